package com.entitystore.persistence;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Small key-value area a database keeps next to its collections,
 * used to record which schema version each store last wrote.
 */
public interface MetadataStore {

    Mono<Map<String, Object>> readMetadata();

    Mono<Void> upsertMetadata(String key, Object value);

    Mono<Void> removeMetadata(String key);
}
