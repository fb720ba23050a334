package com.entitystore.persistence;

import reactor.core.publisher.Mono;

/**
 * Structured document backend.
 */
public interface DocumentDatabase extends MetadataStore {

    /**
     * Open a collection, creating it if needed. Every stored document passes through
     * {@code loader}; see {@link CollectionLoader} for how failures are handled.
     */
    <T extends BaseDocument> Mono<DocumentCollection<T>> getOrCreateCollection(
            String name, Class<T> schema, DocumentLoader loader);

    /**
     * Open an existing collection as-is, without running any loader.
     */
    <T> Mono<DocumentCollection<T>> getCollection(String name, Class<T> schema);

    Mono<Void> deleteCollection(String name);
}
