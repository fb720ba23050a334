package com.entitystore.persistence;

import com.entitystore.nlp.Embedder;
import reactor.core.publisher.Mono;

/**
 * Vector backend. Each collection is bound to the embedder it was opened with.
 */
public interface VectorDatabase extends MetadataStore {

    <T extends EmbeddableDocument> Mono<VectorCollection<T>> getOrCreateCollection(
            String name, Class<T> schema, Embedder embedder, DocumentLoader loader);

    Mono<Void> deleteCollection(String name);
}
