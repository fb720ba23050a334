package com.entitystore.persistence;

import reactor.core.publisher.Flux;

/**
 * A document collection whose documents are also embedded for similarity search.
 *
 * @param <T> document type
 */
public interface VectorCollection<T extends EmbeddableDocument> extends DocumentCollection<T> {

    /**
     * Up to {@code k} documents matching {@code filter}, ordered by ascending distance to {@code query}.
     */
    Flux<SimilarDocumentResult<T>> findSimilarDocuments(Filter filter, String query, int k);
}
