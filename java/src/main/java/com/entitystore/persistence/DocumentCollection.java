package com.entitystore.persistence;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * A named collection of typed documents in a document backend.
 *
 * @param <T> document type
 */
public interface DocumentCollection<T> {

    String getName();

    Flux<T> find(Filter filter);

    /**
     * First matching document, or empty.
     */
    Mono<T> findOne(Filter filter);

    Mono<InsertResult> insertOne(T document);

    /**
     * Overwrite the non-null fields of {@code patch} on the first matching document.
     */
    Mono<UpdateResult<T>> updateOne(Filter filter, T patch);

    /**
     * Delete the first matching document.
     */
    Mono<DeleteResult<T>> deleteOne(Filter filter);
}
