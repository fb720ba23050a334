package com.entitystore.nlp;

import reactor.core.publisher.Mono;

/**
 * Turns text into vectors. A store holds one embedder for its whole lifetime.
 */
public interface Embedder {

    Mono<float[]> embed(String text);

    /**
     * Largest input, in tokens, a single {@link #embed} call accepts.
     */
    int getMaxTokens();

    EstimatingTokenizer getTokenizer();
}
