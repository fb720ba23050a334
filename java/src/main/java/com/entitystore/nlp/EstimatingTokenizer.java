package com.entitystore.nlp;

import reactor.core.publisher.Mono;

public interface EstimatingTokenizer {

    Mono<Integer> estimateTokenCount(String text);
}
