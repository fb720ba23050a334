package com.entitystore.nlp;

import reactor.core.publisher.Mono;

/**
 * Cheap token estimate: about four characters per token, at least one token per word.
 */
public class ApproximateTokenizer implements EstimatingTokenizer {

    private static final int CHARS_PER_TOKEN = 4;

    @Override
    public Mono<Integer> estimateTokenCount(String text) {
        return Mono.fromSupplier(() -> estimate(text));
    }

    int estimate(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        int tokens = 0;
        for (String word : text.trim().split("\\s+")) {
            tokens += Math.max(1, (word.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN);
        }
        return tokens;
    }
}
