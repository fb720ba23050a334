package com.entitystore.nlp;

import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic embedder for tests: hashed bag of lower-cased words.
 * Texts sharing more words are closer.
 */
public class BagOfWordsEmbedder implements Embedder {

    private static final int DIMENSIONS = 256;

    private final int maxTokens;
    private final Duration delay;
    private final List<String> events;
    private final EstimatingTokenizer tokenizer = new ApproximateTokenizer();

    public BagOfWordsEmbedder() {
        this(8192);
    }

    public BagOfWordsEmbedder(int maxTokens) {
        this(maxTokens, Duration.ZERO, null);
    }

    /**
     * @param events if not null, every embedded text is appended when embedding starts
     */
    public BagOfWordsEmbedder(int maxTokens, Duration delay, List<String> events) {
        this.maxTokens = maxTokens;
        this.delay = delay;
        this.events = events;
    }

    @Override
    public Mono<float[]> embed(String text) {
        Mono<float[]> vector = Mono.fromSupplier(() -> {
            if (events != null) {
                events.add(text);
            }
            return vectorize(text);
        });
        return delay.isZero() ? vector : vector.delayElement(delay);
    }

    @Override
    public int getMaxTokens() {
        return maxTokens;
    }

    @Override
    public EstimatingTokenizer getTokenizer() {
        return tokenizer;
    }

    static float[] vectorize(String text) {
        float[] vector = new float[DIMENSIONS];
        for (String word : text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (!word.isEmpty()) {
                vector[Math.floorMod(word.hashCode(), DIMENSIONS)] += 1f;
            }
        }
        return vector;
    }
}
