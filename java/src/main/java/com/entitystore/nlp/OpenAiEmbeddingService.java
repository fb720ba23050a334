package com.entitystore.nlp;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Embedder backed by an OpenAI-compatible {@code /embeddings} endpoint.
 */
@Slf4j
@Service
public class OpenAiEmbeddingService implements Embedder {

    private final WebClient webClient;
    private final String apiKey;
    private final String model;
    private final int maxTokens;
    private final EstimatingTokenizer tokenizer = new ApproximateTokenizer();

    public OpenAiEmbeddingService(
            WebClient.Builder webClientBuilder,
            @Value("${entitystore.embedding.api-url}") String apiUrl,
            @Value("${entitystore.embedding.api-key}") String apiKey,
            @Value("${entitystore.embedding.model}") String model,
            @Value("${entitystore.embedding.max-tokens:8192}") int maxTokens) {
        this.webClient = webClientBuilder.baseUrl(apiUrl).build();
        this.apiKey = apiKey;
        this.model = model;
        this.maxTokens = maxTokens;
    }

    /**
     * Generate embedding vector for text content.
     *
     * @param text Input text
     * @return Embedding vector as float array
     */
    @Override
    public Mono<float[]> embed(String text) {
        Map<String, Object> requestBody = Map.of(
                "model", model,
                "input", text,
                "encoding_format", "float"
        );

        return webClient.post()
                .header("Authorization", "Bearer " + apiKey)
                .header("Content-Type", "application/json")
                .bodyValue(requestBody)
                .retrieve()
                .bodyToMono(Map.class)
                .map(OpenAiEmbeddingService::extractEmbedding)
                .doOnError(error -> log.error("Failed to generate embedding with model {}", model, error));
    }

    @Override
    public int getMaxTokens() {
        return maxTokens;
    }

    @Override
    public EstimatingTokenizer getTokenizer() {
        return tokenizer;
    }

    @SuppressWarnings("unchecked")
    static float[] extractEmbedding(Map<?, ?> response) {
        List<Map<String, Object>> data = (List<Map<String, Object>>) response.get("data");
        if (data == null || data.isEmpty()) {
            throw new IllegalStateException("Invalid embedding response");
        }
        List<Number> embedding = (List<Number>) data.get(0).get("embedding");
        float[] vector = new float[embedding.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = embedding.get(i).floatValue();
        }
        return vector;
    }
}
