package com.entitystore.persistence.memory;

import com.entitystore.nlp.Embedder;
import com.entitystore.nlp.VectorMath;
import com.entitystore.persistence.EmbeddableDocument;
import com.entitystore.persistence.Filter;
import com.entitystore.persistence.SimilarDocumentResult;
import com.entitystore.persistence.VectorCollection;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Vector collection with brute-force cosine search.
 */
public class InMemoryVectorCollection<T extends EmbeddableDocument>
        extends InMemoryDocumentCollection<T> implements VectorCollection<T> {

    static final String CONTENT_FIELD = "content";

    private final Embedder embedder;
    private final Map<ObjectNode, float[]> vectors;

    InMemoryVectorCollection(String name, Class<T> schema, List<ObjectNode> documents,
                             Map<ObjectNode, float[]> vectors, Embedder embedder, ObjectMapper objectMapper,
                             Supplier<Mono<Void>> onChange) {
        super(name, schema, documents, objectMapper, onChange);
        this.vectors = vectors;
        this.embedder = embedder;
    }

    static Map<ObjectNode, float[]> newVectorIndex() {
        return Collections.synchronizedMap(new IdentityHashMap<>());
    }

    @Override
    public Flux<SimilarDocumentResult<T>> findSimilarDocuments(Filter filter, String query, int k) {
        if (k <= 0) {
            return Flux.empty();
        }
        return embedder.embed(query).flatMapMany(queryVector -> Flux.fromStream(
                matching(filter).stream()
                        .filter(vectors::containsKey)
                        .map(node -> new SimilarDocumentResult<>(node,
                                VectorMath.cosineDistance(queryVector, vectors.get(node))))
                        .sorted(Comparator.comparingDouble(SimilarDocumentResult::getDistance))
                        .limit(k)
                        .map(hit -> new SimilarDocumentResult<>(toDocument(hit.getDocument()), hit.getDistance()))));
    }

    @Override
    protected Mono<Void> beforeInsert(ObjectNode node) {
        return embedInto(node);
    }

    @Override
    protected Mono<Void> afterUpdate(ObjectNode node) {
        return embedInto(node);
    }

    @Override
    protected void afterRemove(ObjectNode node) {
        vectors.remove(node);
    }

    Mono<Void> embedInto(ObjectNode node) {
        JsonNode content = node.get(CONTENT_FIELD);
        String text = content == null || content.isNull() ? "" : content.asText();
        return embedder.embed(text)
                .doOnNext(vector -> vectors.put(node, vector))
                .then();
    }
}
