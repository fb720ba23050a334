package com.entitystore.service.search;

import com.entitystore.model.document.EntityVectorDocument;
import com.entitystore.nlp.Embedder;
import com.entitystore.persistence.Filter;
import com.entitystore.persistence.SimilarDocumentResult;
import com.entitystore.persistence.VectorCollection;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ranks candidate entities by semantic distance to a free-text query.
 *
 * Entities may own several vector documents, so hits are grouped by owning entity
 * and each entity is scored by its closest vector over every query chunk.
 */
@Slf4j
public class RelevanceSearchEngine {

    static final int CHUNK_HEADROOM_DIVISOR = 5;

    private final VectorCollection<EntityVectorDocument> vectors;
    private final Embedder embedder;

    public RelevanceSearchEngine(VectorCollection<EntityVectorDocument> vectors, Embedder embedder) {
        this.vectors = vectors;
        this.embedder = embedder;
    }

    /**
     * Find the entities closest to {@code query}.
     *
     * @param query Free-text query
     * @param candidateVectorCounts Candidate entity IDs mapped to the number of vector documents each owns
     * @param maxCount Maximum number of entities to return
     * @return Best hit per entity, ascending by distance, at most {@code maxCount} long
     */
    public Mono<List<SimilarDocumentResult<EntityVectorDocument>>> search(
            String query, Map<String, Integer> candidateVectorCounts, int maxCount) {
        if (candidateVectorCounts.isEmpty() || maxCount <= 0) {
            return Mono.just(Collections.emptyList());
        }

        Filter candidates = Filter.in(EntityVectorDocument.ENTITY_ID_FIELD, candidateVectorCounts.keySet());
        int k = minVectorsForMaxItemCount(candidateVectorCounts.values(), maxCount);

        return queryChunks(query)
                .flatMapMany(chunks -> {
                    log.debug("Searching {} candidates with {} chunk(s), k={}", candidateVectorCounts.size(), chunks.size(), k);
                    return Flux.fromIterable(chunks)
                            .flatMapSequential(chunk -> vectors.findSimilarDocuments(candidates, chunk, k));
                })
                .collectList()
                .map(hits -> rank(hits, maxCount));
    }

    /**
     * Split a query into word chunks small enough to embed in one call.
     */
    public Mono<List<String>> queryChunks(String query) {
        List<String> words = Arrays.asList(query.trim().split("\\s+"));
        if (query.isBlank()) {
            return Mono.just(List.of(""));
        }
        int chunkTokenBudget = embedder.getMaxTokens() / CHUNK_HEADROOM_DIVISOR;

        return embedder.getTokenizer().estimateTokenCount(query)
                .map(totalTokens -> {
                    double tokensPerWord = (double) totalTokens / words.size();
                    int wordsPerChunk = tokensPerWord == 0
                            ? words.size()
                            : Math.max((int) Math.floor(chunkTokenBudget / tokensPerWord), 1);

                    List<String> chunks = new ArrayList<>();
                    for (int i = 0; i < words.size(); i += wordsPerChunk) {
                        chunks.add(String.join(" ", words.subList(i, Math.min(i + wordsPerChunk, words.size()))));
                    }
                    return chunks;
                })
                .flatMapMany(Flux::fromIterable)
                .concatMap(chunk -> embedder.getTokenizer().estimateTokenCount(chunk)
                        .map(tokens -> tokens == 0 ? "" : chunk))
                .collectList();
    }

    /**
     * Neighbour count that leaves room for {@code maxCount} distinct entities even if the
     * entities owning the most vectors crowd the top hits. Never more than the total.
     */
    public static int minVectorsForMaxItemCount(Iterable<Integer> vectorCounts, int maxCount) {
        List<Integer> sorted = new ArrayList<>();
        vectorCounts.forEach(sorted::add);
        sorted.sort(Comparator.reverseOrder());

        int k = 0;
        for (int i = 0; i < Math.min(maxCount, sorted.size()); i++) {
            k += sorted.get(i);
        }
        return Math.max(k, 1);
    }

    static List<SimilarDocumentResult<EntityVectorDocument>> rank(
            List<SimilarDocumentResult<EntityVectorDocument>> hits, int maxCount) {
        Map<String, SimilarDocumentResult<EntityVectorDocument>> bestPerEntity = new LinkedHashMap<>();
        for (SimilarDocumentResult<EntityVectorDocument> hit : hits) {
            bestPerEntity.merge(hit.getDocument().getEntityId(), hit,
                    (current, candidate) -> candidate.getDistance() < current.getDistance() ? candidate : current);
        }

        List<SimilarDocumentResult<EntityVectorDocument>> ranked = new ArrayList<>(bestPerEntity.values());
        ranked.sort(Comparator.comparingDouble(r -> r.getDistance()));
        return ranked.size() > maxCount ? new ArrayList<>(ranked.subList(0, maxCount)) : ranked;
    }
}
