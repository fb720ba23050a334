package com.entitystore.service.search;

import com.entitystore.model.document.EntityVectorDocument;
import com.entitystore.nlp.BagOfWordsEmbedder;
import com.entitystore.persistence.SimilarDocumentResult;
import com.entitystore.persistence.VectorCollection;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class RelevanceSearchEngineTest {

    @Mock
    private VectorCollection<EntityVectorDocument> vectors;

    @Test
    void minVectorsForMaxItemCount_LeavesRoomForCrowdingEntities() {
        assertThat(RelevanceSearchEngine.minVectorsForMaxItemCount(List.of(1, 3, 2), 2)).isEqualTo(5);
        assertThat(RelevanceSearchEngine.minVectorsForMaxItemCount(List.of(1, 3, 2), 1)).isEqualTo(3);
    }

    @Test
    void minVectorsForMaxItemCount_CappedAtTotal() {
        assertThat(RelevanceSearchEngine.minVectorsForMaxItemCount(List.of(1, 3, 2), 10)).isEqualTo(6);
    }

    @Test
    void queryChunks_SplitsByTokenBudget() {
        // budget 10 / 5 = 2 tokens, each word estimates to 2 tokens
        RelevanceSearchEngine engine = new RelevanceSearchEngine(vectors, new BagOfWordsEmbedder(10));

        StepVerifier.create(engine.queryChunks("alpha bravo gamma delta"))
                .expectNext(List.of("alpha", "bravo", "gamma", "delta"))
                .verifyComplete();
    }

    @Test
    void queryChunks_ShortQueryIsOneChunk() {
        RelevanceSearchEngine engine = new RelevanceSearchEngine(vectors, new BagOfWordsEmbedder(8192));

        StepVerifier.create(engine.queryChunks("where is my refund"))
                .expectNext(List.of("where is my refund"))
                .verifyComplete();
        StepVerifier.create(engine.queryChunks("   "))
                .expectNext(List.of(""))
                .verifyComplete();
    }

    @Test
    void search_EmptyCandidatesSkipsBackend() {
        RelevanceSearchEngine engine = new RelevanceSearchEngine(vectors, new BagOfWordsEmbedder());

        StepVerifier.create(engine.search("refund", Map.of(), 3))
                .expectNext(List.of())
                .verifyComplete();
        StepVerifier.create(engine.search("refund", Map.of("e1", 1), 0))
                .expectNext(List.of())
                .verifyComplete();

        verifyNoInteractions(vectors);
    }

    @Test
    void rank_KeepsBestHitPerEntity() {
        List<SimilarDocumentResult<EntityVectorDocument>> hits = List.of(
                hit("e1", 0.4), hit("e2", 0.3), hit("e1", 0.1), hit("e3", 0.9), hit("e2", 0.2));

        List<SimilarDocumentResult<EntityVectorDocument>> ranked = RelevanceSearchEngine.rank(hits, 2);

        assertThat(ranked).extracting(result -> result.getDocument().getEntityId()).containsExactly("e1", "e2");
        assertThat(ranked).extracting(SimilarDocumentResult::getDistance).containsExactly(0.1, 0.2);
    }

    private static SimilarDocumentResult<EntityVectorDocument> hit(String entityId, double distance) {
        return new SimilarDocumentResult<>(EntityVectorDocument.builder().entityId(entityId).build(), distance);
    }
}
