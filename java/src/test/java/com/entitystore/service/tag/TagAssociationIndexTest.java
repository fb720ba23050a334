package com.entitystore.service.tag;

import com.entitystore.exception.ItemNotFoundException;
import com.entitystore.model.document.TagAssociationDocument;
import com.entitystore.persistence.DocumentCollection;
import com.entitystore.persistence.DocumentLoader;
import com.entitystore.persistence.memory.InMemoryDocumentDatabase;
import com.entitystore.util.IdGenerator;
import com.entitystore.util.IdPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TagAssociationIndexTest {

    private TagAssociationIndex index;

    @BeforeEach
    void setUp() {
        DocumentCollection<TagAssociationDocument> collection = new InMemoryDocumentDatabase(new ObjectMapper())
                .getOrCreateCollection("associations", TagAssociationDocument.class, DocumentLoader.identity())
                .block();
        index = new TagAssociationIndex(collection, new IdGenerator(IdPolicy.CONTENT_ADDRESSED), "0.3.0");
    }

    @Test
    void upsert_SecondTimeIsNoOp() {
        StepVerifier.create(index.upsert("e1", "t1")).expectNext(true).verifyComplete();
        StepVerifier.create(index.upsert("e1", "t1")).expectNext(false).verifyComplete();

        StepVerifier.create(index.listAll().count()).expectNext(1L).verifyComplete();
    }

    @Test
    void listForEntity_ReturnsItsTags() {
        index.upsert("e1", "t1").then(index.upsert("e1", "t2")).then(index.upsert("e2", "t3")).block();

        StepVerifier.create(index.listForEntity("e1"))
                .assertNext(tags -> assertThat(tags).containsExactly("t1", "t2"))
                .verifyComplete();
    }

    @Test
    void listEntitiesForTags_IsLogicalOr() {
        index.upsert("e1", "t1").then(index.upsert("e2", "t2")).then(index.upsert("e3", "t3")).block();

        StepVerifier.create(index.listEntitiesForTags(List.of("t1", "t2")))
                .assertNext(entities -> assertThat(entities).containsExactlyInAnyOrder("e1", "e2"))
                .verifyComplete();
        StepVerifier.create(index.listEntitiesForTags(List.of()))
                .assertNext(entities -> assertThat(entities).isEmpty())
                .verifyComplete();
    }

    @Test
    void remove_MissingPair() {
        index.upsert("e1", "t1").block();

        StepVerifier.create(index.remove("e1", "t2"))
                .expectError(ItemNotFoundException.class)
                .verify();
        StepVerifier.create(index.remove("e1", "t1")).verifyComplete();
        StepVerifier.create(index.listTaggedEntities())
                .assertNext(entities -> assertThat(entities).isEmpty())
                .verifyComplete();
    }

    @Test
    void removeAllForEntity_LeavesOtherEntities() {
        index.upsert("e1", "t1").then(index.upsert("e1", "t2")).then(index.upsert("e2", "t1")).block();

        StepVerifier.create(index.removeAllForEntity("e1")).expectNext(2L).verifyComplete();

        StepVerifier.create(index.listTaggedEntities())
                .assertNext(entities -> assertThat(entities).containsExactly("e2"))
                .verifyComplete();
    }
}
