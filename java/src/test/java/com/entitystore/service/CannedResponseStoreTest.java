package com.entitystore.service;

import com.entitystore.exception.InvalidContentException;
import com.entitystore.exception.ItemNotFoundException;
import com.entitystore.exception.MigrationRequiredException;
import com.entitystore.exception.ServerOutdatedException;
import com.entitystore.model.document.CannedResponseDocument;
import com.entitystore.model.document.EntityVectorDocument;
import com.entitystore.model.dto.CannedResponseUpdateParams;
import com.entitystore.model.entity.CannedResponse;
import com.entitystore.model.entity.ResponseField;
import com.entitystore.nlp.BagOfWordsEmbedder;
import com.entitystore.persistence.BaseDocument;
import com.entitystore.persistence.DeleteResult;
import com.entitystore.persistence.DocumentCollection;
import com.entitystore.persistence.DocumentLoader;
import com.entitystore.persistence.Filter;
import com.entitystore.persistence.InsertResult;
import com.entitystore.persistence.UpdateResult;
import com.entitystore.persistence.memory.InMemoryDocumentDatabase;
import com.entitystore.persistence.memory.InMemoryVectorDatabase;
import com.entitystore.util.IdPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for CannedResponseStore on the transient backends.
 */
class CannedResponseStoreTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private InMemoryDocumentDatabase documentDatabase;
    private InMemoryVectorDatabase vectorDatabase;
    private CannedResponseStore store;

    @BeforeEach
    void setUp() {
        documentDatabase = new InMemoryDocumentDatabase(objectMapper);
        vectorDatabase = new InMemoryVectorDatabase(objectMapper);
        store = newStore(new BagOfWordsEmbedder(), true);
        store.open().block();
    }

    private CannedResponseStore newStore(BagOfWordsEmbedder embedder, boolean allowMigration) {
        return new CannedResponseStore(documentDatabase, vectorDatabase, embedder,
                IdPolicy.CONTENT_ADDRESSED, allowMigration, objectMapper);
    }

    private CannedResponse create(String value, List<String> signals, List<String> tags) {
        return store.create(value, null, signals, tags, null).block();
    }

    @Test
    void create_SameContentYieldsSameRecord() {
        List<ResponseField> fields = List.of(new ResponseField("order_id", "The order number", List.of("A-1001")));

        CannedResponse first = store.create("Your order {order_id} has shipped", fields, null, null, null).block();
        CannedResponse second = store.create("Your order {order_id} has shipped", fields, null, List.of("shipping"), null).block();

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(second.getTags()).containsExactly("shipping");
        StepVerifier.create(store.list(null).count()).expectNext(1L).verifyComplete();
        StepVerifier.create(store.vectors.find(Filter.all()).count()).expectNext(1L).verifyComplete();
    }

    @Test
    void create_DifferentFieldsYieldDifferentIds() {
        CannedResponse plain = store.create("Hello there", null, null, null, null).block();
        CannedResponse withField = store.create("Hello there",
                List.of(new ResponseField("name", "Customer name", List.of("Ana"))), null, null, null).block();

        assertThat(withField.getId()).isNotEqualTo(plain.getId());
    }

    @Test
    void read_ReturnsStoredEntity() {
        OffsetDateTime createdAt = OffsetDateTime.of(2024, 5, 1, 12, 0, 0, 0, ZoneOffset.UTC);
        CannedResponse created = store.create("Thanks for waiting",
                List.of(new ResponseField("name", "Customer name", List.of("Ana"))),
                List.of("customer was on hold"), List.of("greetings"), createdAt).block();

        StepVerifier.create(store.read(created.getId()))
                .assertNext(read -> {
                    assertThat(read.getValue()).isEqualTo("Thanks for waiting");
                    assertThat(read.getFields()).extracting(ResponseField::getName).containsExactly("name");
                    assertThat(read.getSignals()).containsExactly("customer was on hold");
                    assertThat(read.getTags()).containsExactly("greetings");
                    assertThat(read.getCreationUtc()).isEqualTo(createdAt);
                })
                .verifyComplete();
    }

    @Test
    void read_Missing() {
        StepVerifier.create(store.read("nope"))
                .expectError(ItemNotFoundException.class)
                .verify();
    }

    @Test
    void read_MalformedFields() {
        store.documents.insertOne(CannedResponseDocument.builder()
                .id("broken")
                .version("0.3.0")
                .creationUtc("2024-01-01T00:00:00Z")
                .value("Hi")
                .fields("{not json")
                .signals(List.of())
                .checksum("x")
                .build()).block();

        StepVerifier.create(store.read("broken"))
                .expectError(InvalidContentException.class)
                .verify();
    }

    @Test
    void tags_RoundTrip() {
        CannedResponse response = create("We are open 9 to 5", null, null);

        StepVerifier.create(store.upsertTag(response.getId(), "hours")).expectNext(true).verifyComplete();
        StepVerifier.create(store.upsertTag(response.getId(), "hours")).expectNext(false).verifyComplete();
        StepVerifier.create(store.list(List.of("hours")).map(CannedResponse::getId))
                .expectNext(response.getId())
                .verifyComplete();

        StepVerifier.create(store.removeTag(response.getId(), "hours")).verifyComplete();
        StepVerifier.create(store.list(List.of("hours"))).verifyComplete();
    }

    @Test
    void tags_UnknownEntityOrPair() {
        CannedResponse response = create("We are open 9 to 5", null, null);

        StepVerifier.create(store.upsertTag("missing", "hours"))
                .expectError(ItemNotFoundException.class)
                .verify();
        StepVerifier.create(store.removeTag(response.getId(), "never-added"))
                .expectError(ItemNotFoundException.class)
                .verify();
    }

    @Test
    void list_EmptyTagSetMeansUntagged() {
        CannedResponse untagged = create("Untagged response", null, null);
        CannedResponse tagged = create("Tagged response", null, List.of("billing"));

        StepVerifier.create(store.list(List.of()).map(CannedResponse::getId))
                .expectNext(untagged.getId())
                .verifyComplete();
        StepVerifier.create(store.list(null).map(CannedResponse::getId).collectList())
                .assertNext(ids -> assertThat(ids).containsExactlyInAnyOrder(untagged.getId(), tagged.getId()))
                .verifyComplete();
    }

    @Test
    void list_AnyOfTags() {
        CannedResponse billing = create("Your invoice is attached", null, List.of("billing"));
        CannedResponse shipping = create("Your parcel is on its way", null, List.of("shipping"));
        create("Goodbye", null, List.of("farewell"));

        StepVerifier.create(store.list(List.of("billing", "shipping")).map(CannedResponse::getId).collectList())
                .assertNext(ids -> assertThat(ids).containsExactlyInAnyOrder(billing.getId(), shipping.getId()))
                .verifyComplete();
    }

    @Test
    void update_PreservesIdentity() {
        List<ResponseField> fields = List.of(new ResponseField("amount", "Refund amount", List.of("$10")));
        CannedResponse created = store.create("Refund of {amount} issued", fields,
                List.of("refund confirmation"), List.of("billing"), null).block();

        CannedResponse updated = store.update(created.getId(),
                CannedResponseUpdateParams.builder().value("We refunded {amount}").build()).block();

        assertThat(updated.getId()).isEqualTo(created.getId());
        assertThat(updated.getValue()).isEqualTo("We refunded {amount}");
        assertThat(updated.getFields()).isEqualTo(created.getFields());
        assertThat(updated.getSignals()).containsExactly("refund confirmation");
        assertThat(updated.getCreationUtc()).isEqualTo(created.getCreationUtc());
        assertThat(updated.getTags()).containsExactly("billing");

        StepVerifier.create(store.vectors.find(Filter.eq(EntityVectorDocument.ENTITY_ID_FIELD, created.getId()))
                        .map(EntityVectorDocument::getContent).collectList())
                .assertNext(contents -> assertThat(contents)
                        .containsExactlyInAnyOrder("We refunded {amount}", "refund confirmation"))
                .verifyComplete();
    }

    @Test
    void update_Missing() {
        StepVerifier.create(store.update("nope", CannedResponseUpdateParams.builder().value("x").build()))
                .expectError(ItemNotFoundException.class)
                .verify();
    }

    @Test
    void delete_Cascades() {
        CannedResponse response = create("Delete me", List.of("remove this"), List.of("temp", "other"));

        StepVerifier.create(store.delete(response.getId())).verifyComplete();

        StepVerifier.create(store.read(response.getId()))
                .expectError(ItemNotFoundException.class)
                .verify();
        StepVerifier.create(store.vectors.find(Filter.eq(EntityVectorDocument.ENTITY_ID_FIELD, response.getId())))
                .verifyComplete();
        StepVerifier.create(store.tags.listForEntity(response.getId()))
                .assertNext(tags -> assertThat(tags).isEmpty())
                .verifyComplete();
        StepVerifier.create(store.delete(response.getId()))
                .expectError(ItemNotFoundException.class)
                .verify();
    }

    @Test
    void findRelevant_RanksBySimilarity() {
        CannedResponse refund = create("Refunds for damaged items take five days", null, null);
        CannedResponse shipping = create("Shipping damaged items takes three days", null, null);
        CannedResponse greeting = create("Hello and welcome to our store", null, null);

        StepVerifier.create(store.findRelevant("how long do refunds for damaged items take",
                        List.of(refund, shipping, greeting), 2))
                .assertNext(results -> {
                    assertThat(results).hasSize(2);
                    assertThat(results.get(0).getId()).isEqualTo(refund.getId());
                    assertThat(results.get(1).getId()).isEqualTo(shipping.getId());
                })
                .verifyComplete();
    }

    @Test
    void findRelevant_OnlySearchesCandidates() {
        CannedResponse refund = create("Refunds for damaged items take five days", null, null);
        CannedResponse greeting = create("Hello and welcome to our store", null, null);

        StepVerifier.create(store.findRelevant("refunds for damaged items", List.of(greeting), 5))
                .assertNext(results -> assertThat(results).extracting(CannedResponse::getId)
                        .containsExactly(greeting.getId()))
                .verifyComplete();
        assertThat(refund.getId()).isNotEqualTo(greeting.getId());
    }

    @Test
    void findRelevant_MultiVectorEntityDoesNotCrowdOthers() {
        CannedResponse crowded = create("refund policy", List.of("refund window", "refund status", "refund request"), null);
        CannedResponse second = create("refund issued today", null, null);
        CannedResponse third = create("store hours", null, null);

        StepVerifier.create(store.findRelevant("refund", List.of(crowded, second, third), 2))
                .assertNext(results -> assertThat(results).extracting(CannedResponse::getId)
                        .containsExactly(crowded.getId(), second.getId()))
                .verifyComplete();
    }

    @Test
    void findRelevant_NoCandidates() {
        StepVerifier.create(store.findRelevant("anything", List.of(), 3))
                .expectNext(List.of())
                .verifyComplete();
    }

    @Test
    void create_ConcurrentWritesDoNotInterleave() {
        List<String> events = Collections.synchronizedList(new ArrayList<>());
        documentDatabase = new RecordingDocumentDatabase(objectMapper, events);
        vectorDatabase = new InMemoryVectorDatabase(objectMapper);
        CannedResponseStore slowStore = newStore(new BagOfWordsEmbedder(8192, Duration.ofMillis(20), events), true);
        slowStore.open().block();

        Mono<CannedResponse> alpha = slowStore.create("alpha one", null, List.of("alpha two"), null, null);
        Mono<CannedResponse> beta = slowStore.create("beta one", null, List.of("beta two"), null, null);

        StepVerifier.create(Mono.zip(alpha, beta))
                .assertNext(both -> assertThat(both.getT1().getId()).isNotEqualTo(both.getT2().getId()))
                .verifyComplete();

        // two embeddings then the record insert, per writer
        assertThat(events).hasSize(6);
        String firstWriter = writerOf(events.get(0));
        String secondWriter = writerOf(events.get(3));
        assertThat(firstWriter).isNotEqualTo(secondWriter);
        assertThat(events.subList(0, 3)).allMatch(event -> writerOf(event).equals(firstWriter));
        assertThat(events.subList(3, 6)).allMatch(event -> writerOf(event).equals(secondWriter));
        assertThat(events.get(2)).startsWith("insert canned_responses");
        assertThat(events.get(5)).startsWith("insert canned_responses");
    }

    private static String writerOf(String event) {
        return event.contains("alpha") ? "alpha" : "beta";
    }

    @Test
    void open_TracksVectorSchemaVersionSeparately() {
        StepVerifier.create(documentDatabase.readMetadata())
                .assertNext(metadata -> assertThat(metadata)
                        .containsEntry("CannedResponseStore_version", CannedResponseStore.VERSION.toString()))
                .verifyComplete();
        StepVerifier.create(vectorDatabase.readMetadata())
                .assertNext(metadata -> assertThat(metadata)
                        .containsEntry("CannedResponseStore_version", CannedResponseStore.VECTOR_VERSION.toString()))
                .verifyComplete();
        assertThat(CannedResponseStore.VECTOR_VERSION).isNotEqualTo(CannedResponseStore.VERSION);
    }

    @Test
    void open_CurrentVectorSchemaNeedsNoMigration() {
        documentDatabase = new InMemoryDocumentDatabase(objectMapper);
        vectorDatabase = new InMemoryVectorDatabase(objectMapper);
        documentDatabase.upsertMetadata("CannedResponseStore_version", "0.3.0").block();
        vectorDatabase.upsertMetadata("CannedResponseStore_version", "0.2.0").block();

        StepVerifier.create(newStore(new BagOfWordsEmbedder(), false).open())
                .verifyComplete();
    }

    @Test
    void reconcile_RemovesOrphans() {
        CannedResponse kept = create("Keep me", null, List.of("a"));
        CannedResponse orphaned = create("Orphan me", List.of("orphan signal"), List.of("b"));
        store.documents.deleteOne(Filter.eq("id", orphaned.getId())).block();

        StepVerifier.create(store.reconcile())
                .assertNext(report -> {
                    assertThat(report.getOrphanedVectorDocuments()).isEqualTo(2);
                    assertThat(report.getOrphanedTagAssociations()).isEqualTo(1);
                })
                .verifyComplete();

        StepVerifier.create(store.vectors.find(Filter.all()).map(EntityVectorDocument::getEntityId))
                .expectNext(kept.getId())
                .verifyComplete();
        StepVerifier.create(store.read(kept.getId()).map(CannedResponse::getTags))
                .expectNext(Set.of("a"))
                .verifyComplete();
    }

    @Test
    void open_OlderSchemaWithoutMigrationFails() {
        documentDatabase = new InMemoryDocumentDatabase(objectMapper);
        vectorDatabase = new InMemoryVectorDatabase(objectMapper);
        documentDatabase.upsertMetadata("CannedResponseStore_version", "0.2.0").block();

        StepVerifier.create(newStore(new BagOfWordsEmbedder(), false).open())
                .expectError(MigrationRequiredException.class)
                .verify();
    }

    @Test
    void open_NewerSchemaFails() {
        documentDatabase = new InMemoryDocumentDatabase(objectMapper);
        vectorDatabase = new InMemoryVectorDatabase(objectMapper);
        vectorDatabase.upsertMetadata("CannedResponseStore_version", "9.0.0").block();

        StepVerifier.create(newStore(new BagOfWordsEmbedder(), true).open())
                .expectError(ServerOutdatedException.class)
                .verify();
    }

    /**
     * Appends {@code insert <collection> <document>} for every record inserted.
     */
    private static class RecordingDocumentDatabase extends InMemoryDocumentDatabase {

        private final List<String> events;

        RecordingDocumentDatabase(ObjectMapper objectMapper, List<String> events) {
            super(objectMapper);
            this.events = events;
        }

        @Override
        public <T extends BaseDocument> Mono<DocumentCollection<T>> getOrCreateCollection(
                String name, Class<T> schema, DocumentLoader loader) {
            return super.getOrCreateCollection(name, schema, loader).map(this::recording);
        }

        private <T> DocumentCollection<T> recording(DocumentCollection<T> delegate) {
            return new DocumentCollection<>() {
                @Override
                public String getName() {
                    return delegate.getName();
                }

                @Override
                public Flux<T> find(Filter filter) {
                    return delegate.find(filter);
                }

                @Override
                public Mono<T> findOne(Filter filter) {
                    return delegate.findOne(filter);
                }

                @Override
                public Mono<InsertResult> insertOne(T document) {
                    return delegate.insertOne(document)
                            .doOnSuccess(ignored -> events.add("insert " + delegate.getName() + " " + document));
                }

                @Override
                public Mono<UpdateResult<T>> updateOne(Filter filter, T patch) {
                    return delegate.updateOne(filter, patch);
                }

                @Override
                public Mono<DeleteResult<T>> deleteOne(Filter filter) {
                    return delegate.deleteOne(filter);
                }
            };
        }
    }
}
