package com.entitystore.service;

import com.entitystore.exception.ItemNotFoundException;
import com.entitystore.model.document.EntityVectorDocument;
import com.entitystore.model.dto.JourneyUpdateParams;
import com.entitystore.model.entity.Journey;
import com.entitystore.nlp.BagOfWordsEmbedder;
import com.entitystore.persistence.Filter;
import com.entitystore.persistence.memory.InMemoryDocumentDatabase;
import com.entitystore.persistence.memory.InMemoryVectorDatabase;
import com.entitystore.util.IdPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JourneyStoreTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private JourneyStore store;

    @BeforeEach
    void setUp() {
        store = new JourneyStore(new InMemoryDocumentDatabase(objectMapper), new InMemoryVectorDatabase(objectMapper),
                new BagOfWordsEmbedder(), IdPolicy.RANDOM, true);
        store.open().block();
    }

    private Journey create(String title, List<String> conditions, List<String> tags) {
        return store.create(title, title + " flow", conditions, tags, null).block();
    }

    @Test
    void create_IndexesAssembledContent() {
        Journey journey = create("Book a flight", List.of("customer wants to fly"), null);

        assertThat(journey.getConditions()).containsExactly("customer wants to fly");
        StepVerifier.create(store.vectors.find(Filter.eq(EntityVectorDocument.ENTITY_ID_FIELD, journey.getId()))
                        .map(EntityVectorDocument::getContent))
                .expectNext(JourneyStore.assembleContent("Book a flight", "Book a flight flow", List.of("customer wants to fly")))
                .verifyComplete();
    }

    @Test
    void addCondition_ReindexesJourney() {
        Journey journey = create("Book a flight", List.of(), null);

        StepVerifier.create(store.addCondition(journey.getId(), "customer mentions a hotel")).expectNext(true).verifyComplete();
        StepVerifier.create(store.addCondition(journey.getId(), "customer mentions a hotel")).expectNext(false).verifyComplete();

        StepVerifier.create(store.read(journey.getId()).map(Journey::getConditions))
                .assertNext(conditions -> assertThat(conditions).containsExactly("customer mentions a hotel"))
                .verifyComplete();
        StepVerifier.create(store.vectors.find(Filter.eq(EntityVectorDocument.ENTITY_ID_FIELD, journey.getId()))
                        .map(EntityVectorDocument::getContent))
                .assertNext(content -> assertThat(content).endsWith("Conditions: customer mentions a hotel"))
                .verifyComplete();
    }

    @Test
    void removeCondition_MissingCondition() {
        Journey journey = create("Book a flight", List.of("customer wants to fly"), null);

        StepVerifier.create(store.removeCondition(journey.getId(), "unknown"))
                .expectError(ItemNotFoundException.class)
                .verify();
        StepVerifier.create(store.removeCondition(journey.getId(), "customer wants to fly")).verifyComplete();
        StepVerifier.create(store.read(journey.getId()).map(Journey::getConditions))
                .assertNext(conditions -> assertThat(conditions).isEmpty())
                .verifyComplete();
    }

    @Test
    void list_ByTagAndCondition() {
        Journey flights = create("Book a flight", List.of("travel"), List.of("sales"));
        create("Cancel a flight", List.of("cancellation"), List.of("sales"));
        create("Report lost luggage", List.of("travel"), List.of("support"));

        StepVerifier.create(store.list(List.of("sales"), "travel").map(Journey::getId))
                .expectNext(flights.getId())
                .verifyComplete();
    }

    @Test
    void update_KeepsConditions() {
        Journey journey = create("Book a flight", List.of("travel"), null);

        Journey updated = store.update(journey.getId(), JourneyUpdateParams.builder().title("Book a trip").build()).block();

        assertThat(updated.getTitle()).isEqualTo("Book a trip");
        assertThat(updated.getDescription()).isEqualTo("Book a flight flow");
        assertThat(updated.getConditions()).containsExactly("travel");
    }

    @Test
    void delete_RemovesConditions() {
        Journey journey = create("Book a flight", List.of("travel", "vacation"), List.of("sales"));

        StepVerifier.create(store.delete(journey.getId())).verifyComplete();

        StepVerifier.create(store.list(null, "travel")).verifyComplete();
        StepVerifier.create(store.vectors.find(Filter.all())).verifyComplete();
    }

    @Test
    void findRelevant_UsesConditions() {
        Journey flights = create("Book a flight", List.of("customer wants to travel abroad"), null);
        Journey refunds = create("Request a refund", List.of("customer is unhappy with purchase"), null);

        StepVerifier.create(store.findRelevant("I want to travel abroad", List.of(flights, refunds), 1))
                .assertNext(results -> assertThat(results).extracting(Journey::getId).containsExactly(flights.getId()))
                .verifyComplete();
    }
}
