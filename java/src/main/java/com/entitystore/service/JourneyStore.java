package com.entitystore.service;

import com.entitystore.exception.ItemNotFoundException;
import com.entitystore.model.document.JourneyConditionDocument;
import com.entitystore.model.document.JourneyDocument;
import com.entitystore.model.dto.JourneyUpdateParams;
import com.entitystore.model.entity.Journey;
import com.entitystore.nlp.Embedder;
import com.entitystore.persistence.DocumentCollection;
import com.entitystore.persistence.DocumentDatabase;
import com.entitystore.persistence.Filter;
import com.entitystore.persistence.VectorDatabase;
import com.entitystore.persistence.migration.DocumentMigrationHelper;
import com.entitystore.util.ChecksumUtil;
import com.entitystore.util.IdPolicy;
import com.entitystore.util.Version;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Store of journeys. A journey is indexed as one text combining its title, description
 * and conditions, so adding or removing a condition re-indexes it.
 */
@Slf4j
public class JourneyStore extends AbstractEntityStore<Journey, JourneyDocument> {

    public static final Version VERSION = Version.of(0, 2, 0);
    public static final Version VECTOR_VERSION = Version.of(0, 2, 0);
    public static final String COLLECTION = "journeys";
    public static final String CONDITIONS_COLLECTION = "journey_conditions";

    private final DocumentMigrationHelper documentLoader;
    private final DocumentMigrationHelper vectorLoader;
    private final DocumentMigrationHelper tagLoader = DocumentMigrationHelper.to("0.2.0").build();
    private final DocumentMigrationHelper conditionLoader = DocumentMigrationHelper.to("0.2.0").build();

    private DocumentCollection<JourneyConditionDocument> conditions;

    public JourneyStore(DocumentDatabase documentDatabase,
                        VectorDatabase vectorDatabase,
                        Embedder embedder,
                        IdPolicy idPolicy,
                        boolean allowMigration) {
        super("JourneyStore", VERSION, VECTOR_VERSION, JourneyDocument.class,
                documentDatabase, vectorDatabase, embedder, idPolicy, allowMigration);

        this.documentLoader = DocumentMigrationHelper.to("0.2.0")
                .from("0.1.0", document -> Mono.fromCallable(() -> {
                    ObjectNode upgraded = atVersion(document, "0.2.0");
                    upgraded.put("checksum", ChecksumUtil.md5Checksum(
                            upgraded.path("title").asText() + upgraded.path("description").asText()));
                    return upgraded;
                }))
                .build();

        this.vectorLoader = DocumentMigrationHelper.to(VECTOR_VERSION.toString())
                .from("0.1.0", document -> Mono.fromCallable(() ->
                        renameField(atVersion(document, "0.2.0"), "journey_id", "entity_id")))
                .build();
    }

    /**
     * Text indexed for a journey.
     */
    public static String assembleContent(String title, String description, Collection<String> conditions) {
        return title + "\n" + description + "\nConditions: " + String.join(", ", conditions);
    }

    @Override
    protected String collectionName() {
        return COLLECTION;
    }

    @Override
    protected DocumentMigrationHelper documentLoader() {
        return documentLoader;
    }

    @Override
    protected DocumentMigrationHelper vectorLoader() {
        return vectorLoader;
    }

    @Override
    protected DocumentMigrationHelper tagLoader() {
        return tagLoader;
    }

    @Override
    protected Mono<Void> openAdditionalCollections() {
        return documentDatabase.getOrCreateCollection(CONDITIONS_COLLECTION, JourneyConditionDocument.class, conditionLoader)
                .doOnNext(opened -> this.conditions = opened)
                .then();
    }

    /**
     * Create a journey: vector document, record, conditions, then tags.
     */
    public Mono<Journey> create(String title,
                                String description,
                                Collection<String> conditionTexts,
                                Collection<String> tagIds,
                                OffsetDateTime createdAt) {
        Set<String> requestedConditions = conditionTexts == null ? new LinkedHashSet<>() : new LinkedHashSet<>(conditionTexts);
        Set<String> requestedTags = tagIds == null ? new LinkedHashSet<>() : new LinkedHashSet<>(tagIds);

        return lock.write(() -> {
            String checksum = ChecksumUtil.md5Checksum(title + description);
            JourneyDocument document = JourneyDocument.builder()
                    .id(getIdGenerator().generate(checksum))
                    .version(VERSION.toString())
                    .creationUtc(now(createdAt))
                    .title(title)
                    .description(description)
                    .checksum(checksum)
                    .build();

            return documents.findOne(byId(document.getId()))
                    .flatMap(existing -> upsertTags(existing.getId(), requestedTags, createdAt)
                            .then(readUnlocked(existing.getId())))
                    .switchIfEmpty(Mono.defer(() ->
                            insertVectors(document.getId(), List.of(assembleContent(title, description, requestedConditions)))
                                    .then(documents.insertOne(document))
                                    .thenMany(Flux.fromIterable(requestedConditions))
                                    .concatMap(condition -> insertCondition(document.getId(), condition, createdAt))
                                    .then(upsertTags(document.getId(), requestedTags, createdAt))
                                    .then(readUnlocked(document.getId()))));
        });
    }

    public Mono<Journey> update(String id, JourneyUpdateParams params) {
        return replaceEntity(id, existing -> Mono.fromSupplier(() -> {
            String title = params.getTitle() != null ? params.getTitle() : existing.getTitle();
            String description = params.getDescription() != null ? params.getDescription() : existing.getDescription();

            return existing.toBuilder()
                    .version(VERSION.toString())
                    .title(title)
                    .description(description)
                    .checksum(ChecksumUtil.md5Checksum(title + description))
                    .build();
        }));
    }

    /**
     * Attach a condition to a journey.
     *
     * @return false if the journey already had the condition
     */
    public Mono<Boolean> addCondition(String journeyId, String condition) {
        return lock.write(() -> requireRecord(journeyId)
                .flatMap(journey -> conditions.findOne(conditionPair(journeyId, condition))
                        .map(existing -> false)
                        .switchIfEmpty(Mono.defer(() -> insertCondition(journeyId, condition, null)
                                .then(reindex(journey))
                                .thenReturn(true)))));
    }

    /**
     * Detach a condition from a journey.
     *
     * @throws ItemNotFoundException if the journey does not exist or does not have the condition
     */
    public Mono<Void> removeCondition(String journeyId, String condition) {
        return lock.write(() -> requireRecord(journeyId)
                .flatMap(journey -> conditions.deleteOne(conditionPair(journeyId, condition))
                        .flatMap(result -> result.getDeletedCount() == 0
                                ? Mono.<Void>error(new ItemNotFoundException("Journey condition", journeyId + "/" + condition))
                                : reindex(journey))));
    }

    /**
     * Journeys matching the tag selection of {@link #list(Collection)} that also have {@code condition}.
     */
    public Flux<Journey> list(Collection<String> tagIds, String condition) {
        if (condition == null) {
            return list(tagIds);
        }
        return lock.readMany(() -> listUnlocked(tagIds)
                .filter(journey -> journey.getConditions().contains(condition)));
    }

    @Override
    protected Mono<Void> deleteDependents(String entityId) {
        return conditions.deleteOne(Filter.eq(JourneyConditionDocument.JOURNEY_ID_FIELD, entityId))
                .repeat()
                .takeWhile(result -> result.getDeletedCount() > 0)
                .then();
    }

    @Override
    protected Mono<List<String>> embeddableContents(JourneyDocument document) {
        return conditionsOf(document.getId())
                .map(current -> List.of(assembleContent(document.getTitle(), document.getDescription(), current)));
    }

    @Override
    protected Mono<Journey> toEntity(JourneyDocument document, Set<String> tagIds) {
        return conditionsOf(document.getId())
                .map(current -> Journey.builder()
                        .id(document.getId())
                        .creationUtc(ResponseFieldCodec.readTimestamp(document.getCreationUtc()))
                        .title(document.getTitle())
                        .description(document.getDescription())
                        .conditions(current)
                        .tags(new LinkedHashSet<>(tagIds))
                        .build());
    }

    private Mono<Set<String>> conditionsOf(String journeyId) {
        return conditions.find(Filter.eq(JourneyConditionDocument.JOURNEY_ID_FIELD, journeyId))
                .map(JourneyConditionDocument::getCondition)
                .collect(LinkedHashSet::new, Set::add);
    }

    private Mono<Void> insertCondition(String journeyId, String condition, OffsetDateTime createdAt) {
        JourneyConditionDocument document = JourneyConditionDocument.builder()
                .id(getIdGenerator().generate(ChecksumUtil.md5Checksum(journeyId + condition)))
                .version(conditionLoader.getTargetVersion())
                .creationUtc(now(createdAt))
                .journeyId(journeyId)
                .condition(condition)
                .build();
        log.debug("Adding condition to journey {}", journeyId);
        return conditions.insertOne(document).then();
    }

    private static Filter conditionPair(String journeyId, String condition) {
        return Filter.and(
                Filter.eq(JourneyConditionDocument.JOURNEY_ID_FIELD, journeyId),
                Filter.eq(JourneyConditionDocument.CONDITION_FIELD, condition));
    }
}
