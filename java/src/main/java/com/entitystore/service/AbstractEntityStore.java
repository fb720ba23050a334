package com.entitystore.service;

import com.entitystore.exception.ItemNotFoundException;
import com.entitystore.model.document.EntityVectorDocument;
import com.entitystore.model.document.TagAssociationDocument;
import com.entitystore.model.entity.TaggedEntity;
import com.entitystore.nlp.Embedder;
import com.entitystore.persistence.BaseDocument;
import com.entitystore.persistence.DocumentCollection;
import com.entitystore.persistence.DocumentDatabase;
import com.entitystore.persistence.Filter;
import com.entitystore.persistence.VectorCollection;
import com.entitystore.persistence.VectorDatabase;
import com.entitystore.persistence.migration.DocumentMigrationHelper;
import com.entitystore.persistence.migration.StoreMigrationHelper;
import com.entitystore.service.search.RelevanceSearchEngine;
import com.entitystore.service.tag.TagAssociationIndex;
import com.entitystore.util.ChecksumUtil;
import com.entitystore.util.IdGenerator;
import com.entitystore.util.IdPolicy;
import com.entitystore.util.ReaderWriterLock;
import com.entitystore.util.Version;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Shared machinery of the entity stores.
 *
 * Each entity lives in three places: its structured record in the document database,
 * one vector document per distinct embeddable text in the vector database, and its tag
 * associations. Writes touch them in that order without a transaction: an interrupted
 * create can leave vector documents behind, which {@link #reconcile()} removes.
 *
 * All public operations take the store-wide lock: readers share it, writers own it.
 *
 * @param <E> entity type
 * @param <D> structured record type
 */
@Slf4j
public abstract class AbstractEntityStore<E extends TaggedEntity, D extends BaseDocument> {

    @Getter
    private final String storeName;
    @Getter
    private final Version version;
    @Getter
    private final Version vectorVersion;
    @Getter
    private final IdGenerator idGenerator;

    protected final ReaderWriterLock lock = new ReaderWriterLock();
    protected final DocumentDatabase documentDatabase;
    protected final Embedder embedder;

    private final VectorDatabase vectorDatabase;
    private final Class<D> documentSchema;
    @Getter
    private final StoreMigrationHelper documentMigration;
    @Getter
    private final StoreMigrationHelper vectorMigration;

    protected DocumentCollection<D> documents;
    protected VectorCollection<EntityVectorDocument> vectors;
    protected TagAssociationIndex tags;
    protected RelevanceSearchEngine searchEngine;

    /**
     * @param version       schema version of the records kept in the document database
     * @param vectorVersion schema version of the vector documents, tracked separately
     */
    protected AbstractEntityStore(String storeName,
                                  Version version,
                                  Version vectorVersion,
                                  Class<D> documentSchema,
                                  DocumentDatabase documentDatabase,
                                  VectorDatabase vectorDatabase,
                                  Embedder embedder,
                                  IdPolicy idPolicy,
                                  boolean allowMigration) {
        this.storeName = storeName;
        this.version = version;
        this.vectorVersion = vectorVersion;
        this.documentSchema = documentSchema;
        this.documentDatabase = documentDatabase;
        this.vectorDatabase = vectorDatabase;
        this.embedder = embedder;
        this.idGenerator = new IdGenerator(idPolicy);
        this.documentMigration = new StoreMigrationHelper(storeName, version, documentDatabase, allowMigration);
        this.vectorMigration = new StoreMigrationHelper(storeName, vectorVersion, vectorDatabase, allowMigration);
    }

    protected abstract String collectionName();

    protected abstract DocumentMigrationHelper documentLoader();

    protected abstract DocumentMigrationHelper vectorLoader();

    protected abstract DocumentMigrationHelper tagLoader();

    /**
     * Texts embedded for an entity. Duplicates are indexed once.
     */
    protected abstract Mono<List<String>> embeddableContents(D document);

    /**
     * Assemble the entity from its record. Fails with {@code InvalidContentException}
     * if a stored sub-field cannot be read.
     */
    protected abstract Mono<E> toEntity(D document, Set<String> tagIds);

    /**
     * Open extra document collections. Runs inside the document schema check.
     */
    protected Mono<Void> openAdditionalCollections() {
        return Mono.empty();
    }

    /**
     * Remove entity-owned rows other than vectors and tags.
     */
    protected Mono<Void> deleteDependents(String entityId) {
        return Mono.empty();
    }

    public String tagCollectionName() {
        return collectionName() + "_tag_associations";
    }

    public String vectorCollectionName() {
        return collectionName();
    }

    /**
     * Check schema versions, load (and if allowed migrate) every collection, then record
     * the runtime version. The store must not be used if this fails.
     */
    public Mono<Void> open() {
        Mono<Boolean> openDocuments = documentMigration.open(() ->
                documentDatabase.getOrCreateCollection(collectionName(), documentSchema, documentLoader())
                        .zipWith(documentDatabase.getOrCreateCollection(
                                tagCollectionName(), TagAssociationDocument.class, tagLoader()))
                        .flatMap(opened -> {
                            this.documents = opened.getT1();
                            this.tags = new TagAssociationIndex(opened.getT2(), idGenerator, tagLoader().getTargetVersion());
                            return openAdditionalCollections().thenReturn(true);
                        }));

        Mono<Boolean> openVectors = vectorMigration.open(() ->
                vectorDatabase.<EntityVectorDocument>getOrCreateCollection(
                                vectorCollectionName(), EntityVectorDocument.class, embedder, vectorLoader())
                        .map(opened -> {
                            this.vectors = opened;
                            this.searchEngine = new RelevanceSearchEngine(opened, embedder);
                            return true;
                        }));

        return openVectors.then(openDocuments).then();
    }

    public Mono<E> read(String id) {
        return lock.read(() -> readUnlocked(id));
    }

    /**
     * List entities by tag.
     *
     * @param tagIds null for every entity, empty for untagged entities only,
     *               otherwise entities carrying at least one of the tags
     */
    public Flux<E> list(Collection<String> tagIds) {
        return lock.readMany(() -> listUnlocked(tagIds));
    }

    protected Flux<E> listUnlocked(Collection<String> tagIds) {
        return Flux.defer(() -> {
            if (tagIds == null) {
                return documents.find(Filter.all()).concatMap(this::hydrate);
            }
            if (tagIds.isEmpty()) {
                return tags.listTaggedEntities()
                        .flatMapMany(tagged -> documents.find(Filter.all())
                                .filter(document -> !tagged.contains(document.getId())))
                        .concatMap(this::hydrate);
            }
            return tags.listEntitiesForTags(tagIds)
                    .flatMapMany(ids -> ids.isEmpty()
                            ? Flux.<D>empty()
                            : documents.find(Filter.in(BaseDocument.ID_FIELD, ids)))
                    .concatMap(this::hydrate);
        });
    }

    /**
     * Delete an entity with its vector documents, tag associations and dependents.
     *
     * @throws ItemNotFoundException if the entity does not exist
     */
    public Mono<Void> delete(String id) {
        return lock.write(() -> documents.deleteOne(byId(id))
                .flatMap(result -> {
                    if (result.getDeletedCount() == 0) {
                        return Mono.<Void>error(new ItemNotFoundException(entityType(), id));
                    }
                    return deleteVectors(id)
                            .then(tags.removeAllForEntity(id))
                            .then(deleteDependents(id))
                            .doOnSuccess(ignored -> log.debug("{}: deleted {}", storeName, id));
                }));
    }

    public Mono<Boolean> upsertTag(String id, String tagId, OffsetDateTime createdAt) {
        return lock.write(() -> requireRecord(id).then(tags.upsert(id, tagId, createdAt)));
    }

    public Mono<Boolean> upsertTag(String id, String tagId) {
        return upsertTag(id, tagId, null);
    }

    public Mono<Void> removeTag(String id, String tagId) {
        return lock.write(() -> requireRecord(id).then(tags.remove(id, tagId)));
    }

    /**
     * Up to {@code maxCount} of the {@code candidates} most relevant to {@code query},
     * most relevant first.
     */
    public Mono<List<E>> findRelevant(String query, Collection<E> candidates, int maxCount) {
        if (candidates.isEmpty() || maxCount <= 0) {
            return Mono.just(Collections.emptyList());
        }
        Set<String> candidateIds = new LinkedHashSet<>();
        candidates.forEach(candidate -> candidateIds.add(candidate.getId()));

        return lock.read(() -> vectors.find(Filter.in(EntityVectorDocument.ENTITY_ID_FIELD, candidateIds))
                .collect(LinkedHashMap<String, Integer>::new,
                        (counts, vector) -> counts.merge(vector.getEntityId(), 1, Integer::sum))
                .flatMap(counts -> searchEngine.search(query, counts, maxCount))
                .flatMapMany(Flux::fromIterable)
                .concatMap(hit -> documents.findOne(byId(hit.getDocument().getEntityId())))
                .concatMap(this::hydrate)
                .collectList());
    }

    /**
     * Remove vector documents and tag associations whose entity no longer exists.
     */
    public Mono<ReconcileReport> reconcile() {
        return lock.write(() -> documents.find(Filter.all())
                .map(BaseDocument::getId)
                .collect(LinkedHashSet<String>::new, Set::add)
                .flatMap(live -> {
                    Mono<Long> vectorOrphans = vectors.find(Filter.all())
                            .map(EntityVectorDocument::getEntityId)
                            .filter(owner -> !live.contains(owner))
                            .distinct()
                            .concatMap(owner -> deleteVectors(owner).flatMap(count -> deleteDependents(owner).thenReturn(count)))
                            .reduce(0L, Long::sum);
                    Mono<Long> tagOrphans = tags.listAll()
                            .map(TagAssociationDocument::getEntityId)
                            .filter(owner -> !live.contains(owner))
                            .distinct()
                            .concatMap(tags::removeAllForEntity)
                            .reduce(0L, Long::sum);
                    return Mono.zip(vectorOrphans, tagOrphans);
                })
                .map(counts -> new ReconcileReport(counts.getT1(), counts.getT2()))
                .doOnNext(report -> log.info("{}: reconciled, removed {} vector documents and {} tag associations",
                        storeName, report.getOrphanedVectorDocuments(), report.getOrphanedTagAssociations())));
    }

    /**
     * Write a new entity: vector documents, then the record, then tag associations.
     * In a content-addressed store an existing record with the same id is returned
     * instead, after tagging it with {@code tagIds}.
     */
    protected Mono<E> insertEntity(D document, Collection<String> tagIds, OffsetDateTime createdAt) {
        return lock.write(() -> insertEntityUnlocked(document, tagIds, createdAt));
    }

    protected Mono<E> insertEntityUnlocked(D document, Collection<String> tagIds, OffsetDateTime createdAt) {
        Collection<String> requestedTags = tagIds == null ? Collections.emptyList() : tagIds;
        return Mono.defer(() -> {
            Mono<D> existing = idGenerator.getPolicy() == IdPolicy.CONTENT_ADDRESSED
                    ? documents.findOne(byId(document.getId()))
                    : Mono.empty();

            return existing
                    .flatMap(found -> {
                        log.debug("{}: {} already exists", storeName, found.getId());
                        return upsertTags(found.getId(), requestedTags, createdAt).then(readUnlocked(found.getId()));
                    })
                    .switchIfEmpty(Mono.defer(() -> embeddableContents(document)
                            .flatMap(contents -> insertVectors(document.getId(), contents))
                            .then(documents.insertOne(document))
                            .then(upsertTags(document.getId(), requestedTags, createdAt))
                            .then(Mono.defer(() -> toEntity(document, new LinkedHashSet<>(requestedTags))))
                            .doOnNext(created -> log.debug("{}: created {}", storeName, created.getId()))));
        });
    }

    /**
     * Rewrite an entity's record and re-index its vectors. Tags stay as they are.
     *
     * @param merge builds the new record from the stored one
     */
    protected Mono<E> replaceEntity(String id, Function<D, Mono<D>> merge) {
        return lock.write(() -> requireRecord(id)
                .flatMap(merge)
                .flatMap(updated -> deleteVectors(id)
                        .then(embeddableContents(updated))
                        .flatMap(contents -> insertVectors(id, contents))
                        .then(documents.updateOne(byId(id), updated)))
                .then(readUnlocked(id)));
    }

    /**
     * Drop and re-insert the vector documents of an existing entity. Caller holds the writer lock.
     */
    protected Mono<Void> reindex(D document) {
        return deleteVectors(document.getId())
                .then(embeddableContents(document))
                .flatMap(contents -> insertVectors(document.getId(), contents));
    }

    protected Mono<E> readUnlocked(String id) {
        return requireRecord(id).flatMap(this::hydrate);
    }

    protected Mono<D> requireRecord(String id) {
        return documents.findOne(byId(id))
                .switchIfEmpty(Mono.error(() -> new ItemNotFoundException(entityType(), id)));
    }

    protected Mono<E> hydrate(D document) {
        return tags.listForEntity(document.getId()).flatMap(tagIds -> toEntity(document, tagIds));
    }

    protected Mono<Void> insertVectors(String entityId, List<String> contents) {
        return Flux.fromIterable(new LinkedHashSet<>(contents))
                .concatMap(content -> vectors.insertOne(EntityVectorDocument.builder()
                        .id(idGenerator.generate(ChecksumUtil.md5Checksum(entityId + content)))
                        .entityId(entityId)
                        .version(vectorVersion.toString())
                        .content(content)
                        .checksum(ChecksumUtil.md5Checksum(content))
                        .build()))
                .then();
    }

    protected Mono<Long> deleteVectors(String entityId) {
        Filter ofEntity = Filter.eq(EntityVectorDocument.ENTITY_ID_FIELD, entityId);
        return vectors.deleteOne(ofEntity)
                .repeat()
                .takeWhile(result -> result.getDeletedCount() > 0)
                .count();
    }

    protected String entityType() {
        return documentSchema.getSimpleName().replace("Document", "");
    }

    protected static Filter byId(String id) {
        return Filter.eq(BaseDocument.ID_FIELD, id);
    }

    protected static String now(OffsetDateTime createdAt) {
        return (createdAt != null ? createdAt : OffsetDateTime.now(ZoneOffset.UTC)).toString();
    }

    /**
     * Copy of {@code document} stamped with {@code version}, for migration converters.
     */
    protected static ObjectNode atVersion(ObjectNode document, String version) {
        ObjectNode upgraded = document.deepCopy();
        upgraded.put(BaseDocument.VERSION_FIELD, version);
        return upgraded;
    }

    protected static ObjectNode renameField(ObjectNode document, String from, String to) {
        if (document.has(from)) {
            document.set(to, document.remove(from));
        }
        return document;
    }

    protected Mono<Void> upsertTags(String entityId, Collection<String> tagIds, OffsetDateTime createdAt) {
        return Flux.fromIterable(tagIds)
                .concatMap(tagId -> tags.upsert(entityId, tagId, createdAt))
                .then();
    }
}
