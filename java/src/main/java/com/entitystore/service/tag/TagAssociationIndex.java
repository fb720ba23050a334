package com.entitystore.service.tag;

import com.entitystore.exception.ItemNotFoundException;
import com.entitystore.model.document.TagAssociationDocument;
import com.entitystore.persistence.DocumentCollection;
import com.entitystore.persistence.Filter;
import com.entitystore.util.ChecksumUtil;
import com.entitystore.util.IdGenerator;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Many-to-many index between entity ids and tag ids, kept in its own collection.
 * Callers hold the store lock; the index does no locking of its own.
 */
@Slf4j
public class TagAssociationIndex {

    private final DocumentCollection<TagAssociationDocument> associations;
    private final IdGenerator idGenerator;
    private final String schemaVersion;

    public TagAssociationIndex(DocumentCollection<TagAssociationDocument> associations,
                               IdGenerator idGenerator,
                               String schemaVersion) {
        this.associations = associations;
        this.idGenerator = idGenerator;
        this.schemaVersion = schemaVersion;
    }

    /**
     * Associate a tag with an entity.
     *
     * @param entityId Entity ID
     * @param tagId Tag ID
     * @param createdAt Creation time, or null for now
     * @return true if a new association was written, false if it already existed
     */
    public Mono<Boolean> upsert(String entityId, String tagId, OffsetDateTime createdAt) {
        return associations.findOne(pair(entityId, tagId))
                .map(existing -> false)
                .switchIfEmpty(Mono.defer(() -> {
                    TagAssociationDocument document = TagAssociationDocument.builder()
                            .id(idGenerator.generate(ChecksumUtil.md5Checksum(entityId + tagId)))
                            .version(schemaVersion)
                            .creationUtc((createdAt != null ? createdAt : OffsetDateTime.now(ZoneOffset.UTC)).toString())
                            .entityId(entityId)
                            .tagId(tagId)
                            .build();
                    log.debug("Tagging {} with {}", entityId, tagId);
                    return associations.insertOne(document).thenReturn(true);
                }));
    }

    public Mono<Boolean> upsert(String entityId, String tagId) {
        return upsert(entityId, tagId, null);
    }

    /**
     * Remove one association.
     *
     * @throws ItemNotFoundException if the entity does not carry the tag
     */
    public Mono<Void> remove(String entityId, String tagId) {
        return associations.deleteOne(pair(entityId, tagId))
                .flatMap(result -> result.getDeletedCount() == 0
                        ? Mono.<Void>error(new ItemNotFoundException("Tag association", entityId + "/" + tagId))
                        : Mono.<Void>empty());
    }

    public Mono<Set<String>> listForEntity(String entityId) {
        return associations.find(Filter.eq(TagAssociationDocument.ENTITY_ID_FIELD, entityId))
                .map(TagAssociationDocument::getTagId)
                .collect(LinkedHashSet::new, Set::add);
    }

    /**
     * Entities carrying at least one of {@code tagIds}.
     */
    public Mono<Set<String>> listEntitiesForTags(Collection<String> tagIds) {
        if (tagIds.isEmpty()) {
            return Mono.just(new LinkedHashSet<>());
        }
        return associations.find(Filter.in(TagAssociationDocument.TAG_ID_FIELD, tagIds))
                .map(TagAssociationDocument::getEntityId)
                .collect(LinkedHashSet::new, Set::add);
    }

    /**
     * Every entity that carries any tag at all.
     */
    public Mono<Set<String>> listTaggedEntities() {
        return associations.find(Filter.all())
                .map(TagAssociationDocument::getEntityId)
                .collect(LinkedHashSet::new, Set::add);
    }

    public Flux<TagAssociationDocument> listAll() {
        return associations.find(Filter.all());
    }

    /**
     * Remove every association of an entity.
     *
     * @return number of associations removed
     */
    public Mono<Long> removeAllForEntity(String entityId) {
        Filter ofEntity = Filter.eq(TagAssociationDocument.ENTITY_ID_FIELD, entityId);
        return associations.deleteOne(ofEntity)
                .repeat()
                .takeWhile(result -> result.getDeletedCount() > 0)
                .count();
    }

    private static Filter pair(String entityId, String tagId) {
        return Filter.and(
                Filter.eq(TagAssociationDocument.ENTITY_ID_FIELD, entityId),
                Filter.eq(TagAssociationDocument.TAG_ID_FIELD, tagId));
    }
}
