package com.entitystore.service;

import com.entitystore.model.document.CannedResponseDocument;
import com.entitystore.model.dto.CannedResponseUpdateParams;
import com.entitystore.model.entity.CannedResponse;
import com.entitystore.model.entity.ResponseField;
import com.entitystore.nlp.Embedder;
import com.entitystore.persistence.DocumentDatabase;
import com.entitystore.persistence.VectorDatabase;
import com.entitystore.persistence.migration.DocumentMigrationHelper;
import com.entitystore.util.ChecksumUtil;
import com.entitystore.util.IdPolicy;
import com.entitystore.util.Version;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Store of canned responses. Ids are derived from content by default,
 * so creating the same response twice yields the same record.
 */
@Slf4j
public class CannedResponseStore extends AbstractEntityStore<CannedResponse, CannedResponseDocument> {

    public static final Version VERSION = Version.of(0, 3, 0);
    public static final Version VECTOR_VERSION = Version.of(0, 2, 0);
    public static final String COLLECTION = "canned_responses";

    private final ResponseFieldCodec codec;
    private final DocumentMigrationHelper documentLoader;
    private final DocumentMigrationHelper vectorLoader;
    private final DocumentMigrationHelper tagLoader;

    public CannedResponseStore(DocumentDatabase documentDatabase,
                               VectorDatabase vectorDatabase,
                               Embedder embedder,
                               IdPolicy idPolicy,
                               boolean allowMigration,
                               ObjectMapper objectMapper) {
        super("CannedResponseStore", VERSION, VECTOR_VERSION, CannedResponseDocument.class,
                documentDatabase, vectorDatabase, embedder, idPolicy, allowMigration);
        this.codec = new ResponseFieldCodec(objectMapper);

        this.documentLoader = DocumentMigrationHelper.to("0.3.0")
                .from("0.1.0", document -> Mono.fromCallable(() -> {
                    ObjectNode upgraded = atVersion(document, "0.2.0");
                    JsonNode fields = upgraded.get("fields");
                    String serialized = fields == null || fields.isNull()
                            ? "[]"
                            : fields.isTextual() ? fields.asText() : objectMapper.writeValueAsString(fields);
                    upgraded.put("fields", serialized);
                    upgraded.put("checksum", ChecksumUtil.md5Checksum(upgraded.path("value").asText() + serialized));
                    return upgraded;
                }))
                .from("0.2.0", document -> Mono.fromCallable(() -> {
                    ObjectNode upgraded = atVersion(document, "0.3.0");
                    if (!upgraded.has("signals")) {
                        upgraded.putArray("signals");
                    }
                    return upgraded;
                }))
                .build();

        this.vectorLoader = DocumentMigrationHelper.to(VECTOR_VERSION.toString())
                .from("0.1.0", document -> Mono.fromCallable(() ->
                        renameField(atVersion(document, "0.2.0"), "can_rep_id", "entity_id")))
                .build();

        this.tagLoader = DocumentMigrationHelper.to("0.3.0")
                .from("0.1.0", document -> Mono.fromCallable(() ->
                        renameField(atVersion(document, "0.2.0"), "can_rep_id", "entity_id")))
                .from("0.2.0", document -> document.hasNonNull("tag_id")
                        ? Mono.just(atVersion(document, "0.3.0"))
                        : Mono.<ObjectNode>empty().doOnSubscribe(ignored ->
                                log.warn("Dropping tag association {} without a tag id", document.path("id").asText())))
                .build();
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

    /**
     * Create a canned response.
     *
     * @param value Response template
     * @param fields Template fields, may be null
     * @param signals Phrases the response should also be found by, may be null
     * @param tagIds Tags to attach, may be null
     * @param createdAt Creation time, or null for now
     * @return The new response, or the stored one if identical content already exists
     */
    public Mono<CannedResponse> create(String value,
                                       List<ResponseField> fields,
                                       List<String> signals,
                                       Collection<String> tagIds,
                                       OffsetDateTime createdAt) {
        return Mono.defer(() -> {
            String serializedFields = codec.writeFields(fields);
            String checksum = ChecksumUtil.md5Checksum(value + serializedFields);

            CannedResponseDocument document = CannedResponseDocument.builder()
                    .id(getIdGenerator().generate(checksum))
                    .version(VERSION.toString())
                    .creationUtc(now(createdAt))
                    .value(value)
                    .fields(serializedFields)
                    .signals(signals == null ? new ArrayList<>() : new ArrayList<>(signals))
                    .checksum(checksum)
                    .build();
            return insertEntity(document, tagIds, createdAt);
        });
    }

    public Mono<CannedResponse> create(String value, Collection<String> tagIds) {
        return create(value, null, null, tagIds, null);
    }

    public Mono<CannedResponse> update(String id, CannedResponseUpdateParams params) {
        return replaceEntity(id, existing -> Mono.fromCallable(() -> {
            String fields = params.getFields() != null ? codec.writeFields(params.getFields()) : existing.getFields();
            String value = params.getValue() != null ? params.getValue() : existing.getValue();
            List<String> signals = params.getSignals() != null ? new ArrayList<>(params.getSignals()) : existing.getSignals();

            return existing.toBuilder()
                    .version(VERSION.toString())
                    .value(value)
                    .fields(fields)
                    .signals(signals)
                    .checksum(ChecksumUtil.md5Checksum(value + fields))
                    .build();
        }));
    }

    @Override
    protected Mono<List<String>> embeddableContents(CannedResponseDocument document) {
        List<String> contents = new ArrayList<>();
        contents.add(document.getValue());
        if (document.getSignals() != null) {
            contents.addAll(document.getSignals());
        }
        return Mono.just(contents);
    }

    @Override
    protected Mono<CannedResponse> toEntity(CannedResponseDocument document, Set<String> tagIds) {
        return Mono.fromCallable(() -> CannedResponse.builder()
                .id(document.getId())
                .creationUtc(ResponseFieldCodec.readTimestamp(document.getCreationUtc()))
                .value(document.getValue())
                .fields(codec.readFields(document.getFields()))
                .signals(document.getSignals() == null ? List.of() : List.copyOf(document.getSignals()))
                .tags(new LinkedHashSet<>(tagIds))
                .build());
    }
}
