package com.entitystore.service;

import com.entitystore.model.document.UtteranceDocument;
import com.entitystore.model.dto.UtteranceUpdateParams;
import com.entitystore.model.entity.ResponseField;
import com.entitystore.model.entity.Utterance;
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
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Store of utterance templates, found by their value or by the customer queries they answer.
 */
public class UtteranceStore extends AbstractEntityStore<Utterance, UtteranceDocument> {

    public static final Version VERSION = Version.of(0, 2, 0);
    public static final Version VECTOR_VERSION = Version.of(0, 2, 0);
    public static final String COLLECTION = "utterances";

    private final ResponseFieldCodec codec;
    private final DocumentMigrationHelper documentLoader;
    private final DocumentMigrationHelper vectorLoader = DocumentMigrationHelper.to(VECTOR_VERSION.toString()).build();
    private final DocumentMigrationHelper tagLoader = DocumentMigrationHelper.to("0.2.0").build();

    public UtteranceStore(DocumentDatabase documentDatabase,
                          VectorDatabase vectorDatabase,
                          Embedder embedder,
                          IdPolicy idPolicy,
                          boolean allowMigration,
                          ObjectMapper objectMapper) {
        super("UtteranceStore", VERSION, VECTOR_VERSION, UtteranceDocument.class,
                documentDatabase, vectorDatabase, embedder, idPolicy, allowMigration);
        this.codec = new ResponseFieldCodec(objectMapper);

        this.documentLoader = DocumentMigrationHelper.to("0.2.0")
                .from("0.1.0", document -> Mono.fromCallable(() -> {
                    ObjectNode upgraded = atVersion(document, "0.2.0");
                    JsonNode fields = upgraded.get("fields");
                    if (fields != null && fields.isArray()) {
                        upgraded.put("fields", objectMapper.writeValueAsString(fields));
                    }
                    if (!upgraded.hasNonNull("queries")) {
                        upgraded.put("queries", "[]");
                    }
                    if (!upgraded.hasNonNull("checksum")) {
                        upgraded.put("checksum", ChecksumUtil.md5Checksum(
                                upgraded.path("value").asText() + upgraded.path("fields").asText("[]")));
                    }
                    return upgraded;
                }))
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

    public Mono<Utterance> create(String value,
                                  List<ResponseField> fields,
                                  List<String> queries,
                                  Collection<String> tagIds,
                                  OffsetDateTime createdAt) {
        return Mono.defer(() -> {
            String serializedFields = codec.writeFields(fields);
            String checksum = ChecksumUtil.md5Checksum(value + serializedFields);

            UtteranceDocument document = UtteranceDocument.builder()
                    .id(getIdGenerator().generate(checksum))
                    .version(VERSION.toString())
                    .creationUtc(now(createdAt))
                    .value(value)
                    .fields(serializedFields)
                    .queries(codec.writeStrings(queries))
                    .checksum(checksum)
                    .build();
            return insertEntity(document, tagIds, createdAt);
        });
    }

    public Mono<Utterance> update(String id, UtteranceUpdateParams params) {
        return replaceEntity(id, existing -> Mono.fromCallable(() -> {
            String value = params.getValue() != null ? params.getValue() : existing.getValue();
            String fields = params.getFields() != null ? codec.writeFields(params.getFields()) : existing.getFields();
            String queries = params.getQueries() != null ? codec.writeStrings(params.getQueries()) : existing.getQueries();

            return existing.toBuilder()
                    .version(VERSION.toString())
                    .value(value)
                    .fields(fields)
                    .queries(queries)
                    .checksum(ChecksumUtil.md5Checksum(value + fields))
                    .build();
        }));
    }

    @Override
    protected Mono<List<String>> embeddableContents(UtteranceDocument document) {
        return Mono.fromCallable(() -> {
            List<String> contents = new ArrayList<>();
            contents.add(document.getValue());
            contents.addAll(codec.readStrings(document.getQueries(), "queries"));
            return contents;
        });
    }

    @Override
    protected Mono<Utterance> toEntity(UtteranceDocument document, Set<String> tagIds) {
        return Mono.fromCallable(() -> Utterance.builder()
                .id(document.getId())
                .creationUtc(ResponseFieldCodec.readTimestamp(document.getCreationUtc()))
                .value(document.getValue())
                .fields(codec.readFields(document.getFields()))
                .queries(codec.readStrings(document.getQueries(), "queries"))
                .tags(new LinkedHashSet<>(tagIds))
                .build());
    }
}
