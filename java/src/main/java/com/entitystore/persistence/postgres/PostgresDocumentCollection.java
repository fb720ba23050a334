package com.entitystore.persistence.postgres;

import com.entitystore.exception.InvalidContentException;
import com.entitystore.persistence.BaseDocument;
import com.entitystore.persistence.DeleteResult;
import com.entitystore.persistence.DocumentCollection;
import com.entitystore.persistence.Filter;
import com.entitystore.persistence.InsertResult;
import com.entitystore.persistence.UpdateResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple2;
import reactor.util.function.Tuples;


/**
 * Collection stored as a table of JSONB documents. {@code seq} keeps insertion order
 * and addresses single rows.
 */
public class PostgresDocumentCollection<T> implements DocumentCollection<T> {

    @Getter
    private final String name;
    @Getter
    private final String tableName;
    private final Class<T> schema;
    protected final String table;
    protected final DatabaseClient databaseClient;
    protected final ObjectMapper objectMapper;

    public PostgresDocumentCollection(String name, Class<T> schema, DatabaseClient databaseClient, ObjectMapper objectMapper) {
        this(name, name, schema, databaseClient, objectMapper);
    }

    public PostgresDocumentCollection(String name, String tableName, Class<T> schema,
                                      DatabaseClient databaseClient, ObjectMapper objectMapper) {
        this.name = name;
        this.tableName = tableName;
        this.schema = schema;
        this.table = PostgresTables.quote(tableName);
        this.databaseClient = databaseClient;
        this.objectMapper = objectMapper;
    }

    Mono<Void> ensureTable() {
        return databaseClient.sql(PostgresTables.documentTableDdl(tableName)).then();
    }

    @Override
    public Flux<T> find(Filter filter) {
        return findRows(filter, null).map(row -> toDocument(row.getT2()));
    }

    @Override
    public Mono<T> findOne(Filter filter) {
        return findRows(filter, 1).next().map(row -> toDocument(row.getT2()));
    }

    @Override
    public Mono<InsertResult> insertOne(T document) {
        return Mono.defer(() -> insertNode(objectMapper.valueToTree(document)))
                .thenReturn(new InsertResult(true));
    }

    @Override
    public Mono<UpdateResult<T>> updateOne(Filter filter, T patch) {
        return findRows(filter, 1).next()
                .flatMap(row -> {
                    ObjectNode updated = row.getT2();
                    ObjectNode changes = objectMapper.valueToTree(patch);
                    changes.fields().forEachRemaining(entry -> {
                        if (!entry.getValue().isNull()) {
                            updated.set(entry.getKey(), entry.getValue());
                        }
                    });
                    return writeNode(row.getT1(), updated)
                            .then(Mono.fromSupplier(() -> new UpdateResult<>(1, 1, toDocument(updated))));
                })
                .defaultIfEmpty(new UpdateResult<>(0, 0, null));
    }

    @Override
    public Mono<DeleteResult<T>> deleteOne(Filter filter) {
        SqlFragment where = FilterSqlRenderer.render(filter, 1);
        String sql = "DELETE FROM " + table + " WHERE seq = (SELECT seq FROM " + table
                + " WHERE " + where.getSql() + " ORDER BY seq LIMIT 1) RETURNING document::text AS document";

        return where.bindTo(databaseClient.sql(sql), 0)
                .map((row, meta) -> row.get("document", String.class))
                .one()
                .map(json -> new DeleteResult<>(1, toDocument(parse(json))))
                .defaultIfEmpty(new DeleteResult<>(0, null));
    }

    /**
     * Every stored row as (seq, document), in insertion order.
     */
    Flux<Tuple2<Long, ObjectNode>> scanRaw() {
        return findRows(Filter.all(), null);
    }

    protected Flux<Tuple2<Long, ObjectNode>> findRows(Filter filter, Integer limit) {
        SqlFragment where = FilterSqlRenderer.render(filter, 1);
        String sql = "SELECT seq, document::text AS document FROM " + table
                + " WHERE " + where.getSql() + " ORDER BY seq" + (limit == null ? "" : " LIMIT " + limit);

        return where.bindTo(databaseClient.sql(sql), 0)
                .map((row, meta) -> Tuples.of(row.get("seq", Long.class), row.get("document", String.class)))
                .all()
                .map(row -> Tuples.of(row.getT1(), parse(row.getT2())));
    }

    protected Mono<Void> insertNode(ObjectNode node) {
        return databaseClient.sql("INSERT INTO " + table + " (id, document) VALUES ($1, $2::jsonb)")
                .bind(0, idOf(node))
                .bind(1, serialize(node))
                .then();
    }

    protected Mono<Void> writeNode(long seq, ObjectNode node) {
        return databaseClient.sql("UPDATE " + table + " SET id = $1, document = $2::jsonb WHERE seq = $3")
                .bind(0, idOf(node))
                .bind(1, serialize(node))
                .bind(2, seq)
                .then();
    }

    Mono<Void> deleteRow(long seq) {
        return databaseClient.sql("DELETE FROM " + table + " WHERE seq = $1")
                .bind(0, seq)
                .then();
    }

    protected String serialize(ObjectNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new InvalidContentException("Failed to serialize document for " + name, e);
        }
    }

    protected ObjectNode parse(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            if (!node.isObject()) {
                throw new InvalidContentException("Stored document in " + name + " is not an object", null);
            }
            return (ObjectNode) node;
        } catch (JsonProcessingException e) {
            throw new InvalidContentException("Malformed document in " + name, e);
        }
    }

    protected T toDocument(ObjectNode node) {
        try {
            return objectMapper.convertValue(node, schema);
        } catch (IllegalArgumentException e) {
            throw new InvalidContentException("Malformed document in collection " + name, e);
        }
    }

    private static String idOf(ObjectNode node) {
        JsonNode id = node.get(BaseDocument.ID_FIELD);
        return id == null || id.isNull() ? "" : id.asText();
    }
}
