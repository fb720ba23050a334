package com.entitystore.persistence.postgres;

import com.entitystore.nlp.Embedder;
import com.entitystore.nlp.VectorMath;
import com.entitystore.persistence.EmbeddableDocument;
import com.entitystore.persistence.Filter;
import com.entitystore.persistence.SimilarDocumentResult;
import com.entitystore.persistence.VectorCollection;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * pgvector-backed collection. Uses the {@code <=>} operator (cosine distance).
 */
public class PgVectorCollection<T extends EmbeddableDocument>
        extends PostgresDocumentCollection<T> implements VectorCollection<T> {

    private final Embedder embedder;

    public PgVectorCollection(String name, String tableName, Class<T> schema, Embedder embedder,
                              DatabaseClient databaseClient, ObjectMapper objectMapper) {
        super(name, tableName, schema, databaseClient, objectMapper);
        this.embedder = embedder;
    }

    @Override
    Mono<Void> ensureTable() {
        return databaseClient.sql(PostgresTables.vectorTableDdl(getTableName())).then();
    }

    @Override
    public Flux<SimilarDocumentResult<T>> findSimilarDocuments(Filter filter, String query, int k) {
        if (k <= 0) {
            return Flux.empty();
        }
        SqlFragment where = FilterSqlRenderer.render(filter, 2);
        String sql = "SELECT document::text AS document, embedding <=> $1::vector AS distance FROM " + table
                + " WHERE embedding IS NOT NULL AND " + where.getSql()
                + " ORDER BY distance LIMIT " + k;

        return embedder.embed(query).flatMapMany(vector ->
                where.bindTo(databaseClient.sql(sql).bind(0, VectorMath.formatVector(vector)), 1)
                        .map((row, meta) -> new SimilarDocumentResult<>(
                                row.get("document", String.class),
                                row.get("distance", Double.class)))
                        .all()
                        .map(hit -> new SimilarDocumentResult<>(toDocument(parse(hit.getDocument())), hit.getDistance())));
    }

    @Override
    protected Mono<Void> insertNode(ObjectNode node) {
        return embedder.embed(contentOf(node)).flatMap(vector -> databaseClient
                .sql("INSERT INTO " + table + " (id, document, embedding) VALUES ($1, $2::jsonb, $3::vector)")
                .bind(0, node.path("id").asText(""))
                .bind(1, serialize(node))
                .bind(2, VectorMath.formatVector(vector))
                .then());
    }

    @Override
    protected Mono<Void> writeNode(long seq, ObjectNode node) {
        return embedder.embed(contentOf(node)).flatMap(vector -> databaseClient
                .sql("UPDATE " + table + " SET id = $1, document = $2::jsonb, embedding = $3::vector WHERE seq = $4")
                .bind(0, node.path("id").asText(""))
                .bind(1, serialize(node))
                .bind(2, VectorMath.formatVector(vector))
                .bind(3, seq)
                .then());
    }

    private static String contentOf(ObjectNode node) {
        JsonNode content = node.get("content");
        return content == null || content.isNull() ? "" : content.asText();
    }
}
