package com.entitystore.persistence.postgres;

import com.entitystore.nlp.Embedder;
import com.entitystore.persistence.CollectionLoader;
import com.entitystore.persistence.DocumentLoader;
import com.entitystore.persistence.EmbeddableDocument;
import com.entitystore.persistence.MetadataStore;
import com.entitystore.persistence.VectorCollection;
import com.entitystore.persistence.VectorDatabase;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Vector database on PostgreSQL with the pgvector extension.
 * Its tables carry the {@value #TABLE_PREFIX} prefix so they never collide with
 * document tables in the same schema.
 */
public class PgVectorDatabase implements VectorDatabase {

    public static final String TABLE_PREFIX = "vec_";

    private final DatabaseClient databaseClient;
    private final ObjectMapper objectMapper;
    private final MetadataStore metadataStore;

    public PgVectorDatabase(DatabaseClient databaseClient, ObjectMapper objectMapper, String metadataTable) {
        this.databaseClient = databaseClient;
        this.objectMapper = objectMapper;
        this.metadataStore = new PostgresMetadataStore(databaseClient, metadataTable);
    }

    @Override
    public <T extends EmbeddableDocument> Mono<VectorCollection<T>> getOrCreateCollection(
            String name, Class<T> schema, Embedder embedder, DocumentLoader loader) {
        PgVectorCollection<T> collection = new PgVectorCollection<>(
                name, tableName(name), schema, embedder, databaseClient, objectMapper);
        String failedName = CollectionLoader.failedMigrationsCollection(name);
        PostgresDocumentCollection<ObjectNode> failed = new PostgresDocumentCollection<>(
                failedName, tableName(failedName), ObjectNode.class, databaseClient, objectMapper);
        return PostgresDocumentDatabase.load(collection, failed, loader).thenReturn(collection);
    }

    @Override
    public Mono<Void> deleteCollection(String name) {
        return databaseClient.sql("DROP TABLE IF EXISTS " + PostgresTables.quote(tableName(name))).then();
    }

    static String tableName(String collection) {
        return TABLE_PREFIX + collection;
    }

    @Override
    public Mono<Map<String, Object>> readMetadata() {
        return metadataStore.readMetadata();
    }

    @Override
    public Mono<Void> upsertMetadata(String key, Object value) {
        return metadataStore.upsertMetadata(key, value);
    }

    @Override
    public Mono<Void> removeMetadata(String key) {
        return metadataStore.removeMetadata(key);
    }
}
