package com.entitystore.persistence.postgres;

import com.entitystore.persistence.BaseDocument;
import com.entitystore.persistence.CollectionLoader;
import com.entitystore.persistence.DocumentCollection;
import com.entitystore.persistence.DocumentDatabase;
import com.entitystore.persistence.DocumentLoader;
import com.entitystore.persistence.MetadataStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple2;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Document database on PostgreSQL: one JSONB table per collection.
 */
public class PostgresDocumentDatabase implements DocumentDatabase {

    private final DatabaseClient databaseClient;
    private final ObjectMapper objectMapper;
    private final MetadataStore metadataStore;

    public PostgresDocumentDatabase(DatabaseClient databaseClient, ObjectMapper objectMapper, String metadataTable) {
        this.databaseClient = databaseClient;
        this.objectMapper = objectMapper;
        this.metadataStore = new PostgresMetadataStore(databaseClient, metadataTable);
    }

    @Override
    public <T extends BaseDocument> Mono<DocumentCollection<T>> getOrCreateCollection(
            String name, Class<T> schema, DocumentLoader loader) {
        PostgresDocumentCollection<T> collection = new PostgresDocumentCollection<>(name, schema, databaseClient, objectMapper);
        PostgresDocumentCollection<ObjectNode> failed = new PostgresDocumentCollection<>(
                CollectionLoader.failedMigrationsCollection(name), ObjectNode.class, databaseClient, objectMapper);
        return load(collection, failed, loader).thenReturn(collection);
    }

    @Override
    public <T> Mono<DocumentCollection<T>> getCollection(String name, Class<T> schema) {
        PostgresDocumentCollection<T> collection = new PostgresDocumentCollection<>(name, schema, databaseClient, objectMapper);
        return collection.ensureTable().thenReturn(collection);
    }

    @Override
    public Mono<Void> deleteCollection(String name) {
        return databaseClient.sql("DROP TABLE IF EXISTS " + PostgresTables.quote(name)).then();
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

    /**
     * Run the loader over every row: write migrated documents back, move failures to the sidecar table.
     */
    static Mono<Void> load(PostgresDocumentCollection<?> collection,
                           PostgresDocumentCollection<ObjectNode> failed,
                           DocumentLoader loader) {
        String name = collection.getName();
        return collection.ensureTable()
                .then(failed.ensureTable())
                .thenMany(collection.scanRaw())
                .collectList()
                .flatMap(rows -> {
                    Map<ObjectNode, Long> seqs = new IdentityHashMap<>();
                    rows.forEach(row -> seqs.put(row.getT2(), row.getT1()));
                    List<ObjectNode> documents = rows.stream().map(Tuple2::getT2).collect(Collectors.toList());

                    return CollectionLoader.load(name, Flux.fromIterable(documents), loader)
                            .concatMap(outcome -> {
                                long seq = seqs.get(outcome.getOriginal());
                                switch (outcome.getKind()) {
                                    case MIGRATED:
                                        return collection.writeNode(seq, outcome.getDocument()).thenReturn(outcome);
                                    case FAILED:
                                        return failed.insertNode(outcome.getOriginal())
                                                .then(collection.deleteRow(seq))
                                                .thenReturn(outcome);
                                    default:
                                        return Mono.just(outcome);
                                }
                            })
                            .collectList()
                            .doOnNext(outcomes -> CollectionLoader.logSummary(name, outcomes))
                            .then();
                });
    }
}
