package com.entitystore.persistence.postgres;

import com.entitystore.persistence.MetadataStore;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Metadata kept in a two-column table ({@code key}, {@code value}).
 */
public class PostgresMetadataStore implements MetadataStore {

    private final DatabaseClient databaseClient;
    private final String table;
    private final Mono<Void> ensureTable;

    public PostgresMetadataStore(DatabaseClient databaseClient, String tableName) {
        this.databaseClient = databaseClient;
        this.table = PostgresTables.quote(tableName);
        this.ensureTable = databaseClient
                .sql("CREATE TABLE IF NOT EXISTS " + table + " (key TEXT PRIMARY KEY, value TEXT NOT NULL)")
                .then()
                .cache();
    }

    @Override
    public Mono<Map<String, Object>> readMetadata() {
        return ensureTable.then(databaseClient.sql("SELECT key, value FROM " + table)
                .map((row, meta) -> Map.entry(row.get("key", String.class), row.get("value", String.class)))
                .all()
                .collect(LinkedHashMap<String, Object>::new, (map, entry) -> map.put(entry.getKey(), entry.getValue()))
                .map(Collections::unmodifiableMap));
    }

    @Override
    public Mono<Void> upsertMetadata(String key, Object value) {
        return ensureTable.then(databaseClient
                .sql("INSERT INTO " + table + " (key, value) VALUES ($1, $2) "
                        + "ON CONFLICT (key) DO UPDATE SET value = EXCLUDED.value")
                .bind(0, key)
                .bind(1, String.valueOf(value))
                .then());
    }

    @Override
    public Mono<Void> removeMetadata(String key) {
        return ensureTable.then(databaseClient.sql("DELETE FROM " + table + " WHERE key = $1")
                .bind(0, key)
                .then());
    }
}
