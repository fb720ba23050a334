package com.entitystore.persistence.memory;

import com.entitystore.persistence.BaseDocument;
import com.entitystore.persistence.CollectionLoader;
import com.entitystore.persistence.DocumentCollection;
import com.entitystore.persistence.DocumentDatabase;
import com.entitystore.persistence.DocumentLoader;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Transient document database. Nothing survives the process.
 */
public class InMemoryDocumentDatabase implements DocumentDatabase {

    protected final ObjectMapper objectMapper;
    protected final Map<String, List<ObjectNode>> collections = new ConcurrentHashMap<>();
    protected final Map<String, Object> metadata = new ConcurrentHashMap<>();

    public InMemoryDocumentDatabase(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public <T extends BaseDocument> Mono<DocumentCollection<T>> getOrCreateCollection(
            String name, Class<T> schema, DocumentLoader loader) {
        return Mono.defer(() -> {
            List<ObjectNode> stored = storage(name);
            List<ObjectNode> snapshot;
            synchronized (stored) {
                snapshot = new ArrayList<>(stored);
            }

            return CollectionLoader.load(name, Flux.fromIterable(snapshot), loader)
                    .collectList()
                    .flatMap(outcomes -> {
                        List<ObjectNode> failed = storage(CollectionLoader.failedMigrationsCollection(name));
                        synchronized (stored) {
                            stored.clear();
                            for (CollectionLoader.Outcome outcome : outcomes) {
                                if (outcome.isUsable()) {
                                    stored.add(outcome.getDocument());
                                } else {
                                    synchronized (failed) {
                                        failed.add(outcome.getOriginal());
                                    }
                                }
                            }
                        }
                        CollectionLoader.logSummary(name, outcomes);
                        return persist();
                    })
                    .thenReturn(new InMemoryDocumentCollection<>(name, schema, stored, objectMapper, this::persist));
        });
    }

    @Override
    public <T> Mono<DocumentCollection<T>> getCollection(String name, Class<T> schema) {
        return Mono.fromSupplier(() ->
                new InMemoryDocumentCollection<>(name, schema, storage(name), objectMapper, this::persist));
    }

    @Override
    public Mono<Void> deleteCollection(String name) {
        return Mono.defer(() -> {
            collections.remove(name);
            return persist();
        });
    }

    @Override
    public Mono<Map<String, Object>> readMetadata() {
        return Mono.fromSupplier(() -> Collections.unmodifiableMap(new LinkedHashMap<>(metadata)));
    }

    @Override
    public Mono<Void> upsertMetadata(String key, Object value) {
        return Mono.defer(() -> {
            metadata.put(key, value);
            return persist();
        });
    }

    @Override
    public Mono<Void> removeMetadata(String key) {
        return Mono.defer(() -> {
            metadata.remove(key);
            return persist();
        });
    }

    protected List<ObjectNode> storage(String name) {
        return collections.computeIfAbsent(name, k -> Collections.synchronizedList(new ArrayList<>()));
    }

    /**
     * Called after every change. Transient storage has nothing to do.
     */
    protected Mono<Void> persist() {
        return Mono.empty();
    }
}
