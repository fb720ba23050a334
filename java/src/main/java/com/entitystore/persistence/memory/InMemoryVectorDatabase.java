package com.entitystore.persistence.memory;

import com.entitystore.nlp.Embedder;
import com.entitystore.persistence.CollectionLoader;
import com.entitystore.persistence.EmbeddableDocument;
import com.entitystore.persistence.VectorCollection;
import com.entitystore.persistence.VectorDatabase;
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
 * Vector database held in memory. Embeddings are recomputed whenever a collection is opened.
 */
public class InMemoryVectorDatabase implements VectorDatabase {

    protected final ObjectMapper objectMapper;
    protected final Map<String, List<ObjectNode>> collections = new ConcurrentHashMap<>();
    protected final Map<String, Object> metadata = new ConcurrentHashMap<>();

    public InMemoryVectorDatabase(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public <T extends EmbeddableDocument> Mono<VectorCollection<T>> getOrCreateCollection(
            String name, Class<T> schema, Embedder embedder, DocumentLoader loader) {
        return Mono.defer(() -> {
            List<ObjectNode> stored = storage(name);
            List<ObjectNode> snapshot;
            synchronized (stored) {
                snapshot = new ArrayList<>(stored);
            }
            Map<ObjectNode, float[]> vectors = InMemoryVectorCollection.newVectorIndex();
            InMemoryVectorCollection<T> collection =
                    new InMemoryVectorCollection<>(name, schema, stored, vectors, embedder, objectMapper, this::persist);

            return CollectionLoader.load(name, Flux.fromIterable(snapshot), loader)
                    .collectList()
                    .flatMap(outcomes -> {
                        List<ObjectNode> failed = storage(CollectionLoader.failedMigrationsCollection(name));
                        List<ObjectNode> usable = new ArrayList<>();
                        for (CollectionLoader.Outcome outcome : outcomes) {
                            if (outcome.isUsable()) {
                                usable.add(outcome.getDocument());
                            } else {
                                failed.add(outcome.getOriginal());
                            }
                        }
                        synchronized (stored) {
                            stored.clear();
                            stored.addAll(usable);
                        }
                        CollectionLoader.logSummary(name, outcomes);
                        return Flux.fromIterable(usable).concatMap(collection::embedInto).then(persist());
                    })
                    .thenReturn(collection);
        });
    }

    /**
     * Documents quarantined while opening {@code name}, as stored before migration.
     */
    public List<ObjectNode> getFailedMigrations(String name) {
        List<ObjectNode> failed = storage(CollectionLoader.failedMigrationsCollection(name));
        synchronized (failed) {
            return new ArrayList<>(failed);
        }
    }

    /**
     * Store raw documents without embedding them, as an older deployment would have left them.
     */
    public Mono<Void> importRawDocuments(String name, List<ObjectNode> documents) {
        return Mono.defer(() -> {
            storage(name).addAll(documents);
            return persist();
        });
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
