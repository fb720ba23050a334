package com.entitystore.persistence.memory;

import com.entitystore.exception.InvalidContentException;
import com.entitystore.persistence.DeleteResult;
import com.entitystore.persistence.DocumentCollection;
import com.entitystore.persistence.Filter;
import com.entitystore.persistence.InsertResult;
import com.entitystore.persistence.UpdateResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Supplier;

/**
 * Document collection kept as a list of JSON trees.
 * The list is shared with the owning database, which may persist it after every change.
 */
public class InMemoryDocumentCollection<T> implements DocumentCollection<T> {

    @Getter
    private final String name;
    private final Class<T> schema;
    private final List<ObjectNode> documents;
    protected final ObjectMapper objectMapper;
    private final Supplier<Mono<Void>> onChange;

    public InMemoryDocumentCollection(String name, Class<T> schema, List<ObjectNode> documents,
                                      ObjectMapper objectMapper, Supplier<Mono<Void>> onChange) {
        this.name = name;
        this.schema = schema;
        this.documents = documents;
        this.objectMapper = objectMapper;
        this.onChange = onChange;
    }

    @Override
    public Flux<T> find(Filter filter) {
        return Flux.defer(() -> Flux.fromIterable(matching(filter))).map(this::toDocument);
    }

    @Override
    public Mono<T> findOne(Filter filter) {
        return find(filter).next();
    }

    @Override
    public Mono<InsertResult> insertOne(T document) {
        return Mono.defer(() -> {
            ObjectNode node = toNode(document);
            return beforeInsert(node)
                    .then(Mono.fromRunnable(() -> {
                        synchronized (documents) {
                            documents.add(node);
                        }
                    }))
                    .then(onChange.get())
                    .thenReturn(new InsertResult(true));
        });
    }

    @Override
    public Mono<UpdateResult<T>> updateOne(Filter filter, T patch) {
        return Mono.defer(() -> {
            ObjectNode target = first(filter);
            if (target == null) {
                return Mono.just(new UpdateResult<T>(0, 0, null));
            }
            ObjectNode changes = toNode(patch);
            List<String> unset = new ArrayList<>();
            changes.fieldNames().forEachRemaining(field -> {
                if (changes.get(field).isNull()) {
                    unset.add(field);
                }
            });
            changes.remove(unset);
            ObjectNode updated;
            synchronized (documents) {
                target.setAll(changes);
                updated = target.deepCopy();
            }
            return afterUpdate(target)
                    .then(onChange.get())
                    .then(Mono.fromSupplier(() -> new UpdateResult<>(1, 1, toDocument(updated))));
        });
    }

    @Override
    public Mono<DeleteResult<T>> deleteOne(Filter filter) {
        return Mono.defer(() -> {
            ObjectNode removed = null;
            synchronized (documents) {
                Iterator<ObjectNode> it = documents.iterator();
                while (it.hasNext()) {
                    ObjectNode candidate = it.next();
                    if (FilterMatcher.matches(filter, candidate)) {
                        it.remove();
                        removed = candidate;
                        break;
                    }
                }
            }
            if (removed == null) {
                return Mono.just(new DeleteResult<T>(0, null));
            }
            afterRemove(removed);
            ObjectNode deleted = removed;
            return onChange.get().then(Mono.fromSupplier(() -> new DeleteResult<>(1, toDocument(deleted))));
        });
    }

    /**
     * Hook run before a new document becomes visible.
     */
    protected Mono<Void> beforeInsert(ObjectNode node) {
        return Mono.empty();
    }

    protected Mono<Void> afterUpdate(ObjectNode node) {
        return Mono.empty();
    }

    protected void afterRemove(ObjectNode node) {
    }

    protected List<ObjectNode> matching(Filter filter) {
        List<ObjectNode> result = new ArrayList<>();
        synchronized (documents) {
            for (ObjectNode node : documents) {
                if (FilterMatcher.matches(filter, node)) {
                    result.add(node);
                }
            }
        }
        return result;
    }

    private ObjectNode first(Filter filter) {
        synchronized (documents) {
            for (ObjectNode node : documents) {
                if (FilterMatcher.matches(filter, node)) {
                    return node;
                }
            }
        }
        return null;
    }

    protected ObjectNode toNode(T document) {
        return objectMapper.valueToTree(document);
    }

    protected T toDocument(ObjectNode node) {
        try {
            return objectMapper.convertValue(node.deepCopy(), schema);
        } catch (IllegalArgumentException e) {
            throw new InvalidContentException("Malformed document in collection " + name, e);
        }
    }
}
