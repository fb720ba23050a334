package com.entitystore.persistence.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;

/**
 * Document database persisted to a single JSON file.
 * The whole file is rewritten after every change.
 */
public class JsonFileDocumentDatabase extends InMemoryDocumentDatabase {

    private final JsonFileStorage file;

    public JsonFileDocumentDatabase(Path path, ObjectMapper objectMapper) {
        super(objectMapper);
        this.file = new JsonFileStorage(path, objectMapper);
        file.readInto(metadata, collections);
    }

    @Override
    protected Mono<Void> persist() {
        return Mono.<Void>fromRunnable(() -> file.write(metadata, collections)).subscribeOn(Schedulers.boundedElastic());
    }
}
