package com.entitystore.persistence.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;

/**
 * Vector database whose documents are persisted to a JSON file. Vectors are not
 * stored; they are recomputed with the collection's embedder when it is opened.
 */
public class JsonFileVectorDatabase extends InMemoryVectorDatabase {

    private final JsonFileStorage file;

    public JsonFileVectorDatabase(Path path, ObjectMapper objectMapper) {
        super(objectMapper);
        this.file = new JsonFileStorage(path, objectMapper);
        file.readInto(metadata, collections);
    }

    @Override
    protected Mono<Void> persist() {
        return Mono.<Void>fromRunnable(() -> file.write(metadata, collections)).subscribeOn(Schedulers.boundedElastic());
    }
}
