package com.entitystore.persistence;

import com.fasterxml.jackson.databind.node.ObjectNode;
import reactor.core.publisher.Mono;

/**
 * Turns a raw stored document into one at the current schema version.
 * An empty result drops the document; an error quarantines it.
 */
@FunctionalInterface
public interface DocumentLoader {

    Mono<ObjectNode> load(ObjectNode rawDocument);

    static DocumentLoader identity() {
        return Mono::just;
    }
}
