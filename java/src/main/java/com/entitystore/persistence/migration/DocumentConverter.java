package com.entitystore.persistence.migration;

import com.fasterxml.jackson.databind.node.ObjectNode;
import reactor.core.publisher.Mono;

/**
 * Upgrades a raw document by one schema version. Completing empty drops the document.
 */
@FunctionalInterface
public interface DocumentConverter {

    Mono<ObjectNode> convert(ObjectNode document);
}
