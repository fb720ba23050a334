package com.entitystore.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Runs a {@link DocumentLoader} over every document of a collection being opened.
 *
 * A failing document never aborts the open: it is reported as {@link Kind#FAILED}
 * and the backend moves it, unchanged, to {@code <collection>_failed_migrations}.
 */
@Slf4j
public final class CollectionLoader {

    public static final String FAILED_MIGRATIONS_SUFFIX = "_failed_migrations";

    private CollectionLoader() {
    }

    public static String failedMigrationsCollection(String collection) {
        return collection + FAILED_MIGRATIONS_SUFFIX;
    }

    public enum Kind {
        /** Already at the current version. */
        LOADED,
        /** Upgraded; must be written back in place. */
        MIGRATED,
        /** Dropped by a converter or not migratable; must be quarantined. */
        FAILED
    }

    @Getter
    @AllArgsConstructor(access = AccessLevel.PRIVATE)
    public static final class Outcome {
        private final Kind kind;
        private final ObjectNode original;
        private final ObjectNode document;
        private final Throwable failure;

        public boolean isUsable() {
            return kind != Kind.FAILED;
        }
    }

    public static Flux<Outcome> load(String collection, Flux<ObjectNode> rawDocuments, DocumentLoader loader) {
        return rawDocuments.concatMap(raw -> loadOne(collection, raw, loader));
    }

    static Mono<Outcome> loadOne(String collection, ObjectNode raw, DocumentLoader loader) {
        return Mono.defer(() -> loader.load(raw.deepCopy()))
                .map(loaded -> loaded.equals(raw)
                        ? new Outcome(Kind.LOADED, raw, loaded, null)
                        : new Outcome(Kind.MIGRATED, raw, loaded, null))
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.warn("Document {} in {} was dropped during migration", describe(raw), collection);
                    return new Outcome(Kind.FAILED, raw, null, null);
                }))
                .onErrorResume(error -> {
                    log.warn("Failed to migrate document {} in {}: {}", describe(raw), collection, error.getMessage());
                    return Mono.just(new Outcome(Kind.FAILED, raw, null, error));
                });
    }

    public static void logSummary(String collection, List<Outcome> outcomes) {
        long migrated = outcomes.stream().filter(o -> o.getKind() == Kind.MIGRATED).count();
        long failed = outcomes.stream().filter(o -> o.getKind() == Kind.FAILED).count();
        if (migrated > 0 || failed > 0) {
            log.info("Opened collection {}: {} documents, {} migrated, {} moved to {}",
                    collection, outcomes.size(), migrated, failed, failedMigrationsCollection(collection));
        } else {
            log.debug("Opened collection {}: {} documents", collection, outcomes.size());
        }
    }

    private static String describe(ObjectNode raw) {
        JsonNode id = raw.get(BaseDocument.ID_FIELD);
        JsonNode version = raw.get(BaseDocument.VERSION_FIELD);
        return String.format("'%s' (version %s)",
                id == null ? "?" : id.asText(),
                version == null ? "?" : version.asText());
    }
}
