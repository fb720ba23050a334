package com.entitystore.persistence.migration;

import com.entitystore.exception.UnmigratableDocumentException;
import com.entitystore.persistence.BaseDocument;
import com.entitystore.persistence.DocumentLoader;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Walks a document up a linear chain of converters until it reaches the target version.
 *
 * <pre>
 *   DocumentMigrationHelper.to("0.3.0")
 *       .from("0.1.0", this::v010ToV020)
 *       .from("0.2.0", this::v020ToV030)
 *       .build();
 * </pre>
 */
public final class DocumentMigrationHelper implements DocumentLoader {

    @Getter
    private final String targetVersion;
    private final Map<String, DocumentConverter> converters;

    private DocumentMigrationHelper(String targetVersion, Map<String, DocumentConverter> converters) {
        this.targetVersion = targetVersion;
        this.converters = Collections.unmodifiableMap(converters);
    }

    public static Builder to(String targetVersion) {
        return new Builder(targetVersion);
    }

    /**
     * Upgrade {@code document} to the target version. Empty if a converter dropped it;
     * {@link UnmigratableDocumentException} if a version along the way has no converter.
     */
    public Mono<ObjectNode> migrate(ObjectNode document) {
        String version = versionOf(document);
        if (targetVersion.equals(version)) {
            return Mono.just(document);
        }
        DocumentConverter converter = version == null ? null : converters.get(version);
        if (converter == null) {
            return Mono.error(new UnmigratableDocumentException(idOf(document), version));
        }
        return converter.convert(document).flatMap(this::migrate);
    }

    @Override
    public Mono<ObjectNode> load(ObjectNode rawDocument) {
        return migrate(rawDocument);
    }

    private static String versionOf(ObjectNode document) {
        JsonNode version = document.get(BaseDocument.VERSION_FIELD);
        return version == null || version.isNull() ? null : version.asText();
    }

    private static String idOf(ObjectNode document) {
        JsonNode id = document.get(BaseDocument.ID_FIELD);
        return id == null || id.isNull() ? null : id.asText();
    }

    public static final class Builder {
        private final String targetVersion;
        private final Map<String, DocumentConverter> converters = new LinkedHashMap<>();

        private Builder(String targetVersion) {
            this.targetVersion = targetVersion;
        }

        /**
         * Register the converter applied to documents at {@code version}.
         */
        public Builder from(String version, DocumentConverter converter) {
            if (targetVersion.equals(version)) {
                throw new IllegalArgumentException("Cannot register a converter from the target version " + version);
            }
            if (converters.putIfAbsent(version, converter) != null) {
                throw new IllegalArgumentException("Converter already registered for version " + version);
            }
            return this;
        }

        public DocumentMigrationHelper build() {
            return new DocumentMigrationHelper(targetVersion, converters);
        }
    }
}
