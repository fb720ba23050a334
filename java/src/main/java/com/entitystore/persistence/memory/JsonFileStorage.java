package com.entitystore.persistence.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads and atomically rewrites a database file of the form
 * <pre>
 * { "metadata": { ... }, "collections": { "name": [ {...}, ... ] } }
 * </pre>
 */
@Slf4j
class JsonFileStorage {

    private final Path path;
    private final ObjectMapper objectMapper;
    private final Object fileLock = new Object();

    JsonFileStorage(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    void readInto(Map<String, Object> metadata, Map<String, List<ObjectNode>> collections) {
        if (!Files.exists(path)) {
            return;
        }
        try {
            JsonNode root = objectMapper.readTree(path.toFile());
            Iterator<Map.Entry<String, JsonNode>> entries = root.path("metadata").fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                metadata.put(entry.getKey(), objectMapper.treeToValue(entry.getValue(), Object.class));
            }
            Iterator<Map.Entry<String, JsonNode>> stored = root.path("collections").fields();
            while (stored.hasNext()) {
                Map.Entry<String, JsonNode> entry = stored.next();
                List<ObjectNode> documents = Collections.synchronizedList(new ArrayList<>());
                for (JsonNode document : entry.getValue()) {
                    if (document.isObject()) {
                        documents.add((ObjectNode) document);
                    }
                }
                collections.put(entry.getKey(), documents);
            }
            log.info("Loaded {} collections from {}", collections.size(), path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read database file " + path, e);
        }
    }

    void write(Map<String, Object> metadata, Map<String, List<ObjectNode>> collections) {
        synchronized (fileLock) {
            ObjectNode root = objectMapper.createObjectNode();
            root.set("metadata", objectMapper.valueToTree(metadata));
            ObjectNode stored = root.putObject("collections");
            collections.forEach((name, documents) -> {
                ArrayNode array = stored.putArray(name);
                synchronized (documents) {
                    documents.forEach(document -> array.add(document.deepCopy()));
                }
            });
            try {
                Path parent = path.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Path temp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), root);
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write database file " + path, e);
            }
        }
    }
}
