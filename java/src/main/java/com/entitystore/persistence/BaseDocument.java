package com.entitystore.persistence;

/**
 * Minimal shape every stored document has: an identifier and the schema version it was written with.
 */
public interface BaseDocument {

    String ID_FIELD = "id";
    String VERSION_FIELD = "version";

    String getId();

    String getVersion();
}
