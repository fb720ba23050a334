package com.entitystore.persistence.postgres;

import java.util.regex.Pattern;

/**
 * Naming and DDL for collection tables.
 */
final class PostgresTables {

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,62}");

    private PostgresTables() {
    }

    static String quote(String name) {
        if (!TABLE_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid collection name: " + name);
        }
        return "\"" + name + "\"";
    }

    static String documentTableDdl(String name) {
        return "CREATE TABLE IF NOT EXISTS " + quote(name)
                + " (seq BIGSERIAL PRIMARY KEY, id TEXT, document JSONB NOT NULL)";
    }

    static String vectorTableDdl(String name) {
        return "CREATE TABLE IF NOT EXISTS " + quote(name)
                + " (seq BIGSERIAL PRIMARY KEY, id TEXT, document JSONB NOT NULL, embedding vector)";
    }
}
