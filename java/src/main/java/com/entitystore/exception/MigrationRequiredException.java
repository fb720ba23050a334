package com.entitystore.exception;

/**
 * Thrown at open time when persisted data is older than the store schema
 * and the store was opened with migrations disallowed.
 */
public class MigrationRequiredException extends EntityStoreException {

    public MigrationRequiredException(String storeName, String persistedVersion, String runtimeVersion) {
        super(String.format("Migration required for %s (persisted %s, runtime %s)",
                storeName, persistedVersion, runtimeVersion));
    }
}
