package com.entitystore.exception;

/**
 * Thrown when the persisted data was written by a newer schema than this build knows.
 */
public class ServerOutdatedException extends EntityStoreException {

    public ServerOutdatedException(String storeName, String persistedVersion, String runtimeVersion) {
        super(String.format("%s data is at version %s but this server only supports %s",
                storeName, persistedVersion, runtimeVersion));
    }
}
