package com.entitystore.exception;

/**
 * Base class for all errors raised by the entity stores and their backends.
 */
public class EntityStoreException extends RuntimeException {

    public EntityStoreException(String message) {
        super(message);
    }

    public EntityStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
