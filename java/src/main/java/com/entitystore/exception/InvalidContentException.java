package com.entitystore.exception;

/**
 * Thrown when a stored payload cannot be deserialized.
 */
public class InvalidContentException extends EntityStoreException {

    public InvalidContentException(String message, Throwable cause) {
        super(message, cause);
    }
}
