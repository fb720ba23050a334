package com.entitystore.exception;

import lombok.Getter;

/**
 * Thrown for a single stored document whose version has no registered upgrade path.
 */
@Getter
public class UnmigratableDocumentException extends EntityStoreException {

    private final String documentId;
    private final String documentVersion;

    public UnmigratableDocumentException(String documentId, String documentVersion) {
        super(String.format("No migration registered for document '%s' at version %s",
                documentId, documentVersion));
        this.documentId = documentId;
        this.documentVersion = documentVersion;
    }
}
