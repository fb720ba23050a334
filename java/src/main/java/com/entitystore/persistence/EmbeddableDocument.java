package com.entitystore.persistence;

/**
 * A vector-backend document; {@link #getContent()} is the text that gets embedded.
 */
public interface EmbeddableDocument extends BaseDocument {

    String getContent();

    String getChecksum();
}
