package com.entitystore.util;

/**
 * How a store derives identifiers for new entities and associations.
 */
public enum IdPolicy {

    /** Identifier derived from the content checksum; identical content maps to the same id. */
    CONTENT_ADDRESSED,

    /** Identifier unrelated to content. */
    RANDOM
}
