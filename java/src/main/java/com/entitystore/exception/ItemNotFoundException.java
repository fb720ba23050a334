package com.entitystore.exception;

import lombok.Getter;

/**
 * Exception thrown when an entity, tag or association does not exist.
 */
@Getter
public class ItemNotFoundException extends EntityStoreException {

    private final String itemId;

    public ItemNotFoundException(String itemId) {
        super(String.format("Item '%s' not found", itemId));
        this.itemId = itemId;
    }

    public ItemNotFoundException(String itemType, String itemId) {
        super(String.format("%s with identifier '%s' not found", itemType, itemId));
        this.itemId = itemId;
    }
}
