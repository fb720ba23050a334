package com.entitystore.persistence;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Outcome of {@code deleteOne}; {@code deletedDocument} is null when nothing matched.
 */
@Data
@AllArgsConstructor
public class DeleteResult<T> {

    private long deletedCount;
    private T deletedDocument;
}
