package com.entitystore.persistence;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Outcome of {@code updateOne}; {@code updatedDocument} is null when nothing matched.
 */
@Data
@AllArgsConstructor
public class UpdateResult<T> {

    private long matchedCount;
    private long modifiedCount;
    private T updatedDocument;
}
