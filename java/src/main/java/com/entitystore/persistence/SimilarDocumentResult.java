package com.entitystore.persistence;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A nearest-neighbour hit. Lower distance means more similar.
 */
@Data
@AllArgsConstructor
public class SimilarDocumentResult<T> {

    private T document;
    private double distance;
}
