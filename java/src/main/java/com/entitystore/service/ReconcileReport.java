package com.entitystore.service;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * What a reconciliation sweep removed.
 */
@Data
@AllArgsConstructor
public class ReconcileReport {

    private long orphanedVectorDocuments;
    private long orphanedTagAssociations;
}
