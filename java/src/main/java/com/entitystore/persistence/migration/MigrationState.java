package com.entitystore.persistence.migration;

/**
 * Lifecycle of a store's schema check at open time.
 */
public enum MigrationState {
    NOT_OPENED,
    VERSION_CHECKED,
    UP_TO_DATE,
    MIGRATION_NEEDED,
    MIGRATION_DISALLOWED,
    OPEN
}
