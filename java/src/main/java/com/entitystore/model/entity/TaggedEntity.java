package com.entitystore.model.entity;

import java.time.OffsetDateTime;
import java.util.Set;

/**
 * What every store-managed entity exposes to the shared store machinery.
 */
public interface TaggedEntity {

    String getId();

    OffsetDateTime getCreationUtc();

    Set<String> getTags();
}
