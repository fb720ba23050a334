package com.entitystore.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A multi-step conversational flow, activated when any of its conditions holds.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Journey implements TaggedEntity {

    @EqualsAndHashCode.Include
    private String id;

    private OffsetDateTime creationUtc;

    private String title;

    private String description;

    @Builder.Default
    private Set<String> conditions = new LinkedHashSet<>();

    @Builder.Default
    private Set<String> tags = new LinkedHashSet<>();
}
