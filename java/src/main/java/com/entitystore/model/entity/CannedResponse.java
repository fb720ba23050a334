package com.entitystore.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A pre-written agent response. Identity is the id alone.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class CannedResponse implements TaggedEntity {

    @EqualsAndHashCode.Include
    private String id;

    private OffsetDateTime creationUtc;

    private String value;

    @Builder.Default
    private List<ResponseField> fields = List.of();

    @Builder.Default
    private List<String> signals = List.of();

    @Builder.Default
    private Set<String> tags = new LinkedHashSet<>();
}
