package com.entitystore.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update of a journey. Conditions and tags have their own operations.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JourneyUpdateParams {

    private String title;

    private String description;
}
