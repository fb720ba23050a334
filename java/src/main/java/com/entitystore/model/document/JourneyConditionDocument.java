package com.entitystore.model.document;

import com.entitystore.persistence.BaseDocument;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Join row between a journey and one of its activation conditions (a guideline id).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class JourneyConditionDocument implements BaseDocument {

    public static final String JOURNEY_ID_FIELD = "journey_id";
    public static final String CONDITION_FIELD = "condition";

    @JsonProperty("id")
    private String id;

    @JsonProperty("version")
    private String version;

    @JsonProperty("creation_utc")
    private String creationUtc;

    @JsonProperty(JOURNEY_ID_FIELD)
    private String journeyId;

    @JsonProperty(CONDITION_FIELD)
    private String condition;
}
