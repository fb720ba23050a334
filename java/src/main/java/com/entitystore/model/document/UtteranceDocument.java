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
 * Structured record of an utterance. {@code fields} and {@code queries} are JSON strings.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class UtteranceDocument implements BaseDocument {

    @JsonProperty("id")
    private String id;

    @JsonProperty("version")
    private String version;

    @JsonProperty("creation_utc")
    private String creationUtc;

    @JsonProperty("value")
    private String value;

    @JsonProperty("fields")
    private String fields;

    @JsonProperty("queries")
    private String queries;

    @JsonProperty("checksum")
    private String checksum;
}
