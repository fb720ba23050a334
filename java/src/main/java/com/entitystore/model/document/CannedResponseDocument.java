package com.entitystore.model.document;

import com.entitystore.persistence.BaseDocument;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Structured record of a canned response.
 * {@code fields} holds the JSON-serialized field list.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CannedResponseDocument implements BaseDocument {

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

    @JsonProperty("signals")
    private List<String> signals;

    @JsonProperty("checksum")
    private String checksum;
}
