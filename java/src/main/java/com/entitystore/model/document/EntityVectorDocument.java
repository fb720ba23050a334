package com.entitystore.model.document;

import com.entitystore.persistence.EmbeddableDocument;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One embeddable text of an entity. An entity may own several of these,
 * so search results are grouped by {@code entity_id}, never by {@code id}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class EntityVectorDocument implements EmbeddableDocument {

    public static final String ENTITY_ID_FIELD = "entity_id";

    @JsonProperty("id")
    private String id;

    @JsonProperty(ENTITY_ID_FIELD)
    private String entityId;

    @JsonProperty("version")
    private String version;

    @JsonProperty("content")
    private String content;

    @JsonProperty("checksum")
    private String checksum;
}
