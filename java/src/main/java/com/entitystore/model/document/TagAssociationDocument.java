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
 * Join row between an entity and a tag.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TagAssociationDocument implements BaseDocument {

    public static final String ENTITY_ID_FIELD = "entity_id";
    public static final String TAG_ID_FIELD = "tag_id";

    @JsonProperty("id")
    private String id;

    @JsonProperty("version")
    private String version;

    @JsonProperty("creation_utc")
    private String creationUtc;

    @JsonProperty(ENTITY_ID_FIELD)
    private String entityId;

    @JsonProperty(TAG_ID_FIELD)
    private String tagId;
}
