package com.entitystore.model.entity;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A named placeholder inside a response template, with examples of values it takes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResponseField {

    @JsonProperty("name")
    private String name;

    @JsonProperty("description")
    private String description;

    @JsonProperty("examples")
    private List<String> examples;
}
