package com.entitystore.model.dto;

import com.entitystore.model.entity.ResponseField;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Partial update of an utterance. Null fields keep their stored value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UtteranceUpdateParams {

    private String value;

    private List<ResponseField> fields;

    private List<String> queries;
}
