package com.entitystore.service;

import com.entitystore.exception.InvalidContentException;
import com.entitystore.model.entity.ResponseField;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Converts the sub-fields that structured records keep as JSON strings.
 */
class ResponseFieldCodec {

    private static final TypeReference<List<ResponseField>> FIELD_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    ResponseFieldCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    String writeFields(List<ResponseField> fields) {
        return write(fields == null ? List.of() : fields);
    }

    String writeStrings(List<String> values) {
        return write(values == null ? List.of() : values);
    }

    List<ResponseField> readFields(String json) {
        return json == null ? List.of() : read(json, FIELD_LIST, "fields");
    }

    List<String> readStrings(String json, String what) {
        return json == null ? List.of() : read(json, STRING_LIST, what);
    }

    static OffsetDateTime readTimestamp(String value) {
        if (value == null) {
            throw new InvalidContentException("Missing creation_utc", null);
        }
        try {
            return OffsetDateTime.parse(value);
        } catch (DateTimeParseException e) {
            throw new InvalidContentException("Malformed creation_utc: " + value, e);
        }
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new InvalidContentException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T read(String json, TypeReference<T> type, String what) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new InvalidContentException("Malformed " + what + ": " + e.getOriginalMessage(), e);
        }
    }
}
