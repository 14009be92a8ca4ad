package com.discernus.gasket;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Declared shape of a structured payload. Required fields may be dotted paths
 * ({@code scores.care}) into nested objects.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PayloadSchema(String name, List<String> requiredFields) {

    public PayloadSchema {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Schema name is required");
        }
        requiredFields = requiredFields == null ? List.of() : List.copyOf(requiredFields);
    }

    public static PayloadSchema of(String name, String... requiredFields) {
        return new PayloadSchema(name, List.of(requiredFields));
    }

    public List<String> missingFields(JsonNode payload) {
        List<String> missing = new ArrayList<>();
        for (String field : requiredFields) {
            JsonNode current = payload;
            for (String segment : field.split("\\.")) {
                current = current == null ? null : current.get(segment);
            }
            if (current == null || current.isNull() || current.isMissingNode()) {
                missing.add(field);
            }
        }
        return missing;
    }

    public boolean requiresObject() {
        return !requiredFields.isEmpty();
    }
}
