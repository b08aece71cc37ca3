package com.ciaagent.shared.validation;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public record SchemaValidationResult(boolean valid, List<String> errors, JsonNode data) {

    public static SchemaValidationResult ok(JsonNode data) {
        return new SchemaValidationResult(true, List.of(), data);
    }

    public static SchemaValidationResult invalid(List<String> errors) {
        return new SchemaValidationResult(false, List.copyOf(errors), null);
    }

    public String formatErrors() {
        if (valid) return "";
        return errors.isEmpty() ? "Unknown validation error" : String.join("; ", errors);
    }
}
