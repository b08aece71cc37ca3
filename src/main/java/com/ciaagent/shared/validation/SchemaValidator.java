package com.ciaagent.shared.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON Schema (draft 7) validation with a bounded cache of compiled schemas.
 */
public class SchemaValidator {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ObjectReader STRICT_READER = MAPPER.reader()
            .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    private static final int DEFAULT_CACHE_SIZE = 100;

    private final JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
    private final int maxCacheSize;
    private final Map<String, JsonSchema> cache;

    public SchemaValidator() {
        this(DEFAULT_CACHE_SIZE);
    }

    public SchemaValidator(int maxCacheSize) {
        this.maxCacheSize = maxCacheSize;
        this.cache = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, JsonSchema> eldest) {
                return size() > SchemaValidator.this.maxCacheSize;
            }
        };
    }

    /**
     * Parses {@code text} as exactly one JSON value and validates it. Parse failures,
     * trailing text included, are reported as a validation error.
     */
    public SchemaValidationResult validate(String text, JsonNode schema) {
        JsonNode data;
        try {
            data = STRICT_READER.readTree(text == null ? "" : text);
        } catch (JsonProcessingException e) {
            return SchemaValidationResult.invalid(List.of("(root): Invalid JSON: " + e.getOriginalMessage()));
        }
        if (data == null || data.isMissingNode()) {
            return SchemaValidationResult.invalid(List.of("(root): Invalid JSON: empty content"));
        }
        return validate(data, schema);
    }

    public SchemaValidationResult validate(JsonNode data, JsonNode schema) {
        JsonSchema compiled;
        try {
            compiled = compile(schema);
        } catch (RuntimeException e) {
            return SchemaValidationResult.invalid(List.of("Validation error: " + e.getMessage()));
        }
        var messages = compiled.validate(data);
        if (messages.isEmpty()) {
            return SchemaValidationResult.ok(data);
        }
        return SchemaValidationResult.invalid(messages.stream()
                .sorted(Comparator.comparing(ValidationMessage::getMessage))
                .map(ValidationMessage::getMessage)
                .toList());
    }

    public synchronized JsonSchema compile(JsonNode schema) {
        var key = schema.toString();
        var cached = cache.get(key);
        if (cached != null) return cached;
        try {
            var compiled = factory.getSchema(schema);
            cache.put(key, compiled);
            return compiled;
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Schema compilation failed: " + e.getMessage(), e);
        }
    }

    public synchronized int cacheSize() {
        return cache.size();
    }

    /** Reads a schema from either an inline JSON string or a file; inline wins. */
    public static JsonNode loadSchema(String inline, String file) throws IOException {
        if (inline != null && !inline.isBlank()) {
            return MAPPER.readTree(inline);
        }
        if (file != null && !file.isBlank()) {
            return MAPPER.readTree(Files.readString(Path.of(file)));
        }
        return null;
    }
}
