package com.ciaagent.shared.validation;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SchemaValidatorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void validatesRequiredProperty() throws Exception {
        var schema = MAPPER.readTree("{\"type\":\"object\",\"required\":[\"message\"]}");
        var validator = new SchemaValidator();

        assertTrue(validator.validate("{\"message\":\"ok\"}", schema).valid());
        var invalid = validator.validate("{\"wrong\":\"field\"}", schema);
        assertFalse(invalid.valid());
        assertTrue(invalid.formatErrors().contains("message"));
    }

    @Test
    void reportsParseFailures() throws Exception {
        var schema = MAPPER.readTree("{\"type\":\"object\"}");

        var result = new SchemaValidator().validate("{not json", schema);

        assertFalse(result.valid());
        assertTrue(result.errors().get(0).startsWith("(root): Invalid JSON"));
    }

    @Test
    void rejectsTextAfterTheJsonValue() throws Exception {
        var schema = MAPPER.readTree("{\"type\":\"object\",\"required\":[\"message\"]}");
        var validator = new SchemaValidator();

        var trailing = validator.validate("{\"message\":\"ok\"} this is not json", schema);
        var concatenated = validator.validate("{\"message\":\"a\"}{\"message\":\"b\"}", schema);

        assertFalse(trailing.valid());
        assertTrue(trailing.errors().get(0).startsWith("(root): Invalid JSON"));
        assertFalse(concatenated.valid());
        assertTrue(validator.validate("  {\"message\":\"ok\"}\n", schema).valid());
    }

    @Test
    void cachesCompiledSchemasUpToLimit() throws Exception {
        var validator = new SchemaValidator(2);
        for (var type : new String[] { "object", "array", "string" }) {
            validator.validate("{}", MAPPER.readTree("{\"type\":\"" + type + "\"}"));
        }
        assertEquals(2, validator.cacheSize());
    }

    @Test
    void inlineSchemaWinsOverFile() throws Exception {
        var file = tempDir.resolve("schema.json");
        Files.writeString(file, "{\"type\":\"array\"}");

        assertEquals("object", SchemaValidator.loadSchema("{\"type\":\"object\"}", file.toString()).get("type").asText());
        assertEquals("array", SchemaValidator.loadSchema(null, file.toString()).get("type").asText());
        assertNull(SchemaValidator.loadSchema(null, null));
    }
}
