package com.ciaagent.tools;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ToolRegistryTest {

    private static Tool named(String name) {
        return new Tool() {
            @Override public String name() { return name; }
            @Override public String description() { return name; }
            @Override public JsonNode inputSchema() { return null; }
            @Override public ToolResult execute(ToolContext ctx, JsonNode input) { return new ToolResult(name, false); }
        };
    }

    @Test
    void rejectsDuplicateRegistration() {
        var registry = new ToolRegistry();
        registry.register(named("a"));

        assertThrows(IllegalArgumentException.class, () -> registry.register(named("a")));
        assertFalse(registry.registerIfAbsent(named("a")));
        assertTrue(registry.registerIfAbsent(named("b")));
        assertEquals(2, registry.all().size());
    }

    @Test
    void unregisterRemovesTool() {
        var registry = new ToolRegistry();
        registry.register(named("a"));

        assertTrue(registry.unregister("a"));
        assertFalse(registry.unregister("a"));
        assertNull(registry.get("a"));
    }
}
