package com.ciaagent.mcp;

import com.fasterxml.jackson.databind.JsonNode;

/** A tool as a server describes it, before it is bound into the catalog. */
public record McpToolDef(String name, String description, JsonNode inputSchema) {}
