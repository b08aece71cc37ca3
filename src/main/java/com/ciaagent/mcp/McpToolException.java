package com.ciaagent.mcp;

public class McpToolException extends RuntimeException {

    private final String toolId;

    public McpToolException(String toolId, String message, Throwable cause) {
        super(message, cause);
        this.toolId = toolId;
    }

    public String toolId() { return toolId; }
}
