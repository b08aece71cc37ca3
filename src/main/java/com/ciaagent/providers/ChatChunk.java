package com.ciaagent.providers;

import java.util.Map;

/**
 * One element of a streamed provider response. A {@code result} or {@code error}
 * chunk is terminal: nothing follows it.
 */
public record ChatChunk(
    String type,
    String content,
    String sessionId,
    String toolName,
    Map<String, Object> metadata
) {
    public static final String ASSISTANT = "assistant";
    public static final String RESULT = "result";
    public static final String SYSTEM = "system";
    public static final String TOOL = "tool";
    public static final String THINKING = "thinking";
    public static final String ERROR = "error";

    public ChatChunk {
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public static ChatChunk assistant(String content) {
        return new ChatChunk(ASSISTANT, content, null, null, null);
    }

    public static ChatChunk result(String sessionId) {
        return new ChatChunk(RESULT, null, sessionId, null, null);
    }

    public static ChatChunk system(String content, Map<String, Object> metadata) {
        return new ChatChunk(SYSTEM, content, null, null, metadata);
    }

    public static ChatChunk tool(String toolName, String content) {
        return new ChatChunk(TOOL, content, null, toolName, null);
    }

    public static ChatChunk error(String content) {
        return new ChatChunk(ERROR, content, null, null, null);
    }

    public boolean is(String kind) {
        return kind.equals(type);
    }

    public boolean isTerminal() {
        return RESULT.equals(type) || ERROR.equals(type);
    }
}
