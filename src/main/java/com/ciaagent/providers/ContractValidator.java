package com.ciaagent.providers;

import java.util.Set;

public final class ContractValidator {

    private static final Set<String> ALLOWED_CHUNK_TYPES = Set.of(
        ChatChunk.ASSISTANT, ChatChunk.RESULT, ChatChunk.SYSTEM,
        ChatChunk.TOOL, ChatChunk.THINKING, ChatChunk.ERROR
    );

    private ContractValidator() {}

    public static boolean validateChunkType(ChatChunk chunk) {
        return chunk.type() != null && ALLOWED_CHUNK_TYPES.contains(chunk.type());
    }

    /** Result chunks must name the session they close. */
    public static boolean validateSessionId(ChatChunk chunk) {
        if (!chunk.is(ChatChunk.RESULT)) return true;
        return chunk.sessionId() != null && !chunk.sessionId().isBlank();
    }

    /** @return the violation message, or null when the chunk honours the contract */
    public static String check(ChatChunk chunk) {
        if (!validateChunkType(chunk)) {
            return "Contract validation failed: Invalid chunk type: " + chunk.type();
        }
        if (!validateSessionId(chunk)) {
            return "Contract validation failed: Missing or invalid sessionId in result chunk";
        }
        return null;
    }
}
