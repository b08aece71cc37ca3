package com.ciaagent.providers;

import java.util.List;

public record ChatRequest(
    List<Message> messages,
    String cwd,
    String resumeSessionId
) {
    public ChatRequest {
        messages = List.copyOf(messages);
    }

    public static ChatRequest of(String prompt, String cwd) {
        return new ChatRequest(List.of(Message.user(prompt)), cwd, null);
    }
}
