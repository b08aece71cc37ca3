package com.ciaagent.providers;

import java.util.Iterator;
import java.util.List;

/**
 * A streaming call source. Each call to {@link #sendQuery} starts a fresh,
 * finite, non-restartable stream that ends after a {@code result} or {@code error} chunk.
 */
public interface ModelProvider {
    String id();
    Iterator<ChatChunk> sendQuery(ChatRequest request);

    default List<String> listModels() {
        return List.of();
    }
}
