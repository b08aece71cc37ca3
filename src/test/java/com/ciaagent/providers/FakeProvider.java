package com.ciaagent.providers;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/** Plays back one scripted response per call; the last script repeats. */
class FakeProvider implements ModelProvider {

    final AtomicInteger calls = new AtomicInteger();
    private final List<Supplier<List<ChatChunk>>> script = new ArrayList<>();

    FakeProvider then(ChatChunk... chunks) {
        script.add(() -> List.of(chunks));
        return this;
    }

    FakeProvider thenThrow(String message) {
        script.add(() -> { throw new RuntimeException(message); });
        return this;
    }

    @Override
    public String id() { return "fake"; }

    @Override
    public Iterator<ChatChunk> sendQuery(ChatRequest request) {
        int call = calls.getAndIncrement();
        return script.get(Math.min(call, script.size() - 1)).get().iterator();
    }

    static List<ChatChunk> drain(Iterator<ChatChunk> stream) {
        var chunks = new ArrayList<ChatChunk>();
        stream.forEachRemaining(chunks::add);
        return chunks;
    }
}
