package com.ciaagent.providers;

import com.ciaagent.shared.validation.SchemaValidator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ciaagent.providers.FakeProvider.drain;
import static org.junit.jupiter.api.Assertions.*;

class SchemaValidatingProviderTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private final ChatRequest request = ChatRequest.of("give me json", "/tmp");

    private static JsonNode schema() throws Exception {
        return MAPPER.readTree("{\"type\":\"object\",\"required\":[\"message\"]}");
    }

    private SchemaValidatingProvider validating(FakeProvider fake, JsonNode schema, int maxRetries) {
        return new SchemaValidatingProvider(fake, schema, maxRetries, true, 30_000, new SchemaValidator(), ms -> {});
    }

    @Test
    void retriesUntilResponseMatchesSchema() throws Exception {
        var fake = new FakeProvider()
                .then(ChatChunk.assistant("{\"wrong\":\"field\"}"), ChatChunk.result("s1"))
                .then(ChatChunk.assistant("{\"message\":\"ok\"}"), ChatChunk.result("s1"));

        var chunks = drain(validating(fake, schema(), 2).sendQuery(request));

        assertEquals(2, fake.calls.get());
        assertEquals(List.of(ChatChunk.assistant("{\"message\":\"ok\"}"), ChatChunk.result("s1")), chunks);
    }

    @Test
    void throwsWhenEveryAttemptIsInvalid() throws Exception {
        var fake = new FakeProvider().then(ChatChunk.assistant("{\"wrong\":\"field\"}"), ChatChunk.result("s1"));
        var stream = validating(fake, schema(), 2).sendQuery(request);

        var ex = assertThrows(StructuredOutputException.class, stream::hasNext);

        assertEquals(3, fake.calls.get());
        assertEquals(2, ex.retries());
        assertTrue(ex.getMessage().startsWith("Schema validation failed after 2 retries"));
        assertTrue(ex.getMessage().contains("message"));
    }

    @Test
    void unparseableJsonCountsAsInvalid() throws Exception {
        var fake = new FakeProvider()
                .then(ChatChunk.assistant("not json"))
                .then(ChatChunk.assistant("{\"message\":"), ChatChunk.assistant("\"split\"}"));

        var chunks = drain(validating(fake, schema(), 1).sendQuery(request));

        assertEquals(2, fake.calls.get());
        assertEquals(2, chunks.size());
        assertEquals("\"split\"}", chunks.get(1).content());
    }

    @Test
    void trailingTextAfterJsonIsRetried() throws Exception {
        var fake = new FakeProvider()
                .then(ChatChunk.assistant("{\"message\":\"ok\"}"), ChatChunk.assistant(" and some prose"),
                        ChatChunk.result("s1"))
                .then(ChatChunk.assistant("{\"message\":\"ok\"}"), ChatChunk.result("s1"));

        var chunks = drain(validating(fake, schema(), 2).sendQuery(request));

        assertEquals(2, fake.calls.get());
        assertEquals(List.of(ChatChunk.assistant("{\"message\":\"ok\"}"), ChatChunk.result("s1")), chunks);
    }

    @Test
    void nonAssistantChunksStreamBeforeValidation() throws Exception {
        var fake = new FakeProvider().then(
                ChatChunk.system("init", null),
                ChatChunk.tool("bash", "ran"),
                ChatChunk.assistant("{\"message\":\"ok\"}"),
                ChatChunk.result("s1"));

        var chunks = drain(validating(fake, schema(), 2).sendQuery(request));

        assertEquals(List.of(ChatChunk.SYSTEM, ChatChunk.TOOL, ChatChunk.ASSISTANT, ChatChunk.RESULT),
                chunks.stream().map(ChatChunk::type).toList());
    }

    @Test
    void errorChunkEndsStreamUnvalidated() throws Exception {
        var fake = new FakeProvider().then(ChatChunk.error("Provider failed after 3 retry attempts: boom"));

        var chunks = drain(validating(fake, schema(), 2).sendQuery(request));

        assertEquals(1, fake.calls.get());
        assertEquals(1, chunks.size());
        assertTrue(chunks.get(0).is(ChatChunk.ERROR));
    }

    @Test
    void quotaErrorsAreNotRetried() throws Exception {
        var fake = new FakeProvider().thenThrow("rate limit exceeded");
        var stream = validating(fake, schema(), 3).sendQuery(request);

        var ex = assertThrows(StructuredOutputException.class, stream::hasNext);

        assertEquals(1, fake.calls.get());
        assertTrue(ex.getMessage().startsWith("Schema validation error: rate limit exceeded"));
    }

    @Test
    void transientExceptionsAreRetried() throws Exception {
        var fake = new FakeProvider()
                .thenThrow("socket closed")
                .then(ChatChunk.assistant("{\"message\":\"ok\"}"), ChatChunk.result("s1"));

        var chunks = drain(validating(fake, schema(), 2).sendQuery(request));

        assertEquals(2, fake.calls.get());
        assertEquals(2, chunks.size());
    }

    @Test
    void passesThroughWithoutSchema() {
        var fake = new FakeProvider().then(ChatChunk.assistant("anything"), ChatChunk.result("s1"));

        var chunks = drain(validating(fake, null, 2).sendQuery(request));

        assertEquals(2, chunks.size());
        assertEquals(1, fake.calls.get());
    }
}
