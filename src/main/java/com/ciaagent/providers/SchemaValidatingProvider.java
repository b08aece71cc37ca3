package com.ciaagent.providers;

import com.ciaagent.shared.validation.SchemaValidator;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Decorator: constrains the assistant response to a JSON Schema.
 * <p>
 * Non-assistant chunks stream through as they arrive. Assistant chunks are held
 * until the attempt ends, joined, parsed and validated; the closing {@code result}
 * chunk is held with them so it still ends the stream. An invalid response discards
 * the attempt and re-runs the whole underlying call, up to {@code maxRetries} times,
 * after which a {@link StructuredOutputException} is thrown from the iterator.
 * Provider {@code error} chunks end the stream unvalidated.
 */
public class SchemaValidatingProvider implements ModelProvider {

    private static final Logger log = LoggerFactory.getLogger(SchemaValidatingProvider.class);

    private final ModelProvider delegate;
    private final JsonNode schema;
    private final int maxRetries;
    private final boolean backoff;
    private final long retryTimeoutMs;
    private final SchemaValidator validator;
    private final ResilientCall.Sleeper sleeper;

    public SchemaValidatingProvider(ModelProvider delegate, JsonNode schema, int maxRetries,
                                    boolean backoff, long retryTimeoutMs) {
        this(delegate, schema, maxRetries, backoff, retryTimeoutMs, new SchemaValidator(), ResilientCall.THREAD_SLEEPER);
    }

    SchemaValidatingProvider(ModelProvider delegate, JsonNode schema, int maxRetries, boolean backoff,
                             long retryTimeoutMs, SchemaValidator validator, ResilientCall.Sleeper sleeper) {
        this.delegate = delegate;
        this.schema = schema;
        this.maxRetries = Math.max(0, maxRetries);
        this.backoff = backoff;
        this.retryTimeoutMs = retryTimeoutMs;
        this.validator = validator;
        this.sleeper = sleeper;
    }

    @Override
    public String id() { return delegate.id(); }

    @Override
    public List<String> listModels() {
        return delegate.listModels();
    }

    @Override
    public Iterator<ChatChunk> sendQuery(ChatRequest request) {
        if (schema == null) {
            return delegate.sendQuery(request);
        }
        return new ValidatingStream(request);
    }

    private final class ValidatingStream implements Iterator<ChatChunk> {

        private final ChatRequest request;
        private final ArrayDeque<ChatChunk> ready = new ArrayDeque<>();
        private final List<ChatChunk> assistant = new ArrayList<>();
        private Iterator<ChatChunk> source;
        private ChatChunk heldResult;
        private int attempts;
        private boolean finished;

        ValidatingStream(ChatRequest request) {
            this.request = request;
        }

        @Override
        public boolean hasNext() {
            while (ready.isEmpty() && !finished) {
                advance();
            }
            return !ready.isEmpty();
        }

        @Override
        public ChatChunk next() {
            if (!hasNext()) throw new NoSuchElementException();
            return ready.poll();
        }

        private void advance() {
            try {
                if (source == null) {
                    attempts++;
                    source = delegate.sendQuery(request);
                }
                if (source.hasNext() && heldResult == null) {
                    accept(source.next());
                    return;
                }
            } catch (StructuredOutputException e) {
                throw e;
            } catch (RuntimeException e) {
                var message = ResilientCall.messageOf(e);
                if (ResilientCall.isSchemaNonRetryable(message)) {
                    finished = true;
                    throw new StructuredOutputException("Schema validation error: " + message, attempts - 1, e);
                }
                retryOrFail(message, e);
                return;
            }
            validateAttempt();
        }

        private void accept(ChatChunk chunk) {
            if (chunk.is(ChatChunk.ASSISTANT)) {
                assistant.add(chunk);
            } else if (chunk.is(ChatChunk.RESULT)) {
                heldResult = chunk;
            } else if (chunk.is(ChatChunk.ERROR)) {
                ready.add(chunk);
                finished = true;
            } else {
                ready.add(chunk);
            }
        }

        private void validateAttempt() {
            if (!assistant.isEmpty()) {
                var content = new StringBuilder();
                assistant.forEach(c -> content.append(c.content() != null ? c.content() : ""));
                var result = validator.validate(content.toString(), schema);
                if (!result.valid()) {
                    retryOrFail(result.formatErrors(), null);
                    return;
                }
            }
            ready.addAll(assistant);
            if (heldResult != null) ready.add(heldResult);
            finished = true;
        }

        private void retryOrFail(String error, Throwable cause) {
            int retriesUsed = attempts - 1;
            if (retriesUsed >= maxRetries) {
                finished = true;
                throw new StructuredOutputException(
                        "Schema validation failed after " + maxRetries + " retries: " + error, maxRetries, cause);
            }
            log.warn("Structured output attempt {}/{} rejected: {}", attempts, maxRetries + 1, error);
            assistant.clear();
            heldResult = null;
            source = null;
            try {
                sleeper.sleep(ResilientCall.delayMs(retriesUsed, backoff, retryTimeoutMs));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                finished = true;
                throw new StructuredOutputException("Schema validation interrupted: " + error, retriesUsed, e);
            }
        }
    }
}
