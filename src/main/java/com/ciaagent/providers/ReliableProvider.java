package com.ciaagent.providers;

import com.ciaagent.observability.MetricsConfig;
import com.ciaagent.shared.config.ReliabilityConfig;
import com.ciaagent.shared.errors.CommonErrors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Decorator: retries a streaming provider call on transient failures with backoff.
 * Each attempt is collected in full; only a successful attempt reaches the caller.
 * Authentication, not-found and contract failures are not retried.
 */
public class ReliableProvider implements ModelProvider {

    private static final Logger log = LoggerFactory.getLogger(ReliableProvider.class);

    private final ModelProvider delegate;
    private final ReliabilityConfig config;
    private final MetricsConfig metrics;
    private final ResilientCall.Sleeper sleeper;
    private final Clock clock;

    public ReliableProvider(ModelProvider delegate, ReliabilityConfig config, MetricsConfig metrics) {
        this(delegate, config, metrics, ResilientCall.THREAD_SLEEPER, Clock.systemUTC());
    }

    ReliableProvider(ModelProvider delegate, ReliabilityConfig config, MetricsConfig metrics,
                     ResilientCall.Sleeper sleeper, Clock clock) {
        this.delegate = delegate;
        this.config = config;
        this.metrics = metrics;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    @Override
    public String id() { return "reliable-" + delegate.id(); }

    @Override
    public List<String> listModels() {
        return delegate.listModels();
    }

    @Override
    public Iterator<ChatChunk> sendQuery(ChatRequest request) {
        if (config.retries() <= 0) {
            return new PassThrough(request);
        }

        int maxRetries = config.retries();
        long minDelay = ResilientCall.minDelayMs(config.backoff());
        long windowMs = Math.max(config.retryTimeoutMs(), (maxRetries + 1) * minDelay);
        long deadline = clock.millis() + windowMs;
        String lastError = null;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (attempt > 0 && clock.millis() >= deadline) {
                return unreliable("Retry window timed out after " + windowMs + "ms");
            }
            var outcome = attempt(request);
            if (outcome.succeeded()) {
                if (attempt > 0) {
                    log.info("Provider {} recovered on attempt {}", delegate.id(), attempt + 1);
                }
                return outcome.chunks().iterator();
            }
            if (outcome.nonRetryable()) {
                log.warn("Provider {} failed with non-retryable error: {}", delegate.id(), outcome.error());
                return unreliable(outcome.error());
            }
            lastError = outcome.error();
            if (attempt < maxRetries) {
                long wait = Math.min(ResilientCall.delayMs(attempt, config.backoff(), config.retryTimeoutMs()),
                        Math.max(0, deadline - clock.millis()));
                log.warn("Provider {} attempt {}/{} failed: {}; retrying in {}ms",
                        delegate.id(), attempt + 1, maxRetries + 1, lastError, wait);
                metrics.providerRetries().increment();
                try {
                    sleeper.sleep(wait);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return unreliable("Interrupted during retry: " + lastError);
                }
            }
        }
        return List.of(ChatChunk.error(CommonErrors.retryExhausted(maxRetries, lastError).summary())).iterator();
    }

    private Attempt attempt(ChatRequest request) {
        var chunks = new ArrayList<ChatChunk>();
        try {
            var stream = delegate.sendQuery(request);
            while (stream.hasNext()) {
                var chunk = stream.next();
                if (config.contractValidation()) {
                    var violation = ContractValidator.check(chunk);
                    if (violation != null) {
                        return Attempt.failed(violation, true);
                    }
                }
                if (chunk.is(ChatChunk.ERROR)) {
                    var message = chunk.content() != null ? chunk.content() : "Provider returned an error chunk";
                    return Attempt.failed(message, ResilientCall.isNonRetryable(message));
                }
                chunks.add(chunk);
                if (chunk.isTerminal()) break;
            }
        } catch (RuntimeException e) {
            var message = ResilientCall.messageOf(e);
            return Attempt.failed(message, ResilientCall.isNonRetryable(message));
        }
        return new Attempt(chunks, null, false);
    }

    private Iterator<ChatChunk> unreliable(String reason) {
        return List.of(ChatChunk.error(CommonErrors.providerUnreliable(id(), reason).summary())).iterator();
    }

    private record Attempt(List<ChatChunk> chunks, String error, boolean nonRetryable) {
        static Attempt failed(String error, boolean nonRetryable) {
            return new Attempt(List.of(), error, nonRetryable);
        }

        boolean succeeded() { return error == null; }
    }

    /**
     * Zero retries: chunks stream straight through; a failure becomes a single
     * terminal error chunk and the stream ends.
     */
    private final class PassThrough implements Iterator<ChatChunk> {

        private final ChatRequest request;
        private Iterator<ChatChunk> source;
        private ChatChunk next;
        private boolean done;

        PassThrough(ChatRequest request) {
            this.request = request;
        }

        @Override
        public boolean hasNext() {
            if (next != null) return true;
            if (done) return false;
            try {
                if (source == null) source = delegate.sendQuery(request);
                if (!source.hasNext()) {
                    done = true;
                    return false;
                }
                var chunk = source.next();
                var violation = config.contractValidation() ? ContractValidator.check(chunk) : null;
                if (violation != null) {
                    next = ChatChunk.error(CommonErrors.providerUnreliable(id(), violation).summary());
                } else if (chunk.is(ChatChunk.ERROR)) {
                    next = ChatChunk.error(CommonErrors.retryExhausted(0, chunk.content()).summary());
                } else {
                    next = chunk;
                }
            } catch (RuntimeException e) {
                next = ChatChunk.error(CommonErrors.retryExhausted(0, ResilientCall.messageOf(e)).summary());
            }
            if (next.isTerminal()) done = true;
            return true;
        }

        @Override
        public ChatChunk next() {
            if (!hasNext()) throw new NoSuchElementException();
            var chunk = next;
            next = null;
            return chunk;
        }
    }
}
