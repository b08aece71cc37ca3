package com.ciaagent.providers;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry classification and backoff shared by the provider decorators.
 */
public final class ResilientCall {

    static final long BACKOFF_MIN_DELAY_MS = 1_000;
    static final long FIXED_DELAY_MS = 500;
    private static final int BACKOFF_FACTOR = 2;

    private static final List<String> NON_RETRYABLE = List.of(
        "auth", "unauthorized", "forbidden", "invalid api key",
        "401", "403", "404", "not found", "does not exist",
        "contract validation failed"
    );

    private static final List<String> SCHEMA_NON_RETRYABLE = List.of(
        "auth", "forbidden", "not found", "invalid api key",
        "quota exceeded", "rate limit", "billing", "payment", "subscription"
    );

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long ms) throws InterruptedException;
    }

    public static final Sleeper THREAD_SLEEPER = Thread::sleep;

    private ResilientCall() {}

    /** Authentication, authorization and not-found failures will not heal on retry. */
    public static boolean isNonRetryable(String message) {
        return matches(message, NON_RETRYABLE);
    }

    static boolean isSchemaNonRetryable(String message) {
        return matches(message, SCHEMA_NON_RETRYABLE);
    }

    static long minDelayMs(boolean backoff) {
        return backoff ? BACKOFF_MIN_DELAY_MS : FIXED_DELAY_MS;
    }

    /**
     * Delay before retry number {@code retry} (0-based). Exponential with jitter when
     * backoff is on, otherwise a fixed minimal delay; never above {@code maxDelayMs}.
     */
    public static long delayMs(int retry, boolean backoff, long maxDelayMs) {
        if (!backoff) {
            return Math.min(FIXED_DELAY_MS, maxDelayMs);
        }
        double jitter = 1 + ThreadLocalRandom.current().nextDouble();
        double delay = BACKOFF_MIN_DELAY_MS * Math.pow(BACKOFF_FACTOR, retry) * jitter;
        return (long) Math.min(delay, maxDelayMs);
    }

    static String messageOf(Throwable t) {
        var msg = t.getMessage();
        return msg != null ? msg : t.getClass().getSimpleName();
    }

    private static boolean matches(String message, List<String> patterns) {
        if (message == null) return false;
        var lower = message.toLowerCase(Locale.ROOT);
        return patterns.stream().anyMatch(lower::contains);
    }
}
