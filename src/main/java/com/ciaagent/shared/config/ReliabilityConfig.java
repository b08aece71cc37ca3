package com.ciaagent.shared.config;

public record ReliabilityConfig(
    int retries,
    boolean backoff,
    long retryTimeoutMs,
    boolean contractValidation
) {
    public static ReliabilityConfig defaults() {
        return new ReliabilityConfig(3, true, 30_000, false);
    }
}
