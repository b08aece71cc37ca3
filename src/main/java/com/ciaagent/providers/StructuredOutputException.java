package com.ciaagent.providers;

import com.ciaagent.shared.errors.ExitCode;

/**
 * Terminal structured-output failure. Never retried and never turned into a chunk.
 */
public class StructuredOutputException extends RuntimeException {

    private final int retries;

    public StructuredOutputException(String message, int retries, Throwable cause) {
        super(message, cause);
        this.retries = retries;
    }

    public int retries() { return retries; }

    public ExitCode exitCode() { return ExitCode.SCHEMA_VALIDATION; }
}
