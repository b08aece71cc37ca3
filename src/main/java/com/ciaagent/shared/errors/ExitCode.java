package com.ciaagent.shared.errors;

public enum ExitCode {
    SUCCESS(0, "Command completed successfully"),
    INPUT_VALIDATION(1, "Invalid command line arguments or options"),
    SCHEMA_VALIDATION(2, "Schema validation failed"),
    AUTH_CONFIG(3, "Authentication or configuration error"),
    LLM_EXECUTION(4, "LLM execution failed"),
    TIMEOUT(5, "Operation timed out");

    private final int code;
    private final String description;

    ExitCode(int code, String description) {
        this.code = code;
        this.description = description;
    }

    public int code() { return code; }
    public String description() { return description; }
}
