package com.ciaagent.shared.errors;

public final class CommonErrors {

    private CommonErrors() {}

    public static CliError invalidArgument(String arg, String expected) {
        return new CliError(ExitCode.INPUT_VALIDATION, "Invalid argument: " + arg,
                "Expected: " + expected, "Check your command syntax with --help");
    }

    public static CliError invalidConfig(String field, String issue) {
        return new CliError(ExitCode.INPUT_VALIDATION, "Configuration error: " + field,
                issue, "Check your config file: ~/.cia/config.yaml");
    }

    public static CliError operationFailed(String operation, String reason) {
        return new CliError(ExitCode.LLM_EXECUTION, "Operation failed: " + operation,
                reason, "Run 'cia mcp doctor' for connection diagnostics");
    }

    public static CliError schemaValidationFailed(String details) {
        return new CliError(ExitCode.SCHEMA_VALIDATION, "Schema validation failed",
                details, "Check your schema-file or schema-inline setting");
    }

    public static CliError retryExhausted(int attempts, String lastError) {
        return new CliError(ExitCode.LLM_EXECUTION,
                "Provider failed after " + attempts + " retry attempts",
                lastError, "Check your network connection and provider configuration");
    }

    public static CliError contractViolation(String details) {
        return new CliError(ExitCode.LLM_EXECUTION, "Provider contract violation detected",
                details, "This indicates a provider implementation issue - report to maintainers");
    }

    public static CliError providerUnreliable(String provider, String reason) {
        return new CliError(ExitCode.LLM_EXECUTION, "Provider '" + provider + "' reliability issue",
                reason, "Try switching providers or check provider service status");
    }

    public static CliError authRequired(String server) {
        return new CliError(ExitCode.AUTH_CONFIG, "Authentication required for " + server,
                null, "Run: cia mcp auth " + server);
    }
}
