package com.ciaagent.shared.errors;

import java.io.PrintStream;
import java.io.PrintWriter;

/**
 * User-facing error: what failed, why, and what to try next.
 */
public record CliError(ExitCode code, String message, String details, String suggestion) {

    /** Message and details on one line, the form used inside error chunks. */
    public String summary() {
        return details != null && !details.isBlank() ? message + ": " + details : message;
    }

    public String format() {
        var sb = new StringBuilder();
        sb.append(System.lineSeparator()).append("Error: ").append(message).append(System.lineSeparator());
        if (details != null && !details.isBlank()) {
            sb.append("   ").append(details).append(System.lineSeparator());
        }
        if (suggestion != null && !suggestion.isBlank()) {
            sb.append("Suggestion: ").append(suggestion).append(System.lineSeparator());
        }
        if (code != ExitCode.SUCCESS) {
            sb.append("   Exit code: ").append(code.code())
                    .append(" (").append(code.description()).append(")").append(System.lineSeparator());
        }
        return sb.toString();
    }

    public void print(PrintStream err) {
        err.println(format());
    }

    public void print(PrintWriter err) {
        err.println(format());
        err.flush();
    }
}
