package com.ciaagent.mcp;

import java.time.Instant;

public record HealthRecord(boolean connected, Instant lastCheck, int consecutiveFailures, String lastError) {}
