package com.ciaagent.tools;

public record ToolContext(String workDir, String sessionId) {}
