package com.ciaagent.tools;

public record ToolResult(String output, boolean isError) {}
