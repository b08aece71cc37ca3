package com.ciaagent.mcp;

public record ServerInfo(String name, ServerStatus status) {}
