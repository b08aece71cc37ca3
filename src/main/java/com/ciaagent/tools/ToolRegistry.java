package com.ciaagent.tools;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ToolRegistry {
    private final Map<String, Tool> tools = new LinkedHashMap<>();

    public synchronized void register(Tool tool) {
        if (tools.containsKey(tool.name())) {
            throw new IllegalArgumentException("Duplicate tool: " + tool.name());
        }
        tools.put(tool.name(), tool);
    }

    /** @return false when a tool of that name is already registered */
    public synchronized boolean registerIfAbsent(Tool tool) {
        return tools.putIfAbsent(tool.name(), tool) == null;
    }

    public synchronized boolean unregister(String name) {
        return tools.remove(name) != null;
    }

    public synchronized Tool get(String name) {
        return tools.get(name);
    }

    public synchronized Collection<Tool> all() {
        return List.copyOf(tools.values());
    }
}
