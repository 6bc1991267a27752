package com.example.investigator.tools;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/** Canned tool outputs for every catalogued tool; unscripted tools return an empty output. */
public class ScriptedTools {

    private final Map<String, String> outputs = new HashMap<>();
    private final Map<String, String> failures = new HashMap<>();
    private final List<String> calls = new CopyOnWriteArrayList<>();
    private final List<Map<String, Object>> params = new CopyOnWriteArrayList<>();

    public ScriptedTools output(String tool, String output) {
        outputs.put(tool, output);
        return this;
    }

    public ScriptedTools fail(String tool, String message) {
        failures.put(tool, message);
        return this;
    }

    public List<String> calls() {
        return List.copyOf(calls);
    }

    /** Parameters of the most recent call to {@code tool}, or null. */
    public Map<String, Object> lastParams(String tool) {
        for (int i = calls.size() - 1; i >= 0; i--) {
            if (calls.get(i).equals(tool)) {
                return params.get(i);
            }
        }
        return null;
    }

    public ToolCatalog catalog() {
        List<ToolCapability> tools = new ArrayList<>();
        for (ToolCatalog.ToolSpec spec : ToolCatalog.SPECS) {
            tools.add(tool(spec.name()));
        }
        return new ToolCatalog(tools);
    }

    private ToolCapability tool(String name) {
        return new ToolCapability() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public ToolResult call(Map<String, Object> args) throws ToolCallException {
                calls.add(name);
                params.add(args);
                if (failures.containsKey(name)) {
                    throw new ToolCallException(name, failures.get(name));
                }
                return new ToolResult(name, outputs.getOrDefault(name, ""));
            }
        };
    }
}
