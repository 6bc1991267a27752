package com.example.investigator.tools;

import com.example.investigator.model.Domain;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** The bounded set of tools visible to one specialist domain. */
public final class DomainCapabilities {

    private final Domain domain;
    private final Map<String, ToolCapability> tools;

    public DomainCapabilities(Domain domain, List<ToolCapability> tools) {
        this.domain = domain;
        Map<String, ToolCapability> byName = new LinkedHashMap<>();
        for (ToolCapability tool : tools) {
            byName.put(tool.name(), tool);
        }
        this.tools = Map.copyOf(byName);
    }

    public Domain domain() {
        return domain;
    }

    public boolean has(String name) {
        return tools.containsKey(name);
    }

    public List<String> names() {
        return tools.keySet().stream().sorted().toList();
    }

    public ToolResult call(String name, Map<String, Object> params) throws ToolCallException {
        ToolCapability tool = tools.get(name);
        if (tool == null) {
            throw new ToolCallException(name, "not available to the " + domain.id() + " specialist");
        }
        return tool.call(params);
    }
}
