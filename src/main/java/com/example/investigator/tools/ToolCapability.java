package com.example.investigator.tools;

import java.util.Map;

/**
 * One named query/action a specialist may invoke while gathering evidence. Implementations talk to
 * systems outside this service: calls are fallible and carry no latency guarantee beyond the
 * investigation deadline.
 */
public interface ToolCapability {

    String name();

    ToolResult call(Map<String, Object> params) throws ToolCallException;
}
