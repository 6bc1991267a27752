package com.example.investigator.specialist;

import com.example.investigator.tools.DomainCapabilities;
import com.example.investigator.tools.ToolCallException;
import com.example.investigator.tools.ToolResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Evidence gathered by one specialist run: ordered excerpts plus the tools that were called. */
public final class Evidence {

    static final int EXCERPT_CHARS = 500;

    private static final Logger log = LoggerFactory.getLogger(Evidence.class);

    private final DomainCapabilities capabilities;
    private final List<String> excerpts = new ArrayList<>();
    private final List<String> toolsUsed = new ArrayList<>();

    Evidence(DomainCapabilities capabilities) {
        this.capabilities = capabilities;
    }

    /** Calls a tool; failures propagate and end the investigation as an error finding. */
    public ToolResult call(String tool, Map<String, Object> params) throws ToolCallException {
        checkCancelled();
        toolsUsed.add(tool);
        return capabilities.call(tool, params);
    }

    /** Calls a tool where a failure only means "no data from this source". */
    public Optional<ToolResult> tryCall(String tool, Map<String, Object> params) {
        try {
            return Optional.of(call(tool, params));
        } catch (ToolCallException e) {
            log.debug("Optional tool call {} failed: {}", tool, e.getMessage());
            return Optional.empty();
        }
    }

    /** Calls a tool and records its output under {@code label}. */
    public ToolResult collect(String label, String tool, Map<String, Object> params)
            throws ToolCallException {
        ToolResult result = call(tool, params);
        add(label, result.output());
        return result;
    }

    public void add(String label, String text) {
        String body = text == null ? "" : text;
        if (body.length() > EXCERPT_CHARS) {
            body = body.substring(0, EXCERPT_CHARS);
        }
        excerpts.add(label + ":\n" + body);
    }

    void checkCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("investigation cancelled at deadline");
        }
    }

    public List<String> excerpts() {
        return List.copyOf(excerpts);
    }

    public List<String> toolsUsed() {
        return List.copyOf(toolsUsed);
    }

    boolean isEmpty() {
        return excerpts.isEmpty();
    }
}
