package com.example.investigator.tools;

import com.example.investigator.service.EmbeddedLogIndex;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@code search_logs}: Lucene query against the embedded log index. */
public class LogSearchTool implements ToolCapability {

    public static final String NAME = "search_logs";
    private static final int DEFAULT_LIMIT = 10;

    private static final Logger log = LoggerFactory.getLogger(LogSearchTool.class);
    private final EmbeddedLogIndex logIndex;

    public LogSearchTool(EmbeddedLogIndex logIndex) {
        this.logIndex = logIndex;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ToolResult call(Map<String, Object> params) throws ToolCallException {
        Object query = params.get("query");
        if (query == null || query.toString().isBlank()) {
            throw new ToolCallException(NAME, "'query' is required");
        }
        int limit = DEFAULT_LIMIT;
        if (params.get("limit") instanceof Number number) {
            limit = Math.max(1, number.intValue());
        }

        log.info(">>> TOOL EXECUTION: Searching logs with query: [{}]", query);
        try {
            EmbeddedLogIndex.SearchResult result = logIndex.search(query.toString(), limit);
            return new ToolResult(NAME, result.render());
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new ToolCallException(NAME, e.getMessage(), e);
        }
    }
}
