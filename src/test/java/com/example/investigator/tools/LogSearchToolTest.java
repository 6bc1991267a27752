package com.example.investigator.tools;

import com.example.investigator.service.EmbeddedLogIndex;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LogSearchToolTest {

    private final EmbeddedLogIndex logIndex = new EmbeddedLogIndex();
    private final LogSearchTool tool = new LogSearchTool(logIndex);

    @BeforeEach
    void setUp() {
        logIndex.loadScenario("db-timeout");
    }

    @Test
    void findsErrorLogsForService() throws ToolCallException {
        ToolResult result =
                tool.call(Map.of("query", "service:\"inventory\" AND level:ERROR", "limit", 5));

        Assertions.assertTrue(result.output().startsWith("Found 15 matches"));
        Assertions.assertEquals(6, result.output().lines().count());
        Assertions.assertTrue(result.output().contains("HikariPool-1"));
    }

    @Test
    void missingQueryIsRejected() {
        Assertions.assertThrows(ToolCallException.class, () -> tool.call(Map.of("limit", 5)));
    }

    @Test
    void unparseableQueryIsToolFailure() {
        ToolCallException e =
                Assertions.assertThrows(
                        ToolCallException.class, () -> tool.call(Map.of("query", "level:(ERROR")));
        Assertions.assertEquals(LogSearchTool.NAME, e.tool());
    }
}
