package com.example.investigator.specialist;

import com.example.investigator.model.Alert;
import com.example.investigator.model.Domain;
import com.example.investigator.reasoning.ReasoningBackend;
import com.example.investigator.tools.ToolCallException;
import java.util.Map;

/** Data stores and the knowledge graph: query failures, sync issues, known runbooks. */
public class DataSpecialist extends AbstractSpecialist {

    private static final int SEARCH_CHARS = 100;

    public DataSpecialist(ReasoningBackend backend) {
        super(Domain.DATA, backend);
    }

    @Override
    protected String systemPrompt() {
        return """
                You are a data-layer specialist investigating a database or query alert.

                Analyze the provided entity relations and runbooks to determine:
                1. Is the affected data store healthy?
                2. Are queries failing?
                3. Is there a synchronization issue, and does a runbook already cover it?
                """;
    }

    @Override
    protected void gatherEvidence(Alert alert, Evidence evidence) throws ToolCallException {
        String context = (alert.name() + " " + alert.description()).trim();
        if (context.length() > SEARCH_CHARS) {
            context = context.substring(0, SEARCH_CHARS);
        }
        evidence.collect("Related entities", "search_entities", Map.of("query", context));
        evidence.collect("Related runbooks", "search_runbooks", Map.of("query", alert.name()));
    }
}
