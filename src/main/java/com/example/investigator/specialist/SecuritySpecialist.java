package com.example.investigator.specialist;

import com.example.investigator.model.Alert;
import com.example.investigator.model.Domain;
import com.example.investigator.reasoning.ReasoningBackend;
import com.example.investigator.tools.ToolCallException;
import com.example.investigator.tools.ToolResult;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Secrets, authentication failures and certificates. */
public class SecuritySpecialist extends AbstractSpecialist {

    private static final List<String> SECRET_ROOTS = List.of("/platform/", "/infrastructure/");

    public SecuritySpecialist(ReasoningBackend backend) {
        super(Domain.SECURITY, backend);
    }

    @Override
    protected String systemPrompt() {
        return """
                You are a security specialist investigating an authentication or secrets alert.

                Analyze the provided secret status and auth events to determine:
                1. Are the required secrets present?
                2. Is there an authentication or authorization failure?
                3. Are certificates valid?
                """;
    }

    @Override
    protected void gatherEvidence(Alert alert, Evidence evidence) throws ToolCallException {
        String target = alert.firstLabel("service", "pod");
        if (target != null) {
            // secrets live under one of two roots; the first that answers wins
            boolean found = false;
            for (String root : SECRET_ROOTS) {
                String path = root + target;
                Optional<ToolResult> secrets = evidence.tryCall("list_secrets", Map.of("path", path));
                if (secrets.isPresent()) {
                    evidence.add("Secrets at " + path, secrets.get().excerpt(300));
                    found = true;
                    break;
                }
            }
            if (!found) {
                evidence.add("Secrets", "No secret path found for " + target);
            }
        }

        if (nameMentions(alert, "auth", "401", "403", "forbidden", "cert")) {
            evidence.collect(
                    "Events", "kubectl_get_events", Map.of("namespace", alert.namespace()));
        }
    }
}
