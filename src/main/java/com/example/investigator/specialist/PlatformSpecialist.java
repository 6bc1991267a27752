package com.example.investigator.specialist;

import com.example.investigator.model.Alert;
import com.example.investigator.model.Domain;
import com.example.investigator.reasoning.ReasoningBackend;
import com.example.investigator.tools.ToolCallException;
import java.util.Map;

/** Workload health: pods, restarts, OOM kills, scheduling and resource limits. */
public class PlatformSpecialist extends AbstractSpecialist {

    public PlatformSpecialist(ReasoningBackend backend) {
        super(Domain.PLATFORM, backend);
    }

    @Override
    protected String systemPrompt() {
        return """
                You are a platform specialist investigating a Kubernetes workload alert.
                Clusters are managed through GitOps: never suggest a manual kubectl apply.

                Analyze the provided pod status, events and logs to determine:
                1. What is the root cause (OOM, crashloop, image pull, resource limits, scheduling)?
                2. Is this actionable or a false positive?
                3. What is the recommended fix (restart, scale, raise limits, check storage)?
                """;
    }

    @Override
    protected void gatherEvidence(Alert alert, Evidence evidence) throws ToolCallException {
        String namespace = alert.namespace();
        String pod = alert.label("pod");

        if (pod == null || pod.isBlank()) {
            evidence.collect(
                    "Pods in " + namespace, "kubectl_get_pods", Map.of("namespace", namespace));
            return;
        }

        evidence.collect(
                "Pod status",
                "kubectl_get_pods",
                Map.of("namespace", namespace, "name", pod));
        evidence.collect(
                "Events",
                "kubectl_get_events",
                Map.of("namespace", namespace, "field_selector", "involvedObject.name=" + pod));
        if (nameMentions(alert, "crash", "oom")) {
            evidence.collect(
                    "Logs",
                    "kubectl_logs",
                    Map.of("namespace", namespace, "pod", pod, "tail", 30));
        }
    }
}
