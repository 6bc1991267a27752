package com.example.investigator.specialist;

import com.example.investigator.model.Alert;
import com.example.investigator.model.Domain;
import com.example.investigator.reasoning.ReasoningBackend;
import com.example.investigator.tools.LogSearchTool;
import com.example.investigator.tools.ToolCallException;
import java.util.Map;

/** Error rates, latency, anomalies and error logs. */
public class ReliabilitySpecialist extends AbstractSpecialist {

    public ReliabilitySpecialist(ReasoningBackend backend) {
        super(Domain.RELIABILITY, backend);
    }

    @Override
    protected String systemPrompt() {
        return """
                You are an SRE specialist investigating a performance or availability alert.
                Metrics are PromQL-compatible; anomalies come from service dependency monitoring.

                Analyze the provided metrics, anomalies and error logs to determine:
                1. What is causing the latency or error rate?
                2. Is this a transient spike or a persistent issue?
                3. What is the recommended mitigation?
                """;
    }

    @Override
    protected void gatherEvidence(Alert alert, Evidence evidence) throws ToolCallException {
        evidence.collect("Recent anomalies", "coroot_get_recent_anomalies", Map.of());

        String service = alert.firstLabel("service", "pod");
        if (service == null) {
            return;
        }
        String selector = service.replace("\"", "");
        evidence.collect(
                "Error rate",
                "query_metrics_instant",
                Map.of(
                        "query",
                        "sum(rate(http_requests_total{service=\"" + selector
                                + "\",status=~\"5..\"}[5m]))"));
        evidence.collect(
                "P95 latency",
                "query_metrics_instant",
                Map.of(
                        "query",
                        "histogram_quantile(0.95, rate(http_request_duration_seconds_bucket{service=\""
                                + selector
                                + "\"}[5m]))"));
        evidence.collect(
                "Error logs",
                LogSearchTool.NAME,
                Map.of("query", "service:\"" + selector + "\" AND level:ERROR", "limit", 5));
    }
}
