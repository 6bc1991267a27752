package com.example.investigator.specialist;

import com.example.investigator.model.Alert;
import com.example.investigator.model.Domain;
import com.example.investigator.reasoning.ReasoningBackend;
import com.example.investigator.tools.ToolCallException;
import com.example.investigator.tools.ToolResult;
import java.util.List;
import java.util.Map;

/** DNS, split-horizon routing, service and ingress reachability. */
public class NetworkSpecialist extends AbstractSpecialist {

    public NetworkSpecialist(ReasoningBackend backend) {
        super(Domain.NETWORK, backend);
    }

    @Override
    protected String systemPrompt() {
        return """
                You are a network specialist investigating a connectivity or DNS alert.
                DNS is served by AdGuard with rewrites for selected hosts; everything else resolves
                through a wildcard record to the cluster load balancer.

                Analyze the provided DNS records, query logs and service state to determine:
                1. Is there a DNS misconfiguration (missing rewrite, wrong target)?
                2. Is a service unreachable (missing endpoints, broken ingress, failed deployment)?
                3. Is this a split-DNS routing problem?
                """;
    }

    @Override
    protected void gatherEvidence(Alert alert, Evidence evidence) throws ToolCallException {
        String namespace = alert.namespace();
        String service = alert.label("service");

        ToolResult rewrites = evidence.call("adguard_list_rewrites", Map.of());
        if (service != null) {
            List<String> relevant = linesMentioning(rewrites.output(), service, namespace);
            if (relevant.isEmpty()) {
                evidence.add(
                        "DNS rewrites",
                        "No DNS rewrite found for "
                                + service
                                + " (may resolve via the wildcard record)");
            } else {
                evidence.add(
                        "Relevant DNS rewrites",
                        String.join("\n", relevant.subList(0, Math.min(10, relevant.size()))));
            }
        } else {
            evidence.add("DNS rewrites (sample)", rewrites.excerpt(400));
        }

        if (nameMentions(alert, "dns", "resolve", "unreachable", "timeout", "connection")) {
            String term = service != null ? service : namespace;
            evidence.collect(
                    "Recent DNS queries for " + term,
                    "adguard_get_query_log",
                    Map.of("search", term, "limit", 20));
        }

        if (service == null) {
            return;
        }
        evidence.collect(
                "Service",
                "kubectl_get_services",
                Map.of("namespace", namespace, "name", service));
        evidence.collect("Ingresses", "kubectl_get_ingresses", Map.of("namespace", namespace));

        ToolResult deployments =
                evidence.call("kubectl_get_deployments", Map.of("namespace", namespace));
        List<String> deployment = linesMentioning(deployments.output(), service);
        if (!deployment.isEmpty()) {
            evidence.add(
                    "Deployment status",
                    String.join("\n", deployment.subList(0, Math.min(5, deployment.size()))));
        }
    }
}
