package com.example.investigator.tools;

import com.example.investigator.model.Domain;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Registry of the tools specialists may call and which domain sees which tool.
 *
 * <p>The catalog is fixed: adding a tool means adding a {@link ToolSpec} here and an implementation
 * in {@code ToolsConfig}.
 */
public class ToolCatalog {

    public record ToolSpec(String name, ToolServer server, Set<Domain> visibleTo) {}

    public static final List<ToolSpec> SPECS =
            List.of(
                    new ToolSpec("kubectl_get_pods", ToolServer.INFRASTRUCTURE, Set.of(Domain.PLATFORM)),
                    new ToolSpec(
                            "kubectl_get_events",
                            ToolServer.INFRASTRUCTURE,
                            Set.of(Domain.PLATFORM, Domain.SECURITY)),
                    new ToolSpec("kubectl_logs", ToolServer.INFRASTRUCTURE, Set.of(Domain.PLATFORM)),
                    new ToolSpec(
                            "kubectl_get_services", ToolServer.INFRASTRUCTURE, Set.of(Domain.NETWORK)),
                    new ToolSpec(
                            "kubectl_get_ingresses", ToolServer.INFRASTRUCTURE, Set.of(Domain.NETWORK)),
                    new ToolSpec(
                            "kubectl_get_deployments",
                            ToolServer.INFRASTRUCTURE,
                            Set.of(Domain.NETWORK)),
                    new ToolSpec("list_secrets", ToolServer.INFRASTRUCTURE, Set.of(Domain.SECURITY)),
                    new ToolSpec("adguard_list_rewrites", ToolServer.HOME, Set.of(Domain.NETWORK)),
                    new ToolSpec("adguard_get_query_log", ToolServer.HOME, Set.of(Domain.NETWORK)),
                    new ToolSpec(
                            "coroot_get_recent_anomalies",
                            ToolServer.OBSERVABILITY,
                            Set.of(Domain.RELIABILITY)),
                    new ToolSpec(
                            "query_metrics_instant",
                            ToolServer.OBSERVABILITY,
                            Set.of(Domain.RELIABILITY)),
                    new ToolSpec("search_entities", ToolServer.KNOWLEDGE, Set.of(Domain.DATA)),
                    new ToolSpec("search_runbooks", ToolServer.KNOWLEDGE, Set.of(Domain.DATA)),
                    new ToolSpec(LogSearchTool.NAME, ToolServer.LOCAL, Set.of(Domain.RELIABILITY)));

    private final Map<Domain, DomainCapabilities> byDomain = new EnumMap<>(Domain.class);

    public ToolCatalog(Collection<? extends ToolCapability> implementations) {
        Map<String, ToolCapability> byName = new LinkedHashMap<>();
        for (ToolCapability tool : implementations) {
            if (byName.put(tool.name(), tool) != null) {
                throw new IllegalStateException("Duplicate tool implementation: " + tool.name());
            }
        }
        for (ToolSpec spec : SPECS) {
            if (!byName.containsKey(spec.name())) {
                throw new IllegalStateException("No implementation for catalogued tool " + spec.name());
            }
        }
        for (Domain domain : Domain.values()) {
            List<ToolCapability> visible = new ArrayList<>();
            for (ToolSpec spec : SPECS) {
                if (spec.visibleTo().contains(domain)) {
                    visible.add(byName.get(spec.name()));
                }
            }
            byDomain.put(domain, new DomainCapabilities(domain, visible));
        }
    }

    public DomainCapabilities forDomain(Domain domain) {
        return byDomain.get(domain);
    }
}
