package com.example.investigator.controller;

import com.example.investigator.model.Domain;
import com.example.investigator.model.InvestigationRequest;
import com.example.investigator.model.InvestigationResponse;
import com.example.investigator.service.AuthorityWeightTable;
import com.example.investigator.service.InvestigationOrchestrator;
import com.example.investigator.specialist.SpecialistRegistry;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class InvestigationController {

    static final String SERVICE_NAME = "alert-investigator";

    private final InvestigationOrchestrator orchestrator;
    private final SpecialistRegistry registry;
    private final AuthorityWeightTable weightTable;

    public InvestigationController(
            InvestigationOrchestrator orchestrator,
            SpecialistRegistry registry,
            AuthorityWeightTable weightTable) {
        this.orchestrator = orchestrator;
        this.registry = registry;
        this.weightTable = weightTable;
    }

    @PostMapping("/v1/investigate")
    public InvestigationResponse investigate(@Valid @RequestBody InvestigationRequest request) {
        return orchestrator.investigate(request);
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "healthy", "service", SERVICE_NAME);
    }

    /** Registered specialists and the authority weights of every configured category. */
    @GetMapping("/v1/agents")
    public Map<String, Object> agents() {
        List<String> agents = registry.domains().stream().map(Domain::id).toList();
        Map<String, Map<String, Double>> weights = new LinkedHashMap<>();
        weightTable
                .describe()
                .forEach(
                        (category, byDomain) -> {
                            Map<String, Double> rendered = new TreeMap<>();
                            byDomain.forEach((domain, weight) -> rendered.put(domain.id(), weight));
                            weights.put(category, rendered);
                        });
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("agents", agents);
        body.put("weights", weights);
        return body;
    }
}
