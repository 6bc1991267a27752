package com.example.investigator;

import com.example.investigator.config.InvestigationProperties;
import com.example.investigator.model.Alert;
import com.example.investigator.model.Domain;
import com.example.investigator.model.Severity;
import com.example.investigator.service.AuthorityWeightTable;
import com.example.investigator.specialist.SpecialistRegistry;
import com.example.investigator.tools.ToolCatalog;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.env.Environment;
import org.springframework.test.context.ActiveProfiles;

/** Wiring and configuration binding; no model or tool server is contacted. */
@SpringBootTest
@ActiveProfiles("test")
class AlertInvestigatorApplicationTest {

    @Autowired private InvestigationProperties properties;
    @Autowired private SpecialistRegistry registry;
    @Autowired private AuthorityWeightTable weightTable;
    @Autowired private ToolCatalog toolCatalog;
    @Autowired private Environment environment;

    @Test
    void bindsInvestigationSettings() {
        Assertions.assertEquals(Duration.ofSeconds(15), properties.deadline());
        Assertions.assertEquals(Duration.ofMillis(250), properties.synthesis().retryBackoff());
        Assertions.assertEquals(0.6, properties.synthesis().actionableThreshold());
        Assertions.assertEquals(0.3, properties.synthesis().benignThreshold());
        Assertions.assertFalse(properties.authority().categories().isEmpty());
    }

    @Test
    void modelReadTimeoutFitsSynthesisBudget() {
        Duration readTimeout =
                Binder.get(environment)
                        .bind("spring.http.client.read-timeout", Duration.class)
                        .get();

        Assertions.assertTrue(readTimeout.compareTo(properties.synthesis().budget()) < 0);
    }

    @Test
    void wiresEverySpecialistAndTool() {
        Assertions.assertEquals(5, registry.size());
        for (Domain domain : Domain.values()) {
            Assertions.assertFalse(toolCatalog.forDomain(domain).names().isEmpty());
        }
    }

    @Test
    void configuredCategoriesResolve() {
        Alert crashLoop = new Alert("KubePodCrashLooping", Map.of(), Severity.CRITICAL, "");
        Alert dns = new Alert("Whatever", Map.of("component", "dns"), Severity.WARNING, "");

        Assertions.assertEquals("workload", weightTable.categoryFor(crashLoop));
        Assertions.assertEquals(1.0, weightTable.weightsFor(crashLoop).get(Domain.PLATFORM));
        Assertions.assertEquals("network", weightTable.categoryFor(dns));
    }
}
