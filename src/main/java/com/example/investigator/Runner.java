package com.example.investigator;

import com.example.investigator.config.InvestigationProperties;
import com.example.investigator.service.AuthorityWeightTable;
import com.example.investigator.service.EmbeddedLogIndex;
import com.example.investigator.specialist.SpecialistRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

@Configuration
@Profile("!test")
public class Runner {

    private static final Logger log = LoggerFactory.getLogger(Runner.class);

    @Bean
    ApplicationRunner startApplication(
            SpecialistRegistry registry,
            AuthorityWeightTable weightTable,
            EmbeddedLogIndex logIndex,
            InvestigationProperties properties) {
        return args -> {
            // Step 1: Seed the log index
            logIndex.loadScenario(properties.logs().scenario());

            // Step 2: Report what is wired
            log.info(
                    ">>> {} specialists ready: {}, deadline {}ms",
                    registry.size(),
                    registry.domains(),
                    properties.deadline().toMillis());
            log.info(">>> Authority categories: {}", weightTable.describe().keySet());
        };
    }
}
