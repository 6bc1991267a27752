package com.example.investigator.config;

import com.example.investigator.reasoning.ReasoningBackend;
import com.example.investigator.specialist.SpecialistRegistry;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

@Configuration
public class SpecialistConfig {

    @Bean
    public SpecialistRegistry specialistRegistry(
            @Qualifier("specialistBackend") ReasoningBackend specialistBackend) {
        return SpecialistRegistry.standard(specialistBackend);
    }

    /** One thread per running specialist; stragglers are interrupted at the deadline. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService specialistExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("specialist-"));
    }
}
