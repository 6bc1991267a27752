package com.example.investigator.service;

import com.example.investigator.config.InvestigationProperties;
import com.example.investigator.model.Alert;
import com.example.investigator.model.Domain;
import com.example.investigator.model.SpecialistFinding;
import com.example.investigator.specialist.Specialist;
import com.example.investigator.specialist.SpecialistRegistry;
import com.example.investigator.tools.ToolCatalog;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Fans an alert out to every registered specialist at once and collects exactly one finding per
 * domain under a single shared deadline. Specialist faults never escape this class.
 */
@Service
public class SpecialistDispatcher {

    private static final Logger log = LoggerFactory.getLogger(SpecialistDispatcher.class);

    private final SpecialistRegistry registry;
    private final ToolCatalog toolCatalog;
    private final ExecutorService executor;
    private final Duration deadline;

    @Autowired
    public SpecialistDispatcher(
            SpecialistRegistry registry,
            ToolCatalog toolCatalog,
            @Qualifier("specialistExecutor") ExecutorService executor,
            InvestigationProperties properties) {
        this(registry, toolCatalog, executor, properties.deadline());
    }

    public SpecialistDispatcher(
            SpecialistRegistry registry,
            ToolCatalog toolCatalog,
            ExecutorService executor,
            Duration deadline) {
        this.registry = registry;
        this.toolCatalog = toolCatalog;
        this.executor = executor;
        this.deadline = deadline;
    }

    /** One finding per registered domain, in domain order. */
    public Map<Domain, SpecialistFinding> dispatch(Alert alert) {
        List<Domain> domains = new ArrayList<>();
        List<Callable<SpecialistFinding>> tasks = new ArrayList<>();
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        for (Map.Entry<Domain, Specialist> entry : registry.specialists().entrySet()) {
            domains.add(entry.getKey());
            tasks.add(task(entry.getValue(), alert, mdc));
        }

        Map<Domain, SpecialistFinding> findings = new EnumMap<>(Domain.class);
        List<Future<SpecialistFinding>> futures;
        try {
            futures = executor.invokeAll(tasks, deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn(">>> Dispatch interrupted, reporting every specialist as timed out");
            for (Domain domain : domains) {
                findings.put(domain, SpecialistFinding.timeout(domain, deadline));
            }
            return Collections.unmodifiableMap(findings);
        }

        for (int i = 0; i < futures.size(); i++) {
            Domain domain = domains.get(i);
            findings.put(domain, collect(domain, futures.get(i)));
        }
        long ok = findings.values().stream().filter(SpecialistFinding::isOk).count();
        log.info(">>> Specialists finished: {}/{} OK", ok, findings.size());
        return Collections.unmodifiableMap(findings);
    }

    private Callable<SpecialistFinding> task(
            Specialist specialist, Alert alert, Map<String, String> mdc) {
        return () -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return specialist.investigate(alert, toolCatalog.forDomain(specialist.domain()));
            } finally {
                MDC.clear();
            }
        };
    }

    private SpecialistFinding collect(Domain domain, Future<SpecialistFinding> future) {
        // invokeAll has already completed or cancelled every future
        try {
            SpecialistFinding finding = future.get();
            if (finding == null) {
                return SpecialistFinding.error(domain, "Specialist returned no finding", List.of(), 0);
            }
            return finding;
        } catch (CancellationException e) {
            log.warn(">>> {} specialist timed out after {}ms", domain.id(), deadline.toMillis());
            return SpecialistFinding.timeout(domain, deadline);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error(">>> {} specialist failed", domain.id(), cause);
            return SpecialistFinding.error(
                    domain, "Specialist failed: " + cause, List.of(), deadline.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SpecialistFinding.timeout(domain, deadline);
        }
    }
}
