package com.example.investigator.specialist;

import com.example.investigator.model.Alert;
import com.example.investigator.model.Domain;
import com.example.investigator.model.SpecialistFinding;
import com.example.investigator.tools.DomainCapabilities;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/** Specialist whose behaviour is a plain function of the alert. */
public class StubSpecialist implements Specialist {

    private final Domain domain;
    private final Function<Alert, SpecialistFinding> behaviour;
    private final AtomicInteger calls = new AtomicInteger();

    public StubSpecialist(Domain domain, Function<Alert, SpecialistFinding> behaviour) {
        this.domain = domain;
        this.behaviour = behaviour;
    }

    public static StubSpecialist confident(Domain domain, double confidence) {
        return new StubSpecialist(
                domain,
                alert ->
                        SpecialistFinding.ok(
                                domain,
                                "FAIL: " + alert.name() + " confirmed in " + domain.id(),
                                confidence,
                                List.of(),
                                "Inspect " + domain.id(),
                                List.of(),
                                5));
    }

    /** A registry of stubs for every domain, each returning OK with {@code confidence}. */
    public static List<StubSpecialist> allConfident(double confidence) {
        List<StubSpecialist> all = new ArrayList<>();
        for (Domain domain : Domain.values()) {
            all.add(confident(domain, confidence));
        }
        return all;
    }

    public int calls() {
        return calls.get();
    }

    @Override
    public Domain domain() {
        return domain;
    }

    @Override
    public SpecialistFinding investigate(Alert alert, DomainCapabilities capabilities) {
        calls.incrementAndGet();
        return behaviour.apply(alert);
    }
}
