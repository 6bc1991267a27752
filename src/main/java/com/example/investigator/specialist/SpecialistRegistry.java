package com.example.investigator.specialist;

import com.example.investigator.model.Domain;
import com.example.investigator.reasoning.ReasoningBackend;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Static mapping from domain to its specialist. Every domain is covered exactly once. */
public class SpecialistRegistry {

    private final Map<Domain, Specialist> specialists;

    public SpecialistRegistry(Collection<? extends Specialist> specialists) {
        Map<Domain, Specialist> byDomain = new EnumMap<>(Domain.class);
        for (Specialist specialist : specialists) {
            if (byDomain.put(specialist.domain(), specialist) != null) {
                throw new IllegalStateException(
                        "Two specialists registered for domain " + specialist.domain().id());
            }
        }
        for (Domain domain : Domain.values()) {
            if (!byDomain.containsKey(domain)) {
                throw new IllegalStateException("No specialist registered for domain " + domain.id());
            }
        }
        this.specialists = Collections.unmodifiableMap(byDomain);
    }

    /** The five standard specialists, all reasoning through {@code backend}. */
    public static SpecialistRegistry standard(ReasoningBackend backend) {
        return new SpecialistRegistry(
                List.of(
                        new DataSpecialist(backend),
                        new NetworkSpecialist(backend),
                        new PlatformSpecialist(backend),
                        new ReliabilitySpecialist(backend),
                        new SecuritySpecialist(backend)));
    }

    /** Specialists in domain order. */
    public Map<Domain, Specialist> specialists() {
        return specialists;
    }

    public Specialist get(Domain domain) {
        return specialists.get(domain);
    }

    public List<Domain> domains() {
        return List.copyOf(specialists.keySet());
    }

    public int size() {
        return specialists.size();
    }
}
