package com.example.investigator.specialist;

import com.example.investigator.model.Alert;
import com.example.investigator.model.Domain;
import com.example.investigator.model.SpecialistFinding;
import com.example.investigator.tools.DomainCapabilities;

/**
 * A domain-scoped investigator. Implementations never throw: every failure comes back as an
 * {@code ERROR} finding. They impose no timeout of their own and stop at the next tool or model
 * call once their thread is interrupted.
 */
public interface Specialist {

    Domain domain();

    SpecialistFinding investigate(Alert alert, DomainCapabilities capabilities);
}
