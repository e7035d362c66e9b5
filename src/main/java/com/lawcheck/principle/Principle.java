package com.lawcheck.principle;

import com.lawcheck.model.Statute;

import java.util.Optional;

/**
 * A constitutional principle every statute must respect.
 * Principles are deterministic rules over a single statute.
 */
public interface Principle {

    /** Unique principle identifier, e.g. "equality". */
    String principleId();

    /** Human-readable name used in findings, e.g. "Equal Protection". */
    String name();

    String description();

    /**
     * Check a statute against this principle.
     *
     * @return a violation, or empty if the statute complies
     */
    Optional<PrincipleViolation> check(Statute statute);

    default PrincipleViolation violation(Statute statute, String detail) {
        return new PrincipleViolation(principleId(), name(), statute.id(), detail);
    }
}
