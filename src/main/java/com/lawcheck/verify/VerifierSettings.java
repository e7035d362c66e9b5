package com.lawcheck.verify;

import com.lawcheck.constraint.AnalysisLimits;

/**
 * Tunables of a {@link StatuteVerifier}. {@code workerThreads} of zero means
 * one worker per available processor.
 */
public record VerifierSettings(
    Severity contradictionSeverity,
    double similarityThreshold,
    AnalysisLimits limits,
    boolean legacyCustomReferences,
    boolean parallel,
    int workerThreads,
    VerificationBudget budget
) {

    public static final VerifierSettings DEFAULTS = new VerifierSettings(
        Severity.ERROR, 0.5, AnalysisLimits.DEFAULTS, false, false, 0, VerificationBudget.UNLIMITED);

    public VerifierSettings {
        if (contradictionSeverity != Severity.WARNING && contradictionSeverity != Severity.ERROR) {
            throw new IllegalArgumentException("contradiction severity must be WARNING or ERROR");
        }
        if (workerThreads < 0) {
            throw new IllegalArgumentException("workerThreads must be >= 0");
        }
        limits = limits == null ? AnalysisLimits.DEFAULTS : limits;
        budget = budget == null ? VerificationBudget.UNLIMITED : budget;
    }

    public int effectiveWorkerThreads() {
        return workerThreads > 0 ? workerThreads : Runtime.getRuntime().availableProcessors();
    }

    public VerifierSettings withParallel(boolean parallel, int workerThreads) {
        return new VerifierSettings(contradictionSeverity, similarityThreshold, limits,
            legacyCustomReferences, parallel, workerThreads, budget);
    }

    public VerifierSettings withBudget(VerificationBudget budget) {
        return new VerifierSettings(contradictionSeverity, similarityThreshold, limits,
            legacyCustomReferences, parallel, workerThreads, budget);
    }

    public VerifierSettings withContradictionSeverity(Severity severity) {
        return new VerifierSettings(severity, similarityThreshold, limits,
            legacyCustomReferences, parallel, workerThreads, budget);
    }

    public VerifierSettings withLegacyCustomReferences(boolean enabled) {
        return new VerifierSettings(contradictionSeverity, similarityThreshold, limits,
            enabled, parallel, workerThreads, budget);
    }

    /** Everything that can change the outcome of a cached check. */
    String fingerprint() {
        return "severity=" + contradictionSeverity.getValue()
            + ";similarity=" + similarityThreshold
            + ";limits=" + limits;
    }
}
