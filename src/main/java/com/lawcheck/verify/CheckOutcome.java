package com.lawcheck.verify;

/**
 * Result of one check on one statute or statute pair. {@code degraded} is set
 * when any constraint query behind it fell back to structural analysis.
 */
public record CheckOutcome(VerificationResult result, boolean degraded) {

    public CheckOutcome {
        result = result.copy();
    }

    @Override
    public VerificationResult result() {
        return result.copy();
    }
}
