package com.lawcheck.verify;

import java.time.Duration;

/**
 * Upper bound on the work of one verification run. A check is one statute or
 * one statute pair; zero means unlimited for either bound. Checks beyond the
 * budget are skipped and the run reports a "budget exceeded" warning.
 */
public record VerificationBudget(long maxChecks, Duration maxDuration) {

    public static final VerificationBudget UNLIMITED = new VerificationBudget(0, Duration.ZERO);

    public VerificationBudget {
        if (maxChecks < 0) {
            throw new IllegalArgumentException("maxChecks must be >= 0");
        }
        maxDuration = maxDuration == null ? Duration.ZERO : maxDuration;
        if (maxDuration.isNegative()) {
            throw new IllegalArgumentException("maxDuration must be >= 0");
        }
    }

    public boolean limitsChecks() {
        return maxChecks > 0;
    }

    public boolean limitsDuration() {
        return !maxDuration.isZero();
    }
}
