package com.lawcheck.constraint;

/**
 * Answer to a constraint query.
 *
 * {@code UNKNOWN} is returned whenever the backend cannot be certain; callers
 * must never treat it as either {@code TRUE} or {@code FALSE}.
 * {@code degraded} marks answers that came from the heuristic path although
 * a solver was requested (solver missing, timed out or failed).
 */
public record Verdict(Truth truth, boolean degraded) {

    public static final Verdict TRUE = new Verdict(Truth.TRUE, false);
    public static final Verdict FALSE = new Verdict(Truth.FALSE, false);
    public static final Verdict UNKNOWN = new Verdict(Truth.UNKNOWN, false);

    public static Verdict of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean isTrue() {
        return truth == Truth.TRUE;
    }

    public boolean isFalse() {
        return truth == Truth.FALSE;
    }

    public boolean isUnknown() {
        return truth == Truth.UNKNOWN;
    }

    public Verdict negate() {
        return new Verdict(truth.negate(), degraded);
    }

    public Verdict asDegraded() {
        return degraded ? this : new Verdict(truth, true);
    }

    /** Three-valued conjunction; degradation of either side carries over. */
    public Verdict and(Verdict other) {
        boolean anyDegraded = degraded || other.degraded;
        Truth combined;
        if (truth == Truth.FALSE || other.truth == Truth.FALSE) {
            combined = Truth.FALSE;
        } else if (truth == Truth.TRUE && other.truth == Truth.TRUE) {
            combined = Truth.TRUE;
        } else {
            combined = Truth.UNKNOWN;
        }
        return new Verdict(combined, anyDegraded);
    }
}
