package com.lawcheck.constraint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Chooses the backend for a {@link SolverMode}. When Z3 is requested, or
 * preferred, but cannot be loaded, the structural backend is returned with
 * every verdict marked degraded, so verification reports reduced precision.
 */
public final class ConstraintBackends {

    private static final Logger log = LoggerFactory.getLogger(ConstraintBackends.class);

    private ConstraintBackends() {
    }

    public static ConstraintBackend create(SolverMode mode, Duration timeout, AnalysisLimits limits) {
        switch (mode) {
            case HEURISTIC:
                return new HeuristicConstraintBackend(limits);
            case AUTO:
                if (Z3ConstraintBackend.isAvailable()) {
                    return new Z3ConstraintBackend(timeout, limits);
                }
                log.info("Z3 not available, using heuristic constraint backend with reduced precision");
                return new HeuristicConstraintBackend(limits, true);
            case Z3:
            default:
                if (Z3ConstraintBackend.isAvailable()) {
                    return new Z3ConstraintBackend(timeout, limits);
                }
                log.warn("Z3 requested but not available; verdicts will be marked degraded");
                return new HeuristicConstraintBackend(limits, true);
        }
    }

    public static ConstraintBackend heuristic() {
        return new HeuristicConstraintBackend();
    }
}
