package com.lawcheck.constraint;

import com.lawcheck.model.Condition;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * SMT-backed constraint backend.
 *
 * Each query runs in its own Z3 {@link Context}, so instances are safe to
 * share between verification workers. A query the solver cannot settle
 * within the timeout, or that fails inside Z3, is answered by the
 * structural analysis instead and the verdict is marked degraded.
 */
public class Z3ConstraintBackend implements ConstraintBackend {

    private static final Logger log = LoggerFactory.getLogger(Z3ConstraintBackend.class);

    private static final Object LOAD_LOCK = new Object();
    private static volatile Boolean available;

    private final Duration timeout;
    private final AnalysisLimits limits;
    private final HeuristicConstraintBackend fallback;

    public Z3ConstraintBackend(Duration timeout, AnalysisLimits limits) {
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("solver timeout must be positive");
        }
        this.timeout = timeout;
        this.limits = limits;
        this.fallback = new HeuristicConstraintBackend(limits);
    }

    /**
     * Whether the native Z3 library can be loaded on this machine. The load attempt
     * runs once per JVM.
     */
    public static boolean isAvailable() {
        Boolean loaded = available;
        if (loaded != null) {
            return loaded;
        }
        synchronized (LOAD_LOCK) {
            if (available == null) {
                available = tryLoad();
            }
            return available;
        }
    }

    private static boolean tryLoad() {
        try (Context ctx = new Context()) {
            log.info("Z3 solver available");
            return true;
        } catch (LinkageError | Z3Exception ex) {
            log.warn("Z3 solver could not be loaded: {}", ex.toString());
            return false;
        }
    }

    @Override
    public String name() {
        return "z3";
    }

    @Override
    public Verdict isSatisfiable(Condition condition) {
        if (!limits.admits(condition)) {
            return Verdict.UNKNOWN;
        }
        try (Context ctx = new Context()) {
            Z3Encoder encoder = new Z3Encoder(ctx, condition);
            BoolExpr formula = encoder.encode(condition);

            Solver solver = ctx.mkSolver();
            Params params = ctx.mkParams();
            params.add("timeout", (int) Math.min(Integer.MAX_VALUE, timeout.toMillis()));
            solver.setParameters(params);
            solver.add(encoder.sideConstraints());
            solver.add(formula);

            Status status = solver.check();
            if (status == Status.SATISFIABLE) {
                return Verdict.TRUE;
            }
            if (status == Status.UNSATISFIABLE) {
                return Verdict.FALSE;
            }
            log.debug("Z3 returned unknown ({}), using structural analysis", solver.getReasonUnknown());
        } catch (Z3Exception ex) {
            log.warn("Z3 query failed, using structural analysis: {}", ex.getMessage());
        }
        return new Verdict(fallback.decide(condition), true);
    }
}
