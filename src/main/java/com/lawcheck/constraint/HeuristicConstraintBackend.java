package com.lawcheck.constraint;

import com.lawcheck.model.Condition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Structural backend that needs no external solver.
 *
 * The condition is brought into negation normal form and expanded into
 * disjunctive normal form; each conjunction is then checked for clashing
 * literals by {@link LiteralConjunction}. Conditions outside the
 * {@link AnalysisLimits} or with too many DNF terms yield {@code UNKNOWN}.
 */
public class HeuristicConstraintBackend implements ConstraintBackend {

    private static final Logger log = LoggerFactory.getLogger(HeuristicConstraintBackend.class);

    private final AnalysisLimits limits;
    private final boolean degraded;

    public HeuristicConstraintBackend() {
        this(AnalysisLimits.DEFAULTS, false);
    }

    public HeuristicConstraintBackend(AnalysisLimits limits) {
        this(limits, false);
    }

    /**
     * @param degraded mark every verdict as degraded; used when this backend
     *                 stands in for a solver that could not be loaded
     */
    public HeuristicConstraintBackend(AnalysisLimits limits, boolean degraded) {
        this.limits = limits;
        this.degraded = degraded;
    }

    @Override
    public String name() {
        return degraded ? "heuristic-degraded" : "heuristic";
    }

    public boolean isDegraded() {
        return degraded;
    }

    public AnalysisLimits limits() {
        return limits;
    }

    @Override
    public Verdict isSatisfiable(Condition condition) {
        Truth truth = decide(condition);
        return new Verdict(truth, degraded);
    }

    Truth decide(Condition condition) {
        if (!limits.admits(condition)) {
            log.debug("Condition exceeds analysis limits, answering unknown");
            return Truth.UNKNOWN;
        }
        List<List<Literal>> terms = NormalForms.toDnf(NormalForms.toNnf(condition), limits.maxDnfTerms());
        if (terms == null) {
            log.debug("DNF expansion exceeded {} terms, answering unknown", limits.maxDnfTerms());
            return Truth.UNKNOWN;
        }
        boolean unknown = false;
        for (List<Literal> term : terms) {
            Truth truth = LiteralConjunction.decide(term);
            if (truth == Truth.TRUE) {
                return Truth.TRUE;
            }
            unknown |= truth == Truth.UNKNOWN;
        }
        return unknown ? Truth.UNKNOWN : Truth.FALSE;
    }
}
