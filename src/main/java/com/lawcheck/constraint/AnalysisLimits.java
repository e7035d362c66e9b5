package com.lawcheck.constraint;

import com.lawcheck.model.Condition;
import com.lawcheck.model.ConditionShape;

/**
 * Resource guard for structural analysis. Conditions beyond these limits are
 * answered with {@link Truth#UNKNOWN} instead of being analyzed.
 */
public record AnalysisLimits(int maxDepth, int maxNodes, int maxDnfTerms) {

    public static final AnalysisLimits DEFAULTS = new AnalysisLimits(256, 10_000, 256);

    public AnalysisLimits {
        if (maxDepth < 1 || maxNodes < 1 || maxDnfTerms < 1) {
            throw new IllegalArgumentException("analysis limits must be positive");
        }
    }

    public boolean admits(Condition condition) {
        ConditionShape shape = ConditionShape.of(condition);
        return shape.depth() <= maxDepth && shape.nodeCount() <= maxNodes;
    }
}
