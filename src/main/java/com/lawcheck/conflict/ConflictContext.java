package com.lawcheck.conflict;

import com.lawcheck.constraint.ConstraintBackend;
import com.lawcheck.constraint.Verdict;
import com.lawcheck.model.Condition;
import com.lawcheck.model.Statute;

/** Shared predicates for conflict rules. */
public class ConflictContext {

    private final ConstraintBackend backend;
    private final double similarityThreshold;

    public ConflictContext(ConstraintBackend backend, double similarityThreshold) {
        if (similarityThreshold < 0.0 || similarityThreshold > 1.0) {
            throw new IllegalArgumentException("similarity threshold must be within [0, 1]");
        }
        this.backend = backend;
        this.similarityThreshold = similarityThreshold;
    }

    public ConstraintBackend backend() {
        return backend;
    }

    public double similarityThreshold() {
        return similarityThreshold;
    }

    public boolean similarTitles(Statute first, Statute second) {
        return Similarity.jaccard(first.title(), second.title()) >= similarityThreshold;
    }

    /**
     * Whether some subject satisfies the preconditions of both statutes.
     * A statute without preconditions applies to everyone.
     */
    public Verdict preconditionsOverlap(Statute first, Statute second) {
        if (first.preconditions().isEmpty() && second.preconditions().isEmpty()) {
            return Verdict.TRUE;
        }
        if (first.preconditions().isEmpty()) {
            return backend.isSatisfiable(Condition.allOf(second.preconditions()));
        }
        if (second.preconditions().isEmpty()) {
            return backend.isSatisfiable(Condition.allOf(first.preconditions()));
        }
        return backend.isSatisfiable(Condition.and(
            Condition.allOf(first.preconditions()), Condition.allOf(second.preconditions())));
    }
}
