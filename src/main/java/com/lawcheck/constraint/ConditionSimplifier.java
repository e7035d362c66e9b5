package com.lawcheck.constraint;

import com.lawcheck.model.Condition;
import com.lawcheck.model.ConditionShape;

/**
 * Bottom-up rewriting of condition trees.
 *
 * Rewrites applied:
 * <ul>
 *   <li>{@code NOT NOT x} becomes {@code x}</li>
 *   <li>{@code NOT} over set membership or a pattern flips the atom's own negation</li>
 *   <li>{@code x AND x} and {@code x OR x} collapse to {@code x}</li>
 *   <li>{@code a AND b} becomes {@code a} when the backend proves {@code a} implies {@code b}</li>
 *   <li>{@code a OR b} becomes {@code b} when the backend proves {@code a} implies {@code b}</li>
 * </ul>
 * Implication also covers the degenerate cases: an unsatisfiable disjunct and
 * a tautological conjunct are both dropped. Comparisons under {@code NOT} are
 * left alone because an absent quantity makes {@code NOT age >= 18} true but
 * {@code age < 18} false at evaluation time.
 */
class ConditionSimplifier {

    private final ConstraintBackend backend;
    private final int maxDepth;

    ConditionSimplifier(ConstraintBackend backend) {
        this(backend, AnalysisLimits.DEFAULTS.maxDepth());
    }

    ConditionSimplifier(ConstraintBackend backend, int maxDepth) {
        this.backend = backend;
        this.maxDepth = maxDepth;
    }

    Simplification simplify(Condition condition) {
        if (ConditionShape.of(condition).depth() > maxDepth) {
            return new Simplification(condition, false);
        }
        Condition rewritten = rewrite(condition);
        return new Simplification(rewritten, !rewritten.equals(condition));
    }

    private Condition rewrite(Condition condition) {
        if (condition instanceof Condition.Not not) {
            Condition inner = rewrite(not.inner());
            if (inner instanceof Condition.Not doubled) {
                return doubled.inner();
            }
            if (inner instanceof Condition.SetMembership || inner instanceof Condition.Pattern) {
                return NormalForms.negateAtom(inner);
            }
            return new Condition.Not(inner);
        }
        if (condition instanceof Condition.And and) {
            Condition left = rewrite(and.left());
            Condition right = rewrite(and.right());
            if (left.equals(right)) {
                return left;
            }
            if (backend.implies(left, right).isTrue()) {
                return left;
            }
            if (backend.implies(right, left).isTrue()) {
                return right;
            }
            return new Condition.And(left, right);
        }
        if (condition instanceof Condition.Or or) {
            Condition left = rewrite(or.left());
            Condition right = rewrite(or.right());
            if (left.equals(right)) {
                return left;
            }
            if (backend.implies(left, right).isTrue()) {
                return right;
            }
            if (backend.implies(right, left).isTrue()) {
                return left;
            }
            return new Condition.Or(left, right);
        }
        return condition;
    }
}
