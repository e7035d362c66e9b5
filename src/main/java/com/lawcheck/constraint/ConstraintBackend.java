package com.lawcheck.constraint;

import com.lawcheck.model.Condition;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Logical queries over conditions.
 *
 * Every query answers with a three-valued {@link Verdict}. Implementations
 * reason about fully specified subjects: each numeric quantity has a
 * non-negative value, each string attribute is either absent or has exactly
 * one value, and each custom predicate is an independent proposition.
 *
 * Only {@link #isSatisfiable} is required; the remaining queries reduce to it.
 */
public interface ConstraintBackend {

    /** Short identifier used in logs and warnings, e.g. "z3" or "heuristic". */
    String name();

    Verdict isSatisfiable(Condition condition);

    default Verdict isTautology(Condition condition) {
        return isSatisfiable(Condition.not(condition)).negate();
    }

    /** Whether every subject satisfying {@code premise} also satisfies {@code conclusion}. */
    default Verdict implies(Condition premise, Condition conclusion) {
        return isSatisfiable(Condition.and(premise, Condition.not(conclusion))).negate();
    }

    default Verdict equivalent(Condition a, Condition b) {
        return implies(a, b).and(implies(b, a));
    }

    /** Whether no subject satisfies both conditions. */
    default Verdict contradicts(Condition a, Condition b) {
        return isSatisfiable(Condition.and(a, b)).negate();
    }

    default Simplification simplify(Condition condition) {
        return new ConditionSimplifier(this).simplify(condition);
    }

    /**
     * A minimal subset of {@code conditions} that is jointly unsatisfiable,
     * as indices into the list, or empty when the conjunction is not proven
     * unsatisfiable.
     */
    default Optional<List<Integer>> unsatCore(List<Condition> conditions) {
        if (conditions.isEmpty() || !isSatisfiable(Condition.allOf(conditions)).isFalse()) {
            return Optional.empty();
        }
        List<Integer> core = new ArrayList<>();
        for (int i = 0; i < conditions.size(); i++) {
            core.add(i);
        }
        // deletion filter: drop each member whose removal keeps the rest unsatisfiable
        for (int i = conditions.size() - 1; i >= 0 && core.size() > 1; i--) {
            List<Integer> without = new ArrayList<>(core);
            without.remove(Integer.valueOf(i));
            List<Condition> remaining = new ArrayList<>();
            for (int index : without) {
                remaining.add(conditions.get(index));
            }
            if (isSatisfiable(Condition.allOf(remaining)).isFalse()) {
                core = without;
            }
        }
        return Optional.of(List.copyOf(core));
    }
}
