package com.lawcheck.eval;

import com.lawcheck.model.Condition;

import java.util.List;

/**
 * Evaluates conditions against an {@link EvaluationContext}.
 *
 * {@code And} and {@code Or} short-circuit left to right: the right operand
 * of {@code And} is not evaluated when the left is false, and the right
 * operand of {@code Or} is not evaluated when the left is true.
 */
public interface ConditionEvaluator {

    boolean evaluate(Condition condition, EvaluationContext context);

    /** True when every precondition holds; an empty list always holds. */
    default boolean evaluateAll(List<Condition> preconditions, EvaluationContext context) {
        for (Condition condition : preconditions) {
            if (!evaluate(condition, context)) {
                return false;
            }
        }
        return true;
    }
}
