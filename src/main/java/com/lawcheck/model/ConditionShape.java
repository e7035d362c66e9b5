package com.lawcheck.model;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;
import java.util.TreeSet;

/**
 * Structural measurements of a condition tree: depth, node count,
 * connective count and the set of leaf kinds.
 *
 * Computed iteratively so that pathologically deep trees cannot exhaust the
 * call stack.
 */
public record ConditionShape(int depth, int nodeCount, int operatorCount, Set<String> kinds) {

    public ConditionShape {
        kinds = Set.copyOf(kinds);
    }

    public static ConditionShape of(Condition condition) {
        int maxDepth = 0;
        int nodes = 0;
        int operators = 0;
        Set<String> kinds = new TreeSet<>();

        Deque<Object[]> stack = new ArrayDeque<>();
        stack.push(new Object[] {condition, 1});
        while (!stack.isEmpty()) {
            Object[] frame = stack.pop();
            Condition current = (Condition) frame[0];
            int depth = (Integer) frame[1];
            nodes++;
            maxDepth = Math.max(maxDepth, depth);

            if (current instanceof Condition.And and) {
                operators++;
                stack.push(new Object[] {and.right(), depth + 1});
                stack.push(new Object[] {and.left(), depth + 1});
            } else if (current instanceof Condition.Or or) {
                operators++;
                stack.push(new Object[] {or.right(), depth + 1});
                stack.push(new Object[] {or.left(), depth + 1});
            } else if (current instanceof Condition.Not not) {
                operators++;
                stack.push(new Object[] {not.inner(), depth + 1});
            } else {
                kinds.add(kindOf(current));
            }
        }
        return new ConditionShape(maxDepth, nodes, operators, kinds);
    }

    /** Simple name of the leaf variant, e.g. "Age" or "SetMembership". */
    public static String kindOf(Condition condition) {
        return condition.getClass().getSimpleName();
    }
}
