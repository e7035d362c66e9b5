package com.lawcheck.constraint;

import com.lawcheck.model.Condition;

import java.util.ArrayList;
import java.util.List;

/**
 * Negation and disjunctive normal forms of condition trees.
 *
 * Callers are expected to bound the tree depth first (see
 * {@link AnalysisLimits}); both transformations recurse.
 */
final class NormalForms {

    private NormalForms() {
    }

    static Condition toNnf(Condition condition) {
        return nnf(condition, false);
    }

    private static Condition nnf(Condition condition, boolean negate) {
        if (condition instanceof Condition.And and) {
            Condition left = nnf(and.left(), negate);
            Condition right = nnf(and.right(), negate);
            return negate ? new Condition.Or(left, right) : new Condition.And(left, right);
        }
        if (condition instanceof Condition.Or or) {
            Condition left = nnf(or.left(), negate);
            Condition right = nnf(or.right(), negate);
            return negate ? new Condition.And(left, right) : new Condition.Or(left, right);
        }
        if (condition instanceof Condition.Not not) {
            return nnf(not.inner(), !negate);
        }
        if (!negate) {
            return condition;
        }
        return negateAtom(condition);
    }

    /**
     * Pushes a negation into the atom where the atom can express it.
     * Comparisons stay wrapped: {@code NOT age >= 18} also holds when age is
     * absent, which {@code age < 18} does not.
     */
    static Condition negateAtom(Condition atom) {
        if (atom instanceof Condition.SetMembership membership) {
            return new Condition.SetMembership(membership.attribute(), membership.values(), !membership.negated());
        }
        if (atom instanceof Condition.Pattern pattern) {
            return new Condition.Pattern(pattern.attribute(), pattern.regex(), !pattern.negated());
        }
        return new Condition.Not(atom);
    }

    /**
     * Expands an NNF condition into a disjunction of literal conjunctions.
     *
     * @return the terms, or {@code null} when more than {@code maxTerms}
     *         terms would be produced
     */
    static List<List<Literal>> toDnf(Condition nnf, int maxTerms) {
        if (nnf instanceof Condition.Or or) {
            List<List<Literal>> left = toDnf(or.left(), maxTerms);
            if (left == null) {
                return null;
            }
            List<List<Literal>> right = toDnf(or.right(), maxTerms);
            if (right == null || left.size() + right.size() > maxTerms) {
                return null;
            }
            List<List<Literal>> terms = new ArrayList<>(left);
            terms.addAll(right);
            return terms;
        }
        if (nnf instanceof Condition.And and) {
            List<List<Literal>> left = toDnf(and.left(), maxTerms);
            if (left == null) {
                return null;
            }
            List<List<Literal>> right = toDnf(and.right(), maxTerms);
            if (right == null || (long) left.size() * right.size() > maxTerms) {
                return null;
            }
            List<List<Literal>> terms = new ArrayList<>(left.size() * right.size());
            for (List<Literal> l : left) {
                for (List<Literal> r : right) {
                    List<Literal> term = new ArrayList<>(l.size() + r.size());
                    term.addAll(l);
                    term.addAll(r);
                    terms.add(term);
                }
            }
            return terms;
        }
        if (nnf instanceof Condition.Not not) {
            return single(new Literal(not.inner(), false));
        }
        return single(new Literal(nnf, true));
    }

    private static List<List<Literal>> single(Literal literal) {
        List<List<Literal>> terms = new ArrayList<>(1);
        terms.add(List.of(literal));
        return terms;
    }
}
