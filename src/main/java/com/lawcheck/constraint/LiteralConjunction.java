package com.lawcheck.constraint;

import com.lawcheck.model.ComparisonOp;
import com.lawcheck.model.Condition;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Decides a single conjunction of literals.
 *
 * Numeric quantities are either absent or non-negative: integers for age,
 * income and durations, reals for percentages. A comparison requires the
 * quantity to be present, its negation also holds when it is absent. A string
 * attribute is either absent or holds one value. The answer is {@link Truth#UNKNOWN} only when a pattern
 * has to be matched against an unconstrained value.
 */
final class LiteralConjunction {

    private final Map<String, IntegerBounds> integers = new LinkedHashMap<>();
    private final Map<String, RealBounds> reals = new LinkedHashMap<>();
    private final Map<String, AttributeFacts> attributes = new LinkedHashMap<>();
    private final Map<String, Boolean> customs = new HashMap<>();
    private boolean clash;

    private LiteralConjunction() {
    }

    static Truth decide(List<Literal> term) {
        LiteralConjunction conjunction = new LiteralConjunction();
        for (Literal literal : term) {
            conjunction.add(literal);
            if (conjunction.clash) {
                return Truth.FALSE;
            }
        }
        return conjunction.decide();
    }

    private void add(Literal literal) {
        Condition atom = literal.atom();
        boolean positive = literal.positive();
        if (atom instanceof Condition.Age age) {
            integer(SemanticKeys.numeric(atom)).add(age.op(), age.value(), positive);
        } else if (atom instanceof Condition.Income income) {
            integer(SemanticKeys.numeric(atom)).add(income.op(), income.value(), positive);
        } else if (atom instanceof Condition.Duration duration) {
            integer(SemanticKeys.numeric(atom)).add(duration.op(), duration.value(), positive);
        } else if (atom instanceof Condition.Percentage percentage) {
            reals.computeIfAbsent(SemanticKeys.numeric(atom), k -> new RealBounds())
                .add(percentage.op(), percentage.value(), positive);
        } else if (atom instanceof Condition.Custom custom) {
            Boolean previous = customs.putIfAbsent(custom.description(), literal.positive());
            if (previous != null && previous != literal.positive()) {
                clash = true;
            }
        } else {
            String attribute = SemanticKeys.attribute(atom);
            attributes.computeIfAbsent(attribute, k -> new AttributeFacts()).add(atom, literal.positive());
        }
    }

    private IntegerBounds integer(String key) {
        return integers.computeIfAbsent(key, k -> new IntegerBounds());
    }

    private Truth decide() {
        boolean unknown = false;
        for (IntegerBounds bounds : integers.values()) {
            if (!bounds.feasible()) {
                return Truth.FALSE;
            }
        }
        for (RealBounds bounds : reals.values()) {
            if (!bounds.feasible()) {
                return Truth.FALSE;
            }
        }
        for (AttributeFacts facts : attributes.values()) {
            Truth truth = facts.decide();
            if (truth == Truth.FALSE) {
                return Truth.FALSE;
            }
            unknown |= truth == Truth.UNKNOWN;
        }
        return unknown ? Truth.UNKNOWN : Truth.TRUE;
    }

    private static final class IntegerBounds {
        private boolean present;
        private long lower = 0;
        private long upper = Long.MAX_VALUE;
        private boolean empty;
        private final Set<Long> excluded = new HashSet<>();

        /** A negative literal only bounds the value if some positive one forces it present. */
        void add(ComparisonOp op, long value, boolean positive) {
            present |= positive;
            switch (positive ? op : op.negate()) {
                case EQUAL -> {
                    lower = Math.max(lower, value);
                    upper = Math.min(upper, value);
                }
                case NOT_EQUAL -> excluded.add(value);
                case LESS_THAN -> {
                    if (value == Long.MIN_VALUE) {
                        empty = true;
                    } else {
                        upper = Math.min(upper, value - 1);
                    }
                }
                case LESS_OR_EQUAL -> upper = Math.min(upper, value);
                case GREATER_THAN -> {
                    if (value == Long.MAX_VALUE) {
                        empty = true;
                    } else {
                        lower = Math.max(lower, value + 1);
                    }
                }
                case GREATER_OR_EQUAL -> lower = Math.max(lower, value);
            }
        }

        boolean feasible() {
            if (!present) {
                return true;
            }
            if (empty || lower > upper) {
                return false;
            }
            long width = upper - lower;
            if (width >= excluded.size()) {
                return true;
            }
            long blocked = excluded.stream().filter(v -> v >= lower && v <= upper).count();
            return blocked < width + 1;
        }
    }

    private static final class RealBounds {
        private boolean present;
        private double lower = 0.0;
        private boolean lowerStrict;
        private double upper = Double.POSITIVE_INFINITY;
        private boolean upperStrict;
        private final Set<Double> excluded = new HashSet<>();

        void add(ComparisonOp op, double value, boolean positive) {
            present |= positive;
            switch (positive ? op : op.negate()) {
                case EQUAL -> {
                    raiseLower(value, false);
                    lowerUpper(value, false);
                }
                case NOT_EQUAL -> excluded.add(value);
                case LESS_THAN -> lowerUpper(value, true);
                case LESS_OR_EQUAL -> lowerUpper(value, false);
                case GREATER_THAN -> raiseLower(value, true);
                case GREATER_OR_EQUAL -> raiseLower(value, false);
            }
        }

        private void raiseLower(double value, boolean strict) {
            if (value > lower || (value == lower && strict)) {
                lower = value;
                lowerStrict = strict;
            }
        }

        private void lowerUpper(double value, boolean strict) {
            if (value < upper || (value == upper && strict)) {
                upper = value;
                upperStrict = strict;
            }
        }

        boolean feasible() {
            if (!present) {
                return true;
            }
            if (lower > upper) {
                return false;
            }
            if (lower == upper) {
                return !lowerStrict && !upperStrict && !excluded.contains(lower);
            }
            // a non-degenerate interval of reals outlasts any finite exclusion set
            return true;
        }
    }

    private static final class AttributeFacts {
        private boolean present;
        private boolean absent;
        private Set<String> candidates;
        private final Set<String> forbidden = new HashSet<>();
        private final List<Pattern> required = new ArrayList<>();
        private final List<Pattern> rejected = new ArrayList<>();

        void add(Condition atom, boolean positive) {
            if (atom instanceof Condition.HasAttribute) {
                if (positive) {
                    present = true;
                } else {
                    absent = true;
                }
            } else if (atom instanceof Condition.AttributeEquals equals) {
                if (positive) {
                    present = true;
                    restrict(Set.of(equals.value()));
                } else {
                    forbidden.add(equals.value());
                }
            } else if (atom instanceof Condition.SetMembership membership) {
                if (membership.negated()) {
                    forbidden.addAll(membership.values());
                } else {
                    present = true;
                    restrict(membership.values());
                }
            } else if (atom instanceof Condition.Pattern pattern) {
                Pattern compiled = Pattern.compile(pattern.regex());
                if (pattern.negated()) {
                    rejected.add(compiled);
                } else {
                    present = true;
                    required.add(compiled);
                }
            }
        }

        private void restrict(Set<String> values) {
            if (candidates == null) {
                candidates = new TreeSet<>(values);
            } else {
                candidates.retainAll(values);
            }
        }

        Truth decide() {
            if (!present) {
                // an absent attribute satisfies every non-forcing literal
                return Truth.TRUE;
            }
            if (absent) {
                return Truth.FALSE;
            }
            if (candidates != null) {
                for (String candidate : candidates) {
                    if (admits(candidate)) {
                        return Truth.TRUE;
                    }
                }
                return Truth.FALSE;
            }
            return required.isEmpty() && rejected.isEmpty() ? Truth.TRUE : Truth.UNKNOWN;
        }

        private boolean admits(String value) {
            if (forbidden.contains(value)) {
                return false;
            }
            for (Pattern pattern : required) {
                if (!pattern.matcher(value).find()) {
                    return false;
                }
            }
            for (Pattern pattern : rejected) {
                if (pattern.matcher(value).find()) {
                    return false;
                }
            }
            return true;
        }
    }
}
