package com.lawcheck.eval;

import com.lawcheck.model.ComparisonOp;
import com.lawcheck.model.Condition;

import java.util.Map;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Tree-walk evaluator with a nesting-depth guard.
 *
 * Numeric comparisons against a quantity the context does not carry
 * evaluate to {@code false}. Custom conditions are resolved through the
 * context's {@link EvaluationContext.CustomPredicateResolver}; unknown
 * descriptions evaluate to {@code false}. Patterns use search semantics:
 * the regex may match anywhere in the attribute value.
 */
public final class DefaultConditionEvaluator implements ConditionEvaluator {

    public static final int DEFAULT_MAX_DEPTH = 256;

    private final MissingAttributePolicy missingAttributePolicy;
    private final int maxDepth;
    private final Map<String, Pattern> compiledPatterns = new ConcurrentHashMap<>();

    public DefaultConditionEvaluator() {
        this(MissingAttributePolicy.FALSE, DEFAULT_MAX_DEPTH);
    }

    public DefaultConditionEvaluator(MissingAttributePolicy missingAttributePolicy, int maxDepth) {
        this.missingAttributePolicy = missingAttributePolicy;
        this.maxDepth = maxDepth;
    }

    @Override
    public boolean evaluate(Condition condition, EvaluationContext context) {
        return eval(condition, context, 1);
    }

    private boolean eval(Condition condition, EvaluationContext context, int depth) {
        if (depth > maxDepth) {
            throw new EvaluationLimitExceededException("max nesting depth exceeded: " + maxDepth);
        }

        if (condition instanceof Condition.And and) {
            return eval(and.left(), context, depth + 1) && eval(and.right(), context, depth + 1);
        }
        if (condition instanceof Condition.Or or) {
            return eval(or.left(), context, depth + 1) || eval(or.right(), context, depth + 1);
        }
        if (condition instanceof Condition.Not not) {
            return !eval(not.inner(), context, depth + 1);
        }
        return evalLeaf(condition, context);
    }

    private boolean evalLeaf(Condition condition, EvaluationContext context) {
        if (condition instanceof Condition.Age age) {
            return compare(context.age(), age.op(), age.value());
        }
        if (condition instanceof Condition.Income income) {
            return compare(context.income(), income.op(), income.value());
        }
        if (condition instanceof Condition.Duration duration) {
            return compare(context.duration(duration.unit()), duration.op(), duration.value());
        }
        if (condition instanceof Condition.Percentage percentage) {
            OptionalDouble actual = context.percentage(percentage.context());
            return actual.isPresent() && percentage.op().test(actual.getAsDouble(), percentage.value());
        }
        if (condition instanceof Condition.SetMembership membership) {
            boolean member = context.attribute(membership.attribute())
                .map(membership.values()::contains)
                .orElse(false);
            return member != membership.negated();
        }
        if (condition instanceof Condition.Pattern pattern) {
            boolean matched = context.attribute(pattern.attribute())
                .map(value -> compiled(pattern.regex()).matcher(value).find())
                .orElse(false);
            return matched != pattern.negated();
        }
        if (condition instanceof Condition.HasAttribute has) {
            return context.hasAttribute(has.key());
        }
        if (condition instanceof Condition.AttributeEquals equals) {
            if (!context.hasAttribute(equals.key())) {
                if (missingAttributePolicy == MissingAttributePolicy.STRICT) {
                    throw new MissingAttributeException(equals.key());
                }
                return false;
            }
            return equals.value().equals(context.attribute(equals.key()).orElse(null));
        }
        if (condition instanceof Condition.Custom custom) {
            Predicate<EvaluationContext> predicate = context.customResolver().resolve(custom.description());
            return predicate != null && predicate.test(context);
        }
        throw new IllegalArgumentException("unsupported condition: " + condition.getClass().getName());
    }

    private static boolean compare(OptionalLong actual, ComparisonOp op, long expected) {
        return actual.isPresent() && op.test(actual.getAsLong(), expected);
    }

    private Pattern compiled(String regex) {
        return compiledPatterns.computeIfAbsent(regex, Pattern::compile);
    }
}
