package com.lawcheck.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * A legal predicate, either a typed comparison or a boolean connective over
 * nested conditions.
 *
 * Conditions are immutable values. Each nested condition is owned by exactly
 * one parent, so every tree is finite and acyclic by construction.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Condition.Age.class, name = "age"),
    @JsonSubTypes.Type(value = Condition.Income.class, name = "income"),
    @JsonSubTypes.Type(value = Condition.Duration.class, name = "duration"),
    @JsonSubTypes.Type(value = Condition.Percentage.class, name = "percentage"),
    @JsonSubTypes.Type(value = Condition.SetMembership.class, name = "set_membership"),
    @JsonSubTypes.Type(value = Condition.Pattern.class, name = "pattern"),
    @JsonSubTypes.Type(value = Condition.HasAttribute.class, name = "has_attribute"),
    @JsonSubTypes.Type(value = Condition.AttributeEquals.class, name = "attribute_equals"),
    @JsonSubTypes.Type(value = Condition.Custom.class, name = "custom"),
    @JsonSubTypes.Type(value = Condition.And.class, name = "and"),
    @JsonSubTypes.Type(value = Condition.Or.class, name = "or"),
    @JsonSubTypes.Type(value = Condition.Not.class, name = "not")
})
public sealed interface Condition {

    <R> R accept(Visitor<R> visitor);

    record Age(ComparisonOp op, long value) implements Condition {
        public Age {
            Objects.requireNonNull(op, "op");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAge(this);
        }
    }

    record Income(ComparisonOp op, long value) implements Condition {
        public Income {
            Objects.requireNonNull(op, "op");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIncome(this);
        }
    }

    record Duration(ComparisonOp op, long value, DurationUnit unit) implements Condition {
        public Duration {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(unit, "unit");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDuration(this);
        }
    }

    /** {@code context} names the percentage being compared, e.g. "ownership_share". */
    record Percentage(ComparisonOp op, double value, String context) implements Condition {
        public Percentage {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(context, "context");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPercentage(this);
        }
    }

    record SetMembership(String attribute, Set<String> values, boolean negated) implements Condition {
        public SetMembership {
            Objects.requireNonNull(attribute, "attribute");
            values = values == null
                ? Collections.emptySortedSet()
                : Collections.unmodifiableSortedSet(new TreeSet<>(values));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSetMembership(this);
        }
    }

    record Pattern(String attribute, String regex, boolean negated) implements Condition {
        public Pattern {
            Objects.requireNonNull(attribute, "attribute");
            Objects.requireNonNull(regex, "regex");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPattern(this);
        }
    }

    record HasAttribute(String key) implements Condition {
        public HasAttribute {
            Objects.requireNonNull(key, "key");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitHasAttribute(this);
        }
    }

    record AttributeEquals(String key, String value) implements Condition {
        public AttributeEquals {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAttributeEquals(this);
        }
    }

    record Custom(String description) implements Condition {
        public Custom {
            Objects.requireNonNull(description, "description");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCustom(this);
        }
    }

    record And(Condition left, Condition right) implements Condition {
        public And {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAnd(this);
        }
    }

    record Or(Condition left, Condition right) implements Condition {
        public Or {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitOr(this);
        }
    }

    record Not(Condition inner) implements Condition {
        public Not {
            Objects.requireNonNull(inner, "inner");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNot(this);
        }
    }

    interface Visitor<R> {
        R visitAge(Age age);
        R visitIncome(Income income);
        R visitDuration(Duration duration);
        R visitPercentage(Percentage percentage);
        R visitSetMembership(SetMembership membership);
        R visitPattern(Pattern pattern);
        R visitHasAttribute(HasAttribute hasAttribute);
        R visitAttributeEquals(AttributeEquals attributeEquals);
        R visitCustom(Custom custom);
        R visitAnd(And and);
        R visitOr(Or or);
        R visitNot(Not not);
    }

    // --- construction helpers ---

    static Condition age(ComparisonOp op, long value) { return new Age(op, value); }
    static Condition income(ComparisonOp op, long value) { return new Income(op, value); }
    static Condition duration(ComparisonOp op, long value, DurationUnit unit) { return new Duration(op, value, unit); }
    static Condition percentage(ComparisonOp op, double value, String context) { return new Percentage(op, value, context); }
    static Condition memberOf(String attribute, Set<String> values) { return new SetMembership(attribute, values, false); }
    static Condition notMemberOf(String attribute, Set<String> values) { return new SetMembership(attribute, values, true); }
    static Condition matches(String attribute, String regex) { return new Pattern(attribute, regex, false); }
    static Condition hasAttribute(String key) { return new HasAttribute(key); }
    static Condition attributeEquals(String key, String value) { return new AttributeEquals(key, value); }
    static Condition custom(String description) { return new Custom(description); }
    static Condition and(Condition left, Condition right) { return new And(left, right); }
    static Condition or(Condition left, Condition right) { return new Or(left, right); }
    static Condition not(Condition inner) { return new Not(inner); }

    /**
     * Conjunction of the given conditions, kept in order. Two conditions give
     * {@code (a AND b)}; longer lists are split in halves so the tree depth
     * grows logarithmically with the list length.
     *
     * @throws IllegalArgumentException if the list is empty
     */
    static Condition allOf(List<Condition> conditions) {
        if (conditions == null || conditions.isEmpty()) {
            throw new IllegalArgumentException("cannot conjoin an empty condition list");
        }
        if (conditions.size() == 1) {
            return conditions.get(0);
        }
        int middle = conditions.size() / 2;
        return new And(allOf(conditions.subList(0, middle)), allOf(conditions.subList(middle, conditions.size())));
    }

    @JsonIgnore
    default boolean isConnective() {
        return this instanceof And || this instanceof Or || this instanceof Not;
    }

    /** Human-readable rendering, e.g. {@code (age >= 18 AND income < 30000)}. */
    default String render() {
        return accept(ConditionRenderer.INSTANCE);
    }
}
