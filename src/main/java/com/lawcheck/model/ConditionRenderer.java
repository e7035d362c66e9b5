package com.lawcheck.model;

import java.math.BigDecimal;
import java.util.stream.Collectors;

final class ConditionRenderer implements Condition.Visitor<String> {

    static final ConditionRenderer INSTANCE = new ConditionRenderer();

    private ConditionRenderer() {
    }

    @Override
    public String visitAge(Condition.Age age) {
        return "age " + age.op() + " " + age.value();
    }

    @Override
    public String visitIncome(Condition.Income income) {
        return "income " + income.op() + " " + income.value();
    }

    @Override
    public String visitDuration(Condition.Duration duration) {
        return "duration " + duration.op() + " " + duration.value() + " " + duration.unit().getValue();
    }

    @Override
    public String visitPercentage(Condition.Percentage percentage) {
        return percentage.context() + " " + percentage.op() + " "
            + BigDecimal.valueOf(percentage.value()).stripTrailingZeros().toPlainString() + "%";
    }

    @Override
    public String visitSetMembership(Condition.SetMembership membership) {
        String values = membership.values().stream().collect(Collectors.joining(", ", "{", "}"));
        return membership.attribute() + (membership.negated() ? " not in " : " in ") + values;
    }

    @Override
    public String visitPattern(Condition.Pattern pattern) {
        return pattern.attribute() + (pattern.negated() ? " !~ /" : " =~ /") + pattern.regex() + "/";
    }

    @Override
    public String visitHasAttribute(Condition.HasAttribute hasAttribute) {
        return "has_attribute(" + hasAttribute.key() + ")";
    }

    @Override
    public String visitAttributeEquals(Condition.AttributeEquals attributeEquals) {
        return attributeEquals.key() + " == \"" + attributeEquals.value() + "\"";
    }

    @Override
    public String visitCustom(Condition.Custom custom) {
        return "custom(" + custom.description() + ")";
    }

    @Override
    public String visitAnd(Condition.And and) {
        return "(" + and.left().accept(this) + " AND " + and.right().accept(this) + ")";
    }

    @Override
    public String visitOr(Condition.Or or) {
        return "(" + or.left().accept(this) + " OR " + or.right().accept(this) + ")";
    }

    @Override
    public String visitNot(Condition.Not not) {
        return "NOT " + not.inner().accept(this);
    }
}
