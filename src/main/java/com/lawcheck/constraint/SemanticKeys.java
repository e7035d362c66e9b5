package com.lawcheck.constraint;

import com.lawcheck.model.Condition;

/**
 * Stable variable names shared by the structural analysis and the solver
 * encoding. Two atoms talk about the same quantity iff their keys are equal.
 */
final class SemanticKeys {

    private SemanticKeys() {
    }

    static String numeric(Condition atom) {
        if (atom instanceof Condition.Age) {
            return "age";
        }
        if (atom instanceof Condition.Income) {
            return "income";
        }
        if (atom instanceof Condition.Duration duration) {
            return "duration[" + duration.unit().getValue() + "]";
        }
        if (atom instanceof Condition.Percentage percentage) {
            return "percentage[" + percentage.context() + "]";
        }
        return null;
    }

    /** Name of the string attribute an atom constrains, or {@code null}. */
    static String attribute(Condition atom) {
        if (atom instanceof Condition.HasAttribute has) {
            return has.key();
        }
        if (atom instanceof Condition.AttributeEquals equals) {
            return equals.key();
        }
        if (atom instanceof Condition.SetMembership membership) {
            return membership.attribute();
        }
        if (atom instanceof Condition.Pattern pattern) {
            return pattern.attribute();
        }
        return null;
    }

    static String quantityPresent(String numericKey) {
        return "known[" + numericKey + "]";
    }

    static String attributeValue(String attribute) {
        return "attr[" + attribute + "]";
    }

    static String attributePresent(String attribute) {
        return "has[" + attribute + "]";
    }

    static String custom(String description) {
        return "custom[" + description + "]";
    }

    static String pattern(Condition.Pattern pattern) {
        return "pattern[" + pattern.attribute() + "][" + pattern.regex() + "]";
    }
}
