package com.lawcheck.model;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.regex.PatternSyntaxException;

/**
 * Input validation performed before any verification check runs.
 *
 * Only shape errors are rejected here. Duplicate ids are a finding
 * (id collision), not a validation failure, and deep or large condition
 * trees are handled by the verifier's resource guard.
 */
public class StatuteValidator {

    public void validateAll(List<Statute> statutes) {
        requireNonNull(statutes, "statutes cannot be null");
        for (int i = 0; i < statutes.size(); i++) {
            Statute statute = statutes.get(i);
            requireNonNull(statute, "statutes[" + i + "] cannot be null");
            validate(statute);
        }
    }

    public void validate(Statute statute) {
        requireNonNull(statute, "statute cannot be null");
        requireString(statute.id(), "statute id is required");
        String id = statute.id();

        requireNonNull(statute.effect(), "statute '" + id + "': effect is required");
        if (statute.version() < 1) {
            throw new InvalidStatuteException("statute '" + id + "': version must be >= 1");
        }

        for (String reference : statute.references()) {
            requireString(reference, "statute '" + id + "': references must be non-blank ids");
        }

        TemporalValidity validity = statute.temporalValidity();
        if (validity != null && validity.effectiveDate() != null && validity.expiryDate() != null
                && validity.expiryDate().isBefore(validity.effectiveDate())) {
            throw new InvalidStatuteException(
                "statute '" + id + "': expiry_date must not precede effective_date");
        }

        for (int i = 0; i < statute.preconditions().size(); i++) {
            Condition condition = statute.preconditions().get(i);
            requireNonNull(condition, "statute '" + id + "': preconditions[" + i + "] cannot be null");
            validateCondition(id, i, condition);
        }
    }

    private void validateCondition(String statuteId, int index, Condition root) {
        String where = "statute '" + statuteId + "', precondition " + (index + 1);
        Deque<Condition> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Condition current = stack.pop();
            if (current instanceof Condition.And and) {
                stack.push(and.right());
                stack.push(and.left());
            } else if (current instanceof Condition.Or or) {
                stack.push(or.right());
                stack.push(or.left());
            } else if (current instanceof Condition.Not not) {
                stack.push(not.inner());
            } else if (current instanceof Condition.Pattern pattern) {
                requireString(pattern.attribute(), where + ": pattern attribute is required");
                try {
                    java.util.regex.Pattern.compile(pattern.regex());
                } catch (PatternSyntaxException ex) {
                    throw new InvalidStatuteException(where + ": invalid regex '" + pattern.regex() + "'", ex);
                }
            } else if (current instanceof Condition.SetMembership membership) {
                requireString(membership.attribute(), where + ": set membership attribute is required");
            } else if (current instanceof Condition.HasAttribute has) {
                requireString(has.key(), where + ": attribute key is required");
            } else if (current instanceof Condition.AttributeEquals equals) {
                requireString(equals.key(), where + ": attribute key is required");
            } else if (current instanceof Condition.Percentage percentage) {
                if (Double.isNaN(percentage.value()) || Double.isInfinite(percentage.value())) {
                    throw new InvalidStatuteException(where + ": percentage value must be finite");
                }
                requireString(percentage.context(), where + ": percentage context is required");
            }
        }
    }

    private String requireString(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new InvalidStatuteException(message);
        }
        return value;
    }

    private void requireNonNull(Object value, String message) {
        if (value == null) {
            throw new InvalidStatuteException(message);
        }
    }
}
