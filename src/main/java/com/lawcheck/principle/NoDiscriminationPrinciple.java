package com.lawcheck.principle;

import com.lawcheck.model.Condition;
import com.lawcheck.model.Statute;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Flags statutes whose preconditions test a protected attribute, such as
 * gender or religion. Attribute names are compared case-insensitively.
 */
public class NoDiscriminationPrinciple implements Principle {

    public static final String ID = "equality";

    public static final Set<String> DEFAULT_PROTECTED_ATTRIBUTES = Set.of(
        "race", "ethnicity", "religion", "gender", "sex", "sexual_orientation",
        "national_origin", "disability", "political_opinion");

    private final Set<String> protectedAttributes;

    public NoDiscriminationPrinciple() {
        this(DEFAULT_PROTECTED_ATTRIBUTES);
    }

    public NoDiscriminationPrinciple(Set<String> protectedAttributes) {
        this.protectedAttributes = protectedAttributes.stream()
            .map(a -> a.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public String principleId() {
        return ID;
    }

    @Override
    public String name() {
        return "Equal Protection";
    }

    @Override
    public String description() {
        return "All persons are equal under the law";
    }

    @Override
    public Optional<PrincipleViolation> check(Statute statute) {
        Set<String> found = new TreeSet<>();
        for (Condition precondition : statute.preconditions()) {
            collectProtected(precondition, found);
        }
        if (found.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(violation(statute,
            "preconditions test protected attributes " + found));
    }

    private void collectProtected(Condition root, Set<String> found) {
        Deque<Condition> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Condition current = stack.pop();
            String attribute = null;
            if (current instanceof Condition.And and) {
                stack.push(and.right());
                stack.push(and.left());
            } else if (current instanceof Condition.Or or) {
                stack.push(or.right());
                stack.push(or.left());
            } else if (current instanceof Condition.Not not) {
                stack.push(not.inner());
            } else if (current instanceof Condition.HasAttribute has) {
                attribute = has.key();
            } else if (current instanceof Condition.AttributeEquals equals) {
                attribute = equals.key();
            } else if (current instanceof Condition.SetMembership membership) {
                attribute = membership.attribute();
            } else if (current instanceof Condition.Pattern pattern) {
                attribute = pattern.attribute();
            }
            if (attribute != null && protectedAttributes.contains(attribute.toLowerCase(Locale.ROOT))) {
                found.add(attribute);
            }
        }
    }
}
