package com.lawcheck.principle;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

public final class Principles {

    public static final List<String> DEFAULT_IDS = List.of(
        NoDiscriminationPrinciple.ID, RequiresProcedurePrinciple.ID, NoRetroactivityPrinciple.ID);

    private Principles() {
    }

    public static List<Principle> defaults() {
        return defaults(DEFAULT_IDS, NoDiscriminationPrinciple.DEFAULT_PROTECTED_ATTRIBUTES);
    }

    /**
     * The built-in principles named in {@code enabledIds}, in the order given.
     *
     * @throws IllegalArgumentException for an unknown id
     */
    public static List<Principle> defaults(Collection<String> enabledIds, Set<String> protectedAttributes) {
        List<Principle> principles = new ArrayList<>();
        for (String id : enabledIds) {
            switch (id) {
                case NoDiscriminationPrinciple.ID -> principles.add(new NoDiscriminationPrinciple(protectedAttributes));
                case RequiresProcedurePrinciple.ID -> principles.add(new RequiresProcedurePrinciple());
                case NoRetroactivityPrinciple.ID -> principles.add(new NoRetroactivityPrinciple());
                default -> throw new IllegalArgumentException("unknown principle: " + id);
            }
        }
        return List.copyOf(principles);
    }
}
