package com.lawcheck.principle;

import com.lawcheck.model.Statute;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/** A caller-supplied principle: {@code complies} returns true for compliant statutes. */
public class CustomPrinciple implements Principle {

    private final String principleId;
    private final String description;
    private final Predicate<Statute> complies;

    public CustomPrinciple(String principleId, String description, Predicate<Statute> complies) {
        this.principleId = Objects.requireNonNull(principleId, "principleId");
        this.description = Objects.requireNonNull(description, "description");
        this.complies = Objects.requireNonNull(complies, "complies");
    }

    @Override
    public String principleId() {
        return principleId;
    }

    @Override
    public String name() {
        return description;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public Optional<PrincipleViolation> check(Statute statute) {
        if (complies.test(statute)) {
            return Optional.empty();
        }
        return Optional.of(violation(statute, "does not satisfy '" + description + "'"));
    }
}
