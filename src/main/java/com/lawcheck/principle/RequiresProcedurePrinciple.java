package com.lawcheck.principle;

import com.lawcheck.model.Effect;
import com.lawcheck.model.Statute;

import java.util.List;
import java.util.Optional;

/**
 * Adverse effects (revocation, prohibition, status change) must name a
 * procedural safeguard: a {@code procedure}, {@code appeal} or
 * {@code hearing} parameter on the effect, or discretion logic that routes
 * the decision to a human.
 */
public class RequiresProcedurePrinciple implements Principle {

    public static final String ID = "due-process";

    static final List<String> SAFEGUARD_PARAMETERS = List.of("procedure", "appeal", "hearing");

    @Override
    public String principleId() {
        return ID;
    }

    @Override
    public String name() {
        return "Due Process";
    }

    @Override
    public String description() {
        return "Fair procedures must be followed";
    }

    @Override
    public Optional<PrincipleViolation> check(Statute statute) {
        Effect effect = statute.effect();
        if (!effect.effectType().isAdverse() || statute.hasDiscretion()) {
            return Optional.empty();
        }
        for (String parameter : SAFEGUARD_PARAMETERS) {
            String value = effect.parameters().get(parameter);
            if (value != null && !value.isBlank()) {
                return Optional.empty();
            }
        }
        return Optional.of(violation(statute,
            "adverse effect '" + effect.effectType().getValue() + "' has no procedural safeguard"));
    }
}
