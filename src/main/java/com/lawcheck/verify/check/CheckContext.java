package com.lawcheck.verify.check;

import com.lawcheck.constraint.ConstraintBackend;
import com.lawcheck.model.Condition;
import com.lawcheck.model.Statute;
import com.lawcheck.verify.VerifierSettings;

import java.util.Optional;

/** What a check may use while it runs: the constraint backend and the verifier settings. */
public record CheckContext(ConstraintBackend backend, VerifierSettings settings) {

    /** Conjunction of a statute's preconditions, empty when it has none. */
    public static Optional<Condition> preconditionsOf(Statute statute) {
        if (statute.preconditions().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Condition.allOf(statute.preconditions()));
    }
}
