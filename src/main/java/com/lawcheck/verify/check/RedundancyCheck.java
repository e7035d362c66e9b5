package com.lawcheck.verify.check;

import com.lawcheck.constraint.ConstraintBackend;
import com.lawcheck.model.Condition;
import com.lawcheck.model.Statute;
import com.lawcheck.verify.VerificationResult;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Suggests dropping a precondition implied by another one, e.g.
 * {@code age >= 18} next to {@code age >= 21}. Of two equivalent
 * preconditions only the first is reported.
 */
public class RedundancyCheck implements StatuteCheck {

    @Override
    public String checkId() {
        return "redundant-condition";
    }

    @Override
    public VerificationResult check(Statute statute, CheckContext context) {
        VerificationResult result = VerificationResult.pass();
        List<Condition> conditions = statute.preconditions();
        if (conditions.size() < 2) {
            return result;
        }
        ConstraintBackend backend = context.backend();

        // an unsatisfiable premise implies everything; leave those to the dead statute check
        Set<Integer> usablePremises = new HashSet<>();
        for (int i = 0; i < conditions.size(); i++) {
            if (backend.isSatisfiable(conditions.get(i)).isTrue()) {
                usablePremises.add(i);
            }
        }

        Set<Integer> redundant = new HashSet<>();
        for (int j = 0; j < conditions.size(); j++) {
            for (int i = 0; i < conditions.size(); i++) {
                if (i == j || redundant.contains(i) || !usablePremises.contains(i)) {
                    continue;
                }
                if (backend.implies(conditions.get(i), conditions.get(j)).isTrue()) {
                    redundant.add(j);
                    result.addSuggestion(String.format(
                        "In statute '%s': condition '%s' is redundant (implied by '%s')",
                        statute.id(), conditions.get(j).render(), conditions.get(i).render()));
                    break;
                }
            }
        }
        return result;
    }
}
