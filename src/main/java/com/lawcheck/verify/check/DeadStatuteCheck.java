package com.lawcheck.verify.check;

import com.lawcheck.constraint.Verdict;
import com.lawcheck.model.Condition;
import com.lawcheck.model.Statute;
import com.lawcheck.verify.VerificationError;
import com.lawcheck.verify.VerificationResult;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Flags statutes whose preconditions are proven jointly unsatisfiable.
 * An undecided query produces no finding.
 */
public class DeadStatuteCheck implements StatuteCheck {

    @Override
    public String checkId() {
        return "dead-statute";
    }

    @Override
    public VerificationResult check(Statute statute, CheckContext context) {
        VerificationResult result = VerificationResult.pass();
        Optional<Condition> preconditions = CheckContext.preconditionsOf(statute);
        if (preconditions.isEmpty()) {
            return result;
        }
        Verdict verdict = context.backend().isSatisfiable(preconditions.get());
        if (!verdict.isFalse()) {
            return result;
        }
        result.addError(new VerificationError.DeadStatute(statute.id(),
            "preconditions can never be satisfied together"));

        List<Condition> conditions = statute.preconditions();
        context.backend().unsatCore(conditions).ifPresent(core -> result.addSuggestion(
            "In statute '" + statute.id() + "': conflicting preconditions "
                + core.stream()
                    .map(i -> (i + 1) + " (" + conditions.get(i).render() + ")")
                    .collect(Collectors.joining(", "))));
        return result;
    }
}
