package com.lawcheck.verify.check;

import com.lawcheck.constraint.ConstraintBackend;
import com.lawcheck.model.Condition;
import com.lawcheck.model.Statute;
import com.lawcheck.verify.VerificationError;
import com.lawcheck.verify.VerificationResult;

import java.util.List;
import java.util.Optional;

/**
 * Reports, per precondition, the first branch that can never be taken: an
 * unsatisfiable sub-condition, an OR side that is always false, or a NOT
 * over a tautology.
 */
public class UnreachableBranchCheck implements StatuteCheck {

    @Override
    public String checkId() {
        return "unreachable-branch";
    }

    @Override
    public VerificationResult check(Statute statute, CheckContext context) {
        VerificationResult result = VerificationResult.pass();
        List<Condition> conditions = statute.preconditions();
        for (int i = 0; i < conditions.size(); i++) {
            int index = i + 1;
            findUnreachable(conditions.get(i), context.backend()).ifPresent(detail ->
                result.addError(new VerificationError.UnreachableCode(statute.id(), index, detail)));
        }
        return result;
    }

    private Optional<String> findUnreachable(Condition condition, ConstraintBackend backend) {
        if (backend.isSatisfiable(condition).isFalse()) {
            return Optional.of("condition " + condition.render() + " can never be satisfied");
        }
        if (condition instanceof Condition.Or or) {
            if (backend.isSatisfiable(or.left()).isFalse()) {
                return Optional.of("left branch of OR is always false, making it redundant");
            }
            if (backend.isSatisfiable(or.right()).isFalse()) {
                return Optional.of("right branch of OR is always false, making it redundant");
            }
            return firstOf(findUnreachable(or.left(), backend), or.right(), backend);
        }
        if (condition instanceof Condition.And and) {
            return firstOf(findUnreachable(and.left(), backend), and.right(), backend);
        }
        if (condition instanceof Condition.Not not) {
            if (backend.isTautology(not.inner()).isTrue()) {
                return Optional.of("NOT of a tautology is always false");
            }
            return findUnreachable(not.inner(), backend);
        }
        return Optional.empty();
    }

    private Optional<String> firstOf(Optional<String> found, Condition next, ConstraintBackend backend) {
        return found.isPresent() ? found : findUnreachable(next, backend);
    }
}
