package com.lawcheck.verify.check;

import com.lawcheck.conflict.Jurisdictions;
import com.lawcheck.constraint.Verdict;
import com.lawcheck.model.Condition;
import com.lawcheck.model.Statute;
import com.lawcheck.verify.VerificationError;
import com.lawcheck.verify.VerificationResult;

import java.util.Optional;

/**
 * Two statutes with equivalent preconditions that prescribe different,
 * non-contradictory effects for the same resource: it is unclear which applies.
 */
public class AmbiguityCheck implements PairCheck {

    @Override
    public String checkId() {
        return "ambiguity";
    }

    @Override
    public VerificationResult check(Statute first, Statute second, CheckContext context) {
        VerificationResult result = VerificationResult.pass();
        if (first.effect().equals(second.effect())
                || first.effect().contradicts(second.effect())
                || !first.effect().resource().equals(second.effect().resource())
                || !Jurisdictions.sameOrUnspecified(first.jurisdiction(), second.jurisdiction())) {
            return result;
        }
        Optional<Condition> a = CheckContext.preconditionsOf(first);
        Optional<Condition> b = CheckContext.preconditionsOf(second);
        Verdict equivalent;
        if (a.isEmpty() && b.isEmpty()) {
            equivalent = Verdict.TRUE;
        } else if (a.isEmpty() || b.isEmpty()) {
            equivalent = context.backend().isTautology(a.isPresent() ? a.get() : b.get());
        } else {
            equivalent = context.backend().equivalent(a.get(), b.get());
        }
        if (equivalent.isTrue()) {
            result.addError(new VerificationError.Ambiguity(first.id(), second.id(), String.format(
                "equivalent preconditions lead to different effects ('%s' vs '%s') on '%s'",
                first.effect().effectType().getValue(), second.effect().effectType().getValue(),
                first.effect().resource())));
        }
        return result;
    }
}
