package com.lawcheck.verify.check;

import com.lawcheck.conflict.ConflictContext;
import com.lawcheck.conflict.Jurisdictions;
import com.lawcheck.model.Statute;
import com.lawcheck.verify.VerificationError;
import com.lawcheck.verify.VerificationResult;

/**
 * Two statutes in the same jurisdiction whose effects exclude each other on
 * one resource while their preconditions can hold at once. Pairs from
 * different levels of a jurisdiction hierarchy are left to the hierarchy
 * violation rule.
 */
public class ContradictionCheck implements PairCheck {

    @Override
    public String checkId() {
        return "logical-contradiction";
    }

    @Override
    public VerificationResult check(Statute first, Statute second, CheckContext context) {
        VerificationResult result = VerificationResult.pass();
        if (!first.effect().contradicts(second.effect())
                || !Jurisdictions.sameOrUnspecified(first.jurisdiction(), second.jurisdiction())) {
            return result;
        }
        ConflictContext overlap = new ConflictContext(context.backend(), context.settings().similarityThreshold());
        if (!overlap.preconditionsOverlap(first, second).isTrue()) {
            return result;
        }
        result.addError(new VerificationError.LogicalContradiction(first.id(), second.id(),
            String.format("effects '%s' and '%s' on '%s' can apply to the same subject",
                first.effect().effectType().getValue(),
                second.effect().effectType().getValue(),
                first.effect().resource()),
            context.settings().contradictionSeverity()));
        return result;
    }
}
