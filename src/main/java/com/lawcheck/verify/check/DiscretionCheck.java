package com.lawcheck.verify.check;

import com.lawcheck.model.Statute;
import com.lawcheck.verify.VerificationResult;

public class DiscretionCheck implements StatuteCheck {

    @Override
    public String checkId() {
        return "discretion";
    }

    @Override
    public boolean usesSolver() {
        return false;
    }

    @Override
    public VerificationResult check(Statute statute, CheckContext context) {
        VerificationResult result = VerificationResult.pass();
        if (statute.hasDiscretion()) {
            result.addWarning("Statute '" + statute.id()
                + "' contains discretionary elements that require human review");
        }
        return result;
    }
}
