package com.lawcheck.verify.check;

import com.lawcheck.model.Statute;
import com.lawcheck.principle.Principle;
import com.lawcheck.principle.PrincipleViolation;
import com.lawcheck.verify.VerificationError;
import com.lawcheck.verify.VerificationResult;

import java.util.List;
import java.util.Optional;

public class PrincipleCheck implements StatuteCheck {

    private final List<Principle> principles;

    public PrincipleCheck(List<Principle> principles) {
        this.principles = List.copyOf(principles);
    }

    @Override
    public String checkId() {
        return "constitutional-compliance";
    }

    @Override
    public boolean usesSolver() {
        return false;
    }

    // principles are caller-supplied code and have no content fingerprint
    @Override
    public boolean cacheable() {
        return false;
    }

    @Override
    public VerificationResult check(Statute statute, CheckContext context) {
        VerificationResult result = VerificationResult.pass();
        for (Principle principle : principles) {
            Optional<PrincipleViolation> violation = principle.check(statute);
            violation.ifPresent(v -> result.addError(
                new VerificationError.ConstitutionalConflict(v.statuteId(), v.principle(), v.detail())));
        }
        return result;
    }
}
