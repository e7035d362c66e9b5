package com.lawcheck.verify.check;

import com.lawcheck.conflict.ConflictContext;
import com.lawcheck.conflict.ConflictDetector;
import com.lawcheck.conflict.ConflictRule;
import com.lawcheck.conflict.StatuteConflict;
import com.lawcheck.model.Statute;
import com.lawcheck.verify.VerificationError;
import com.lawcheck.verify.VerificationResult;

import java.util.List;
import java.util.stream.Collectors;

/** Reports the conflict rules' findings for one statute pair. */
public class ConflictCheck implements PairCheck {

    private final List<ConflictRule> rules;

    public ConflictCheck(List<ConflictRule> rules) {
        this.rules = List.copyOf(rules);
    }

    @Override
    public String checkId() {
        return "statute-conflicts" + rules.stream()
            .map(rule -> rule.type().getValue())
            .collect(Collectors.joining(",", "[", "]"));
    }

    @Override
    public VerificationResult check(Statute first, Statute second, CheckContext context) {
        ConflictDetector detector = new ConflictDetector(rules,
            new ConflictContext(context.backend(), context.settings().similarityThreshold()));
        VerificationResult result = VerificationResult.pass();
        for (StatuteConflict conflict : detector.detectPair(first, second)) {
            result.addError(VerificationError.fromConflict(conflict));
        }
        return result;
    }
}
