package com.lawcheck.verify.check;

import com.lawcheck.constraint.Simplification;
import com.lawcheck.model.Condition;
import com.lawcheck.model.Statute;
import com.lawcheck.verify.ComplexityAnalyzer;
import com.lawcheck.verify.ComplexityLevel;
import com.lawcheck.verify.ComplexityMetrics;
import com.lawcheck.verify.VerificationResult;

import java.util.List;

/**
 * Warns about very complex statutes and suggests simpler forms of
 * preconditions the backend can rewrite.
 */
public class ComplexityCheck implements StatuteCheck {

    @Override
    public String checkId() {
        return "complexity";
    }

    @Override
    public VerificationResult check(Statute statute, CheckContext context) {
        VerificationResult result = VerificationResult.pass();
        ComplexityMetrics metrics = ComplexityAnalyzer.analyze(statute);
        if (metrics.complexityLevel() == ComplexityLevel.VERY_COMPLEX) {
            result.addWarning(String.format(
                "Statute '%s' is very complex (score %d/100, cyclomatic complexity %d); consider splitting it",
                statute.id(), metrics.complexityScore(), metrics.cyclomaticComplexity()));
        }
        List<Condition> conditions = statute.preconditions();
        for (int i = 0; i < conditions.size(); i++) {
            Simplification simplification = context.backend().simplify(conditions.get(i));
            if (simplification.changed()) {
                result.addSuggestion(String.format(
                    "In statute '%s', precondition %d can be simplified to: %s",
                    statute.id(), i + 1, simplification.condition().render()));
            }
        }
        return result;
    }
}
