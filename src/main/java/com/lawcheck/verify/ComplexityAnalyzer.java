package com.lawcheck.verify;

import com.lawcheck.model.Condition;
import com.lawcheck.model.ConditionShape;
import com.lawcheck.model.Statute;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural complexity of statutes. Pure functions; no solver involved.
 *
 * Score (capped at 100): preconditions beyond the first add 10 each (max 30),
 * nesting beyond depth 1 adds 15 per level (max 30), each logical operator
 * adds 8 (max 24), each condition type beyond the first adds 6 (max 12), and
 * discretion logic adds 10.
 */
public final class ComplexityAnalyzer {

    private ComplexityAnalyzer() {
    }

    public static ComplexityMetrics analyze(Statute statute) {
        int count = statute.preconditions().size();
        int depth = 0;
        int operators = 0;
        Set<String> kinds = new HashSet<>();
        for (Condition precondition : statute.preconditions()) {
            ConditionShape shape = ConditionShape.of(precondition);
            depth = Math.max(depth, shape.depth());
            operators += shape.operatorCount();
            kinds.addAll(shape.kinds());
        }
        boolean discretion = statute.hasDiscretion();
        int cyclomatic = 1 + count + operators;

        int score = 0;
        if (count > 1) {
            score += Math.min(30, (count - 1) * 10);
        }
        if (depth > 1) {
            score += Math.min(30, (depth - 1) * 15);
        }
        score += Math.min(24, operators * 8);
        if (kinds.size() > 1) {
            score += Math.min(12, (kinds.size() - 1) * 6);
        }
        if (discretion) {
            score += 10;
        }
        score = Math.min(100, score);

        return new ComplexityMetrics(statute.id(), count, depth, operators, kinds.size(),
            discretion, cyclomatic, score, ComplexityLevel.forScore(score));
    }

    /** Markdown summary: one section per statute followed by totals. */
    public static String report(List<Statute> statutes) {
        StringBuilder report = new StringBuilder("# Statute Complexity Report\n\n");
        int totalScore = 0;
        ComplexityLevel highest = ComplexityLevel.SIMPLE;
        for (Statute statute : statutes) {
            ComplexityMetrics metrics = analyze(statute);
            totalScore += metrics.complexityScore();
            if (metrics.complexityLevel().compareTo(highest) > 0) {
                highest = metrics.complexityLevel();
            }
            report.append("## ").append(statute.id()).append(": \"").append(statute.title()).append("\"\n")
                .append("- Complexity Level: ").append(metrics.complexityLevel().getLabel()).append('\n')
                .append("- Complexity Score: ").append(metrics.complexityScore()).append("/100\n")
                .append("- Conditions: ").append(metrics.conditionCount()).append('\n')
                .append("- Max Depth: ").append(metrics.conditionDepth()).append('\n')
                .append("- Logical Operators: ").append(metrics.logicalOperatorCount()).append('\n')
                .append("- Condition Types: ").append(metrics.conditionTypeCount()).append('\n')
                .append("- Has Discretion: ").append(metrics.hasDiscretion()).append('\n')
                .append("- Cyclomatic Complexity: ").append(metrics.cyclomaticComplexity()).append("\n\n");
        }
        int average = statutes.isEmpty() ? 0 : totalScore / statutes.size();
        report.append("## Summary\n")
            .append("- Total Statutes: ").append(statutes.size()).append('\n')
            .append("- Average Complexity Score: ").append(average).append('\n')
            .append("- Maximum Complexity Level: ").append(highest.getLabel()).append('\n');
        return report.toString();
    }
}
