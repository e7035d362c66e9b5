package com.lawcheck.verify;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Mutable accumulator of verification findings.
 *
 * {@code passed} turns false as soon as a finding of severity
 * {@link Severity#ERROR} or worse is added. Merging is associative: lists are
 * concatenated in order and {@code passed} values are combined with AND.
 */
public class VerificationResult {

    private boolean passed = true;
    private final List<VerificationError> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final List<String> suggestions = new ArrayList<>();

    public static VerificationResult pass() {
        return new VerificationResult();
    }

    public static VerificationResult fail(List<VerificationError> errors) {
        VerificationResult result = new VerificationResult();
        errors.forEach(result::addError);
        result.passed = false;
        return result;
    }

    public VerificationResult addError(VerificationError error) {
        errors.add(Objects.requireNonNull(error, "error"));
        if (error.severity().isAtLeast(Severity.ERROR)) {
            passed = false;
        }
        return this;
    }

    public VerificationResult addWarning(String warning) {
        warnings.add(warning);
        return this;
    }

    public VerificationResult addSuggestion(String suggestion) {
        suggestions.add(suggestion);
        return this;
    }

    public VerificationResult merge(VerificationResult other) {
        passed = passed && other.passed;
        errors.addAll(other.errors);
        warnings.addAll(other.warnings);
        suggestions.addAll(other.suggestions);
        return this;
    }

    public VerificationResult copy() {
        return new VerificationResult().merge(this);
    }

    @JsonProperty("passed")
    public boolean isPassed() {
        return passed;
    }

    @JsonProperty("errors")
    public List<VerificationError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    @JsonProperty("warnings")
    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    @JsonProperty("suggestions")
    public List<String> getSuggestions() {
        return Collections.unmodifiableList(suggestions);
    }

    /** Findings of at least the given severity, in report order. */
    public List<VerificationError> errorsBySeverity(Severity minimum) {
        List<VerificationError> matching = new ArrayList<>();
        for (VerificationError error : errors) {
            if (error.severity().isAtLeast(minimum)) {
                matching.add(error);
            }
        }
        return matching;
    }

    public Map<Severity, Integer> severityCounts() {
        Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            counts.put(severity, 0);
        }
        for (VerificationError error : errors) {
            counts.merge(error.severity(), 1, Integer::sum);
        }
        return counts;
    }

    public boolean hasCriticalErrors() {
        return errors.stream().anyMatch(e -> e.severity() == Severity.CRITICAL);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VerificationResult other)) {
            return false;
        }
        return passed == other.passed
            && errors.equals(other.errors)
            && warnings.equals(other.warnings)
            && suggestions.equals(other.suggestions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(passed, errors, warnings, suggestions);
    }

    @Override
    public String toString() {
        return "VerificationResult{passed=" + passed
            + ", errors=" + errors.size()
            + ", warnings=" + warnings.size()
            + ", suggestions=" + suggestions.size() + "}";
    }
}
