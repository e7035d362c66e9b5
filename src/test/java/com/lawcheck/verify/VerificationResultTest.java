package com.lawcheck.verify;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VerificationResultTest {

    @Test
    void warningFinding_keepsResultPassing() {
        VerificationResult result = VerificationResult.pass()
            .addError(new VerificationError.Ambiguity("a", "b", "same preconditions"));
        assertTrue(result.isPassed());
        assertFalse(result.hasCriticalErrors());
    }

    @Test
    void errorFinding_failsResult() {
        VerificationResult result = VerificationResult.pass()
            .addError(new VerificationError.DeadStatute("s1", "never applies"));
        assertFalse(result.isPassed());
    }

    @Test
    void merge_concatenatesInOrderAndAndsPassed() {
        VerificationResult first = VerificationResult.pass().addWarning("w1").addSuggestion("s1");
        VerificationResult second = VerificationResult.fail(List.of(
            new VerificationError.CircularReference(List.of("a", "b"))));
        second.addWarning("w2");

        first.merge(second);

        assertFalse(first.isPassed());
        assertEquals(List.of("w1", "w2"), first.getWarnings());
        assertEquals(List.of("s1"), first.getSuggestions());
        assertTrue(first.hasCriticalErrors());
    }

    @Test
    void fail_withoutFindings_stillFails() {
        assertFalse(VerificationResult.fail(List.of()).isPassed());
    }

    @Test
    void severityCounts_includeZeroes() {
        VerificationResult result = VerificationResult.pass()
            .addError(new VerificationError.DeadStatute("s1", "never applies"))
            .addError(new VerificationError.UnreachableCode("s1", 1, "always false"));
        Map<Severity, Integer> counts = result.severityCounts();
        assertEquals(1, counts.get(Severity.ERROR));
        assertEquals(1, counts.get(Severity.WARNING));
        assertEquals(0, counts.get(Severity.CRITICAL));
        assertEquals(1, result.errorsBySeverity(Severity.ERROR).size());
    }

    @Test
    void circularReference_messageClosesTheLoop() {
        assertEquals("Circular reference: a -> b -> a",
            new VerificationError.CircularReference(List.of("a", "b")).message());
    }
}
