package com.lawcheck.constraint;

import com.lawcheck.model.ComparisonOp;
import com.lawcheck.model.Condition;
import com.lawcheck.model.DurationUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class HeuristicConstraintBackendTest {

    private static final Condition ADULT = Condition.age(ComparisonOp.GREATER_OR_EQUAL, 18);
    private static final Condition MINOR = Condition.age(ComparisonOp.LESS_THAN, 18);

    private HeuristicConstraintBackend backend;

    @BeforeEach
    void setUp() {
        backend = new HeuristicConstraintBackend();
    }

    @Nested
    @DisplayName("Satisfiability")
    class Satisfiability {

        @Test
        void disjointAgeBounds_unsatisfiable() {
            Verdict verdict = backend.isSatisfiable(Condition.and(ADULT, MINOR));
            assertTrue(verdict.isFalse());
            assertFalse(verdict.degraded());
        }

        @Test
        void touchingIntegerBounds_satisfiable() {
            Condition exactly18 = Condition.and(ADULT, Condition.age(ComparisonOp.LESS_OR_EQUAL, 18));
            assertTrue(backend.isSatisfiable(exactly18).isTrue());
        }

        @Test
        void strictIntegerGap_unsatisfiable() {
            Condition gap = Condition.and(
                Condition.income(ComparisonOp.GREATER_THAN, 10),
                Condition.income(ComparisonOp.LESS_THAN, 11));
            assertTrue(backend.isSatisfiable(gap).isFalse());
        }

        @Test
        void strictRealGap_satisfiable() {
            Condition gap = Condition.and(
                Condition.percentage(ComparisonOp.GREATER_THAN, 10.0, "share"),
                Condition.percentage(ComparisonOp.LESS_THAN, 10.5, "share"));
            assertTrue(backend.isSatisfiable(gap).isTrue());
        }

        @Test
        void negativeQuantity_unsatisfiable() {
            assertTrue(backend.isSatisfiable(Condition.age(ComparisonOp.LESS_THAN, 0)).isFalse());
        }

        @Test
        void negatedComplementaryBounds_satisfiedByAbsentAge() {
            Condition condition = Condition.and(Condition.not(ADULT), Condition.not(MINOR));
            assertTrue(backend.isSatisfiable(condition).isTrue());
        }

        @Test
        void negatedBound_constrainsPresentAge() {
            assertTrue(backend.isSatisfiable(Condition.and(ADULT, Condition.not(ADULT))).isFalse());
            Condition notOver65 = Condition.not(Condition.age(ComparisonOp.GREATER_THAN, 65));
            assertTrue(backend.implies(Condition.and(ADULT, notOver65),
                Condition.age(ComparisonOp.LESS_OR_EQUAL, 65)).isTrue());
        }

        @Test
        void negatedPercentages_satisfiedByAbsentShare() {
            Condition over = Condition.percentage(ComparisonOp.GREATER_THAN, 50.0, "share");
            Condition atMost = Condition.percentage(ComparisonOp.LESS_OR_EQUAL, 50.0, "share");
            assertTrue(backend.isSatisfiable(Condition.and(Condition.not(over), Condition.not(atMost))).isTrue());
            assertTrue(backend.isSatisfiable(Condition.and(over, Condition.not(over))).isFalse());
        }

        @Test
        void durationsInDifferentUnits_independent() {
            Condition condition = Condition.and(
                Condition.duration(ComparisonOp.GREATER_THAN, 5, DurationUnit.YEARS),
                Condition.duration(ComparisonOp.LESS_THAN, 2, DurationUnit.MONTHS));
            assertTrue(backend.isSatisfiable(condition).isTrue());
        }

        @Test
        void disjointSetMembership_unsatisfiable() {
            Condition condition = Condition.and(
                Condition.memberOf("status", Set.of("citizen")),
                Condition.attributeEquals("status", "resident"));
            assertTrue(backend.isSatisfiable(condition).isFalse());
        }

        @Test
        void presenceAndAbsence_unsatisfiable() {
            Condition condition = Condition.and(
                Condition.hasAttribute("license"),
                Condition.not(Condition.hasAttribute("license")));
            assertTrue(backend.isSatisfiable(condition).isFalse());
        }

        @Test
        void negatedMembership_satisfiedByAbsence() {
            Condition condition = Condition.and(
                Condition.notMemberOf("status", Set.of("citizen")),
                Condition.not(Condition.hasAttribute("status")));
            assertTrue(backend.isSatisfiable(condition).isTrue());
        }

        @Test
        void customPolarityClash_unsatisfiable() {
            Condition veteran = Condition.custom("is_veteran");
            assertTrue(backend.isSatisfiable(Condition.and(veteran, Condition.not(veteran))).isFalse());
        }

        @Test
        void patternOverUnconstrainedValue_unknown() {
            assertTrue(backend.isSatisfiable(Condition.matches("postcode", "^SW")).isUnknown());
        }

        @Test
        void patternOverCandidateValues_decided() {
            Condition condition = Condition.and(
                Condition.memberOf("postcode", Set.of("SW1", "EC2")),
                Condition.matches("postcode", "^N"));
            assertTrue(backend.isSatisfiable(condition).isFalse());
        }

        @Test
        void dnfOverflow_unknown() {
            HeuristicConstraintBackend tight = new HeuristicConstraintBackend(new AnalysisLimits(256, 10_000, 2));
            Condition wide = Condition.and(
                Condition.or(ADULT, Condition.custom("a")),
                Condition.or(MINOR, Condition.custom("b")));
            assertTrue(tight.isSatisfiable(wide).isUnknown());
        }
    }

    @Nested
    @DisplayName("Derived queries")
    class DerivedQueries {

        @Test
        void excludedMiddle_isTautology() {
            assertTrue(backend.isTautology(Condition.or(ADULT, Condition.not(ADULT))).isTrue());
            assertTrue(backend.isTautology(ADULT).isFalse());
        }

        @Test
        void complementaryBounds_notTautology_whenAgeMayBeAbsent() {
            assertTrue(backend.isTautology(Condition.or(ADULT, MINOR)).isFalse());
        }

        @Test
        void tighterBound_impliesLooserBound() {
            Condition over21 = Condition.age(ComparisonOp.GREATER_OR_EQUAL, 21);
            assertTrue(backend.implies(over21, ADULT).isTrue());
            assertTrue(backend.implies(ADULT, over21).isFalse());
        }

        @Test
        void equivalentBounds() {
            Condition over17 = Condition.age(ComparisonOp.GREATER_THAN, 17);
            assertTrue(backend.equivalent(ADULT, over17).isTrue());
        }

        @Test
        void contradicts_disjointBounds() {
            assertTrue(backend.contradicts(ADULT, MINOR).isTrue());
            assertTrue(backend.contradicts(ADULT, Condition.custom("x")).isFalse());
        }

        @Test
        void unsatCore_isMinimal() {
            List<Condition> conditions = List.of(
                Condition.hasAttribute("license"),
                ADULT,
                Condition.income(ComparisonOp.GREATER_THAN, 0),
                MINOR);
            Optional<List<Integer>> core = backend.unsatCore(conditions);
            assertEquals(Optional.of(List.of(1, 3)), core);
        }

        @Test
        void unsatCore_emptyForSatisfiableSet() {
            assertTrue(backend.unsatCore(List.of(ADULT, Condition.hasAttribute("x"))).isEmpty());
        }
    }

    @Nested
    @DisplayName("Simplification")
    class Simplify {

        @Test
        void doubleNegation_removed() {
            Simplification result = backend.simplify(Condition.not(Condition.not(ADULT)));
            assertTrue(result.changed());
            assertEquals(ADULT, result.condition());
        }

        @Test
        void impliedConjunct_dropped() {
            Condition over21 = Condition.age(ComparisonOp.GREATER_OR_EQUAL, 21);
            Simplification result = backend.simplify(Condition.and(over21, ADULT));
            assertEquals(over21, result.condition());
        }

        @Test
        void subsumedDisjunct_dropped() {
            Condition over21 = Condition.age(ComparisonOp.GREATER_OR_EQUAL, 21);
            Simplification result = backend.simplify(Condition.or(over21, ADULT));
            assertEquals(ADULT, result.condition());
        }

        @Test
        void negatedMembership_flipsAtom() {
            Simplification result = backend.simplify(Condition.not(Condition.memberOf("s", Set.of("a"))));
            assertEquals(Condition.notMemberOf("s", Set.of("a")), result.condition());
        }

        @Test
        void negatedComparison_keptAsIs() {
            Simplification result = backend.simplify(Condition.not(ADULT));
            assertFalse(result.changed());
        }
    }

    @Test
    void degradedBackend_marksEveryVerdict() {
        HeuristicConstraintBackend degraded = new HeuristicConstraintBackend(AnalysisLimits.DEFAULTS, true);
        assertEquals("heuristic-degraded", degraded.name());
        assertTrue(degraded.isSatisfiable(ADULT).degraded());
        assertTrue(degraded.implies(ADULT, ADULT).degraded());
    }
}
