package com.lawcheck.conflict;

import com.lawcheck.constraint.HeuristicConstraintBackend;
import com.lawcheck.model.ComparisonOp;
import com.lawcheck.model.Condition;
import com.lawcheck.model.EffectType;
import com.lawcheck.model.Statute;
import com.lawcheck.model.TemporalValidity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConflictDetectorTest {

    private ConflictDetector detector;

    @BeforeEach
    void setUp() {
        detector = new ConflictDetector(ConflictDetector.defaultRules(),
            new ConflictContext(new HeuristicConstraintBackend(), 0.5));
    }

    private static List<ConflictType> types(List<StatuteConflict> conflicts) {
        return conflicts.stream().map(StatuteConflict::conflictType).toList();
    }

    @Nested
    @DisplayName("Rules")
    class Rules {

        @Test
        void sameId_collides() {
            Statute v1 = Statute.builder("tax-1").title("Income Tax").build();
            Statute v2 = v1.amend().build();
            List<StatuteConflict> conflicts = detector.detectPair(v1, v2);
            assertTrue(types(conflicts).contains(ConflictType.ID_COLLISION));
            // both versions have no validity window, so they overlap in time
            assertTrue(types(conflicts).contains(ConflictType.TEMPORAL_CONFLICT));
        }

        @Test
        void consecutiveVersions_noTemporalConflict() {
            Statute v1 = Statute.builder("tax-1").title("Income Tax")
                .temporalValidity(TemporalValidity.between(LocalDate.of(2020, 1, 1), LocalDate.of(2020, 12, 31)))
                .build();
            Statute v2 = v1.amend()
                .temporalValidity(TemporalValidity.between(LocalDate.of(2021, 1, 1), null))
                .build();
            assertFalse(types(detector.detectPair(v1, v2)).contains(ConflictType.TEMPORAL_CONFLICT));
        }

        @Test
        void similarStatutesInNestedJurisdictions_overlap() {
            Statute federal = Statute.builder("a").title("Housing Benefit Act").jurisdiction("US")
                .precondition(Condition.income(ComparisonOp.LESS_THAN, 30_000)).build();
            Statute state = Statute.builder("b").title("Housing Benefit Rules").jurisdiction("US-CA")
                .precondition(Condition.income(ComparisonOp.LESS_THAN, 20_000)).build();
            assertEquals(List.of(ConflictType.JURISDICTIONAL_OVERLAP), types(detector.detectPair(federal, state)));
        }

        @Test
        void disjointPreconditions_noOverlap() {
            Statute a = Statute.builder("a").title("Housing Benefit").jurisdiction("US")
                .precondition(Condition.age(ComparisonOp.LESS_THAN, 18)).build();
            Statute b = Statute.builder("b").title("Housing Benefit").jurisdiction("US")
                .precondition(Condition.age(ComparisonOp.GREATER_OR_EQUAL, 18)).build();
            assertTrue(detector.detectPair(a, b).isEmpty());
        }

        @Test
        void lowerJurisdictionContradictingHigher_violatesHierarchy() {
            Statute national = Statute.builder("n").title("Firearm licensing").jurisdiction("US")
                .effect(EffectType.GRANT, "firearm license").build();
            Statute city = Statute.builder("c").title("City ban").jurisdiction("US-CA/SF")
                .effect(EffectType.REVOKE, "Firearm  License").build();
            List<StatuteConflict> conflicts = detector.detectPair(city, national);
            assertEquals(List.of(ConflictType.HIERARCHY_VIOLATION), types(conflicts));
            assertTrue(conflicts.get(0).description().contains("'c' (US-CA/SF)"));
        }

        @Test
        void siblingJurisdictionsContradicting_noHierarchyViolation() {
            Statute california = Statute.builder("ca").title("Firearm licensing").jurisdiction("US-CA")
                .effect(EffectType.GRANT, "firearm license").build();
            Statute newYork = Statute.builder("ny").title("Firearm ban").jurisdiction("US-NY")
                .effect(EffectType.REVOKE, "firearm license").build();
            assertFalse(types(detector.detectPair(california, newYork)).contains(ConflictType.HIERARCHY_VIOLATION));
        }

        @Test
        void siblingJurisdictions_notRanked() {
            assertFalse(Jurisdictions.ranked("US-CA", "US-NY"));
            assertFalse(Jurisdictions.isAncestor("US", "USA"));
            assertTrue(Jurisdictions.isAncestor("us", "US.TX"));
        }
    }

    @Test
    void detectPair_isSymmetric() {
        Statute a = Statute.builder("a").title("Housing Benefit Act").jurisdiction("US").build();
        Statute b = Statute.builder("b").title("Housing Benefit Act").jurisdiction("US").version(2).build();
        assertEquals(detector.detectPair(a, b), detector.detectPair(b, a));
        assertFalse(detector.detectPair(a, b).isEmpty());
        assertEquals("a", detector.detectPair(b, a).get(0).firstId());
    }

    @Test
    void detect_scansEveryPair() {
        Statute a = Statute.builder("x").title("One").build();
        Statute b = Statute.builder("x").title("Two").build();
        Statute c = Statute.builder("x").title("Three").build();
        long collisions = detector.detect(List.of(a, b, c)).stream()
            .filter(conflict -> conflict.conflictType() == ConflictType.ID_COLLISION)
            .count();
        assertEquals(3, collisions);
    }

    @Test
    void blankTitles_areNotSimilar() {
        assertEquals(0.0, Similarity.jaccard("", "  "));
        assertEquals(1.0, Similarity.jaccard("Housing Act", "housing  act"));
    }
}
