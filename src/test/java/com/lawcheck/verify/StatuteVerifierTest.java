package com.lawcheck.verify;

import com.lawcheck.conflict.ConflictDetector;
import com.lawcheck.constraint.AnalysisLimits;
import com.lawcheck.constraint.HeuristicConstraintBackend;
import com.lawcheck.eval.DefaultConditionEvaluator;
import com.lawcheck.eval.EvaluationContext;
import com.lawcheck.model.ComparisonOp;
import com.lawcheck.model.Condition;
import com.lawcheck.model.Effect;
import com.lawcheck.model.EffectType;
import com.lawcheck.model.InvalidStatuteException;
import com.lawcheck.model.Statute;
import com.lawcheck.principle.CustomPrinciple;
import com.lawcheck.principle.Principles;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class StatuteVerifierTest {

    private static final Condition ADULT = Condition.age(ComparisonOp.GREATER_OR_EQUAL, 18);
    private static final Condition MINOR = Condition.age(ComparisonOp.LESS_THAN, 18);

    private StatuteVerifier verifier;

    private static void pause(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(ex);
        }
    }

    @BeforeEach
    void setUp() {
        verifier = new StatuteVerifier(new HeuristicConstraintBackend());
    }

    @Nested
    @DisplayName("Structural findings")
    class Structural {

        @Test
        void contradictoryPreconditions_reportDeadStatute() {
            Statute s1 = Statute.builder("s1").precondition(ADULT).build();
            Statute s2 = Statute.builder("s2").precondition(ADULT).precondition(MINOR).build();

            VerificationResult result = verifier.verify(List.of(s1, s2));

            assertFalse(result.isPassed());
            assertEquals(List.of(new VerificationError.DeadStatute("s2", "preconditions can never be satisfied together")),
                result.getErrors());
            assertTrue(result.getSuggestions().stream()
                .anyMatch(s -> s.startsWith("In statute 's2': conflicting preconditions 1")));
        }

        @Test
        void negatedComplementaryBounds_notDead_whenAgeIsUnknown() {
            Statute statute = Statute.builder("s").precondition(Condition.not(ADULT))
                .precondition(Condition.not(MINOR)).build();

            VerificationResult result = verifier.verify(List.of(statute));

            assertTrue(new DefaultConditionEvaluator()
                .evaluateAll(statute.preconditions(), EvaluationContext.empty()));
            assertTrue(result.isPassed());
            assertTrue(result.getErrors().isEmpty(), () -> "unexpected errors " + result.getErrors());
        }

        @Test
        void mutualReferences_reportOneCycle() {
            Statute s1 = Statute.builder("s1").reference("s2").build();
            Statute s2 = Statute.builder("s2").reference("s1").build();

            VerificationResult result = verifier.verify(List.of(s1, s2));

            assertFalse(result.isPassed());
            assertEquals(List.of(new VerificationError.CircularReference(List.of("s1", "s2"))), result.getErrors());
        }

        @Test
        void unknownReference_isWarningOnly() {
            VerificationResult result = verifier.verify(List.of(Statute.builder("s1").reference("ghost").build()));

            assertTrue(result.isPassed());
            assertTrue(result.getWarnings().contains("Statute 's1' references unknown statutes [ghost]"));
        }

        @Test
        void alwaysFalseBranch_reportedAsUnreachable() {
            Statute statute = Statute.builder("s1")
                .precondition(Condition.or(Condition.and(ADULT, MINOR), Condition.hasAttribute("license")))
                .build();

            VerificationResult result = verifier.verify(List.of(statute));

            assertEquals(List.of(new VerificationError.UnreachableCode("s1", 1,
                "left branch of OR is always false, making it redundant")), result.getErrors());
            assertTrue(result.isPassed());
        }

        @Test
        void impliedPrecondition_suggestedAsRedundant() {
            Statute statute = Statute.builder("s1")
                .precondition(Condition.age(ComparisonOp.GREATER_OR_EQUAL, 21))
                .precondition(ADULT)
                .build();

            VerificationResult result = verifier.verify(List.of(statute));

            assertTrue(result.getSuggestions().contains(
                "In statute 's1': condition 'age >= 18' is redundant (implied by 'age >= 21')"));
        }

        @Test
        void discretion_flaggedForReview() {
            Statute statute = Statute.builder("s1").discretionLogic("judge decides").build();
            VerificationResult result = verifier.verify(List.of(statute));
            assertTrue(result.getWarnings().contains(
                "Statute 's1' contains discretionary elements that require human review"));
        }

        @Test
        void malformedInput_rejectedBeforeChecks() {
            Statute broken = Statute.builder("s1").precondition(Condition.matches("x", "(")).build();
            assertThrows(InvalidStatuteException.class, () -> verifier.verify(List.of(broken)));
        }

        @Test
        void emptyInput_passes() {
            VerificationResult result = verifier.verify(List.of());
            assertTrue(result.isPassed());
            assertTrue(result.getErrors().isEmpty());
        }
    }

    @Nested
    @DisplayName("Pairwise findings")
    class Pairwise {

        private final Statute grant = Statute.builder("a").effect(EffectType.GRANT, "parking permit").build();
        private final Statute revoke = Statute.builder("b")
            .effect(new Effect(EffectType.REVOKE, "Parking Permit").withParameter("appeal", "council"))
            .build();

        @Test
        void contradictoryEffects_reportedWithConfiguredSeverity() {
            VerificationResult result = verifier.verify(List.of(revoke, grant));

            assertFalse(result.isPassed());
            assertEquals(1, result.getErrors().size());
            VerificationError.LogicalContradiction contradiction =
                assertInstanceOf(VerificationError.LogicalContradiction.class, result.getErrors().get(0));
            assertEquals("a", contradiction.firstId());
            assertEquals("b", contradiction.secondId());
            assertEquals(Severity.ERROR, contradiction.severity());
        }

        @Test
        void warningSeverity_keepsRunPassing() {
            try (StatuteVerifier lenient = new StatuteVerifier(new HeuristicConstraintBackend(),
                    VerifierSettings.DEFAULTS.withContradictionSeverity(Severity.WARNING), null,
                    Principles.defaults(), ConflictDetector.defaultRules())) {
                VerificationResult result = lenient.verify(List.of(grant, revoke));
                assertTrue(result.isPassed());
                assertEquals(Severity.WARNING, result.getErrors().get(0).severity());
            }
        }

        @Test
        void disjointPreconditions_noContradiction() {
            Statute adults = Statute.builder("a").precondition(ADULT).effect(EffectType.GRANT, "permit").build();
            Statute minors = Statute.builder("b").precondition(MINOR)
                .effect(new Effect(EffectType.REVOKE, "permit").withParameter("hearing", "yes"))
                .build();
            assertTrue(verifier.verify(List.of(adults, minors)).getErrors().isEmpty());
        }

        @Test
        void equivalentPreconditionsDifferentEffects_reportAmbiguity() {
            Statute a = Statute.builder("a").precondition(ADULT).effect(EffectType.GRANT, "benefit").build();
            Statute b = Statute.builder("b").precondition(Condition.age(ComparisonOp.GREATER_THAN, 17))
                .effect(EffectType.OBLIGATION, "benefit").build();

            VerificationResult result = verifier.verify(List.of(a, b));

            assertEquals(1, result.getErrors().size());
            assertInstanceOf(VerificationError.Ambiguity.class, result.getErrors().get(0));
            assertTrue(result.isPassed());
        }

        @Test
        void duplicateIds_reportIdCollision() {
            Statute v1 = Statute.builder("tax").title("Tax").build();
            Statute again = Statute.builder("tax").title("Tax").build();

            VerificationResult result = verifier.verify(List.of(v1, again));

            assertTrue(result.getErrors().stream().anyMatch(e -> e instanceof VerificationError.IdCollision));
            assertFalse(result.isPassed());
        }
    }

    @Nested
    @DisplayName("Principles")
    class PrincipleFindings {

        @Test
        void protectedAttribute_isConstitutionalConflict() {
            Statute statute = Statute.builder("s1").precondition(Condition.attributeEquals("religion", "x")).build();

            VerificationResult result = verifier.verify(List.of(statute));

            assertTrue(result.hasCriticalErrors());
            VerificationError.ConstitutionalConflict conflict =
                assertInstanceOf(VerificationError.ConstitutionalConflict.class, result.getErrors().get(0));
            assertEquals("Equal Protection", conflict.principle());
        }

        @Test
        void callerPrinciples_replaceDefaults() {
            Statute statute = Statute.builder("s1").precondition(Condition.attributeEquals("religion", "x")).build();
            CustomPrinciple titled = new CustomPrinciple("titled", "Statutes must have a title", s -> !s.title().isBlank());

            VerificationResult result = verifier.verify(List.of(statute), List.of(titled));

            assertEquals(1, result.getErrors().size());
            assertTrue(result.getErrors().get(0).message().contains("Statutes must have a title"));
        }
    }

    @Nested
    @DisplayName("Execution")
    class Execution {

        private List<Statute> corpus() {
            List<Statute> statutes = new ArrayList<>();
            for (int i = 0; i < 12; i++) {
                Statute.Builder builder = Statute.builder("s" + i)
                    .title("Benefit rule " + i)
                    .precondition(Condition.age(ComparisonOp.GREATER_OR_EQUAL, 10 + i))
                    .effect(i % 2 == 0 ? EffectType.GRANT : EffectType.REVOKE, "benefit");
                if (i % 3 == 0) {
                    builder.precondition(Condition.age(ComparisonOp.LESS_THAN, 5));
                }
                if (i > 0) {
                    builder.reference("s" + (i - 1));
                }
                statutes.add(builder.build());
            }
            statutes.add(Statute.builder("s0").reference("s11").build());
            return statutes;
        }

        @Test
        void repeatedRuns_giveEqualResults() {
            assertEquals(verifier.verify(corpus()), verifier.verify(corpus()));
        }

        @Test
        void parallelRun_matchesSequentialRun() {
            VerificationResult sequential = verifier.verify(corpus());
            try (StatuteVerifier parallel = new StatuteVerifier(new HeuristicConstraintBackend(),
                    VerifierSettings.DEFAULTS.withParallel(true, 4), null,
                    Principles.defaults(), ConflictDetector.defaultRules())) {
                assertEquals(sequential, parallel.verify(corpus()));
            }
        }

        @Test
        void cachedRun_matchesColdRun() {
            VerificationCache cache = new VerificationCache();
            try (StatuteVerifier cached = new StatuteVerifier(new HeuristicConstraintBackend(),
                    VerifierSettings.DEFAULTS, cache, Principles.defaults(), ConflictDetector.defaultRules())) {
                VerificationResult cold = cached.verify(corpus());
                long missesAfterCold = cache.stats().missCount();
                VerificationResult warm = cached.verify(corpus());

                assertEquals(cold, warm);
                assertEquals(verifier.verify(corpus()), warm);
                assertEquals(missesAfterCold, cache.stats().missCount());
                assertTrue(cache.stats().hitCount() > 0);
            }
        }

        @Test
        void checkBudget_skipsRemainingWork() {
            List<Statute> statutes = List.of(
                Statute.builder("a").build(), Statute.builder("b").build(), Statute.builder("c").build());
            try (StatuteVerifier bounded = new StatuteVerifier(new HeuristicConstraintBackend(),
                    VerifierSettings.DEFAULTS.withBudget(new VerificationBudget(2, Duration.ZERO)), null,
                    Principles.defaults(), ConflictDetector.defaultRules())) {
                VerificationResult result = bounded.verify(statutes);
                assertTrue(result.getWarnings().contains(
                    "Verification budget exceeded: 4 of 6 checks skipped; results are partial"));
            }
        }

        @Test
        void timeBudget_skipsUnitsStartedAfterDeadline() {
            List<Statute> statutes = List.of(
                Statute.builder("a").build(), Statute.builder("b").build(), Statute.builder("c").build());
            AtomicInteger inspected = new AtomicInteger();
            CustomPrinciple slow = new CustomPrinciple("slow", "Takes longer than the budget", statute -> {
                inspected.incrementAndGet();
                pause(Duration.ofMillis(200));
                return true;
            });
            try (StatuteVerifier bounded = new StatuteVerifier(new HeuristicConstraintBackend(),
                    VerifierSettings.DEFAULTS.withBudget(new VerificationBudget(0, Duration.ofMillis(50))), null,
                    Principles.defaults(), ConflictDetector.defaultRules())) {
                VerificationResult result = bounded.verify(statutes, List.of(slow));

                assertEquals(1, inspected.get());
                assertTrue(result.isPassed());
                assertTrue(result.getWarnings().contains(
                    "Verification budget exceeded: 5 of 6 checks skipped; results are partial"),
                    () -> "warnings were " + result.getWarnings());
            }
        }

        @Test
        void degradedBackend_addsSingleReducedPrecisionWarning() {
            try (StatuteVerifier degraded = new StatuteVerifier(
                    new HeuristicConstraintBackend(AnalysisLimits.DEFAULTS, true))) {
                VerificationResult result = degraded.verify(corpus());
                assertEquals(1, result.getWarnings().stream()
                    .filter(StatuteVerifier.REDUCED_PRECISION_WARNING::equals)
                    .count());
            }
        }

        @Test
        void exactBackend_noReducedPrecisionWarning() {
            assertFalse(verifier.verify(corpus()).getWarnings().contains(StatuteVerifier.REDUCED_PRECISION_WARNING));
        }

        @Test
        void oversizedStatute_skipsSolverChecks() {
            Condition deep = ADULT;
            for (int i = 0; i < 10; i++) {
                deep = Condition.not(Condition.not(deep));
            }
            Statute statute = Statute.builder("deep").precondition(deep).precondition(MINOR).build();
            VerifierSettings tight = new VerifierSettings(Severity.ERROR, 0.5, new AnalysisLimits(8, 1000, 64),
                false, false, 0, VerificationBudget.UNLIMITED);
            try (StatuteVerifier guarded = new StatuteVerifier(new HeuristicConstraintBackend(tight.limits()), tight,
                    null, Principles.defaults(), ConflictDetector.defaultRules())) {
                VerificationResult result = guarded.verify(List.of(statute));
                assertTrue(result.getWarnings().contains(
                    "Statute 'deep' exceeds the analysis limits; solver-based checks were skipped"));
                assertTrue(result.getErrors().isEmpty());
            }
        }
    }

    @Nested
    @DisplayName("Analyses")
    class Analyses {

        @Test
        void coverage_classifiesEveryPrecondition() {
            Statute statute = Statute.builder("s1")
                .precondition(ADULT)
                .precondition(Condition.and(ADULT, MINOR))
                .precondition(Condition.matches("postcode", "^SW"))
                .build();

            CoverageReport report = verifier.analyzeCoverage(List.of(statute));

            assertEquals(3, report.totalConditions());
            assertEquals(1, report.satisfiableConditions());
            assertEquals(1, report.unsatisfiableConditions());
            assertEquals(1, report.undecided());
            assertEquals(List.of(0), report.coveredConditions().get("s1"));
            assertEquals(List.of(1, 2), report.uncoveredConditions().get("s1"));
        }

        @Test
        void graphMetrics_reportCycle() {
            Statute s1 = Statute.builder("s1").reference("s2").build();
            Statute s2 = Statute.builder("s2").reference("s1").build();
            assertEquals(List.of(List.of("s1", "s2")), verifier.analyzeGraphMetrics(List.of(s1, s2)).cycles());
        }

        @Test
        void simplify_removesDoubleNegation() {
            assertEquals(ADULT, verifier.simplify(Condition.not(Condition.not(ADULT))).condition());
        }

        @Test
        void statuteConflicts_delegateToRules() {
            Statute a = Statute.builder("x").title("Rule").build();
            Statute b = Statute.builder("x").title("Rule").version(2).build();
            assertEquals(2, verifier.detectStatuteConflicts(List.of(a, b)).size());
        }

        @Test
        void legacyCustomReferences_buildEdges() {
            Statute s1 = Statute.builder("s1").precondition(Condition.custom("statute:s2")).build();
            Statute s2 = Statute.builder("s2").precondition(Condition.custom("statute:s1")).build();
            try (StatuteVerifier legacy = new StatuteVerifier(new HeuristicConstraintBackend(),
                    VerifierSettings.DEFAULTS.withLegacyCustomReferences(true), null,
                    Principles.defaults(), ConflictDetector.defaultRules())) {
                assertTrue(legacy.verify(List.of(s1, s2)).hasCriticalErrors());
            }
            assertFalse(verifier.verify(List.of(s1, s2)).hasCriticalErrors());
        }

        @Test
        void protectedAttributes_configurable() {
            Statute statute = Statute.builder("s1").precondition(Condition.hasAttribute("caste")).build();
            try (StatuteVerifier custom = new StatuteVerifier(new HeuristicConstraintBackend(), VerifierSettings.DEFAULTS,
                    null, Principles.defaults(Principles.DEFAULT_IDS, Set.of("caste")), ConflictDetector.defaultRules())) {
                assertTrue(custom.verify(List.of(statute)).hasCriticalErrors());
            }
        }
    }
}
