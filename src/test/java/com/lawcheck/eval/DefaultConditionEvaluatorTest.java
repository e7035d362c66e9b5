package com.lawcheck.eval;

import com.lawcheck.model.ComparisonOp;
import com.lawcheck.model.Condition;
import com.lawcheck.model.DurationUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DefaultConditionEvaluatorTest {

    private DefaultConditionEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new DefaultConditionEvaluator();
    }

    @Nested
    @DisplayName("Leaf conditions")
    class Leaves {

        @Test
        void age_comparesAgainstContext() {
            EvaluationContext adult = EvaluationContext.builder().age(25).build();
            assertTrue(evaluator.evaluate(Condition.age(ComparisonOp.GREATER_OR_EQUAL, 18), adult));
            assertFalse(evaluator.evaluate(Condition.age(ComparisonOp.LESS_THAN, 18), adult));
        }

        @Test
        void missingNumericValue_isFalseForEveryOperator() {
            EvaluationContext empty = EvaluationContext.empty();
            for (ComparisonOp op : ComparisonOp.values()) {
                assertFalse(evaluator.evaluate(Condition.income(op, 1000), empty), op.getSymbol());
            }
        }

        @Test
        void duration_usesMatchingUnitOnly() {
            EvaluationContext ctx = EvaluationContext.builder().duration(DurationUnit.YEARS, 5).build();
            assertTrue(evaluator.evaluate(Condition.duration(ComparisonOp.GREATER_THAN, 3, DurationUnit.YEARS), ctx));
            assertFalse(evaluator.evaluate(Condition.duration(ComparisonOp.GREATER_THAN, 3, DurationUnit.MONTHS), ctx));
        }

        @Test
        void percentage_comparesByContext() {
            EvaluationContext ctx = EvaluationContext.builder().percentage("ownership", 51.5).build();
            assertTrue(evaluator.evaluate(Condition.percentage(ComparisonOp.GREATER_THAN, 50.0, "ownership"), ctx));
            assertFalse(evaluator.evaluate(Condition.percentage(ComparisonOp.GREATER_THAN, 50.0, "tax"), ctx));
        }

        @Test
        void setMembership_negatedHoldsWhenAbsent() {
            Condition member = Condition.memberOf("status", Set.of("resident", "citizen"));
            Condition nonMember = Condition.notMemberOf("status", Set.of("resident", "citizen"));
            EvaluationContext citizen = EvaluationContext.builder().attribute("status", "citizen").build();

            assertTrue(evaluator.evaluate(member, citizen));
            assertFalse(evaluator.evaluate(nonMember, citizen));
            assertFalse(evaluator.evaluate(member, EvaluationContext.empty()));
            assertTrue(evaluator.evaluate(nonMember, EvaluationContext.empty()));
        }

        @Test
        void pattern_usesFindSemantics() {
            EvaluationContext ctx = EvaluationContext.builder().attribute("postcode", "SW1A 1AA").build();
            assertTrue(evaluator.evaluate(Condition.matches("postcode", "^SW"), ctx));
            assertTrue(evaluator.evaluate(Condition.matches("postcode", "1A"), ctx));
            assertFalse(evaluator.evaluate(Condition.matches("postcode", "^EC"), ctx));
        }

        @Test
        void attributeEquals_missingKeyIsFalseByDefault() {
            assertFalse(evaluator.evaluate(Condition.attributeEquals("status", "x"), EvaluationContext.empty()));
        }

        @Test
        void attributeEquals_strictPolicyThrowsOnMissingKey() {
            DefaultConditionEvaluator strict = new DefaultConditionEvaluator(MissingAttributePolicy.STRICT, 64);
            MissingAttributeException ex = assertThrows(MissingAttributeException.class,
                () -> strict.evaluate(Condition.attributeEquals("status", "x"), EvaluationContext.empty()));
            assertEquals("status", ex.getKey());
        }

        @Test
        void hasAttribute_ignoresStrictPolicy() {
            DefaultConditionEvaluator strict = new DefaultConditionEvaluator(MissingAttributePolicy.STRICT, 64);
            assertFalse(strict.evaluate(Condition.hasAttribute("status"), EvaluationContext.empty()));
        }

        @Test
        void custom_unknownPredicateIsFalse() {
            assertFalse(evaluator.evaluate(Condition.custom("is_veteran"), EvaluationContext.empty()));
        }

        @Test
        void custom_resolvedThroughContext() {
            EvaluationContext ctx = EvaluationContext.builder()
                .customResolver(description -> "is_veteran".equals(description) ? c -> true : null)
                .build();
            assertTrue(evaluator.evaluate(Condition.custom("is_veteran"), ctx));
        }
    }

    @Nested
    @DisplayName("Connectives")
    class Connectives {

        @Test
        void and_skipsRightOperandWhenLeftIsFalse() {
            AtomicInteger calls = new AtomicInteger();
            EvaluationContext ctx = countingContext(calls);
            Condition condition = Condition.and(Condition.age(ComparisonOp.GREATER_THAN, 100), Condition.custom("tracked"));

            assertFalse(evaluator.evaluate(condition, ctx));
            assertEquals(0, calls.get());
        }

        @Test
        void or_skipsRightOperandWhenLeftIsTrue() {
            AtomicInteger calls = new AtomicInteger();
            EvaluationContext ctx = countingContext(calls);
            Condition condition = Condition.or(Condition.age(ComparisonOp.GREATER_OR_EQUAL, 18), Condition.custom("tracked"));

            assertTrue(evaluator.evaluate(condition, ctx));
            assertEquals(0, calls.get());
        }

        @Test
        void and_evaluatesRightOperandWhenLeftIsTrue() {
            AtomicInteger calls = new AtomicInteger();
            EvaluationContext ctx = countingContext(calls);
            Condition condition = Condition.and(Condition.age(ComparisonOp.GREATER_OR_EQUAL, 18), Condition.custom("tracked"));

            assertTrue(evaluator.evaluate(condition, ctx));
            assertEquals(1, calls.get());
        }

        @Test
        void doubleNegation_isIdentity() {
            EvaluationContext ctx = EvaluationContext.builder().age(30).build();
            Condition base = Condition.age(ComparisonOp.GREATER_OR_EQUAL, 18);
            assertEquals(evaluator.evaluate(base, ctx),
                evaluator.evaluate(Condition.not(Condition.not(base)), ctx));
        }

        @Test
        void evaluateAll_emptyListHolds() {
            assertTrue(evaluator.evaluateAll(List.of(), EvaluationContext.empty()));
        }

        @Test
        void deepNesting_beyondLimitFails() {
            DefaultConditionEvaluator shallow = new DefaultConditionEvaluator(MissingAttributePolicy.FALSE, 8);
            Condition condition = Condition.hasAttribute("x");
            for (int i = 0; i < 10; i++) {
                condition = Condition.not(condition);
            }
            Condition nested = condition;
            assertThrows(EvaluationLimitExceededException.class,
                () -> shallow.evaluate(nested, EvaluationContext.empty()));
        }
    }

    private static EvaluationContext countingContext(AtomicInteger calls) {
        return EvaluationContext.builder()
            .age(30)
            .customResolver(description -> ctx -> {
                calls.incrementAndGet();
                return true;
            })
            .build();
    }
}
