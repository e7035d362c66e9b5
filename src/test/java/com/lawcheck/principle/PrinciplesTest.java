package com.lawcheck.principle;

import com.lawcheck.model.ComparisonOp;
import com.lawcheck.model.Condition;
import com.lawcheck.model.Effect;
import com.lawcheck.model.EffectType;
import com.lawcheck.model.Statute;
import com.lawcheck.model.TemporalValidity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PrinciplesTest {

    @Nested
    @DisplayName("Equal protection")
    class Equality {

        private final NoDiscriminationPrinciple principle = new NoDiscriminationPrinciple();

        @Test
        void protectedAttributeInNestedCondition_violates() {
            Statute statute = Statute.builder("s1")
                .precondition(Condition.and(
                    Condition.age(ComparisonOp.GREATER_OR_EQUAL, 18),
                    Condition.not(Condition.attributeEquals("Religion", "x"))))
                .build();
            Optional<PrincipleViolation> violation = principle.check(statute);
            assertTrue(violation.isPresent());
            assertEquals("equality", violation.get().principleId());
            assertEquals("s1", violation.get().statuteId());
            assertTrue(violation.get().detail().contains("Religion"));
        }

        @Test
        void neutralAttributes_comply() {
            Statute statute = Statute.builder("s1")
                .precondition(Condition.memberOf("residency", Set.of("resident")))
                .build();
            assertTrue(principle.check(statute).isEmpty());
        }

        @Test
        void customProtectedSet_replacesDefaults() {
            NoDiscriminationPrinciple custom = new NoDiscriminationPrinciple(Set.of("caste"));
            Statute statute = Statute.builder("s1").precondition(Condition.hasAttribute("caste")).build();
            Statute byGender = Statute.builder("s2").precondition(Condition.hasAttribute("gender")).build();
            assertTrue(custom.check(statute).isPresent());
            assertTrue(custom.check(byGender).isEmpty());
        }
    }

    @Nested
    @DisplayName("Due process")
    class DueProcess {

        private final RequiresProcedurePrinciple principle = new RequiresProcedurePrinciple();

        @Test
        void revocationWithoutSafeguard_violates() {
            Statute statute = Statute.builder("s1").effect(EffectType.REVOKE, "license").build();
            assertTrue(principle.check(statute).isPresent());
        }

        @Test
        void revocationWithAppeal_complies() {
            Statute statute = Statute.builder("s1")
                .effect(new Effect(EffectType.REVOKE, "license").withParameter("appeal", "tribunal"))
                .build();
            assertTrue(principle.check(statute).isEmpty());
        }

        @Test
        void revocationWithDiscretion_complies() {
            Statute statute = Statute.builder("s1")
                .effect(EffectType.REVOKE, "license")
                .discretionLogic("officer reviews the case")
                .build();
            assertTrue(principle.check(statute).isEmpty());
        }

        @Test
        void grant_complies() {
            assertTrue(principle.check(Statute.builder("s1").effect(EffectType.GRANT, "x").build()).isEmpty());
        }
    }

    @Nested
    @DisplayName("Non-retroactivity")
    class Retroactivity {

        private final NoRetroactivityPrinciple principle = new NoRetroactivityPrinciple();

        @Test
        void effectiveBeforeEnactment_violates() {
            Statute statute = Statute.builder("s1")
                .temporalValidity(new TemporalValidity(LocalDate.of(2020, 1, 1), null,
                    Instant.parse("2021-06-01T10:00:00Z"), null))
                .build();
            assertTrue(principle.check(statute).isPresent());
        }

        @Test
        void effectiveOnEnactmentDay_complies() {
            Statute statute = Statute.builder("s1")
                .temporalValidity(new TemporalValidity(LocalDate.of(2021, 6, 1), null,
                    Instant.parse("2021-06-01T23:00:00Z"), null))
                .build();
            assertTrue(principle.check(statute).isEmpty());
        }

        @Test
        void missingDates_comply() {
            assertTrue(principle.check(Statute.builder("s1").build()).isEmpty());
        }
    }

    @Test
    void defaults_inConfiguredOrder() {
        List<Principle> principles = Principles.defaults(List.of("non-retroactivity", "equality"), Set.of("race"));
        assertEquals(List.of("non-retroactivity", "equality"),
            principles.stream().map(Principle::principleId).toList());
    }

    @Test
    void defaults_unknownIdRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> Principles.defaults(List.of("equality", "sharia"), Set.of()));
    }

    @Test
    void customPrinciple_usesPredicate() {
        CustomPrinciple titled = new CustomPrinciple("titled", "Statutes must have a title", s -> !s.title().isBlank());
        assertTrue(titled.check(Statute.builder("s1").build()).isPresent());
        assertTrue(titled.check(Statute.builder("s2").title("Named").build()).isEmpty());
    }
}
