package com.lawcheck.verify;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.lawcheck.conflict.StatuteConflict;

import java.util.List;

/**
 * A verification finding. Findings are values reported inside a
 * {@link VerificationResult}; they are never thrown.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = VerificationError.CircularReference.class, name = "circular_reference"),
    @JsonSubTypes.Type(value = VerificationError.DeadStatute.class, name = "dead_statute"),
    @JsonSubTypes.Type(value = VerificationError.ConstitutionalConflict.class, name = "constitutional_conflict"),
    @JsonSubTypes.Type(value = VerificationError.LogicalContradiction.class, name = "logical_contradiction"),
    @JsonSubTypes.Type(value = VerificationError.Ambiguity.class, name = "ambiguity"),
    @JsonSubTypes.Type(value = VerificationError.UnreachableCode.class, name = "unreachable_code"),
    @JsonSubTypes.Type(value = VerificationError.IdCollision.class, name = "id_collision"),
    @JsonSubTypes.Type(value = VerificationError.JurisdictionalOverlap.class, name = "jurisdictional_overlap"),
    @JsonSubTypes.Type(value = VerificationError.TemporalConflict.class, name = "temporal_conflict"),
    @JsonSubTypes.Type(value = VerificationError.HierarchyViolation.class, name = "hierarchy_violation")
})
public sealed interface VerificationError {

    @JsonProperty("severity")
    Severity severity();

    @JsonProperty("message")
    String message();

    /** Statute references cycle; {@code cycle} lists the ids in reference order. */
    record CircularReference(@JsonProperty("cycle") List<String> cycle) implements VerificationError {
        public CircularReference {
            cycle = List.copyOf(cycle);
        }

        public Severity severity() {
            return Severity.CRITICAL;
        }

        public String message() {
            return "Circular reference: " + String.join(" -> ", cycle) + " -> " + cycle.get(0);
        }
    }

    record DeadStatute(
        @JsonProperty("statute_id") String statuteId,
        @JsonProperty("reason") String reason
    ) implements VerificationError {
        public Severity severity() {
            return Severity.ERROR;
        }

        public String message() {
            return "Dead statute '" + statuteId + "': " + reason;
        }
    }

    record ConstitutionalConflict(
        @JsonProperty("statute_id") String statuteId,
        @JsonProperty("principle") String principle,
        @JsonProperty("detail") String detail
    ) implements VerificationError {
        public Severity severity() {
            return Severity.CRITICAL;
        }

        public String message() {
            return "Constitutional conflict: '" + statuteId + "' conflicts with " + principle + " (" + detail + ")";
        }
    }

    record LogicalContradiction(
        @JsonProperty("first_id") String firstId,
        @JsonProperty("second_id") String secondId,
        @JsonProperty("detail") String detail,
        @JsonProperty("severity") Severity severity
    ) implements VerificationError {
        public String message() {
            return "Logical contradiction between '" + firstId + "' and '" + secondId + "': " + detail;
        }
    }

    record Ambiguity(
        @JsonProperty("first_id") String firstId,
        @JsonProperty("second_id") String secondId,
        @JsonProperty("detail") String detail
    ) implements VerificationError {
        public Severity severity() {
            return Severity.WARNING;
        }

        public String message() {
            return "Ambiguity between '" + firstId + "' and '" + secondId + "': " + detail;
        }
    }

    /** {@code precondition} is 1-based. */
    record UnreachableCode(
        @JsonProperty("statute_id") String statuteId,
        @JsonProperty("precondition") int precondition,
        @JsonProperty("detail") String detail
    ) implements VerificationError {
        public Severity severity() {
            return Severity.WARNING;
        }

        public String message() {
            return "In statute '" + statuteId + "', precondition " + precondition + ": " + detail;
        }
    }

    record IdCollision(
        @JsonProperty("first_id") String firstId,
        @JsonProperty("second_id") String secondId,
        @JsonProperty("detail") String detail
    ) implements VerificationError {
        public Severity severity() {
            return Severity.ERROR;
        }

        public String message() {
            return "Id collision: " + detail;
        }
    }

    record JurisdictionalOverlap(
        @JsonProperty("first_id") String firstId,
        @JsonProperty("second_id") String secondId,
        @JsonProperty("detail") String detail
    ) implements VerificationError {
        public Severity severity() {
            return Severity.WARNING;
        }

        public String message() {
            return "Jurisdictional overlap: " + detail;
        }
    }

    record TemporalConflict(
        @JsonProperty("first_id") String firstId,
        @JsonProperty("second_id") String secondId,
        @JsonProperty("detail") String detail
    ) implements VerificationError {
        public Severity severity() {
            return Severity.WARNING;
        }

        public String message() {
            return "Temporal conflict: " + detail;
        }
    }

    record HierarchyViolation(
        @JsonProperty("first_id") String firstId,
        @JsonProperty("second_id") String secondId,
        @JsonProperty("detail") String detail
    ) implements VerificationError {
        public Severity severity() {
            return Severity.ERROR;
        }

        public String message() {
            return "Hierarchy violation: " + detail;
        }
    }

    static VerificationError fromConflict(StatuteConflict conflict) {
        return switch (conflict.conflictType()) {
            case ID_COLLISION -> new IdCollision(conflict.firstId(), conflict.secondId(), conflict.description());
            case JURISDICTIONAL_OVERLAP ->
                new JurisdictionalOverlap(conflict.firstId(), conflict.secondId(), conflict.description());
            case TEMPORAL_CONFLICT ->
                new TemporalConflict(conflict.firstId(), conflict.secondId(), conflict.description());
            case HIERARCHY_VIOLATION ->
                new HierarchyViolation(conflict.firstId(), conflict.secondId(), conflict.description());
        };
    }
}
