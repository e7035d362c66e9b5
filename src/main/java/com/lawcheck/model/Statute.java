package com.lawcheck.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A legal rule: if every precondition holds, the effect applies.
 *
 * Statutes are immutable. An amendment is a new {@code Statute} with the same
 * id and a higher version, produced through {@link #amend()}.
 *
 * {@code references} lists the ids of statutes this one depends on; it is the
 * only source of edges in the dependency graph unless legacy
 * {@code statute:<id>} custom conditions are enabled.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Statute(
    @JsonProperty("id") String id,
    @JsonProperty("title") String title,
    @JsonProperty("preconditions") List<Condition> preconditions,
    @JsonProperty("effect") Effect effect,
    @JsonProperty("discretion_logic") String discretionLogic,
    @JsonProperty("jurisdiction") String jurisdiction,
    @JsonProperty("temporal_validity") TemporalValidity temporalValidity,
    @JsonProperty("version") int version,
    @JsonProperty("references") Set<String> references
) {

    public Statute {
        title = title == null ? "" : title;
        preconditions = preconditions == null ? List.of() : List.copyOf(preconditions);
        references = references == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(references));
        version = version == 0 ? 1 : version;
    }

    public static Builder builder(String id) {
        return new Builder().id(id);
    }

    /** A builder pre-filled with this statute and the next version number. */
    public Builder amend() {
        return new Builder()
            .id(id)
            .title(title)
            .preconditions(preconditions)
            .effect(effect)
            .discretionLogic(discretionLogic)
            .jurisdiction(jurisdiction)
            .temporalValidity(temporalValidity)
            .version(version + 1)
            .references(references);
    }

    public boolean hasDiscretion() {
        return discretionLogic != null && !discretionLogic.isBlank();
    }

    public static final class Builder {
        private String id;
        private String title = "";
        private final List<Condition> preconditions = new ArrayList<>();
        private Effect effect = new Effect(EffectType.CUSTOM, "");
        private String discretionLogic;
        private String jurisdiction;
        private TemporalValidity temporalValidity;
        private int version = 1;
        private final Set<String> references = new LinkedHashSet<>();

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder precondition(Condition condition) {
            this.preconditions.add(condition);
            return this;
        }

        public Builder preconditions(List<Condition> conditions) {
            this.preconditions.clear();
            this.preconditions.addAll(conditions);
            return this;
        }

        public Builder effect(Effect effect) {
            this.effect = effect;
            return this;
        }

        public Builder effect(EffectType type, String description) {
            return effect(new Effect(type, description));
        }

        public Builder discretionLogic(String discretionLogic) {
            this.discretionLogic = discretionLogic;
            return this;
        }

        public Builder jurisdiction(String jurisdiction) {
            this.jurisdiction = jurisdiction;
            return this;
        }

        public Builder temporalValidity(TemporalValidity temporalValidity) {
            this.temporalValidity = temporalValidity;
            return this;
        }

        public Builder version(int version) {
            this.version = version;
            return this;
        }

        public Builder reference(String statuteId) {
            this.references.add(statuteId);
            return this;
        }

        public Builder references(Set<String> statuteIds) {
            this.references.clear();
            this.references.addAll(statuteIds);
            return this;
        }

        /** Builds without validating; see {@link StatuteValidator}. */
        public Statute build() {
            return new Statute(id, title, preconditions, effect, discretionLogic,
                jurisdiction, temporalValidity, version, references);
        }
    }
}
