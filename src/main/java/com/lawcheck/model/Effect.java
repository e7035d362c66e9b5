package com.lawcheck.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Legal consequence of a statute. Parameters keep their insertion order.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Effect(
    @JsonProperty("effect_type") EffectType effectType,
    @JsonProperty("description") String description,
    @JsonProperty("parameters") Map<String, String> parameters
) {

    public static final String RESOURCE_PARAMETER = "resource";

    public Effect {
        Objects.requireNonNull(effectType, "effect_type");
        description = description == null ? "" : description;
        parameters = parameters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public Effect(EffectType effectType, String description) {
        this(effectType, description, Map.of());
    }

    public Effect withParameter(String key, String value) {
        Map<String, String> copy = new LinkedHashMap<>(parameters);
        copy.put(key, value);
        return new Effect(effectType, description, copy);
    }

    /**
     * The thing this effect acts upon: the {@code resource} parameter when
     * present, otherwise the lower-cased, whitespace-collapsed description.
     */
    @JsonIgnore
    public String resource() {
        String explicit = parameters.get(RESOURCE_PARAMETER);
        String raw = explicit != null && !explicit.isBlank() ? explicit : description;
        return raw.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    /** Same resource and mutually exclusive effect types. */
    public boolean contradicts(Effect other) {
        return effectType.excludes(other.effectType) && resource().equals(other.resource());
    }
}
