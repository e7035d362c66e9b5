package com.lawcheck.eval;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.lawcheck.model.DurationUnit;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * The facts a condition is evaluated against: numeric quantities, string
 * attributes and an optional resolver for custom predicates.
 *
 * Instances are immutable. The {@link #fingerprint()} covers every fact but
 * not the custom predicate resolver, which must therefore be pure for
 * memoized evaluation to be sound.
 */
public final class EvaluationContext {

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .build();

    private final Long age;
    private final Long income;
    private final Map<DurationUnit, Long> durations;
    private final Map<String, Double> percentages;
    private final Map<String, String> attributes;
    private final CustomPredicateResolver customResolver;
    private final String fingerprint;

    private EvaluationContext(Builder builder) {
        this.age = builder.age;
        this.income = builder.income;
        this.durations = Collections.unmodifiableMap(new EnumMap<>(builder.durations));
        this.percentages = Collections.unmodifiableMap(new TreeMap<>(builder.percentages));
        this.attributes = Collections.unmodifiableMap(new TreeMap<>(builder.attributes));
        this.customResolver = builder.customResolver;
        this.fingerprint = computeFingerprint();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static EvaluationContext empty() {
        return builder().build();
    }

    public OptionalLong age() {
        return age == null ? OptionalLong.empty() : OptionalLong.of(age);
    }

    public OptionalLong income() {
        return income == null ? OptionalLong.empty() : OptionalLong.of(income);
    }

    public OptionalLong duration(DurationUnit unit) {
        Long value = durations.get(unit);
        return value == null ? OptionalLong.empty() : OptionalLong.of(value);
    }

    public OptionalDouble percentage(String context) {
        Double value = percentages.get(context);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public Optional<String> attribute(String key) {
        return Optional.ofNullable(attributes.get(key));
    }

    public boolean hasAttribute(String key) {
        return attributes.containsKey(key);
    }

    public Map<String, String> attributes() {
        return attributes;
    }

    public CustomPredicateResolver customResolver() {
        return customResolver;
    }

    /** Canonical JSON of all facts; equal facts give equal fingerprints, different facts different ones. */
    public String fingerprint() {
        return fingerprint;
    }

    private String computeFingerprint() {
        Map<String, Object> facts = new LinkedHashMap<>();
        facts.put("age", age);
        facts.put("income", income);
        facts.put("durations", durations);
        facts.put("percentages", percentages);
        facts.put("attributes", attributes);
        try {
            return CANONICAL.writeValueAsString(facts);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("cannot fingerprint evaluation context", ex);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EvaluationContext other)) {
            return false;
        }
        return fingerprint.equals(other.fingerprint) && customResolver == other.customResolver;
    }

    @Override
    public int hashCode() {
        return fingerprint.hashCode();
    }

    @Override
    public String toString() {
        return "EvaluationContext" + fingerprint;
    }

    /**
     * Resolves the description of a custom condition to a predicate over the
     * context. Returning {@code null} means "unknown predicate", which
     * evaluates to {@code false}.
     */
    @FunctionalInterface
    public interface CustomPredicateResolver {
        Predicate<EvaluationContext> resolve(String description);

        CustomPredicateResolver NONE = description -> null;
    }

    public static final class Builder {
        private Long age;
        private Long income;
        private final Map<DurationUnit, Long> durations = new EnumMap<>(DurationUnit.class);
        private final Map<String, Double> percentages = new TreeMap<>();
        private final Map<String, String> attributes = new TreeMap<>();
        private CustomPredicateResolver customResolver = CustomPredicateResolver.NONE;

        private Builder() {
        }

        public Builder age(long age) {
            this.age = age;
            return this;
        }

        public Builder income(long income) {
            this.income = income;
            return this;
        }

        public Builder duration(DurationUnit unit, long value) {
            durations.put(Objects.requireNonNull(unit, "unit"), value);
            return this;
        }

        public Builder percentage(String context, double value) {
            percentages.put(Objects.requireNonNull(context, "context"), value);
            return this;
        }

        public Builder attribute(String key, String value) {
            attributes.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder attributes(Map<String, String> values) {
            values.forEach(this::attribute);
            return this;
        }

        public Builder customResolver(CustomPredicateResolver resolver) {
            this.customResolver = resolver == null ? CustomPredicateResolver.NONE : resolver;
            return this;
        }

        public EvaluationContext build() {
            return new EvaluationContext(this);
        }
    }
}
