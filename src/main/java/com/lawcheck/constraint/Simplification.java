package com.lawcheck.constraint;

import com.lawcheck.model.Condition;

/** Result of {@link ConstraintBackend#simplify}; {@code changed} is false when nothing applied. */
public record Simplification(Condition condition, boolean changed) {
}
