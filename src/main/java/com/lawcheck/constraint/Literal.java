package com.lawcheck.constraint;

import com.lawcheck.model.Condition;

/**
 * An atom in negation normal form. Set membership and patterns carry their
 * own polarity and always appear with {@code positive == true}; comparisons,
 * attribute presence, attribute equality and custom atoms can be negated.
 */
record Literal(Condition atom, boolean positive) {
}
