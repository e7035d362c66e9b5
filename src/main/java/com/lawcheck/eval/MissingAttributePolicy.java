package com.lawcheck.eval;

/**
 * How {@code AttributeEquals} behaves when the context lacks the key.
 * {@code HasAttribute} is an existence test and is never affected.
 */
public enum MissingAttributePolicy {
    /** The comparison evaluates to {@code false}. */
    FALSE,
    /** Evaluation fails with {@link MissingAttributeException}. */
    STRICT
}
