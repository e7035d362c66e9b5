package com.lawcheck.eval;

/**
 * Thrown in {@link MissingAttributePolicy#STRICT} mode when a condition reads
 * an attribute the evaluation context does not carry.
 */
public class MissingAttributeException extends RuntimeException {

    private final String key;

    public MissingAttributeException(String key) {
        super("attribute not present in evaluation context: " + key);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
