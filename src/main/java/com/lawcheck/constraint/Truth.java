package com.lawcheck.constraint;

public enum Truth {
    TRUE,
    FALSE,
    UNKNOWN;

    public Truth negate() {
        return switch (this) {
            case TRUE -> FALSE;
            case FALSE -> TRUE;
            case UNKNOWN -> UNKNOWN;
        };
    }
}
