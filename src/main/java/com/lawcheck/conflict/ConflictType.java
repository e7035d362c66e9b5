package com.lawcheck.conflict;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConflictType {
    ID_COLLISION("id_collision"),
    JURISDICTIONAL_OVERLAP("jurisdictional_overlap"),
    TEMPORAL_CONFLICT("temporal_conflict"),
    HIERARCHY_VIOLATION("hierarchy_violation");

    private final String value;

    ConflictType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
