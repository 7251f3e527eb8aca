package ai.mapper.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EdgeType {
    // structural, from the index
    CONTAINS("contains"),
    EXTENDS("extends"),
    IMPLEMENTS("implements"),
    USES_TRAIT("uses_trait"),
    OVERRIDES("overrides"),
    USES("uses"),
    TYPE_HINT("type_hint"),

    // from call data
    CALLS("calls"),
    RECEIVER("receiver"),
    ARGUMENT("argument"),
    PRODUCES("produces"),
    ASSIGNED_FROM("assigned_from"),
    TYPE_OF("type_of");

    private final String label;

    EdgeType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean isInheritance() {
        return this == EXTENDS || this == IMPLEMENTS || this == USES_TRAIT;
    }
}
