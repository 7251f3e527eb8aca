package ai.mapper.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Node kinds of the code graph. Structural kinds come from the index, Value and Call from the
 * auxiliary call data.
 */
public enum NodeKind {
    FILE("File"),
    CLASS("Class"),
    INTERFACE("Interface"),
    TRAIT("Trait"),
    ENUM("Enum"),
    METHOD("Method"),
    FUNCTION("Function"),
    PROPERTY("Property"),
    CONSTANT("Constant"),
    ARGUMENT("Argument"),
    ENUM_CASE("EnumCase"),
    VALUE("Value"),
    CALL("Call");

    private final String label;

    NodeKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean isClassLike() {
        return this == CLASS || this == INTERFACE || this == TRAIT || this == ENUM;
    }

    public boolean isCallable() {
        return this == METHOD || this == FUNCTION;
    }

    /**
     * Kinds whose range spans a body and can therefore enclose other occurrences.
     */
    public boolean hasBody() {
        return isClassLike() || isCallable();
    }
}
