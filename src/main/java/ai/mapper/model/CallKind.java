package ai.mapper.model;

import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Syntactic shape of a call site. The set is closed: classification code switches over it
 * without a default branch so a new shape fails compilation until every switch handles it.
 */
public enum CallKind {
    FUNCTION("function"),
    METHOD("method"),
    METHOD_STATIC("method_static"),
    CONSTRUCTOR("constructor"),
    ACCESS("access"),
    ACCESS_STATIC("access_static");

    private final String label;

    CallKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Optional<CallKind> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        final String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (CallKind kind : values()) {
            if (kind.label.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
