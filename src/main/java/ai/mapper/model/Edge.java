package ai.mapper.model;

import java.util.Comparator;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Typed edge between two node IDs.
 * <p>
 * location: set for edges that originate at one occurrence (uses, type_hint, calls)
 * position:  0-based argument index, argument edges only
 */
@JsonPropertyOrder({"type", "source", "target", "location", "position"})
public record Edge(
        EdgeType type,
        String source,
        String target,
        @JsonInclude(JsonInclude.Include.NON_NULL) Location location,
        @JsonInclude(JsonInclude.Include.NON_NULL) Integer position
) {

    public static final Comparator<Edge> ORDER = Comparator.comparing(Edge::source)
            .thenComparing(e -> e.type().label())
            .thenComparing(Edge::target)
            .thenComparing(e -> e.position() == null ? -1 : e.position());

    public Edge {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
    }

    public static Edge of(EdgeType type, String source, String target) {
        return new Edge(type, source, target, null, null);
    }

    public static Edge at(EdgeType type, String source, String target, Location location) {
        return new Edge(type, source, target, location, null);
    }

    /**
     * Deduplication identity; location is not part of it.
     */
    @JsonIgnore
    public Key key() {
        return new Key(type, source, target, position);
    }

    public record Key(EdgeType type, String source, String target, Integer position) {
    }
}
