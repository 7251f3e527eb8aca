package ai.mapper.graph;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import ai.mapper.model.Edge;
import ai.mapper.model.Node;

/**
 * Fully built graph, ready for writing.
 * - nodes sorted by id
 * - edges sorted by {@link Edge#ORDER}
 */
@JsonPropertyOrder({"version", "metadata", "nodes", "edges"})
public record Graph(
        String version,
        Metadata metadata,
        List<Node> nodes,
        List<Edge> edges
) {

    public static final String VERSION = "2.0";

    public Graph {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    @JsonPropertyOrder({"generated_at", "project_root", "source_index"})
    public record Metadata(
            @JsonProperty("generated_at") String generatedAt,
            @JsonProperty("project_root") String projectRoot,
            @JsonProperty("source_index") @JsonInclude(JsonInclude.Include.NON_NULL) String sourceIndex
    ) {
    }
}
