package ai.mapper.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import ai.mapper.graph.Graph;

/**
 * Writes a {@link Graph} as one JSON document and reads it back.
 */
public final class GraphWriter {

    private final ObjectMapper jsonMapper;

    public GraphWriter(boolean pretty) {
        final ObjectMapper mapper = new ObjectMapper();
        this.jsonMapper = pretty ? mapper.enable(SerializationFeature.INDENT_OUTPUT) : mapper;
    }

    public void write(Graph graph, Path file) throws IOException {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(file, "file");

        final Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        jsonMapper.writeValue(file.toFile(), graph);
    }

    public String toJson(Graph graph) throws IOException {
        Objects.requireNonNull(graph, "graph");
        return jsonMapper.writeValueAsString(graph);
    }

    public static Graph read(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        try (InputStream in = Files.newInputStream(file)) {
            return reader().readValue(in, Graph.class);
        }
    }

    public static Graph read(String json) throws IOException {
        Objects.requireNonNull(json, "json");
        return reader().readValue(json, Graph.class);
    }

    private static ObjectMapper reader() {
        return new ObjectMapper().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
