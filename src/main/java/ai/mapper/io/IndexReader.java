package ai.mapper.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ai.mapper.scip.ScipIndex;

/**
 * Reads the JSON rendering of a SCIP index (as printed by {@code scip print --json}).
 * Binary protobuf indices are converted by the caller beforehand.
 */
public final class IndexReader {

    private final ObjectMapper mapper = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public ScipIndex read(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        try (InputStream in = Files.newInputStream(file)) {
            return read(in);
        }
    }

    /**
     * @throws IOException when the input is not JSON or its root carries no {@code documents}
     */
    public ScipIndex read(InputStream in) throws IOException {
        Objects.requireNonNull(in, "in");
        final JsonNode root = mapper.readTree(in);
        if (root == null || !root.isObject() || !root.has("documents")) {
            throw new IOException("Not a SCIP index: no 'documents' at the JSON root");
        }
        return mapper.treeToValue(root, ScipIndex.class);
    }
}
