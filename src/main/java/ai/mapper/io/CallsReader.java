package ai.mapper.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ai.mapper.calls.CallsData;

/**
 * Reads {@code calls.json}: {@code {version, values[], calls[]}}.
 */
public final class CallsReader {

    private final ObjectMapper mapper = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public CallsData read(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        try (InputStream in = Files.newInputStream(file)) {
            return read(in);
        }
    }

    public CallsData read(InputStream in) throws IOException {
        Objects.requireNonNull(in, "in");
        final JsonNode root = mapper.readTree(in);
        if (root == null || !root.isObject()) {
            throw new IOException("Not a calls document: JSON root must be an object");
        }
        return mapper.treeToValue(root, CallsData.class);
    }
}
