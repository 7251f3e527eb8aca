package ai.mapper.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Deterministic node IDs. Every ID is a pure function of its input, so mapping an unchanged
 * index twice yields identical IDs.
 */
public final class Ids {

    private static final int HASH_CHARS = 16;

    private Ids() {
    }

    public static String nodeId(String symbol) {
        Objects.requireNonNull(symbol, "symbol");
        return "node:" + shortHash(symbol);
    }

    public static String fileNodeId(String filePath) {
        Objects.requireNonNull(filePath, "filePath");
        return "node:" + shortHash("file:" + filePath);
    }

    public static String valueNodeId(String locationId) {
        Objects.requireNonNull(locationId, "locationId");
        return "node:val:" + shortHash("val:" + locationId);
    }

    public static String callNodeId(String locationId) {
        Objects.requireNonNull(locationId, "locationId");
        return "node:call:" + shortHash("call:" + locationId);
    }

    /**
     * Symbol recorded on synthesized File nodes.
     */
    public static String fileSymbol(String filePath) {
        Objects.requireNonNull(filePath, "filePath");
        return "file:" + filePath;
    }

    public static String fileName(String filePath) {
        final String normalized = filePath.replace('\\', '/');
        final int i = normalized.lastIndexOf('/');
        return i >= 0 ? normalized.substring(i + 1) : normalized;
    }

    static String shortHash(String input) {
        try {
            final MessageDigest digest = MessageDigest.getInstance("SHA-256");
            final byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, HASH_CHARS);
        } catch (NoSuchAlgorithmException ex) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}
