package ai.mapper.graph;

/**
 * Tunables of a mapping run.
 *
 * @param methodFallbackLines estimated extent of a Method/Function with no following sibling
 * @param typeFallbackLines   estimated extent of a Class/Interface/Trait/Enum with no following sibling
 * @param projectRoot         overrides the index's project root in the output metadata; null keeps it
 */
public record MapperSettings(
        int methodFallbackLines,
        int typeFallbackLines,
        String projectRoot
) {

    public static final int DEFAULT_METHOD_FALLBACK_LINES = 20;
    public static final int DEFAULT_TYPE_FALLBACK_LINES = 200;

    public MapperSettings {
        if (methodFallbackLines < 0 || typeFallbackLines < 0) {
            throw new IllegalArgumentException("fallback extents must be >= 0");
        }
    }

    public static MapperSettings defaults() {
        return new MapperSettings(DEFAULT_METHOD_FALLBACK_LINES, DEFAULT_TYPE_FALLBACK_LINES, null);
    }

    public MapperSettings withFallbacks(int methodLines, int typeLines) {
        return new MapperSettings(methodLines, typeLines, projectRoot);
    }

    public MapperSettings withProjectRoot(String root) {
        return new MapperSettings(methodFallbackLines, typeFallbackLines, root);
    }
}
