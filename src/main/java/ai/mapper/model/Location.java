package ai.mapper.model;

/**
 * Position of the occurrence an edge originates from.
 */
public record Location(
        String file,
        int line,
        int col
) {
}
