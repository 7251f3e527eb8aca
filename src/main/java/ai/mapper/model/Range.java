package ai.mapper.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Source range, 0-based lines and columns.
 * <p>
 * On body-bearing nodes an {@code endLine <= startLine} means the end is not known yet; the
 * range estimator replaces such ranges before the spatial index is built.
 */
public record Range(
        @JsonProperty("start_line") int startLine,
        @JsonProperty("start_col") int startCol,
        @JsonProperty("end_line") int endLine,
        @JsonProperty("end_col") int endCol
) {

    /**
     * Converts a SCIP range: {@code [startLine, startCol, endLine, endCol]} or
     * {@code [line, startCol, endCol]}.
     *
     * @return the range, or {@code null} when the list has any other shape
     */
    public static Range fromScip(List<Integer> scip) {
        if (scip == null) {
            return null;
        }
        if (scip.size() == 4) {
            return new Range(scip.get(0), scip.get(1), scip.get(2), scip.get(3));
        }
        if (scip.size() == 3) {
            return new Range(scip.get(0), scip.get(1), scip.get(0), scip.get(2));
        }
        return null;
    }

    public static Range point(int line, int col, int length) {
        return new Range(line, col, line, col + Math.max(0, length));
    }

    @JsonIgnore
    public boolean hasKnownEnd() {
        return endLine > startLine;
    }

    public boolean containsLine(int line) {
        return startLine <= line && line <= endLine;
    }

    public Range withEndLine(int newEndLine) {
        return new Range(startLine, startCol, Math.max(startLine, newEndLine), 0);
    }
}
