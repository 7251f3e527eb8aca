package ai.mapper.scip;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import ai.mapper.model.Range;

/**
 * A position where a symbol is defined or referenced.
 * <p>
 * range:          SCIP 3- or 4-int range of the identifier
 * enclosingRange: full extent of the defining construct, when the indexer emits it
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Occurrence(
        List<Integer> range,
        String symbol,
        @JsonAlias("symbol_roles") int symbolRoles,
        @JsonAlias("enclosing_range") List<Integer> enclosingRange
) {

    public Occurrence {
        range = range == null ? List.of() : List.copyOf(range);
        enclosingRange = enclosingRange == null ? List.of() : List.copyOf(enclosingRange);
    }

    @JsonIgnore
    public boolean isDefinition() {
        return SymbolRoles.DEFINITION.isSet(symbolRoles);
    }

    public Range identifierRange() {
        return Range.fromScip(range);
    }

    /**
     * Full construct extent, or {@code null} when the indexer did not emit one.
     */
    public Range bodyRange() {
        return enclosingRange.isEmpty() ? null : Range.fromScip(enclosingRange);
    }
}
