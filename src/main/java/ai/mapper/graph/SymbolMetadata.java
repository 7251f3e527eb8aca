package ai.mapper.graph;

import java.util.List;

import ai.mapper.scip.Relationship;

/**
 * Merged symbol-table information for one symbol; never emitted.
 *
 * @param kindHint  SCIP symbol kind ("Class", "Field", ...) or null
 * @param signature signature documentation text or null
 * @param file      document whose symbol table first listed the symbol
 */
public record SymbolMetadata(
        String symbol,
        List<String> documentation,
        List<Relationship> relationships,
        String kindHint,
        String signature,
        String file
) {

    public SymbolMetadata {
        documentation = documentation == null ? List.of() : List.copyOf(documentation);
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
    }

    public static SymbolMetadata empty(String symbol) {
        return new SymbolMetadata(symbol, List.of(), List.of(), null, null, null);
    }
}
