package ai.mapper.graph;

import ai.mapper.model.NodeKind;

/**
 * Result of decoding one symbol string.
 *
 * @param parentSymbol owning type/callable symbol, null for top-level symbols
 * @param containerFqn FQN of the owner (namespace for top-level symbols)
 */
public record DecodedSymbol(
        String symbol,
        NodeKind kind,
        String name,
        String fqn,
        String parentSymbol,
        String containerFqn
) {
}
