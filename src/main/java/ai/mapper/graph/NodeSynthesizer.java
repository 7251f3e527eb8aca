package ai.mapper.graph;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.mapper.model.Ids;
import ai.mapper.model.Location;
import ai.mapper.model.Node;
import ai.mapper.model.Range;
import ai.mapper.scip.Document;
import ai.mapper.scip.Occurrence;

/**
 * Creates one File node per document path and one node per symbol with a resolvable kind.
 * <p>
 * A node's range comes from the first occurrence flagged as a definition: its enclosing range
 * when the indexer emitted one, otherwise the identifier range (end unknown, repaired by
 * {@link RangeEstimator}). The identifier position is recorded separately as the node's
 * definition site. Symbols known only from a symbol table have neither.
 */
public final class NodeSynthesizer {

    private static final Logger LOG = LoggerFactory.getLogger(NodeSynthesizer.class);

    public void synthesize(MappingContext ctx) {
        // Step 1: File nodes, in document order
        for (Document doc : ctx.index().documents()) {
            ctx.addFileNode(Node.file(doc.relativePath()));
        }

        // Step 2: first definition of every symbol
        final Map<String, Definition> definitions = new LinkedHashMap<>();
        for (Document doc : ctx.index().documents()) {
            for (Occurrence occ : doc.occurrences()) {
                if (!occ.isDefinition() || occ.symbol() == null || definitions.containsKey(occ.symbol())) {
                    continue;
                }
                final Range body = occ.bodyRange();
                final Range range = body != null ? body : occ.identifierRange();
                if (range == null) {
                    ctx.skip("malformed definition range");
                }
                definitions.put(occ.symbol(), new Definition(doc.relativePath(), range, occ.identifierRange()));
            }
        }

        // Step 3: one node per decodable symbol (definitions first, then symbol-table only)
        final Set<String> allSymbols = new LinkedHashSet<>(definitions.keySet());
        allSymbols.addAll(ctx.metadata().keySet());

        for (String symbol : allSymbols) {
            final var decoded = ctx.decoder().decode(symbol);
            if (decoded.isEmpty()) {
                LOG.debug("No node for symbol (unparseable or non-entity): {}", symbol);
                ctx.skip("undecodable symbol");
                continue;
            }
            final SymbolMetadata meta = ctx.metadataOf(symbol);
            final Definition def = definitions.get(symbol);
            final String file = def != null ? def.file() : meta.file();
            final Range range = def != null ? def.range() : null;

            final var d = decoded.get();
            final String id = Ids.nodeId(symbol);
            ctx.addSymbolNode(
                    Node.symbol(id, d.kind(), d.name(), d.fqn(), symbol, file, range, meta.documentation()),
                    d);
            if (def != null && def.identifier() != null) {
                final Range at = def.identifier();
                ctx.definitionSite(id, new Location(def.file(), at.startLine(), at.startCol()));
            }
        }
    }

    private record Definition(String file, Range range, Range identifier) {
    }
}
