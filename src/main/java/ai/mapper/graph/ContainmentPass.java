package ai.mapper.graph;

import java.util.Optional;

import ai.mapper.model.Edge;
import ai.mapper.model.EdgeType;
import ai.mapper.model.Node;

/**
 * File -> top-level type/function, type -> member, callable -> argument. Taken from the symbol
 * hierarchy alone; a node whose owning symbol has no node hangs off its File node instead. Every
 * symbol node carries the path of a document, so every non-File node gets exactly one parent.
 */
public final class ContainmentPass {

    public void run(MappingContext ctx) {
        for (Node node : ctx.symbolNodes()) {
            final Optional<String> parentId = ctx.decoded(node.id())
                    .map(DecodedSymbol::parentSymbol)
                    .flatMap(parent -> ctx.symbols().nodeIdOf(parent))
                    .or(() -> ctx.fileNodeId(node.file()));

            if (parentId.isEmpty()) {
                ctx.skip("no containment parent");
                continue;
            }
            if (!parentId.get().equals(node.id())) {
                ctx.addEdge(Edge.of(EdgeType.CONTAINS, parentId.get(), node.id()));
            }
        }
    }
}
