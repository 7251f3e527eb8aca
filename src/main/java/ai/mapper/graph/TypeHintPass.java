package ai.mapper.graph;

import java.util.Optional;

import ai.mapper.model.Edge;
import ai.mapper.model.EdgeType;
import ai.mapper.model.Node;
import ai.mapper.scip.Relationship;

/**
 * type_hint edges from arguments, properties and callables (return types) to the types named
 * by their {@code isTypeDefinition} relationships. Located at the hinted node's identifier.
 */
public final class TypeHintPass {

    public void run(MappingContext ctx) {
        for (Node node : ctx.symbolNodes()) {
            switch (node.kind()) {
                case ARGUMENT, PROPERTY, METHOD, FUNCTION -> hints(ctx, node);
                default -> {
                }
            }
        }
    }

    private static void hints(MappingContext ctx, Node node) {
        for (Relationship rel : ctx.metadataOf(node.symbol()).relationships()) {
            if (!rel.isTypeDefinition()) {
                continue;
            }
            final Optional<String> target = ctx.symbols().resolve(rel.symbol());
            if (target.isEmpty() || target.get().equals(node.id())) {
                ctx.skip("unresolved type hint");
                continue;
            }
            ctx.addEdge(Edge.at(EdgeType.TYPE_HINT, node.id(), target.get(), ctx.definitionSite(node.id()).orElse(null)));
        }
    }
}
