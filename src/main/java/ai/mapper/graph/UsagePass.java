package ai.mapper.graph;

import java.util.Optional;
import java.util.Set;

import ai.mapper.model.Edge;
import ai.mapper.model.EdgeType;
import ai.mapper.model.Location;
import ai.mapper.model.Node;
import ai.mapper.model.NodeKind;
import ai.mapper.model.Range;
import ai.mapper.scip.Document;
import ai.mapper.scip.Occurrence;
import ai.mapper.scip.SymbolRoles;

/**
 * uses edges from the innermost enclosing node of every reference occurrence to the node of the
 * referenced symbol. Documents and occurrences are walked in index order, so the edge kept for a
 * repeated (source, target) pair carries the location of the first reference.
 * <p>
 * Read, write and import occurrences all count as uses; definitions and forward definitions do
 * not. An import sits outside every body, so its source is the File node.
 */
public final class UsagePass {

    public void run(MappingContext ctx) {
        for (Document doc : ctx.index().documents()) {
            for (Occurrence occ : doc.occurrences()) {
                final Set<SymbolRoles> roles = SymbolRoles.decode(occ.symbolRoles());
                if (roles.contains(SymbolRoles.DEFINITION) || roles.contains(SymbolRoles.FORWARD_DEFINITION)) {
                    continue;
                }
                use(ctx, doc.relativePath(), occ);
            }
        }
    }

    private static void use(MappingContext ctx, String file, Occurrence occ) {
        final Range at = occ.identifierRange();
        if (at == null || occ.symbol() == null || occ.symbol().isBlank()) {
            ctx.skip("malformed reference occurrence");
            return;
        }
        final Optional<String> target = ctx.symbols().resolve(occ.symbol());
        if (target.isEmpty()) {
            // external or local symbol
            ctx.skip("unresolved reference");
            return;
        }
        final Optional<Node> source = ctx.spatialIndex().enclosing(file, at.startLine()).flatMap(ctx::node);
        if (source.isEmpty()) {
            ctx.skip("reference outside any document");
            return;
        }
        if (source.get().id().equals(target.get()) || referencesOwnMember(source.get(), occ.symbol())) {
            return;
        }
        ctx.addEdge(Edge.at(EdgeType.USES, source.get().id(), target.get(),
                new Location(file, at.startLine(), at.startCol())));
    }

    /**
     * A callable reading its own parameter, or a type touching its own member.
     */
    private static boolean referencesOwnMember(Node source, String targetSymbol) {
        return source.kind() != NodeKind.FILE && targetSymbol.startsWith(source.symbol());
    }
}
