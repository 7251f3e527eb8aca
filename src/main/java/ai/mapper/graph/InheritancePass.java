package ai.mapper.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.mapper.model.Edge;
import ai.mapper.model.EdgeType;
import ai.mapper.model.Node;
import ai.mapper.model.NodeKind;
import ai.mapper.scip.Relationship;

/**
 * extends / implements / uses_trait edges between class-like nodes.
 * <p>
 * Declared relationships are authoritative:
 * - implementation + reference -> uses_trait
 * - implementation only        -> implements (extends between interfaces or towards a class)
 * - reference only             -> extends
 * Only a type that declares no inheritance relationship at all falls back to parsing its
 * documentation / signature ({@code extends A}, {@code implements B, C}, {@code use T;}).
 */
public final class InheritancePass {

    private static final Logger LOG = LoggerFactory.getLogger(InheritancePass.class);

    private static final Pattern EXTENDS = Pattern.compile(
            "\\bextends\\s+([\\\\A-Za-z0-9_,\\s]+?)(?=\\s+implements\\b|\\s*\\{|\\s*$)");
    private static final Pattern IMPLEMENTS = Pattern.compile(
            "\\bimplements\\s+([\\\\A-Za-z0-9_,\\s]+?)(?=\\s*\\{|\\s*$)");
    private static final Pattern USE_TRAIT = Pattern.compile(
            "\\buse\\s+\\\\?([A-Za-z0-9_\\\\]+)\\s*;");

    public void run(MappingContext ctx) {
        int fromDocs = 0;
        for (Node node : ctx.symbolNodes()) {
            if (!node.kind().isClassLike()) {
                continue;
            }
            final SymbolMetadata meta = ctx.metadataOf(node.symbol());
            boolean declared = false;

            for (Relationship rel : meta.relationships()) {
                if (rel.isTypeDefinition() || (!rel.isImplementation() && !rel.isReference())) {
                    continue;
                }
                declared = true;

                final Optional<Node> target = ctx.symbols().resolve(rel.symbol()).flatMap(ctx::node);
                if (target.isEmpty() || !target.get().kind().isClassLike() || target.get().id().equals(node.id())) {
                    LOG.debug("Unresolved inheritance target {} of {}", rel.symbol(), node.fqn());
                    ctx.skip("unresolved inheritance target");
                    continue;
                }
                ctx.addEdge(Edge.of(classify(rel, node.kind(), target.get().kind()), node.id(), target.get().id()));
            }

            if (!declared) {
                fromDocs += fromDocumentation(ctx, node, meta);
            }
        }
        LOG.debug("Inheritance edges derived from documentation: {}", fromDocs);
    }

    static EdgeType classify(Relationship rel, NodeKind source, NodeKind target) {
        if (rel.isImplementation() && rel.isReference()) {
            return EdgeType.USES_TRAIT;
        }
        if (rel.isImplementation()) {
            return switch (target) {
                case INTERFACE -> source == NodeKind.INTERFACE ? EdgeType.EXTENDS : EdgeType.IMPLEMENTS;
                case TRAIT -> EdgeType.USES_TRAIT;
                default -> EdgeType.EXTENDS;
            };
        }
        return EdgeType.EXTENDS;
    }

    private int fromDocumentation(MappingContext ctx, Node node, SymbolMetadata meta) {
        final List<String> texts = new ArrayList<>(meta.documentation());
        if (meta.signature() != null) {
            texts.add(0, meta.signature());
        }
        final String namespace = ctx.decoded(node.id()).map(DecodedSymbol::containerFqn).orElse("");

        int added = 0;
        for (String raw : texts) {
            final String text = SymbolDecoder.stripFences(raw);
            for (String name : names(EXTENDS, text)) {
                added += link(ctx, node, EdgeType.EXTENDS, name, namespace);
            }
            for (String name : names(IMPLEMENTS, text)) {
                final EdgeType type = node.kind() == NodeKind.INTERFACE ? EdgeType.EXTENDS : EdgeType.IMPLEMENTS;
                added += link(ctx, node, type, name, namespace);
            }
            final Matcher use = USE_TRAIT.matcher(text);
            while (use.find()) {
                added += link(ctx, node, EdgeType.USES_TRAIT, use.group(1), namespace);
            }
        }
        return added;
    }

    private static int link(MappingContext ctx, Node node, EdgeType type, String name, String namespace) {
        final Optional<String> target = ctx.symbols().resolveTypeName(name, namespace);
        if (target.isEmpty() || target.get().equals(node.id())) {
            ctx.skip("unresolved documented parent");
            return 0;
        }
        return ctx.addEdge(Edge.of(type, node.id(), target.get())) ? 1 : 0;
    }

    private static List<String> names(Pattern pattern, String text) {
        final List<String> out = new ArrayList<>();
        final Matcher m = pattern.matcher(text);
        if (m.find()) {
            for (String part : m.group(1).split(",")) {
                final String name = part.trim();
                if (!name.isEmpty()) {
                    out.add(name);
                }
            }
        }
        return out;
    }
}
