package ai.mapper.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import ai.mapper.model.Edge;
import ai.mapper.model.EdgeType;
import ai.mapper.model.Node;
import ai.mapper.model.NodeKind;
import ai.mapper.scip.Relationship;

/**
 * overrides edges from a method to the nearest ancestor method of the same name.
 * <p>
 * Ancestors are visited breadth-first along extends, uses_trait and implements edges (in that
 * order, then by target id), so a grandparent or an interface two levels up is found when the
 * direct parent does not declare the method. A visited set ends the walk on inheritance cycles.
 * Must run after {@link InheritancePass}.
 */
public final class OverridePass {

    private static final Comparator<Edge> PARENT_ORDER = Comparator
            .comparingInt((Edge e) -> rank(e.type()))
            .thenComparing(Edge::target);

    public void run(MappingContext ctx) {
        final Map<String, List<Edge>> parents = parents(ctx);
        final Map<String, Map<String, String>> methodsByOwner = methodsByOwner(ctx);

        for (Node method : ctx.symbolNodes()) {
            if (method.kind() != NodeKind.METHOD) {
                continue;
            }
            final Optional<String> owner = ownerOf(ctx, method);
            Optional<String> target = owner.flatMap(o -> nearest(o, method.name(), parents, methodsByOwner));
            if (target.isEmpty()) {
                target = fromRelationships(ctx, method);
            }
            target.filter(t -> !t.equals(method.id()))
                    .ifPresent(t -> ctx.addEdge(Edge.of(EdgeType.OVERRIDES, method.id(), t)));
        }
    }

    static Optional<String> nearest(String ownerId, String methodName,
                                    Map<String, List<Edge>> parents,
                                    Map<String, Map<String, String>> methodsByOwner) {
        final Set<String> visited = new HashSet<>();
        final Deque<String> queue = new ArrayDeque<>();
        visited.add(ownerId);
        enqueueParents(ownerId, parents, visited, queue);

        while (!queue.isEmpty()) {
            final String ancestor = queue.poll();
            final String found = methodsByOwner.getOrDefault(ancestor, Map.of()).get(methodName);
            if (found != null) {
                return Optional.of(found);
            }
            enqueueParents(ancestor, parents, visited, queue);
        }
        return Optional.empty();
    }

    private static void enqueueParents(String typeId, Map<String, List<Edge>> parents,
                                       Set<String> visited, Deque<String> queue) {
        for (Edge e : parents.getOrDefault(typeId, List.of())) {
            if (visited.add(e.target())) {
                queue.add(e.target());
            }
        }
    }

    private static Map<String, List<Edge>> parents(MappingContext ctx) {
        final Map<String, List<Edge>> parents = new HashMap<>();
        for (Edge e : ctx.edges()) {
            if (e.type().isInheritance()) {
                parents.computeIfAbsent(e.source(), k -> new ArrayList<>()).add(e);
            }
        }
        parents.values().forEach(list -> list.sort(PARENT_ORDER));
        return parents;
    }

    private static Map<String, Map<String, String>> methodsByOwner(MappingContext ctx) {
        final Map<String, Map<String, String>> out = new HashMap<>();
        for (Node node : ctx.symbolNodes()) {
            if (node.kind() == NodeKind.METHOD) {
                ownerOf(ctx, node).ifPresent(owner ->
                        out.computeIfAbsent(owner, k -> new HashMap<>()).putIfAbsent(node.name(), node.id()));
            }
        }
        return out;
    }

    private static Optional<String> ownerOf(MappingContext ctx, Node method) {
        return ctx.decoded(method.id())
                .map(DecodedSymbol::parentSymbol)
                .flatMap(parent -> ctx.symbols().nodeIdOf(parent));
    }

    private static Optional<String> fromRelationships(MappingContext ctx, Node method) {
        for (Relationship rel : ctx.metadataOf(method.symbol()).relationships()) {
            if (!rel.isImplementation()) {
                continue;
            }
            final Optional<String> target = ctx.symbols().resolve(rel.symbol())
                    .filter(id -> ctx.node(id).map(n -> n.kind() == NodeKind.METHOD).orElse(false));
            if (target.isPresent()) {
                return target;
            }
        }
        return Optional.empty();
    }

    private static int rank(EdgeType type) {
        return switch (type) {
            case EXTENDS -> 0;
            case USES_TRAIT -> 1;
            case IMPLEMENTS -> 2;
            default -> 3;
        };
    }
}
