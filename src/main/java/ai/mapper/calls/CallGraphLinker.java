package ai.mapper.calls;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.mapper.graph.DecodedSymbol;
import ai.mapper.graph.MappingContext;
import ai.mapper.model.CallKind;
import ai.mapper.model.Edge;
import ai.mapper.model.EdgeType;
import ai.mapper.model.Ids;
import ai.mapper.model.Location;
import ai.mapper.model.Node;
import ai.mapper.model.NodeKind;
import ai.mapper.model.Range;
import ai.mapper.scip.Descriptor;
import ai.mapper.scip.ScipSymbol;

/**
 * Turns call-site records into Value and Call nodes wired to the symbol graph.
 * <p>
 * Nodes:
 * - one Value node per distinct value id (a repeated id reuses the first node)
 * - one Call node per call id, kind from {@link CallKindResolver}
 * <p>
 * Edges from each Call: calls (located), receiver, argument (with position), produces, and one
 * contains from its caller. From each Value: assigned_from, type_of and one contains from its
 * enclosing callable. A record whose container cannot be found (unknown scope and no usable
 * location) gets no node at all, so every emitted Call and Value has exactly one parent.
 * <p>
 * Every Call and Value is placed at its own record's location (or its own location id), never
 * at the location of a call it is nested in.
 */
public final class CallGraphLinker {

    private static final Logger LOG = LoggerFactory.getLogger(CallGraphLinker.class);

    private static final Pattern PARAMETER = Pattern.compile("\\.\\(\\$?([A-Za-z_][A-Za-z0-9_]*)\\)");
    private static final Pattern LOCAL = Pattern.compile("\\.local\\$([A-Za-z_][A-Za-z0-9_]*)@");
    private static final Pattern PROPERTY = Pattern.compile("#\\$([A-Za-z_][A-Za-z0-9_]*)\\.?$");

    private static final String PARAMETER_MARK = ".($";
    private static final String LOCAL_MARK = ".local$";

    public void link(MappingContext ctx, CallsData data) {
        Objects.requireNonNull(ctx, "ctx");
        Objects.requireNonNull(data, "data");

        final CallKindResolver resolver = new CallKindResolver(data);
        final Map<String, String> valueNodes = new LinkedHashMap<>();
        final Map<String, String> callNodes = new LinkedHashMap<>();
        final Map<String, String> parents = new LinkedHashMap<>();

        // Step 1: Value nodes
        for (ValueRecord value : data.values()) {
            if (value.id() == null || value.id().isBlank()) {
                ctx.skip("value without id");
                continue;
            }
            if (valueNodes.containsKey(value.id())) {
                continue;
            }
            final Optional<String> parent = enclosingCallable(ctx, scopeSymbol(value.symbol()),
                    locationOf(value.location(), value.id()));
            if (parent.isEmpty()) {
                LOG.debug("No container for value {}", value.id());
                ctx.skip("value without container");
                continue;
            }
            final String nodeId = Ids.valueNodeId(value.id());
            valueNodes.put(value.id(), nodeId);
            parents.put(nodeId, parent.get());
            ctx.addNode(valueNode(ctx, nodeId, value));
        }

        // Step 2: Call nodes
        for (CallRecord call : data.calls()) {
            if (call.id() == null || call.id().isBlank()) {
                ctx.skip("call without id");
                continue;
            }
            if (callNodes.containsKey(call.id())) {
                continue;
            }
            final Optional<String> parent = enclosingCallable(ctx, call.caller(),
                    locationOf(call.location(), call.id()));
            if (parent.isEmpty()) {
                LOG.debug("No container for call {}", call.id());
                ctx.skip("call without container");
                continue;
            }
            final String nodeId = Ids.callNodeId(call.id());
            callNodes.put(call.id(), nodeId);
            parents.put(nodeId, parent.get());
            ctx.addNode(callNode(ctx, nodeId, call, resolver.resolve(call)));
        }

        // Step 3: edges of calls
        final Map<String, CallRecord> linked = new LinkedHashMap<>();
        for (CallRecord call : data.calls()) {
            if (call.id() != null && callNodes.containsKey(call.id())) {
                linked.putIfAbsent(call.id(), call);
            }
        }
        for (CallRecord call : linked.values()) {
            final String nodeId = callNodes.get(call.id());
            callEdges(ctx, nodeId, call, valueNodes);
            ctx.addEdge(Edge.of(EdgeType.CONTAINS, parents.get(nodeId), nodeId));
        }

        // Step 4: edges of values
        final Map<String, ValueRecord> values = new LinkedHashMap<>();
        for (ValueRecord value : data.values()) {
            if (value.id() != null && valueNodes.containsKey(value.id())) {
                values.putIfAbsent(value.id(), value);
            }
        }
        for (ValueRecord value : values.values()) {
            final String nodeId = valueNodes.get(value.id());
            valueEdges(ctx, nodeId, value, valueNodes);
            ctx.addEdge(Edge.of(EdgeType.CONTAINS, parents.get(nodeId), nodeId));
        }

        LOG.debug("Linked {} calls and {} values", callNodes.size(), valueNodes.size());
    }

    // --- nodes ---

    private static Node valueNode(MappingContext ctx, String nodeId, ValueRecord value) {
        final String name = valueName(value);
        final Optional<Location> at = locationOf(value.location(), value.id());
        if (at.isEmpty()) {
            ctx.skip("value without location");
        }
        return Node.value(
                nodeId,
                name,
                valueFqn(ctx, value, name, at),
                value.symbol() == null ? "" : value.symbol(),
                at.map(Location::file).orElse(null),
                at.map(l -> Range.point(l.line(), l.col(), name.length())).orElse(null),
                value.kind() == null ? "unknown" : value.kind(),
                value.type());
    }

    private static Node callNode(MappingContext ctx, String nodeId, CallRecord call, CallKind kind) {
        final String name = callName(call, kind);
        final Optional<Location> at = locationOf(call.location(), call.id());
        if (at.isEmpty()) {
            ctx.skip("call without location");
        }
        return Node.call(
                nodeId,
                name,
                callFqn(ctx, call, at),
                at.map(Location::file).orElse(null),
                at.map(l -> Range.point(l.line(), l.col(), name.length())).orElse(null),
                kind);
    }

    // --- edges ---

    private static void callEdges(MappingContext ctx, String callNodeId, CallRecord call,
                                  Map<String, String> valueNodes) {
        final Optional<Location> at = locationOf(call.location(), call.id());

        Optional<String> target = ctx.symbols().resolve(call.callee());
        if (target.isEmpty() && CallKind.fromLabel(call.kind()).filter(k -> k == CallKind.CONSTRUCTOR).isPresent()) {
            target = ctx.symbols().resolve(call.returnType());
        }
        if (target.isPresent()) {
            ctx.addEdge(Edge.at(EdgeType.CALLS, callNodeId, target.get(), at.orElse(null)));
        } else if (call.callee() != null) {
            ctx.skip("unresolved callee");
        }

        if (call.receiverValueId() != null) {
            valueNode(ctx, valueNodes, call.receiverValueId())
                    .ifPresent(v -> ctx.addEdge(Edge.of(EdgeType.RECEIVER, callNodeId, v)));
        }

        for (ArgumentRecord arg : call.arguments()) {
            if (arg.valueId() == null || arg.position() == null) {
                ctx.skip("malformed argument");
                continue;
            }
            valueNode(ctx, valueNodes, arg.valueId())
                    .ifPresent(v -> ctx.addEdge(new Edge(EdgeType.ARGUMENT, callNodeId, v, null, arg.position())));
        }

        final String resultId = call.resultValueId() != null ? call.resultValueId() : call.id();
        Optional.ofNullable(valueNodes.get(resultId))
                .ifPresent(v -> ctx.addEdge(Edge.of(EdgeType.PRODUCES, callNodeId, v)));
    }

    private static void valueEdges(MappingContext ctx, String valueNodeId, ValueRecord value,
                                   Map<String, String> valueNodes) {
        if (value.sourceValueId() != null) {
            valueNode(ctx, valueNodes, value.sourceValueId())
                    .filter(source -> !source.equals(valueNodeId))
                    .ifPresent(source -> ctx.addEdge(Edge.of(EdgeType.ASSIGNED_FROM, valueNodeId, source)));
        }

        if (value.type() != null) {
            final Optional<String> type = ctx.symbols().resolve(value.type());
            if (type.isPresent()) {
                ctx.addEdge(Edge.of(EdgeType.TYPE_OF, valueNodeId, type.get()));
            } else {
                ctx.skip("unresolved value type");
            }
        }
    }

    private static Optional<String> valueNode(MappingContext ctx, Map<String, String> valueNodes, String valueId) {
        final String nodeId = valueNodes.get(valueId);
        if (nodeId == null) {
            LOG.debug("Dangling value id {}", valueId);
            ctx.skip("dangling value id");
        }
        return Optional.ofNullable(nodeId);
    }

    /**
     * Node of the owning symbol when it is known, otherwise the innermost callable around the
     * location (File node as a last resort).
     */
    private static Optional<String> enclosingCallable(MappingContext ctx, String ownerSymbol, Optional<Location> at) {
        final Optional<String> owner = ctx.symbols().resolve(ownerSymbol);
        if (owner.isPresent()) {
            return owner;
        }
        return at.flatMap(l -> ctx.spatialIndex().enclosingMatching(l.file(), l.line(), NodeKind::isCallable));
    }

    // --- names ---

    static String valueName(ValueRecord value) {
        final String symbol = value.symbol();
        if (symbol != null) {
            for (Pattern p : new Pattern[]{PARAMETER, LOCAL, PROPERTY}) {
                final Matcher m = p.matcher(symbol);
                if (m.find()) {
                    return "$" + m.group(1);
                }
            }
        }
        final String kind = value.kind() == null ? "" : value.kind();
        return switch (kind) {
            case "result" -> "(result)";
            case "literal" -> "(literal)";
            case "constant" -> "(constant)";
            default -> "$unknown";
        };
    }

    static String callName(CallRecord call, CallKind kind) {
        final Optional<Descriptor> last = ScipSymbol.parse(call.callee()).flatMap(ScipSymbol::last);
        if (last.isPresent()) {
            final Descriptor d = last.get();
            switch (d.suffix()) {
                case METHOD -> {
                    return d.name() + "()";
                }
                case TERM -> {
                    return d.name().startsWith("$") ? d.name().substring(1) : d.name();
                }
                case TYPE -> {
                    return "new " + d.name() + "()";
                }
                default -> {
                }
            }
        }
        if (kind == CallKind.CONSTRUCTOR) {
            final Optional<Descriptor> type = ScipSymbol.parse(call.returnType()).flatMap(ScipSymbol::last);
            if (type.isPresent()) {
                return "new " + type.get().name() + "()";
            }
        }
        return "(call)";
    }

    private static String valueFqn(MappingContext ctx, ValueRecord value, String name, Optional<Location> at) {
        final String scope = scopeSymbol(value.symbol());
        if (scope != null) {
            return fqnOf(ctx, scope) + "." + name;
        }
        return at.map(l -> l.file() + ":" + l.line() + ":" + name).orElse(value.id() + ":" + name);
    }

    private static String callFqn(MappingContext ctx, CallRecord call, Optional<Location> at) {
        final Location l = at.orElse(null);
        if (call.caller() != null && !call.caller().isBlank() && l != null) {
            return fqnOf(ctx, call.caller()) + "@" + l.line() + ":" + l.col();
        }
        return l != null ? l.file() + ":" + l.line() + ":" + l.col() : call.id();
    }

    private static String fqnOf(MappingContext ctx, String symbol) {
        return ctx.decoder().decode(symbol)
                .map(DecodedSymbol::fqn)
                .orElseGet(() -> ScipSymbol.parse(symbol).map(ScipSymbol::descriptorText).orElse(symbol));
    }

    /**
     * Callable a parameter or local value belongs to: {@code ...#m().($x)} and
     * {@code ...#m().local$x@3} both give {@code ...#m().}.
     */
    static String scopeSymbol(String valueSymbol) {
        if (valueSymbol == null) {
            return null;
        }
        int i = valueSymbol.lastIndexOf(PARAMETER_MARK);
        if (i < 0) {
            i = valueSymbol.lastIndexOf(LOCAL_MARK);
        }
        return i < 0 ? null : valueSymbol.substring(0, i) + ".";
    }

    private static Optional<Location> locationOf(Location recorded, String locationId) {
        if (recorded != null && recorded.file() != null) {
            return Optional.of(recorded);
        }
        return LocationIds.parse(locationId);
    }
}
