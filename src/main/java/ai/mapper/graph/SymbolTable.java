package ai.mapper.graph;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import ai.mapper.model.Node;
import ai.mapper.scip.ScipSymbol;

/**
 * Index-wide lookups from symbols and type names to node IDs:
 * - symbol -> node id (exact)
 * - descriptor (header stripped) -> node id, for targets emitted under another package/version
 * - every {@code /}-boundary suffix of a descriptor -> node id, for targets with a shorter namespace
 * - type fqn -> node id, and simple name -> node id (only if unique), for names read from docs
 */
public final class SymbolTable {

    private final Map<String, String> bySymbol = new HashMap<>();
    private final Map<String, String> byDescriptor = new TreeMap<>();
    private final Map<String, String> typeByFqn = new HashMap<>();
    private final Map<String, String> uniqueSimpleToId = new HashMap<>();
    private final Map<String, Integer> simpleCounts = new HashMap<>();
    private final Map<String, String> byDescriptorSuffix = new HashMap<>();
    private final Map<String, Optional<String>> resolved = new HashMap<>();

    public void register(Node node) {
        resolved.clear();
        bySymbol.put(node.symbol(), node.id());
        ScipSymbol.parse(node.symbol())
                .map(ScipSymbol::descriptorText)
                .filter(d -> !d.isEmpty())
                .ifPresent(d -> byDescriptor.putIfAbsent(stripTypeMarker(d), node.id()));

        if (node.kind().isClassLike()) {
            typeByFqn.putIfAbsent(node.fqn(), node.id());
            final String simple = simpleNameOf(node.fqn());
            simpleCounts.merge(simple, 1, Integer::sum);
        }
    }

    public void finalizeIndex() {
        // needs all registrations: a simple name maps only when unique
        for (var e : typeByFqn.entrySet()) {
            final String simple = simpleNameOf(e.getKey());
            if (simpleCounts.getOrDefault(simple, 0) == 1) {
                uniqueSimpleToId.put(simple, e.getValue());
            }
        }

        // sorted iteration: the first descriptor in order owns a shared suffix
        byDescriptorSuffix.clear();
        for (var e : byDescriptor.entrySet()) {
            final String descriptor = e.getKey();
            for (int i = descriptor.indexOf('/'); i >= 0; i = descriptor.indexOf('/', i + 1)) {
                byDescriptorSuffix.putIfAbsent(descriptor.substring(i + 1), e.getValue());
            }
        }
        resolved.clear();
    }

    public Optional<String> nodeIdOf(String symbol) {
        return Optional.ofNullable(symbol == null ? null : bySymbol.get(symbol));
    }

    /**
     * Resolves a symbol that may not match any node verbatim: exact match first, then trailing
     * {@code .}/{@code #} variants, then the descriptor with or without its package header.
     * Answers, misses included, are remembered until the next registration.
     */
    public Optional<String> resolve(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return Optional.empty();
        }
        final Optional<String> known = resolved.get(symbol);
        if (known != null) {
            return known;
        }
        final Optional<String> answer = lookup(symbol);
        resolved.put(symbol, answer);
        return answer;
    }

    private Optional<String> lookup(String symbol) {
        final String exact = bySymbol.get(symbol);
        if (exact != null) {
            return Optional.of(exact);
        }
        for (String variant : new String[]{stripSuffix(symbol, "."), symbol + ".", stripSuffix(symbol, "#")}) {
            final String id = bySymbol.get(variant);
            if (id != null) {
                return Optional.of(id);
            }
        }

        final String descriptor = ScipSymbol.parse(symbol)
                .map(ScipSymbol::descriptorText)
                .orElse(symbol.strip());
        final String cleaned = stripTypeMarker(stripPrefix(descriptor, "/"));
        if (cleaned.isEmpty()) {
            return Optional.empty();
        }
        final String direct = byDescriptor.get(cleaned);
        if (direct != null) {
            return Optional.of(direct);
        }
        return Optional.ofNullable(byDescriptorSuffix.get(cleaned));
    }

    /**
     * Resolves a type name written in source form ({@code \App\Foo}, {@code App\Foo} or
     * {@code Foo}) against the registered class-like nodes.
     *
     * @param namespace namespace of the referencing type, tried for unqualified names
     */
    public Optional<String> resolveTypeName(String typeName, String namespace) {
        if (typeName == null || typeName.isBlank()) {
            return Optional.empty();
        }
        final String trimmed = stripPrefix(typeName.strip().replace('/', '\\'), "\\");
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }

        // already qualified
        final String qualified = typeByFqn.get(trimmed);
        if (qualified != null) {
            return Optional.of(qualified);
        }

        // same namespace
        if (trimmed.indexOf('\\') < 0 && namespace != null && !namespace.isBlank()) {
            final String candidate = typeByFqn.get(namespace + "\\" + trimmed);
            if (candidate != null) {
                return Optional.of(candidate);
            }
        }

        // unique simple name in the index
        return Optional.ofNullable(uniqueSimpleToId.get(simpleNameOf(trimmed)));
    }

    static String simpleNameOf(String fqn) {
        final int i = fqn.lastIndexOf('\\');
        return i >= 0 ? fqn.substring(i + 1) : fqn;
    }

    private static String stripTypeMarker(String descriptor) {
        return stripSuffix(descriptor, "#");
    }

    private static String stripSuffix(String s, String suffix) {
        String out = s;
        while (out.endsWith(suffix)) {
            out = out.substring(0, out.length() - suffix.length());
        }
        return out;
    }

    private static String stripPrefix(String s, String prefix) {
        String out = s;
        while (out.startsWith(prefix)) {
            out = out.substring(prefix.length());
        }
        return out;
    }
}
