package ai.mapper.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

import ai.mapper.model.Edge;
import ai.mapper.model.Location;
import ai.mapper.model.Node;
import ai.mapper.scip.ScipIndex;

/**
 * Mutable state of one mapping run, handed from pass to pass. Owns the nodes and edges built so
 * far and deduplicates edges by {@link Edge#key()} (first edge wins, so the first occurrence's
 * location is kept).
 * <p>
 * Not thread-safe; a run owns exactly one context.
 */
public final class MappingContext {

    private final ScipIndex index;
    private final MapperSettings settings;
    private final Map<String, SymbolMetadata> metadata;
    private final SymbolDecoder decoder;
    private final SymbolTable symbols = new SymbolTable();

    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final Map<String, String> fileNodeIds = new LinkedHashMap<>();
    private final Map<String, DecodedSymbol> decodedByNodeId = new LinkedHashMap<>();
    private final Map<String, Location> definitionSites = new LinkedHashMap<>();
    private final Map<Edge.Key, Edge> edges = new LinkedHashMap<>();
    private final Map<String, Integer> skipped = new TreeMap<>();

    private SpatialIndex spatialIndex = SpatialIndex.empty();

    public MappingContext(ScipIndex index, MapperSettings settings, Map<String, SymbolMetadata> metadata) {
        this.index = Objects.requireNonNull(index, "index");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.decoder = new SymbolDecoder(metadata);
    }

    public ScipIndex index() {
        return index;
    }

    public MapperSettings settings() {
        return settings;
    }

    public SymbolDecoder decoder() {
        return decoder;
    }

    public SymbolTable symbols() {
        return symbols;
    }

    public SymbolMetadata metadataOf(String symbol) {
        return metadata.getOrDefault(symbol, SymbolMetadata.empty(symbol));
    }

    public Map<String, SymbolMetadata> metadata() {
        return metadata;
    }

    // --- nodes ---

    /**
     * Adds a node unless one with the same id exists.
     *
     * @return true when the node was added
     */
    public boolean addNode(Node node) {
        if (nodes.containsKey(node.id())) {
            return false;
        }
        nodes.put(node.id(), node);
        return true;
    }

    public void addFileNode(Node fileNode) {
        if (addNode(fileNode)) {
            fileNodeIds.put(fileNode.file(), fileNode.id());
        }
    }

    public void addSymbolNode(Node node, DecodedSymbol decoded) {
        if (addNode(node)) {
            decodedByNodeId.put(node.id(), decoded);
            symbols.register(node);
        }
    }

    /**
     * Swaps in an updated copy of an existing node (range estimation).
     */
    public void replaceNode(Node node) {
        if (!nodes.containsKey(node.id())) {
            throw new IllegalArgumentException("Unknown node: " + node.id());
        }
        nodes.put(node.id(), node);
    }

    public Optional<Node> node(String id) {
        return Optional.ofNullable(id == null ? null : nodes.get(id));
    }

    public Collection<Node> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public Optional<String> fileNodeId(String file) {
        return Optional.ofNullable(file == null ? null : fileNodeIds.get(file));
    }

    public Map<String, String> fileNodeIds() {
        return Collections.unmodifiableMap(fileNodeIds);
    }

    /**
     * Identifier position of a node's definition, kept apart from its (body) range.
     */
    public void definitionSite(String nodeId, Location site) {
        definitionSites.put(nodeId, Objects.requireNonNull(site, "site"));
    }

    public Optional<Location> definitionSite(String nodeId) {
        return Optional.ofNullable(definitionSites.get(nodeId));
    }

    public Optional<DecodedSymbol> decoded(String nodeId) {
        return Optional.ofNullable(decodedByNodeId.get(nodeId));
    }

    /**
     * Nodes created from index symbols, in creation order.
     */
    public List<Node> symbolNodes() {
        final List<Node> out = new ArrayList<>(decodedByNodeId.size());
        for (String id : decodedByNodeId.keySet()) {
            out.add(nodes.get(id));
        }
        return out;
    }

    // --- edges ---

    /**
     * @return true when the edge was new
     */
    public boolean addEdge(Edge edge) {
        return edges.putIfAbsent(edge.key(), edge) == null;
    }

    public Collection<Edge> edges() {
        return Collections.unmodifiableCollection(edges.values());
    }

    // --- spatial index ---

    public SpatialIndex spatialIndex() {
        return spatialIndex;
    }

    public void spatialIndex(SpatialIndex index) {
        this.spatialIndex = Objects.requireNonNull(index, "index");
    }

    // --- degraded input accounting ---

    public void skip(String reason) {
        skipped.merge(reason, 1, Integer::sum);
    }

    public Map<String, Integer> skipped() {
        return Collections.unmodifiableMap(skipped);
    }
}
