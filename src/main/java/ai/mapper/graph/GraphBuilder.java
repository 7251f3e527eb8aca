package ai.mapper.graph;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.mapper.calls.CallGraphLinker;
import ai.mapper.calls.CallsData;
import ai.mapper.model.Edge;
import ai.mapper.model.Node;
import ai.mapper.scip.ScipIndex;

/**
 * Maps one SCIP index (plus optional call-site data) to a property graph.
 * <p>
 * Runs full passes in a fixed order over one {@link MappingContext}; each pass completes before
 * the next starts. Stateless between runs: every {@link #build} call gets a fresh context.
 */
public final class GraphBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(GraphBuilder.class);

    private final MapperSettings settings;
    private final Clock clock;

    public GraphBuilder(MapperSettings settings) {
        this(settings, Clock.systemUTC());
    }

    GraphBuilder(MapperSettings settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Graph build(ScipIndex index) {
        return build(index, null, null);
    }

    /**
     * @param calls       call-site data, or null to skip the call graph
     * @param sourceIndex recorded in the output metadata, may be null
     */
    public Graph build(ScipIndex index, CallsData calls, String sourceIndex) {
        Objects.requireNonNull(index, "index");

        // Step 1: merge per-symbol metadata across documents
        final Map<String, SymbolMetadata> metadata = new MetadataCollector().collect(index);
        final MappingContext ctx = new MappingContext(index, settings, metadata);

        // Step 2: File and symbol nodes, then the name indices that need all of them
        new NodeSynthesizer().synthesize(ctx);
        ctx.symbols().finalizeIndex();

        // Step 3: body extents (must precede the spatial index)
        new RangeEstimator().estimate(ctx);
        ctx.spatialIndex(SpatialIndex.build(ctx.nodes(), ctx.fileNodeIds()));

        // Step 4: structure
        new ContainmentPass().run(ctx);
        new InheritancePass().run(ctx);
        new TypeHintPass().run(ctx);

        // Step 5: references; override needs the inheritance edges
        new UsagePass().run(ctx);
        new OverridePass().run(ctx);

        // Step 6: call graph (optional input)
        if (calls != null) {
            new CallGraphLinker().link(ctx, calls);
        }

        final List<Node> nodes = new ArrayList<>(ctx.nodes());
        nodes.sort(Comparator.comparing(Node::id));
        final List<Edge> edges = new ArrayList<>(ctx.edges());
        edges.sort(Edge.ORDER);

        LOG.info("Mapped {} documents: {} nodes, {} edges", index.documents().size(), nodes.size(), edges.size());
        if (!ctx.skipped().isEmpty()) {
            LOG.info("Skipped input: {}", ctx.skipped());
        }

        final String projectRoot = settings.projectRoot() != null ? settings.projectRoot() : index.projectRoot();
        return new Graph(
                Graph.VERSION,
                new Graph.Metadata(Instant.now(clock).toString(), projectRoot, sourceIndex),
                nodes,
                edges);
    }
}
