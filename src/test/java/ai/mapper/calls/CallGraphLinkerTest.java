package ai.mapper.calls;

import static ai.mapper.ScipFixtures.def;
import static ai.mapper.ScipFixtures.defBody;
import static ai.mapper.ScipFixtures.document;
import static ai.mapper.ScipFixtures.index;
import static ai.mapper.ScipFixtures.sym;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import ai.mapper.graph.Graph;
import ai.mapper.graph.GraphBuilder;
import ai.mapper.graph.MapperSettings;
import ai.mapper.model.CallKind;
import ai.mapper.model.Edge;
import ai.mapper.model.EdgeType;
import ai.mapper.model.Ids;
import ai.mapper.model.Location;
import ai.mapper.model.Node;
import ai.mapper.model.NodeKind;
import ai.mapper.model.Range;
import ai.mapper.scip.ScipIndex;

class CallGraphLinkerTest {

    private static final String FILE = "src/Service.php";
    private static final String USER = sym("App/User#");
    private static final String GET_NAME = sym("App/User#getName().");
    private static final String SERVICE = sym("App/Service#");
    private static final String RUN = sym("App/Service#run().");
    private static final String LOG = sym("App/Service#log().");
    private static final String USER_PARAM = sym("App/Service#run().($user)");

    private static final String OBJ = FILE + ":4:8";
    private static final String GET_NAME_CALL = FILE + ":4:15";
    private static final String TRIM_CALL = FILE + ":4:26";
    private static final String LOG_CALL = FILE + ":6:8";
    private static final String NESTED_CALL = FILE + ":6:20";
    private static final String COPY = FILE + ":8:8";

    private static ScipIndex serviceIndex() {
        return index(
                document("src/User.php")
                        .occ(defBody(USER, 0, 10), defBody(GET_NAME, 2, 5))
                        .build(),
                document(FILE)
                        .occ(defBody(SERVICE, 0, 30), defBody(RUN, 2, 20), def(USER_PARAM, 2, 24),
                                defBody(LOG, 22, 28))
                        .build());
    }

    /**
     * <pre>
     * 4: $user->getName()->trim();
     * 6: $this->log($this->format($x));
     * 8: $copy = $user;
     * </pre>
     */
    private static CallsData calls() {
        return new CallsData("1", List.of(
                new ValueRecord(OBJ, "parameter", USER_PARAM, USER, new Location(FILE, 4, 8), null),
                new ValueRecord(GET_NAME_CALL, "result", null, null, new Location(FILE, 4, 15), null),
                new ValueRecord(NESTED_CALL, "result", null, null, null, null),
                new ValueRecord(COPY, "local", sym("App/Service#run().local$copy@8"), null,
                        new Location(FILE, 8, 8), OBJ),
                new ValueRecord(OBJ, "parameter", USER_PARAM, null, new Location(FILE, 9, 9), null)
        ), List.of(
                new CallRecord(GET_NAME_CALL, "method", RUN, GET_NAME, null, new Location(FILE, 4, 15),
                        OBJ, null, List.of()),
                new CallRecord(TRIM_CALL, "access", RUN, sym("App/Str#trim()."), null, new Location(FILE, 4, 26),
                        GET_NAME_CALL, null, List.of()),
                new CallRecord(LOG_CALL, "method", RUN, LOG, null, new Location(FILE, 6, 8),
                        null, null, List.of(new ArgumentRecord(0, NESTED_CALL), new ArgumentRecord(1, "gone:1:1"))),
                new CallRecord(NESTED_CALL, "method", null, sym("App/Service#format()."), null, null,
                        "missing:2:2", null, List.of())
        ));
    }

    private static Graph build() {
        return new GraphBuilder(MapperSettings.defaults()).build(serviceIndex(), calls(), null);
    }

    private static Node byId(Graph graph, String id) {
        return graph.nodes().stream().filter(n -> n.id().equals(id)).findFirst().orElseThrow();
    }

    private static List<Edge> from(Graph graph, String sourceId, EdgeType type) {
        return graph.edges().stream()
                .filter(e -> e.source().equals(sourceId) && e.type() == type)
                .collect(Collectors.toList());
    }

    @Test
    void callNode_kindNameAndLocation() {
        final Graph graph = build();
        final Node call = byId(graph, Ids.callNodeId(GET_NAME_CALL));

        assertThat(call.kind()).isEqualTo(NodeKind.CALL);
        assertThat(call.callKind()).isEqualTo(CallKind.METHOD);
        assertThat(call.name()).isEqualTo("getName()");
        assertThat(call.fqn()).isEqualTo("App\\Service::run()@4:15");
        assertThat(call.file()).isEqualTo(FILE);
        assertThat(call.range()).isEqualTo(Range.point(4, 15, "getName()".length()));
        assertThat(call.symbol()).isEmpty();
    }

    @Test
    void chainedCall_onTheResultOfAnotherCall() {
        final Graph graph = build();
        final String trim = Ids.callNodeId(TRIM_CALL);

        assertThat(byId(graph, trim).callKind()).isEqualTo(CallKind.METHOD);
        assertThat(from(graph, trim, EdgeType.RECEIVER)).extracting(Edge::target)
                .containsExactly(Ids.valueNodeId(GET_NAME_CALL));
        // callee has no node in the index
        assertThat(from(graph, trim, EdgeType.CALLS)).isEmpty();
    }

    @Test
    void callEdges() {
        final Graph graph = build();
        final String call = Ids.callNodeId(GET_NAME_CALL);
        final String getName = byId(graph, Ids.nodeId(GET_NAME)).id();

        assertThat(from(graph, call, EdgeType.CALLS)).containsExactly(
                Edge.at(EdgeType.CALLS, call, getName, new Location(FILE, 4, 15)));
        assertThat(from(graph, call, EdgeType.RECEIVER)).extracting(Edge::target)
                .containsExactly(Ids.valueNodeId(OBJ));
        assertThat(from(graph, call, EdgeType.PRODUCES)).extracting(Edge::target)
                .containsExactly(Ids.valueNodeId(GET_NAME_CALL));
        assertThat(from(graph, Ids.nodeId(RUN), EdgeType.CONTAINS)).extracting(Edge::target)
                .contains(call, Ids.callNodeId(TRIM_CALL), Ids.callNodeId(LOG_CALL));
    }

    @Test
    void arguments_carryPositions_andDanglingIdsAreSkipped() {
        final Graph graph = build();
        final List<Edge> args = from(graph, Ids.callNodeId(LOG_CALL), EdgeType.ARGUMENT);

        assertThat(args).hasSize(1);
        assertThat(args.get(0).position()).isZero();
        assertThat(args.get(0).target()).isEqualTo(Ids.valueNodeId(NESTED_CALL));
        assertThat(from(graph, Ids.callNodeId(NESTED_CALL), EdgeType.RECEIVER)).isEmpty();
    }

    @Test
    void nestedCall_keepsItsOwnLocation() {
        final Graph graph = build();
        final Node nested = byId(graph, Ids.callNodeId(NESTED_CALL));

        assertThat(nested.range().startLine()).isEqualTo(6);
        assertThat(nested.range().startCol()).isEqualTo(20);
        assertThat(nested.fqn()).isEqualTo(FILE + ":6:20");
        // no caller recorded: placed by position inside run()
        assertThat(graph.edges()).contains(Edge.of(EdgeType.CONTAINS, Ids.nodeId(RUN), nested.id()));
        assertThat(byId(graph, Ids.valueNodeId(NESTED_CALL)).range().startCol()).isEqualTo(20);
    }

    @Test
    void valueNodes_namesProvenanceAndTypes() {
        final Graph graph = build();
        final Node user = byId(graph, Ids.valueNodeId(OBJ));
        final Node copy = byId(graph, Ids.valueNodeId(COPY));

        assertThat(user.name()).isEqualTo("$user");
        assertThat(user.valueKind()).isEqualTo("parameter");
        assertThat(user.typeSymbol()).isEqualTo(USER);
        assertThat(user.fqn()).isEqualTo("App\\Service::run().$user");
        // a repeated id reuses the first record
        assertThat(user.range().startLine()).isEqualTo(4);

        assertThat(copy.name()).isEqualTo("$copy");
        assertThat(byId(graph, Ids.valueNodeId(GET_NAME_CALL)).name()).isEqualTo("(result)");

        assertThat(graph.edges()).contains(
                Edge.of(EdgeType.TYPE_OF, user.id(), Ids.nodeId(USER)),
                Edge.of(EdgeType.ASSIGNED_FROM, copy.id(), user.id()),
                Edge.of(EdgeType.CONTAINS, Ids.nodeId(RUN), user.id()),
                Edge.of(EdgeType.CONTAINS, Ids.nodeId(RUN), copy.id()));
    }

    @Test
    void everyCallAndValue_hasOneParent() {
        final Graph graph = build();
        final Map<String, Integer> parents = new HashMap<>();
        for (Edge e : graph.edges()) {
            if (e.type() == EdgeType.CONTAINS) {
                parents.merge(e.target(), 1, Integer::sum);
            }
        }
        for (Node n : graph.nodes()) {
            if (n.kind() == NodeKind.CALL || n.kind() == NodeKind.VALUE) {
                assertThat(parents.get(n.id())).as(n.fqn()).isEqualTo(1);
            }
        }
    }

    @Test
    void recordsWithoutContainer_getNoNode() {
        final String orphan = "orphan";
        final String vendor = "vendor/lib/Util.php:3:3";
        final String stray = "stray";
        final CallsData data = new CallsData("1", List.of(
                new ValueRecord(orphan, "literal", null, null, null, null),
                new ValueRecord(vendor, "local", null, null, null, null),
                new ValueRecord(OBJ, "parameter", USER_PARAM, null, null, null)
        ), List.of(
                new CallRecord(stray, "function", null, sym("App/helper()."), null, null, null, null,
                        List.of(new ArgumentRecord(0, OBJ))),
                new CallRecord(LOG_CALL, "method", RUN, LOG, null, null, null, null,
                        List.of(new ArgumentRecord(0, orphan), new ArgumentRecord(1, vendor)))
        ));

        final Graph graph = new GraphBuilder(MapperSettings.defaults()).build(serviceIndex(), data, null);

        assertThat(graph.nodes()).extracting(Node::id).doesNotContain(
                Ids.valueNodeId(orphan), Ids.valueNodeId(vendor), Ids.callNodeId(stray));
        assertThat(graph.nodes()).extracting(Node::id).contains(Ids.valueNodeId(OBJ), Ids.callNodeId(LOG_CALL));
        assertThat(from(graph, Ids.callNodeId(LOG_CALL), EdgeType.ARGUMENT)).isEmpty();
        assertThat(graph.edges()).contains(
                Edge.of(EdgeType.CONTAINS, Ids.nodeId(RUN), Ids.valueNodeId(OBJ)),
                Edge.of(EdgeType.CONTAINS, Ids.nodeId(RUN), Ids.callNodeId(LOG_CALL)));
    }

    @Test
    void names() {
        assertThat(CallGraphLinker.valueName(new ValueRecord("a:1:1", "literal", null, null, null, null)))
                .isEqualTo("(literal)");
        assertThat(CallGraphLinker.valueName(new ValueRecord("a:1:1", "property", sym("App/User#$email."),
                null, null, null))).isEqualTo("$email");
        assertThat(CallGraphLinker.valueName(new ValueRecord("a:1:1", "weird", null, null, null, null)))
                .isEqualTo("$unknown");

        final CallRecord ctor = new CallRecord("a:1:1", "constructor", null, null, sym("App/User#"), null,
                null, null, List.of());
        assertThat(CallGraphLinker.callName(ctor, CallKind.CONSTRUCTOR)).isEqualTo("new User()");
        final CallRecord access = new CallRecord("a:1:1", "access", null, sym("App/User#$email."), null, null,
                null, null, List.of());
        assertThat(CallGraphLinker.callName(access, CallKind.ACCESS)).isEqualTo("email");

        assertThat(CallGraphLinker.scopeSymbol(sym("App/A#m().($x)"))).isEqualTo(sym("App/A#m()."));
        assertThat(CallGraphLinker.scopeSymbol(sym("App/A#$p."))).isNull();
    }
}
