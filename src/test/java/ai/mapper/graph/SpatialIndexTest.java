package ai.mapper.graph;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import ai.mapper.model.Node;
import ai.mapper.model.NodeKind;
import ai.mapper.model.Range;

class SpatialIndexTest {

    private static final String FILE = "src/A.php";
    private static final Node FILE_NODE = Node.file(FILE);

    private static Node node(String id, NodeKind kind, int start, int end) {
        return Node.symbol(id, kind, id, id, id, FILE, new Range(start, 0, end, 0), List.of());
    }

    private static SpatialIndex index(Node... nodes) {
        return SpatialIndex.build(List.of(nodes), Map.of(FILE, FILE_NODE.id()));
    }

    @Test
    void enclosing_returnsInnermostThenOuterThenFile() {
        final SpatialIndex idx = index(node("A", NodeKind.CLASS, 10, 50), node("B", NodeKind.METHOD, 20, 30));

        assertThat(idx.enclosing(FILE, 25)).contains("B");
        assertThat(idx.enclosing(FILE, 40)).contains("A");
        assertThat(idx.enclosing(FILE, 5)).contains(FILE_NODE.id());
        assertThat(idx.enclosing(FILE, 50)).contains("A");
        assertThat(idx.enclosing("src/Other.php", 25)).isEmpty();
    }

    @Test
    void enclosing_climbsPastClosedSiblings() {
        final SpatialIndex idx = index(
                node("C", NodeKind.CLASS, 0, 100),
                node("m1", NodeKind.METHOD, 5, 10),
                node("m2", NodeKind.METHOD, 12, 15),
                node("m3", NodeKind.METHOD, 60, 70));

        assertThat(idx.enclosing(FILE, 13)).contains("m2");
        assertThat(idx.enclosing(FILE, 40)).contains("C");
        assertThat(idx.enclosing(FILE, 101)).contains(FILE_NODE.id());
    }

    @Test
    void equalRanges_preferTheCallable() {
        final SpatialIndex idx = index(node("fn", NodeKind.FUNCTION, 3, 9), node("T", NodeKind.CLASS, 3, 9));

        assertThat(idx.enclosing(FILE, 4)).contains("fn");
    }

    @Test
    void kindFilters() {
        final SpatialIndex idx = index(node("A", NodeKind.CLASS, 10, 50), node("B", NodeKind.METHOD, 20, 30));

        assertThat(idx.enclosingMatching(FILE, 25, NodeKind::isCallable)).contains("B");
        assertThat(idx.enclosingMatching(FILE, 40, NodeKind::isCallable)).contains(FILE_NODE.id());
        assertThat(idx.enclosingMatching(FILE, 40, NodeKind::isClassLike)).contains("A");
    }

    @Test
    void nodesWithoutBodies_areNotIndexed() {
        final Node property = Node.symbol("p", NodeKind.PROPERTY, "p", "p", "p", FILE,
                new Range(20, 0, 40, 0), List.of());
        final SpatialIndex idx = index(node("A", NodeKind.CLASS, 10, 50), property);

        assertThat(idx.enclosing(FILE, 30)).contains("A");
    }
}
