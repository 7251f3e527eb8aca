package ai.mapper.io;

import static ai.mapper.ScipFixtures.def;
import static ai.mapper.ScipFixtures.defBody;
import static ai.mapper.ScipFixtures.document;
import static ai.mapper.ScipFixtures.extendsRel;
import static ai.mapper.ScipFixtures.index;
import static ai.mapper.ScipFixtures.info;
import static ai.mapper.ScipFixtures.ref;
import static ai.mapper.ScipFixtures.sym;
import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ai.mapper.calls.ArgumentRecord;
import ai.mapper.calls.CallRecord;
import ai.mapper.calls.CallsData;
import ai.mapper.calls.ValueRecord;
import ai.mapper.graph.Graph;
import ai.mapper.graph.GraphBuilder;
import ai.mapper.graph.MapperSettings;
import ai.mapper.model.Location;

class GraphWriterTest {

    private static Graph graph() {
        final String base = sym("App/Base#");
        final String child = sym("App/Child#");
        final String run = sym("App/Child#run().");
        final var index = index(document("src/Child.php")
                .occ(defBody(base, 0, 5), defBody(child, 6, 30), def(run, 8, 20), ref(base, 10, 4))
                .symbols(info(base, null, List.of("```php\nclass Base\n```")), info(child, "Class", extendsRel(base)))
                .build());
        final var calls = new CallsData("1",
                List.of(new ValueRecord("src/Child.php:10:4", "literal", null, null, null, null)),
                List.of(new CallRecord("src/Child.php:10:2", "function", run, sym("App/helper()."), null,
                        new Location("src/Child.php", 10, 2), null, null,
                        List.of(new ArgumentRecord(0, "src/Child.php:10:4")))));
        return new GraphBuilder(MapperSettings.defaults()).build(index, calls, "index.json");
    }

    @Test
    void roundTrip_yieldsAnEqualGraph() throws IOException {
        final Graph graph = graph();

        final Graph back = GraphWriter.read(new GraphWriter(false).toJson(graph));

        assertThat(back).isEqualTo(graph);
    }

    @Test
    void write_createsParentsAndReadsBack(@TempDir Path dir) throws IOException {
        final Graph graph = graph();
        final Path out = dir.resolve("out/nested/graph.json");

        new GraphWriter(true).write(graph, out);

        assertThat(out).exists();
        assertThat(GraphWriter.read(out)).isEqualTo(graph);
    }

    @Test
    void json_usesSnakeCaseAndOmitsKindSpecificFields() throws IOException {
        final String json = new GraphWriter(false).toJson(graph());

        assertThat(json).startsWith("{\"version\":\"2.0\",\"metadata\":{\"generated_at\":");
        assertThat(json).contains("\"project_root\":\"file:///work/app\"", "\"source_index\":\"index.json\"");
        assertThat(json).contains("\"start_line\":", "\"end_col\":", "\"kind\":\"Class\"", "\"type\":\"extends\"");
        assertThat(json).contains("\"call_kind\":\"function\"", "\"value_kind\":\"literal\"", "\"position\":0");
        assertThat(json).doesNotContain("\"key\"", "\"known_end\"", "\"hasKnownEnd\"");
        assertThat(json).doesNotContain("\"type_symbol\":null", "\"call_kind\":null", "\"location\":null");
    }

    @Test
    void prettyOutput_isIndented() throws IOException {
        assertThat(new GraphWriter(true).toJson(graph())).contains("\n  \"metadata\"");
    }
}
