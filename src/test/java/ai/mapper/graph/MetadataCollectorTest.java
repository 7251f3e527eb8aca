package ai.mapper.graph;

import static ai.mapper.ScipFixtures.document;
import static ai.mapper.ScipFixtures.extendsRel;
import static ai.mapper.ScipFixtures.implementsRel;
import static ai.mapper.ScipFixtures.index;
import static ai.mapper.ScipFixtures.info;
import static ai.mapper.ScipFixtures.sym;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import ai.mapper.scip.Relationship;

class MetadataCollectorTest {

    private static final String USER = sym("App/User#");

    @Test
    void repeatedEmissions_merge() {
        final var index = index(
                document("src/User.php")
                        .symbols(info(USER, "Class", List.of("User entity"), extendsRel(sym("App/Base#"))))
                        .build(),
                document("src/UserAlias.php")
                        .symbols(info(USER, "Interface", List.of("User entity", "More docs"),
                                extendsRel(sym("App/Base#")), implementsRel(sym("App/Named#"))))
                        .build());

        final Map<String, SymbolMetadata> merged = new MetadataCollector().collect(index);
        final SymbolMetadata user = merged.get(USER);

        assertThat(user.documentation()).containsExactly("User entity", "More docs");
        assertThat(user.relationships()).extracting(Relationship::symbol)
                .containsExactly(sym("App/Base#"), sym("App/Named#"));
        assertThat(user.kindHint()).isEqualTo("Class");
        assertThat(user.file()).isEqualTo("src/User.php");
    }

    @Test
    void blankSymbols_areIgnored_andOrderIsFirstSeen() {
        final var index = index(document("src/A.php")
                .symbols(info(sym("App/B#"), null), info(" ", "Class"), info(sym("App/A#"), null))
                .build());

        assertThat(new MetadataCollector().collect(index).keySet())
                .containsExactly(sym("App/B#"), sym("App/A#"));
    }
}
