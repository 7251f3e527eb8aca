package ai.mapper.scip;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One indexed source file: its occurrences and its symbol table.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Document(
        @JsonAlias("relative_path") String relativePath,
        String language,
        List<Occurrence> occurrences,
        List<SymbolInformation> symbols
) {

    public Document {
        Objects.requireNonNull(relativePath, "relativePath");
        occurrences = occurrences == null ? List.of() : List.copyOf(occurrences);
        symbols = symbols == null ? List.of() : List.copyOf(symbols);
    }
}
