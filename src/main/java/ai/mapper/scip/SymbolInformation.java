package ai.mapper.scip;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Symbol table entry of a document.
 * <p>
 * kind: SCIP symbol kind name ("Class", "Interface", "Method", "Field", ...), may be absent
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SymbolInformation(
        String symbol,
        List<String> documentation,
        List<Relationship> relationships,
        String kind,
        @JsonAlias("display_name") String displayName,
        @JsonAlias("signature_documentation") SignatureDocumentation signatureDocumentation
) {

    public SymbolInformation {
        documentation = documentation == null ? List.of() : List.copyOf(documentation);
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
    }

    public String signatureText() {
        return signatureDocumentation == null ? null : signatureDocumentation.text();
    }
}
