package ai.mapper.scip;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Metadata(
        @JsonAlias("project_root") String projectRoot,
        @JsonAlias("text_document_encoding") String textDocumentEncoding
) {
}
