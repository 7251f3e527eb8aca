package ai.mapper.scip;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Decoded SCIP index: the only input the mapping engine needs. How it was decoded
 * (protobuf, JSON) is up to the caller.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScipIndex(
        Metadata metadata,
        List<Document> documents
) {

    public ScipIndex {
        documents = documents == null ? List.of() : List.copyOf(documents);
    }

    public String projectRoot() {
        return metadata == null || metadata.projectRoot() == null ? "" : metadata.projectRoot();
    }
}
