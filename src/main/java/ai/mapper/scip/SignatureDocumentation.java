package ai.mapper.scip;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SignatureDocumentation(
        String language,
        String text
) {
}
