package ai.mapper.scip;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Declared link from one symbol to another (inheritance, overrides, type definition).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Relationship(
        String symbol,
        @JsonProperty("isReference") @JsonAlias("is_reference") boolean isReference,
        @JsonProperty("isImplementation") @JsonAlias("is_implementation") boolean isImplementation,
        @JsonProperty("isTypeDefinition") @JsonAlias("is_type_definition") boolean isTypeDefinition,
        @JsonProperty("isDefinition") @JsonAlias("is_definition") boolean isDefinition
) {
}
