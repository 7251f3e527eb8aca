package ai.mapper.calls;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param position 0-based argument index
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ArgumentRecord(
        Integer position,
        @JsonProperty("value_id") String valueId
) {
}
