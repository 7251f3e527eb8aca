package ai.mapper.calls;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import ai.mapper.model.Location;

/**
 * One value flowing through call sites: a parameter, local, property read, literal, constant or
 * call result.
 *
 * @param id            location id {@code file:line:col}
 * @param kind          parameter / local / property / literal / constant / result
 * @param symbol        SCIP symbol of the variable, when it has one
 * @param type          SCIP symbol of the runtime type, when known
 * @param sourceValueId value this one was assigned from
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ValueRecord(
        String id,
        String kind,
        String symbol,
        String type,
        Location location,
        @JsonProperty("source_value_id") String sourceValueId
) {
}
