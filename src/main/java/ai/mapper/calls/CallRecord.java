package ai.mapper.calls;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import ai.mapper.model.Location;

/**
 * One call or access expression.
 *
 * @param id              location id {@code file:line:col}
 * @param kind            shape as recorded by the producer (function, method, method_static,
 *                        constructor, access, access_static); may be missing or unknown
 * @param caller          symbol of the enclosing method/function
 * @param callee          symbol of the called method/function/property
 * @param returnType      symbol of the result type; the class for constructors
 * @param receiverValueId value the call is made on
 * @param resultValueId   value the call produces
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CallRecord(
        String id,
        String kind,
        String caller,
        String callee,
        @JsonProperty("return_type") String returnType,
        Location location,
        @JsonProperty("receiver_value_id") String receiverValueId,
        @JsonProperty("result_value_id") String resultValueId,
        List<ArgumentRecord> arguments
) {

    public CallRecord {
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }
}
