package ai.mapper.calls;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Call-site data supplied next to the index ({@code calls.json}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CallsData(
        String version,
        List<ValueRecord> values,
        List<CallRecord> calls
) {

    public CallsData {
        values = values == null ? List.of() : List.copyOf(values);
        calls = calls == null ? List.of() : List.copyOf(calls);
    }
}
