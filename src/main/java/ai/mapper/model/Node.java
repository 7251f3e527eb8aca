package ai.mapper.model;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Graph node. {@code valueKind} and {@code typeSymbol} are only set on Value nodes,
 * {@code callKind} only on Call nodes.
 */
@JsonPropertyOrder({"id", "kind", "name", "fqn", "symbol", "file", "range", "documentation",
        "value_kind", "type_symbol", "call_kind"})
public record Node(
        String id,
        NodeKind kind,
        String name,
        String fqn,
        String symbol,
        String file,
        Range range,
        List<String> documentation,
        @JsonProperty("value_kind") @JsonInclude(JsonInclude.Include.NON_NULL) String valueKind,
        @JsonProperty("type_symbol") @JsonInclude(JsonInclude.Include.NON_NULL) String typeSymbol,
        @JsonProperty("call_kind") @JsonInclude(JsonInclude.Include.NON_NULL) CallKind callKind
) {

    public Node {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        documentation = documentation == null ? List.of() : List.copyOf(documentation);
    }

    public static Node symbol(String id, NodeKind kind, String name, String fqn, String symbol,
                              String file, Range range, List<String> documentation) {
        return new Node(id, kind, name, fqn, symbol, file, range, documentation, null, null, null);
    }

    public static Node file(String filePath) {
        return new Node(Ids.fileNodeId(filePath), NodeKind.FILE, Ids.fileName(filePath), filePath,
                Ids.fileSymbol(filePath), filePath, null, List.of(), null, null, null);
    }

    public static Node value(String id, String name, String fqn, String symbol, String file,
                             Range range, String valueKind, String typeSymbol) {
        return new Node(id, NodeKind.VALUE, name, fqn, symbol, file, range, List.of(),
                valueKind, typeSymbol, null);
    }

    public static Node call(String id, String name, String fqn, String file, Range range,
                            CallKind callKind) {
        return new Node(id, NodeKind.CALL, name, fqn, "", file, range, List.of(), null, null, callKind);
    }

    public Node withRange(Range newRange) {
        return new Node(id, kind, name, fqn, symbol, file, newRange, documentation,
                valueKind, typeSymbol, callKind);
    }
}
