package ai.mapper.io;

final class CallsReaderJson {

    static final String CALLS_JSON = """
            {
              "version": "1.0",
              "values": [
                {"id": "src/A.php:3:4", "kind": "local", "symbol": "local 1",
                 "location": {"file": "src/A.php", "line": 3, "col": 4}},
                {"id": "src/A.php:5:8", "kind": "local", "source_value_id": "src/A.php:3:4",
                 "location": {"file": "src/A.php", "line": 5, "col": 8}}
              ],
              "calls": [
                {"id": "src/A.php:3:10", "kind": "method", "callee": "scip-php composer acme/app 1.0.0 App/Str#trim().",
                 "return_type": "scip-php composer acme/app 1.0.0 App/Str#",
                 "location": {"file": "src/A.php", "line": 3, "col": 10},
                 "receiver_value_id": "src/A.php:3:4",
                 "arguments": [{"position": 0, "value_id": "src/A.php:5:8"}],
                 "extra": "ignored"}
              ]
            }
            """;

    private CallsReaderJson() {
    }
}
