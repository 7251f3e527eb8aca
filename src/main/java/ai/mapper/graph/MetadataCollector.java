package ai.mapper.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import ai.mapper.scip.Document;
import ai.mapper.scip.Relationship;
import ai.mapper.scip.ScipIndex;
import ai.mapper.scip.SymbolInformation;

/**
 * Walks every document's symbol table once and merges repeated emissions of a symbol:
 * documentation is concatenated (identical entries kept once), relationships are unioned in
 * first-seen order, and the first non-empty kind hint, signature and file win.
 */
public final class MetadataCollector {

    public Map<String, SymbolMetadata> collect(ScipIndex index) {
        Objects.requireNonNull(index, "index");

        final Map<String, Accumulator> bySymbol = new LinkedHashMap<>();
        for (Document doc : index.documents()) {
            for (SymbolInformation info : doc.symbols()) {
                if (info.symbol() == null || info.symbol().isBlank()) {
                    continue;
                }
                bySymbol.computeIfAbsent(info.symbol(), k -> new Accumulator())
                        .add(info, doc.relativePath());
            }
        }

        final Map<String, SymbolMetadata> out = new LinkedHashMap<>();
        for (var e : bySymbol.entrySet()) {
            out.put(e.getKey(), e.getValue().toMetadata(e.getKey()));
        }
        return Collections.unmodifiableMap(out);
    }

    private static final class Accumulator {
        final List<String> documentation = new ArrayList<>();
        final Set<Relationship> relationships = new LinkedHashSet<>();
        String kindHint;
        String signature;
        String file;

        void add(SymbolInformation info, String docPath) {
            for (String doc : info.documentation()) {
                if (doc != null && !documentation.contains(doc)) {
                    documentation.add(doc);
                }
            }
            relationships.addAll(info.relationships());
            if (isBlank(kindHint) && !isBlank(info.kind())) {
                kindHint = info.kind();
            }
            if (isBlank(signature) && !isBlank(info.signatureText())) {
                signature = info.signatureText();
            }
            if (file == null) {
                file = docPath;
            }
        }

        SymbolMetadata toMetadata(String symbol) {
            return new SymbolMetadata(symbol, documentation, new ArrayList<>(relationships),
                    kindHint, signature, file);
        }

        private static boolean isBlank(String s) {
            return s == null || s.isBlank();
        }
    }
}
