package ai.mapper.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.mapper.model.Node;
import ai.mapper.model.NodeKind;
import ai.mapper.model.Range;

/**
 * Estimates missing body ends from sibling order.
 * <p>
 * Within one file, nodes sharing a container (owning symbol, or the file for top-level nodes)
 * are ordered by start line. A body-bearing node without a real end is closed one line before
 * the next sibling starts; the last sibling gets a fixed extent by kind
 * ({@link MapperSettings#methodFallbackLines()}, {@link MapperSettings#typeFallbackLines()}).
 * Either way the estimate never runs past the container's own end. Containers are handled
 * before their members so that end is already settled.
 * <p>
 * This is a heuristic: it does not reconstruct true body extents.
 */
public final class RangeEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(RangeEstimator.class);

    private static final String FILE_ROOT = "";

    private static final Comparator<Node> BY_START = Comparator
            .comparingInt((Node n) -> n.range().startLine())
            .thenComparingInt(n -> n.range().startCol())
            .thenComparing(Node::id);

    public void estimate(MappingContext ctx) {
        final Map<String, List<Node>> byFile = new LinkedHashMap<>();
        for (Node node : ctx.symbolNodes()) {
            if (node.file() == null || node.range() == null) {
                continue;
            }
            byFile.computeIfAbsent(node.file(), k -> new ArrayList<>()).add(node);
        }

        int estimated = 0;
        for (var e : byFile.entrySet()) {
            estimated += estimateFile(ctx, e.getValue());
        }
        LOG.debug("Estimated {} body ranges across {} files", estimated, byFile.size());
    }

    /**
     * File-local: touches only nodes of one file.
     */
    private int estimateFile(MappingContext ctx, List<Node> fileNodes) {
        final Map<String, Node> byId = new HashMap<>();
        for (Node n : fileNodes) {
            byId.put(n.id(), n);
        }

        final Map<String, List<Node>> children = new HashMap<>();
        for (Node n : fileNodes) {
            children.computeIfAbsent(containerOf(ctx, n, byId), k -> new ArrayList<>()).add(n);
        }

        int estimated = 0;
        final Deque<String> queue = new ArrayDeque<>();
        queue.add(FILE_ROOT);
        while (!queue.isEmpty()) {
            final String containerId = queue.poll();
            final List<Node> siblings = children.getOrDefault(containerId, List.of());
            if (siblings.isEmpty()) {
                continue;
            }
            final int containerEnd = containerEnd(containerId, byId);

            final List<Node> ordered = new ArrayList<>();
            for (Node s : siblings) {
                ordered.add(byId.get(s.id()));
            }
            ordered.sort(BY_START);

            for (int i = 0; i < ordered.size(); i++) {
                final Node node = ordered.get(i);
                if (node.kind().hasBody() && !node.range().hasKnownEnd()) {
                    final int end = Math.min(estimatedEnd(ctx.settings(), ordered, i), containerEnd);
                    final Node updated = node.withRange(node.range().withEndLine(end));
                    ctx.replaceNode(updated);
                    byId.put(updated.id(), updated);
                    estimated++;
                }
                queue.add(node.id());
            }
        }
        return estimated;
    }

    private static int estimatedEnd(MapperSettings settings, List<Node> ordered, int i) {
        final Range range = ordered.get(i).range();
        for (int j = i + 1; j < ordered.size(); j++) {
            final int nextStart = ordered.get(j).range().startLine();
            if (nextStart > range.startLine()) {
                return nextStart - 1;
            }
        }
        return range.startLine() + fallbackLines(settings, ordered.get(i).kind());
    }

    static int fallbackLines(MapperSettings settings, NodeKind kind) {
        return kind.isCallable() ? settings.methodFallbackLines() : settings.typeFallbackLines();
    }

    private static String containerOf(MappingContext ctx, Node node, Map<String, Node> sameFile) {
        return ctx.decoded(node.id())
                .map(DecodedSymbol::parentSymbol)
                .flatMap(parent -> ctx.symbols().nodeIdOf(parent))
                .filter(sameFile::containsKey)
                .orElse(FILE_ROOT);
    }

    private static int containerEnd(String containerId, Map<String, Node> byId) {
        if (FILE_ROOT.equals(containerId)) {
            return Integer.MAX_VALUE;
        }
        final Range r = byId.get(containerId).range();
        return r.hasKnownEnd() ? r.endLine() : Integer.MAX_VALUE;
    }
}
