package ai.mapper.graph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

import ai.mapper.model.Node;
import ai.mapper.model.NodeKind;
import ai.mapper.model.Range;

/**
 * Per-file answer to "which node encloses line L?".
 * <p>
 * Entries of a file are sorted by start line (wider first on equal starts, types before
 * callables on equal ranges) and each one records its nearest enclosing entry, computed with
 * one stack pass. A query binary-searches the last entry starting at or before the line and
 * climbs enclosing entries until one contains it: O(log n + nesting depth).
 * <p>
 * Immutable once built.
 */
public final class SpatialIndex {

    private static final Comparator<Entry> ORDER = Comparator
            .comparingInt((Entry e) -> e.range().startLine())
            .thenComparing(Comparator.comparingInt((Entry e) -> e.range().endLine()).reversed())
            .thenComparingInt(e -> e.kind().isCallable() ? 1 : 0)
            .thenComparing(Entry::nodeId);

    private final Map<String, FileEntries> byFile;
    private final Map<String, String> fileNodeIds;

    private SpatialIndex(Map<String, FileEntries> byFile, Map<String, String> fileNodeIds) {
        this.byFile = byFile;
        this.fileNodeIds = fileNodeIds;
    }

    public static SpatialIndex empty() {
        return new SpatialIndex(Map.of(), Map.of());
    }

    /**
     * Indexes every body-bearing node with a file and range.
     *
     * @param fileNodeIds file path -> File node id, used as the fallback answer
     */
    public static SpatialIndex build(Collection<Node> nodes, Map<String, String> fileNodeIds) {
        final Map<String, List<Entry>> grouped = new HashMap<>();
        for (Node node : nodes) {
            if (!node.kind().hasBody() || node.file() == null || node.range() == null) {
                continue;
            }
            grouped.computeIfAbsent(node.file(), k -> new ArrayList<>())
                    .add(new Entry(node.range(), node.id(), node.kind()));
        }

        final Map<String, FileEntries> byFile = new HashMap<>();
        for (var e : grouped.entrySet()) {
            byFile.put(e.getKey(), FileEntries.of(e.getValue()));
        }
        return new SpatialIndex(byFile, Map.copyOf(fileNodeIds));
    }

    /**
     * Innermost node whose range contains {@code line}; the File node when none does; empty
     * for a file the index has never seen.
     */
    public Optional<String> enclosing(String file, int line) {
        return enclosingMatching(file, line, kind -> true);
    }

    /**
     * Innermost enclosing node whose kind passes {@code accept}, falling back to the File node.
     */
    public Optional<String> enclosingMatching(String file, int line, Predicate<NodeKind> accept) {
        if (file == null) {
            return Optional.empty();
        }
        final FileEntries entries = byFile.get(file);
        if (entries != null) {
            final Entry hit = entries.innermost(line, accept);
            if (hit != null) {
                return Optional.of(hit.nodeId());
            }
        }
        return Optional.ofNullable(fileNodeIds.get(file));
    }

    record Entry(Range range, String nodeId, NodeKind kind) {

        boolean encloses(Entry other) {
            return range.startLine() <= other.range.startLine() && other.range.endLine() <= range.endLine();
        }
    }

    private static final class FileEntries {
        private final Entry[] entries;
        private final int[] startLines;
        private final int[] parent;

        private FileEntries(Entry[] entries, int[] startLines, int[] parent) {
            this.entries = entries;
            this.startLines = startLines;
            this.parent = parent;
        }

        static FileEntries of(List<Entry> unsorted) {
            final Entry[] entries = unsorted.toArray(new Entry[0]);
            Arrays.sort(entries, ORDER);

            final int n = entries.length;
            final int[] startLines = new int[n];
            final int[] parent = new int[n];
            final int[] stack = new int[n];
            int top = -1;
            for (int i = 0; i < n; i++) {
                startLines[i] = entries[i].range().startLine();
                while (top >= 0 && !entries[stack[top]].encloses(entries[i])) {
                    top--;
                }
                parent[i] = top >= 0 ? stack[top] : -1;
                stack[++top] = i;
            }
            return new FileEntries(entries, startLines, parent);
        }

        Entry innermost(int line, Predicate<NodeKind> accept) {
            int i = lastStartingAtOrBefore(line);
            while (i >= 0) {
                final Entry e = entries[i];
                if (e.range().containsLine(line) && accept.test(e.kind())) {
                    return e;
                }
                i = parent[i];
            }
            return null;
        }

        private int lastStartingAtOrBefore(int line) {
            int lo = 0;
            int hi = startLines.length - 1;
            int found = -1;
            while (lo <= hi) {
                final int mid = (lo + hi) >>> 1;
                if (startLines[mid] <= line) {
                    found = mid;
                    lo = mid + 1;
                } else {
                    hi = mid - 1;
                }
            }
            return found;
        }
    }
}
