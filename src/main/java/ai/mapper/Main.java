package ai.mapper;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

import ai.mapper.calls.CallsData;
import ai.mapper.graph.Graph;
import ai.mapper.graph.GraphBuilder;
import ai.mapper.graph.MapperSettings;
import ai.mapper.io.CallsReader;
import ai.mapper.io.GraphWriter;
import ai.mapper.io.IndexReader;
import ai.mapper.io.KlocArchive;
import ai.mapper.scip.ScipIndex;

public final class Main {

    public static void main(String[] args) {
        final int code = run(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args) {
        Path indexFile = null;
        Path archiveFile = null;
        Path callsFile = null;
        Path outFile = null;
        boolean pretty = false;
        MapperSettings settings = MapperSettings.defaults();

        try {
            try {
                settings = parseFallbacks(args, settings);
            } catch (IllegalArgumentException ex) {
                System.err.println("ERROR: " + safeMsg(ex.getMessage()));
                printUsage();
                return 2;
            }

            for (String arg : args) {
                if ("--help".equals(arg) || "-h".equals(arg)) {
                    printUsage();
                    return 0;
                }
                if (arg.startsWith("--index=")) {
                    indexFile = Paths.get(arg.substring("--index=".length()));
                    continue;
                }
                if (arg.startsWith("--archive=")) {
                    archiveFile = Paths.get(arg.substring("--archive=".length()));
                    continue;
                }
                if (arg.startsWith("--calls=")) {
                    callsFile = Paths.get(arg.substring("--calls=".length()));
                    continue;
                }
                if (arg.startsWith("--out=")) {
                    outFile = Paths.get(arg.substring("--out=".length()));
                    continue;
                }
                if ("--pretty".equals(arg)) {
                    pretty = true;
                    continue;
                }
                if (arg.startsWith("--methodFallback=") || arg.startsWith("--typeFallback=")) {
                    continue;
                }
                if (arg.startsWith("--projectRoot=")) {
                    settings = settings.withProjectRoot(arg.substring("--projectRoot=".length()));
                    continue;
                }
                System.err.println("ERROR: unknown argument: " + arg);
                printUsage();
                return 2;
            }

            if ((indexFile == null) == (archiveFile == null)) {
                System.err.println("ERROR: exactly one of --index or --archive is required");
                printUsage();
                return 2;
            }
            if (outFile == null) {
                System.err.println("ERROR: --out is required");
                printUsage();
                return 2;
            }

            final ScipIndex index;
            CallsData calls = null;
            final String source;
            if (archiveFile != null) {
                final KlocArchive archive = KlocArchive.load(archiveFile);
                index = archive.index();
                calls = archive.calls().orElse(null);
                source = archiveFile.toString();
            } else {
                index = new IndexReader().read(indexFile);
                source = indexFile.toString();
            }
            if (callsFile != null) {
                // explicit file wins over the archive's calls.json
                calls = new CallsReader().read(callsFile);
            }

            System.err.println("Mapping " + source + " ...");
            final Graph graph = new GraphBuilder(settings).build(index, calls, source);
            new GraphWriter(pretty).write(graph, outFile);

            System.out.println("Graph written to: " + outFile);
            System.out.println("Nodes: " + graph.nodes().size() + ", edges: " + graph.edges().size()
                    + (calls != null ? " (with call graph)" : ""));
            return 0;
        } catch (IOException ex) {
            System.err.println("ERROR: IO failure: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (Exception ex) {
            System.err.println("ERROR: failed to build graph: "
                    + ex.getClass().getSimpleName() + ": " + safeMsg(ex.getMessage()));
            return 1;
        }
    }

    private static MapperSettings parseFallbacks(String[] args, MapperSettings settings) {
        MapperSettings out = settings;
        for (String arg : args) {
            if (arg.startsWith("--methodFallback=")) {
                out = out.withFallbacks(parseLines(arg, "--methodFallback="), out.typeFallbackLines());
            } else if (arg.startsWith("--typeFallback=")) {
                out = out.withFallbacks(out.methodFallbackLines(), parseLines(arg, "--typeFallback="));
            }
        }
        return out;
    }

    private static int parseLines(String arg, String prefix) {
        final String value = arg.substring(prefix.length()).trim();
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("not a line count: " + arg, ex);
        }
    }

    private static void printUsage() {
        System.out.println("Usage: scip-graph-mapper (--index=<file> | --archive=<file.kloc>) --out=<file> [options]");
        System.out.println("Options:");
        System.out.println("  --index=<path>            SCIP index, JSON rendering");
        System.out.println("  --archive=<path>          .kloc archive (index.json + optional calls.json)");
        System.out.println("  --calls=<path>            calls.json with call-site data");
        System.out.println("  --out=<path>              Output graph JSON");
        System.out.println("  --pretty                  Pretty-print the output");
        System.out.println("  --methodFallback=<n>      Estimated extent of a trailing method (default: "
                + MapperSettings.DEFAULT_METHOD_FALLBACK_LINES + ")");
        System.out.println("  --typeFallback=<n>        Estimated extent of a trailing type (default: "
                + MapperSettings.DEFAULT_TYPE_FALLBACK_LINES + ")");
        System.out.println("  --projectRoot=<path>      Project root recorded in the output metadata");
        System.out.println("  --help, -h                Show this help");
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
