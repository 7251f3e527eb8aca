package ai.mapper.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

import ai.mapper.calls.CallsData;
import ai.mapper.scip.ScipIndex;

/**
 * Loaded {@code .kloc} archive: a ZIP with
 * - index.json: SCIP index, JSON rendering (required)
 * - calls.json: call-site data (optional)
 * <p>
 * Only JSON-rendered archives load. Archives that carry the protobuf {@code index.scip} are
 * rejected with a message naming it; render them first (e.g. {@code scip print --json}).
 * <p>
 * Members are read straight from the ZIP; nothing is extracted to disk.
 */
public final class KlocArchive {

    public static final String INDEX_ENTRY = "index.json";
    public static final String CALLS_ENTRY = "calls.json";
    static final String PROTOBUF_INDEX_ENTRY = "index.scip";

    private final ScipIndex index;
    private final CallsData calls;

    private KlocArchive(ScipIndex index, CallsData calls) {
        this.index = index;
        this.calls = calls;
    }

    public static KlocArchive load(Path archive) throws IOException {
        Objects.requireNonNull(archive, "archive");
        if (!Files.isRegularFile(archive)) {
            throw new NoSuchFileException(archive.toString(), null, "archive not found");
        }

        try (ZipFile zip = new ZipFile(archive.toFile())) {
            final ZipEntry indexEntry = zip.getEntry(INDEX_ENTRY);
            if (indexEntry == null) {
                if (zip.getEntry(PROTOBUF_INDEX_ENTRY) != null) {
                    throw new ArchiveException("Archive carries a protobuf " + PROTOBUF_INDEX_ENTRY
                            + " but only a JSON-rendered " + INDEX_ENTRY + " can be read: " + archive);
                }
                throw new ArchiveException("Archive missing " + INDEX_ENTRY + ": " + archive);
            }
            final ScipIndex index;
            try (InputStream in = zip.getInputStream(indexEntry)) {
                index = new IndexReader().read(in);
            } catch (IOException ex) {
                throw new ArchiveException("Invalid " + INDEX_ENTRY + " in " + archive + ": " + ex.getMessage(), ex);
            }

            CallsData calls = null;
            final ZipEntry callsEntry = zip.getEntry(CALLS_ENTRY);
            if (callsEntry != null) {
                try (InputStream in = zip.getInputStream(callsEntry)) {
                    calls = new CallsReader().read(in);
                } catch (IOException ex) {
                    throw new ArchiveException("Invalid " + CALLS_ENTRY + " in " + archive + ": " + ex.getMessage(), ex);
                }
            }
            return new KlocArchive(index, calls);
        } catch (ZipException ex) {
            throw new ArchiveException("Invalid archive format: " + archive + " is not a valid ZIP file", ex);
        }
    }

    public ScipIndex index() {
        return index;
    }

    public Optional<CallsData> calls() {
        return Optional.ofNullable(calls);
    }
}
