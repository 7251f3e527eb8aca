package ai.mapper.io;

import java.io.IOException;

/**
 * A {@code .kloc} archive that is not a ZIP file, lacks {@code index.json}, or carries an
 * unreadable member.
 */
public final class ArchiveException extends IOException {

    public ArchiveException(String message) {
        super(message);
    }

    public ArchiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
