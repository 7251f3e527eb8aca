package ai.mapper.calls;

import java.util.Optional;

import ai.mapper.model.Location;

/**
 * Location ids ({@code file:line:col}) used as value and call identifiers.
 */
public final class LocationIds {

    private LocationIds() {
    }

    /**
     * Splits on the last two colons so file paths containing colons still parse.
     */
    public static Optional<Location> parse(String id) {
        if (id == null) {
            return Optional.empty();
        }
        final int colSep = id.lastIndexOf(':');
        final int lineSep = colSep > 0 ? id.lastIndexOf(':', colSep - 1) : -1;
        if (lineSep <= 0) {
            return Optional.empty();
        }
        try {
            final int line = Integer.parseInt(id.substring(lineSep + 1, colSep));
            final int col = Integer.parseInt(id.substring(colSep + 1));
            return Optional.of(new Location(id.substring(0, lineSep), line, col));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }
}
