package ai.mapper.scip;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Parsed SCIP symbol string.
 * <pre>
 *   symbol     := scheme ' ' manager ' ' package ' ' version ' ' descriptor+ | 'local ' id
 *   descriptor := name '/' | name '#' | name '.' | name '(' disambiguator? ').'
 *               | '(' name ')' | '[' name ']' | name ':' | name '!'
 *   name       := [A-Za-z0-9_+\-$]+ | '`' ( [^`] | '``' )+ '`'
 * </pre>
 * Inside header tokens a double space stands for a literal space and a lone {@code .} for an
 * empty token.
 */
public record ScipSymbol(
        String raw,
        String scheme,
        String manager,
        String packageName,
        String version,
        List<Descriptor> descriptors,
        boolean local
) {

    private static final String LOCAL_PREFIX = "local ";

    public ScipSymbol {
        Objects.requireNonNull(raw, "raw");
        descriptors = List.copyOf(descriptors);
    }

    /**
     * Parses a symbol string. Never throws.
     *
     * @return the parsed symbol, or empty when the string does not follow the grammar
     */
    public static Optional<ScipSymbol> parse(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return Optional.empty();
        }
        if (symbol.startsWith(LOCAL_PREFIX)) {
            return Optional.of(new ScipSymbol(symbol, "local", "", "", "", List.of(), true));
        }
        return new Parser(symbol).parse();
    }

    public Optional<Descriptor> last() {
        return descriptors.isEmpty()
                ? Optional.empty()
                : Optional.of(descriptors.get(descriptors.size() - 1));
    }

    /**
     * Descriptor part of the symbol, header stripped.
     */
    public String descriptorText() {
        return descriptors.isEmpty() ? "" : raw.substring(descriptors.get(0).start());
    }

    /**
     * Symbol of the owning type or callable. Empty for top-level symbols, whose owner is a
     * namespace (and therefore the file).
     */
    public Optional<String> parentSymbol() {
        if (descriptors.size() < 2) {
            return Optional.empty();
        }
        final Descriptor previous = descriptors.get(descriptors.size() - 2);
        if (previous.suffix() == Descriptor.Suffix.NAMESPACE) {
            return Optional.empty();
        }
        return Optional.of(raw.substring(0, descriptors.get(descriptors.size() - 1).start()));
    }

    /**
     * True when a type descriptor precedes the last descriptor.
     */
    public boolean hasTypeOwner() {
        for (int i = 0; i < descriptors.size() - 1; i++) {
            if (descriptors.get(i).suffix() == Descriptor.Suffix.TYPE) {
                return true;
            }
        }
        return false;
    }

    private static final class Parser {

        private final String s;
        private int pos;

        private Parser(String s) {
            this.s = s;
        }

        Optional<ScipSymbol> parse() {
            final String scheme = headerToken();
            final String manager = headerToken();
            final String pkg = headerToken();
            final String version = headerToken();
            if (scheme == null || manager == null || pkg == null || version == null || scheme.isEmpty()) {
                return Optional.empty();
            }

            final List<Descriptor> descriptors = new ArrayList<>();
            while (pos < s.length()) {
                final Descriptor d = descriptor();
                if (d == null) {
                    return Optional.empty();
                }
                descriptors.add(d);
            }
            if (descriptors.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(new ScipSymbol(s, scheme, manager, pkg, version, descriptors, false));
        }

        /**
         * Reads one space-terminated header token; null when the input ends first.
         */
        private String headerToken() {
            final StringBuilder sb = new StringBuilder();
            while (pos < s.length()) {
                final char c = s.charAt(pos);
                if (c == ' ') {
                    if (pos + 1 < s.length() && s.charAt(pos + 1) == ' ') {
                        sb.append(' ');
                        pos += 2;
                        continue;
                    }
                    pos++;
                    final String token = sb.toString();
                    return ".".equals(token) ? "" : token;
                }
                sb.append(c);
                pos++;
            }
            return null;
        }

        private Descriptor descriptor() {
            final int start = pos;
            final char first = s.charAt(pos);

            if (first == '[' || first == '(') {
                final char close = first == '[' ? ']' : ')';
                pos++;
                final String name = name();
                if (name == null || !expect(close)) {
                    return null;
                }
                final Descriptor.Suffix suffix = first == '['
                        ? Descriptor.Suffix.TYPE_PARAMETER
                        : Descriptor.Suffix.PARAMETER;
                return new Descriptor(name, "", suffix, start);
            }

            final String name = name();
            if (name == null || pos >= s.length()) {
                return null;
            }
            final char c = s.charAt(pos++);
            return switch (c) {
                case '/' -> new Descriptor(name, "", Descriptor.Suffix.NAMESPACE, start);
                case '#' -> new Descriptor(name, "", Descriptor.Suffix.TYPE, start);
                case '.' -> new Descriptor(name, "", Descriptor.Suffix.TERM, start);
                case ':' -> new Descriptor(name, "", Descriptor.Suffix.META, start);
                case '!' -> new Descriptor(name, "", Descriptor.Suffix.MACRO, start);
                case '(' -> method(name, start);
                default -> null;
            };
        }

        private Descriptor method(String name, int start) {
            final StringBuilder disambiguator = new StringBuilder();
            while (pos < s.length() && isIdentifierChar(s.charAt(pos))) {
                disambiguator.append(s.charAt(pos++));
            }
            if (!expect(')') || !expect('.')) {
                return null;
            }
            return new Descriptor(name, disambiguator.toString(), Descriptor.Suffix.METHOD, start);
        }

        private String name() {
            if (pos >= s.length()) {
                return null;
            }
            if (s.charAt(pos) == '`') {
                return escapedName();
            }
            final int begin = pos;
            while (pos < s.length() && isIdentifierChar(s.charAt(pos))) {
                pos++;
            }
            return pos > begin ? s.substring(begin, pos) : null;
        }

        private String escapedName() {
            pos++; // opening back-tick
            final StringBuilder sb = new StringBuilder();
            while (pos < s.length()) {
                final char c = s.charAt(pos);
                if (c == '`') {
                    if (pos + 1 < s.length() && s.charAt(pos + 1) == '`') {
                        sb.append('`');
                        pos += 2;
                        continue;
                    }
                    pos++;
                    return sb.length() > 0 ? sb.toString() : null;
                }
                sb.append(c);
                pos++;
            }
            return null;
        }

        private boolean expect(char c) {
            if (pos < s.length() && s.charAt(pos) == c) {
                pos++;
                return true;
            }
            return false;
        }

        private static boolean isIdentifierChar(char c) {
            return Character.isLetterOrDigit(c) || c == '_' || c == '+' || c == '-' || c == '$';
        }
    }
}
