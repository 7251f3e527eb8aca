package ai.mapper.graph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import ai.mapper.model.NodeKind;
import ai.mapper.scip.Descriptor;
import ai.mapper.scip.ScipSymbol;

/**
 * Derives kind, name and FQN of a symbol from its descriptor chain.
 * <p>
 * FQN convention: {@code \} between namespaces, {@code ::} before members, {@code ()} after
 * callables, e.g. {@code App\Entity\User::getId()::$id}.
 * <p>
 * Symbols outside the recognised shapes (namespaces, locals, type parameters, meta and macro
 * descriptors, anything unparseable) decode to empty and get no node.
 */
public final class SymbolDecoder {

    private static final Pattern TYPE_DECLARATION = Pattern.compile(
            "^(?:(?:abstract|final|readonly|sealed|public|private|protected|static)\\s+)*"
                    + "(class|interface|trait|enum)\\b");

    private static final Pattern MEMBER_DECLARATION = Pattern.compile(
            "^(?:(?:final|readonly|public|private|protected|static|var)\\s+)*"
                    + "(const\\b|case\\b|\\??[\\\\\\w|&]*\\s*\\$)");

    private final Map<String, SymbolMetadata> metadata;
    private final Map<String, Optional<DecodedSymbol>> cache = new HashMap<>();

    public SymbolDecoder(Map<String, SymbolMetadata> metadata) {
        this.metadata = Objects.requireNonNull(metadata, "metadata");
    }

    public Optional<DecodedSymbol> decode(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        final Optional<DecodedSymbol> cached = cache.get(symbol);
        if (cached != null) {
            return cached;
        }
        final Optional<DecodedSymbol> decoded = ScipSymbol.parse(symbol).flatMap(this::decodeParsed);
        cache.put(symbol, decoded);
        return decoded;
    }

    private Optional<DecodedSymbol> decodeParsed(ScipSymbol parsed) {
        if (parsed.local() || parsed.last().isEmpty()) {
            return Optional.empty();
        }
        final Descriptor last = parsed.last().get();
        final SymbolMetadata meta = metadata.getOrDefault(parsed.raw(), SymbolMetadata.empty(parsed.raw()));

        final NodeKind kind = switch (last.suffix()) {
            case PARAMETER -> NodeKind.ARGUMENT;
            case METHOD -> parsed.hasTypeOwner() ? NodeKind.METHOD : NodeKind.FUNCTION;
            case TYPE -> typeKind(meta);
            case TERM -> parsed.hasTypeOwner() ? memberKind(parsed, last, meta) : NodeKind.CONSTANT;
            case NAMESPACE, TYPE_PARAMETER, META, MACRO -> null;
        };
        if (kind == null) {
            return Optional.empty();
        }

        final List<Descriptor> chain = parsed.descriptors();
        final String fqn = fqn(chain);
        final String containerFqn = containerFqn(chain.subList(0, chain.size() - 1));
        final String parent = parsed.parentSymbol().orElse(null);
        return Optional.of(new DecodedSymbol(parsed.raw(), kind, last.name(), fqn, parent, containerFqn));
    }

    private static NodeKind typeKind(SymbolMetadata meta) {
        final Optional<NodeKind> hinted = kindFromHint(meta.kindHint());
        if (hinted.isPresent() && hinted.get().isClassLike()) {
            return hinted.get();
        }
        if (meta.signature() != null) {
            final NodeKind fromSignature = kindFromDeclaration(meta.signature());
            if (fromSignature != null) {
                return fromSignature;
            }
        }
        return kindFromDocumentation(meta.documentation()).orElse(NodeKind.CLASS);
    }

    private NodeKind memberKind(ScipSymbol parsed, Descriptor last, SymbolMetadata meta) {
        final Optional<NodeKind> hinted = kindFromHint(meta.kindHint());
        if (hinted.isPresent()) {
            final NodeKind k = hinted.get();
            if (k == NodeKind.PROPERTY || k == NodeKind.CONSTANT || k == NodeKind.ENUM_CASE) {
                return k;
            }
        }

        final NodeKind declared = memberKindFromDeclaration(meta);
        if (declared != null) {
            return declared;
        }

        if (last.name().startsWith("$")) {
            return NodeKind.PROPERTY;
        }
        final boolean ownerIsEnum = parsed.parentSymbol()
                .flatMap(this::decode)
                .map(owner -> owner.kind() == NodeKind.ENUM)
                .orElse(false);
        // properties always carry their '$'
        return ownerIsEnum ? NodeKind.ENUM_CASE : NodeKind.CONSTANT;
    }

    /**
     * Reads {@code const X}, {@code case X} or a {@code $x} property declaration from the
     * signature, then from the documentation.
     */
    static NodeKind memberKindFromDeclaration(SymbolMetadata meta) {
        final List<String> texts = new ArrayList<>();
        if (meta.signature() != null) {
            texts.add(meta.signature());
        }
        texts.addAll(meta.documentation());
        for (String text : texts) {
            final Matcher m = MEMBER_DECLARATION.matcher(stripFences(text).toLowerCase(Locale.ROOT));
            if (!m.find()) {
                continue;
            }
            return switch (m.group(1)) {
                case "const" -> NodeKind.CONSTANT;
                case "case" -> NodeKind.ENUM_CASE;
                default -> NodeKind.PROPERTY;
            };
        }
        return null;
    }

    /**
     * Maps a SCIP symbol kind name to a node kind.
     */
    static Optional<NodeKind> kindFromHint(String hint) {
        if (hint == null || hint.isBlank()) {
            return Optional.empty();
        }
        final NodeKind kind = switch (hint.trim().toLowerCase(Locale.ROOT)) {
            case "class", "struct", "object" -> NodeKind.CLASS;
            case "interface", "protocol" -> NodeKind.INTERFACE;
            case "trait", "mixin" -> NodeKind.TRAIT;
            case "enum" -> NodeKind.ENUM;
            case "method", "staticmethod", "abstractmethod", "constructor", "getter", "setter" -> NodeKind.METHOD;
            case "function" -> NodeKind.FUNCTION;
            case "field", "property", "staticfield", "staticproperty", "instancevariable" -> NodeKind.PROPERTY;
            case "constant", "staticvariable" -> NodeKind.CONSTANT;
            case "enummember" -> NodeKind.ENUM_CASE;
            case "parameter" -> NodeKind.ARGUMENT;
            default -> null;
        };
        return Optional.ofNullable(kind);
    }

    /**
     * Infers a class-like kind from documentation such as {@code ```php\nfinal class Foo```}.
     */
    public static Optional<NodeKind> kindFromDocumentation(List<String> docs) {
        for (String doc : docs) {
            final NodeKind kind = kindFromDeclaration(doc);
            if (kind != null) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    private static NodeKind kindFromDeclaration(String text) {
        final String cleaned = stripFences(text).toLowerCase(Locale.ROOT);
        final Matcher m = TYPE_DECLARATION.matcher(cleaned);
        if (!m.find()) {
            return null;
        }
        return switch (m.group(1)) {
            case "interface" -> NodeKind.INTERFACE;
            case "trait" -> NodeKind.TRAIT;
            case "enum" -> NodeKind.ENUM;
            default -> NodeKind.CLASS;
        };
    }

    /**
     * Removes markdown code fences and collapses whitespace.
     */
    static String stripFences(String doc) {
        if (doc == null) {
            return "";
        }
        final String noFences = doc.replaceAll("```[A-Za-z0-9_-]*", " ");
        return noFences.trim().replaceAll("\\s+", " ");
    }

    static String fqn(List<Descriptor> chain) {
        final StringBuilder sb = new StringBuilder();
        Descriptor.Suffix previous = null;
        for (Descriptor d : chain) {
            switch (d.suffix()) {
                case NAMESPACE -> sb.append(d.name()).append('\\');
                case TYPE -> {
                    if (previous == Descriptor.Suffix.TYPE) {
                        sb.append('\\');
                    } else if (previous != null && previous != Descriptor.Suffix.NAMESPACE) {
                        sb.append("::");
                    }
                    sb.append(d.name());
                }
                case TERM, META, MACRO -> {
                    appendMemberSeparator(sb, previous);
                    sb.append(d.name());
                }
                case METHOD -> {
                    appendMemberSeparator(sb, previous);
                    sb.append(d.name()).append("()");
                }
                case PARAMETER, TYPE_PARAMETER -> sb.append("::").append(d.name());
            }
            previous = d.suffix();
        }
        return sb.toString();
    }

    private static String containerFqn(List<Descriptor> ownerChain) {
        final String fqn = fqn(ownerChain);
        return fqn.endsWith("\\") ? fqn.substring(0, fqn.length() - 1) : fqn;
    }

    private static void appendMemberSeparator(StringBuilder sb, Descriptor.Suffix previous) {
        if (previous != null && previous != Descriptor.Suffix.NAMESPACE) {
            sb.append("::");
        }
    }
}
