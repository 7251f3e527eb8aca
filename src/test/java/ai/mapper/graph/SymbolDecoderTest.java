package ai.mapper.graph;

import static ai.mapper.ScipFixtures.sym;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import ai.mapper.model.NodeKind;

class SymbolDecoderTest {

    private final Map<String, SymbolMetadata> metadata = new HashMap<>();

    private DecodedSymbol decode(String descriptors) {
        return new SymbolDecoder(metadata).decode(sym(descriptors)).orElseThrow();
    }

    private void hint(String descriptors, String kind, List<String> docs, String signature) {
        metadata.put(sym(descriptors), new SymbolMetadata(sym(descriptors), docs, List.of(), kind, signature, null));
    }

    @Test
    void method_underType() {
        final DecodedSymbol d = decode("App/Entity/User#getId().");

        assertThat(d.kind()).isEqualTo(NodeKind.METHOD);
        assertThat(d.name()).isEqualTo("getId");
        assertThat(d.fqn()).isEqualTo("App\\Entity\\User::getId()");
        assertThat(d.containerFqn()).isEqualTo("App\\Entity\\User");
        assertThat(d.parentSymbol()).isEqualTo(sym("App/Entity/User#"));
    }

    @Test
    void topLevelMethod_isFunction() {
        final DecodedSymbol d = decode("App/helper().");

        assertThat(d.kind()).isEqualTo(NodeKind.FUNCTION);
        assertThat(d.fqn()).isEqualTo("App\\helper()");
        assertThat(d.containerFqn()).isEqualTo("App");
        assertThat(d.parentSymbol()).isNull();
    }

    @Test
    void typeKind_fromHintThenSignatureThenDocumentation() {
        hint("App/Repo#", "Interface", List.of(), null);
        hint("App/Loggable#", null, List.of(), "trait Loggable");
        hint("App/Status#", null, List.of("```php\nenum Status: string\n```"), null);
        hint("App/Base#", null, List.of("```php\nabstract class Base\n```"), null);

        assertThat(decode("App/Repo#").kind()).isEqualTo(NodeKind.INTERFACE);
        assertThat(decode("App/Loggable#").kind()).isEqualTo(NodeKind.TRAIT);
        assertThat(decode("App/Status#").kind()).isEqualTo(NodeKind.ENUM);
        assertThat(decode("App/Base#").kind()).isEqualTo(NodeKind.CLASS);
        assertThat(decode("App/Plain#").kind()).isEqualTo(NodeKind.CLASS);
        assertThat(decode("App/Plain#").fqn()).isEqualTo("App\\Plain");
    }

    @Test
    void memberTerms() {
        hint("App/Status#", "Enum", List.of(), null);
        hint("App/User#Limit.", "Constant", List.of(), null);

        final DecodedSymbol property = decode("App/User#$name.");
        assertThat(property.kind()).isEqualTo(NodeKind.PROPERTY);
        assertThat(property.fqn()).isEqualTo("App\\User::$name");

        assertThat(decode("App/User#MAX_SIZE.").kind()).isEqualTo(NodeKind.CONSTANT);
        assertThat(decode("App/User#Limit.").kind()).isEqualTo(NodeKind.CONSTANT);
        assertThat(decode("App/User#name.").kind()).isEqualTo(NodeKind.CONSTANT);
        assertThat(decode("App/Status#Active.").kind()).isEqualTo(NodeKind.ENUM_CASE);
    }

    @Test
    void memberTerms_declarationBeatsNaming() {
        hint("App/User#maxSize.", null, List.of(), "const maxSize = 5");
        hint("App/User#$email.", null, List.of(), "public const EMAIL = 'x'");
        hint("App/Suit#Hearts.", null, List.of("```php\ncase Hearts = 'H';\n```"), null);
        hint("App/User#total.", null, List.of("```php\nprivate ?int $total\n```"), null);

        assertThat(decode("App/User#maxSize.").kind()).isEqualTo(NodeKind.CONSTANT);
        assertThat(decode("App/User#$email.").kind()).isEqualTo(NodeKind.CONSTANT);
        assertThat(decode("App/Suit#Hearts.").kind()).isEqualTo(NodeKind.ENUM_CASE);
        assertThat(decode("App/User#total.").kind()).isEqualTo(NodeKind.PROPERTY);
    }

    @Test
    void memberDeclaration_ignoresProse() {
        final SymbolMetadata prose = new SymbolMetadata(sym("App/User#x."),
                List.of("Constant value used by the cache"), List.of(), null, null, null);

        assertThat(SymbolDecoder.memberKindFromDeclaration(prose)).isNull();
    }

    @Test
    void topLevelTerm_isConstant() {
        final DecodedSymbol d = decode("App/VERSION.");

        assertThat(d.kind()).isEqualTo(NodeKind.CONSTANT);
        assertThat(d.fqn()).isEqualTo("App\\VERSION");
    }

    @Test
    void parameter_isArgumentOfItsMethod() {
        final DecodedSymbol d = decode("App/User#setName().($name)");

        assertThat(d.kind()).isEqualTo(NodeKind.ARGUMENT);
        assertThat(d.name()).isEqualTo("$name");
        assertThat(d.fqn()).isEqualTo("App\\User::setName()::$name");
        assertThat(d.parentSymbol()).isEqualTo(sym("App/User#setName()."));
    }

    @Test
    void nonEntities_decodeToEmpty() {
        final SymbolDecoder decoder = new SymbolDecoder(metadata);

        assertThat(decoder.decode(sym("App/"))).isEmpty();
        assertThat(decoder.decode(sym("App/Box#[T]"))).isEmpty();
        assertThat(decoder.decode("local 3")).isEmpty();
        assertThat(decoder.decode("not a symbol")).isEmpty();
        assertThat(decoder.decode(null)).isEmpty();
    }

    @Test
    void kindFromDocumentation_ignoresProse() {
        assertThat(SymbolDecoder.kindFromDocumentation(List.of("Holds the user class data."))).isEmpty();
        assertThat(SymbolDecoder.kindFromDocumentation(List.of("```php\nfinal class User\n```")))
                .contains(NodeKind.CLASS);
    }
}
