package ai.aerof.deck.lexer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.Assertions.tuple;

import java.util.List;
import org.junit.jupiter.api.Test;

class LexerTest {

    private final Lexer lexer = new Lexer();

    @Test
    void tokenizesBlockWithAssignments() {
        List<Token> tokens = lexer.tokenize("under Problem {\n  Type = Steady;\n}");

        assertThat(tokens)
                .extracting(Token::type, Token::text)
                .containsExactly(
                        tuple(TokenType.UNDER, "under"),
                        tuple(TokenType.IDENTIFIER, "Problem"),
                        tuple(TokenType.LBRACE, "{"),
                        tuple(TokenType.IDENTIFIER, "Type"),
                        tuple(TokenType.EQUALS, "="),
                        tuple(TokenType.IDENTIFIER, "Steady"),
                        tuple(TokenType.SEMICOLON, ";"),
                        tuple(TokenType.RBRACE, "}"));
    }

    @Test
    void keepsDottedIdentifierAsSingleToken() {
        List<Token> tokens = lexer.tokenize("Preconditioner.Type = Ras;");

        assertThat(tokens.get(0).type()).isEqualTo(TokenType.IDENTIFIER);
        assertThat(tokens.get(0).text()).isEqualTo("Preconditioner.Type");
        assertThat(tokens).hasSize(4);
    }

    @Test
    void distinguishesKeywordFromIdentifiersThatStartWithIt() {
        List<Token> tokens = lexer.tokenize("under underRelaxation");

        assertThat(tokens).extracting(Token::type)
                .containsExactly(TokenType.UNDER, TokenType.IDENTIFIER);
    }

    @Test
    void readsNumericLiterals() {
        List<Token> tokens = lexer.tokenize("1 -2.5 +3e10 4.0E-3 .5 7.");

        assertThat(tokens).extracting(Token::type).containsOnly(TokenType.NUMBER);
        assertThat(tokens).extracting(Token::text)
                .containsExactly("1", "-2.5", "+3e10", "4.0E-3", ".5", "7.");
    }

    @Test
    void copiesQuotedStringContentVerbatim() {
        List<Token> tokens = lexer.tokenize("Geometry = \"data/wing mesh.top\";");

        Token value = tokens.get(2);
        assertThat(value.type()).isEqualTo(TokenType.STRING);
        assertThat(value.text()).isEqualTo("data/wing mesh.top");
    }

    @Test
    void tracksLineAndColumn() {
        List<Token> tokens = lexer.tokenize("A = 1;\n  B = 2;");

        Token b = tokens.get(4);
        assertThat(b.text()).isEqualTo("B");
        assertThat(b.line()).isEqualTo(2);
        assertThat(b.column()).isEqualTo(3);
        assertThat(b.position()).isEqualTo(9);
    }

    @Test
    void rejectsUnknownCharacterWithPosition() {
        LexException error = lexError("A = 1;\n# comment");

        assertThat(error.unexpectedChar()).isEqualTo('#');
        assertThat(error.position()).isEqualTo(7);
        assertThat(error.line()).isEqualTo(2);
        assertThat(error.column()).isEqualTo(1);
        assertThat(error).hasMessageContaining("line 2, column 1");
    }

    @Test
    void rejectsUnterminatedString() {
        LexException error = lexError("A = \"open");

        assertThat(error.unexpectedChar()).isEqualTo('"');
        assertThat(error.position()).isEqualTo(4);
    }

    @Test
    void rejectsSignWithoutDigits() {
        LexException error = lexError("A = -;");

        assertThat(error.unexpectedChar()).isEqualTo('-');
    }

    @Test
    void classifiesIdentifierAndNumberShapes() {
        assertThat(Lexer.isIdentifier("Equations.Type")).isTrue();
        assertThat(Lexer.isIdentifier("_x1")).isTrue();
        assertThat(Lexer.isIdentifier("1abc")).isFalse();
        assertThat(Lexer.isIdentifier("a b")).isFalse();
        assertThat(Lexer.isNumber("-1.5e-3")).isTrue();
        assertThat(Lexer.isNumber("1e")).isFalse();
        assertThat(Lexer.isNumber("abc")).isFalse();
    }

    @Test
    void reportsEndLocationOfMultiLineString() {
        Token token = lexer.tokenize("A = \"first\nsecond\"").get(2);

        assertThat(token.width()).isEqualTo(14);
        assertThat(token.endPosition()).isEqualTo(18);
        assertThat(token.endLine()).isEqualTo(2);
        assertThat(token.endColumn()).isEqualTo(8);
    }

    @Test
    void returnsNoTokensForBlankInput() {
        assertThat(lexer.tokenize(" \n\t ")).isEmpty();
    }

    private LexException lexError(String text) {
        Throwable thrown = catchThrowable(() -> lexer.tokenize(text));
        assertThat(thrown).isInstanceOf(LexException.class);
        return (LexException) thrown;
    }
}
