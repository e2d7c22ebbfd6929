package org.featuretree.script;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScriptLexerTest {

    @Test
    void tokenize_simpleAssignmentWithPositions() {
        List<Token> tokens = ScriptLexer.tokenize("width = 5\n");

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.NAME, TokenType.OP, TokenType.NUMBER, TokenType.NEWLINE, TokenType.END);
        Token name = tokens.get(0);
        assertThat(name.text()).isEqualTo("width");
        assertThat(name.line()).isEqualTo(1);
        assertThat(name.column()).isZero();
        assertThat(name.endColumn()).isEqualTo(5);
        assertThat(tokens.get(1).column()).isEqualTo(6);
        assertThat(tokens.get(2).value()).isEqualTo(5L);
        assertThat(tokens.get(2).column()).isEqualTo(8);
    }

    @Test
    void tokenize_numberForms() {
        List<Token> tokens = ScriptLexer.tokenize("a = [2.5, 1_000, 0x10, 1e3, .5]");

        List<Object> numbers = tokens.stream()
                .filter(t -> t.type() == TokenType.NUMBER)
                .map(Token::value)
                .toList();
        assertThat(numbers).containsExactly(2.5, 1000L, 16L, 1000.0, 0.5);
    }

    @Test
    void tokenize_stringEscapesAndPrefixes() {
        List<Token> tokens = ScriptLexer.tokenize("s = 'a\\'b\\n' + r'\\d' + \"\"\"x\ny\"\"\"");

        List<Object> strings = tokens.stream()
                .filter(t -> t.type() == TokenType.STRING)
                .map(Token::value)
                .toList();
        assertThat(strings).containsExactly("a'b\n", "\\d", "x\ny");
    }

    @Test
    void tokenize_indentationProducesIndentAndDedent() {
        String script = """
                if flag:
                    x = 1
                y = 2
                """;

        List<TokenType> types = ScriptLexer.tokenize(script).stream().map(Token::type).toList();

        assertThat(types).containsSubsequence(TokenType.INDENT, TokenType.NAME, TokenType.DEDENT, TokenType.NAME);
    }

    @Test
    void tokenize_implicitContinuationInsideBracketsHasNoNewline() {
        List<Token> tokens = ScriptLexer.tokenize("f(1,\n  2)\n");

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.NAME, TokenType.OP, TokenType.NUMBER, TokenType.OP, TokenType.NUMBER, TokenType.OP,
                TokenType.NEWLINE, TokenType.END);
    }

    @Test
    void tokenize_skipsBomAndKeepsColumnsZeroBased() {
        List<Token> tokens = ScriptLexer.tokenize("\uFEFFx = 1\n");

        assertThat(tokens.get(0).text()).isEqualTo("x");
        assertThat(tokens.get(0).line()).isEqualTo(1);
        assertThat(tokens.get(0).column()).isZero();
    }

    @Test
    void tokenize_crlfCountsAsSingleLineBreak() {
        List<Token> tokens = ScriptLexer.tokenize("a = 1\r\nb = 2\r\n");

        Token b = tokens.stream().filter(t -> t.text().equals("b")).findFirst().orElseThrow();
        assertThat(b.line()).isEqualTo(2);
        assertThat(b.column()).isZero();
    }

    @Test
    void tokenize_commentsAndBlankLinesAreIgnored() {
        List<Token> tokens = ScriptLexer.tokenize("# header\n\nx = 1  # trailing\n\n");

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.NAME, TokenType.OP, TokenType.NUMBER, TokenType.NEWLINE, TokenType.END);
        assertThat(tokens.get(0).line()).isEqualTo(3);
    }

    @Test
    void tokenize_unclosedBracketFails() {
        assertThatThrownBy(() -> ScriptLexer.tokenize("f(1, 2\n"))
                .isInstanceOfSatisfying(ScriptSyntaxException.class,
                        e -> assertThat(e.getReason()).isEqualTo("括号未闭合"));
    }

    @Test
    void tokenize_unterminatedStringReportsStartPosition() {
        assertThatThrownBy(() -> ScriptLexer.tokenize("x = 1\ny = 'abc\n"))
                .isInstanceOfSatisfying(ScriptSyntaxException.class, e -> {
                    assertThat(e.getReason()).isEqualTo("字符串未闭合");
                    assertThat(e.getLine()).isEqualTo(2);
                    assertThat(e.getColumn()).isEqualTo(4);
                });
    }
}
