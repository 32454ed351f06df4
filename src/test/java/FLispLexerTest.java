import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.flisp.script.parser.Lexer;
import com.flisp.script.parser.Token;
import com.flisp.script.parser.TokenType;

public class FLispLexerTest {

    private static List<Token> lex(String src) {
        return new Lexer(src).tokenize();
    }

    private static void assertTypes(List<Token> tokens, TokenType... expected) {
        assertEquals(expected.length, tokens.size(), "token count for " + tokens);
        for (int i = 0; i < expected.length; i++) {
            assertEquals(expected[i], tokens.get(i).type, "token " + i + " of " + tokens);
        }
    }

    @Test
    void simpleCall() {
        List<Token> tokens = lex("(plus 1 2.5)");
        assertTypes(tokens,
                TokenType.LEFT_PAREN, TokenType.KEYWORD, TokenType.INTEGER, TokenType.REAL, TokenType.RIGHT_PAREN);

        assertEquals("plus", tokens.get(1).lexeme);
        assertEquals(1L, tokens.get(2).literal);
        assertEquals(2.5, (Double) tokens.get(3).literal, 1e-12);
    }

    @Test
    void literalsAreRecognizedBeforeKeywordsAndNumbers() {
        List<Token> tokens = lex("true false null");
        assertTypes(tokens, TokenType.BOOLEAN, TokenType.BOOLEAN, TokenType.NULL);
        assertEquals(Boolean.TRUE, tokens.get(0).literal);
        assertEquals(Boolean.FALSE, tokens.get(1).literal);
    }

    @Test
    void integersArePreferredOverReals() {
        List<Token> tokens = lex("-5 +3 42");
        assertTypes(tokens, TokenType.INTEGER, TokenType.INTEGER, TokenType.INTEGER);
        assertEquals(-5L, tokens.get(0).literal);
        assertEquals(3L, tokens.get(1).literal);
        assertEquals(42L, tokens.get(2).literal);
    }

    @Test
    void realForms() {
        List<Token> tokens = lex("1e3 .5 5. -2.25");
        assertTypes(tokens, TokenType.REAL, TokenType.REAL, TokenType.REAL, TokenType.REAL);
        assertEquals(1000.0, (Double) tokens.get(0).literal, 1e-12);
        assertEquals(0.5, (Double) tokens.get(1).literal, 1e-12);
        assertEquals(5.0, (Double) tokens.get(2).literal, 1e-12);
        assertEquals(-2.25, (Double) tokens.get(3).literal, 1e-12);
    }

    @Test
    void integerOutOfLongRangeBecomesReal() {
        List<Token> tokens = lex("99999999999999999999");
        assertTypes(tokens, TokenType.REAL);
    }

    @Test
    void identifiersAreLettersOnly() {
        List<Token> tokens = lex("foo x1 $ Plus");
        assertTypes(tokens, TokenType.IDENTIFIER, TokenType.UNKNOWN, TokenType.UNKNOWN, TokenType.IDENTIFIER);
        assertEquals("x1", tokens.get(1).lexeme);
    }

    @Test
    void quoteAndNewlines() {
        List<Token> tokens = lex("'a\n(b)");
        assertTypes(tokens,
                TokenType.QUOTE, TokenType.IDENTIFIER, TokenType.NEWLINE,
                TokenType.LEFT_PAREN, TokenType.IDENTIFIER, TokenType.RIGHT_PAREN);
    }

    @Test
    void parenthesesDelimitAtoms() {
        List<Token> tokens = lex("(a)(b)");
        assertTypes(tokens,
                TokenType.LEFT_PAREN, TokenType.IDENTIFIER, TokenType.RIGHT_PAREN,
                TokenType.LEFT_PAREN, TokenType.IDENTIFIER, TokenType.RIGHT_PAREN);
    }

    @Test
    void everyKeywordIsAKeyword() {
        for (String kw : Lexer.KEYWORDS) {
            List<Token> tokens = lex(kw);
            assertTypes(tokens, TokenType.KEYWORD);
        }
        assertEquals(33, Lexer.KEYWORDS.size());
    }

    @Test
    void emptyAndBlankSourceYieldNoTokens() {
        assertTrue(lex("").isEmpty());
        assertTrue(lex("  \t ").isEmpty());
    }
}
