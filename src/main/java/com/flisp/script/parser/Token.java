package com.flisp.script.parser;

/**
 * A lexical token. Tokens carry no position: the parser reconstructs line
 * numbers by counting {@link TokenType#NEWLINE} tokens.
 */
public class Token {
    public final TokenType type;
    public final String lexeme;
    public final Object literal;

    public Token(TokenType type, String lexeme, Object literal) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
    }

    @Override
    public String toString() {
        switch (type) {
            case INTEGER:     return "integer(" + literal + ")";
            case REAL:        return "real(" + literal + ")";
            case BOOLEAN:     return "boolean(" + literal + ")";
            case NULL:        return "null";
            case IDENTIFIER:  return "identifier(" + lexeme + ")";
            case KEYWORD:     return "keyword(" + lexeme + ")";
            case QUOTE:       return "quote";
            case LEFT_PAREN:  return "lparen";
            case RIGHT_PAREN: return "rparen";
            case NEWLINE:     return "newline";
            default:          return "unknown(" + lexeme + ")";
        }
    }
}
