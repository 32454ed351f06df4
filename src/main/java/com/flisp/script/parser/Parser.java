package com.flisp.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.flisp.debug.Debug;

/**
 * Recursive-descent parser over the token stream. Never throws to its caller:
 * syntax errors are collected as diagnostics and parsing resumes at the next
 * line break or closing parenthesis.
 */
public class Parser {

    /** STRICT rejects unknown lexemes, LENIENT folds them into the AST as atoms. */
    public enum Mode {
        STRICT,
        LENIENT
    }

    private static final String TAG = "flisp.parser";

    private final List<Token> tokens;
    private final Mode mode;
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private int current = 0;
    private int line = 1;

    public Parser(List<Token> tokens) { this(tokens, Mode.STRICT); }

    public Parser(List<Token> tokens, Mode mode) {
        this.tokens = tokens;
        this.mode = (mode == null) ? Mode.STRICT : mode;
    }

    public ParseResult parseProgram() {
        List<Node> nodes = new ArrayList<>();
        while (!isAtEnd()) {
            if (match(TokenType.NEWLINE)) continue;

            int startLine = line;
            try {
                nodes.add(new Node(parseElement(), startLine));
            } catch (ParseError e) {
                Diagnostic d = Diagnostic.syntax(e.line, e.getMessage());
                diagnostics.add(d);
                Debug.get().d(TAG, d.toString());
                if (e.fatal) break;
                synchronize();
            }
        }
        return new ParseResult(nodes, diagnostics);
    }

    /** Parses exactly one element starting at the current token. */
    Element parseElement() {
        while (match(TokenType.NEWLINE)) {
            // line breaks between elements only move the line counter
        }
        if (isAtEnd()) throw fatal(line, "unexpected end of input");

        Token token = advance();
        switch (token.type) {
            case INTEGER:
                return Element.integer((Long) token.literal);
            case REAL:
                return Element.real((Double) token.literal);
            case BOOLEAN:
                return Element.bool((Boolean) token.literal);
            case NULL:
                return Element.nil();
            case IDENTIFIER:
            case KEYWORD:
                // keywords are only special in head position, which later stages decide
                return Element.atom(token.lexeme);
            case QUOTE:
                return Element.list(Element.atom("quote"), parseElement());
            case LEFT_PAREN:
                return list();
            case RIGHT_PAREN:
                throw error(line, "unexpected token ')'");
            case UNKNOWN:
                if (mode == Mode.LENIENT) return Element.atom(token.lexeme);
                throw error(line, "unexpected token '" + token.lexeme + "'");
            default:
                throw error(line, "unexpected token '" + token.lexeme + "'");
        }
    }

    private Element list() {
        int openLine = line;
        List<Element> elements = new ArrayList<>();
        while (true) {
            if (match(TokenType.NEWLINE)) continue;
            if (isAtEnd()) throw fatal(openLine, "missing closing parenthesis");
            if (match(TokenType.RIGHT_PAREN)) break;
            elements.add(parseElement());
        }
        return Element.list(elements);
    }

    /**
     * Skips to the next statement boundary: a line break or ')' (consumed) or a
     * '(' (left in place so the nested expression can still be parsed).
     */
    private void synchronize() {
        while (!isAtEnd()) {
            TokenType type = peek().type;
            if (type == TokenType.LEFT_PAREN) return;
            advance();
            if (type == TokenType.NEWLINE || type == TokenType.RIGHT_PAREN) return;
        }
    }

    private boolean isAtEnd() { return current >= tokens.size(); }

    private Token peek() { return tokens.get(current); }

    private Token advance() {
        Token t = tokens.get(current++);
        if (t.type == TokenType.NEWLINE) line++;
        return t;
    }

    private boolean match(TokenType type) {
        if (isAtEnd() || peek().type != type) return false;
        advance();
        return true;
    }

    private static ParseError error(int line, String message) {
        return new ParseError(line, message, false);
    }

    private static ParseError fatal(int line, String message) {
        return new ParseError(line, message, true);
    }

    private static final class ParseError extends RuntimeException {
        private static final long serialVersionUID = 1L;
        final int line;
        final boolean fatal;

        ParseError(int line, String message, boolean fatal) {
            super(message, null, false, false);
            this.line = line;
            this.fatal = fatal;
        }
    }
}
