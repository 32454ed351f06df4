package com.flisp.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

public class Lexer {
    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    public static final Set<String> KEYWORDS;
    static {
        Set<String> set = new LinkedHashSet<>();
        Collections.addAll(set,
                "quote", "setq", "func", "lambda", "prog", "cond",
                "while", "return", "break",
                "plus", "minus", "times", "divide",
                "head", "tail", "cons",
                "equal", "nonequal", "less", "lesseq", "greater", "greatereq",
                "isint", "isreal", "isbool", "isnull", "isatom", "islist",
                "and", "or", "xor", "not", "eval");
        KEYWORDS = Collections.unmodifiableSet(set);
    }

    private static final Pattern INTEGER = Pattern.compile("[+-]?[0-9]+");
    private static final Pattern REAL =
            Pattern.compile("[+-]?([0-9]+(\\.[0-9]*)?|\\.[0-9]+)([eE][+-]?[0-9]+)?");

    public Lexer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '\'': addToken(TokenType.QUOTE); break;
            case '\n': addToken(TokenType.NEWLINE); break;
            default:
                if (Character.isWhitespace(c)) break;
                atom();
        }
    }

    private void atom() {
        while (!isAtEnd() && !isDelimiter(peek())) advance();
        String text = source.substring(start, current);

        if ("true".equals(text) || "false".equals(text)) {
            addToken(TokenType.BOOLEAN, Boolean.valueOf(text));
        } else if ("null".equals(text)) {
            addToken(TokenType.NULL);
        } else if (KEYWORDS.contains(text)) {
            addToken(TokenType.KEYWORD);
        } else if (INTEGER.matcher(text).matches() && fitsLong(text)) {
            addToken(TokenType.INTEGER, Long.parseLong(text));
        } else if (REAL.matcher(text).matches()) {
            addToken(TokenType.REAL, Double.parseDouble(text));
        } else if (allLetters(text)) {
            addToken(TokenType.IDENTIFIER);
        } else {
            addToken(TokenType.UNKNOWN);
        }
    }

    private static boolean fitsLong(String text) {
        try {
            Long.parseLong(text);
            return true;
        } catch (NumberFormatException e) {
            // out of range: classified as a real instead
            return false;
        }
    }

    private static boolean allLetters(String text) {
        return text.codePoints().allMatch(Character::isLetter);
    }

    private boolean isDelimiter(char c) {
        return Character.isWhitespace(c) || c == '(' || c == ')' || c == '\'';
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }
    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal));
    }
}
