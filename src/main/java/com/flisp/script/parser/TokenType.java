package com.flisp.script.parser;

public enum TokenType {
    // Literals
    INTEGER, REAL, BOOLEAN, NULL,

    // Names
    IDENTIFIER, KEYWORD,

    // Punctuation
    QUOTE, LEFT_PAREN, RIGHT_PAREN,

    NEWLINE,

    // Lexeme the scanner could not classify; the parser decides what to do with it.
    UNKNOWN
}
