package com.flisp.script.parser;

/** Category of a fatal runtime error. */
public enum ErrorKind {
    UNDEFINED_ATOM,
    UNDEFINED_FUNCTION,
    NOT_CALLABLE,
    TYPE_MISMATCH,
    ARITY,
    MALFORMED_FORM,
    BREAK_OUTSIDE_LOOP,
    RETURN_OUTSIDE_FUNCTION,
    DIVISION_BY_ZERO
}
