package com.flisp.script.parser;

/**
 * Fatal error raised while evaluating a program. The interpreter stamps the
 * line of the top-level form that was being evaluated.
 */
public class ScriptRuntimeException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private int line = -1;

    public ScriptRuntimeException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind kind() { return kind; }

    /** 1-based line of the failing top-level form, or -1 if unknown. */
    public int line() { return line; }

    ScriptRuntimeException atLine(int line) {
        if (this.line < 0) this.line = line;
        return this;
    }

    @Override
    public String getMessage() {
        String msg = super.getMessage();
        return (line < 0) ? msg : "[line " + line + "] " + msg;
    }
}
