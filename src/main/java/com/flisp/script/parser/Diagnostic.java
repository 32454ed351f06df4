package com.flisp.script.parser;

import java.util.Objects;

/** A non-fatal problem found by the parser or the semantic analyzer. */
public final class Diagnostic {
    public enum Phase {
        SYNTAX("Syntax"),
        SEMANTIC("Semantic");

        private final String label;

        Phase(String label) { this.label = label; }

        public String label() { return label; }
    }

    public final Phase phase;
    public final int line;
    public final String message;

    public Diagnostic(Phase phase, int line, String message) {
        this.phase = Objects.requireNonNull(phase);
        this.line = line;
        this.message = message;
    }

    public static Diagnostic syntax(int line, String message) {
        return new Diagnostic(Phase.SYNTAX, line, message);
    }

    public static Diagnostic semantic(int line, String message) {
        return new Diagnostic(Phase.SEMANTIC, line, message);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Diagnostic)) return false;
        Diagnostic other = (Diagnostic) o;
        return phase == other.phase && line == other.line && Objects.equals(message, other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(phase, line, message);
    }

    @Override
    public String toString() {
        return "Line " + line + ": " + phase.label() + " error: " + message;
    }
}
