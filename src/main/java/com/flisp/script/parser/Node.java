package com.flisp.script.parser;

import java.util.Objects;

/** A top-level form paired with the 1-based line it started on. */
public final class Node {
    public final Element element;
    public final int line;

    public Node(Element element, int line) {
        this.element = Objects.requireNonNull(element);
        this.line = line;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Node)) return false;
        Node other = (Node) o;
        return line == other.line && element.equals(other.element);
    }

    @Override
    public int hashCode() {
        return Objects.hash(element, line);
    }

    @Override
    public String toString() {
        return line + ": " + element;
    }
}
