package com.flisp.script.parser;

import java.util.Collections;
import java.util.List;

public class ParseResult {
    private final List<Node> nodes;
    private final List<Diagnostic> diagnostics;

    public ParseResult(List<Node> nodes, List<Diagnostic> diagnostics) {
        this.nodes = Collections.unmodifiableList(nodes);
        this.diagnostics = Collections.unmodifiableList(diagnostics);
    }

    public List<Node> nodes() { return nodes; }
    public List<Diagnostic> diagnostics() { return diagnostics; }
    public boolean hasErrors() { return !diagnostics.isEmpty(); }
}
