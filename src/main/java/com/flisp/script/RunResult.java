package com.flisp.script;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.flisp.script.parser.Diagnostic;
import com.flisp.script.parser.ScriptRuntimeException;
import com.flisp.script.parser.Value;

/** Everything one {@link FLispScript#run(String)} produced. */
public class RunResult {
    private final List<Diagnostic> syntaxDiagnostics;
    private final List<Diagnostic> semanticDiagnostics;
    private final List<Value> results;
    private final List<Value> printable;
    private final Map<String, Value> env;
    private final ScriptRuntimeException error;
    private final boolean blocked;

    RunResult(List<Diagnostic> syntaxDiagnostics,
              List<Diagnostic> semanticDiagnostics,
              List<Value> results,
              List<Value> printable,
              Map<String, Value> env,
              ScriptRuntimeException error,
              boolean blocked) {
        this.syntaxDiagnostics = Collections.unmodifiableList(syntaxDiagnostics);
        this.semanticDiagnostics = Collections.unmodifiableList(semanticDiagnostics);
        this.results = Collections.unmodifiableList(results);
        this.printable = Collections.unmodifiableList(printable);
        this.env = env;
        this.error = error;
        this.blocked = blocked;
    }

    public List<Diagnostic> syntaxDiagnostics() { return syntaxDiagnostics; }
    public List<Diagnostic> semanticDiagnostics() { return semanticDiagnostics; }

    /** One value per evaluated top-level form. */
    public List<Value> results() { return results; }

    /** Values of top-level forms other than setq, func and while. */
    public List<Value> printable() { return printable; }

    /** Global bindings after the run. */
    public Map<String, Value> env() { return env; }

    /** The runtime error routed to the error listener, or null. */
    public ScriptRuntimeException error() { return error; }

    /** True when diagnostics gating stopped the program from running. */
    public boolean isBlocked() { return blocked; }

    public boolean hasDiagnostics() {
        return !syntaxDiagnostics.isEmpty() || !semanticDiagnostics.isEmpty();
    }

    /** Value of the last evaluated form, or null (the FLisp value) if none ran. */
    public Value lastValue() {
        return results.isEmpty() ? Value.nil() : results.get(results.size() - 1);
    }
}
