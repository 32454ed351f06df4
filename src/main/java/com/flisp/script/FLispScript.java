package com.flisp.script;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.flisp.debug.Debug;
import com.flisp.script.optimizer.AstOptimizer;
import com.flisp.script.parser.Diagnostic;
import com.flisp.script.parser.Environment;
import com.flisp.script.parser.Interpreter;
import com.flisp.script.parser.Lexer;
import com.flisp.script.parser.Node;
import com.flisp.script.parser.ParseResult;
import com.flisp.script.parser.Parser;
import com.flisp.script.parser.ScriptRuntimeException;
import com.flisp.script.parser.Token;
import com.flisp.script.parser.Value;
import com.flisp.script.semantic.SemanticAnalyzer;

/**
 * Core FLisp engine: runs text through tokenize, parse, optional optimize,
 * analyze and interpret.
 *
 * - Mode:
 *     - STRICT (default): unknown lexemes are syntax errors
 *     - LENIENT: unknown lexemes are read as atoms
 * - Optimize: constant folding and dead-store elimination before evaluation
 * - Gate on diagnostics: refuse to run a program with syntax or semantic errors
 */
public class FLispScript {
    private static final String TAG = "flisp.engine";

    /** Host hook that receives runtime errors instead of having them thrown. */
    public interface ErrorListener {
        void onError(ScriptRuntimeException error);
    }

    private Parser.Mode mode = Parser.Mode.STRICT;
    private boolean optimize = false;
    private boolean gateOnDiagnostics = false;
    private ErrorListener errorListener = null;

    public void setMode(Parser.Mode mode) { this.mode = (mode == null) ? Parser.Mode.STRICT : mode; }

    public Parser.Mode getMode() { return mode; }

    public void setOptimize(boolean optimize) { this.optimize = optimize; }

    public boolean isOptimize() { return optimize; }

    public void setGateOnDiagnostics(boolean gate) { this.gateOnDiagnostics = gate; }

    public boolean isGateOnDiagnostics() { return gateOnDiagnostics; }

    /*
     * ERROR HANDLING CONTRACT:
     *
     * - If NO listener is registered, runtime errors THROW to the host.
     * - If a listener IS registered, runtime errors are routed to it, suppressed,
     *   and returned in RunResult.error().
     *
     * Syntax and semantic problems are never thrown; they are diagnostics.
     */
    public void setErrorListener(ErrorListener listener) { this.errorListener = listener; }

    // ===================== STAGES =====================

    public List<Token> tokenize(String source) {
        return new Lexer(requireSource(source)).tokenize();
    }

    public ParseResult parse(String source) {
        return new Parser(tokenize(source), mode).parseProgram();
    }

    /** Syntax diagnostics followed by semantic diagnostics. */
    public List<Diagnostic> analyze(String source) {
        ParseResult parsed = parse(source);
        List<Diagnostic> out = new ArrayList<>(parsed.diagnostics());
        out.addAll(new SemanticAnalyzer(parsed.nodes()).analyze());
        return out;
    }

    public List<Node> optimize(String source) {
        return AstOptimizer.optimize(parse(source).nodes());
    }

    // ===================== RUN =====================

    public RunResult run(String source) {
        return run(source, Collections.emptyMap());
    }

    /** Runs with an initial set of global bindings. */
    public RunResult run(String source, Map<String, Value> initialEnv) {
        ParseResult parsed = parse(source);
        List<Node> program = parsed.nodes();
        List<Diagnostic> semantic = new SemanticAnalyzer(program).analyze();
        Debug.get().d(TAG, "parsed " + program.size() + " form(s), "
                + parsed.diagnostics().size() + " syntax / " + semantic.size() + " semantic diagnostic(s)");

        Environment env = new Environment(initialEnv);
        if (gateOnDiagnostics && (parsed.hasErrors() || !semantic.isEmpty())) {
            Debug.get().i(TAG, "run blocked by diagnostics");
            return new RunResult(parsed.diagnostics(), semantic, Collections.emptyList(),
                    Collections.emptyList(), env.snapshot(), null, true);
        }

        List<Node> executable = optimize ? AstOptimizer.optimize(program) : program;
        Interpreter interpreter = new Interpreter(env);
        try {
            List<Value> results = interpreter.interpret(executable);
            return new RunResult(parsed.diagnostics(), semantic, results,
                    printable(program, results), env.snapshot(), null, false);
        } catch (ScriptRuntimeException e) {
            if (errorListener == null) throw e;

            Debug.get().d(TAG, "runtime error routed to listener: " + e.getMessage());
            errorListener.onError(e);
            return new RunResult(parsed.diagnostics(), semantic, Collections.emptyList(),
                    Collections.emptyList(), env.snapshot(), e, false);
        }
    }

    /** Value of the last top-level form. */
    public Value evaluate(String source) {
        return run(source).lastValue();
    }

    /** Top-level setq, func and while forms are evaluated for effect and not echoed. */
    private static List<Value> printable(List<Node> program, List<Value> results) {
        List<Value> out = new ArrayList<>();
        for (int i = 0; i < results.size(); i++) {
            String head = program.get(i).element.headName();
            if ("setq".equals(head) || "func".equals(head) || "while".equals(head)) continue;
            out.add(results.get(i));
        }
        return out;
    }

    private static String requireSource(String source) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        return source;
    }
}
