package com.flisp.script;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.flisp.debug.Debug;
import com.flisp.protocol.AstJson;
import com.flisp.script.parser.Diagnostic;
import com.flisp.script.parser.Node;
import com.flisp.script.parser.ParseResult;
import com.flisp.script.parser.Parser;
import com.flisp.script.parser.ScriptRuntimeException;
import com.flisp.script.parser.Token;
import com.flisp.script.parser.Value;

public final class FLispCli {

    private static final String USAGE =
            "Usage: FLispCli [--tokens|--ast|--check|--optimize] [--lenient] [--json] [--verbose] [file]";

    private enum Command { RUN, TOKENS, AST, CHECK, OPTIMIZE }

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    /** Runs the CLI and returns the process exit code. */
    public static int execute(String[] args) {
        Command command = Command.RUN;
        boolean lenient = false;
        boolean json = false;
        String file = null;

        for (String arg : args) {
            switch (arg) {
                case "--tokens":   command = Command.TOKENS; break;
                case "--ast":      command = Command.AST; break;
                case "--check":    command = Command.CHECK; break;
                case "--optimize": command = Command.OPTIMIZE; break;
                case "--lenient":  lenient = true; break;
                case "--json":     json = true; break;
                case "--verbose":  Debug.useSysOut(); break;
                default:
                    if (arg.startsWith("--") || file != null) {
                        System.err.println(USAGE);
                        return 2;
                    }
                    file = arg;
            }
        }

        final String source;
        try {
            source = (file == null) ? readAll(System.in) : Files.readString(Path.of(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.err.println("Failed to read script: " + (file == null ? "<stdin>" : file));
            e.printStackTrace(System.err);
            return 3;
        }

        FLispScript engine = new FLispScript();
        engine.setMode(lenient ? Parser.Mode.LENIENT : Parser.Mode.STRICT);
        AstJson out = new AstJson();

        switch (command) {
            case TOKENS: {
                List<Token> tokens = engine.tokenize(source);
                if (json) {
                    System.out.println(out.write(out.tokens(tokens)));
                } else {
                    for (Token t : tokens) System.out.println(t);
                }
                return 0;
            }
            case AST: {
                ParseResult parsed = engine.parse(source);
                if (json) {
                    System.out.println(out.write(out.nodes(parsed.nodes())));
                } else {
                    printNodes(parsed.nodes());
                }
                printDiagnostics(parsed.diagnostics());
                return 0;
            }
            case OPTIMIZE: {
                List<Node> optimized = engine.optimize(source);
                if (json) {
                    System.out.println(out.write(out.nodes(optimized)));
                } else {
                    printNodes(optimized);
                }
                return 0;
            }
            case CHECK: {
                List<Diagnostic> diagnostics = engine.analyze(source);
                if (json) {
                    System.out.println(out.write(out.diagnostics(diagnostics)));
                } else if (diagnostics.isEmpty()) {
                    System.out.println("No errors.");
                } else {
                    for (Diagnostic d : diagnostics) System.out.println(d);
                }
                return diagnostics.isEmpty() ? 0 : 1;
            }
            default:
                return run(engine, out, source, json);
        }
    }

    private static int run(FLispScript engine, AstJson out, String source, boolean json) {
        final RunResult result;
        try {
            result = engine.run(source);
        } catch (ScriptRuntimeException e) {
            System.err.println("Runtime error: " + e.getMessage());
            return 1;
        }

        if (json) {
            System.out.println(out.write(out.runResult(result)));
        } else {
            printDiagnostics(result.syntaxDiagnostics());
            printDiagnostics(result.semanticDiagnostics());
            for (Value v : result.printable()) System.out.println(v);
        }
        return 0;
    }

    private static void printNodes(List<Node> nodes) {
        for (Node n : nodes) System.out.println(n);
    }

    private static void printDiagnostics(List<Diagnostic> diagnostics) {
        for (Diagnostic d : diagnostics) System.err.println(d);
    }

    private static String readAll(InputStream in) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        in.transferTo(buf);
        return buf.toString(StandardCharsets.UTF_8);
    }

    private FLispCli() {}
}
