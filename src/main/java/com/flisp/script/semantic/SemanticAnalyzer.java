package com.flisp.script.semantic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.flisp.debug.Debug;
import com.flisp.script.parser.Builtins;
import com.flisp.script.parser.Diagnostic;
import com.flisp.script.parser.Element;
import com.flisp.script.parser.Node;

/**
 * Scope-aware checker with best-effort type inference. Reports every problem
 * it can find and never modifies the AST. Its findings are advisory: the
 * interpreter runs regardless unless the caller gates on them.
 */
public final class SemanticAnalyzer {
    private static final String TAG = "flisp.semantic";
    private static final int MAX_INFER_DEPTH = 10;

    private final List<Node> ast;
    private final List<Diagnostic> errors = new ArrayList<>();
    private final SymbolTable globalScope = new SymbolTable();

    public SemanticAnalyzer(List<Node> ast) {
        this.ast = ast;
    }

    public List<Diagnostic> analyze() {
        for (Node node : ast) {
            analyzeNode(node.element, globalScope, node.line, Context.TOP);
        }
        Debug.get().d(TAG, errors.size() + " semantic diagnostic(s) in " + ast.size() + " form(s)");
        return Collections.unmodifiableList(new ArrayList<>(errors));
    }

    /** Global scope after analysis; exposes what the analyzer inferred. */
    public SymbolTable globalScope() { return globalScope; }

    /** Where a form sits: inside a prog, a while body, a function body. */
    private static final class Context {
        static final Context TOP = new Context(false, false, false);

        final boolean inProg;
        final boolean inWhile;
        final boolean inFunc;

        Context(boolean inProg, boolean inWhile, boolean inFunc) {
            this.inProg = inProg;
            this.inWhile = inWhile;
            this.inFunc = inFunc;
        }

        Context prog() { return new Context(true, inWhile, inFunc); }
        Context loopBody() { return new Context(inProg, true, inFunc); }
        static Context functionBody() { return new Context(false, false, true); }
    }

    private void analyzeNode(Element element, SymbolTable scope, int line, Context ctx) {
        switch (element.getType()) {
            case ATOM: {
                String name = element.asAtom();
                if (!isBuiltinSymbol(name) && !scope.isVariableDefined(name) && scope.lookupFunction(name) == null) {
                    recordError("Undeclared identifier '" + name + "'", line);
                }
                return;
            }
            case LIST:
                break;
            default:
                return; // literals need no checks
        }

        List<Element> elements = element.asList();
        if (elements.isEmpty()) return;
        Element first = elements.get(0);

        if ("lambda".equals(first.headName())) {
            checkAnonymousLambdaCall(first.asList(), elements.subList(1, elements.size()), scope, line, ctx);
            return;
        }

        if (!first.isAtom()) {
            // computed head, e.g. ((maker 5) 1)
            for (Element e : elements) analyzeNode(e, scope, line, ctx);
            return;
        }

        switch (first.asAtom()) {
            case "quote":  checkQuote(elements, line); break;
            case "setq":   checkSetq(elements, scope, line, ctx); break;
            case "func":   checkFunc(elements, scope, line); break;
            case "lambda": checkLambda(elements, scope, line); break;
            case "prog":   checkProg(elements, scope, line, ctx); break;
            case "cond":   checkCond(elements, scope, line, ctx); break;
            case "while":  checkWhile(elements, scope, line, ctx); break;
            case "return": checkReturn(elements, scope, line, ctx); break;
            case "break":
                if (!ctx.inWhile) recordError("break used outside of while", line);
                if (elements.size() > 1) recordError("break expects no arguments, got " + (elements.size() - 1), line);
                break;
            default:
                checkFunctionCall(elements, scope, line, ctx);
        }
    }

    // -------------------------
    // Special forms
    // -------------------------

    private void checkQuote(List<Element> elements, int line) {
        if (elements.size() != 2) {
            recordError("quote requires exactly 1 argument, got " + (elements.size() - 1), line);
        }
        // quoted data is not analyzed, just as it is not evaluated
    }

    private void checkSetq(List<Element> elements, SymbolTable scope, int line, Context ctx) {
        if (elements.size() != 3) {
            recordError("setq requires exactly 2 arguments, got " + (elements.size() - 1), line);
            return;
        }
        if (!elements.get(1).isAtom()) {
            recordError("first argument of setq must be an atom", line);
            return;
        }
        Element value = elements.get(2);
        analyzeNode(value, scope, line, ctx);
        scope.defineVariable(elements.get(1).asAtom(), inferType(value, scope, 0));
    }

    private void checkFunc(List<Element> elements, SymbolTable scope, int line) {
        if (elements.size() != 4) {
            recordError("func requires exactly 3 arguments, got " + (elements.size() - 1), line);
            return;
        }
        if (!elements.get(1).isAtom()) {
            recordError("first argument of func must be an atom", line);
            return;
        }
        if (!elements.get(2).isList()) {
            recordError("second argument of func must be a list of parameters", line);
            return;
        }
        List<String> params = paramNames(elements.get(2), "func", line);

        // registered before the body is analyzed so the body may recurse
        scope.defineFunction(elements.get(1).asAtom(), params, elements.get(3));

        SymbolTable fnScope = scope.child();
        for (String p : params) fnScope.defineVariable(p, TypeKind.ANY);
        analyzeNode(elements.get(3), fnScope, line, Context.functionBody());
    }

    private void checkLambda(List<Element> elements, SymbolTable scope, int line) {
        if (elements.size() != 3) {
            recordError("lambda requires exactly 2 arguments, got " + (elements.size() - 1), line);
            return;
        }
        if (!elements.get(1).isList()) {
            recordError("first argument of lambda must be a list of parameters", line);
            return;
        }
        SymbolTable local = scope.child();
        for (String p : paramNames(elements.get(1), "lambda", line)) local.defineVariable(p, TypeKind.ANY);
        analyzeNode(elements.get(2), local, line, Context.functionBody());
    }

    private void checkProg(List<Element> elements, SymbolTable scope, int line, Context ctx) {
        if (elements.size() < 2) {
            recordError("prog requires a list of local variables", line);
            return;
        }
        if (!elements.get(1).isList()) {
            recordError("first argument of prog must be a list of local variables", line);
            return;
        }
        SymbolTable localScope = scope.child();
        for (Element v : elements.get(1).asList()) {
            if (v.isAtom()) {
                localScope.defineVariable(v.asAtom(), TypeKind.ANY);
            } else {
                recordError("prog local variable must be an atom", line);
            }
        }
        Context body = ctx.prog();
        for (Element expr : elements.subList(2, elements.size())) {
            analyzeNode(expr, localScope, line, body);
        }
    }

    private void checkCond(List<Element> elements, SymbolTable scope, int line, Context ctx) {
        if (elements.size() < 3 || elements.size() > 4) {
            recordError("cond requires 2 or 3 arguments, got " + (elements.size() - 1), line);
            return;
        }
        analyzeNode(elements.get(1), scope, line, ctx);
        TypeKind condType = inferType(elements.get(1), scope, 0);
        if (condType != TypeKind.BOOL && condType != TypeKind.ANY) {
            recordError("cond expects a boolean condition, got " + condType, line);
        }
        analyzeNode(elements.get(2), scope, line, ctx);
        if (elements.size() == 4) analyzeNode(elements.get(3), scope, line, ctx);
    }

    private void checkWhile(List<Element> elements, SymbolTable scope, int line, Context ctx) {
        if (elements.size() < 2) {
            recordError("while requires a condition", line);
            return;
        }
        analyzeNode(elements.get(1), scope, line, ctx);
        TypeKind condType = inferType(elements.get(1), scope, 0);
        if (condType != TypeKind.BOOL && condType != TypeKind.ANY) {
            recordError("while expects a boolean condition, got " + condType, line);
        }
        Context body = ctx.loopBody();
        for (Element expr : elements.subList(2, elements.size())) {
            analyzeNode(expr, scope, line, body);
        }
    }

    private void checkReturn(List<Element> elements, SymbolTable scope, int line, Context ctx) {
        if (!ctx.inProg && !ctx.inFunc) {
            recordError("return used outside of prog or function", line);
            return;
        }
        if (elements.size() > 2) {
            recordError("return expects 0 or 1 arguments, got " + (elements.size() - 1), line);
        }
        if (elements.size() == 2) analyzeNode(elements.get(1), scope, line, ctx);
    }

    // -------------------------
    // Calls
    // -------------------------

    private void checkFunctionCall(List<Element> elements, SymbolTable scope, int line, Context ctx) {
        String name = elements.get(0).asAtom();
        List<Element> args = elements.subList(1, elements.size());

        SymbolTable.FunctionSig user = scope.lookupFunction(name);
        boolean boundVariable = scope.isVariableDefined(name);
        if (!isBuiltinSymbol(name) && user == null && !boundVariable) {
            recordError("Call to undefined function '" + name + "'", line);
        }

        for (Element arg : args) analyzeNode(arg, scope, line, ctx);

        // a user function with a builtin's name wins, as in the interpreter
        if (user != null) {
            if (user.params.size() != args.size()) {
                recordError(name + " expects " + user.params.size() + " argument(s), got " + args.size(), line);
            }
            return;
        }
        // a variable of unknown kind may hold a function under a builtin's name
        if (boundVariable && scope.lookupVariableType(name) == TypeKind.ANY) return;

        if (Builtins.isBuiltin(name)) checkBuiltinCall(name, args, scope, line, ctx);
    }

    private void checkBuiltinCall(String name, List<Element> args, SymbolTable scope, int line, Context ctx) {
        BuiltinSpec spec = BuiltinSpec.SPECS.get(name);
        if (spec == null) return;

        if (args.size() != spec.arity) {
            recordError(name + " expects " + spec.arity + " argument(s), got " + args.size(), line);
        }

        switch (name) {
            case "less": case "lesseq": case "greater": case "greatereq":
            case "equal": case "nonequal":
                for (int i = 0; i < args.size(); i++) {
                    TypeKind t = inferType(args.get(i), scope, 0);
                    if (t != TypeKind.NUMBER && t != TypeKind.BOOL && t != TypeKind.ANY) {
                        recordError(name + " expects number or bool for argument " + (i + 1) + ", got " + t, line);
                    }
                }
                return;
            case "eval":
                // (eval '(...)) : the quoted expression runs right here, in the caller's context
                if (args.size() == 1 && "quote".equals(args.get(0).headName())) {
                    List<Element> quote = args.get(0).asList();
                    if (quote.size() == 2 && quote.get(1).isList()) {
                        analyzeNode(quote.get(1), scope, line, ctx);
                    }
                }
                return;
            default:
                break;
        }

        if (spec.expectedArgTypes == null) return;
        for (int i = 0; i < spec.expectedArgTypes.size() && i < args.size(); i++) {
            TypeKind expected = spec.expectedArgTypes.get(i);
            TypeKind actual = inferType(args.get(i), scope, 0);
            if (expected != TypeKind.ANY && actual != expected && actual != TypeKind.ANY) {
                recordError(name + " expects " + expected + " for argument " + (i + 1) + ", got " + actual, line);
            }
        }
    }

    /** ((lambda (params) body) args...) */
    private void checkAnonymousLambdaCall(List<Element> lambda, List<Element> callArgs, SymbolTable scope,
                                          int line, Context ctx) {
        if (lambda.size() != 3) {
            recordError("lambda must have exactly 2 arguments (parameters and body)", line);
            return;
        }
        if (!lambda.get(1).isList()) {
            recordError("lambda parameters must be a list", line);
            return;
        }
        List<String> params = paramNames(lambda.get(1), "lambda", line);
        if (params.size() != callArgs.size()) {
            recordError("anonymous lambda expects " + params.size() + " argument(s), got " + callArgs.size(), line);
        }

        for (Element arg : callArgs) analyzeNode(arg, scope, line, ctx);

        SymbolTable lambdaScope = scope.child();
        for (String p : params) lambdaScope.defineVariable(p, TypeKind.ANY);
        analyzeNode(lambda.get(2), lambdaScope, line, Context.functionBody());
    }

    // -------------------------
    // Type inference
    // -------------------------

    TypeKind inferType(Element element, SymbolTable scope, int depth) {
        if (depth > MAX_INFER_DEPTH) return TypeKind.ANY;

        switch (element.getType()) {
            case INTEGER:
            case REAL:
                return TypeKind.NUMBER;
            case BOOL:
                return TypeKind.BOOL;
            case NULL:
                return TypeKind.NULL;
            case ATOM: {
                TypeKind t = scope.lookupVariableType(element.asAtom());
                return (t == null) ? TypeKind.ANY : t;
            }
            default:
                break;
        }

        List<Element> elems = element.asList();
        if (elems.isEmpty()) return TypeKind.LIST;

        String head = element.headName();
        if (head == null) return TypeKind.ANY;

        switch (head) {
            case "quote":
                if (elems.size() != 2) return TypeKind.ANY;
                Element quoted = elems.get(1);
                if (quoted.isList()) return TypeKind.LIST;
                // quoted atoms have no static kind of their own
                return quoted.isAtom() ? TypeKind.ANY : inferType(quoted, scope, depth + 1);
            case "setq":
                return (elems.size() == 3) ? inferType(elems.get(2), scope, depth + 1) : TypeKind.ANY;
            case "cond": {
                if (elems.size() != 4) return TypeKind.ANY;
                TypeKind a = inferType(elems.get(2), scope, depth + 1);
                TypeKind b = inferType(elems.get(3), scope, depth + 1);
                return (a == b) ? a : TypeKind.ANY;
            }
            default:
                break;
        }

        if (Builtins.isSpecialForm(head)) return TypeKind.ANY;
        // user definitions shadow builtins; their result is unknown
        if (scope.lookupFunction(head) != null || scope.isVariableDefined(head)) return TypeKind.ANY;

        BuiltinSpec spec = BuiltinSpec.SPECS.get(head);
        return (spec == null) ? TypeKind.ANY : spec.returnType;
    }

    // -------------------------
    // Helpers
    // -------------------------

    private List<String> paramNames(Element list, String form, int line) {
        List<String> out = new ArrayList<>();
        for (Element p : list.asList()) {
            if (p.isAtom()) {
                out.add(p.asAtom());
            } else {
                recordError(form + " parameter must be an atom, got " + p, line);
            }
        }
        return out;
    }

    private void recordError(String message, int line) {
        errors.add(Diagnostic.semantic(line, message));
    }

    private static boolean isBuiltinSymbol(String name) {
        return Builtins.isSpecialForm(name) || Builtins.isBuiltin(name);
    }
}
