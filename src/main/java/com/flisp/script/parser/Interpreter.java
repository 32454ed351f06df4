package com.flisp.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.flisp.debug.Debug;

/**
 * Tree-walking evaluator. Evaluation is strict and left to right; every
 * top-level form runs in one global environment that persists across calls.
 */
public class Interpreter {
    private static final String TAG = "flisp.interpreter";

    private final Environment global;

    public Interpreter() {
        this(new Environment());
    }

    public Interpreter(Environment global) {
        this.global = global;
    }

    public Environment globals() { return global; }

    /**
     * Evaluates every node in order and returns one value per node.
     *
     * @throws ScriptRuntimeException on the first runtime error; the error carries the
     *         line of the top-level form that failed
     */
    public List<Value> interpret(List<Node> nodes) {
        List<Value> results = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            Debug.get().t(TAG, "eval line " + node.line + ": " + node.element);
            try {
                results.add(eval(node.element, global));
            } catch (ReturnSignal rs) {
                throw fail(new ScriptRuntimeException(ErrorKind.RETURN_OUTSIDE_FUNCTION,
                        "return used outside of prog or function"), node);
            } catch (BreakSignal bs) {
                throw fail(new ScriptRuntimeException(ErrorKind.BREAK_OUTSIDE_LOOP,
                        "break used outside of while"), node);
            } catch (ScriptRuntimeException e) {
                throw fail(e, node);
            }
        }
        return results;
    }

    private ScriptRuntimeException fail(ScriptRuntimeException e, Node node) {
        e.atLine(node.line);
        Debug.get().w(TAG, e.kind() + " " + e.getMessage());
        return e;
    }

    Value eval(Element element, Environment env) {
        switch (element.getType()) {
            case ATOM:
                return env.get(element.asAtom());
            case LIST:
                return evalList(element.asList(), env);
            default:
                return Value.fromElement(element);
        }
    }

    private Value evalList(List<Element> elems, Environment env) {
        if (elems.isEmpty()) return Value.nil();

        Element head = elems.get(0);
        if (!head.isAtom()) return callComputed(head, elems, env);

        String name = head.asAtom();
        switch (name) {
            case "quote":  return quote(elems);
            case "setq":   return setq(elems, env);
            case "func":   return defineFunc(elems, env);
            case "lambda": return defineLambda(elems, env);
            case "prog":   return prog(elems, env);
            case "cond":   return cond(elems, env);
            case "while":  return whileLoop(elems, env);
            case "return": {
                requireArgs(elems, 0, 1);
                Value v = (elems.size() == 2) ? eval(elems.get(1), env) : Value.nil();
                throw new ReturnSignal(v);
            }
            case "break":
                requireArgs(elems, 0, 0);
                throw new BreakSignal();
            default:
                return callNamed(name, elems, env);
        }
    }

    // -------------------------
    // Special forms
    // -------------------------

    private Value quote(List<Element> elems) {
        requireArgs(elems, 1, 1);
        return Value.fromElement(elems.get(1));
    }

    private Value setq(List<Element> elems, Environment env) {
        requireArgs(elems, 2, 2);
        String name = requireAtom(elems.get(1), "setq target");
        Value value = eval(elems.get(2), env);
        env.define(name, value);
        return value;
    }

    private Value defineFunc(List<Element> elems, Environment env) {
        requireArgs(elems, 3, 3);
        String name = requireAtom(elems.get(1), "func name");
        List<String> params = paramNames(elems.get(2), "func");
        Value fn = Value.func(new Closure(name, params, elems.get(3), env));
        env.define(name, fn);
        return fn;
    }

    private Value defineLambda(List<Element> elems, Environment env) {
        requireArgs(elems, 2, 2);
        List<String> params = paramNames(elems.get(1), "lambda");
        return Value.func(new Closure(null, params, elems.get(2), env));
    }

    private Value prog(List<Element> elems, Environment env) {
        requireArgs(elems, 1, Integer.MAX_VALUE);
        List<String> locals = paramNames(elems.get(1), "prog");

        Environment local = env.childScope();
        for (String name : locals) local.define(name, Value.nil());

        Value result = Value.nil();
        try {
            for (int i = 2; i < elems.size(); i++) {
                result = eval(elems.get(i), local);
            }
        } catch (ReturnSignal rs) {
            return rs.value;
        }
        // BreakSignal is not ours: it travels on to the nearest while
        return result;
    }

    private Value cond(List<Element> elems, Environment env) {
        requireArgs(elems, 2, 3);
        if (requireCondition(eval(elems.get(1), env), "cond")) {
            return eval(elems.get(2), env);
        }
        return (elems.size() == 4) ? eval(elems.get(3), env) : Value.nil();
    }

    private Value whileLoop(List<Element> elems, Environment env) {
        requireArgs(elems, 1, Integer.MAX_VALUE);
        Value result = Value.nil();
        while (requireCondition(eval(elems.get(1), env), "while")) {
            try {
                for (int i = 2; i < elems.size(); i++) {
                    result = eval(elems.get(i), env);
                }
            } catch (BreakSignal bs) {
                return Value.nil();
            }
        }
        return result;
    }

    // -------------------------
    // Calls
    // -------------------------

    private Value callNamed(String name, List<Element> elems, Environment env) {
        List<Value> args = evalArgs(elems, env);

        // a function bound under the name shadows a builtin of the same name
        Value bound = env.lookup(name);
        if (bound != null && bound.getType() == Value.Type.FUNC) {
            return bound.asFunc().call(this, args);
        }

        Builtins.BuiltinFunction builtin = Builtins.get(name);
        if (builtin != null) return builtin.call(this, env, args);

        if (bound != null) {
            throw new ScriptRuntimeException(ErrorKind.NOT_CALLABLE,
                    "'" + name + "' is bound to a " + bound.typeName() + ", not a function");
        }
        throw new ScriptRuntimeException(ErrorKind.UNDEFINED_FUNCTION, "Undefined function: " + name);
    }

    private Value callComputed(Element head, List<Element> elems, Environment env) {
        Value op = eval(head, env);
        List<Value> args = evalArgs(elems, env);
        if (op.getType() != Value.Type.FUNC) {
            throw new ScriptRuntimeException(ErrorKind.NOT_CALLABLE,
                    "Cannot call a " + op.typeName() + ": " + head);
        }
        return op.asFunc().call(this, args);
    }

    private List<Value> evalArgs(List<Element> elems, Environment env) {
        List<Value> args = new ArrayList<>(elems.size() - 1);
        for (int i = 1; i < elems.size(); i++) {
            args.add(eval(elems.get(i), env));
        }
        return args;
    }

    // -------------------------
    // Helpers
    // -------------------------

    private static void requireArgs(List<Element> elems, int min, int max) {
        int n = elems.size() - 1;
        if (n < min || n > max) {
            String expected = (min == max) ? Integer.toString(min)
                    : (max == Integer.MAX_VALUE) ? "at least " + min : min + " to " + max;
            throw new ScriptRuntimeException(ErrorKind.MALFORMED_FORM,
                    elems.get(0) + " expects " + expected + " argument(s), got " + n);
        }
    }

    private static String requireAtom(Element e, String what) {
        if (!e.isAtom()) {
            throw new ScriptRuntimeException(ErrorKind.MALFORMED_FORM, what + " must be an atom, got " + e);
        }
        return e.asAtom();
    }

    private static List<String> paramNames(Element e, String form) {
        if (!e.isList()) {
            throw new ScriptRuntimeException(ErrorKind.MALFORMED_FORM, form + " expects a list of atoms, got " + e);
        }
        List<String> names = new ArrayList<>(e.asList().size());
        for (Element p : e.asList()) names.add(requireAtom(p, form + " parameter"));
        return names;
    }

    private static boolean requireCondition(Value v, String form) {
        if (v.getType() != Value.Type.BOOL) {
            throw new ScriptRuntimeException(ErrorKind.TYPE_MISMATCH,
                    form + " condition must be a bool, got " + v.typeName());
        }
        return v.asBool();
    }

    static final class ReturnSignal extends RuntimeException {
        private static final long serialVersionUID = 1L;
        final transient Value value;
        ReturnSignal(Value value) { super(null, null, false, false); this.value = value; }
    }

    static final class BreakSignal extends RuntimeException {
        private static final long serialVersionUID = 1L;
        BreakSignal() { super(null, null, false, false); }
    }
}
