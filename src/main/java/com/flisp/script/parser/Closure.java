package com.flisp.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A function value: parameter names, the unevaluated body and the environment
 * active where it was defined. Immutable once created.
 */
public final class Closure {
    final String name;
    final List<String> params;
    final Element body;
    final Environment closure;

    Closure(String name, List<String> params, Element body, Environment closure) {
        this.name = name;
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        this.body = body;
        this.closure = closure;
    }

    public String name() { return name == null ? "lambda" : name; }
    public List<String> params() { return params; }

    Value call(Interpreter interpreter, List<Value> args) {
        if (args.size() != params.size()) {
            throw new ScriptRuntimeException(ErrorKind.ARITY,
                    name() + " expects " + params.size() + " arguments, got " + args.size());
        }

        // New call frame is a child of the closure (lexical scoping), not of the caller.
        Environment frame = closure.childScope();
        for (int i = 0; i < params.size(); i++) {
            frame.define(params.get(i), args.get(i));
        }

        try {
            return interpreter.eval(body, frame);
        } catch (Interpreter.ReturnSignal rs) {
            return rs.value;
        } catch (Interpreter.BreakSignal bs) {
            throw new ScriptRuntimeException(ErrorKind.BREAK_OUTSIDE_LOOP,
                    "break escaped the body of " + name() + " without an enclosing while");
        }
    }
}
