package com.flisp.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Registry of the builtin functions. Special forms are not builtins: they are
 * dispatched by the interpreter before argument evaluation.
 */
public final class Builtins {

    /** A builtin receives already-evaluated arguments, left to right. */
    public interface BuiltinFunction {
        Value call(Interpreter interpreter, Environment env, List<Value> args);
    }

    public static final Set<String> SPECIAL_FORMS;
    static {
        Set<String> set = new LinkedHashSet<>();
        Collections.addAll(set, "quote", "setq", "func", "lambda", "prog", "cond", "while", "return", "break");
        SPECIAL_FORMS = Collections.unmodifiableSet(set);
    }

    private static final Map<String, BuiltinFunction> CORE;
    static {
        Map<String, BuiltinFunction> map = new LinkedHashMap<>();
        registerCoreBuiltins(map);
        CORE = Collections.unmodifiableMap(map);
    }

    private Builtins() {}

    public static boolean isBuiltin(String name) { return CORE.containsKey(name); }

    public static boolean isSpecialForm(String name) { return SPECIAL_FORMS.contains(name); }

    public static BuiltinFunction get(String name) { return CORE.get(name); }

    private static void registerCoreBuiltins(Map<String, BuiltinFunction> map) {
        for (String op : new String[] {"plus", "minus", "times", "divide"}) {
            map.put(op, (in, env, args) -> {
                requireArgCount(op, args, 2);
                Value a = args.get(0);
                Value b = args.get(1);
                requireNumber(op, a, b);
                if ("divide".equals(op) && b.getType() == Value.Type.INTEGER && b.asInteger() == 0) {
                    throw new ScriptRuntimeException(ErrorKind.DIVISION_BY_ZERO, "divide by integer zero");
                }
                return Value.number(Arithmetic.apply(op, a.asNumber(), b.asNumber()));
            });
        }

        for (String op : new String[] {"less", "lesseq", "greater", "greatereq", "equal", "nonequal"}) {
            map.put(op, (in, env, args) -> {
                requireArgCount(op, args, 2);
                double a = numericOrBool(op, args.get(0));
                double b = numericOrBool(op, args.get(1));
                return Value.bool(Arithmetic.compare(op, a, b));
            });
        }

        for (String op : new String[] {"and", "or", "xor"}) {
            map.put(op, (in, env, args) -> {
                requireArgCount(op, args, 2);
                return Value.bool(Arithmetic.logical(op, requireBool(op, args.get(0)), requireBool(op, args.get(1))));
            });
        }

        map.put("not", (in, env, args) -> {
            requireArgCount("not", args, 1);
            return Value.bool(!requireBool("not", args.get(0)));
        });

        registerPredicate(map, "isint", Value.Type.INTEGER);
        registerPredicate(map, "isreal", Value.Type.REAL);
        registerPredicate(map, "isbool", Value.Type.BOOL);
        registerPredicate(map, "isnull", Value.Type.NULL);
        registerPredicate(map, "isatom", Value.Type.ATOM);
        registerPredicate(map, "islist", Value.Type.LIST);

        map.put("head", (in, env, args) -> {
            requireArgCount("head", args, 1);
            List<Value> list = requireList("head", args.get(0));
            if (list.isEmpty()) {
                throw new ScriptRuntimeException(ErrorKind.TYPE_MISMATCH, "head expects a non-empty list");
            }
            return list.get(0);
        });

        map.put("tail", (in, env, args) -> {
            requireArgCount("tail", args, 1);
            List<Value> list = requireList("tail", args.get(0));
            return Value.list(list.isEmpty() ? list : list.subList(1, list.size()));
        });

        map.put("cons", (in, env, args) -> {
            requireArgCount("cons", args, 2);
            List<Value> tail = requireList("cons", args.get(1));
            List<Value> out = new ArrayList<>(tail.size() + 1);
            out.add(args.get(0));
            out.addAll(tail);
            return Value.list(out);
        });

        map.put("eval", (in, env, args) -> {
            requireArgCount("eval", args, 1);
            Value v = args.get(0);
            if (v.getType() != Value.Type.LIST) return v;
            return in.eval(v.toElement(), env);
        });
    }

    private static void registerPredicate(Map<String, BuiltinFunction> map, String name, Value.Type type) {
        map.put(name, (in, env, args) -> {
            requireArgCount(name, args, 1);
            return Value.bool(args.get(0).getType() == type);
        });
    }

    private static void requireArgCount(String name, List<Value> args, int expected) {
        if (args.size() != expected) {
            throw new ScriptRuntimeException(ErrorKind.ARITY,
                    name + " expects " + expected + " argument(s), got " + args.size());
        }
    }

    private static void requireNumber(String name, Value a, Value b) {
        if (!a.isNumber() || !b.isNumber()) {
            throw new ScriptRuntimeException(ErrorKind.TYPE_MISMATCH,
                    name + " expects numbers, got " + a.typeName() + " and " + b.typeName());
        }
    }

    private static double numericOrBool(String name, Value v) {
        if (v.isNumber()) return v.asNumber();
        if (v.getType() == Value.Type.BOOL) return v.asBool() ? 1.0 : 0.0;
        throw new ScriptRuntimeException(ErrorKind.TYPE_MISMATCH,
                name + " expects number or bool, got " + v.typeName());
    }

    private static boolean requireBool(String name, Value v) {
        if (v.getType() != Value.Type.BOOL) {
            throw new ScriptRuntimeException(ErrorKind.TYPE_MISMATCH,
                    name + " expects bool, got " + v.typeName());
        }
        return v.asBool();
    }

    private static List<Value> requireList(String name, Value v) {
        if (v.getType() != Value.Type.LIST) {
            throw new ScriptRuntimeException(ErrorKind.TYPE_MISMATCH,
                    name + " expects a list, got " + v.typeName());
        }
        return v.asList();
    }
}
