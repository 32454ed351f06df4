package com.flisp.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public final class Value {
    public enum Type { INTEGER, REAL, BOOL, NULL, ATOM, LIST, FUNC }

    private static final Value NULL = new Value(Type.NULL, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value integer(long i) { return new Value(Type.INTEGER, i); }
    public static Value real(double d) { return new Value(Type.REAL, d); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value nil() { return NULL; }
    public static Value atom(String name) { return new Value(Type.ATOM, Objects.requireNonNull(name)); }
    public static Value func(Closure c) { return new Value(Type.FUNC, Objects.requireNonNull(c)); }

    public static Value list(List<Value> items) {
        return new Value(Type.LIST, Collections.unmodifiableList(new ArrayList<>(items)));
    }

    /** Integer when the result has no fractional part and fits a long, real otherwise. */
    public static Value number(double d) {
        return Arithmetic.isWhole(d) ? integer((long) d) : real(d);
    }

    public Type getType() { return type; }

    public boolean isNumber() { return type == Type.INTEGER || type == Type.REAL; }

    public long asInteger() {
        if (type != Type.INTEGER) throw mismatch("integer");
        return (long) value;
    }

    public double asReal() {
        if (type != Type.REAL) throw mismatch("real");
        return (double) value;
    }

    /** Integers and reals widened to double. */
    public double asNumber() {
        if (type == Type.INTEGER) return (double) (long) value;
        if (type == Type.REAL) return (double) value;
        throw mismatch("number");
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw mismatch("bool");
        return (boolean) value;
    }

    public String asAtom() {
        if (type != Type.ATOM) throw mismatch("atom");
        return (String) value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asList() {
        if (type != Type.LIST) throw mismatch("list");
        return (List<Value>) value;
    }

    public Closure asFunc() {
        if (type != Type.FUNC) throw mismatch("function");
        return (Closure) value;
    }

    private ScriptRuntimeException mismatch(String expected) {
        return new ScriptRuntimeException(ErrorKind.TYPE_MISMATCH,
                "Expected " + expected + ", got " + typeName());
    }

    /** Lower-case type name used in error messages. */
    public String typeName() {
        switch (type) {
            case INTEGER: return "integer";
            case REAL:    return "real";
            case BOOL:    return "bool";
            case ATOM:    return "atom";
            case LIST:    return "list";
            case FUNC:    return "function";
            default:      return "null";
        }
    }

    /** Structural conversion of quoted data. */
    public static Value fromElement(Element e) {
        switch (e.type) {
            case INTEGER: return integer(e.asInteger());
            case REAL:    return real(e.asReal());
            case BOOL:    return bool(e.asBool());
            case ATOM:    return atom(e.asAtom());
            case LIST: {
                List<Value> items = new ArrayList<>(e.asList().size());
                for (Element child : e.asList()) items.add(fromElement(child));
                return list(items);
            }
            default:      return nil();
        }
    }

    /** Inverse of {@link #fromElement(Element)}; used by {@code eval}. Functions have no source form. */
    public Element toElement() {
        switch (type) {
            case INTEGER: return Element.integer(asInteger());
            case REAL:    return Element.real(asReal());
            case BOOL:    return Element.bool(asBool());
            case ATOM:    return Element.atom(asAtom());
            case LIST: {
                List<Element> items = new ArrayList<>(asList().size());
                for (Value v : asList()) items.add(v.toElement());
                return Element.list(items);
            }
            case FUNC:
                throw new ScriptRuntimeException(ErrorKind.TYPE_MISMATCH,
                        "Cannot convert a function value back into an expression");
            default:      return Element.nil();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (type != other.type) return false;
        // closures compare by identity
        if (type == Type.FUNC) return value == other.value;
        return Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return (type == Type.FUNC) ? System.identityHashCode(value) : Objects.hash(type, value);
    }

    @Override
    public String toString() {
        switch (type) {
            case INTEGER:
                return Long.toString(asInteger());
            case REAL:
                return Double.toString(asReal());
            case BOOL:
                return Boolean.toString(asBool());
            case ATOM:
                return asAtom();
            case LIST: {
                StringBuilder sb = new StringBuilder("(");
                List<Value> items = asList();
                for (int i = 0; i < items.size(); i++) {
                    if (i > 0) sb.append(' ');
                    sb.append(items.get(i));
                }
                return sb.append(')').toString();
            }
            case FUNC:
                return "<function>";
            default:
                return "null";
        }
    }
}
