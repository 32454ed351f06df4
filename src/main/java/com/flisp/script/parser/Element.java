package com.flisp.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Recursive AST value. Lists are the only compound form: special forms are
 * lists whose head atom names the form.
 */
public final class Element {
    public enum Type { ATOM, INTEGER, REAL, BOOL, NULL, LIST }

    private static final Element NULL = new Element(Type.NULL, null);
    private static final Element TRUE = new Element(Type.BOOL, Boolean.TRUE);
    private static final Element FALSE = new Element(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;

    private Element(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Element atom(String name) { return new Element(Type.ATOM, Objects.requireNonNull(name)); }
    public static Element integer(long v) { return new Element(Type.INTEGER, v); }
    public static Element real(double v) { return new Element(Type.REAL, v); }
    public static Element bool(boolean b) { return b ? TRUE : FALSE; }
    public static Element nil() { return NULL; }

    public static Element list(List<Element> elements) {
        return new Element(Type.LIST, Collections.unmodifiableList(new ArrayList<>(elements)));
    }

    public static Element list(Element... elements) {
        List<Element> out = new ArrayList<>(elements.length);
        Collections.addAll(out, elements);
        return list(out);
    }

    public Type getType() { return type; }

    public boolean isAtom() { return type == Type.ATOM; }
    public boolean isList() { return type == Type.LIST; }

    public String asAtom() {
        if (type != Type.ATOM) throw new IllegalStateException("Expected atom, got " + type);
        return (String) value;
    }

    public long asInteger() {
        if (type != Type.INTEGER) throw new IllegalStateException("Expected integer, got " + type);
        return (long) value;
    }

    public double asReal() {
        if (type != Type.REAL) throw new IllegalStateException("Expected real, got " + type);
        return (double) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new IllegalStateException("Expected bool, got " + type);
        return (boolean) value;
    }

    @SuppressWarnings("unchecked")
    public List<Element> asList() {
        if (type != Type.LIST) throw new IllegalStateException("Expected list, got " + type);
        return (List<Element>) value;
    }

    /** The head atom name of a non-empty list, or null. */
    public String headName() {
        if (type != Type.LIST) return null;
        List<Element> elems = asList();
        if (elems.isEmpty() || !elems.get(0).isAtom()) return null;
        return elems.get(0).asAtom();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Element)) return false;
        Element other = (Element) o;
        return type == other.type && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        switch (type) {
            case ATOM:
                return asAtom();
            case INTEGER:
                return Long.toString(asInteger());
            case REAL:
                return Double.toString(asReal());
            case BOOL:
                return Boolean.toString(asBool());
            case LIST: {
                StringBuilder sb = new StringBuilder("(");
                List<Element> elems = asList();
                for (int i = 0; i < elems.size(); i++) {
                    if (i > 0) sb.append(' ');
                    sb.append(elems.get(i));
                }
                return sb.append(')').toString();
            }
            default:
                return "null";
        }
    }
}
