package com.flisp.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runtime scope frame. Frames are shared by reference: every closure created
 * in a frame keeps that same frame alive and sees later rebindings in it.
 */
public class Environment {

    public final Environment parent;

    private final Map<String, Value> vars = new LinkedHashMap<>();

    /** Root (global) frame. */
    public Environment() {
        this.parent = null;
    }

    public Environment(Map<String, Value> initial) {
        this.parent = null;
        if (initial != null) vars.putAll(initial);
    }

    private Environment(Environment parent) {
        this.parent = parent;
    }

    /** New frame whose parent is this one (prog block or call frame). */
    public Environment childScope() {
        return new Environment(this);
    }

    /** Binds in THIS frame, shadowing any outer binding and replacing an existing local one. */
    public void define(String name, Value value) {
        vars.put(name, value);
    }

    /** Nearest binding along the parent chain, or null when unbound. */
    public Value lookup(String name) {
        for (Environment e = this; e != null; e = e.parent) {
            Value v = e.vars.get(name);
            if (v != null) return v;
        }
        return null;
    }

    public Value get(String name) {
        Value v = lookup(name);
        if (v == null) {
            throw new ScriptRuntimeException(ErrorKind.UNDEFINED_ATOM, "Undefined atom: " + name);
        }
        return v;
    }

    public boolean exists(String name) {
        return lookup(name) != null;
    }

    public boolean existsInCurrentScope(String name) {
        return vars.containsKey(name);
    }

    /** Copy of this frame's own bindings, in definition order. */
    public Map<String, Value> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(vars));
    }

    /** Frames from this one outwards to the root. */
    public List<Environment> chain() {
        List<Environment> out = new ArrayList<>();
        for (Environment e = this; e != null; e = e.parent) out.add(e);
        return out;
    }

    public Environment root() {
        Environment e = this;
        while (e.parent != null) e = e.parent;
        return e;
    }
}
