package com.flisp.script.semantic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.flisp.script.parser.Element;

/**
 * One analysis scope: inferred variable types, known functions, and a link to
 * the enclosing scope. Lookups walk the parent chain and stop if a frame is
 * visited twice.
 */
public final class SymbolTable {

    /** Parameter names and body of a function known to the analyzer. */
    public static final class FunctionSig {
        public final List<String> params;
        public final Element body;

        public FunctionSig(List<String> params, Element body) {
            this.params = Collections.unmodifiableList(new ArrayList<>(params));
            this.body = body;
        }
    }

    private final Map<String, TypeKind> variables = new LinkedHashMap<>();
    private final Map<String, FunctionSig> functions = new LinkedHashMap<>();
    private SymbolTable parent;

    public SymbolTable() {
        this(null);
    }

    public SymbolTable(SymbolTable parent) {
        this.parent = parent;
    }

    public SymbolTable parent() { return parent; }

    public void setParent(SymbolTable parent) { this.parent = parent; }

    public SymbolTable child() { return new SymbolTable(this); }

    public void defineVariable(String name, TypeKind type) {
        variables.put(name, type == null ? TypeKind.ANY : type);
    }

    public boolean isVariableDefined(String name) {
        return lookupVariableType(name) != null;
    }

    /** Nearest recorded type, or null if the name is not a known variable. */
    public TypeKind lookupVariableType(String name) {
        Set<SymbolTable> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        for (SymbolTable t = this; t != null; t = t.parent) {
            if (!visited.add(t)) return null;
            TypeKind type = t.variables.get(name);
            if (type != null) return type;
        }
        return null;
    }

    public void defineFunction(String name, List<String> params, Element body) {
        functions.put(name, new FunctionSig(params, body));
    }

    public FunctionSig lookupFunction(String name) {
        Set<SymbolTable> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        for (SymbolTable t = this; t != null; t = t.parent) {
            if (!visited.add(t)) return null;
            FunctionSig fn = t.functions.get(name);
            if (fn != null) return fn;
        }
        return null;
    }
}
