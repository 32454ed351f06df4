package com.flisp.script.semantic;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Arity, expected argument types and result type of each builtin. */
final class BuiltinSpec {
    final int arity;
    /** Null when arguments are not type-checked. */
    final List<TypeKind> expectedArgTypes;
    final TypeKind returnType;

    private BuiltinSpec(int arity, List<TypeKind> expectedArgTypes, TypeKind returnType) {
        this.arity = arity;
        this.expectedArgTypes = expectedArgTypes;
        this.returnType = returnType;
    }

    private static BuiltinSpec of(int arity, TypeKind returnType, TypeKind... expected) {
        List<TypeKind> types = (expected.length == 0) ? null : Collections.unmodifiableList(Arrays.asList(expected));
        return new BuiltinSpec(arity, types, returnType);
    }

    static final Map<String, BuiltinSpec> SPECS;
    static {
        Map<String, BuiltinSpec> m = new LinkedHashMap<>();

        m.put("plus",   of(2, TypeKind.NUMBER, TypeKind.NUMBER, TypeKind.NUMBER));
        m.put("minus",  of(2, TypeKind.NUMBER, TypeKind.NUMBER, TypeKind.NUMBER));
        m.put("times",  of(2, TypeKind.NUMBER, TypeKind.NUMBER, TypeKind.NUMBER));
        m.put("divide", of(2, TypeKind.NUMBER, TypeKind.NUMBER, TypeKind.NUMBER));

        // comparisons and equality are checked separately: number, bool or any
        for (String op : new String[] {"less", "lesseq", "greater", "greatereq", "equal", "nonequal"}) {
            m.put(op, of(2, TypeKind.BOOL));
        }

        m.put("head", of(1, TypeKind.ANY, TypeKind.LIST));
        m.put("tail", of(1, TypeKind.LIST, TypeKind.LIST));
        m.put("cons", of(2, TypeKind.LIST, TypeKind.ANY, TypeKind.LIST));

        m.put("and", of(2, TypeKind.BOOL, TypeKind.BOOL, TypeKind.BOOL));
        m.put("or",  of(2, TypeKind.BOOL, TypeKind.BOOL, TypeKind.BOOL));
        m.put("xor", of(2, TypeKind.BOOL, TypeKind.BOOL, TypeKind.BOOL));
        m.put("not", of(1, TypeKind.BOOL, TypeKind.BOOL));

        for (String p : new String[] {"isint", "isreal", "isbool", "isnull", "isatom", "islist"}) {
            m.put(p, of(1, TypeKind.BOOL));
        }

        m.put("eval", of(1, TypeKind.ANY));
        SPECS = Collections.unmodifiableMap(m);
    }
}
