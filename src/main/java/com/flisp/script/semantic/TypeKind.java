package com.flisp.script.semantic;

/** Static type approximation used by the analyzer. Integers and reals are both NUMBER. */
public enum TypeKind {
    NUMBER, BOOL, ANY, NULL, LIST;

    @Override
    public String toString() {
        return name().toLowerCase();
    }
}
