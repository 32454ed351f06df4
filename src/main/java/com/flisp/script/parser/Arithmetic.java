package com.flisp.script.parser;

/**
 * Numeric rules shared by the interpreter and the constant folder, so that a
 * folded literal is exactly what evaluation would have produced.
 */
public final class Arithmetic {

    private static final double LONG_MIN = -0x1p63;
    private static final double LONG_MAX_EXCLUSIVE = 0x1p63;

    private Arithmetic() {}

    /** Finite, no fractional part, and representable as a long. */
    public static boolean isWhole(double d) {
        return !Double.isInfinite(d) && !Double.isNaN(d)
                && Math.floor(d) == d
                && d >= LONG_MIN && d < LONG_MAX_EXCLUSIVE;
    }

    public static boolean isArithmetic(String name) {
        return "plus".equals(name) || "minus".equals(name) || "times".equals(name) || "divide".equals(name);
    }

    public static boolean isComparison(String name) {
        switch (name) {
            case "less": case "lesseq": case "greater": case "greatereq":
            case "equal": case "nonequal":
                return true;
            default:
                return false;
        }
    }

    public static double apply(String op, double a, double b) {
        switch (op) {
            case "plus":   return a + b;
            case "minus":  return a - b;
            case "times":  return a * b;
            case "divide": return a / b;
            default: throw new IllegalArgumentException("Not an arithmetic builtin: " + op);
        }
    }

    public static boolean compare(String op, double a, double b) {
        switch (op) {
            case "less":      return a < b;
            case "lesseq":    return a <= b;
            case "greater":   return a > b;
            case "greatereq": return a >= b;
            case "equal":     return a == b;
            case "nonequal":  return a != b;
            default: throw new IllegalArgumentException("Not a comparison builtin: " + op);
        }
    }

    public static boolean logical(String op, boolean a, boolean b) {
        switch (op) {
            case "and": return a && b;
            case "or":  return a || b;
            case "xor": return a != b;
            default: throw new IllegalArgumentException("Not a logical builtin: " + op);
        }
    }
}
