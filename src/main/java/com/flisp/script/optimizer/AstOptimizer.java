package com.flisp.script.optimizer;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.flisp.debug.Debug;
import com.flisp.script.parser.Arithmetic;
import com.flisp.script.parser.Builtins;
import com.flisp.script.parser.Element;
import com.flisp.script.parser.Node;

/**
 * Pure AST-to-AST rewrite: constant folding followed by dead-store
 * elimination of top-level {@code setq}s. The rewritten program evaluates to
 * the same values, with the same side effects in the same order.
 */
public final class AstOptimizer {
    private static final String TAG = "flisp.optimizer";

    private final Set<String> reboundBuiltins;
    private int folds = 0;

    private AstOptimizer(Set<String> reboundBuiltins) {
        this.reboundBuiltins = reboundBuiltins;
    }

    public static List<Node> optimize(List<Node> nodes) {
        AstOptimizer optimizer = new AstOptimizer(collectReboundBuiltins(nodes));

        List<Node> folded = new ArrayList<>(nodes.size());
        for (Node n : nodes) {
            folded.add(new Node(optimizer.optimizeElement(n.element), n.line));
        }
        List<Node> result = removeDeadStores(folded);

        Debug.get().d(TAG, optimizer.folds + " constant fold(s)");
        return result;
    }

    // -------------------------
    // Constant folding
    // -------------------------

    private Element optimizeElement(Element e) {
        if (!e.isList()) return e;
        // quoted data is never evaluated, so it is never folded
        if ("quote".equals(e.headName())) return e;

        List<Element> children = new ArrayList<>(e.asList().size());
        for (Element child : e.asList()) children.add(optimizeElement(child));

        Element folded = constantFold(children);
        if (folded != null) {
            folds++;
            Debug.get().t(TAG, "folded " + Element.list(children) + " -> " + folded);
            return folded;
        }
        return Element.list(children);
    }

    /** The literal a builtin call over literals evaluates to, or null if it must stay a call. */
    private Element constantFold(List<Element> elems) {
        if (elems.isEmpty() || !elems.get(0).isAtom()) return null;
        String op = elems.get(0).asAtom();
        if (reboundBuiltins.contains(op)) return null;

        if (elems.size() == 3 && (Arithmetic.isArithmetic(op) || Arithmetic.isComparison(op))) {
            Element lhs = elems.get(1);
            Element rhs = elems.get(2);
            // booleans stay unfolded: arithmetic on them is a runtime type error
            if (!isNumber(lhs) || !isNumber(rhs)) return null;
            double a = numericValue(lhs);
            double b = numericValue(rhs);

            if (Arithmetic.isComparison(op)) return Element.bool(Arithmetic.compare(op, a, b));

            // division by zero is left to the interpreter
            if ("divide".equals(op) && b == 0) return null;
            double res = Arithmetic.apply(op, a, b);
            return Arithmetic.isWhole(res) ? Element.integer((long) res) : Element.real(res);
        }

        if (elems.size() == 3 && ("and".equals(op) || "or".equals(op) || "xor".equals(op))) {
            Element lhs = elems.get(1);
            Element rhs = elems.get(2);
            if (lhs.getType() != Element.Type.BOOL || rhs.getType() != Element.Type.BOOL) return null;
            return Element.bool(Arithmetic.logical(op, lhs.asBool(), rhs.asBool()));
        }

        if (elems.size() == 2 && "not".equals(op) && elems.get(1).getType() == Element.Type.BOOL) {
            return Element.bool(!elems.get(1).asBool());
        }
        return null;
    }

    private static boolean isNumber(Element e) {
        return e.getType() == Element.Type.INTEGER || e.getType() == Element.Type.REAL;
    }

    private static double numericValue(Element e) {
        return (e.getType() == Element.Type.INTEGER) ? (double) e.asInteger() : e.asReal();
    }

    /**
     * Builtin names the program may rebind: setq/func targets, lambda/func
     * parameters and prog locals, and, when the program calls eval, builtin
     * names inside quoted data. Calls through those names are not folded.
     */
    private static Set<String> collectReboundBuiltins(List<Node> nodes) {
        Set<String> out = new HashSet<>();
        Set<String> quoted = new HashSet<>();
        boolean usesEval = false;
        for (Node n : nodes) {
            collectRebound(n.element, out, quoted);
            usesEval |= mentionsEval(n.element);
        }
        if (usesEval) out.addAll(quoted);
        return out;
    }

    private static void collectRebound(Element e, Set<String> out, Set<String> quoted) {
        if (!e.isList()) return;
        List<Element> elems = e.asList();
        String head = e.headName();
        if (head != null) {
            switch (head) {
                case "quote":
                    for (Element q : elems.subList(1, elems.size())) collectBuiltinAtoms(q, quoted);
                    return;
                case "setq":
                case "func":
                    if (elems.size() > 1) addIfBuiltin(elems.get(1), out);
                    if ("func".equals(head) && elems.size() > 2) addAllIfBuiltin(elems.get(2), out);
                    break;
                case "lambda":
                case "prog":
                    if (elems.size() > 1) addAllIfBuiltin(elems.get(1), out);
                    break;
                default:
                    break;
            }
        }
        for (Element child : elems) collectRebound(child, out, quoted);
    }

    private static void collectBuiltinAtoms(Element e, Set<String> out) {
        if (e.isAtom()) {
            addIfBuiltin(e, out);
        } else if (e.isList()) {
            for (Element child : e.asList()) collectBuiltinAtoms(child, out);
        }
    }

    private static boolean mentionsEval(Element e) {
        if (e.isAtom()) return "eval".equals(e.asAtom());
        if (!e.isList()) return false;
        for (Element child : e.asList()) {
            if (mentionsEval(child)) return true;
        }
        return false;
    }

    private static void addAllIfBuiltin(Element list, Set<String> out) {
        if (!list.isList()) return;
        for (Element p : list.asList()) addIfBuiltin(p, out);
    }

    private static void addIfBuiltin(Element e, Set<String> out) {
        if (e.isAtom() && Builtins.isBuiltin(e.asAtom())) out.add(e.asAtom());
    }

    // -------------------------
    // Dead-store elimination
    // -------------------------

    private static List<Node> removeDeadStores(List<Node> nodes) {
        Set<String> declared = new HashSet<>();
        Set<String> used = new HashSet<>();

        for (Node n : nodes) {
            String target = setqTarget(n.element);
            if (target != null) declared.add(target);
            collectUses(n.element, used);
        }

        Set<String> unused = new HashSet<>(declared);
        unused.removeAll(used);
        if (unused.isEmpty()) return nodes;

        List<Node> out = new ArrayList<>(nodes.size());
        for (Node n : nodes) {
            String target = setqTarget(n.element);
            if (target != null && unused.contains(target)) {
                // the store goes, the value expression (and its side effects) stays
                Debug.get().t(TAG, "dead store to '" + target + "' at line " + n.line);
                out.add(new Node(n.element.asList().get(2), n.line));
            } else {
                out.add(n);
            }
        }
        return out;
    }

    /** Target name of a well-formed (setq name value), or null. */
    private static String setqTarget(Element e) {
        if (!"setq".equals(e.headName())) return null;
        List<Element> elems = e.asList();
        if (elems.size() != 3 || !elems.get(1).isAtom()) return null;
        return elems.get(1).asAtom();
    }

    /** Every atom except the name being assigned by a setq. */
    private static void collectUses(Element e, Set<String> used) {
        if (e.isAtom()) {
            used.add(e.asAtom());
            return;
        }
        if (!e.isList()) return;
        List<Element> elems = e.asList();
        if (setqTarget(e) != null) {
            used.add("setq");
            collectUses(elems.get(2), used);
            return;
        }
        for (Element child : elems) collectUses(child, used);
    }
}
