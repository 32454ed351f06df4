import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.flisp.script.parser.Diagnostic;
import com.flisp.script.parser.Lexer;
import com.flisp.script.parser.ParseResult;
import com.flisp.script.parser.Parser;
import com.flisp.script.semantic.SemanticAnalyzer;
import com.flisp.script.semantic.TypeKind;

public class FLispSemanticAnalyzerTest {

    private static SemanticAnalyzer analyzer(String src) {
        ParseResult parsed = new Parser(new Lexer(src).tokenize()).parseProgram();
        assertFalse(parsed.hasErrors(), () -> "unexpected syntax errors: " + parsed.diagnostics());
        return new SemanticAnalyzer(parsed.nodes());
    }

    private static List<Diagnostic> analyze(String src) {
        return analyzer(src).analyze();
    }

    private static List<String> messages(String src) {
        return analyze(src).stream().map(d -> d.message).collect(Collectors.toList());
    }

    private static void assertClean(String src) {
        List<Diagnostic> diags = analyze(src);
        assertTrue(diags.isEmpty(), () -> "expected no diagnostics for " + src + " but got " + diags);
    }

    private static void assertSingle(String src, String message) {
        assertEquals(List.of(message), messages(src));
    }

    @Test
    void cleanProgramHasNoDiagnostics() {
        assertClean("(setq x 1)\n(plus x 2)");
        assertClean("(func fact (n) (cond (lesseq n 1) 1 (times n (fact (minus n 1)))))\n(fact 5)");
        assertClean("(prog () (setq maker (lambda (x) (lambda () x))) (setq f (maker 5)) (f))");
    }

    @Test
    void undeclaredIdentifier() {
        List<Diagnostic> diags = analyze("(plus y 1)");
        assertEquals(1, diags.size());
        assertEquals(Diagnostic.Phase.SEMANTIC, diags.get(0).phase);
        assertEquals(1, diags.get(0).line);
        assertEquals("Undeclared identifier 'y'", diags.get(0).message);
        assertEquals("Line 1: Semantic error: Undeclared identifier 'y'", diags.get(0).toString());
    }

    @Test
    void undefinedFunction() {
        assertSingle("(foo 1)", "Call to undefined function 'foo'");
    }

    @Test
    void builtinArityAndArgumentTypes() {
        assertSingle("(plus 1)", "plus expects 2 argument(s), got 1");
        assertSingle("(plus true 1)", "plus expects number for argument 1, got bool");
        assertSingle("(and 1 true)", "and expects bool for argument 1, got number");
        assertSingle("(less (cons 1 '()) 2)", "less expects number or bool for argument 1, got list");
        assertSingle("(head 5)", "head expects list for argument 1, got number");
    }

    @Test
    void inferredVariableTypesFeedArgumentChecks() {
        assertSingle("(setq flag (less 1 2))\n(plus flag 1)", "plus expects number for argument 1, got bool");
        assertClean("(setq n (plus 1 2))\n(times n 2)");
    }

    @Test
    void userFunctionArity() {
        assertSingle("(func f (a) a)\n(f 1 2)", "f expects 1 argument(s), got 2");
    }

    @Test
    void anonymousLambdaArity() {
        assertSingle("((lambda (x) x) 1 2)", "anonymous lambda expects 1 argument(s), got 2");
        assertClean("((lambda (x) x) 1)");
    }

    @Test
    void breakOnlyInsideWhile() {
        assertSingle("(break)", "break used outside of while");
        assertClean("(while true (break))");
        assertClean("(while true (prog () (break)))");
    }

    @Test
    void returnOnlyInsideProgOrFunction() {
        assertSingle("(return 1)", "return used outside of prog or function");
        assertClean("(prog () (return 1))");
        assertClean("(func f () (return 1))");
        assertClean("(lambda () (return 1))");
    }

    @Test
    void structuralChecks() {
        assertSingle("(setq x)", "setq requires exactly 2 arguments, got 1");
        assertSingle("(setq 1 2)", "first argument of setq must be an atom");
        assertSingle("(func f x x)", "second argument of func must be a list of parameters");
        assertSingle("(quote a b)", "quote requires exactly 1 argument, got 2");
    }

    @Test
    void conditionsMustBeBoolean() {
        assertSingle("(cond 1 2 3)", "cond expects a boolean condition, got number");
        assertSingle("(while 1 2)", "while expects a boolean condition, got number");
    }

    @Test
    void allProblemsAreCollectedWithTheirLines() {
        List<Diagnostic> diags = analyze("(plus y 1)\n(foo)\n(break)");
        assertEquals(3, diags.size());
        assertEquals(1, diags.get(0).line);
        assertEquals(2, diags.get(1).line);
        assertEquals(3, diags.get(2).line);
    }

    @Test
    void quotedDataIsNotChecked() {
        assertClean("'(foo bar)");
    }

    @Test
    void evalOfQuotedCodeIsChecked() {
        assertSingle("(eval '(foo 1))", "Call to undefined function 'foo'");
    }

    @Test
    void evaluatedCodeSharesTheCallersContext() {
        assertClean("(prog () (eval '(return 1)))");
        assertClean("(while true (eval '(break)))");
        assertSingle("(eval '(return 1))", "return used outside of prog or function");
    }

    @Test
    void functionShadowingBuiltinUsesItsOwnArity() {
        assertClean("(func plus (a) a)\n(plus 1)");
        assertClean("(setq plus (lambda (a) a))\n(plus 1)");
    }

    @Test
    void nonFunctionBindingKeepsBuiltinChecks() {
        assertSingle("(setq plus 5)\n(plus 1)", "plus expects 2 argument(s), got 1");
    }

    @Test
    void progLocalsAreScopedToTheBlock() {
        assertSingle("(prog (a) (setq a 1))\na", "Undeclared identifier 'a'");
    }

    @Test
    void globalScopeRecordsInferredTypes() {
        SemanticAnalyzer a = analyzer("(setq x 1.5)\n(setq b (less 1 2))\n(setq l '(1 2))\n(setq n null)\n(setq q 'a)");
        a.analyze();
        assertEquals(TypeKind.NUMBER, a.globalScope().lookupVariableType("x"));
        assertEquals(TypeKind.BOOL, a.globalScope().lookupVariableType("b"));
        assertEquals(TypeKind.LIST, a.globalScope().lookupVariableType("l"));
        assertEquals(TypeKind.NULL, a.globalScope().lookupVariableType("n"));
        assertEquals(TypeKind.ANY, a.globalScope().lookupVariableType("q"));
        assertNull(a.globalScope().lookupVariableType("missing"));
    }

    @Test
    void analysisDoesNotModifyTheProgram() {
        ParseResult parsed = new Parser(new Lexer("(plus y 1)\n(setq x 2)").tokenize()).parseProgram();
        String before = parsed.nodes().toString();
        new SemanticAnalyzer(parsed.nodes()).analyze();
        assertEquals(before, parsed.nodes().toString());
    }
}
