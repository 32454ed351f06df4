import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.flisp.script.parser.Element;
import com.flisp.script.semantic.SymbolTable;
import com.flisp.script.semantic.TypeKind;

public class SymbolTableTest {

    @Test
    void lookupWalksOutwardAndInnerDefinitionsShadow() {
        SymbolTable global = new SymbolTable();
        global.defineVariable("x", TypeKind.NUMBER);
        global.defineVariable("shadow", TypeKind.NUMBER);

        SymbolTable local = global.child();
        local.defineVariable("shadow", TypeKind.BOOL);

        assertEquals(TypeKind.NUMBER, local.lookupVariableType("x"));
        assertEquals(TypeKind.BOOL, local.lookupVariableType("shadow"));
        assertEquals(TypeKind.NUMBER, global.lookupVariableType("shadow"));
        assertSame(global, local.parent());
    }

    @Test
    void innerDefinitionsAreInvisibleOutward() {
        SymbolTable global = new SymbolTable();
        SymbolTable local = global.child();
        local.defineVariable("tmp", TypeKind.LIST);

        assertTrue(local.isVariableDefined("tmp"));
        assertFalse(global.isVariableDefined("tmp"));
    }

    @Test
    void redefinitionOverwritesRecordedType() {
        SymbolTable t = new SymbolTable();
        t.defineVariable("v", TypeKind.NUMBER);
        t.defineVariable("v", TypeKind.BOOL);
        assertEquals(TypeKind.BOOL, t.lookupVariableType("v"));
    }

    @Test
    void nullTypeIsRecordedAsAny() {
        SymbolTable t = new SymbolTable();
        t.defineVariable("v", null);
        assertEquals(TypeKind.ANY, t.lookupVariableType("v"));
    }

    @Test
    void functionsAreFoundThroughTheChain() {
        SymbolTable global = new SymbolTable();
        global.defineFunction("f", List.of("a", "b"), Element.atom("a"));

        SymbolTable.FunctionSig sig = global.child().child().lookupFunction("f");
        assertNotNull(sig);
        assertEquals(List.of("a", "b"), sig.params);
        assertEquals(Element.atom("a"), sig.body);
        assertNull(global.lookupFunction("g"));
    }

    @Test
    void cyclicParentChainTerminates() {
        SymbolTable a = new SymbolTable();
        SymbolTable b = a.child();
        a.setParent(b);
        b.defineVariable("x", TypeKind.NUMBER);

        assertNull(a.lookupVariableType("missing"));
        assertNull(a.lookupFunction("missing"));
        assertEquals(TypeKind.NUMBER, a.lookupVariableType("x"));
    }
}
