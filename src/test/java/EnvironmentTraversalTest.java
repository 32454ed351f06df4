import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.flisp.script.parser.Environment;
import com.flisp.script.parser.ErrorKind;
import com.flisp.script.parser.ScriptRuntimeException;
import com.flisp.script.parser.Value;

public class EnvironmentTraversalTest {

    @Test
    void getTraversal_localThenParentChain() {
        Environment root = new Environment();
        root.define("a", Value.integer(1));
        root.define("shadow", Value.integer(10));

        Environment child = root.childScope();
        child.define("b", Value.integer(2));
        child.define("shadow", Value.integer(20)); // local shadows parent

        // local
        assertEquals(2L, child.get("b").asInteger());

        // parent
        assertEquals(1L, child.get("a").asInteger());

        // shadowing
        assertEquals(20L, child.get("shadow").asInteger());
        assertEquals(10L, root.get("shadow").asInteger());
    }

    @Test
    void defineBindsInCurrentFrameOnly() {
        Environment root = new Environment();
        root.define("i", Value.integer(0));

        Environment child = root.childScope();
        child.define("i", Value.integer(5));

        assertEquals(0L, root.get("i").asInteger());
        assertEquals(5L, child.get("i").asInteger());
        assertTrue(child.existsInCurrentScope("i"));
        assertFalse(child.childScope().existsInCurrentScope("i"));
    }

    @Test
    void laterRebindingsAreVisibleThroughSharedFrames() {
        Environment root = new Environment();
        Environment child = root.childScope();

        root.define("late", Value.integer(1));
        assertEquals(1L, child.get("late").asInteger());

        root.define("late", Value.integer(2));
        assertEquals(2L, child.get("late").asInteger());
    }

    @Test
    void nullValueIsABinding() {
        Environment root = new Environment();
        root.define("n", Value.nil());
        assertTrue(root.exists("n"));
        assertEquals(Value.nil(), root.childScope().get("n"));
    }

    @Test
    void missingNameThrowsUndefinedAtom() {
        Environment root = new Environment();
        assertNull(root.lookup("nope"));
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class, () -> root.childScope().get("nope"));
        assertEquals(ErrorKind.UNDEFINED_ATOM, e.kind());
    }

    @Test
    void initialBindingsAndSnapshot() {
        Map<String, Value> initial = new LinkedHashMap<>();
        initial.put("x", Value.integer(1));
        Environment root = new Environment(initial);
        root.define("y", Value.bool(true));

        Map<String, Value> snap = root.snapshot();
        assertEquals(List.of("x", "y"), List.copyOf(snap.keySet()));
        assertThrows(UnsupportedOperationException.class, () -> snap.put("z", Value.nil()));

        // the host map is copied, not aliased
        initial.put("w", Value.nil());
        assertFalse(root.exists("w"));
    }

    @Test
    void chainAndRoot() {
        Environment root = new Environment();
        Environment mid = root.childScope();
        Environment leaf = mid.childScope();

        assertEquals(List.of(leaf, mid, root), leaf.chain());
        assertSame(root, leaf.root());
        assertSame(mid, leaf.parent);
    }
}
