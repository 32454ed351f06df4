import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.flisp.script.FLispCli;

public class FLispCliTest {

    @TempDir
    Path dir;

    private String script(String name, String source) throws Exception {
        Path p = dir.resolve(name);
        Files.writeString(p, source, StandardCharsets.UTF_8);
        return p.toString();
    }

    @Test
    void runsAScript() throws Exception {
        String file = script("ok.fl", "(setq x 2)\n(times x 21)\n");
        assertEquals(0, FLispCli.execute(new String[] {file}));
        assertEquals(0, FLispCli.execute(new String[] {"--json", file}));
    }

    @Test
    void runtimeErrorExitsWithOne() throws Exception {
        String file = script("bad.fl", "(plus y 1)\n");
        assertEquals(1, FLispCli.execute(new String[] {file}));
    }

    @Test
    void checkExitsWithOneOnDiagnostics() throws Exception {
        assertEquals(1, FLispCli.execute(new String[] {"--check", script("bad.fl", "(foo 1)\n")}));
        assertEquals(0, FLispCli.execute(new String[] {"--check", script("ok.fl", "(plus 1 2)\n")}));
    }

    @Test
    void inspectionModes() throws Exception {
        String file = script("ok.fl", "(plus 1 (times 2 3))\n");
        assertEquals(0, FLispCli.execute(new String[] {"--tokens", file}));
        assertEquals(0, FLispCli.execute(new String[] {"--ast", "--json", file}));
        assertEquals(0, FLispCli.execute(new String[] {"--optimize", file}));
    }

    @Test
    void lenientFlag() throws Exception {
        String file = script("lenient.fl", "(setq x1 5)\nx1\n");
        assertEquals(1, FLispCli.execute(new String[] {"--check", file}));
        assertEquals(0, FLispCli.execute(new String[] {"--check", "--lenient", file}));
    }

    @Test
    void usageErrors() {
        assertEquals(2, FLispCli.execute(new String[] {"--bogus"}));
        assertEquals(2, FLispCli.execute(new String[] {"a.fl", "b.fl"}));
    }

    @Test
    void unreadableFileExitsWithThree() {
        assertEquals(3, FLispCli.execute(new String[] {dir.resolve("missing.fl").toString()}));
    }
}
