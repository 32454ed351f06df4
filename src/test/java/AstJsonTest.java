import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flisp.protocol.AstJson;
import com.flisp.script.FLispScript;
import com.flisp.script.RunResult;
import com.flisp.script.parser.Value;

public class AstJsonTest {

    private final FLispScript fs = new FLispScript();
    private final AstJson json = new AstJson();

    @Test
    void tokensCarryTypeAndLexeme() {
        ArrayNode arr = json.tokens(fs.tokenize("(plus 1)"));
        assertEquals(4, arr.size());
        assertEquals("LEFT_PAREN", arr.get(0).get("type").asText());
        assertEquals("KEYWORD", arr.get(1).get("type").asText());
        assertEquals("plus", arr.get(1).get("lexeme").asText());
        assertEquals("INTEGER", arr.get(2).get("type").asText());
    }

    @Test
    void nodesMapElementsOntoJson() {
        ArrayNode arr = json.nodes(fs.parse("\n(setq x 1.5)\n'(a true null 7)").nodes());
        assertEquals(2, arr.size());

        JsonNode first = arr.get(0);
        assertEquals(2, first.get("line").asInt());
        JsonNode setq = first.get("element");
        assertTrue(setq.isArray());
        assertEquals("setq", setq.get(0).get("atom").asText());
        assertEquals("x", setq.get(1).get("atom").asText());
        assertEquals(1.5, setq.get(2).asDouble(), 1e-12);

        JsonNode quoted = arr.get(1).get("element").get(1);
        assertEquals("a", quoted.get(0).get("atom").asText());
        assertTrue(quoted.get(1).isBoolean());
        assertTrue(quoted.get(2).isNull());
        assertTrue(quoted.get(3).isIntegralNumber());
        assertEquals(7L, quoted.get(3).asLong());
    }

    @Test
    void diagnostics() {
        ArrayNode arr = json.diagnostics(fs.analyze(")\n(foo)"));
        assertEquals(2, arr.size());
        assertEquals("SYNTAX", arr.get(0).get("phase").asText());
        assertEquals(1, arr.get(0).get("line").asInt());
        assertEquals("SEMANTIC", arr.get(1).get("phase").asText());
        assertEquals("Call to undefined function 'foo'", arr.get(1).get("message").asText());
    }

    @Test
    void valuesIncludingFunctionsAndLists() {
        RunResult r = fs.run("(lambda (a b) a)\n'(1 (2 x))");

        JsonNode fn = json.value(r.results().get(0));
        assertEquals("a", fn.get("function").get("params").get(0).asText());
        assertEquals(2, fn.get("function").get("params").size());

        JsonNode list = json.value(r.results().get(1));
        assertEquals(1, list.get(0).asInt());
        assertEquals("x", list.get(1).get(1).get("atom").asText());

        assertTrue(json.value(Value.nil()).isNull());
    }

    @Test
    void runResultWithRoutedError() {
        fs.setErrorListener(e -> { });
        ObjectNode out = json.runResult(fs.run("(setq a 2)\n(plus a true)"));

        assertFalse(out.get("blocked").asBoolean());
        assertEquals(0, out.get("results").size());
        assertEquals(2, out.get("env").get("a").asInt());
        assertEquals("TYPE_MISMATCH", out.get("error").get("kind").asText());
        assertEquals(2, out.get("error").get("line").asInt());
    }

    @Test
    void writeProducesParseableJson() throws Exception {
        String text = json.write(json.runResult(fs.run("(plus 1 2)")));
        JsonNode back = new ObjectMapper().readTree(text);
        assertEquals(3, back.get("results").get(0).asInt());
        assertFalse(back.has("error"));
    }
}
