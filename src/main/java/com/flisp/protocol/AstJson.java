package com.flisp.protocol;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flisp.script.RunResult;
import com.flisp.script.parser.Diagnostic;
import com.flisp.script.parser.Element;
import com.flisp.script.parser.Node;
import com.flisp.script.parser.Token;
import com.flisp.script.parser.Value;

/**
 * JSON views of pipeline artifacts for tooling.
 *
 * Atoms are objects ({"atom":"x"}) so they can't be confused with strings;
 * numbers, booleans and null map to the JSON scalars; lists map to arrays.
 */
public final class AstJson {

    private final ObjectMapper om = new ObjectMapper();

    public ArrayNode tokens(List<Token> tokens) {
        ArrayNode out = om.createArrayNode();
        for (Token t : tokens) {
            ObjectNode n = out.addObject();
            n.put("type", t.type.name());
            n.put("lexeme", t.lexeme);
        }
        return out;
    }

    public JsonNode element(Element e) {
        switch (e.getType()) {
            case ATOM: {
                ObjectNode n = om.createObjectNode();
                n.put("atom", e.asAtom());
                return n;
            }
            case INTEGER: return om.getNodeFactory().numberNode(e.asInteger());
            case REAL: return om.getNodeFactory().numberNode(e.asReal());
            case BOOL: return om.getNodeFactory().booleanNode(e.asBool());
            case NULL: return om.getNodeFactory().nullNode();
            case LIST: {
                ArrayNode arr = om.createArrayNode();
                for (Element child : e.asList()) arr.add(element(child));
                return arr;
            }
            default:
                throw new IllegalStateException("Unknown element type: " + e.getType());
        }
    }

    public ArrayNode nodes(List<Node> nodes) {
        ArrayNode out = om.createArrayNode();
        for (Node node : nodes) {
            ObjectNode n = out.addObject();
            n.put("line", node.line);
            n.set("element", element(node.element));
        }
        return out;
    }

    public ArrayNode diagnostics(List<Diagnostic> diagnostics) {
        ArrayNode out = om.createArrayNode();
        for (Diagnostic d : diagnostics) {
            ObjectNode n = out.addObject();
            n.put("phase", d.phase.name());
            n.put("line", d.line);
            n.put("message", d.message);
        }
        return out;
    }

    public JsonNode value(Value v) {
        if (v.getType() == Value.Type.FUNC) {
            ObjectNode n = om.createObjectNode();
            ObjectNode fn = n.putObject("function");
            ArrayNode params = fn.putArray("params");
            for (String p : v.asFunc().params()) params.add(p);
            return n;
        }
        if (v.getType() == Value.Type.LIST) {
            ArrayNode arr = om.createArrayNode();
            for (Value item : v.asList()) arr.add(value(item));
            return arr;
        }
        return element(v.toElement());
    }

    public ObjectNode runResult(RunResult result) {
        ObjectNode out = om.createObjectNode();
        out.set("syntax", diagnostics(result.syntaxDiagnostics()));
        out.set("semantic", diagnostics(result.semanticDiagnostics()));
        out.put("blocked", result.isBlocked());

        ArrayNode results = out.putArray("results");
        for (Value v : result.printable()) results.add(value(v));

        ObjectNode env = out.putObject("env");
        for (Map.Entry<String, Value> e : result.env().entrySet()) env.set(e.getKey(), value(e.getValue()));

        if (result.error() != null) {
            ObjectNode err = out.putObject("error");
            err.put("kind", result.error().kind().name());
            err.put("line", result.error().line());
            err.put("message", result.error().getMessage());
        }
        return out;
    }

    public String write(JsonNode node) {
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize JSON: " + e.getMessage(), e);
        }
    }
}
