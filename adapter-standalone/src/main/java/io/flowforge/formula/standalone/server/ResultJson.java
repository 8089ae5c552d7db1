package io.flowforge.formula.standalone.server;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.flowforge.formula.core.ast.AstJson;
import io.flowforge.formula.core.ast.AstPrinter;
import io.flowforge.formula.core.eval.EvaluationError;
import io.flowforge.formula.core.eval.EvaluationResult;
import io.flowforge.formula.core.function.FunctionDefinition;
import io.flowforge.formula.core.function.FunctionExample;
import io.flowforge.formula.core.function.FunctionParameter;
import io.flowforge.formula.core.parser.ParseError;
import io.flowforge.formula.core.parser.ParseResult;
import io.flowforge.formula.core.service.HighlightToken;
import io.flowforge.formula.core.service.Suggestion;
import io.flowforge.formula.core.service.TokenizeResult;
import io.flowforge.formula.core.validate.ValidationError;
import io.flowforge.formula.core.validate.ValidationResult;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/** JSON wire shapes of the engine's result objects. Enum names are written in lower case. */
final class ResultJson {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private ResultJson() {}

    static ObjectNode evaluation(EvaluationResult result) {
        ObjectNode json = NODES.objectNode();
        json.put("success", result.isSuccess());
        if (result.isSuccess()) {
            json.set("value", result.value());
            json.put("type", result.type().label());
        } else {
            json.set("error", evaluationError(result.error()));
        }
        return json;
    }

    private static ObjectNode evaluationError(EvaluationError error) {
        ObjectNode json = NODES.objectNode();
        json.put("kind", lower(error.kind()));
        json.put("message", error.message());
        if (error.position() >= 0) {
            json.put("position", error.position());
        }
        if (error.functionName() != null) {
            json.put("functionName", error.functionName());
        }
        if (error.argumentIndex() != null) {
            json.put("argumentIndex", error.argumentIndex());
        }
        return json;
    }

    static ObjectNode validation(ValidationResult result) {
        ObjectNode json = NODES.objectNode();
        json.put("valid", result.valid());
        ArrayNode errors = json.putArray("errors");
        for (ValidationError error : result.errors()) {
            ObjectNode e = errors.addObject();
            e.put("type", lower(error.type()));
            e.put("message", error.message());
            e.put("start", error.start());
            e.put("end", error.end());
        }
        json.set("referencedFields", strings(result.referencedFields()));
        json.set("referencedFunctions", strings(result.referencedFunctions()));
        return json;
    }

    static ObjectNode parse(ParseResult result) {
        ObjectNode json = NODES.objectNode();
        json.put("success", result.isSuccess());
        if (result.isSuccess()) {
            json.set("ast", AstJson.toJson(result.ast()));
            json.put("canonical", AstPrinter.print(result.ast()));
            json.put("nodeCount", result.nodeCount());
            json.put("depth", result.depth());
        } else {
            json.set("error", parseError(result.error()));
        }
        return json;
    }

    static ObjectNode parseError(ParseError error) {
        ObjectNode json = NODES.objectNode();
        json.put("kind", lower(error.kind()));
        json.put("message", error.message());
        json.put("position", error.position());
        json.put("line", error.line());
        json.put("column", error.column());
        json.put("snippet", error.snippet());
        return json;
    }

    static ObjectNode tokens(TokenizeResult result) {
        ObjectNode json = NODES.objectNode();
        json.put("success", result.isSuccess());
        ArrayNode tokens = json.putArray("tokens");
        for (HighlightToken token : result.tokens()) {
            ObjectNode t = tokens.addObject();
            t.put("type", lower(token.category()));
            t.put("value", token.value());
            t.put("start", token.start());
            t.put("end", token.end());
        }
        if (!result.isSuccess()) {
            json.set("error", parseError(result.error()));
        }
        return json;
    }

    static ObjectNode suggestions(List<Suggestion> suggestions) {
        ObjectNode json = NODES.objectNode();
        ArrayNode array = json.putArray("suggestions");
        for (Suggestion s : suggestions) {
            ObjectNode item = array.addObject();
            item.put("type", lower(s.kind()));
            item.put("label", s.label());
            if (s.description() != null) {
                item.put("description", s.description());
            }
            if (s.category() != null) {
                item.put("category", s.category());
            }
            item.put("insertText", s.insertText());
            item.put("cursorOffset", s.cursorOffset());
        }
        return json;
    }

    static ObjectNode function(FunctionDefinition fn) {
        ObjectNode json = NODES.objectNode();
        json.put("name", fn.name());
        json.put("category", fn.category().label());
        json.put("description", fn.description());
        json.put("signature", fn.signature());
        ArrayNode params = json.putArray("parameters");
        for (FunctionParameter p : fn.parameters()) {
            ObjectNode param = params.addObject();
            param.put("name", p.name());
            param.put("type", p.type().label());
            param.put("required", p.required());
            param.put("variadic", p.variadic());
            param.put("description", p.description());
        }
        json.put("returnType", fn.returnType().label());
        ArrayNode examples = json.putArray("examples");
        for (FunctionExample example : fn.examples()) {
            examples.addObject().put("call", example.call()).put("expected", example.expected());
        }
        return json;
    }

    static ArrayNode functions(Collection<FunctionDefinition> functions) {
        ArrayNode array = NODES.arrayNode();
        functions.forEach(fn -> array.add(function(fn)));
        return array;
    }

    private static ArrayNode strings(Collection<String> values) {
        ArrayNode array = NODES.arrayNode();
        values.forEach(array::add);
        return array;
    }

    private static String lower(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
