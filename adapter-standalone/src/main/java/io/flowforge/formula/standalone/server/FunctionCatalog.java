package io.flowforge.formula.standalone.server;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.flowforge.formula.core.function.FunctionCategory;
import io.flowforge.formula.core.function.FunctionDefinition;
import io.flowforge.formula.core.service.ExpressionService;
import io.javalin.http.Context;
import java.util.List;

/** Read-only GET endpoints describing the function library. */
final class FunctionCatalog {

    private final ExpressionService service;

    FunctionCatalog(ExpressionService service) {
        this.service = service;
    }

    /** {@code GET /api/expressions/functions}. */
    void list(Context ctx) {
        List<FunctionDefinition> functions = service.listFunctions();
        ObjectNode json = JsonNodeFactory.instance.objectNode();
        json.put("count", functions.size());
        json.set("functions", ResultJson.functions(functions));
        write(ctx, json);
    }

    /** {@code GET /api/expressions/functions/categories}. */
    void categories(Context ctx) {
        ObjectNode json = JsonNodeFactory.instance.objectNode();
        ArrayNode categories = json.putArray("categories");
        service.categories().forEach((category, count) ->
                categories.addObject().put("name", category.label()).put("count", count));
        write(ctx, json);
    }

    /** {@code GET /api/expressions/functions/category/{category}}. */
    void byCategory(Context ctx) {
        String label = ctx.pathParam("category");
        FunctionCategory category = FunctionCategory.fromLabel(label)
                .orElseThrow(() -> new RequestRejectedException(
                        ProblemDetail.badRequest("Unknown function category '" + label + "'", ctx.path())));
        List<FunctionDefinition> functions = service.functionsByCategory(category);
        ObjectNode json = JsonNodeFactory.instance.objectNode();
        json.put("category", category.label());
        json.put("count", functions.size());
        json.set("functions", ResultJson.functions(functions));
        write(ctx, json);
    }

    /** {@code GET /api/expressions/functions/{name}}. */
    void one(Context ctx) {
        String name = ctx.pathParam("name");
        FunctionDefinition function = service.function(name)
                .orElseThrow(() -> new RequestRejectedException(
                        ProblemDetail.notFound("Unknown function '" + name + "'", ctx.path())));
        write(ctx, ResultJson.function(function));
    }

    private static void write(Context ctx, ObjectNode json) {
        ctx.status(200);
        ctx.contentType("application/json");
        ctx.result(json.toString());
    }
}
