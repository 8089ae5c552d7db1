package io.flowforge.formula.standalone.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.flowforge.formula.core.service.ExpressionService;
import io.javalin.http.Context;

/** {@code POST /api/expressions/evaluate}: {@code {formula, context?}} to an evaluation result. */
final class EvaluateHandler extends JsonBodyHandler {

    EvaluateHandler(ExpressionService service, int maxBodyBytes) {
        super(service, maxBodyBytes);
    }

    @Override
    protected JsonNode respond(ObjectNode body, Context ctx) {
        String formula = requiredText(body, "formula", ctx);
        return ResultJson.evaluation(service.evaluate(formula, evaluationContext(body, ctx)));
    }
}
