package io.flowforge.formula.standalone.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.flowforge.formula.core.service.BatchResult;
import io.flowforge.formula.core.service.ExpressionService;
import io.flowforge.formula.core.service.NamedFormula;
import io.javalin.http.Context;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code POST /api/expressions/evaluate/batch}: {@code {formulas:[{id, formula}], context?}}.
 * Later formulas see earlier results as fields named by id.
 */
final class BatchEvaluateHandler extends JsonBodyHandler {

    BatchEvaluateHandler(ExpressionService service, int maxBodyBytes) {
        super(service, maxBodyBytes);
    }

    @Override
    protected JsonNode respond(ObjectNode body, Context ctx) {
        JsonNode formulas = body.get("formulas");
        if (formulas == null || !formulas.isArray()) {
            throw new RequestRejectedException(
                    ProblemDetail.badRequest("Field 'formulas' is required and must be an array", ctx.path()));
        }
        List<NamedFormula> named = new ArrayList<>(formulas.size());
        for (JsonNode item : formulas) {
            if (!item.isObject() || !item.path("id").isTextual() || !item.path("formula").isTextual()) {
                throw new RequestRejectedException(ProblemDetail.badRequest(
                        "Each entry of 'formulas' needs string fields 'id' and 'formula'", ctx.path()));
            }
            named.add(new NamedFormula(item.get("id").textValue(), item.get("formula").textValue()));
        }
        BatchResult batch = service.evaluateBatch(named, evaluationContext(body, ctx));
        ObjectNode json = JsonNodeFactory.instance.objectNode();
        ObjectNode results = json.putObject("results");
        batch.results().forEach((id, result) -> results.set(id, ResultJson.evaluation(result)));
        json.put("allSucceeded", batch.allSucceeded());
        return json;
    }
}
