package io.flowforge.formula.standalone.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.flowforge.formula.core.service.ExpressionService;
import io.javalin.http.Context;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * {@code POST /api/expressions/validate}: {@code {formula, availableFields?}}. Field names are
 * only checked when {@code availableFields} is present.
 */
final class ValidateHandler extends JsonBodyHandler {

    ValidateHandler(ExpressionService service, int maxBodyBytes) {
        super(service, maxBodyBytes);
    }

    @Override
    protected JsonNode respond(ObjectNode body, Context ctx) {
        String formula = requiredText(body, "formula", ctx);
        List<String> fields = optionalStrings(body, "availableFields", ctx);
        return ResultJson.validation(service.validate(formula, fields == null ? null : new LinkedHashSet<>(fields)));
    }
}
