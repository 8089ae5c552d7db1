package io.flowforge.formula.standalone.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.flowforge.formula.core.service.ExpressionService;
import io.javalin.http.Context;
import java.util.List;

/**
 * {@code POST /api/expressions/suggestions}: {@code {formula, position?, availableFields?}}. The
 * position defaults to the end of the formula.
 */
final class SuggestionsHandler extends JsonBodyHandler {

    SuggestionsHandler(ExpressionService service, int maxBodyBytes) {
        super(service, maxBodyBytes);
    }

    @Override
    protected JsonNode respond(ObjectNode body, Context ctx) {
        String formula = requiredText(body, "formula", ctx);
        JsonNode position = body.get("position");
        int cursor = formula.length();
        if (position != null && !position.isNull()) {
            if (!position.canConvertToInt() || !position.isIntegralNumber()) {
                throw new RequestRejectedException(
                        ProblemDetail.badRequest("Field 'position' must be an integer", ctx.path()));
            }
            cursor = position.intValue();
        }
        List<String> fields = optionalStrings(body, "availableFields", ctx);
        return ResultJson.suggestions(service.suggestions(formula, cursor, fields == null ? List.of() : fields));
    }
}
