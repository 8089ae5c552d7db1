package io.flowforge.formula.standalone.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.flowforge.formula.core.service.ExpressionService;
import io.javalin.http.Context;

/** {@code POST /api/expressions/parse}: the syntax tree and its canonical form, or the parse error. */
final class ParseHandler extends JsonBodyHandler {

    ParseHandler(ExpressionService service, int maxBodyBytes) {
        super(service, maxBodyBytes);
    }

    @Override
    protected JsonNode respond(ObjectNode body, Context ctx) {
        return ResultJson.parse(service.parse(requiredText(body, "formula", ctx)));
    }
}
