package io.flowforge.formula.standalone.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.flowforge.formula.core.service.ExpressionService;
import io.javalin.http.Context;

/** {@code POST /api/expressions/tokenize}: highlighting tokens for an editor. */
final class TokenizeHandler extends JsonBodyHandler {

    TokenizeHandler(ExpressionService service, int maxBodyBytes) {
        super(service, maxBodyBytes);
    }

    @Override
    protected JsonNode respond(ObjectNode body, Context ctx) {
        return ResultJson.tokens(service.tokenize(requiredText(body, "formula", ctx)));
    }
}
