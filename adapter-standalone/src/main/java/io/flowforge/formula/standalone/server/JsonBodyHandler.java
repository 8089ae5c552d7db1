package io.flowforge.formula.standalone.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.flowforge.formula.core.eval.EvaluationContext;
import io.flowforge.formula.core.service.ExpressionService;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base for POST endpoints taking a JSON object body. Enforces the body size limit, parses the
 * body, and writes the subclass's JSON answer with status 200. Bodies that are too large, not
 * JSON, or missing required fields are rejected with a {@link RequestRejectedException}.
 */
abstract class JsonBodyHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(JsonBodyHandler.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    protected final ExpressionService service;
    private final int maxBodyBytes;

    JsonBodyHandler(ExpressionService service, int maxBodyBytes) {
        this.service = service;
        this.maxBodyBytes = maxBodyBytes;
    }

    @Override
    public final void handle(Context ctx) {
        ObjectNode body = readBody(ctx);
        JsonNode response = respond(body, ctx);
        ctx.status(200);
        ctx.contentType("application/json");
        ctx.result(response.toString());
    }

    /** Computes the response body for a well-formed request. */
    protected abstract JsonNode respond(ObjectNode body, Context ctx);

    private ObjectNode readBody(Context ctx) {
        long contentLength = ctx.contentLength();
        if (contentLength > maxBodyBytes) {
            throw tooLarge(ctx, contentLength);
        }
        byte[] bytes = ctx.bodyAsBytes();
        if (bytes.length > maxBodyBytes) {
            throw tooLarge(ctx, bytes.length);
        }
        JsonNode parsed;
        try {
            parsed = MAPPER.readTree(bytes);
        } catch (IOException e) {
            LOG.debug("Rejected malformed JSON body: path={}, error={}", ctx.path(), e.getMessage());
            throw new RequestRejectedException(
                    ProblemDetail.badRequest("Request body is not valid JSON", ctx.path()));
        }
        if (parsed == null || !parsed.isObject()) {
            throw new RequestRejectedException(
                    ProblemDetail.badRequest("Request body must be a JSON object", ctx.path()));
        }
        return (ObjectNode) parsed;
    }

    private RequestRejectedException tooLarge(Context ctx, long size) {
        LOG.warn("Request body too large: path={}, bytes={}, limit={}", ctx.path(), size, maxBodyBytes);
        return new RequestRejectedException(
                ProblemDetail.bodyTooLarge("Request body exceeds " + maxBodyBytes + " bytes", ctx.path()));
    }

    /** A required string field. */
    protected static String requiredText(ObjectNode body, String field, Context ctx) {
        JsonNode value = body.get(field);
        if (value == null || !value.isTextual()) {
            throw new RequestRejectedException(ProblemDetail.badRequest(
                    "Field '" + field + "' is required and must be a string", ctx.path()));
        }
        return value.textValue();
    }

    /** An optional list of strings; {@code null} when absent. */
    protected static List<String> optionalStrings(ObjectNode body, String field, Context ctx) {
        JsonNode value = body.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isArray()) {
            throw new RequestRejectedException(ProblemDetail.badRequest(
                    "Field '" + field + "' must be an array of strings", ctx.path()));
        }
        List<String> result = new ArrayList<>(value.size());
        for (JsonNode item : value) {
            if (!item.isTextual()) {
                throw new RequestRejectedException(ProblemDetail.badRequest(
                        "Field '" + field + "' must be an array of strings", ctx.path()));
            }
            result.add(item.textValue());
        }
        return result;
    }

    /** The optional {@code context} object of a request. */
    protected static EvaluationContext evaluationContext(ObjectNode body, Context ctx) {
        try {
            return EvaluationContext.fromJson(body.get("context"));
        } catch (IllegalArgumentException e) {
            throw new RequestRejectedException(ProblemDetail.badRequest(e.getMessage(), ctx.path()));
        }
    }
}
