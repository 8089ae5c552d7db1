package io.flowforge.formula.standalone.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Builds RFC 9457 problem details for requests the server rejects before they reach the
 * engine: malformed JSON, missing fields, oversized bodies, unknown functions or categories.
 *
 * <pre>{@code
 * {
 *   "type": "urn:flowforge:formula-server:bad-request",
 *   "title": "Bad Request",
 *   "status": 400,
 *   "detail": "Field 'formula' is required",
 *   "instance": "/api/expressions/evaluate"
 * }
 * }</pre>
 *
 * Formula errors are not problems: they are regular 200 responses with {@code success:false}.
 */
public final class ProblemDetail {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String URN_BAD_REQUEST = "urn:flowforge:formula-server:bad-request";
    static final String URN_BODY_TOO_LARGE = "urn:flowforge:formula-server:body-too-large";
    static final String URN_NOT_FOUND = "urn:flowforge:formula-server:not-found";
    static final String URN_INTERNAL_ERROR = "urn:flowforge:formula-server:internal-error";

    private ProblemDetail() {
        // utility class
    }

    public static JsonNode badRequest(String detail, String instancePath) {
        return build(URN_BAD_REQUEST, "Bad Request", 400, detail, instancePath);
    }

    public static JsonNode bodyTooLarge(String detail, String instancePath) {
        return build(URN_BODY_TOO_LARGE, "Payload Too Large", 413, detail, instancePath);
    }

    public static JsonNode notFound(String detail, String instancePath) {
        return build(URN_NOT_FOUND, "Not Found", 404, detail, instancePath);
    }

    public static JsonNode internalError(String detail, String instancePath) {
        return build(URN_INTERNAL_ERROR, "Internal Server Error", 500, detail, instancePath);
    }

    static JsonNode build(String type, String title, int status, String detail, String instancePath) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", type);
        node.put("title", title);
        node.put("status", status);
        node.put("detail", detail);
        if (instancePath != null) {
            node.put("instance", instancePath);
        } else {
            node.putNull("instance");
        }
        return node;
    }
}
