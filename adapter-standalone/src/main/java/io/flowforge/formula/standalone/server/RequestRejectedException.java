package io.flowforge.formula.standalone.server;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Raised by handlers to answer with a problem-details response instead of a result. The
 * application turns it into {@code application/problem+json} with the problem's status.
 */
public final class RequestRejectedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient JsonNode problem;

    public RequestRejectedException(JsonNode problem) {
        super(problem.path("detail").asText());
        this.problem = problem;
    }

    public JsonNode problem() {
        return problem;
    }

    public int status() {
        return problem.path("status").asInt(500);
    }
}
