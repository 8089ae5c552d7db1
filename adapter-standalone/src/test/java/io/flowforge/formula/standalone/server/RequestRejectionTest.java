package io.flowforge.formula.standalone.server;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import io.flowforge.formula.standalone.config.ServerConfig;
import java.net.http.HttpResponse;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/** Malformed requests are answered with RFC 9457 problem details before reaching the engine. */
@DisplayName("Request rejection")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class RequestRejectionTest extends FormulaServerTestHarness {

    private static final String EVALUATE = "/api/expressions/evaluate";

    @BeforeAll
    void startServer() {
        start(ServerConfig.builder().maxBodyBytes(256));
    }

    @AfterAll
    void stopServer() {
        stop();
    }

    private JsonNode assertProblem(HttpResponse<String> response, int status, String type) throws Exception {
        assertThat(response.statusCode()).isEqualTo(status);
        assertThat(response.headers().firstValue("Content-Type")).hasValueSatisfying(
                ct -> assertThat(ct).startsWith("application/problem+json"));
        JsonNode problem = MAPPER.readTree(response.body());
        assertThat(problem.get("type").asText()).isEqualTo(type);
        assertThat(problem.get("status").asInt()).isEqualTo(status);
        return problem;
    }

    @Test
    @DisplayName("invalid JSON → 400")
    void invalidJson() throws Exception {
        JsonNode problem = assertProblem(post(EVALUATE, "{not json"), 400, ProblemDetail.URN_BAD_REQUEST);

        assertThat(problem.get("detail").asText()).isEqualTo("Request body is not valid JSON");
        assertThat(problem.get("instance").asText()).isEqualTo(EVALUATE);
    }

    @Test
    @DisplayName("JSON that is not an object → 400")
    void notAnObject() throws Exception {
        JsonNode problem = assertProblem(post(EVALUATE, "[1, 2]"), 400, ProblemDetail.URN_BAD_REQUEST);

        assertThat(problem.get("detail").asText()).isEqualTo("Request body must be a JSON object");
    }

    @ParameterizedTest(name = "{0}")
    @CsvSource(
            delimiter = '|',
            quoteCharacter = '`',
            value = {
                "{}                                               | Field 'formula' is required and must be a string",
                "{\"formula\": 42}                                | Field 'formula' is required and must be a string",
                "{\"formula\": \"1\", \"context\": []}            | context must be a JSON object",
                "{\"formula\": \"1\", \"context\": {\"fields\": 1}} | context.fields must be a JSON object",
            })
    @DisplayName("bad evaluate requests → 400 with a reason")
    void badEvaluateRequests(String body, String detail) throws Exception {
        JsonNode problem = assertProblem(post(EVALUATE, body), 400, ProblemDetail.URN_BAD_REQUEST);

        assertThat(problem.get("detail").asText()).isEqualTo(detail);
    }

    @Test
    @DisplayName("batch without a formulas array → 400")
    void batchWithoutFormulas() throws Exception {
        JsonNode problem = assertProblem(
                post("/api/expressions/evaluate/batch", "{\"formulas\": {}}"), 400, ProblemDetail.URN_BAD_REQUEST);

        assertThat(problem.get("detail").asText()).isEqualTo("Field 'formulas' is required and must be an array");
    }

    @Test
    @DisplayName("non-string field list → 400")
    void badFieldList() throws Exception {
        JsonNode problem = assertProblem(
                post("/api/expressions/validate", "{\"formula\": \"a\", \"availableFields\": [1]}"),
                400,
                ProblemDetail.URN_BAD_REQUEST);

        assertThat(problem.get("detail").asText()).isEqualTo("Field 'availableFields' must be an array of strings");
    }

    @Test
    @DisplayName("fractional suggestion position → 400")
    void badPosition() throws Exception {
        assertProblem(
                post("/api/expressions/suggestions", "{\"formula\": \"SU\", \"position\": 1.5}"),
                400,
                ProblemDetail.URN_BAD_REQUEST);
    }

    @Test
    @DisplayName("body over the limit → 413")
    void bodyTooLarge() throws Exception {
        String formula = "1" + " + 1".repeat(100);

        JsonNode problem = assertProblem(
                post(EVALUATE, "{\"formula\": \"" + formula + "\"}"), 413, ProblemDetail.URN_BODY_TOO_LARGE);

        assertThat(problem.get("detail").asText()).isEqualTo("Request body exceeds 256 bytes");
    }
}
