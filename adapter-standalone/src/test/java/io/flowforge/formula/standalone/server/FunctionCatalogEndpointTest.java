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

/** GET endpoints describing the function library. */
@DisplayName("Function catalogue endpoints")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class FunctionCatalogEndpointTest extends FormulaServerTestHarness {

    private static final String FUNCTIONS = "/api/expressions/functions";

    @BeforeAll
    void startServer() {
        start(ServerConfig.builder());
    }

    @AfterAll
    void stopServer() {
        stop();
    }

    @Test
    @DisplayName("lists every function with its documentation")
    void listsFunctions() throws Exception {
        JsonNode body = getJson(FUNCTIONS);

        assertThat(body.get("count").asInt()).isGreaterThanOrEqualTo(50).isEqualTo(body.get("functions").size());
        assertThat(body.get("functions")).allSatisfy(fn -> {
            assertThat(fn.get("name").asText()).isNotBlank();
            assertThat(fn.get("examples")).isNotEmpty();
            assertThat(fn.get("returnType").asText()).isNotBlank();
        });
    }

    @Test
    @DisplayName("categories come with counts in a fixed order")
    void categories() throws Exception {
        JsonNode categories = getJson(FUNCTIONS + "/categories").get("categories");

        assertThat(categories)
                .extracting(c -> c.get("name").asText())
                .containsExactly("math", "text", "date", "logic", "aggregate", "array", "lookup", "conversion");
        int total = 0;
        for (JsonNode c : categories) {
            total += c.get("count").asInt();
        }
        assertThat(total).isEqualTo(getJson(FUNCTIONS).get("count").asInt());
    }

    @Test
    @DisplayName("filters by category ignoring case")
    void byCategory() throws Exception {
        JsonNode body = getJson(FUNCTIONS + "/category/LOOKUP");

        assertThat(body.get("category").asText()).isEqualTo("lookup");
        assertThat(body.get("functions")).extracting(f -> f.get("name").asText()).contains("LOOKUP", "VLOOKUP");
    }

    @Test
    @DisplayName("unknown category is a bad request")
    void unknownCategory() throws Exception {
        HttpResponse<String> response = get(FUNCTIONS + "/category/astrology");

        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(MAPPER.readTree(response.body()).get("detail").asText())
                .isEqualTo("Unknown function category 'astrology'");
    }

    @Test
    @DisplayName("describes one function by name ignoring case")
    void oneFunction() throws Exception {
        JsonNode fn = getJson(FUNCTIONS + "/round");

        assertThat(fn.get("name").asText()).isEqualTo("ROUND");
        assertThat(fn.get("category").asText()).isEqualTo("math");
        assertThat(fn.get("signature").asText()).isEqualTo("ROUND(number, [digits])");
        assertThat(fn.get("parameters")).extracting(p -> p.get("required").asBoolean()).containsExactly(true, false);
    }

    @Test
    @DisplayName("unknown function is not found")
    void unknownFunction() throws Exception {
        HttpResponse<String> response = get(FUNCTIONS + "/NOPE");

        assertThat(response.statusCode()).isEqualTo(404);
        assertThat(response.headers().firstValue("Content-Type")).hasValueSatisfying(
                ct -> assertThat(ct).startsWith("application/problem+json"));
        JsonNode problem = MAPPER.readTree(response.body());
        assertThat(problem.get("type").asText()).isEqualTo(ProblemDetail.URN_NOT_FOUND);
        assertThat(problem.get("instance").asText()).isEqualTo(FUNCTIONS + "/NOPE");
    }
}
