package io.flowforge.formula.core.function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.flowforge.formula.core.value.ValueType;
import io.flowforge.formula.core.value.Values;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FunctionRegistry")
class FunctionRegistryTest {

    private final FunctionRegistry registry = FunctionRegistry.standard();

    @Test
    @DisplayName("Standard registry carries at least 50 documented functions")
    void standardCatalogue() {
        assertThat(registry.size()).isGreaterThanOrEqualTo(50);
        assertThat(registry.list()).allSatisfy(fn -> {
            assertThat(fn.description()).as(fn.name()).isNotBlank();
            assertThat(fn.examples()).as(fn.name()).isNotEmpty();
            assertThat(fn.returnType()).as(fn.name()).isNotNull();
        });
    }

    @Test
    @DisplayName("Every category is represented")
    void everyCategory() {
        Map<FunctionCategory, Integer> categories = registry.categories();

        assertThat(categories.keySet()).containsExactly(FunctionCategory.values());
        assertThat(categories.values().stream().mapToInt(Integer::intValue).sum()).isEqualTo(registry.size());
    }

    @Test
    @DisplayName("Well-known functions are present in their categories")
    void wellKnown() {
        assertThat(registry.byCategory(FunctionCategory.MATH))
                .extracting(FunctionDefinition::name)
                .contains("SUM", "AVERAGE", "ROUND", "SQRT");
        assertThat(registry.byCategory(FunctionCategory.LOOKUP))
                .extracting(FunctionDefinition::name)
                .containsExactly("LOOKUP", "VLOOKUP");
        assertThat(registry.names()).contains("IF", "IFS", "CONCAT", "DATEADD", "UNIQUE", "JSON_PARSE", "COUNTIF");
    }

    @Test
    @DisplayName("Lookup ignores case")
    void caseInsensitiveLookup() {
        assertThat(registry.find("sum")).isPresent();
        assertThat(registry.find("Sum").orElseThrow().name()).isEqualTo("SUM");
        assertThat(registry.contains("nope")).isFalse();
        assertThat(registry.find(null)).isEmpty();
    }

    @Test
    @DisplayName("Duplicate names are rejected, regardless of case")
    void duplicates() {
        FunctionDefinition first = FunctionDefinition.builder("ECHO", FunctionCategory.TEXT)
                .param("value", ValueType.ANY, "Value")
                .example("ECHO(1)", "1")
                .implementation(args -> args.get(0))
                .build();
        FunctionDefinition second = FunctionDefinition.builder("echo", FunctionCategory.LOGIC)
                .example("ECHO()", "null")
                .implementation(args -> Values.nullValue())
                .build();

        assertThatThrownBy(() -> FunctionRegistry.builder().register(first).register(second))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("duplicate function name: ECHO");
    }

    @Test
    @DisplayName("Custom registries keep registration order and omit empty categories")
    void customRegistry() {
        FunctionRegistry custom = FunctionRegistry.builder()
                .registerAll(List.of(
                        FunctionDefinition.builder("B_FN", FunctionCategory.TEXT)
                                .example("B_FN()", "null")
                                .implementation(args -> Values.nullValue())
                                .build(),
                        FunctionDefinition.builder("A_FN", FunctionCategory.TEXT)
                                .example("A_FN()", "null")
                                .implementation(args -> Values.nullValue())
                                .build()))
                .build();

        assertThat(custom.list()).extracting(FunctionDefinition::name).containsExactly("B_FN", "A_FN");
        assertThat(custom.categories()).containsOnlyKeys(FunctionCategory.TEXT);
        assertThat(custom.byCategory(FunctionCategory.MATH)).isEmpty();
    }

    @Test
    @DisplayName("Category labels resolve case-insensitively")
    void categoryLabels() {
        assertThat(FunctionCategory.fromLabel(" Math ")).contains(FunctionCategory.MATH);
        assertThat(FunctionCategory.fromLabel("nope")).isEmpty();
        assertThat(FunctionCategory.CONVERSION.label()).isEqualTo("conversion");
    }
}
