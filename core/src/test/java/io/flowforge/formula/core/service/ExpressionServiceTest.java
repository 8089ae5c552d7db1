package io.flowforge.formula.core.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.flowforge.formula.core.calc.CalculatedField;
import io.flowforge.formula.core.calc.RecalculationResult;
import io.flowforge.formula.core.eval.EvaluationContext;
import io.flowforge.formula.core.eval.EvaluationError;
import io.flowforge.formula.core.eval.EvaluationResult;
import io.flowforge.formula.core.function.FunctionCategory;
import io.flowforge.formula.core.function.FunctionRegistry;
import io.flowforge.formula.core.parser.ExpressionLimits;
import io.flowforge.formula.core.parser.ParseError;
import io.flowforge.formula.core.parser.ParseResult;
import io.flowforge.formula.core.service.HighlightToken.Category;
import io.flowforge.formula.core.validate.ValidationError;
import io.flowforge.formula.core.validate.ValidationResult;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ExpressionService")
class ExpressionServiceTest {

    private final ExpressionService service = new ExpressionService();

    private static EvaluationContext order() {
        return EvaluationContext.builder()
                .field("price", 10)
                .field("quantity", 5)
                .build();
    }

    @Nested
    @DisplayName("evaluate")
    class Evaluate {

        @Test
        @DisplayName("parses and evaluates against a context")
        void evaluatesSource() {
            EvaluationResult result = service.evaluate("price * quantity", order());

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.value().asDouble()).isEqualTo(50.0);
        }

        @Test
        @DisplayName("without a context, fields resolve to null")
        void emptyContext() {
            EvaluationResult result = service.evaluate("ISBLANK(missing)");

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.value().asBoolean()).isTrue();
        }

        @Test
        @DisplayName("syntax error comes back as a PARSE failure with its position")
        void syntaxErrorIsParseKind() {
            EvaluationResult result = service.evaluate("1 + * 2");

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.error().kind()).isEqualTo(EvaluationError.Kind.PARSE);
            assertThat(result.error().message()).isEqualTo("Unexpected token '*'");
            assertThat(result.error().position()).isEqualTo(4);
        }

        @Test
        @DisplayName("lexical error is also a PARSE failure")
        void lexErrorIsParseKind() {
            EvaluationResult result = service.evaluate("'open");

            assertThat(result.error().kind()).isEqualTo(EvaluationError.Kind.PARSE);
            assertThat(result.error().message()).startsWith("Unterminated string");
            assertThat(result.error().position()).isZero();
        }

        @Test
        @DisplayName("formula over the length limit is a LIMIT failure")
        void oversizedFormulaIsLimitKind() {
            ExpressionService strict =
                    new ExpressionService(FunctionRegistry.standard(), new ExpressionLimits(10, 2000, 200));

            EvaluationResult result = strict.evaluate("1 + 2 + 3 + 4");

            assertThat(result.error().kind()).isEqualTo(EvaluationError.Kind.LIMIT);
            assertThat(result.error().message()).isEqualTo("Formula exceeds maximum length of 10 characters");
        }

        @Test
        @DisplayName("pre-parsed AST can be evaluated repeatedly")
        void evaluatesCachedAst() {
            ParseResult parsed = service.parse("price * 2");

            EvaluationResult first = service.evaluate(parsed.ast(), order());
            EvaluationResult second = service.evaluate(
                    parsed.ast(), EvaluationContext.builder().field("price", 7).build());

            assertThat(first.value().asDouble()).isEqualTo(20.0);
            assertThat(second.value().asDouble()).isEqualTo(14.0);
        }
    }

    @Nested
    @DisplayName("tokenize")
    class Tokenize {

        @Test
        @DisplayName("classifies every token for highlighting")
        void classifiesTokens() {
            TokenizeResult result = service.tokenize("IF($score >= 50, \"pass\", name)");

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.tokens())
                    .extracting(HighlightToken::category, HighlightToken::value)
                    .containsExactly(
                            tuple(Category.FUNCTION, "IF"),
                            tuple(Category.PUNCTUATION, "("),
                            tuple(Category.VARIABLE, "$score"),
                            tuple(Category.OPERATOR, ">="),
                            tuple(Category.LITERAL, "50"),
                            tuple(Category.PUNCTUATION, ","),
                            tuple(Category.LITERAL, "pass"),
                            tuple(Category.PUNCTUATION, ","),
                            tuple(Category.FIELD, "name"),
                            tuple(Category.PUNCTUATION, ")"));
        }

        @Test
        @DisplayName("keywords are literals and offsets cover the source text")
        void keywordsAndOffsets() {
            TokenizeResult result = service.tokenize("flag ? true : null");

            assertThat(result.tokens())
                    .extracting(HighlightToken::category, HighlightToken::start, HighlightToken::end)
                    .containsExactly(
                            tuple(Category.FIELD, 0, 4),
                            tuple(Category.OPERATOR, 5, 6),
                            tuple(Category.LITERAL, 7, 11),
                            tuple(Category.OPERATOR, 12, 13),
                            tuple(Category.LITERAL, 14, 18));
        }

        @Test
        @DisplayName("an identifier is a function only when a parenthesis follows")
        void functionNeedsParenthesis() {
            TokenizeResult result = service.tokenize("SUM + SUM(1)");

            assertThat(result.tokens().get(0).category()).isEqualTo(Category.FIELD);
            assertThat(result.tokens().get(2).category()).isEqualTo(Category.FUNCTION);
        }

        @Test
        @DisplayName("empty source yields no tokens")
        void emptySource() {
            assertThat(service.tokenize("").tokens()).isEmpty();
            assertThat(service.tokenize(null).isSuccess()).isTrue();
        }

        @Test
        @DisplayName("lexical error yields no tokens and a positioned error")
        void lexError() {
            TokenizeResult result = service.tokenize("1 # 2");

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.tokens()).isEmpty();
            assertThat(result.error().kind()).isEqualTo(ParseError.Kind.LEX);
            assertThat(result.error().message()).isEqualTo("Unexpected character '#'");
            assertThat(result.error().position()).isEqualTo(2);
        }

        @Test
        @DisplayName("source longer than the length limit is rejected before tokenizing")
        void lengthLimit() {
            ExpressionService limited =
                    new ExpressionService(FunctionRegistry.standard(), new ExpressionLimits(10, 2000, 200));

            TokenizeResult result = limited.tokenize("1 + 2 + 3 + 4 + 5 + 6");

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.tokens()).isEmpty();
            assertThat(result.error().kind()).isEqualTo(ParseError.Kind.LIMIT);
            assertThat(result.error().message()).isEqualTo("Formula exceeds maximum length of 10 characters");
            assertThat(limited.tokenize("1 + 2").isSuccess()).isTrue();
        }
    }

    @Nested
    @DisplayName("suggestions")
    class Suggestions {

        @Test
        @DisplayName("functions come first, then fields, then system variables")
        void ordering() {
            List<Suggestion> result = service.suggestions("no", 2, List.of("notes", "total"));

            assertThat(result)
                    .extracting(Suggestion::kind, Suggestion::label)
                    .containsExactly(
                            tuple(Suggestion.Kind.FUNCTION, "NOW"),
                            tuple(Suggestion.Kind.FUNCTION, "NOT"),
                            tuple(Suggestion.Kind.FUNCTION, "NUMBER"),
                            tuple(Suggestion.Kind.FIELD, "notes"),
                            tuple(Suggestion.Kind.VARIABLE, "$now"));
        }

        @Test
        @DisplayName("function candidates insert the opening parenthesis")
        void functionInsertText() {
            Suggestion sum = service.suggestions("su", 2, List.of()).get(0);

            assertThat(sum.label()).isEqualTo("SUM");
            assertThat(sum.insertText()).isEqualTo("SUM(");
            assertThat(sum.cursorOffset()).isEqualTo(1);
            assertThat(sum.category()).isEqualTo("math");
            assertThat(sum.description()).isNotBlank();
        }

        @Test
        @DisplayName("prefix is the word before the cursor")
        void prefixBeforeCursor() {
            List<Suggestion> result = service.suggestions("SUM(pr", 6, List.of("price", "quantity"));

            assertThat(result).extracting(Suggestion::label).containsExactly("PROPER", "price");
        }

        @Test
        @DisplayName("dollar prefix narrows to system variables")
        void dollarPrefix() {
            List<Suggestion> result = service.suggestions("$to", 3, List.of("total"));

            assertThat(result).extracting(Suggestion::label).containsExactly("$today");
        }

        @Test
        @DisplayName("no prefix offers every candidate")
        void noPrefix() {
            List<Suggestion> result = service.suggestions("1 + ", 4, List.of("price"));

            assertThat(result).hasSize(service.listFunctions().size() + 3);
        }

        @Test
        @DisplayName("out-of-range cursor is clamped")
        void clampedCursor() {
            assertThat(service.suggestions("su", 99, null)).extracting(Suggestion::label)
                    .containsExactly("SUM", "SUMIF");
            assertThat(service.suggestions("su", -5, null)).hasSize(service.listFunctions().size() + 2);
        }
    }

    @Nested
    @DisplayName("evaluateBatch")
    class Batch {

        @Test
        @DisplayName("earlier results are visible to later formulas")
        void chainsResults() {
            BatchResult batch = service.evaluateBatch(
                    List.of(
                            new NamedFormula("subtotal", "price * quantity"),
                            new NamedFormula("tax", "subtotal / 10"),
                            new NamedFormula("total", "subtotal + tax")),
                    order());

            assertThat(batch.allSucceeded()).isTrue();
            assertThat(batch.results()).containsOnlyKeys("subtotal", "tax", "total");
            assertThat(batch.result("total").value().asDouble()).isEqualTo(55.0);
        }

        @Test
        @DisplayName("a failure is recorded and the batch continues")
        void failureDoesNotStopBatch() {
            BatchResult batch = service.evaluateBatch(
                    List.of(
                            new NamedFormula("bad", "1 / 0"),
                            new NamedFormula("missing", "ISBLANK(bad)"),
                            new NamedFormula("syntax", "1 +")),
                    null);

            assertThat(batch.allSucceeded()).isFalse();
            assertThat(batch.result("bad").error().kind()).isEqualTo(EvaluationError.Kind.RUNTIME);
            assertThat(batch.result("missing").value().asBoolean()).isTrue();
            assertThat(batch.result("syntax").error().kind()).isEqualTo(EvaluationError.Kind.PARSE);
        }

        @Test
        @DisplayName("results keep submission order")
        void keepsOrder() {
            BatchResult batch = service.evaluateBatch(
                    List.of(new NamedFormula("z", "1"), new NamedFormula("a", "2"), new NamedFormula("m", "3")),
                    EvaluationContext.empty());

            assertThat(batch.results().keySet()).containsExactly("z", "a", "m");
        }
    }

    @Test
    @DisplayName("recalculate orders calculated fields by dependency")
    void recalculate() {
        RecalculationResult result = service.recalculate(
                List.of(
                        new CalculatedField("total", "subtotal + 5"),
                        new CalculatedField("subtotal", "price * quantity")),
                order());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.values().get("subtotal").asDouble()).isEqualTo(50.0);
        assertThat(result.values().get("total").asDouble()).isEqualTo(55.0);
    }

    @Test
    @DisplayName("validate reports unknown fields against the known set")
    void validate() {
        ValidationResult result = service.validate("SUM(price, qty)", Set.of("price"));

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).extracting(ValidationError::type).containsExactly(ValidationError.Type.UNKNOWN_FIELD);
        assertThat(service.validate("SUM(price, qty)").valid()).isTrue();
    }

    @Nested
    @DisplayName("function catalogue")
    class Catalogue {

        @Test
        @DisplayName("lists at least fifty built-ins")
        void listsBuiltins() {
            assertThat(service.listFunctions()).hasSizeGreaterThanOrEqualTo(50);
        }

        @Test
        @DisplayName("looks functions up ignoring case")
        void findsByName() {
            assertThat(service.function("vlookup")).isPresent();
            assertThat(service.function("NOPE")).isEmpty();
        }

        @Test
        @DisplayName("category counts add up to the full list")
        void categoryCounts() {
            int total = service.categories().values().stream().mapToInt(Integer::intValue).sum();

            assertThat(total).isEqualTo(service.listFunctions().size());
            assertThat(service.functionsByCategory(FunctionCategory.LOOKUP))
                    .extracting(f -> f.name())
                    .contains("LOOKUP", "VLOOKUP");
        }
    }

    @Test
    @DisplayName("evaluation never mutates the caller's context")
    void contextUntouched() {
        EvaluationContext ctx = EvaluationContext.builder()
                .field("items", JsonNodeFactory.instance.arrayNode().add(3).add(1).add(2))
                .build();

        service.evaluate("SORT(items)", ctx);

        assertThat(ctx.field("items").toString()).isEqualTo("[3,1,2]");
    }
}
