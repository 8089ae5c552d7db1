package io.flowforge.formula.core.function.builtin;

import static io.flowforge.formula.core.value.ValueType.ANY;
import static io.flowforge.formula.core.value.ValueType.ARRAY;
import static io.flowforge.formula.core.value.ValueType.NUMBER;
import static io.flowforge.formula.core.value.ValueType.STRING;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.flowforge.formula.core.function.Arguments;
import io.flowforge.formula.core.function.FunctionCategory;
import io.flowforge.formula.core.function.FunctionDefinition;
import io.flowforge.formula.core.value.Values;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * String built-ins. Lengths and positions count Unicode code points, so an emoji is one
 * character. A null argument reads as the empty string.
 */
public final class TextFunctions {

    private static final Pattern WORD = Pattern.compile("\\b(\\w)(\\w*)", Pattern.UNICODE_CHARACTER_CLASS);

    private TextFunctions() {}

    public static List<FunctionDefinition> definitions() {
        return List.of(
                FunctionDefinition.builder("CONCAT", FunctionCategory.TEXT)
                        .description("Joins values as text; null reads as empty")
                        .optionalVariadic("values", ANY, "Values to join")
                        .returns(STRING)
                        .example("CONCAT(\"Hello\", \" \", \"World\")", "\"Hello World\"")
                        .implementation(TextFunctions::concat)
                        .build(),
                FunctionDefinition.builder("CONCATENATE", FunctionCategory.TEXT)
                        .description("Alias of CONCAT")
                        .optionalVariadic("values", ANY, "Values to join")
                        .returns(STRING)
                        .example("CONCATENATE(firstName, \" \", lastName)", "\"Ada Lovelace\"")
                        .implementation(TextFunctions::concat)
                        .build(),
                FunctionDefinition.builder("UPPER", FunctionCategory.TEXT)
                        .description("Converts text to upper case")
                        .param("text", STRING, "Text to convert")
                        .returns(STRING)
                        .example("UPPER(\"hello\")", "\"HELLO\"")
                        .implementation(args -> Values.text(args.text(0).toUpperCase(Locale.ROOT)))
                        .build(),
                FunctionDefinition.builder("LOWER", FunctionCategory.TEXT)
                        .description("Converts text to lower case")
                        .param("text", STRING, "Text to convert")
                        .returns(STRING)
                        .example("LOWER(\"HELLO\")", "\"hello\"")
                        .implementation(args -> Values.text(args.text(0).toLowerCase(Locale.ROOT)))
                        .build(),
                FunctionDefinition.builder("TRIM", FunctionCategory.TEXT)
                        .description("Removes leading and trailing whitespace")
                        .param("text", STRING, "Text to trim")
                        .returns(STRING)
                        .example("TRIM(\"  hello  \")", "\"hello\"")
                        .implementation(args -> Values.text(args.text(0).strip()))
                        .build(),
                FunctionDefinition.builder("LEFT", FunctionCategory.TEXT)
                        .description("Returns the first characters of text")
                        .param("text", STRING, "Source text")
                        .param("count", NUMBER, "Number of characters")
                        .returns(STRING)
                        .example("LEFT(\"Hello\", 2)", "\"He\"")
                        .implementation(args -> {
                            String text = args.text(0);
                            int count = nonNegative(args, 1);
                            return Values.text(slice(text, 0, count));
                        })
                        .build(),
                FunctionDefinition.builder("RIGHT", FunctionCategory.TEXT)
                        .description("Returns the last characters of text")
                        .param("text", STRING, "Source text")
                        .param("count", NUMBER, "Number of characters")
                        .returns(STRING)
                        .example("RIGHT(\"Hello\", 2)", "\"lo\"")
                        .implementation(args -> {
                            String text = args.text(0);
                            int count = nonNegative(args, 1);
                            int length = length(text);
                            return Values.text(slice(text, Math.max(0, length - count), length));
                        })
                        .build(),
                FunctionDefinition.builder("MID", FunctionCategory.TEXT)
                        .description("Returns characters from the middle of text; start is 1-indexed")
                        .param("text", STRING, "Source text")
                        .param("start", NUMBER, "Position of the first character, from 1")
                        .param("count", NUMBER, "Number of characters")
                        .returns(STRING)
                        .example("MID(\"Hello\", 2, 3)", "\"ell\"")
                        .implementation(args -> {
                            String text = args.text(0);
                            int start = args.integer(1);
                            if (start < 1) {
                                throw args.fail(1, "must be at least 1");
                            }
                            int count = nonNegative(args, 2);
                            long end = (long) start - 1 + count;
                            return Values.text(slice(text, start - 1, (int) Math.min(end, Integer.MAX_VALUE)));
                        })
                        .build(),
                FunctionDefinition.builder("LEN", FunctionCategory.TEXT)
                        .description("Returns the number of characters in text")
                        .param("text", STRING, "Text to measure")
                        .returns(NUMBER)
                        .example("LEN(\"Hello\")", "5")
                        .implementation(args -> Values.number(length(args.text(0))))
                        .build(),
                FunctionDefinition.builder("FIND", FunctionCategory.TEXT)
                        .description("Returns the 1-indexed position of one text inside another, or 0 (case-sensitive)")
                        .param("search", STRING, "Text to look for")
                        .param("within", STRING, "Text to search")
                        .optional("start", NUMBER, "Position to start searching from, from 1 (default 1)")
                        .returns(NUMBER)
                        .example("FIND(\"l\", \"Hello\")", "3")
                        .example("FIND(\"x\", \"Hello\")", "0")
                        .implementation(TextFunctions::find)
                        .build(),
                FunctionDefinition.builder("REPLACE", FunctionCategory.TEXT)
                        .description("Replaces every occurrence of a literal substring")
                        .param("text", STRING, "Source text")
                        .param("search", STRING, "Text to replace")
                        .param("replacement", STRING, "Replacement text")
                        .returns(STRING)
                        .example("REPLACE(\"a-b-c\", \"-\", \"/\")", "\"a/b/c\"")
                        .implementation(args -> {
                            String search = args.text(1);
                            if (search.isEmpty()) {
                                throw args.fail(1, "must not be empty");
                            }
                            return Values.text(args.text(0).replace(search, args.text(2)));
                        })
                        .build(),
                FunctionDefinition.builder("SPLIT", FunctionCategory.TEXT)
                        .description("Splits text on a literal delimiter; an empty delimiter splits into characters")
                        .param("text", STRING, "Text to split")
                        .param("delimiter", STRING, "Delimiter")
                        .returns(ARRAY)
                        .example("SPLIT(\"a,b,c\", \",\")", "[\"a\", \"b\", \"c\"]")
                        .implementation(TextFunctions::split)
                        .build(),
                FunctionDefinition.builder("JOIN", FunctionCategory.TEXT)
                        .description("Joins array elements as text with a delimiter")
                        .param("array", ARRAY, "Values to join")
                        .optional("delimiter", STRING, "Delimiter (default \",\")")
                        .returns(STRING)
                        .example("JOIN([\"a\", \"b\"], \"-\")", "\"a-b\"")
                        .implementation(args -> {
                            String delimiter = args.textOr(1, ",");
                            ArrayNode array = args.array(0);
                            StringBuilder sb = new StringBuilder();
                            for (int i = 0; i < array.size(); i++) {
                                if (i > 0) {
                                    sb.append(delimiter);
                                }
                                sb.append(Values.toText(array.get(i)));
                            }
                            return Values.text(sb.toString());
                        })
                        .build(),
                FunctionDefinition.builder("PROPER", FunctionCategory.TEXT)
                        .description("Title-cases text: first letter of each word upper, the rest lower")
                        .param("text", STRING, "Text to convert")
                        .returns(STRING)
                        .example("PROPER(\"hello WORLD\")", "\"Hello World\"")
                        .implementation(args -> Values.text(WORD.matcher(args.text(0))
                                .replaceAll(m -> m.group(1).toUpperCase(Locale.ROOT)
                                        + m.group(2).toLowerCase(Locale.ROOT))))
                        .build(),
                FunctionDefinition.builder("TEXT", FunctionCategory.TEXT)
                        .description("Formats a number with a decimal pattern, or a date with YYYY MM DD HH mm ss tokens")
                        .param("value", ANY, "Value to format")
                        .param("format", STRING, "Format pattern")
                        .returns(STRING)
                        .example("TEXT(1234.5, \"#,##0.00\")", "\"1,234.50\"")
                        .example("TEXT(\"2024-01-15\", \"DD/MM/YYYY\")", "\"15/01/2024\"")
                        .implementation(TextFunctions::format)
                        .build());
    }

    private static JsonNode concat(Arguments args) {
        return Values.text(args.all().stream().map(Values::toText).collect(Collectors.joining()));
    }

    private static JsonNode find(Arguments args) {
        String search = args.text(0);
        String within = args.text(1);
        int start = args.integerOr(2, 1);
        int length = length(within);
        if (start < 1 || start > length + 1) {
            throw args.fail(2, "must be between 1 and " + (length + 1));
        }
        int from = within.offsetByCodePoints(0, start - 1);
        int index = within.indexOf(search, from);
        return Values.number(index < 0 ? 0 : within.codePointCount(0, index) + 1);
    }

    private static JsonNode split(Arguments args) {
        String text = args.text(0);
        String delimiter = args.text(1);
        ArrayNode out = JsonNodeFactory.instance.arrayNode();
        if (delimiter.isEmpty()) {
            text.codePoints().forEach(cp -> out.add(new String(Character.toChars(cp))));
            return out;
        }
        for (String part : text.split(Pattern.quote(delimiter), -1)) {
            out.add(part);
        }
        return out;
    }

    private static JsonNode format(Arguments args) {
        JsonNode value = args.get(0);
        String pattern = args.text(1);
        if (value.isNumber() && (pattern.indexOf('#') >= 0 || pattern.indexOf('0') >= 0)) {
            try {
                DecimalFormat decimal = new DecimalFormat(pattern, DecimalFormatSymbols.getInstance(Locale.ROOT));
                decimal.setRoundingMode(RoundingMode.HALF_UP);
                return Values.text(decimal.format(value.decimalValue()));
            } catch (IllegalArgumentException e) {
                throw args.fail(1, "is not a valid number format: " + e.getMessage());
            }
        }
        if (value.isTextual() && DateSupport.isDate(value)) {
            LocalDateTime t = DateSupport.parse(args, 0).dateTime();
            return Values.text(pattern.replace("YYYY", String.format("%04d", t.getYear()))
                    .replace("MM", pad(t.getMonthValue()))
                    .replace("DD", pad(t.getDayOfMonth()))
                    .replace("HH", pad(t.getHour()))
                    .replace("mm", pad(t.getMinute()))
                    .replace("ss", pad(t.getSecond())));
        }
        return Values.text(Values.toText(value));
    }

    private static String pad(int n) {
        return n < 10 ? "0" + n : Integer.toString(n);
    }

    private static int nonNegative(Arguments args, int index) {
        int n = args.integer(index);
        if (n < 0) {
            throw args.fail(index, "must not be negative");
        }
        return n;
    }

    static int length(String text) {
        return text.codePointCount(0, text.length());
    }

    /** Substring by code point range, clamped to the text. */
    static String slice(String text, int fromCodePoint, int toCodePoint) {
        int length = length(text);
        int from = Math.min(Math.max(fromCodePoint, 0), length);
        int to = Math.min(Math.max(toCodePoint, from), length);
        return text.substring(text.offsetByCodePoints(0, from), text.offsetByCodePoints(0, to));
    }
}
