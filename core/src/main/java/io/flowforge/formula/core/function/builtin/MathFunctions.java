package io.flowforge.formula.core.function.builtin;

import static io.flowforge.formula.core.value.ValueType.NUMBER;

import io.flowforge.formula.core.function.FunctionCategory;
import io.flowforge.formula.core.function.FunctionDefinition;
import io.flowforge.formula.core.value.Values;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/** Arithmetic built-ins. */
public final class MathFunctions {

    private MathFunctions() {}

    public static List<FunctionDefinition> definitions() {
        return List.of(
                FunctionDefinition.builder("SUM", FunctionCategory.MATH)
                        .description("Adds all numbers together; arrays are flattened and blanks ignored")
                        .variadic("values", NUMBER, "Numbers or arrays of numbers to add")
                        .returns(NUMBER)
                        .example("SUM(1, 2, 3)", "6")
                        .example("SUM(lineItems.lineTotal)", "Sum of the line totals")
                        .implementation(args -> Values.number(
                                args.numbers(0).stream().mapToDouble(Double::doubleValue).sum()))
                        .build(),
                FunctionDefinition.builder("AVERAGE", FunctionCategory.MATH)
                        .description("Returns the arithmetic mean; 0 when there are no values")
                        .variadic("values", NUMBER, "Numbers or arrays of numbers")
                        .returns(NUMBER)
                        .example("AVERAGE(1, 2, 3)", "2")
                        .implementation(args -> Values.number(args.numbers(0).stream()
                                .mapToDouble(Double::doubleValue)
                                .average()
                                .orElse(0)))
                        .build(),
                FunctionDefinition.builder("MIN", FunctionCategory.MATH)
                        .description("Returns the smallest number; null when there are no values")
                        .variadic("values", NUMBER, "Numbers or arrays of numbers")
                        .returns(NUMBER)
                        .example("MIN(5, 2, 8)", "2")
                        .implementation(args -> {
                            List<Double> numbers = args.numbers(0);
                            return numbers.isEmpty()
                                    ? Values.nullValue()
                                    : Values.number(numbers.stream()
                                            .mapToDouble(Double::doubleValue)
                                            .min()
                                            .getAsDouble());
                        })
                        .build(),
                FunctionDefinition.builder("MAX", FunctionCategory.MATH)
                        .description("Returns the largest number; null when there are no values")
                        .variadic("values", NUMBER, "Numbers or arrays of numbers")
                        .returns(NUMBER)
                        .example("MAX(5, 2, 8)", "8")
                        .implementation(args -> {
                            List<Double> numbers = args.numbers(0);
                            return numbers.isEmpty()
                                    ? Values.nullValue()
                                    : Values.number(numbers.stream()
                                            .mapToDouble(Double::doubleValue)
                                            .max()
                                            .getAsDouble());
                        })
                        .build(),
                FunctionDefinition.builder("ABS", FunctionCategory.MATH)
                        .description("Returns the absolute value")
                        .param("number", NUMBER, "Input number")
                        .returns(NUMBER)
                        .example("ABS(-5)", "5")
                        .implementation(args -> Values.number(Math.abs(args.number(0))))
                        .build(),
                FunctionDefinition.builder("ROUND", FunctionCategory.MATH)
                        .description("Rounds half away from zero to the given number of decimal places")
                        .param("number", NUMBER, "Number to round")
                        .optional("digits", NUMBER, "Decimal places, may be negative (default 0)")
                        .returns(NUMBER)
                        .example("ROUND(3.14159, 2)", "3.14")
                        .example("ROUND(2.5)", "3")
                        .implementation(args -> Values.number(round(args.number(0), args.integerOr(1, 0))))
                        .build(),
                FunctionDefinition.builder("FLOOR", FunctionCategory.MATH)
                        .description("Rounds down to the nearest integer")
                        .param("number", NUMBER, "Number to round down")
                        .returns(NUMBER)
                        .example("FLOOR(3.7)", "3")
                        .implementation(args -> Values.number(Math.floor(args.number(0))))
                        .build(),
                FunctionDefinition.builder("CEIL", FunctionCategory.MATH)
                        .description("Rounds up to the nearest integer")
                        .param("number", NUMBER, "Number to round up")
                        .returns(NUMBER)
                        .example("CEIL(3.2)", "4")
                        .implementation(args -> Values.number(Math.ceil(args.number(0))))
                        .build(),
                FunctionDefinition.builder("POWER", FunctionCategory.MATH)
                        .description("Raises a number to a power")
                        .param("base", NUMBER, "Base number")
                        .param("exponent", NUMBER, "Exponent")
                        .returns(NUMBER)
                        .example("POWER(2, 3)", "8")
                        .implementation(args -> Values.number(Math.pow(args.number(0), args.number(1))))
                        .build(),
                FunctionDefinition.builder("SQRT", FunctionCategory.MATH)
                        .description("Returns the square root of a non-negative number")
                        .param("number", NUMBER, "Non-negative number")
                        .returns(NUMBER)
                        .example("SQRT(16)", "4")
                        .implementation(args -> {
                            double n = args.number(0);
                            if (n < 0) {
                                throw args.fail(0, "must not be negative");
                            }
                            return Values.number(Math.sqrt(n));
                        })
                        .build(),
                FunctionDefinition.builder("MOD", FunctionCategory.MATH)
                        .description("Returns the remainder of a division; the result has the sign of the dividend")
                        .param("dividend", NUMBER, "Number to divide")
                        .param("divisor", NUMBER, "Number to divide by")
                        .returns(NUMBER)
                        .example("MOD(10, 3)", "1")
                        .implementation(args -> {
                            double divisor = args.number(1);
                            if (divisor == 0) {
                                throw args.fail(1, "division by zero");
                            }
                            return Values.number(args.number(0) % divisor);
                        })
                        .build(),
                FunctionDefinition.builder("RANDOM", FunctionCategory.MATH)
                        .description("Returns a random number in [min, max); [0, 1) by default")
                        .optional("min", NUMBER, "Lower bound (default 0)")
                        .optional("max", NUMBER, "Upper bound (default 1)")
                        .returns(NUMBER)
                        .example("RANDOM()", "0.7231...")
                        .example("RANDOM(1, 10)", "A number between 1 and 10")
                        .implementation(args -> {
                            double min = args.numberOr(0, 0);
                            double max = args.numberOr(1, 1);
                            if (max < min) {
                                throw args.fail(1, "must not be less than min");
                            }
                            return Values.number(min + ThreadLocalRandom.current().nextDouble() * (max - min));
                        })
                        .build());
    }

    /** Beyond this many places a double has no digits left to round. */
    static final int MAX_ROUND_DIGITS = 340;

    static double round(double value, int digits) {
        if (Double.isNaN(value) || Double.isInfinite(value) || digits > MAX_ROUND_DIGITS) {
            return value;
        }
        if (digits < -MAX_ROUND_DIGITS) {
            return 0;
        }
        return BigDecimal.valueOf(value).setScale(digits, RoundingMode.HALF_UP).doubleValue();
    }
}
