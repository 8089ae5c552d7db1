package io.flowforge.formula.core.function.builtin;

import static io.flowforge.formula.core.value.ValueType.DATE;
import static io.flowforge.formula.core.value.ValueType.NUMBER;
import static io.flowforge.formula.core.value.ValueType.STRING;

import com.fasterxml.jackson.databind.JsonNode;
import io.flowforge.formula.core.function.Arguments;
import io.flowforge.formula.core.function.FunctionCategory;
import io.flowforge.formula.core.function.FunctionDefinition;
import io.flowforge.formula.core.value.Values;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;

/**
 * Date built-ins. {@code NOW} and {@code TODAY} read the context clock; everything else is a
 * pure function of its arguments.
 */
public final class DateFunctions {

    private DateFunctions() {}

    public static List<FunctionDefinition> definitions() {
        return List.of(
                FunctionDefinition.builder("NOW", FunctionCategory.DATE)
                        .description("Returns the current instant as an ISO-8601 UTC timestamp")
                        .returns(DATE)
                        .example("NOW()", "\"2024-01-15T09:30:00Z\"")
                        .implementation(args -> Values.text(
                                Instant.now(args.context().clock()).truncatedTo(ChronoUnit.SECONDS).toString()))
                        .build(),
                FunctionDefinition.builder("TODAY", FunctionCategory.DATE)
                        .description("Returns the current calendar date in the clock's zone")
                        .returns(DATE)
                        .example("TODAY()", "\"2024-01-15\"")
                        .implementation(args -> DateSupport.date(LocalDate.now(args.context().clock())))
                        .build(),
                FunctionDefinition.builder("DATE", FunctionCategory.DATE)
                        .description("Builds a calendar date; month is 1-indexed and out-of-range values roll over")
                        .param("year", NUMBER, "Year")
                        .param("month", NUMBER, "Month, 1-12")
                        .param("day", NUMBER, "Day of month")
                        .returns(DATE)
                        .example("DATE(2024, 1, 15)", "\"2024-01-15\"")
                        .example("DATE(2024, 13, 1)", "\"2025-01-01\"")
                        .implementation(args -> {
                            try {
                                return DateSupport.date(LocalDate.of(args.integer(0), 1, 1)
                                        .plusMonths(args.integer(1) - 1L)
                                        .plusDays(args.integer(2) - 1L));
                            } catch (DateTimeException e) {
                                throw args.fail("date out of range: " + e.getMessage());
                            }
                        })
                        .build(),
                FunctionDefinition.builder("YEAR", FunctionCategory.DATE)
                        .description("Returns the year of a date")
                        .param("date", DATE, "Date")
                        .returns(NUMBER)
                        .example("YEAR(\"2024-01-15\")", "2024")
                        .implementation(args -> Values.number(
                                DateSupport.parse(args, 0).dateTime().getYear()))
                        .build(),
                FunctionDefinition.builder("MONTH", FunctionCategory.DATE)
                        .description("Returns the month of a date, 1-12")
                        .param("date", DATE, "Date")
                        .returns(NUMBER)
                        .example("MONTH(\"2024-01-15\")", "1")
                        .implementation(args -> Values.number(
                                DateSupport.parse(args, 0).dateTime().getMonthValue()))
                        .build(),
                FunctionDefinition.builder("DAY", FunctionCategory.DATE)
                        .description("Returns the day of month of a date")
                        .param("date", DATE, "Date")
                        .returns(NUMBER)
                        .example("DAY(\"2024-01-15\")", "15")
                        .implementation(args -> Values.number(
                                DateSupport.parse(args, 0).dateTime().getDayOfMonth()))
                        .build(),
                FunctionDefinition.builder("WEEKDAY", FunctionCategory.DATE)
                        .description("Returns the day of week, 1 = Sunday to 7 = Saturday")
                        .param("date", DATE, "Date")
                        .returns(NUMBER)
                        .example("WEEKDAY(\"2024-01-15\")", "2")
                        .implementation(args -> Values.number(
                                DateSupport.parse(args, 0).dateTime().getDayOfWeek().getValue() % 7 + 1))
                        .build(),
                FunctionDefinition.builder("HOUR", FunctionCategory.DATE)
                        .description("Returns the hour of a date-time, 0-23 (UTC)")
                        .param("date", DATE, "Date-time")
                        .returns(NUMBER)
                        .example("HOUR(\"2024-01-15T09:30:00Z\")", "9")
                        .implementation(args -> Values.number(
                                DateSupport.parse(args, 0).dateTime().getHour()))
                        .build(),
                FunctionDefinition.builder("MINUTE", FunctionCategory.DATE)
                        .description("Returns the minute of a date-time, 0-59")
                        .param("date", DATE, "Date-time")
                        .returns(NUMBER)
                        .example("MINUTE(\"2024-01-15T09:30:00Z\")", "30")
                        .implementation(args -> Values.number(
                                DateSupport.parse(args, 0).dateTime().getMinute()))
                        .build(),
                FunctionDefinition.builder("DATEADD", FunctionCategory.DATE)
                        .description("Adds an amount of years, months, weeks, days, hours, minutes or seconds to a date")
                        .param("date", DATE, "Start date")
                        .param("amount", NUMBER, "Whole amount to add, may be negative")
                        .param("unit", STRING, "years, months, weeks, days, hours, minutes or seconds")
                        .returns(DATE)
                        .example("DATEADD(\"2024-01-15\", 1, \"months\")", "\"2024-02-15\"")
                        .example("DATEADD(\"2024-01-15T09:00:00Z\", 90, \"minutes\")", "\"2024-01-15T10:30:00Z\"")
                        .implementation(DateFunctions::dateAdd)
                        .build(),
                FunctionDefinition.builder("DATEDIFF", FunctionCategory.DATE)
                        .description("Counts whole units from start to end; negative when end is earlier")
                        .param("start", DATE, "Start date")
                        .param("end", DATE, "End date")
                        .optional("unit", STRING, "years, months, weeks, days, hours, minutes or seconds (default days)")
                        .returns(NUMBER)
                        .example("DATEDIFF(\"2024-01-01\", \"2024-01-31\")", "30")
                        .example("DATEDIFF(\"2024-01-01\", \"2024-03-01\", \"months\")", "2")
                        .implementation(args -> {
                            LocalDateTime start = DateSupport.parse(args, 0).dateTime();
                            LocalDateTime end = DateSupport.parse(args, 1).dateTime();
                            ChronoUnit unit = unit(args, 2, args.textOr(2, "days"));
                            return Values.number(unit.between(start, end));
                        })
                        .build());
    }

    private static JsonNode dateAdd(Arguments args) {
        DateSupport.Moment moment = DateSupport.parse(args, 0);
        int amount = args.integer(1);
        ChronoUnit unit = unit(args, 2, args.text(2));
        LocalDateTime shifted;
        try {
            shifted = moment.dateTime().plus(amount, unit);
        } catch (DateTimeException | ArithmeticException e) {
            throw args.fail("result out of range: " + e.getMessage());
        }
        boolean stillDateOnly = moment.dateOnly() && unit.isDateBased();
        return DateSupport.format(new DateSupport.Moment(shifted, stillDateOnly));
    }

    private static ChronoUnit unit(Arguments args, int index, String name) {
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "year", "years" -> ChronoUnit.YEARS;
            case "month", "months" -> ChronoUnit.MONTHS;
            case "week", "weeks" -> ChronoUnit.WEEKS;
            case "day", "days" -> ChronoUnit.DAYS;
            case "hour", "hours" -> ChronoUnit.HOURS;
            case "minute", "minutes" -> ChronoUnit.MINUTES;
            case "second", "seconds" -> ChronoUnit.SECONDS;
            default -> throw args.fail(
                    index, "unknown unit '" + name + "', expected years, months, weeks, days, hours, minutes or seconds");
        };
    }
}
