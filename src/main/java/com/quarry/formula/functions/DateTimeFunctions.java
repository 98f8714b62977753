package com.quarry.formula.functions;

import static com.quarry.formula.functions.Args.date;
import static com.quarry.formula.functions.Args.num;
import static com.quarry.formula.functions.Args.text;
import static com.quarry.formula.functions.ParameterSpec.optional;
import static com.quarry.formula.functions.ParameterSpec.required;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

import com.quarry.formula.parser.FormulaException;
import com.quarry.formula.parser.Value;

/**
 * Date built-ins. Calendar arithmetic and formatting happen in the invocation's effective zone.
 */
public final class DateTimeFunctions {

    private static final DateTimeFormatter SHORT = DateTimeFormatter.ofPattern("MMM d", Locale.US);
    private static final DateTimeFormatter MEDIUM = DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.US);
    private static final DateTimeFormatter LONG = DateTimeFormatter.ofPattern("EEEE, MMMM d, yyyy", Locale.US);
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("hh:mm a", Locale.US);
    private static final DateTimeFormatter DATETIME = DateTimeFormatter.ofPattern("MMM d, hh:mm a", Locale.US);

    private DateTimeFunctions() {}

    static void register(FunctionRegistry.Builder r) {

        r.register(FunctionDefinition.builder("Today", Category.DATETIME)
                .description("Start of the current day")
                .example("TODAY() → 2024-01-15T00:00:00Z")
                .returns("date")
                .sync((call, args) -> Value.dateTime(
                        call.context().now.atZone(call.zone()).toLocalDate().atStartOfDay(call.zone()).toInstant()))
                .build());

        r.register(FunctionDefinition.builder("Now", Category.DATETIME)
                .description("Current date and time")
                .example("NOW() → 2024-01-15T10:30:00Z")
                .returns("date")
                .sync((call, args) -> Value.dateTime(call.context().now))
                .build());

        r.register(FunctionDefinition.builder("DateAdd", Category.DATETIME)
                .description("Add time to a date")
                .example("DATEADD(TODAY(), 7, \"days\")")
                .returns("date")
                .param(required("date", ParamType.DATETIME, "Starting date"))
                .param(required("amount", ParamType.NUMBER, "Amount to add (may be negative)"))
                .param(optional("unit", ParamType.TEXT, "ms, seconds, minutes, hours, days, weeks, months or years", Value.text("days")))
                .sync((call, args) -> {
                    Instant start = date(args, 0, call.zone());
                    double amount = num(args, 1);
                    String unit = text(args, 2).trim().toLowerCase(Locale.ROOT);
                    return Value.dateTime(add(start, amount, unit, call));
                })
                .build());

        r.register(FunctionDefinition.builder("FormatDate", Category.DATETIME)
                .description("Format a date for display")
                .example("FORMATDATE(NOW(), \"long\") → \"Monday, January 15, 2024\"")
                .returns("string")
                .param(required("date", ParamType.DATETIME, "Date to format"))
                .param(optional("style", ParamType.TEXT, "short, medium, long, iso, time or datetime", Value.text("medium")))
                .sync((call, args) -> {
                    ZonedDateTime d = date(args, 0, call.zone()).atZone(call.zone());
                    return Value.text(formatter(text(args, 1)).format(d));
                })
                .build());

        r.register(FunctionDefinition.builder("Duration", Category.DATETIME)
                .description("Time between two dates")
                .example("DURATION(\"2024-01-01\", \"2024-01-15\", \"days\") → 14")
                .returns("number")
                .param(required("start", ParamType.DATETIME, "Start date"))
                .param(required("end", ParamType.DATETIME, "End date"))
                .param(optional("unit", ParamType.TEXT, "ms, seconds, minutes, hours or days", Value.text("days")))
                .sync((call, args) -> {
                    Instant start = date(args, 0, call.zone());
                    Instant end = date(args, 1, call.zone());
                    String unit = text(args, 2).trim().toLowerCase(Locale.ROOT);
                    long millis = end.toEpochMilli() - start.toEpochMilli();
                    double span = (double) millis / fixedUnitMillis(unit, 2);
                    return Value.number(BigDecimal.valueOf(span).setScale(0, RoundingMode.HALF_UP).doubleValue());
                })
                .build());

        r.register(FunctionDefinition.builder("DayOfWeek", Category.DATETIME)
                .description("Day of the week (0 = Sunday)")
                .example("DAYOFWEEK(TODAY()) → 1")
                .returns("number")
                .param(required("date", ParamType.DATETIME, "Date"))
                .sync((call, args) -> {
                    int iso = date(args, 0, call.zone()).atZone(call.zone()).getDayOfWeek().getValue();
                    return Value.number(iso % 7);
                })
                .build());
    }

    private static Instant add(Instant start, double amount, String unit, Invocation call) {
        switch (unit) {
            case "month":
            case "months":
                return start.atZone(call.zone()).plusMonths((long) amount).toInstant();
            case "y":
            case "year":
            case "years":
                return start.atZone(call.zone()).plusYears((long) amount).toInstant();
            case "w":
            case "week":
            case "weeks":
                return start.plusMillis(Math.round(amount * 7 * 86_400_000d));
            default:
                return start.plusMillis(Math.round(amount * fixedUnitMillis(unit, 2)));
        }
    }

    /** Milliseconds in a fixed-length unit; unknown units fail against the given argument. */
    private static long fixedUnitMillis(String unit, int argIndex) {
        switch (unit) {
            case "ms":
            case "millisecond":
            case "milliseconds":
                return 1L;
            case "s":
            case "second":
            case "seconds":
                return 1_000L;
            case "m":
            case "minute":
            case "minutes":
                return 60_000L;
            case "h":
            case "hour":
            case "hours":
                return 3_600_000L;
            case "d":
            case "day":
            case "days":
                return 86_400_000L;
            default:
                throw FormulaException.runtime("Unknown time unit \"" + unit + "\"", argIndex);
        }
    }

    private static DateTimeFormatter formatter(String style) {
        switch (style.trim().toLowerCase(Locale.ROOT)) {
            case "short": return SHORT;
            case "long": return LONG;
            case "iso": return DateTimeFormatter.ISO_LOCAL_DATE;
            case "time": return TIME;
            case "datetime": return DATETIME;
            default: return MEDIUM;
        }
    }
}
