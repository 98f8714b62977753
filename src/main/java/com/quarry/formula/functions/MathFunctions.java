package com.quarry.formula.functions;

import static com.quarry.formula.functions.Args.num;
import static com.quarry.formula.functions.Args.numbers;
import static com.quarry.formula.functions.ParameterSpec.optional;
import static com.quarry.formula.functions.ParameterSpec.required;
import static com.quarry.formula.functions.ParameterSpec.variadic;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

import com.quarry.formula.parser.FormulaException;
import com.quarry.formula.parser.Value;

/**
 * Math built-ins.
 *
 * Sum/Average/Min/Max flatten list arguments and skip blanks; an empty input yields 0.
 * Divide and Mod fail on a zero divisor. Mod follows the spreadsheet convention: the result
 * takes the sign of the divisor.
 */
public final class MathFunctions {

    static final int MIN_DECIMALS = -308;
    static final int MAX_DECIMALS = 340;

    private MathFunctions() {}

    static void register(FunctionRegistry.Builder r) {

        r.register(FunctionDefinition.builder("Sum", Category.MATH)
                .description("Sum of all numeric arguments or list elements")
                .example("SUM(1, 2, 3) → 6")
                .returns("number")
                .param(variadic("values", ParamType.NUMBER, "Numbers to sum"))
                .sync((call, args) -> {
                    double sum = 0;
                    for (double d : numbers(args)) sum += d;
                    return Value.number(sum);
                })
                .build());

        r.register(FunctionDefinition.builder("Average", Category.MATH)
                .description("Average of all numeric arguments")
                .example("AVERAGE(10, 20, 30) → 20")
                .returns("number")
                .param(variadic("values", ParamType.NUMBER, "Numbers to average"))
                .sync((call, args) -> {
                    List<Double> values = numbers(args);
                    if (values.isEmpty()) return Value.number(0);
                    double sum = 0;
                    for (double d : values) sum += d;
                    return Value.number(sum / values.size());
                })
                .build());

        r.register(FunctionDefinition.builder("Min", Category.MATH)
                .description("Minimum value")
                .example("MIN(5, 3, 8) → 3")
                .returns("number")
                .param(variadic("values", ParamType.NUMBER, "Numbers to compare"))
                .sync((call, args) -> {
                    List<Double> values = numbers(args);
                    if (values.isEmpty()) return Value.number(0);
                    double m = values.get(0);
                    for (double d : values) if (d < m) m = d;
                    return Value.number(m);
                })
                .build());

        r.register(FunctionDefinition.builder("Max", Category.MATH)
                .description("Maximum value")
                .example("MAX(5, 3, 8) → 8")
                .returns("number")
                .param(variadic("values", ParamType.NUMBER, "Numbers to compare"))
                .sync((call, args) -> {
                    List<Double> values = numbers(args);
                    if (values.isEmpty()) return Value.number(0);
                    double m = values.get(0);
                    for (double d : values) if (d > m) m = d;
                    return Value.number(m);
                })
                .build());

        r.register(FunctionDefinition.builder("Round", Category.MATH)
                .description("Round half-up to the given number of decimal places")
                .example("ROUND(3.14159, 2) → 3.14")
                .returns("number")
                .param(required("value", ParamType.NUMBER, "Number to round"))
                .param(optional("decimals", ParamType.NUMBER, "Decimal places (negative rounds to tens, hundreds...)", Value.number(0)))
                .sync((call, args) -> {
                    double value = num(args, 0);
                    double places = num(args, 1);
                    // a double has no significant digits outside this range
                    if (Double.isNaN(places) || places < MIN_DECIMALS || places > MAX_DECIMALS) {
                        throw FormulaException.runtime("decimals out of range [" + MIN_DECIMALS + ", " + MAX_DECIMALS + "]: "
                                + Value.number(places).display(), 1);
                    }
                    int decimals = (int) places;
                    if (Double.isNaN(value) || Double.isInfinite(value)) return Value.number(value);
                    return Value.number(BigDecimal.valueOf(value).setScale(decimals, RoundingMode.HALF_UP).doubleValue());
                })
                .build());

        r.register(FunctionDefinition.builder("Abs", Category.MATH)
                .description("Absolute value")
                .example("ABS(-5) → 5")
                .returns("number")
                .param(required("value", ParamType.NUMBER, "Number"))
                .sync((call, args) -> Value.number(Math.abs(num(args, 0))))
                .build());

        r.register(FunctionDefinition.builder("Add", Category.MATH)
                .description("Add two numbers")
                .example("ADD(1, 2) → 3")
                .returns("number")
                .param(required("a", ParamType.NUMBER, "First number"))
                .param(required("b", ParamType.NUMBER, "Second number"))
                .sync((call, args) -> Value.number(num(args, 0) + num(args, 1)))
                .build());

        r.register(FunctionDefinition.builder("Subtract", Category.MATH)
                .description("Subtract the second number from the first")
                .example("SUBTRACT(5, 3) → 2")
                .returns("number")
                .param(required("a", ParamType.NUMBER, "Minuend"))
                .param(required("b", ParamType.NUMBER, "Subtrahend"))
                .sync((call, args) -> Value.number(num(args, 0) - num(args, 1)))
                .build());

        r.register(FunctionDefinition.builder("Multiply", Category.MATH)
                .description("Product of all numeric arguments")
                .example("MULTIPLY(price, quantity)")
                .returns("number")
                .param(variadic("values", ParamType.NUMBER, "Numbers to multiply"))
                .sync((call, args) -> {
                    List<Double> values = numbers(args);
                    if (values.isEmpty()) return Value.number(0);
                    double product = 1;
                    for (double d : values) product *= d;
                    return Value.number(product);
                })
                .build());

        r.register(FunctionDefinition.builder("Divide", Category.MATH)
                .description("Divide the first number by the second")
                .example("DIVIDE(10, 4) → 2.5")
                .returns("number")
                .param(required("dividend", ParamType.NUMBER, "Number to divide"))
                .param(required("divisor", ParamType.NUMBER, "Number to divide by"))
                .sync((call, args) -> {
                    double divisor = num(args, 1);
                    if (divisor == 0) throw FormulaException.runtime("Division by zero", 1);
                    return Value.number(num(args, 0) / divisor);
                })
                .build());

        r.register(FunctionDefinition.builder("Mod", Category.MATH)
                .description("Remainder after division, with the sign of the divisor")
                .example("MOD(10, 3) → 1")
                .returns("number")
                .param(required("dividend", ParamType.NUMBER, "Number to divide"))
                .param(required("divisor", ParamType.NUMBER, "Number to divide by"))
                .sync((call, args) -> {
                    double a = num(args, 0);
                    double b = num(args, 1);
                    if (b == 0) throw FormulaException.runtime("Division by zero", 1);
                    return Value.number(a - b * Math.floor(a / b));
                })
                .build());
    }
}
