package com.quarry.formula.functions;

import static com.quarry.formula.functions.Args.truthy;
import static com.quarry.formula.functions.ParameterSpec.required;
import static com.quarry.formula.functions.ParameterSpec.variadic;

import java.util.Locale;
import java.util.function.IntPredicate;

import com.quarry.formula.parser.Value;

/**
 * Logic and comparison built-ins.
 *
 * Arguments are already evaluated when these run, so If/And/Or do not short-circuit.
 */
public final class LogicFunctions {

    private LogicFunctions() {}

    static void register(FunctionRegistry.Builder r) {

        r.register(FunctionDefinition.builder("If", Category.LOGIC)
                .description("Pick a value based on a condition")
                .example("IF(GT(price, 50), \"expensive\", \"cheap\")")
                .returns("any")
                .param(required("condition", ParamType.ANY, "Condition"))
                .param(required("then", ParamType.ANY, "Value when the condition is true"))
                .param(required("else", ParamType.ANY, "Value when the condition is false"))
                .sync((call, args) -> truthy(args.get(0)) ? args.get(1) : args.get(2))
                .build());

        r.register(FunctionDefinition.builder("And", Category.LOGIC)
                .description("True when every argument is true")
                .example("AND(true, GT(2, 1)) → true")
                .returns("boolean")
                .param(variadic("conditions", ParamType.BOOLEAN, "Conditions"))
                .sync((call, args) -> {
                    for (Value v : args) if (!truthy(v)) return Value.bool(false);
                    return Value.bool(true);
                })
                .build());

        r.register(FunctionDefinition.builder("Or", Category.LOGIC)
                .description("True when any argument is true")
                .example("OR(false, true) → true")
                .returns("boolean")
                .param(variadic("conditions", ParamType.BOOLEAN, "Conditions"))
                .sync((call, args) -> {
                    for (Value v : args) if (truthy(v)) return Value.bool(true);
                    return Value.bool(false);
                })
                .build());

        r.register(FunctionDefinition.builder("Not", Category.LOGIC)
                .description("Negate a condition")
                .example("NOT(false) → true")
                .returns("boolean")
                .param(required("condition", ParamType.BOOLEAN, "Condition"))
                .sync((call, args) -> Value.bool(!truthy(args.get(0))))
                .build());

        r.register(FunctionDefinition.builder("IsEmpty", Category.LOGIC)
                .description("True for missing values, blank text and empty lists")
                .example("ISEMPTY(notes)")
                .returns("boolean")
                .param(required("value", ParamType.ANY, "Value to test"))
                .sync((call, args) -> Value.bool(Args.isEmpty(args.get(0))))
                .build());

        r.register(FunctionDefinition.builder("Coalesce", Category.LOGIC)
                .description("First value that is not missing or blank")
                .example("COALESCE(nickname, name, \"Anonymous\")")
                .returns("any")
                .param(variadic("values", ParamType.ANY, "Candidates in order"))
                .sync((call, args) -> {
                    for (Value v : args) {
                        if (v.isNull()) continue;
                        if (v.getType() == Value.Type.TEXT && v.asText().isEmpty()) continue;
                        return v;
                    }
                    return Value.nil();
                })
                .build());

        r.register(FunctionDefinition.builder("Eq", Category.LOGIC)
                .description("True when both values are equal")
                .example("EQ(status, \"done\")")
                .returns("boolean")
                .param(required("a", ParamType.ANY, "First value"))
                .param(required("b", ParamType.ANY, "Second value"))
                .sync((call, args) -> Value.bool(Args.looseEquals(args.get(0), args.get(1))))
                .build());

        r.register(FunctionDefinition.builder("Neq", Category.LOGIC)
                .description("True when the values differ")
                .example("NEQ(status, \"done\")")
                .returns("boolean")
                .param(required("a", ParamType.ANY, "First value"))
                .param(required("b", ParamType.ANY, "Second value"))
                .sync((call, args) -> Value.bool(!Args.looseEquals(args.get(0), args.get(1))))
                .build());

        comparison(r, "Gt", "greater than", c -> c > 0);
        comparison(r, "Gte", "greater than or equal to", c -> c >= 0);
        comparison(r, "Lt", "less than", c -> c < 0);
        comparison(r, "Lte", "less than or equal to", c -> c <= 0);
    }

    private static void comparison(FunctionRegistry.Builder r, String name, String phrase, IntPredicate test) {
        r.register(FunctionDefinition.builder(name, Category.LOGIC)
                .description("True when the first value is " + phrase + " the second")
                .example(name.toUpperCase(Locale.ROOT) + "(price, 50)")
                .returns("boolean")
                .param(required("a", ParamType.ANY, "First value"))
                .param(required("b", ParamType.ANY, "Second value"))
                .sync((call, args) -> Value.bool(test.test(Args.compare(args.get(0), args.get(1)))))
                .build());
    }
}
