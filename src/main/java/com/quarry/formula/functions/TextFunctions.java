package com.quarry.formula.functions;

import static com.quarry.formula.functions.Args.text;
import static com.quarry.formula.functions.ParameterSpec.required;
import static com.quarry.formula.functions.ParameterSpec.variadic;

import java.util.Locale;

import com.quarry.formula.parser.Value;

/** Text built-ins. Every argument is coerced to text first (NULL reads as ""). */
public final class TextFunctions {

    private TextFunctions() {}

    static void register(FunctionRegistry.Builder r) {

        r.register(FunctionDefinition.builder("Concat", Category.TEXT)
                .description("Concatenate text")
                .example("CONCAT(\"Hello\", \" \", \"World\") → \"Hello World\"")
                .returns("string")
                .param(variadic("strings", ParamType.TEXT, "Text to join"))
                .sync((call, args) -> {
                    StringBuilder sb = new StringBuilder();
                    for (Value v : args) sb.append(Args.toText(v));
                    return Value.text(sb.toString());
                })
                .build());

        r.register(FunctionDefinition.builder("Upper", Category.TEXT)
                .description("Convert to uppercase")
                .example("UPPER(\"hello\") → \"HELLO\"")
                .returns("string")
                .param(required("text", ParamType.TEXT, "Text to convert"))
                .sync((call, args) -> Value.text(text(args, 0).toUpperCase(Locale.ROOT)))
                .build());

        r.register(FunctionDefinition.builder("Lower", Category.TEXT)
                .description("Convert to lowercase")
                .example("LOWER(\"HELLO\") → \"hello\"")
                .returns("string")
                .param(required("text", ParamType.TEXT, "Text to convert"))
                .sync((call, args) -> Value.text(text(args, 0).toLowerCase(Locale.ROOT)))
                .build());

        r.register(FunctionDefinition.builder("Length", Category.TEXT)
                .description("Length of a text, or number of items in a list")
                .example("LENGTH(\"hello\") → 5")
                .returns("number")
                .param(required("value", ParamType.ANY, "Text or list"))
                .sync((call, args) -> {
                    Value v = args.get(0);
                    if (v.getType() == Value.Type.LIST) return Value.number(v.asList().size());
                    return Value.number(Args.toText(v).length());
                })
                .build());

        r.register(FunctionDefinition.builder("Trim", Category.TEXT)
                .description("Remove leading and trailing whitespace")
                .example("TRIM(\"  hello  \") → \"hello\"")
                .returns("string")
                .param(required("text", ParamType.TEXT, "Text to trim"))
                .sync((call, args) -> Value.text(text(args, 0).trim()))
                .build());

        r.register(FunctionDefinition.builder("Replace", Category.TEXT)
                .description("Replace every occurrence of a text")
                .example("REPLACE(\"hello\", \"l\", \"w\") → \"hewwo\"")
                .returns("string")
                .param(required("text", ParamType.TEXT, "Source text"))
                .param(required("search", ParamType.TEXT, "Text to find"))
                .param(required("replacement", ParamType.TEXT, "Replacement"))
                .sync((call, args) -> {
                    String source = text(args, 0);
                    String search = text(args, 1);
                    if (search.isEmpty()) return Value.text(source);
                    return Value.text(source.replace(search, text(args, 2)));
                })
                .build());
    }
}
