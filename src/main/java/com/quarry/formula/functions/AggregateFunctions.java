package com.quarry.formula.functions;

import static com.quarry.formula.functions.Args.arg;
import static com.quarry.formula.functions.Args.itemField;
import static com.quarry.formula.functions.Args.present;
import static com.quarry.formula.functions.Args.text;
import static com.quarry.formula.functions.ParameterSpec.optional;
import static com.quarry.formula.functions.ParameterSpec.required;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import com.quarry.formula.parser.FormulaException;
import com.quarry.formula.parser.Value;

/**
 * Aggregates over a collection: a LIST value, or the text "siblings" / "mentions" naming the
 * context's sibling items or mentioned entities.
 */
public final class AggregateFunctions {

    static final String SIBLINGS = "siblings";
    static final String MENTIONS = "mentions";

    private AggregateFunctions() {}

    static void register(FunctionRegistry.Builder r) {

        r.register(FunctionDefinition.builder("Count", Category.AGGREGATE)
                .description("Count items, optionally only those whose field matches a value")
                .example("COUNT(\"siblings\", \"status\", \"done\")")
                .returns("number")
                .param(required("collection", ParamType.LIST, "List, \"siblings\" or \"mentions\""))
                .param(optional("field", ParamType.TEXT, "Field to test", null))
                .param(optional("value", ParamType.ANY, "Value the field must equal", null))
                .sync((call, args) -> {
                    List<Value> items = collection(call, args.get(0));
                    if (!present(args, 1)) return Value.number(items.size());
                    String field = text(args, 1);
                    int count = 0;
                    if (args.size() < 3) {
                        for (Value item : items) {
                            if (!Args.isEmpty(itemField(item, field))) count++;
                        }
                    } else {
                        Value expected = arg(args, 2);
                        for (Value item : items) {
                            if (Args.looseEquals(itemField(item, field), expected)) count++;
                        }
                    }
                    return Value.number(count);
                })
                .build());

        r.register(FunctionDefinition.builder("SumField", Category.AGGREGATE)
                .description("Sum a numeric field across items")
                .example("SUMFIELD(\"siblings\", \"hours\")")
                .returns("number")
                .param(required("collection", ParamType.LIST, "List, \"siblings\" or \"mentions\""))
                .param(required("field", ParamType.TEXT, "Field to sum"))
                .sync((call, args) -> {
                    List<Value> items = collection(call, args.get(0));
                    String field = text(args, 1);
                    double sum = 0;
                    for (Value item : items) {
                        Value v = itemField(item, field);
                        if (v.getType() == Value.Type.NUMBER) {
                            sum += v.asNumber();
                        } else if (v.getType() == Value.Type.TEXT) {
                            // non-numeric text is skipped like a text cell in a spreadsheet range
                            Double parsed = Args.parseNumber(v.asText());
                            if (parsed != null) sum += parsed;
                        }
                    }
                    return Value.number(sum);
                })
                .build());

        r.register(FunctionDefinition.builder("Filter", Category.AGGREGATE)
                .description("Items whose field equals a value")
                .example("FILTER(\"siblings\", \"status\", \"open\")")
                .returns("array")
                .param(required("collection", ParamType.LIST, "List, \"siblings\" or \"mentions\""))
                .param(required("field", ParamType.TEXT, "Field to test"))
                .param(required("value", ParamType.ANY, "Value the field must equal"))
                .sync((call, args) -> {
                    List<Value> items = collection(call, args.get(0));
                    String field = text(args, 1);
                    Value expected = args.get(2);
                    List<Value> out = new ArrayList<>();
                    for (Value item : items) {
                        if (Args.looseEquals(itemField(item, field), expected)) out.add(item);
                    }
                    return Value.list(out);
                })
                .build());

        r.register(FunctionDefinition.builder("MentionsOfType", Category.AGGREGATE)
                .description("Mentioned entities of a given type")
                .example("MENTIONSOFTYPE(\"place\")")
                .returns("array")
                .param(required("type", ParamType.TEXT, "Entity type, e.g. place or person"))
                .sync((call, args) -> {
                    String type = text(args, 0).trim();
                    List<Value> out = new ArrayList<>();
                    for (Value m : call.context().mentionValues()) {
                        if (m.get("type").display().equalsIgnoreCase(type)) out.add(m);
                    }
                    return Value.list(out);
                })
                .build());
    }

    static List<Value> collection(Invocation call, Value source) {
        switch (source.getType()) {
            case LIST:
                return source.asList();
            case NULL:
                return Collections.emptyList();
            case TEXT: {
                String name = source.asText().trim().toLowerCase(Locale.ROOT);
                if (SIBLINGS.equals(name)) return call.context().siblingValues();
                if (MENTIONS.equals(name)) return call.context().mentionValues();
                throw FormulaException.runtime("Unknown collection \"" + source.asText()
                        + "\" (expected a list, \"siblings\" or \"mentions\")", 0);
            }
            default:
                throw FormulaException.type("Argument 1 must be a list, got " + source.getType(), 0);
        }
    }
}
