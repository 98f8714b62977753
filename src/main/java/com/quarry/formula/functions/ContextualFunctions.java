package com.quarry.formula.functions;

import static com.quarry.formula.functions.Args.present;
import static com.quarry.formula.functions.Args.text;
import static com.quarry.formula.functions.ParameterSpec.optional;
import static com.quarry.formula.functions.ParameterSpec.required;

import java.time.Instant;

import com.quarry.formula.parser.FormulaException;
import com.quarry.formula.parser.Value;

/**
 * Built-ins that read the evaluation context or call out through {@link ContextualServices}.
 *
 * Get and Mention are the field accessors the dependency analyzer knows about. Weather, Route
 * and Distance are asynchronous.
 */
public final class ContextualFunctions {

    private ContextualFunctions() {}

    static void register(FunctionRegistry.Builder r) {

        r.register(FunctionDefinition.builder("Get", Category.CONTEXTUAL)
                .description("Value of a document field")
                .example("GET(\"price\") → 100")
                .returns("any")
                .param(required("field", ParamType.TEXT, "Field name"))
                .sync((call, args) -> call.context().field(text(args, 0)))
                .build());

        r.register(FunctionDefinition.builder("Mention", Category.CONTEXTUAL)
                .description("Entity mentioned in the document, by label")
                .example("MENTION(\"Paris\")")
                .returns("any")
                .param(required("label", ParamType.TEXT, "Label of the mentioned entity"))
                .sync((call, args) -> findMention(call, text(args, 0)))
                .build());

        r.register(FunctionDefinition.builder("Weather", Category.CONTEXTUAL)
                .description("Weather forecast for a place")
                .example("WEATHER(\"Paris\", TODAY())")
                .returns("object")
                .param(required("place", ParamType.PLACE, "Mentioned place or place name"))
                .param(optional("date", ParamType.DATETIME, "Day of the forecast (default: now)", null))
                .async((call, args) -> {
                    Value place = resolvePlace(call, args.get(0));
                    Instant date = present(args, 1) ? Args.date(args, 1, call.zone()) : call.context().now;
                    return call.services().weather(call, place, date);
                })
                .build());

        r.register(FunctionDefinition.builder("Route", Category.CONTEXTUAL)
                .description("Travel route between two places")
                .example("ROUTE(\"Home\", \"Office\", \"transit\")")
                .returns("object")
                .param(required("from", ParamType.PLACE, "Start"))
                .param(required("to", ParamType.PLACE, "Destination"))
                .param(optional("mode", ParamType.TEXT, "drive, walk, bike or transit", Value.text("drive")))
                .async((call, args) -> call.services().route(call,
                        resolvePlace(call, args.get(0)),
                        resolvePlace(call, args.get(1)),
                        text(args, 2).trim()))
                .build());

        r.register(FunctionDefinition.builder("Distance", Category.CONTEXTUAL)
                .description("Straight-line distance between two places in km")
                .example("DISTANCE(\"Paris\", \"Lyon\") → 391.5")
                .returns("number")
                .param(required("from", ParamType.PLACE, "Start"))
                .param(required("to", ParamType.PLACE, "Destination"))
                .async((call, args) -> {
                    Coordinates from = coordinates(call, args.get(0), 0);
                    Coordinates to = coordinates(call, args.get(1), 1);
                    return call.services().distance(call, from, to);
                })
                .build());
    }

    static Value findMention(Invocation call, String label) {
        String wanted = label.trim();
        for (Value m : call.context().mentionValues()) {
            if (m.get("label").display().equalsIgnoreCase(wanted)) return m;
        }
        return Value.nil();
    }

    /** A text argument naming a mentioned entity resolves to that entity; anything else is kept. */
    static Value resolvePlace(Invocation call, Value place) {
        if (place.getType() == Value.Type.TEXT) {
            Value mention = findMention(call, place.asText());
            if (!mention.isNull()) return mention;
        }
        return place;
    }

    /** Reads latitude/longitude from a MAP (top level or its properties) or a mentioned place. */
    static Coordinates coordinates(Invocation call, Value place, int argIndex) {
        Value resolved = resolvePlace(call, place);
        Coordinates c = readCoordinates(resolved);
        if (c == null) c = readCoordinates(resolved.get("properties"));
        if (c == null) {
            throw FormulaException.runtime("No coordinates for \"" + OfflineContextualServices.placeName(place) + "\"", argIndex);
        }
        return c;
    }

    private static Coordinates readCoordinates(Value map) {
        Value lat = map.get("latitude");
        Value lng = map.get("longitude");
        if (lat.isNull()) lat = map.get("lat");
        if (lng.isNull()) lng = map.get("lng");
        if (lat.isNull() || lng.isNull()) return null;
        Double la = asDouble(lat);
        Double lo = asDouble(lng);
        if (la == null || lo == null) return null;
        try {
            return new Coordinates(la, lo);
        } catch (IllegalArgumentException e) {
            throw FormulaException.runtime(e.getMessage());
        }
    }

    private static Double asDouble(Value v) {
        if (v.getType() == Value.Type.NUMBER) return v.asNumber();
        if (v.getType() == Value.Type.TEXT) return Args.parseNumber(v.asText());
        return null;
    }
}
