package com.quarry.formula.functions;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import com.quarry.formula.parser.FormulaException;
import com.quarry.formula.parser.Value;

/**
 * Argument access and the coercion rules shared by all built-ins.
 *
 * Coercion failures are TYPE_ERRORs naming the argument index; a text that cannot be read as a
 * date is a RUNTIME_ERROR.
 */
public final class Args {

    private static final Pattern NUMERIC = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private Args() {}

    /** Argument at index, or NULL when omitted. */
    public static Value arg(List<Value> args, int idx) {
        return (idx < args.size()) ? args.get(idx) : Value.nil();
    }

    public static boolean present(List<Value> args, int idx) {
        return idx < args.size() && !args.get(idx).isNull();
    }

    // ===================== NUMBERS =====================

    public static double num(List<Value> args, int idx) {
        return toNumber(arg(args, idx), idx);
    }

    /** NUMBER as is; TEXT that parses as a number; anything else is a TYPE_ERROR. */
    public static double toNumber(Value v, int idx) {
        switch (v.getType()) {
            case NUMBER:
                return v.asNumber();
            case TEXT: {
                Double parsed = parseNumber(v.asText());
                if (parsed != null) return parsed;
                throw FormulaException.type("Argument " + (idx + 1) + " must be a number, got text \"" + v.asText() + "\"", idx);
            }
            default:
                throw FormulaException.type("Argument " + (idx + 1) + " must be a number, got " + v.getType(), idx);
        }
    }

    /** Parses a decimal number, or returns null. */
    public static Double parseNumber(String s) {
        if (s == null) return null;
        String t = s.trim();
        if (!NUMERIC.matcher(t).matches()) return null;
        double d = Double.parseDouble(t);
        return Double.isInfinite(d) ? null : d;
    }

    /**
     * Flattens LIST arguments and coerces every element to a number; NULL entries are skipped
     * the way spreadsheets skip blank cells.
     */
    public static List<Double> numbers(List<Value> args) {
        List<Double> out = new ArrayList<>();
        for (int i = 0; i < args.size(); i++) {
            Value v = args.get(i);
            if (v.getType() == Value.Type.LIST) {
                for (Value item : v.asList()) {
                    if (!item.isNull()) out.add(toNumber(item, i));
                }
            } else if (!v.isNull()) {
                out.add(toNumber(v, i));
            }
        }
        return out;
    }

    // ===================== TEXT =====================

    public static String text(List<Value> args, int idx) {
        return toText(arg(args, idx));
    }

    /** NULL reads as the empty string; everything else uses its display form. */
    public static String toText(Value v) {
        return v.display();
    }

    // ===================== DATES =====================

    public static Instant date(List<Value> args, int idx, ZoneId zone) {
        return toDate(arg(args, idx), idx, zone);
    }

    /**
     * DATETIME as is; NUMBER as epoch milliseconds; TEXT as an ISO instant, local date-time or
     * local date in the given zone.
     */
    public static Instant toDate(Value v, int idx, ZoneId zone) {
        switch (v.getType()) {
            case DATETIME:
                return v.asDateTime();
            case NUMBER:
                return Instant.ofEpochMilli((long) v.asNumber());
            case TEXT:
                return parseDate(v.asText().trim(), idx, zone);
            default:
                throw FormulaException.type("Argument " + (idx + 1) + " must be a date, got " + v.getType(), idx);
        }
    }

    private static Instant parseDate(String s, int idx, ZoneId zone) {
        try {
            if (s.indexOf('T') < 0) {
                return LocalDate.parse(s).atStartOfDay(zone).toInstant();
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(s, ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime) return ((ZonedDateTime) parsed).toInstant();
            return ((LocalDateTime) parsed).atZone(zone).toInstant();
        } catch (DateTimeException e) {
            throw FormulaException.runtime("Malformed date \"" + s + "\" in argument " + (idx + 1), idx);
        }
    }

    // ===================== LOGIC =====================

    /** BOOL as is; NULL false; numbers non-zero; text non-blank; collections non-empty. */
    public static boolean truthy(Value v) {
        switch (v.getType()) {
            case BOOL:
                return v.asBool();
            case NUMBER: {
                double d = v.asNumber();
                return d != 0 && !Double.isNaN(d);
            }
            case TEXT:
                return !v.asText().trim().isEmpty();
            case LIST:
                return !v.asList().isEmpty();
            case MAP:
                return !v.asMap().isEmpty();
            case DATETIME:
                return true;
            default:
                return false;
        }
    }

    public static boolean isEmpty(Value v) {
        switch (v.getType()) {
            case NULL:
                return true;
            case TEXT:
                return v.asText().trim().isEmpty();
            case LIST:
                return v.asList().isEmpty();
            case MAP:
                return v.asMap().isEmpty();
            default:
                return false;
        }
    }

    /** True when both values can be ordered against each other. */
    public static boolean comparable(Value a, Value b) {
        Value.Type ta = a.getType();
        Value.Type tb = b.getType();
        if (ta == Value.Type.NUMBER && tb == Value.Type.NUMBER) return true;
        if (ta == Value.Type.NUMBER && tb == Value.Type.TEXT) return parseNumber(b.asText()) != null;
        if (ta == Value.Type.TEXT && tb == Value.Type.NUMBER) return parseNumber(a.asText()) != null;
        return ta == tb && (ta == Value.Type.TEXT || ta == Value.Type.DATETIME || ta == Value.Type.BOOL);
    }

    /**
     * Orders two values: numbers numerically (numeric text is coerced), datetimes
     * chronologically, text lexicographically, booleans false before true.
     */
    public static int compare(Value a, Value b) {
        if (!comparable(a, b)) {
            throw FormulaException.type("Cannot compare " + a.getType() + " with " + b.getType(), incomparableIndex(a, b));
        }
        Value.Type ta = a.getType();
        Value.Type tb = b.getType();
        if (ta == Value.Type.NUMBER || tb == Value.Type.NUMBER) {
            return Double.compare(toNumber(a, 0), toNumber(b, 1));
        }
        switch (ta) {
            case TEXT: return a.asText().compareTo(b.asText());
            case DATETIME: return a.asDateTime().compareTo(b.asDateTime());
            default: return Boolean.compare(a.asBool(), b.asBool());
        }
    }

    /** Index of the argument no coercion can bring to the other's type. */
    static int incomparableIndex(Value a, Value b) {
        if (!orderable(a.getType())) return 0;
        if (!orderable(b.getType())) return 1;
        if (a.getType() == Value.Type.TEXT && b.getType() == Value.Type.NUMBER) return 0;
        if (b.getType() == Value.Type.NUMBER || b.getType() == Value.Type.TEXT) {
            // text and numbers only coerce into each other
            return (a.getType() == Value.Type.NUMBER || a.getType() == Value.Type.TEXT) ? 1 : 0;
        }
        return 1;
    }

    private static boolean orderable(Value.Type t) {
        return t == Value.Type.NUMBER || t == Value.Type.TEXT || t == Value.Type.DATETIME || t == Value.Type.BOOL;
    }

    /** Equality used by Eq and by the matching in Count/Filter. */
    public static boolean looseEquals(Value a, Value b) {
        if (comparable(a, b)) return compare(a, b) == 0;
        return a.equals(b);
    }

    // ===================== COLLECTIONS =====================

    /** Field of a MAP item: item.fields[field] when present, else item[field]. */
    public static Value itemField(Value item, String field) {
        if (item.getType() != Value.Type.MAP) return Value.nil();
        Value nested = item.get("fields");
        if (nested.getType() == Value.Type.MAP) {
            Map<String, Value> m = nested.asMap();
            if (m.containsKey(field)) return m.get(field);
        }
        return item.get(field);
    }
}
