package com.quarry.formula.parser;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tagged formula value. Instances are immutable; LIST and MAP payloads are wrapped read-only.
 */
public final class Value {
    public enum Type { NUMBER, TEXT, BOOL, DATETIME, LIST, MAP, NULL }

    private static final Value NULL = new Value(Type.NULL, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value number(double d) { return new Value(Type.NUMBER, d); }
    public static Value text(String s) { return (s == null) ? NULL : new Value(Type.TEXT, s); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value dateTime(Instant t) { return (t == null) ? NULL : new Value(Type.DATETIME, t); }
    public static Value nil() { return NULL; }

    public static Value list(List<Value> items) {
        if (items == null) return new Value(Type.LIST, Collections.emptyList());
        List<Value> copy = new ArrayList<>(items.size());
        for (Value v : items) copy.add(v == null ? NULL : v);
        return new Value(Type.LIST, Collections.unmodifiableList(copy));
    }

    public static Value map(Map<String, Value> entries) {
        Map<String, Value> copy = new LinkedHashMap<>();
        if (entries != null) {
            for (Map.Entry<String, Value> e : entries.entrySet()) {
                copy.put(e.getKey(), e.getValue() == null ? NULL : e.getValue());
            }
        }
        return new Value(Type.MAP, Collections.unmodifiableMap(copy));
    }

    public Type getType() { return type; }

    public boolean isNull() { return type == Type.NULL; }

    public double asNumber() {
        if (type != Type.NUMBER) throw mismatch("number");
        return (double) value;
    }

    public String asText() {
        if (type != Type.TEXT) throw mismatch("text");
        return (String) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw mismatch("bool");
        return (boolean) value;
    }

    public Instant asDateTime() {
        if (type != Type.DATETIME) throw mismatch("datetime");
        return (Instant) value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asList() {
        if (type != Type.LIST) throw mismatch("list");
        return (List<Value>) value;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Value> asMap() {
        if (type != Type.MAP) throw mismatch("map");
        return (Map<String, Value>) value;
    }

    /** MAP field lookup; NULL for non-maps and missing keys. */
    public Value get(String key) {
        if (type != Type.MAP) return NULL;
        Value v = asMap().get(key);
        return (v == null) ? NULL : v;
    }

    private FormulaException mismatch(String expected) {
        return FormulaException.type("Expected " + expected + ", got " + type, -1);
    }

    /** Human-readable rendering used for text coercion and previews. */
    public String display() {
        switch (type) {
            case NUMBER:
                return formatNumber(asNumber());
            case TEXT:
                return asText();
            case BOOL:
                return Boolean.toString(asBool());
            case DATETIME:
                return asDateTime().toString();
            case LIST:
            case MAP:
                return ValueJson.toJsonString(this);
            default:
                return "";
        }
    }

    static String formatNumber(double d) {
        if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
            return Long.toString((long) d);
        }
        return Double.toString(d);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (type != other.type) return false;
        if (type == Type.NUMBER) {
            return Double.compare(asNumber(), other.asNumber()) == 0;
        }
        return Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        switch (type) {
            case TEXT:
                return '"' + asText() + '"';
            case NULL:
                return "null";
            default:
                return display();
        }
    }
}
