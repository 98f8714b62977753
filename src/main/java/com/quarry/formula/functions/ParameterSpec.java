package com.quarry.formula.functions;

import com.quarry.formula.parser.Value;

public final class ParameterSpec {
    public final String name;
    public final ParamType type;
    public final boolean required;
    /** Repeats for every remaining argument; only the last parameter may be variadic. */
    public final boolean variadic;
    public final String description;
    /** Default applied when an optional argument is omitted, or null. */
    public final Value defaultValue;

    private ParameterSpec(String name, ParamType type, boolean required, boolean variadic, String description, Value defaultValue) {
        this.name = name;
        this.type = type;
        this.required = required;
        this.variadic = variadic;
        this.description = description;
        this.defaultValue = defaultValue;
    }

    public static ParameterSpec required(String name, ParamType type, String description) {
        return new ParameterSpec(name, type, true, false, description, null);
    }

    public static ParameterSpec optional(String name, ParamType type, String description, Value defaultValue) {
        return new ParameterSpec(name, type, false, false, description, defaultValue);
    }

    /** One or more values. */
    public static ParameterSpec variadic(String name, ParamType type, String description) {
        return new ParameterSpec(name, type, true, true, description, null);
    }

    /** Type label as shown in the catalog, e.g. "number[]" for variadic numbers. */
    public String typeLabel() {
        return variadic ? type.label() + "[]" : type.label();
    }
}
