package com.quarry.formula.functions;

import com.quarry.formula.parser.Value;

/**
 * Declared parameter type. {@link #accepts} is a soft check run before dispatch: it only rejects
 * values no coercion rule could turn into the declared type.
 */
public enum ParamType {
    NUMBER("number"),
    TEXT("string"),
    BOOLEAN("boolean"),
    DATETIME("date"),
    LIST("array"),
    PLACE("place"),
    ANY("any");

    private final String label;

    ParamType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean accepts(Value v, boolean variadic) {
        Value.Type t = v.getType();
        switch (this) {
            case NUMBER:
                return t == Value.Type.NUMBER || t == Value.Type.TEXT || t == Value.Type.NULL
                        || (variadic && t == Value.Type.LIST);
            case DATETIME:
                return t == Value.Type.DATETIME || t == Value.Type.TEXT || t == Value.Type.NUMBER;
            case PLACE:
                return t == Value.Type.TEXT || t == Value.Type.MAP;
            default:
                return true;
        }
    }
}
