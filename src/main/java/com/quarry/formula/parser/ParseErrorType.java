package com.quarry.formula.parser;

public enum ParseErrorType {
    UNBALANCED_PARENTHESES("UnbalancedParentheses"),
    INVALID_FORMAT("InvalidFormat"),
    UNEXPECTED_TOKEN("UnexpectedToken"),
    UNKNOWN_FUNCTION("UnknownFunction"),
    ARITY_ERROR("ArityError"),
    NESTING_TOO_DEEP("NestingTooDeep");

    private final String code;

    ParseErrorType(String code) {
        this.code = code;
    }

    /** Stable code string shown to hosts, e.g. "UnknownFunction". */
    public String code() {
        return code;
    }
}
