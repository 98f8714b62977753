package com.quarry.formula.parser;

/**
 * Failure raised while lexing, parsing or evaluating a formula.
 *
 * Public engine entry points never let this escape; they convert it to a {@link FormulaError}.
 */
public class FormulaException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final int position;
    private final String functionName;
    private final int argumentIndex;

    public FormulaException(ErrorKind kind, String message) {
        this(kind, message, -1, null, -1, null);
    }

    public FormulaException(ErrorKind kind, String message, int position) {
        this(kind, message, position, null, -1, null);
    }

    public FormulaException(ErrorKind kind, String message, int position, String functionName, int argumentIndex, Throwable cause) {
        super(message, cause);
        this.kind = (kind == null) ? ErrorKind.RUNTIME_ERROR : kind;
        this.position = position;
        this.functionName = functionName;
        this.argumentIndex = argumentIndex;
    }

    public static FormulaException type(String message, int argumentIndex) {
        return new FormulaException(ErrorKind.TYPE_ERROR, message, -1, null, argumentIndex, null);
    }

    public static FormulaException runtime(String message) {
        return new FormulaException(ErrorKind.RUNTIME_ERROR, message);
    }

    public static FormulaException runtime(String message, int argumentIndex) {
        return new FormulaException(ErrorKind.RUNTIME_ERROR, message, -1, null, argumentIndex, null);
    }

    public ErrorKind kind() { return kind; }

    /** Character offset of the offending token, or -1. */
    public int position() { return position; }

    /** Name of the failing function, or null when the failure is not tied to a call. */
    public String functionName() { return functionName; }

    /** Zero-based index of the offending argument, or -1. */
    public int argumentIndex() { return argumentIndex; }

    /**
     * Returns a copy attributed to the given call. Attribution already present is kept, so the
     * innermost failing call wins when errors bubble out of nested calls.
     */
    public FormulaException attribute(String function, int position) {
        if (this.functionName != null) return this;
        return new FormulaException(kind, getMessage(), this.position >= 0 ? this.position : position,
                function, argumentIndex, getCause());
    }

    /** Short code used in {@link FormulaError#code()}. */
    public String code() {
        switch (kind) {
            case LEX_ERROR: return "LexError";
            case PARSE_ERROR: return "ParseError";
            case TYPE_ERROR: return "TypeError";
            case TIMEOUT_ERROR: return "TimeoutError";
            default: return "RuntimeError";
        }
    }

    public FormulaError toError() {
        return new FormulaError(kind, code(), getMessage(), position, functionName, argumentIndex);
    }
}
