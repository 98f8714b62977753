package com.quarry.formula.parser;

import java.util.Objects;

/**
 * Immutable, host-facing description of a failed parse or evaluation.
 *
 * Carries enough detail (kind, code, position, function, argument index) for an editor to
 * render an inline message without access to engine internals.
 */
public final class FormulaError {
    private final ErrorKind kind;
    private final String code;
    private final String message;
    private final int position;
    private final String functionName;
    private final int argumentIndex;

    public FormulaError(ErrorKind kind, String code, String message, int position, String functionName, int argumentIndex) {
        this.kind = kind;
        this.code = code;
        this.message = (message == null) ? "" : message;
        this.position = position;
        this.functionName = functionName;
        this.argumentIndex = argumentIndex;
    }

    public ErrorKind kind() { return kind; }
    public String code() { return code; }
    public String message() { return message; }
    public int position() { return position; }
    public String functionName() { return functionName; }
    public int argumentIndex() { return argumentIndex; }

    /** One-line text for inline display, e.g. "TypeError in ROUND (argument 1): ...". */
    public String describe() {
        StringBuilder sb = new StringBuilder(code);
        if (functionName != null) sb.append(" in ").append(functionName);
        if (argumentIndex >= 0) sb.append(" (argument ").append(argumentIndex + 1).append(')');
        if (position >= 0) sb.append(" at position ").append(position);
        return sb.append(": ").append(message).toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FormulaError)) return false;
        FormulaError other = (FormulaError) o;
        return kind == other.kind && position == other.position && argumentIndex == other.argumentIndex
                && Objects.equals(code, other.code) && message.equals(other.message)
                && Objects.equals(functionName, other.functionName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, code, message, position, functionName, argumentIndex);
    }

    @Override
    public String toString() {
        return describe();
    }
}
