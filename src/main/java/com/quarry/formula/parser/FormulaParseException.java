package com.quarry.formula.parser;

/** Parse failure with a structured {@link ParseErrorType} and, for arity errors, the expected bounds. */
public class FormulaParseException extends FormulaException {

    private static final long serialVersionUID = 1L;

    private final ParseErrorType type;
    private final int expectedMin;
    private final int expectedMax;
    private final int actual;

    public FormulaParseException(ParseErrorType type, String message, int position, String functionName) {
        this(type, message, position, functionName, -1, -1, -1);
    }

    private FormulaParseException(ParseErrorType type, String message, int position, String functionName,
                                  int expectedMin, int expectedMax, int actual) {
        super(ErrorKind.PARSE_ERROR, message, position, functionName, -1, null);
        this.type = type;
        this.expectedMin = expectedMin;
        this.expectedMax = expectedMax;
        this.actual = actual;
    }

    /** expectedMax of -1 means the function is variadic. */
    public static FormulaParseException arity(String functionName, int expectedMin, int expectedMax, int actual, int position) {
        String expected;
        if (expectedMax < 0) expected = "at least " + expectedMin;
        else if (expectedMin == expectedMax) expected = String.valueOf(expectedMin);
        else expected = expectedMin + " to " + expectedMax;
        String msg = functionName + "() expects " + expected + " argument" + ("1".equals(expected) ? "" : "s") + ", got " + actual;
        return new FormulaParseException(ParseErrorType.ARITY_ERROR, msg, position, functionName, expectedMin, expectedMax, actual);
    }

    public ParseErrorType type() { return type; }
    public int expectedMin() { return expectedMin; }
    public int expectedMax() { return expectedMax; }
    public int actual() { return actual; }

    @Override
    public String code() {
        return type.code();
    }
}
