package com.quarry.formula.parser;

import java.util.Collections;
import java.util.Set;

import com.quarry.formula.parser.Expr.FunctionCall;

/** Outcome of parsing one formula: an AST plus its dependencies, or a structured error. */
public final class ParseResult {
    private final String formula;
    private final FunctionCall ast;
    private final Set<String> dependencies;
    private final FormulaError error;
    private final ParseErrorType parseErrorType;

    private ParseResult(String formula, FunctionCall ast, Set<String> dependencies, FormulaError error, ParseErrorType parseErrorType) {
        this.formula = formula;
        this.ast = ast;
        this.dependencies = dependencies;
        this.error = error;
        this.parseErrorType = parseErrorType;
    }

    public static ParseResult success(String formula, FunctionCall ast, Set<String> dependencies) {
        return new ParseResult(formula, ast, dependencies == null ? Collections.emptySet() : dependencies, null, null);
    }

    public static ParseResult failure(String formula, FormulaException e) {
        ParseErrorType type = (e instanceof FormulaParseException) ? ((FormulaParseException) e).type() : null;
        return new ParseResult(formula, null, Collections.emptySet(), e.toError(), type);
    }

    public boolean isSuccess() { return error == null; }
    public String formula() { return formula; }

    /** Root call, or null on failure. */
    public FunctionCall ast() { return ast; }

    public Set<String> dependencies() { return dependencies; }

    /** Error, or null on success. */
    public FormulaError error() { return error; }

    /** Structured parse failure type; null on success and for lex errors. */
    public ParseErrorType parseErrorType() { return parseErrorType; }

    @Override
    public String toString() {
        return isSuccess() ? "ParseResult[" + ast + ", deps=" + dependencies + "]" : "ParseResult[" + error + "]";
    }
}
