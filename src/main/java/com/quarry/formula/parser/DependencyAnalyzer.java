package com.quarry.formula.parser;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import com.quarry.formula.parser.Expr.ExprInterface;
import com.quarry.formula.parser.Expr.ExprVisitor;
import com.quarry.formula.parser.Expr.FieldRef;
import com.quarry.formula.parser.Expr.FunctionCall;
import com.quarry.formula.parser.Expr.Literal;

/**
 * Computes the context fields a formula reads.
 *
 * Every FieldRef contributes its name. GET and MENTION contribute their first argument when it
 * is a literal; when it is computed (a field or a nested call), {@link #ANY_FIELD} is added so
 * callers invalidate on any field change.
 */
public final class DependencyAnalyzer implements ExprVisitor<Void> {

    /** Wildcard dependency: the formula may read any field. */
    public static final String ANY_FIELD = "*";

    private final Set<String> out = new LinkedHashSet<>();

    private DependencyAnalyzer() {}

    public static Set<String> dependencies(ExprInterface ast) {
        if (ast == null) return Collections.emptySet();
        DependencyAnalyzer analyzer = new DependencyAnalyzer();
        ast.accept(analyzer);
        return Collections.unmodifiableSet(analyzer.out);
    }

    public static boolean isFieldAccessor(String functionName) {
        if (functionName == null) return false;
        return "GET".equalsIgnoreCase(functionName) || "MENTION".equalsIgnoreCase(functionName);
    }

    @Override
    public Void visitLiteralExpr(Literal expr) {
        return null;
    }

    @Override
    public Void visitFieldRefExpr(FieldRef expr) {
        out.add(expr.name);
        return null;
    }

    @Override
    public Void visitFunctionCallExpr(FunctionCall expr) {
        if (isFieldAccessor(expr.name) && !expr.arguments.isEmpty()) {
            ExprInterface first = expr.arguments.get(0);
            if (first instanceof Literal) {
                out.add(((Literal) first).value.display());
            } else {
                out.add(ANY_FIELD);
            }
        }
        for (ExprInterface arg : expr.arguments) {
            arg.accept(this);
        }
        return null;
    }
}
