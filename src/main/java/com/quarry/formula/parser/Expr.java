package com.quarry.formula.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);

        /** Character offset where the node starts in the formula text. */
        int position();
    }

    public interface ExprVisitor<R> {
        R visitLiteralExpr(Literal expr);
        R visitFieldRefExpr(FieldRef expr);
        R visitFunctionCallExpr(FunctionCall expr);
    }

    public static final class Literal implements ExprInterface {
        public final Value value;
        private final int position;

        public Literal(Value value, int position) {
            this.value = (value == null) ? Value.nil() : value;
            this.position = position;
        }

        @Override
        public int position() { return position; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }

        @Override
        public String toString() { return value.toString(); }
    }

    /** Bare identifier in argument position: reads a context field. */
    public static final class FieldRef implements ExprInterface {
        public final String name;
        private final int position;

        public FieldRef(String name, int position) {
            this.name = name;
            this.position = position;
        }

        @Override
        public int position() { return position; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitFieldRefExpr(this);
        }

        @Override
        public String toString() { return name; }
    }

    public static final class FunctionCall implements ExprInterface {
        /** Name as written by the user. */
        public final String name;
        public final List<ExprInterface> arguments;
        private final int position;

        public FunctionCall(String name, List<ExprInterface> arguments, int position) {
            this.name = name;
            this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
            this.position = position;
        }

        /** Registry key for this call. */
        public String canonicalName() {
            return name.toUpperCase(java.util.Locale.ROOT);
        }

        @Override
        public int position() { return position; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitFunctionCallExpr(this);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder(name).append('(');
            for (int i = 0; i < arguments.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(arguments.get(i));
            }
            return sb.append(')').toString();
        }
    }
}
