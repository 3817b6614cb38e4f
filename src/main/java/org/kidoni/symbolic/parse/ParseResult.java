package org.kidoni.symbolic.parse;

import org.kidoni.symbolic.expr.Expr;

/**
 * Outcome of {@link Parser#parse()}: either the parsed tree or the reason it could not be
 * built.
 */
public sealed interface ParseResult {
    boolean isValid();

    /**
     * @throws ParseException if this result is {@link Invalid}
     */
    Expr orElseThrow();

    record Parsed(Expr expr) implements ParseResult {
        @Override
        public boolean isValid() {
            return true;
        }

        @Override
        public Expr orElseThrow() {
            return expr;
        }

        @Override
        public String toString() {
            return expr.toString();
        }
    }

    record Invalid(String message, int position) implements ParseResult {
        @Override
        public boolean isValid() {
            return false;
        }

        @Override
        public Expr orElseThrow() {
            throw new ParseException(message, position);
        }

        @Override
        public String toString() {
            return "invalid: " + message;
        }
    }
}
