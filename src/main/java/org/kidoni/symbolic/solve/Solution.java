package org.kidoni.symbolic.solve;

import org.kidoni.symbolic.expr.Expr;

/**
 * One root. {@code exact} is false for decimal approximations.
 */
public record Solution(String variable, Expr value, boolean real, boolean exact) {
    @Override
    public String toString() {
        return variable + " = " + value;
    }
}
