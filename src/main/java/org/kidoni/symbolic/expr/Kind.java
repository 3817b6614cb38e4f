package org.kidoni.symbolic.expr;

/**
 * Discriminant of the closed {@link Expr} variant set. Algorithms dispatch with an
 * exhaustive {@code switch} over this enum, so a new variant breaks every such switch at
 * compile time.
 */
public enum Kind {
    INT,
    FLOAT,
    RATIONAL,
    VAR,
    CONST,
    ADD,
    MUL,
    POW,
    FUNC,
    EQ;

    public boolean isNumeric() {
        return this == INT || this == FLOAT || this == RATIONAL;
    }
}
