package org.kidoni.symbolic.expr;

/**
 * The relation of an {@link Expr.Eq} node.
 */
public enum Relation {
    EQUAL("=", "="),
    LESS("<", "<"),
    GREATER(">", ">"),
    LESS_EQUAL("<=", "\\le"),
    GREATER_EQUAL(">=", "\\ge"),
    NOT_EQUAL("<>", "\\ne");

    private final String symbol;
    private final String latex;

    Relation(final String symbol, final String latex) {
        this.symbol = symbol;
        this.latex = latex;
    }

    public String symbol() {
        return symbol;
    }

    public String latex() {
        return latex;
    }

    /**
     * @param comparison the sign of {@code left.compareTo(right)}
     */
    public boolean holds(final int comparison) {
        return switch (this) {
            case EQUAL -> comparison == 0;
            case LESS -> comparison < 0;
            case GREATER -> comparison > 0;
            case LESS_EQUAL -> comparison <= 0;
            case GREATER_EQUAL -> comparison >= 0;
            case NOT_EQUAL -> comparison != 0;
        };
    }

    /**
     * The relation that holds after swapping both sides: {@code a < b} iff {@code b > a}.
     */
    public Relation flipped() {
        return switch (this) {
            case LESS -> GREATER;
            case GREATER -> LESS;
            case LESS_EQUAL -> GREATER_EQUAL;
            case GREATER_EQUAL -> LESS_EQUAL;
            case EQUAL, NOT_EQUAL -> this;
        };
    }

    @Override
    public String toString() {
        return symbol;
    }
}
