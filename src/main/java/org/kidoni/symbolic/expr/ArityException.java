package org.kidoni.symbolic.expr;

public class ArityException extends EvaluationException {
    private final String function;
    private final String expected;
    private final int actual;

    public ArityException(final String function, final String expected, final int actual) {
        super(function + " expects " + expected + " argument(s), got " + actual);
        this.function = function;
        this.expected = expected;
        this.actual = actual;
    }

    public String getFunction() {
        return function;
    }

    public String getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
