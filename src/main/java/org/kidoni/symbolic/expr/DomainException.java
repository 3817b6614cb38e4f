package org.kidoni.symbolic.expr;

import java.math.BigDecimal;

/**
 * A function was applied outside of its real domain, e.g. {@code ln(-1)} or {@code (-8)^0.3}.
 */
public class DomainException extends EvaluationException {
    private final String function;
    private final BigDecimal argument;

    public DomainException(final String function, final BigDecimal argument) {
        this(function, argument, "argument " + argument.toPlainString() + " is outside the domain");
    }

    public DomainException(final String function, final BigDecimal argument, final String reason) {
        super(function + ": domain error (" + reason + ")");
        this.function = function;
        this.argument = argument;
    }

    public String getFunction() {
        return function;
    }

    public BigDecimal getArgument() {
        return argument;
    }
}
