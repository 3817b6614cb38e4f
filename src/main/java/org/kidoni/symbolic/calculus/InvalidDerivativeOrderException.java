package org.kidoni.symbolic.calculus;

public class InvalidDerivativeOrderException extends DifferentiationException {
    private final int order;

    public InvalidDerivativeOrderException(final int order) {
        super("derivative order must be non-negative, got " + order);
        this.order = order;
    }

    public int getOrder() {
        return order;
    }
}
