package org.kidoni.symbolic.calculus;

/**
 * No differentiation rule applies: an unknown function, a multi-argument function, or an
 * equation.
 */
public class UnsupportedDifferentiationException extends DifferentiationException {
    public UnsupportedDifferentiationException(final String reason) {
        super(reason);
    }

    public UnsupportedDifferentiationException(final String reason, final Throwable cause) {
        super(reason, cause);
    }
}
