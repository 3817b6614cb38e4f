package org.kidoni.symbolic.calculus;

import org.kidoni.symbolic.SymbolicException;

public class DifferentiationException extends SymbolicException {
    public DifferentiationException(final String message) {
        super(message);
    }

    public DifferentiationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
