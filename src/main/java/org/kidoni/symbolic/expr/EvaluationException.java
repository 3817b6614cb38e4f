package org.kidoni.symbolic.expr;

import org.kidoni.symbolic.SymbolicException;

/**
 * An expression could not be reduced to a number with the given bindings.
 */
public class EvaluationException extends SymbolicException {
    public EvaluationException(final String message) {
        super(message);
    }

    public EvaluationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
