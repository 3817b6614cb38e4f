package org.kidoni.symbolic;

/**
 * Root of every error raised by the symbolic algebra library.
 * <p>
 * All errors are unchecked: simplification never fails, and the operations that can fail
 * (evaluation, differentiation, parsing) report malformed-but-well-typed input through a
 * subclass of this exception.
 */
public class SymbolicException extends RuntimeException {
    public SymbolicException() {
        super();
    }

    public SymbolicException(final String message) {
        super(message);
    }

    public SymbolicException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public SymbolicException(final Throwable cause) {
        super(cause);
    }

    protected SymbolicException(final String message, final Throwable cause, final boolean enableSuppression, final boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
