package org.kidoni.symbolic.parse;

import org.kidoni.symbolic.SymbolicException;

public class ParseException extends SymbolicException {
    private final int position;

    public ParseException(final String message) {
        this(message, -1);
    }

    public ParseException(final String message, final int position) {
        super(message);
        this.position = position;
    }

    public ParseException(final String message, final Throwable cause) {
        super(message, cause);
        this.position = -1;
    }

    /**
     * Zero-based character offset of the error, or -1 when unknown.
     */
    public int getPosition() {
        return position;
    }
}
