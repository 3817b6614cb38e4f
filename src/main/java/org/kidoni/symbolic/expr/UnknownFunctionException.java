package org.kidoni.symbolic.expr;

public class UnknownFunctionException extends EvaluationException {
    private final String name;

    public UnknownFunctionException(final String name) {
        super("unsupported function: " + name);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
