package org.kidoni.symbolic.expr;

public class UndefinedVariableException extends EvaluationException {
    private final String name;

    public UndefinedVariableException(final String name) {
        super("undefined variable: " + name);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
