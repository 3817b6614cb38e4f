package org.kidoni.symbolic.parse;

enum TokenType {
    INTEGER,
    DECIMAL,
    IDENTIFIER,
    FUNCTION,
    CONSTANT,
    PLUS("+"),
    MINUS("-"),
    TIMES("*"),
    DIVIDE("/"),
    POWER("^"),
    LEFT_PAREN("("),
    RIGHT_PAREN(")"),
    LEFT_BRACE("{"),
    RIGHT_BRACE("}"),
    LEFT_BRACKET("["),
    RIGHT_BRACKET("]"),
    PIPE("|"),
    COMMA(","),
    SUBSCRIPT("_"),
    RELATION,
    SQRT("\\sqrt"),
    FRAC("\\frac"),
    END("end of input");

    private final String display;

    TokenType() {
        this.display = null;
    }

    TokenType(final String display) {
        this.display = display;
    }

    String display(final String text) {
        return display != null ? display : text;
    }
}
