package org.kidoni.symbolic.parse;

record Token(TokenType type, String text, int position) {
    boolean is(final TokenType other) {
        return type == other;
    }

    @Override
    public String toString() {
        return "'" + type.display(text) + "'";
    }
}
