package org.kidoni.symbolic.parse;

import java.io.IOException;
import java.io.PushbackReader;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.kidoni.symbolic.expr.ElementaryFunction;
import org.kidoni.symbolic.expr.LatexRenderer;

import static java.lang.Character.isDigit;
import static java.lang.Character.isLetter;
import static java.lang.Character.isWhitespace;

/**
 * Splits plain or LaTeX-flavoured math input into tokens.
 * <p>
 * A run of letters is split greedily into known words (function names, {@code pi}, greek
 * letters); whatever is left becomes single-letter variables, so {@code 2xy} reads as
 * {@code 2*x*y} and {@code xsin(y)} as {@code x*sin(y)}.
 */
class Lexer {
    private static final int EOF = -1;

    private static final Set<String> FUNCTIONS = new HashSet<>();
    private static final List<String> WORDS;

    static {
        for (ElementaryFunction function : ElementaryFunction.values()) {
            FUNCTIONS.addAll(function.names());
        }

        List<String> words = new ArrayList<>(FUNCTIONS);
        words.add("pi");
        words.addAll(LatexRenderer.GREEK);
        words.sort(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()));
        WORDS = List.copyOf(words);
    }

    private final PushbackReader reader;
    private int position;

    Lexer(final Reader reader) {
        this.reader = new PushbackReader(reader, 2);
    }

    List<Token> tokenize() throws IOException {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = next(tokens);
        }
        while (!token.is(TokenType.END));
        return tokens;
    }

    private Token next(final List<Token> tokens) throws IOException {
        skipWhitespace();

        int start = position;
        int c = read();
        if (c == EOF) {
            return add(tokens, TokenType.END, "", start);
        }

        if (isDigit(c) || (c == '.' && isDigit(peek()))) {
            unread(c);
            return readNumber(tokens);
        }
        if (isLetter(c) && c != 'π') {
            unread(c);
            readWord(tokens);
            return tokens.get(tokens.size() - 1);
        }

        return switch (c) {
            case '+' -> add(tokens, TokenType.PLUS, "+", start);
            case '-', '−' -> add(tokens, TokenType.MINUS, "-", start);
            case '*' -> {
                if (peek() == '*') {
                    read();
                    yield add(tokens, TokenType.POWER, "**", start);
                }
                yield add(tokens, TokenType.TIMES, "*", start);
            }
            case '·', '×' -> add(tokens, TokenType.TIMES, "*", start);
            case '/', '÷' -> add(tokens, TokenType.DIVIDE, "/", start);
            case '^' -> add(tokens, TokenType.POWER, "^", start);
            case '(' -> add(tokens, TokenType.LEFT_PAREN, "(", start);
            case ')' -> add(tokens, TokenType.RIGHT_PAREN, ")", start);
            case '{' -> add(tokens, TokenType.LEFT_BRACE, "{", start);
            case '}' -> add(tokens, TokenType.RIGHT_BRACE, "}", start);
            case '[' -> add(tokens, TokenType.LEFT_BRACKET, "[", start);
            case ']' -> add(tokens, TokenType.RIGHT_BRACKET, "]", start);
            case '|' -> add(tokens, TokenType.PIPE, "|", start);
            case ',' -> add(tokens, TokenType.COMMA, ",", start);
            case '_' -> add(tokens, TokenType.SUBSCRIPT, "_", start);
            case 'π' -> add(tokens, TokenType.CONSTANT, "pi", start);
            case '=' -> add(tokens, TokenType.RELATION, "=", start);
            case '≤' -> add(tokens, TokenType.RELATION, "<=", start);
            case '≥' -> add(tokens, TokenType.RELATION, ">=", start);
            case '≠' -> add(tokens, TokenType.RELATION, "<>", start);
            case '<' -> {
                if (peek() == '=') {
                    read();
                    yield add(tokens, TokenType.RELATION, "<=", start);
                }
                if (peek() == '>') {
                    read();
                    yield add(tokens, TokenType.RELATION, "<>", start);
                }
                yield add(tokens, TokenType.RELATION, "<", start);
            }
            case '>' -> {
                if (peek() == '=') {
                    read();
                    yield add(tokens, TokenType.RELATION, ">=", start);
                }
                yield add(tokens, TokenType.RELATION, ">", start);
            }
            case '!' -> {
                if (peek() == '=') {
                    read();
                    yield add(tokens, TokenType.RELATION, "<>", start);
                }
                throw new ParseException("invalid character '!' at position " + start, start);
            }
            case '\\' -> readCommand(tokens, start);
            default -> throw new ParseException("invalid character '" + (char) c + "' at position " + start, start);
        };
    }

    private Token readNumber(final List<Token> tokens) throws IOException {
        int start = position;
        StringBuilder buffer = new StringBuilder();
        boolean decimal = false;
        int c;
        while ((c = read()) != EOF) {
            if (isDigit(c)) {
                buffer.append((char) c);
            }
            else if (c == '.' && !decimal) {
                decimal = true;
                buffer.append('.');
            }
            else {
                unread(c);
                break;
            }
        }
        return add(tokens, decimal ? TokenType.DECIMAL : TokenType.INTEGER, buffer.toString(), start);
    }

    private void readWord(final List<Token> tokens) throws IOException {
        int start = position;
        StringBuilder buffer = new StringBuilder();
        int c;
        while ((c = read()) != EOF) {
            if (isLetter(c) && c != 'π') {
                buffer.append((char) c);
            }
            else {
                unread(c);
                break;
            }
        }

        String run = buffer.toString();
        int offset = 0;
        while (offset < run.length()) {
            String word = longestWord(run, offset);
            addWord(tokens, word, start + offset);
            offset += word.length();
        }
    }

    private static String longestWord(final String run, final int offset) {
        for (String word : WORDS) {
            if (run.startsWith(word, offset)) {
                return word;
            }
        }
        return run.substring(offset, offset + 1);
    }

    private static void addWord(final List<Token> tokens, final String word, final int position) {
        if (FUNCTIONS.contains(word)) {
            add(tokens, TokenType.FUNCTION, word, position);
        }
        else if (word.equals("pi") || word.equals("e")) {
            add(tokens, TokenType.CONSTANT, word, position);
        }
        else {
            add(tokens, TokenType.IDENTIFIER, word, position);
        }
    }

    /**
     * A backslash command such as {@code \frac}, {@code \cdot} or {@code \left(}.
     */
    private Token readCommand(final List<Token> tokens, final int start) throws IOException {
        StringBuilder buffer = new StringBuilder();
        int c;
        while ((c = read()) != EOF) {
            if (isLetter(c)) {
                buffer.append((char) c);
            }
            else {
                unread(c);
                break;
            }
        }

        String command = buffer.toString();
        if (command.isEmpty()) {
            c = read();
            return switch (c) {
                case ' ', ',', ';', '!' -> next(tokens);
                case '{' -> add(tokens, TokenType.LEFT_BRACE, "{", start);
                case '}' -> add(tokens, TokenType.RIGHT_BRACE, "}", start);
                case '|' -> add(tokens, TokenType.PIPE, "|", start);
                default -> throw new ParseException("invalid command at position " + start, start);
            };
        }

        return switch (command) {
            case "left", "right" -> {
                skipWhitespace();
                int bracket = read();
                yield switch (bracket) {
                    case '(' -> add(tokens, TokenType.LEFT_PAREN, "(", start);
                    case ')' -> add(tokens, TokenType.RIGHT_PAREN, ")", start);
                    case '[' -> add(tokens, TokenType.LEFT_PAREN, "(", start);
                    case ']' -> add(tokens, TokenType.RIGHT_PAREN, ")", start);
                    case '|' -> add(tokens, TokenType.PIPE, "|", start);
                    case '.' -> next(tokens);
                    case '\\' -> {
                        int brace = read();
                        if (brace == '{') {
                            yield add(tokens, TokenType.LEFT_BRACE, "{", start);
                        }
                        if (brace == '}') {
                            yield add(tokens, TokenType.RIGHT_BRACE, "}", start);
                        }
                        throw new ParseException("invalid delimiter after \\" + command + " at position " + start, start);
                    }
                    default -> throw new ParseException("invalid delimiter after \\" + command + " at position " + start, start);
                };
            }
            case "cdot", "times", "ast" -> add(tokens, TokenType.TIMES, "*", start);
            case "div" -> add(tokens, TokenType.DIVIDE, "/", start);
            case "sqrt" -> add(tokens, TokenType.SQRT, "\\sqrt", start);
            case "frac", "dfrac", "tfrac" -> add(tokens, TokenType.FRAC, "\\frac", start);
            case "le", "leq" -> add(tokens, TokenType.RELATION, "<=", start);
            case "ge", "geq" -> add(tokens, TokenType.RELATION, ">=", start);
            case "ne", "neq" -> add(tokens, TokenType.RELATION, "<>", start);
            case "lt" -> add(tokens, TokenType.RELATION, "<", start);
            case "gt" -> add(tokens, TokenType.RELATION, ">", start);
            case "pi" -> add(tokens, TokenType.CONSTANT, "pi", start);
            case "space", "quad", "qquad" -> next(tokens);
            default -> {
                if (FUNCTIONS.contains(command)) {
                    yield add(tokens, TokenType.FUNCTION, command, start);
                }
                if (LatexRenderer.GREEK.contains(command)) {
                    yield add(tokens, TokenType.IDENTIFIER, command, start);
                }
                throw new ParseException("unknown command \\" + command + " at position " + start, start);
            }
        };
    }

    private static Token add(final List<Token> tokens, final TokenType type, final String text, final int position) {
        Token token = new Token(type, text, position);
        tokens.add(token);
        return token;
    }

    private void skipWhitespace() throws IOException {
        int c;
        while ((c = read()) != EOF) {
            if (!isWhitespace(c)) {
                unread(c);
                break;
            }
        }
    }

    private int read() throws IOException {
        int c = reader.read();
        if (c != EOF) {
            position++;
        }
        return c;
    }

    private int peek() throws IOException {
        int c = reader.read();
        if (c != EOF) {
            reader.unread(c);
        }
        return c;
    }

    private void unread(final int c) throws IOException {
        if (c != EOF) {
            reader.unread(c);
            position--;
        }
    }
}
