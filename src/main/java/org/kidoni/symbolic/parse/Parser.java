package org.kidoni.symbolic.parse;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.kidoni.symbolic.expr.Expr;
import org.kidoni.symbolic.expr.Numbers;
import org.kidoni.symbolic.expr.Relation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive descent parser for plain and LaTeX-style math input.
 * <p>
 * Grammar:
 * <pre>
 *  expression: arith (relation arith)?
 *  arith:      term (('+' | '-') term)*
 *  term:       unary (('*' | '/' | implicit) unary)*
 *  unary:      '-' unary | power
 *  power:      primary (('^' | '**') unary)?
 *  primary:    number | variable | constant | function | '(' expression ')' | '{' expression '}'
 *              | '|' expression '|' | '\sqrt' ('[' expression ']')? group | '\frac' group group
 * </pre>
 * Subtraction is addition of {@code -1*b} and division is multiplication by {@code b^-1}.
 */
public class Parser {
    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    private final Reader reader;

    private List<Token> tokens;
    private int index;
    private int absDepth;

    public Parser(final InputStream inputStream) {
        this(new InputStreamReader(inputStream, StandardCharsets.UTF_8));
    }

    public Parser(final Reader reader) {
        assert reader != null;
        this.reader = reader;
    }

    public static ParseResult parse(final String input) {
        return new Parser(new StringReader(input)).parse();
    }

    /**
     * Parses the whole input. Never throws; malformed input yields {@link ParseResult.Invalid}.
     */
    public ParseResult parse() {
        ParseResult result;

        try {
            tokens = new Lexer(reader).tokenize();
            index = 0;
            absDepth = 0;

            if (current().is(TokenType.END)) {
                throw new ParseException("unexpected end of input", current().position());
            }

            Expr expr = parseExpression();
            if (!current().is(TokenType.END)) {
                throw unexpected(current());
            }
            result = new ParseResult.Parsed(expr);
        }
        catch (NumberFormatException | IOException e) {
            result = new ParseResult.Invalid(e.getMessage(), -1);
        }
        catch (ParseException e) {
            result = new ParseResult.Invalid(e.getMessage(), e.getPosition());
        }

        log.debug("parsed: {}", result);
        return result;
    }

    private Expr parseExpression() {
        Expr left = parseArithmetic();
        if (current().is(TokenType.RELATION)) {
            Relation relation = relation(advance().text());
            Expr right = parseArithmetic();
            return new Expr.Eq(left, right, relation);
        }
        return left;
    }

    private Expr parseArithmetic() {
        List<Expr> terms = new ArrayList<>();
        terms.add(parseTerm());

        while (current().is(TokenType.PLUS) || current().is(TokenType.MINUS)) {
            boolean minus = advance().is(TokenType.MINUS);
            Expr right = parseTerm();
            terms.add(minus ? new Expr.Mul(Numbers.MINUS_ONE, right) : right);
        }

        return terms.size() == 1 ? terms.get(0) : new Expr.Add(terms);
    }

    private Expr parseTerm() {
        List<Expr> factors = new ArrayList<>();
        factors.add(parseUnary());

        while (true) {
            if (current().is(TokenType.TIMES)) {
                advance();
                factors.add(parseUnary());
            }
            else if (current().is(TokenType.DIVIDE)) {
                advance();
                factors.add(new Expr.Pow(parseUnary(), Numbers.MINUS_ONE));
            }
            else if (isImplicitMultiplication()) {
                factors.add(parseUnary());
            }
            else {
                break;
            }
        }

        return factors.size() == 1 ? factors.get(0) : new Expr.Mul(factors);
    }

    private boolean isImplicitMultiplication() {
        return switch (current().type()) {
            case IDENTIFIER, CONSTANT, FUNCTION, LEFT_PAREN, LEFT_BRACE, SQRT, FRAC -> true;
            case PIPE -> absDepth == 0;
            default -> false;
        };
    }

    private Expr parseUnary() {
        Token token = current();
        if (token.is(TokenType.PLUS)) {
            throw unexpected(token);
        }
        if (!token.is(TokenType.MINUS)) {
            return parsePower();
        }

        advance();
        Expr operand = parseUnary();
        if (operand instanceof Expr.Int i && i.signum() > 0) {
            return new Expr.Int(i.value().negate());
        }
        if (operand instanceof Expr.Float f && f.signum() > 0) {
            return new Expr.Float(f.value().negate());
        }
        // includes -0, kept as -1*0
        return new Expr.Mul(Numbers.MINUS_ONE, operand);
    }

    private Expr parsePower() {
        Expr base = parsePrimary();
        if (current().is(TokenType.POWER)) {
            advance();
            return new Expr.Pow(base, parseUnary());
        }
        return base;
    }

    private Expr parsePrimary() {
        Token token = advance();
        return switch (token.type()) {
            case INTEGER -> new Expr.Int(new BigInteger(token.text()));
            case DECIMAL -> new Expr.Float(new BigDecimal(token.text()));
            case IDENTIFIER -> variable(token.text());
            case CONSTANT -> token.text().equals("pi") ? Expr.Const.PI : Expr.Const.E;
            case FUNCTION -> function(token.text());
            case LEFT_PAREN -> closedBy(parseExpression(), TokenType.RIGHT_PAREN);
            case LEFT_BRACE -> closedBy(parseExpression(), TokenType.RIGHT_BRACE);
            case PIPE -> {
                absDepth++;
                Expr operand = parseExpression();
                absDepth--;
                yield new Expr.Func("abs", closedBy(operand, TokenType.PIPE));
            }
            case SQRT -> squareRoot();
            case FRAC -> {
                Expr numerator = group();
                Expr denominator = group();
                yield new Expr.Mul(numerator, new Expr.Pow(denominator, Numbers.MINUS_ONE));
            }
            default -> throw unexpected(token);
        };
    }

    private Expr variable(final String name) {
        if (!current().is(TokenType.SUBSCRIPT)) {
            return new Expr.Var(name);
        }

        advance();
        StringBuilder subscript = new StringBuilder();
        if (current().is(TokenType.LEFT_BRACE)) {
            advance();
            while (!current().is(TokenType.RIGHT_BRACE)) {
                if (current().is(TokenType.END)) {
                    throw unexpected(current());
                }
                subscript.append(advance().text());
            }
            advance();
        }
        else if (current().is(TokenType.INTEGER) || current().is(TokenType.IDENTIFIER)) {
            subscript.append(advance().text());
        }
        else {
            throw unexpected(current());
        }
        return new Expr.Var(name + "_" + subscript);
    }

    private Expr function(final String name) {
        if (current().is(TokenType.LEFT_PAREN)) {
            Token open = advance();
            if (current().is(TokenType.RIGHT_PAREN)) {
                throw new ParseException("empty function call not allowed: " + name + "()", open.position());
            }

            List<Expr> args = new ArrayList<>();
            args.add(parseExpression());
            while (current().is(TokenType.COMMA)) {
                advance();
                args.add(parseExpression());
            }
            expect(TokenType.RIGHT_PAREN);
            return new Expr.Func(name, args);
        }
        if (current().is(TokenType.LEFT_BRACE)) {
            return new Expr.Func(name, group());
        }
        return new Expr.Func(name, parsePrimary());
    }

    // \sqrt{x} or \sqrt[n]{x}, the latter as x^(n^-1)
    private Expr squareRoot() {
        Expr index = null;
        if (current().is(TokenType.LEFT_BRACKET)) {
            advance();
            index = closedBy(parseExpression(), TokenType.RIGHT_BRACKET);
        }

        Expr radicand = current().is(TokenType.LEFT_BRACE) ? group() : parsePrimary();
        if (index != null) {
            return new Expr.Pow(radicand, new Expr.Pow(index, Numbers.MINUS_ONE));
        }
        return new Expr.Func("sqrt", radicand);
    }

    private Expr group() {
        expect(TokenType.LEFT_BRACE);
        return closedBy(parseExpression(), TokenType.RIGHT_BRACE);
    }

    private Expr closedBy(final Expr expr, final TokenType closing) {
        expect(closing);
        return expr;
    }

    private static Relation relation(final String symbol) {
        return switch (symbol) {
            case "=" -> Relation.EQUAL;
            case "<" -> Relation.LESS;
            case ">" -> Relation.GREATER;
            case "<=" -> Relation.LESS_EQUAL;
            case ">=" -> Relation.GREATER_EQUAL;
            case "<>" -> Relation.NOT_EQUAL;
            default -> throw new ParseException("unknown relation: " + symbol);
        };
    }

    private void expect(final TokenType type) {
        Token token = current();
        if (!token.is(type)) {
            throw new ParseException("expected '" + type.display("") + "', got " + token + " at position " + token.position(),
                    token.position());
        }
        advance();
    }

    private static ParseException unexpected(final Token token) {
        if (token.is(TokenType.END)) {
            return new ParseException("unexpected end of input", token.position());
        }
        return new ParseException("unexpected token " + token + " at position " + token.position(), token.position());
    }

    private Token current() {
        return tokens.get(index);
    }

    private Token advance() {
        Token token = tokens.get(index);
        if (!token.is(TokenType.END)) {
            index++;
        }
        return token;
    }
}
