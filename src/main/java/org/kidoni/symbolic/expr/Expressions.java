package org.kidoni.symbolic.expr;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

/**
 * Static factories for building expression trees.
 */
public abstract class Expressions {
    public static Expr add(final Expr... terms) {
        return new Expr.Add(terms);
    }

    public static Expr add(final List<Expr> terms) {
        return new Expr.Add(terms);
    }

    public static Expr mul(final Expr... factors) {
        return new Expr.Mul(factors);
    }

    public static Expr mul(final List<Expr> factors) {
        return new Expr.Mul(factors);
    }

    public static Expr pow(final Expr base, final Expr exponent) {
        return new Expr.Pow(base, exponent);
    }

    public static Expr pow(final Expr base, final long exponent) {
        return new Expr.Pow(base, integer(exponent));
    }

    public static Expr.Var var(final String name) {
        return new Expr.Var(name);
    }

    public static Expr.Int integer(final long value) {
        return new Expr.Int(value);
    }

    public static Expr.Int integer(final BigInteger value) {
        return new Expr.Int(value);
    }

    public static Expr.Float decimal(final String value) {
        return new Expr.Float(new BigDecimal(value));
    }

    public static Expr.Float decimal(final BigDecimal value) {
        return new Expr.Float(value);
    }

    /**
     * A fraction reduced to lowest terms with a positive denominator.
     *
     * @throws IllegalArgumentException if {@code denominator} is zero
     */
    public static Expr.Rational rational(final long numerator, final long denominator) {
        return Expr.Rational.of(numerator, denominator);
    }

    public static Expr.Rational rational(final BigInteger numerator, final BigInteger denominator) {
        return Expr.Rational.of(numerator, denominator);
    }

    /**
     * A fraction kept exactly as given, e.g. {@code 2/4}. Only for reproducing externally
     * supplied forms; arithmetic always produces reduced fractions.
     */
    public static Expr.Rational rationalPreserved(final long numerator, final long denominator) {
        return Expr.Rational.preserved(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    public static Expr func(final String name, final Expr... args) {
        return new Expr.Func(name, args);
    }

    public static Expr func(final String name, final List<Expr> args) {
        return new Expr.Func(name, args);
    }

    public static Expr.Eq eq(final Expr left, final Expr right) {
        return new Expr.Eq(left, right, Relation.EQUAL);
    }

    public static Expr.Eq eq(final Expr left, final Expr right, final Relation relation) {
        return new Expr.Eq(left, right, relation);
    }

    public static Expr.Const constant(final String name, final BigDecimal value) {
        return new Expr.Const(name, value);
    }

    public static Expr negate(final Expr expr) {
        return new Expr.Mul(new Expr.Int(-1), expr);
    }
}
