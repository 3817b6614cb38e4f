package org.kidoni.symbolic.expr;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Exact arithmetic over numeric leaves.
 * <p>
 * Integers and fractions stay exact: {@code Int op Int} is an {@code Int}, mixes with a
 * {@code Rational} give a reduced {@code Rational} (or an {@code Int} when the denominator
 * becomes 1). Any {@code Float} operand makes the result a {@code Float}.
 */
public abstract class Numbers {
    public static final MathContext CONTEXT = new MathContext(50, RoundingMode.HALF_EVEN);

    // exponents beyond this are left symbolic rather than materialized
    static final int MAX_EXACT_EXPONENT = 4096;

    public static final Expr.Int ZERO = new Expr.Int(BigInteger.ZERO);
    public static final Expr.Int ONE = new Expr.Int(BigInteger.ONE);
    public static final Expr.Int MINUS_ONE = new Expr.Int(BigInteger.ONE.negate());

    public static Expr.Numeric add(final Expr.Numeric left, final Expr.Numeric right) {
        if (left instanceof Expr.Float || right instanceof Expr.Float) {
            return new Expr.Float(left.decimalValue().add(right.decimalValue(), CONTEXT));
        }
        if (left instanceof Expr.Int l && right instanceof Expr.Int r) {
            return new Expr.Int(l.value().add(r.value()));
        }

        BigInteger[] a = fraction(left);
        BigInteger[] b = fraction(right);
        return of(a[0].multiply(b[1]).add(b[0].multiply(a[1])), a[1].multiply(b[1]));
    }

    public static Expr.Numeric multiply(final Expr.Numeric left, final Expr.Numeric right) {
        if (left instanceof Expr.Float || right instanceof Expr.Float) {
            return new Expr.Float(left.decimalValue().multiply(right.decimalValue(), CONTEXT));
        }
        if (left instanceof Expr.Int l && right instanceof Expr.Int r) {
            return new Expr.Int(l.value().multiply(r.value()));
        }

        BigInteger[] a = fraction(left);
        BigInteger[] b = fraction(right);
        return of(a[0].multiply(b[0]), a[1].multiply(b[1]));
    }

    public static Expr.Numeric negate(final Expr.Numeric value) {
        if (value instanceof Expr.Int i) {
            return new Expr.Int(i.value().negate());
        }
        if (value instanceof Expr.Float f) {
            return new Expr.Float(f.value().negate());
        }
        Expr.Rational r = (Expr.Rational) value;
        return of(r.numerator().negate(), r.denominator());
    }

    /**
     * {@code base^exponent} computed exactly, or empty when the result is undefined
     * ({@code 0^-n}) or the exponent is too large to materialize.
     */
    public static Optional<Expr.Numeric> pow(final Expr.Numeric base, final BigInteger exponent) {
        if (exponent.abs().compareTo(BigInteger.valueOf(MAX_EXACT_EXPONENT)) > 0) {
            return Optional.empty();
        }
        if (base.signum() == 0 && exponent.signum() < 0) {
            return Optional.empty();
        }

        int n = exponent.intValueExact();
        if (base instanceof Expr.Float f) {
            return Optional.of(new Expr.Float(f.value().pow(n, CONTEXT)));
        }

        BigInteger[] fraction = fraction(base);
        BigInteger num = fraction[0].pow(Math.abs(n));
        BigInteger den = fraction[1].pow(Math.abs(n));
        return Optional.of(n < 0 ? of(den, num) : of(num, den));
    }

    /**
     * Adopts a fraction, reduced, as an {@code Int} when the denominator is 1 and as a
     * {@code Rational} otherwise.
     */
    public static Expr.Numeric of(final BigInteger numerator, final BigInteger denominator) {
        Expr.Rational reduced = Expr.Rational.of(numerator, denominator);
        if (reduced.denominator().equals(BigInteger.ONE)) {
            return new Expr.Int(reduced.numerator());
        }
        return reduced;
    }

    public static boolean isZero(final Expr expr) {
        return expr instanceof Expr.Numeric n && n.signum() == 0;
    }

    public static boolean isOne(final Expr expr) {
        return hasValue(expr, BigDecimal.ONE);
    }

    public static boolean isMinusOne(final Expr expr) {
        return hasValue(expr, BigDecimal.ONE.negate());
    }

    public static boolean isInteger(final Expr expr) {
        return expr instanceof Expr.Int;
    }

    public static boolean isExact(final Expr expr) {
        return expr instanceof Expr.Int || expr instanceof Expr.Rational;
    }

    /**
     * The exact rational value of a constant expression such as {@code 1/3}, {@code 3^-1},
     * {@code 2*3^-1} or {@code 1/2 + 1}. Empty when the expression involves variables,
     * constants, functions or floats.
     */
    public static Optional<Expr.Numeric> exactRational(final Expr expr) {
        switch (expr.kind()) {
            case INT, RATIONAL -> {
                BigInteger[] fraction = fraction((Expr.Numeric) expr);
                return Optional.of(of(fraction[0], fraction[1]));
            }
            case MUL -> {
                Expr.Numeric product = ONE;
                for (Expr factor : ((Expr.Mul) expr).factors()) {
                    Optional<Expr.Numeric> value = exactRational(factor);
                    if (value.isEmpty()) {
                        return Optional.empty();
                    }
                    product = multiply(product, value.get());
                }
                return Optional.of(product);
            }
            case ADD -> {
                Expr.Numeric sum = ZERO;
                for (Expr term : ((Expr.Add) expr).terms()) {
                    Optional<Expr.Numeric> value = exactRational(term);
                    if (value.isEmpty()) {
                        return Optional.empty();
                    }
                    sum = add(sum, value.get());
                }
                return Optional.of(sum);
            }
            case POW -> {
                Expr.Pow pow = (Expr.Pow) expr;
                if (!(pow.exponent() instanceof Expr.Int exponent)) {
                    return Optional.empty();
                }
                return exactRational(pow.base()).flatMap(base -> pow(base, exponent.value()));
            }
            default -> {
                return Optional.empty();
            }
        }
    }

    static BigInteger[] fraction(final Expr.Numeric value) {
        if (value instanceof Expr.Int i) {
            return new BigInteger[]{i.value(), BigInteger.ONE};
        }
        if (value instanceof Expr.Rational r) {
            return new BigInteger[]{r.numerator(), r.denominator()};
        }
        throw new IllegalArgumentException("not an exact number: " + value);
    }

    private static boolean hasValue(final Expr expr, final BigDecimal expected) {
        return expr instanceof Expr.Numeric n && n.decimalValue().compareTo(expected) == 0;
    }
}
