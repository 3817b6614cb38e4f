package org.kidoni.symbolic.expr;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * An immutable node of a mathematical expression tree.
 * <p>
 * The variant set is closed: numeric leaves ({@link Int}, {@link Float}, {@link Rational}),
 * symbolic leaves ({@link Var}, {@link Const}), n-ary {@link Add} and {@link Mul}, binary
 * {@link Pow}, named {@link Func} application and the {@link Eq} relation wrapper. Every
 * transformation builds a new tree; no node is ever changed after construction.
 * <p>
 * {@code toString()} is the canonical textual rendering. The simplifier uses it as a
 * grouping key for like terms, so it must stay deterministic.
 */
public sealed interface Expr {

    Kind kind();

    /**
     * A fully independent copy of this tree.
     */
    Expr deepCopy();

    default BigDecimal eval(final Map<String, BigDecimal> bindings) {
        return Evaluator.evaluate(this, bindings);
    }

    default BigDecimal eval() {
        return eval(Map.of());
    }

    default String toLatex() {
        return LatexRenderer.render(this);
    }

    /**
     * Variable names in first-seen order, without duplicates. Constants are not variables.
     */
    default List<String> freeVariables() {
        Set<String> names = new LinkedHashSet<>();
        collectVariables(this, names);
        return List.copyOf(names);
    }

    default boolean dependsOn(final String variable) {
        return freeVariables().contains(variable);
    }

    /**
     * Same variant and positionally equal children. Sums and products with reordered
     * operands are <em>not</em> structurally equal.
     */
    default boolean structuralEquals(final Expr other) {
        if (other == null || other.kind() != kind()) {
            return false;
        }

        return switch (kind()) {
            case INT -> ((Int) this).value().equals(((Int) other).value());
            case FLOAT -> ((Float) this).value().compareTo(((Float) other).value()) == 0;
            case RATIONAL -> {
                Rational r = (Rational) this;
                Rational o = (Rational) other;
                yield r.numerator().equals(o.numerator()) && r.denominator().equals(o.denominator());
            }
            case VAR -> ((Var) this).name().equals(((Var) other).name());
            case CONST -> ((Const) this).name().equals(((Const) other).name());
            case ADD -> positionallyEqual(((Add) this).terms(), ((Add) other).terms());
            case MUL -> positionallyEqual(((Mul) this).factors(), ((Mul) other).factors());
            case POW -> {
                Pow p = (Pow) this;
                Pow o = (Pow) other;
                yield p.base().structuralEquals(o.base()) && p.exponent().structuralEquals(o.exponent());
            }
            case FUNC -> {
                Func f = (Func) this;
                Func o = (Func) other;
                yield f.name().equals(o.name()) && positionallyEqual(f.args(), o.args());
            }
            case EQ -> {
                Eq e = (Eq) this;
                Eq o = (Eq) other;
                yield e.relation() == o.relation()
                        && e.left().structuralEquals(o.left())
                        && e.right().structuralEquals(o.right());
            }
        };
    }

    private static boolean positionallyEqual(final List<Expr> left, final List<Expr> right) {
        if (left.size() != right.size()) {
            return false;
        }
        for (int i = 0; i < left.size(); i++) {
            if (!left.get(i).structuralEquals(right.get(i))) {
                return false;
            }
        }
        return true;
    }

    private static void collectVariables(final Expr expr, final Set<String> names) {
        switch (expr.kind()) {
            case VAR -> names.add(((Var) expr).name());
            case ADD -> ((Add) expr).terms().forEach(t -> collectVariables(t, names));
            case MUL -> ((Mul) expr).factors().forEach(f -> collectVariables(f, names));
            case POW -> {
                collectVariables(((Pow) expr).base(), names);
                collectVariables(((Pow) expr).exponent(), names);
            }
            case FUNC -> ((Func) expr).args().forEach(a -> collectVariables(a, names));
            case EQ -> {
                collectVariables(((Eq) expr).left(), names);
                collectVariables(((Eq) expr).right(), names);
            }
            case INT, FLOAT, RATIONAL, CONST -> {
            }
        }
    }

    private static boolean isNegativeNumber(final Expr expr) {
        return expr instanceof Numeric n && n.signum() < 0;
    }

    /**
     * Numeric leaves. Their value is known without bindings.
     */
    sealed interface Numeric extends Expr {
        BigDecimal decimalValue();

        int signum();

        boolean isInteger();
    }

    record Int(BigInteger value) implements Numeric {
        public Int {
            Objects.requireNonNull(value, "value");
        }

        public Int(final long value) {
            this(BigInteger.valueOf(value));
        }

        @Override
        public Kind kind() {
            return Kind.INT;
        }

        @Override
        public Expr deepCopy() {
            return new Int(value);
        }

        @Override
        public BigDecimal decimalValue() {
            return new BigDecimal(value);
        }

        @Override
        public int signum() {
            return value.signum();
        }

        @Override
        public boolean isInteger() {
            return true;
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    record Float(BigDecimal value) implements Numeric {
        public Float {
            value = Objects.requireNonNull(value, "value").stripTrailingZeros();
        }

        @Override
        public Kind kind() {
            return Kind.FLOAT;
        }

        @Override
        public Expr deepCopy() {
            return new Float(value);
        }

        @Override
        public BigDecimal decimalValue() {
            return value;
        }

        @Override
        public int signum() {
            return value.signum();
        }

        @Override
        public boolean isInteger() {
            return value.signum() == 0 || value.scale() <= 0;
        }

        @Override
        public String toString() {
            return value.toPlainString();
        }
    }

    /**
     * A fraction of two integers. {@link #of} reduces to lowest terms with a positive
     * denominator; {@link #preserved} keeps the given form and exists only to reproduce
     * externally observable fractions such as {@code 2/4}.
     */
    record Rational(BigInteger numerator, BigInteger denominator) implements Numeric {
        public Rational {
            Objects.requireNonNull(numerator, "numerator");
            Objects.requireNonNull(denominator, "denominator");
            if (denominator.signum() == 0) {
                throw new IllegalArgumentException("denominator must not be zero");
            }
        }

        public static Rational of(final BigInteger numerator, final BigInteger denominator) {
            if (denominator.signum() == 0) {
                throw new IllegalArgumentException("denominator must not be zero");
            }
            BigInteger gcd = numerator.gcd(denominator);
            BigInteger num = numerator.divide(gcd);
            BigInteger den = denominator.divide(gcd);
            if (den.signum() < 0) {
                num = num.negate();
                den = den.negate();
            }
            return new Rational(num, den);
        }

        public static Rational of(final long numerator, final long denominator) {
            return of(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
        }

        public static Rational preserved(final BigInteger numerator, final BigInteger denominator) {
            return new Rational(numerator, denominator);
        }

        public boolean isReduced() {
            return denominator.signum() > 0 && numerator.gcd(denominator).equals(BigInteger.ONE);
        }

        @Override
        public Kind kind() {
            return Kind.RATIONAL;
        }

        @Override
        public Expr deepCopy() {
            return new Rational(numerator, denominator);
        }

        @Override
        public BigDecimal decimalValue() {
            return new BigDecimal(numerator).divide(new BigDecimal(denominator), Numbers.CONTEXT);
        }

        @Override
        public int signum() {
            return numerator.signum() * denominator.signum();
        }

        @Override
        public boolean isInteger() {
            return numerator.mod(denominator.abs()).signum() == 0;
        }

        // always n/d, even when d is 1
        @Override
        public String toString() {
            return numerator + "/" + denominator;
        }
    }

    record Var(String name) implements Expr {
        public Var {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public Kind kind() {
            return Kind.VAR;
        }

        @Override
        public Expr deepCopy() {
            return new Var(name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Const(String name, BigDecimal value) implements Expr {
        public static final Const PI = new Const("pi",
                new BigDecimal("3.1415926535897932384626433832795028841971693993751"));
        public static final Const E = new Const("e",
                new BigDecimal("2.7182818284590452353602874713526624977572470937000"));

        public Const {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Kind kind() {
            return Kind.CONST;
        }

        @Override
        public Expr deepCopy() {
            return new Const(name, value);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Add(List<Expr> terms) implements Expr {
        public Add {
            terms = List.copyOf(terms);
        }

        public Add(final Expr... terms) {
            this(List.of(terms));
        }

        @Override
        public Kind kind() {
            return Kind.ADD;
        }

        @Override
        public Expr deepCopy() {
            return new Add(terms.stream().map(Expr::deepCopy).toList());
        }

        @Override
        public String toString() {
            if (terms.isEmpty()) {
                return "0";
            }

            StringBuilder buffer = new StringBuilder(terms.get(0).toString());
            for (int i = 1; i < terms.size(); i++) {
                String term = terms.get(i).toString();
                if (!term.startsWith("-")) {
                    buffer.append('+');
                }
                buffer.append(term);
            }
            return buffer.toString();
        }
    }

    record Mul(List<Expr> factors) implements Expr {
        public Mul {
            factors = List.copyOf(factors);
        }

        public Mul(final Expr... factors) {
            this(List.of(factors));
        }

        @Override
        public Kind kind() {
            return Kind.MUL;
        }

        @Override
        public Expr deepCopy() {
            return new Mul(factors.stream().map(Expr::deepCopy).toList());
        }

        @Override
        public String toString() {
            if (factors.isEmpty()) {
                return "1";
            }

            return factors.stream()
                    .map(f -> f.kind() == Kind.ADD ? "(" + f + ")" : f.toString())
                    .collect(Collectors.joining("*"));
        }
    }

    record Pow(Expr base, Expr exponent) implements Expr {
        public Pow {
            Objects.requireNonNull(base, "base");
            Objects.requireNonNull(exponent, "exponent");
        }

        @Override
        public Kind kind() {
            return Kind.POW;
        }

        @Override
        public Expr deepCopy() {
            return new Pow(base.deepCopy(), exponent.deepCopy());
        }

        @Override
        public String toString() {
            String b = base.toString();
            if (isNegativeNumber(base)) {
                b = "(" + b + ")";
            }
            else {
                switch (base.kind()) {
                    case ADD, MUL, POW, RATIONAL, EQ -> b = "(" + b + ")";
                    default -> {
                    }
                }
            }

            String e = exponent.toString();
            if (isNegativeNumber(exponent)) {
                e = "(" + e + ")";
            }
            else {
                switch (exponent.kind()) {
                    case ADD, MUL, RATIONAL, EQ -> e = "(" + e + ")";
                    default -> {
                    }
                }
            }

            return b + "^" + e;
        }
    }

    record Func(String name, List<Expr> args) implements Expr {
        public Func {
            Objects.requireNonNull(name, "name");
            args = List.copyOf(args);
        }

        public Func(final String name, final Expr... args) {
            this(name, List.of(args));
        }

        @Override
        public Kind kind() {
            return Kind.FUNC;
        }

        @Override
        public Expr deepCopy() {
            return new Func(name, args.stream().map(Expr::deepCopy).toList());
        }

        @Override
        public String toString() {
            return args.stream()
                    .map(Expr::toString)
                    .collect(Collectors.joining(", ", name + "(", ")"));
        }
    }

    /**
     * An equation or inequality. It has no numeric value of its own; evaluating it yields
     * 1 when the relation holds and 0 otherwise.
     */
    record Eq(Expr left, Expr right, Relation relation) implements Expr {
        public Eq {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
            Objects.requireNonNull(relation, "relation");
        }

        /**
         * {@code left + (-1)*right}, the expression that is zero exactly where an equality holds.
         */
        public Expr difference() {
            return new Add(left, new Mul(new Int(-1), right));
        }

        /**
         * The same relation with both sides swapped, e.g. {@code x >= 8} becomes {@code 8 <= x}.
         */
        public Eq flipped() {
            return new Eq(right, left, relation.flipped());
        }

        @Override
        public Kind kind() {
            return Kind.EQ;
        }

        @Override
        public Expr deepCopy() {
            return new Eq(left.deepCopy(), right.deepCopy(), relation);
        }

        @Override
        public String toString() {
            return left + relation.symbol() + right;
        }
    }
}
