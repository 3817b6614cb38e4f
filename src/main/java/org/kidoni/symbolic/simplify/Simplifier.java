package org.kidoni.symbolic.simplify;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.kidoni.symbolic.expr.Expr;
import org.kidoni.symbolic.expr.Numbers;
import org.kidoni.symbolic.expr.Relation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Best-effort algebraic simplification: collecting like terms and powers, pulling out integer
 * factors, distributing products and putting operands into a canonical order.
 * <p>
 * Every operation is total. Nothing here throws for a well-formed tree, and nothing here
 * claims a unique normal form: {@link #simplify(Expr)} stops at a fixed point or after
 * {@link SimplifyOptions#maxIterations()} rounds, whichever comes first.
 */
public class Simplifier {
    private static final Logger log = LoggerFactory.getLogger(Simplifier.class);

    private static final String NUMERIC_KEY = "1";

    /** Largest power of a sum multiplied out when trying to escape a plateau. */
    static final int ESCAPE_MAX_DEGREE = 4;
    /** Plateaus whose expansion would produce more terms than this are not expanded. */
    static final long ESCAPE_MAX_TERMS = 1_000;

    private final SimplifyOptions options;
    private final Expander expander;
    private final Expander escapeExpander;

    public Simplifier() {
        this(SimplifyOptions.defaults(), ExpandOptions.defaults());
    }

    public Simplifier(final SimplifyOptions options) {
        this(options, ExpandOptions.defaults());
    }

    public Simplifier(final SimplifyOptions options, final ExpandOptions expandOptions) {
        assert options != null && expandOptions != null;
        this.options = options;
        this.expander = new Expander(expandOptions);
        this.escapeExpander = new Expander(expandOptions.withMaxDegree(Math.min(ESCAPE_MAX_DEGREE, expandOptions.maxDegree())));
    }

    public SimplifyOptions options() {
        return options;
    }

    /**
     * Repeats {@code collect(factor(e))} until the rendering stops changing. When a round makes
     * no progress, one expansion of powers up to {@value #ESCAPE_MAX_DEGREE} is tried and kept
     * only if it leads to a different and smaller tree.
     */
    public Expr simplify(final Expr expr) {
        Expr current = expr;
        for (int iteration = 0; iteration < options.maxIterations(); iteration++) {
            Expr next = collect(factor(current));
            String rendered = next.toString();
            log.debug("simplify round {}: {} -> {}", iteration, current, rendered);

            if (rendered.equals(current.toString())) {
                if (expandedTerms(next) > ESCAPE_MAX_TERMS) {
                    log.debug("simplify round {}: expansion of {} too large, stopping", iteration, rendered);
                    return next;
                }
                Expr escape = collect(factor(collect(escapeExpander.expand(next))));
                if (!escape.toString().equals(rendered) && size(escape) < size(next)) {
                    log.debug("simplify round {}: expansion escaped plateau to {}", iteration, escape);
                    current = escape;
                    if (options.singlePass()) {
                        return current;
                    }
                    continue;
                }
                return next;
            }

            current = next;
            if (options.singlePass()) {
                return current;
            }
        }

        log.debug("simplify stopped after {} rounds: {}", options.maxIterations(), current);
        return current;
    }

    /**
     * Combines like terms in sums and like bases in products and applies the power identities.
     */
    public Expr collect(final Expr expr) {
        return switch (expr.kind()) {
            case ADD -> collectAdd((Expr.Add) expr);
            case MUL -> collectMul((Expr.Mul) expr);
            case POW -> {
                Expr.Pow pow = (Expr.Pow) expr;
                yield power(collect(pow.base()), collect(pow.exponent()));
            }
            case RATIONAL -> {
                Expr.Rational r = (Expr.Rational) expr;
                yield Numbers.of(r.numerator(), r.denominator());
            }
            case FUNC -> {
                Expr.Func func = (Expr.Func) expr;
                yield new Expr.Func(func.name(), func.args().stream().map(this::collect).toList());
            }
            case EQ -> {
                Expr.Eq eq = (Expr.Eq) expr;
                yield new Expr.Eq(collect(eq.left()), collect(eq.right()), eq.relation());
            }
            case INT, FLOAT, VAR, CONST -> expr;
        };
    }

    /**
     * Pulls common factors out of a sum: first the greatest common divisor of the integer
     * coefficients, then every symbolic factor shared by all terms. {@code 2*x+4*y} becomes
     * {@code 2*(x+2*y)} and {@code x*y+x*z} becomes {@code x*(y+z)}. A non-integer coefficient
     * disables the integer step only.
     */
    public Expr factor(final Expr expr) {
        return switch (expr.kind()) {
            case ADD -> factorAdd((Expr.Add) expr);
            case MUL -> new Expr.Mul(((Expr.Mul) expr).factors().stream().map(this::factor).toList());
            case EQ -> {
                Expr.Eq eq = (Expr.Eq) expr;
                yield new Expr.Eq(factor(eq.left()), factor(eq.right()), eq.relation());
            }
            default -> expr;
        };
    }

    public Expr expand(final Expr expr) {
        return expander.expand(expr);
    }

    public Expr expandFully(final Expr expr) {
        return expander.expandFully(expr);
    }

    /**
     * Sorts the operands of every sum and product by their rendering, so that reordered but
     * otherwise identical trees render identically.
     */
    public Expr normalize(final Expr expr) {
        return switch (expr.kind()) {
            case ADD -> new Expr.Add(sorted(((Expr.Add) expr).terms()));
            case MUL -> new Expr.Mul(sorted(((Expr.Mul) expr).factors()));
            case POW -> {
                Expr.Pow pow = (Expr.Pow) expr;
                yield new Expr.Pow(normalize(pow.base()), normalize(pow.exponent()));
            }
            case FUNC -> {
                Expr.Func func = (Expr.Func) expr;
                yield new Expr.Func(func.name(), func.args().stream().map(this::normalize).toList());
            }
            case EQ -> {
                Expr.Eq eq = (Expr.Eq) expr;
                yield new Expr.Eq(normalize(eq.left()), normalize(eq.right()), eq.relation());
            }
            default -> expr;
        };
    }

    /**
     * True when both trees simplify and normalize to the same rendering.
     */
    public boolean semanticallyEqual(final Expr left, final Expr right) {
        return normalize(simplify(left)).toString().equals(normalize(simplify(right)).toString());
    }

    /**
     * Subtracts the right side from the left, collects, and divides out the positive integer
     * content. For {@code =} and {@code <>} only the sum factors of the result are kept, so the outcome is fit
     * for comparing equations, not for solving them. For the other relations the sign of the
     * dropped numbers is kept, e.g. {@code -2*x<0} becomes {@code -1*x}.
     */
    public Expr divideThrough(final Expr.Eq eq) {
        Expr collected = collect(eq.difference());
        Expr factored = collected instanceof Expr.Add add ? integerContent(add) : collected;
        if (!(factored instanceof Expr.Mul mul)) {
            return collected;
        }

        List<Expr> sums = new ArrayList<>();
        List<Expr> rest = new ArrayList<>();
        Expr.Numeric dropped = Numbers.ONE;
        for (Expr factor : mul.factors()) {
            if (factor instanceof Expr.Add) {
                sums.add(factor);
            }
            else if (factor instanceof Expr.Numeric n) {
                dropped = Numbers.multiply(dropped, n);
            }
            else {
                rest.add(factor);
            }
        }

        List<Expr> kept = new ArrayList<>(sums);
        boolean equality = eq.relation() == Relation.EQUAL || eq.relation() == Relation.NOT_EQUAL;
        if (!equality || sums.isEmpty()) {
            kept.addAll(rest);
            if (!equality && dropped.signum() < 0) {
                kept.add(0, Numbers.MINUS_ONE);
            }
        }
        log.trace("divide through {}: {}", eq, kept);
        return switch (kept.size()) {
            case 0 -> Numbers.ONE;
            case 1 -> kept.get(0);
            default -> new Expr.Mul(kept);
        };
    }

    /**
     * Rough size of the tree {@code expr} expands into, saturating just above
     * {@link #ESCAPE_MAX_TERMS}.
     */
    static long expandedTerms(final Expr expr) {
        return switch (expr.kind()) {
            case ADD -> {
                long terms = 0;
                for (Expr term : ((Expr.Add) expr).terms()) {
                    terms = saturated(terms + expandedTerms(term));
                }
                yield Math.max(terms, 1);
            }
            case MUL -> {
                long terms = 1;
                for (Expr factor : ((Expr.Mul) expr).factors()) {
                    terms = saturated(terms * expandedTerms(factor));
                }
                yield terms;
            }
            case POW -> {
                Expr.Pow pow = (Expr.Pow) expr;
                long base = expandedTerms(pow.base());
                if (pow.exponent() instanceof Expr.Int e && e.signum() > 0
                        && e.value().compareTo(BigInteger.valueOf(ESCAPE_MAX_DEGREE)) <= 0) {
                    long terms = 1;
                    for (int i = 0; i < e.value().intValue(); i++) {
                        terms = saturated(terms * base);
                    }
                    yield terms;
                }
                yield base;
            }
            case FUNC -> {
                long terms = 1;
                for (Expr arg : ((Expr.Func) expr).args()) {
                    terms = saturated(terms + expandedTerms(arg));
                }
                yield terms;
            }
            case EQ -> saturated(expandedTerms(((Expr.Eq) expr).left()) + expandedTerms(((Expr.Eq) expr).right()));
            case INT, FLOAT, RATIONAL, VAR, CONST -> 1;
        };
    }

    private static long saturated(final long terms) {
        return Math.min(terms, ESCAPE_MAX_TERMS + 1);
    }

    static int size(final Expr expr) {
        return switch (expr.kind()) {
            case ADD -> 1 + ((Expr.Add) expr).terms().stream().mapToInt(Simplifier::size).sum();
            case MUL -> 1 + ((Expr.Mul) expr).factors().stream().mapToInt(Simplifier::size).sum();
            case POW -> 1 + size(((Expr.Pow) expr).base()) + size(((Expr.Pow) expr).exponent());
            case FUNC -> 1 + ((Expr.Func) expr).args().stream().mapToInt(Simplifier::size).sum();
            case EQ -> 1 + size(((Expr.Eq) expr).left()) + size(((Expr.Eq) expr).right());
            default -> 1;
        };
    }

    private List<Expr> sorted(final List<Expr> operands) {
        List<Expr> normalized = new ArrayList<>(operands.size());
        for (Expr operand : operands) {
            normalized.add(normalize(operand));
        }
        normalized.sort(Comparator.comparing(Expr::toString));
        return normalized;
    }

    private Expr collectAdd(final Expr.Add add) {
        List<Expr> terms = new ArrayList<>();
        for (Expr term : flattenAdd(add.terms())) {
            terms.add(collect(term));
        }

        Map<String, Expr> bases = new LinkedHashMap<>();
        Map<String, Expr.Numeric> coefficients = new LinkedHashMap<>();
        for (Expr term : flattenAdd(terms)) {
            Term split = split(term);
            String key = split.base() == null ? NUMERIC_KEY : split.base().toString();
            bases.putIfAbsent(key, split.base());
            coefficients.merge(key, split.coefficient(), Numbers::add);
        }

        List<Expr> result = new ArrayList<>();
        for (Map.Entry<String, Expr.Numeric> entry : coefficients.entrySet()) {
            Expr.Numeric coefficient = entry.getValue();
            if (coefficient.signum() == 0) {
                continue;
            }
            result.add(term(coefficient, bases.get(entry.getKey())));
        }

        if (result.isEmpty()) {
            return Numbers.ZERO;
        }
        if (result.size() == 1) {
            return result.get(0);
        }
        return new Expr.Add(result);
    }

    private Expr collectMul(final Expr.Mul mul) {
        List<Expr> factors = new ArrayList<>();
        for (Expr factor : flattenMul(mul.factors())) {
            factors.add(collect(factor));
        }
        factors = flattenMul(factors);

        // "-0" as written by a user stays visible
        if (factors.size() == 2 && Numbers.isMinusOne(factors.get(0)) && factors.get(0) instanceof Expr.Int
                && factors.get(1) instanceof Expr.Int zero && zero.signum() == 0) {
            return new Expr.Mul(factors);
        }

        Expr.Numeric coefficient = Numbers.ONE;
        Map<String, Expr> bases = new LinkedHashMap<>();
        Map<String, List<Expr>> exponents = new LinkedHashMap<>();
        for (Expr factor : factors) {
            if (factor instanceof Expr.Numeric n) {
                coefficient = Numbers.multiply(coefficient, n);
                continue;
            }

            Expr base = factor;
            Expr exponent = Numbers.ONE;
            if (factor instanceof Expr.Pow pow) {
                base = pow.base();
                exponent = pow.exponent();
            }
            String key = base.toString();
            bases.putIfAbsent(key, base);
            exponents.computeIfAbsent(key, k -> new ArrayList<>()).add(exponent);
        }

        List<Expr> symbolic = new ArrayList<>();
        for (Map.Entry<String, List<Expr>> entry : exponents.entrySet()) {
            List<Expr> powers = entry.getValue();
            Expr exponent = powers.size() == 1 ? powers.get(0) : collect(new Expr.Add(powers));
            Expr factor = power(bases.get(entry.getKey()), exponent);
            if (factor instanceof Expr.Numeric n) {
                coefficient = Numbers.multiply(coefficient, n);
            }
            else if (factor instanceof Expr.Mul m) {
                for (Expr f : m.factors()) {
                    if (f instanceof Expr.Numeric n) {
                        coefficient = Numbers.multiply(coefficient, n);
                    }
                    else {
                        symbolic.add(f);
                    }
                }
            }
            else {
                symbolic.add(factor);
            }
        }

        if (coefficient.signum() == 0) {
            return Numbers.ZERO;
        }
        if (symbolic.isEmpty()) {
            return coefficient;
        }
        if (Numbers.isOne(coefficient)) {
            return symbolic.size() == 1 ? symbolic.get(0) : new Expr.Mul(symbolic);
        }

        List<Expr> result = new ArrayList<>(symbolic.size() + 1);
        result.add(coefficient);
        result.addAll(symbolic);
        return new Expr.Mul(result);
    }

    /**
     * Power identities over already collected operands.
     */
    private Expr power(final Expr base, final Expr exponent) {
        if (base instanceof Expr.Pow inner) {
            return power(inner.base(), collect(new Expr.Mul(inner.exponent(), exponent)));
        }
        if (Numbers.isZero(exponent)) {
            return Numbers.ONE;
        }
        if (Numbers.isOne(exponent)) {
            return base;
        }
        if (base instanceof Expr.Numeric n) {
            if (Numbers.isOne(n)) {
                return Numbers.ONE;
            }
            if (exponent instanceof Expr.Int e) {
                Optional<Expr.Numeric> value = Numbers.pow(n, e.value());
                if (value.isPresent()) {
                    return value.get();
                }
            }
        }
        return new Expr.Pow(base, exponent);
    }

    private Expr factorAdd(final Expr.Add add) {
        if (add.terms().size() < 2) {
            return add;
        }

        List<Term> terms = new ArrayList<>(add.terms().size());
        for (Expr t : add.terms()) {
            terms.add(split(t));
        }

        BigInteger divisor = integerDivisor(add, terms);
        List<List<Expr>> remaining = new ArrayList<>(terms.size());
        for (Term term : terms) {
            remaining.add(symbolicFactors(term.base()));
        }
        List<Expr> common = new ArrayList<>();
        for (Expr candidate : symbolicFactors(terms.get(0).base())) {
            String key = candidate.toString();
            if (remaining.stream().allMatch(others -> indexOf(others, key) >= 0)) {
                remaining.forEach(others -> others.remove(indexOf(others, key)));
                common.add(candidate);
            }
        }

        if (common.isEmpty() && divisor.equals(BigInteger.ONE)) {
            return add;
        }

        List<Expr> reduced = new ArrayList<>(terms.size());
        for (int i = 0; i < terms.size(); i++) {
            Expr.Numeric coefficient = terms.get(i).coefficient();
            if (!divisor.equals(BigInteger.ONE)) {
                coefficient = new Expr.Int(((Expr.Int) coefficient).value().divide(divisor));
            }
            List<Expr> rest = remaining.get(i);
            Expr base = switch (rest.size()) {
                case 0 -> null;
                case 1 -> rest.get(0);
                default -> new Expr.Mul(rest);
            };
            reduced.add(term(coefficient, base));
        }

        List<Expr> factors = new ArrayList<>(common.size() + 2);
        if (!divisor.equals(BigInteger.ONE)) {
            factors.add(new Expr.Int(divisor));
        }
        factors.addAll(common);
        factors.add(new Expr.Add(reduced));
        return new Expr.Mul(factors);
    }

    /**
     * The integer content to divide out of {@code add}, negated for an all-negative sum unless
     * negative factoring is kept. One when there is nothing to divide out.
     */
    private BigInteger integerDivisor(final Expr.Add add, final List<Term> terms) {
        BigInteger gcd = BigInteger.ZERO;
        boolean allNegative = true;
        for (Term term : terms) {
            if (!(term.coefficient() instanceof Expr.Int coefficient)) {
                log.trace("factor: non-integer coefficient in {}, no integer content", add);
                return BigInteger.ONE;
            }
            gcd = gcd.gcd(coefficient.value());
            allNegative &= coefficient.signum() < 0;
        }

        if (gcd.signum() == 0) {
            return BigInteger.ONE;
        }
        return allNegative && !options.keepNegativeFactoring() ? gcd.negate() : gcd;
    }

    /**
     * Factors {@code 2*x+4*y} into {@code 2*(x+2*y)} when the integer content is greater than
     * one; never negative and never symbolic.
     */
    private Expr integerContent(final Expr.Add add) {
        List<Term> terms = new ArrayList<>(add.terms().size());
        BigInteger gcd = BigInteger.ZERO;
        for (Expr t : add.terms()) {
            Term term = split(t);
            if (!(term.coefficient() instanceof Expr.Int coefficient)) {
                return add;
            }
            gcd = gcd.gcd(coefficient.value());
            terms.add(term);
        }
        if (gcd.compareTo(BigInteger.ONE) <= 0) {
            return add;
        }

        List<Expr> reduced = new ArrayList<>(terms.size());
        for (Term term : terms) {
            reduced.add(term(new Expr.Int(((Expr.Int) term.coefficient()).value().divide(gcd)), term.base()));
        }
        return new Expr.Mul(new Expr.Int(gcd), new Expr.Add(reduced));
    }

    private static List<Expr> symbolicFactors(final Expr base) {
        if (base == null) {
            return new ArrayList<>();
        }
        if (base instanceof Expr.Mul mul) {
            return new ArrayList<>(mul.factors());
        }
        List<Expr> factors = new ArrayList<>();
        factors.add(base);
        return factors;
    }

    private static int indexOf(final List<Expr> factors, final String rendered) {
        for (int i = 0; i < factors.size(); i++) {
            if (factors.get(i).toString().equals(rendered)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * A term split into its numeric coefficient and symbolic rest. A {@code null} base marks a
     * purely numeric term.
     */
    private record Term(Expr base, Expr.Numeric coefficient) {
    }

    private static Term split(final Expr term) {
        if (term instanceof Expr.Numeric n) {
            return new Term(null, n);
        }
        if (term instanceof Expr.Mul mul) {
            Expr.Numeric coefficient = Numbers.ONE;
            List<Expr> symbolic = new ArrayList<>();
            for (Expr factor : flattenMul(mul.factors())) {
                if (factor instanceof Expr.Numeric n) {
                    coefficient = Numbers.multiply(coefficient, n);
                }
                else {
                    symbolic.add(factor);
                }
            }
            if (symbolic.isEmpty()) {
                return new Term(null, coefficient);
            }
            return new Term(symbolic.size() == 1 ? symbolic.get(0) : new Expr.Mul(symbolic), coefficient);
        }
        return new Term(term, Numbers.ONE);
    }

    private static Expr term(final Expr.Numeric coefficient, final Expr base) {
        if (base == null) {
            return coefficient;
        }
        if (Numbers.isOne(coefficient)) {
            return base;
        }

        List<Expr> factors = new ArrayList<>();
        factors.add(coefficient instanceof Expr.Int ? coefficient : normalizedNumber(coefficient));
        if (base instanceof Expr.Mul mul) {
            factors.addAll(mul.factors());
        }
        else {
            factors.add(base);
        }
        return new Expr.Mul(factors);
    }

    private static Expr.Numeric normalizedNumber(final Expr.Numeric value) {
        if (value instanceof Expr.Rational r) {
            return Numbers.of(r.numerator(), r.denominator());
        }
        return value;
    }

    private static List<Expr> flattenAdd(final List<Expr> terms) {
        List<Expr> flat = new ArrayList<>(terms.size());
        for (Expr term : terms) {
            if (term instanceof Expr.Add add) {
                flat.addAll(flattenAdd(add.terms()));
            }
            else {
                flat.add(term);
            }
        }
        return flat;
    }

    private static List<Expr> flattenMul(final List<Expr> factors) {
        List<Expr> flat = new ArrayList<>(factors.size());
        for (Expr factor : factors) {
            if (factor instanceof Expr.Mul mul) {
                flat.addAll(flattenMul(mul.factors()));
            }
            else {
                flat.add(factor);
            }
        }
        return flat;
    }
}
