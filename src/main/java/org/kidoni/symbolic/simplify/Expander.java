package org.kidoni.symbolic.simplify;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import org.kidoni.symbolic.expr.Expr;
import org.kidoni.symbolic.expr.Numbers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Distributes products over sums and multiplies out small integer powers of sums.
 * <p>
 * The output is not collected; like terms produced by distribution are left for
 * {@link Simplifier#collect(Expr)}.
 */
public class Expander {
    private static final Logger log = LoggerFactory.getLogger(Expander.class);

    static final int MAX_FULL_ROUNDS = 5;

    private final ExpandOptions options;

    public Expander() {
        this(ExpandOptions.defaults());
    }

    public Expander(final ExpandOptions options) {
        assert options != null;
        this.options = options;
    }

    public Expr expand(final Expr expr) {
        return switch (expr.kind()) {
            case ADD -> new Expr.Add(flattenAdd(((Expr.Add) expr).terms().stream().map(this::expand).toList()));
            case MUL -> distribute(((Expr.Mul) expr).factors().stream().map(this::expand).toList());
            case POW -> {
                Expr.Pow pow = (Expr.Pow) expr;
                yield expandPower(expand(pow.base()), expand(pow.exponent()));
            }
            case FUNC -> expandFunction((Expr.Func) expr);
            case EQ -> {
                Expr.Eq eq = (Expr.Eq) expr;
                yield new Expr.Eq(expand(eq.left()), expand(eq.right()), eq.relation());
            }
            case INT, FLOAT, RATIONAL, VAR, CONST -> expr;
        };
    }

    /**
     * Expands repeatedly until the rendering is stable, at most {@value #MAX_FULL_ROUNDS} times.
     */
    public Expr expandFully(final Expr expr) {
        Expr current = expr;
        for (int round = 0; round < MAX_FULL_ROUNDS; round++) {
            Expr next = expand(current);
            if (next.toString().equals(current.toString())) {
                return next;
            }
            current = next;
        }
        return current;
    }

    /**
     * Multiplies out a product by taking one term from every sum factor, keeping the non-sum
     * factors in front: {@code a*(b+c)} becomes {@code a*b+a*c}.
     */
    private Expr distribute(final List<Expr> factors) {
        List<Expr> plain = new ArrayList<>();
        List<Expr.Add> sums = new ArrayList<>();
        for (Expr factor : flattenMul(factors)) {
            if (factor instanceof Expr.Add add) {
                sums.add(add);
            }
            else {
                plain.add(factor);
            }
        }

        if (sums.isEmpty()) {
            return new Expr.Mul(plain);
        }

        List<List<Expr>> products = new ArrayList<>();
        products.add(plain);
        for (Expr.Add sum : sums) {
            List<List<Expr>> next = new ArrayList<>(products.size() * sum.terms().size());
            for (List<Expr> product : products) {
                for (Expr term : sum.terms()) {
                    List<Expr> extended = new ArrayList<>(product);
                    if (term instanceof Expr.Mul mul) {
                        extended.addAll(mul.factors());
                    }
                    else {
                        extended.add(term);
                    }
                    next.add(extended);
                }
            }
            products = next;
        }

        List<Expr> terms = new ArrayList<>(products.size());
        for (List<Expr> product : products) {
            terms.add(product.size() == 1 ? product.get(0) : new Expr.Mul(product));
        }
        log.trace("distributed {} factor(s) into {} term(s)", factors.size(), terms.size());
        return new Expr.Add(terms);
    }

    private Expr expandPower(final Expr base, final Expr exponent) {
        if (!(exponent instanceof Expr.Int e)) {
            return new Expr.Pow(base, exponent);
        }

        BigInteger n = e.value();
        if (base instanceof Expr.Mul mul) {
            List<Expr> factors = new ArrayList<>(mul.factors().size());
            for (Expr factor : mul.factors()) {
                factors.add(new Expr.Pow(factor, exponent));
            }
            return new Expr.Mul(factors);
        }

        if (!(base instanceof Expr.Add sum) || n.signum() < 0 || n.compareTo(BigInteger.valueOf(options.maxDegree())) > 0) {
            return new Expr.Pow(base, exponent);
        }

        int degree = n.intValueExact();
        if (degree == 0) {
            return Numbers.ONE;
        }
        if (degree == 1) {
            return sum;
        }
        if (sum.terms().size() == 2) {
            return binomial(sum.terms().get(0), sum.terms().get(1), degree);
        }

        Expr result = sum;
        for (int i = 1; i < degree; i++) {
            result = distribute(List.of(result, sum));
        }
        return result;
    }

    private Expr binomial(final Expr a, final Expr b, final int n) {
        List<Expr> terms = new ArrayList<>(n + 1);
        BigInteger coefficient = BigInteger.ONE;
        for (int k = 0; k <= n; k++) {
            List<Expr> factors = new ArrayList<>(3);
            if (!coefficient.equals(BigInteger.ONE)) {
                factors.add(new Expr.Int(coefficient));
            }
            addPower(factors, a, n - k);
            addPower(factors, b, k);

            terms.add(switch (factors.size()) {
                case 0 -> Numbers.ONE;
                case 1 -> factors.get(0);
                default -> new Expr.Mul(factors);
            });

            // C(n, k+1) = C(n, k) * (n - k) / (k + 1)
            coefficient = coefficient.multiply(BigInteger.valueOf(n - k)).divide(BigInteger.valueOf(k + 1));
        }
        return new Expr.Add(terms);
    }

    private void addPower(final List<Expr> factors, final Expr base, final int exponent) {
        if (exponent == 0) {
            return;
        }
        if (exponent == 1) {
            factors.add(base);
            return;
        }
        factors.add(expandPower(base, new Expr.Int(exponent)));
    }

    private Expr expandFunction(final Expr.Func func) {
        List<Expr> args = func.args().stream().map(this::expand).toList();
        if (args.size() != 1) {
            return new Expr.Func(func.name(), args);
        }

        Expr arg = args.get(0);
        if (options.expandLogs() && (func.name().equals("ln") || func.name().equals("log"))) {
            if (arg instanceof Expr.Mul mul) {
                return new Expr.Add(mul.factors().stream()
                        .map(f -> expandFunction(new Expr.Func(func.name(), f)))
                        .toList());
            }
            if (arg instanceof Expr.Pow pow) {
                return new Expr.Mul(pow.exponent(), expandFunction(new Expr.Func(func.name(), pow.base())));
            }
        }

        if (options.expandTrig()) {
            Expr sin = new Expr.Func("sin", arg);
            Expr cos = new Expr.Func("cos", arg);
            switch (func.name()) {
                case "tan" -> {
                    return new Expr.Mul(sin, new Expr.Pow(cos, Numbers.MINUS_ONE));
                }
                case "sec" -> {
                    return new Expr.Pow(cos, Numbers.MINUS_ONE);
                }
                case "csc" -> {
                    return new Expr.Pow(sin, Numbers.MINUS_ONE);
                }
                case "cot" -> {
                    return new Expr.Mul(cos, new Expr.Pow(sin, Numbers.MINUS_ONE));
                }
                default -> {
                }
            }
        }

        return new Expr.Func(func.name(), args);
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
