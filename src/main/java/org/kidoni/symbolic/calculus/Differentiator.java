package org.kidoni.symbolic.calculus;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.kidoni.symbolic.expr.Expr;
import org.kidoni.symbolic.expr.Numbers;
import org.kidoni.symbolic.simplify.Simplifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rule-based symbolic differentiation.
 * <p>
 * Each rule builds a fresh tree which is then passed through {@link Simplifier#collect(Expr)},
 * so results come back with like terms and powers already combined, e.g. the derivative of
 * {@code x^3} is {@code 3*x^2}.
 */
public class Differentiator {
    private static final Logger log = LoggerFactory.getLogger(Differentiator.class);

    private final Simplifier simplifier;

    public Differentiator() {
        this(new Simplifier());
    }

    public Differentiator(final Simplifier simplifier) {
        assert simplifier != null;
        this.simplifier = simplifier;
    }

    /**
     * @throws UnsupportedDifferentiationException for equations, unknown functions and
     *                                             functions of more than one argument
     */
    public Expr derivative(final Expr expr, final String variable) {
        Expr result = switch (expr.kind()) {
            case INT, FLOAT, RATIONAL, CONST -> Numbers.ZERO;
            case VAR -> ((Expr.Var) expr).name().equals(variable) ? Numbers.ONE : Numbers.ZERO;
            case ADD -> {
                List<Expr> terms = new ArrayList<>();
                for (Expr term : ((Expr.Add) expr).terms()) {
                    terms.add(derivative(term, variable));
                }
                yield new Expr.Add(terms);
            }
            case MUL -> product(((Expr.Mul) expr).factors(), variable);
            case POW -> power((Expr.Pow) expr, variable);
            case FUNC -> function((Expr.Func) expr, variable);
            case EQ -> throw new UnsupportedDifferentiationException("cannot differentiate an equation: " + expr);
        };

        Expr collected = simplifier.collect(result);
        log.trace("d/d{} {} = {}", variable, expr, collected);
        return collected;
    }

    /**
     * Differentiates {@code order} times in a row. Order 0 returns {@code expr} itself.
     *
     * @throws InvalidDerivativeOrderException if {@code order} is negative
     */
    public Expr nthDerivative(final Expr expr, final String variable, final int order) {
        if (order < 0) {
            throw new InvalidDerivativeOrderException(order);
        }

        Expr current = expr;
        for (int i = 0; i < order; i++) {
            current = derivative(current, variable);
            if (Numbers.isZero(current)) {
                log.trace("d^{}/d{}^{} vanishes after {} step(s)", order, variable, order, i + 1);
                return current;
            }
        }
        return current;
    }

    /**
     * Partial derivatives with respect to each of {@code variables}, in the given order. Fails as
     * a whole, with the exception of the first partial derivative that fails.
     */
    public Map<String, Expr> gradient(final Expr expr, final List<String> variables) {
        Map<String, Expr> gradient = new LinkedHashMap<>();
        for (String variable : variables) {
            gradient.put(variable, derivative(expr, variable));
        }
        return gradient;
    }

    private Expr product(final List<Expr> factors, final String variable) {
        if (factors.isEmpty()) {
            return Numbers.ZERO;
        }
        if (factors.size() == 1) {
            return derivative(factors.get(0), variable);
        }

        // (f1*f2*...*fn)' = sum over i of f1*...*fi'*...*fn
        List<Expr> terms = new ArrayList<>(factors.size());
        for (int i = 0; i < factors.size(); i++) {
            Expr derivative = derivative(factors.get(i), variable);
            if (Numbers.isZero(derivative)) {
                continue;
            }
            List<Expr> term = new ArrayList<>(factors);
            term.set(i, derivative);
            terms.add(new Expr.Mul(term));
        }
        return new Expr.Add(terms);
    }

    private Expr power(final Expr.Pow pow, final String variable) {
        Expr base = pow.base();
        Expr exponent = pow.exponent();
        boolean baseVaries = base.dependsOn(variable);
        boolean exponentVaries = exponent.dependsOn(variable);

        if (!baseVaries && !exponentVaries) {
            return Numbers.ZERO;
        }
        if (!exponentVaries) {
            Expr reduced = new Expr.Add(exponent, Numbers.MINUS_ONE);
            return new Expr.Mul(exponent, new Expr.Pow(base, reduced), derivative(base, variable));
        }
        if (!baseVaries) {
            return new Expr.Mul(pow, new Expr.Func("ln", base), derivative(exponent, variable));
        }

        // f^g * (g'*ln(f) + g*f'*f^-1)
        Expr logTerm = new Expr.Mul(derivative(exponent, variable), new Expr.Func("ln", base));
        Expr ratioTerm = new Expr.Mul(exponent, derivative(base, variable), new Expr.Pow(base, Numbers.MINUS_ONE));
        return new Expr.Mul(pow, new Expr.Add(logTerm, ratioTerm));
    }

    private Expr function(final Expr.Func func, final String variable) {
        if (func.args().size() != 1) {
            throw new UnsupportedDifferentiationException(
                    "cannot differentiate " + func.name() + " with " + func.args().size() + " arguments");
        }

        Expr argument = func.args().get(0);
        Expr outer = ElementaryDerivative.outer(func.name(), argument)
                .orElseThrow(() -> new UnsupportedDifferentiationException("unsupported function: " + func.name()));
        return new Expr.Mul(outer, derivative(argument, variable));
    }
}
