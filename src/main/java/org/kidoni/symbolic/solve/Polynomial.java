package org.kidoni.symbolic.solve;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import org.kidoni.symbolic.expr.Expr;
import org.kidoni.symbolic.expr.Numbers;
import org.kidoni.symbolic.simplify.Simplifier;

/**
 * Coefficients of an expanded expression read as a polynomial in one variable.
 */
final class Polynomial {
    private final String variable;
    private final Map<Integer, Expr> coefficients;

    private Polynomial(final String variable, final Map<Integer, Expr> coefficients) {
        this.variable = variable;
        this.coefficients = coefficients;
    }

    /**
     * Empty when some term is not of the form {@code c*x^n} with a non-negative integer
     * {@code n} and {@code c} free of the variable.
     */
    static Optional<Polynomial> of(final Expr expanded, final String variable, final Simplifier simplifier) {
        List<Expr> terms = expanded instanceof Expr.Add add ? add.terms() : List.of(expanded);

        Map<Integer, List<Expr>> grouped = new TreeMap<>();
        for (Expr term : terms) {
            List<Expr> factors = term instanceof Expr.Mul mul ? mul.factors() : List.of(term);
            int degree = 0;
            List<Expr> coefficient = new ArrayList<>();
            for (Expr factor : factors) {
                if (!factor.dependsOn(variable)) {
                    coefficient.add(factor);
                }
                else if (factor instanceof Expr.Var) {
                    degree++;
                }
                else if (factor instanceof Expr.Pow pow && pow.base() instanceof Expr.Var
                        && pow.exponent() instanceof Expr.Int n && n.signum() >= 0 && !pow.exponent().dependsOn(variable)) {
                    degree += n.value().intValueExact();
                }
                else {
                    return Optional.empty();
                }
            }
            grouped.computeIfAbsent(degree, d -> new ArrayList<>())
                    .add(coefficient.isEmpty() ? Numbers.ONE : new Expr.Mul(coefficient));
        }

        Map<Integer, Expr> coefficients = new TreeMap<>();
        for (Map.Entry<Integer, List<Expr>> entry : grouped.entrySet()) {
            Expr coefficient = simplifier.collect(new Expr.Add(entry.getValue()));
            if (!Numbers.isZero(coefficient)) {
                coefficients.put(entry.getKey(), coefficient);
            }
        }
        return Optional.of(new Polynomial(variable, coefficients));
    }

    String variable() {
        return variable;
    }

    int degree() {
        return coefficients.keySet().stream().mapToInt(Integer::intValue).max().orElse(0);
    }

    Expr coefficient(final int degree) {
        return coefficients.getOrDefault(degree, Numbers.ZERO);
    }
}
