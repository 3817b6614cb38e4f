package org.kidoni.symbolic.calculus;

import java.util.AbstractMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

import org.kidoni.symbolic.expr.Expr;
import org.kidoni.symbolic.expr.Numbers;

/**
 * Outer derivatives {@code f'(u)} of the single-argument elementary functions. The chain rule
 * factor {@code u'} is applied by {@link Differentiator}.
 */
abstract class ElementaryDerivative {
    private static final Expr TWO = new Expr.Int(2);

    private static final Map<String, UnaryOperator<Expr>> RULES = Map.ofEntries(
            rule("sin", u -> func("cos", u)),
            rule("cos", u -> negate(func("sin", u))),
            rule("tan", u -> reciprocal(new Expr.Pow(func("cos", u), TWO))),
            rule("sec", u -> new Expr.Mul(func("sec", u), func("tan", u))),
            rule("csc", u -> new Expr.Mul(Numbers.MINUS_ONE, func("csc", u), func("cot", u))),
            rule("cot", u -> negate(new Expr.Pow(func("csc", u), TWO))),
            rule("arcsin", u -> reciprocal(func("sqrt", oneMinusSquare(u)))),
            rule("asin", u -> reciprocal(func("sqrt", oneMinusSquare(u)))),
            rule("arccos", u -> negate(reciprocal(func("sqrt", oneMinusSquare(u))))),
            rule("acos", u -> negate(reciprocal(func("sqrt", oneMinusSquare(u))))),
            rule("arctan", u -> reciprocal(new Expr.Add(Numbers.ONE, new Expr.Pow(u, TWO)))),
            rule("atan", u -> reciprocal(new Expr.Add(Numbers.ONE, new Expr.Pow(u, TWO)))),
            rule("sinh", u -> func("cosh", u)),
            rule("cosh", u -> func("sinh", u)),
            rule("tanh", u -> reciprocal(new Expr.Pow(func("cosh", u), TWO))),
            rule("ln", ElementaryDerivative::reciprocal),
            rule("log", u -> reciprocal(new Expr.Mul(u, func("ln", new Expr.Int(10))))),
            rule("exp", u -> func("exp", u)),
            rule("sqrt", u -> new Expr.Mul(Expr.Rational.of(1, 2), new Expr.Pow(u, Expr.Rational.of(-1, 2)))),
            rule("abs", u -> new Expr.Mul(u, reciprocal(func("abs", u)))));

    static Optional<Expr> outer(final String function, final Expr argument) {
        UnaryOperator<Expr> rule = RULES.get(function);
        return rule == null ? Optional.empty() : Optional.of(rule.apply(argument));
    }

    private static Map.Entry<String, UnaryOperator<Expr>> rule(final String function, final UnaryOperator<Expr> derivative) {
        return new AbstractMap.SimpleImmutableEntry<>(function, derivative);
    }

    private static Expr func(final String name, final Expr argument) {
        return new Expr.Func(name, argument);
    }

    private static Expr negate(final Expr expr) {
        return new Expr.Mul(Numbers.MINUS_ONE, expr);
    }

    private static Expr reciprocal(final Expr expr) {
        return new Expr.Pow(expr, Numbers.MINUS_ONE);
    }

    // 1 - u^2
    private static Expr oneMinusSquare(final Expr u) {
        return new Expr.Add(Numbers.ONE, negate(new Expr.Pow(u, TWO)));
    }
}
