package org.kidoni.symbolic;

import java.util.List;
import java.util.Map;

import org.kidoni.symbolic.calculus.Differentiator;
import org.kidoni.symbolic.compare.CompareOptions;
import org.kidoni.symbolic.compare.ComparisonResult;
import org.kidoni.symbolic.compare.ExpressionComparator;
import org.kidoni.symbolic.expr.Expr;
import org.kidoni.symbolic.parse.ParseException;
import org.kidoni.symbolic.parse.Parser;
import org.kidoni.symbolic.simplify.ExpandOptions;
import org.kidoni.symbolic.simplify.SimplifyOptions;
import org.kidoni.symbolic.simplify.Simplifier;
import org.kidoni.symbolic.solve.EquationSolver;
import org.kidoni.symbolic.solve.SolutionSet;
import org.kidoni.symbolic.solve.SolveOptions;

/**
 * One-stop entry point with default options. Each method has an overload, or a component
 * class, that takes explicit options.
 */
public abstract class Symbolic {
    private static final Simplifier SIMPLIFIER = new Simplifier();
    private static final Differentiator DIFFERENTIATOR = new Differentiator(SIMPLIFIER);

    /**
     * @throws ParseException if {@code input} is not a valid expression
     */
    public static Expr parse(final String input) {
        return Parser.parse(input).orElseThrow();
    }

    public static Expr simplify(final Expr expr) {
        return SIMPLIFIER.simplify(expr);
    }

    public static Expr simplify(final Expr expr, final SimplifyOptions options) {
        return new Simplifier(options).simplify(expr);
    }

    public static Expr collect(final Expr expr) {
        return SIMPLIFIER.collect(expr);
    }

    public static Expr collect(final Expr expr, final SimplifyOptions options) {
        return new Simplifier(options).collect(expr);
    }

    public static Expr factor(final Expr expr) {
        return SIMPLIFIER.factor(expr);
    }

    public static Expr factor(final Expr expr, final SimplifyOptions options) {
        return new Simplifier(options).factor(expr);
    }

    /**
     * @see Simplifier#divideThrough(Expr.Eq)
     */
    public static Expr divideThrough(final Expr.Eq eq) {
        return SIMPLIFIER.divideThrough(eq);
    }

    public static Expr expand(final Expr expr) {
        return SIMPLIFIER.expand(expr);
    }

    public static Expr expand(final Expr expr, final ExpandOptions options) {
        return new Simplifier(SimplifyOptions.defaults(), options).expand(expr);
    }

    public static Expr normalize(final Expr expr) {
        return SIMPLIFIER.normalize(expr);
    }

    public static Expr derivative(final Expr expr, final String variable) {
        return DIFFERENTIATOR.derivative(expr, variable);
    }

    public static Expr nthDerivative(final Expr expr, final String variable, final int order) {
        return DIFFERENTIATOR.nthDerivative(expr, variable, order);
    }

    public static Map<String, Expr> gradient(final Expr expr, final List<String> variables) {
        return DIFFERENTIATOR.gradient(expr, variables);
    }

    public static SolutionSet solve(final Expr expr) {
        return new EquationSolver().solve(expr);
    }

    public static SolutionSet solve(final Expr expr, final SolveOptions options) {
        return new EquationSolver(options).solve(expr);
    }

    public static ComparisonResult compare(final Expr first, final Expr second) {
        return new ExpressionComparator().compare(first, second);
    }

    public static ComparisonResult compare(final Expr first, final Expr second, final CompareOptions options) {
        return new ExpressionComparator(options).compare(first, second);
    }
}
