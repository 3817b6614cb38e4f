package org.kidoni.symbolic.compare;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import org.kidoni.symbolic.expr.EvaluationException;
import org.kidoni.symbolic.expr.Expr;
import org.kidoni.symbolic.expr.Numbers;
import org.kidoni.symbolic.expr.Relation;
import org.kidoni.symbolic.simplify.Simplifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether two expressions or two equations mean the same thing.
 * <p>
 * Checks go from cheap to expensive: identical rendering, identical rendering after
 * simplification, then evaluation at random sample points. Sampling is seeded from
 * {@link CompareOptions#seed()}, so a comparison always gives the same answer.
 */
public class ExpressionComparator {
    private static final Logger log = LoggerFactory.getLogger(ExpressionComparator.class);

    private final CompareOptions options;
    private final Simplifier simplifier;

    public ExpressionComparator() {
        this(CompareOptions.defaults());
    }

    public ExpressionComparator(final CompareOptions options) {
        this(options, new Simplifier());
    }

    public ExpressionComparator(final CompareOptions options, final Simplifier simplifier) {
        assert options != null && simplifier != null;
        this.options = options;
        this.simplifier = simplifier;
    }

    public static boolean structurallyEqual(final Expr left, final Expr right) {
        return left.toString().equals(right.toString());
    }

    public static boolean semanticallyEqual(final Expr left, final Expr right) {
        return new Simplifier().semanticallyEqual(left, right);
    }

    public static boolean numericallyEqual(final Expr left, final Expr right, final double tolerance) {
        return new ExpressionComparator(CompareOptions.defaults().withTolerance(tolerance))
                .sample(left, right, variables(left, right))
                .equal();
    }

    public ComparisonResult compare(final Expr first, final Expr second) {
        ComparisonResult result;
        if (first instanceof Expr.Eq left && second instanceof Expr.Eq right) {
            result = compareEquations(left, right);
        }
        else if (first instanceof Expr.Eq || second instanceof Expr.Eq) {
            result = ComparisonResult.different("comparing an equation with a non-equation expression");
        }
        else {
            result = compareExpressions(first, second);
        }

        if (result.equal()) {
            result = applyRequirements(first, second, result);
        }
        log.debug("compare {} with {}: {}", first, second, result.message());
        return result;
    }

    private ComparisonResult compareEquations(final Expr.Eq first, final Expr.Eq second) {
        if (structurallyEqual(first, second) || structurallyEqual(first.flipped(), second)) {
            return ComparisonResult.equivalent("equations are structurally identical",
                    Map.of("comparison_type", "flipped_or_identical"));
        }
        if (first.relation() != second.relation() && first.relation() != second.relation().flipped()) {
            return ComparisonResult.different("different relations: " + first.relation() + " vs " + second.relation(),
                    Map.of("relation1", first.relation().symbol(), "relation2", second.relation().symbol()));
        }

        Expr.Eq aligned = first.relation() == second.relation() ? second : second.flipped();
        Expr left = first.difference();
        Expr right = aligned.difference();

        if (first.relation() == Relation.EQUAL || first.relation() == Relation.NOT_EQUAL) {
            if (compareExpressions(left, right).equal()) {
                return ComparisonResult.equivalent("equations are equivalent");
            }
            if (compareExpressions(left, new Expr.Mul(Numbers.MINUS_ONE, right)).equal()) {
                return ComparisonResult.equivalent("equations are equivalent (rearranged)");
            }
            Expr divided1 = simplifier.divideThrough(first);
            Expr divided2 = simplifier.divideThrough(aligned);
            if (compareExpressions(divided1, divided2).equal()
                    || compareExpressions(divided1, new Expr.Mul(Numbers.MINUS_ONE, divided2)).equal()) {
                return ComparisonResult.equivalent("equations are equivalent (divided through)",
                        Map.of("divided1", divided1.toString(), "divided2", divided2.toString()));
            }
            if (proportional(left, right)) {
                return ComparisonResult.equivalent("equations are equivalent (scaled)");
            }
            return ComparisonResult.different("equations are not equivalent",
                    Map.of("expr1_as_expr", left.toString(), "expr2_as_expr", right.toString()));
        }

        if (compareExpressions(left, right).equal()) {
            return ComparisonResult.equivalent("inequalities are equivalent");
        }
        Expr divided1 = simplifier.divideThrough(first);
        Expr divided2 = simplifier.divideThrough(aligned);
        if (compareExpressions(divided1, divided2).equal()) {
            return ComparisonResult.equivalent("inequalities are equivalent (divided through)",
                    Map.of("divided1", divided1.toString(), "divided2", divided2.toString()));
        }
        return ComparisonResult.different("inequalities are not equivalent");
    }

    private ComparisonResult compareExpressions(final Expr first, final Expr second) {
        List<String> variables1 = first.freeVariables();
        List<String> variables2 = second.freeVariables();
        if (!new HashSet<>(variables1).equals(new HashSet<>(variables2))) {
            return ComparisonResult.different("different variables: " + variables1 + " vs " + variables2,
                    Map.of("expr1_vars", variables1, "expr2_vars", variables2));
        }

        if (structurallyEqual(first, second)) {
            return ComparisonResult.equivalent("expressions are structurally identical");
        }

        String simplified1 = simplifier.normalize(simplifier.simplify(first)).toString();
        String simplified2 = simplifier.normalize(simplifier.simplify(second)).toString();
        if (simplified1.equals(simplified2)) {
            return ComparisonResult.equivalent("expressions are semantically equivalent",
                    Map.of("simplified1", simplified1, "simplified2", simplified2));
        }

        ComparisonResult sampled = sample(first, second, variables1);
        if (sampled.equal()) {
            return sampled;
        }

        Map<String, Object> details = new LinkedHashMap<>(sampled.details());
        details.put("simplified1", simplified1);
        details.put("simplified2", simplified2);
        return ComparisonResult.different(sampled.message(), details);
    }

    private ComparisonResult applyRequirements(final Expr first, final Expr second, final ComparisonResult result) {
        List<String> variables = first.freeVariables();
        for (String required : options.requireVariables()) {
            if (!variables.contains(required)) {
                return ComparisonResult.different("missing required variable: " + required,
                        Map.of("missing_variable", required));
            }
        }

        if (options.checkForm()) {
            String form1 = simplifier.normalize(first).toString();
            String form2 = simplifier.normalize(second).toString();
            if (!form1.equals(form2)) {
                return ComparisonResult.different("expressions do not have the same form",
                        Map.of("form1", form1, "form2", form2));
            }
        }

        if (options.checkSimplified()) {
            Expr simplified = simplifier.simplify(second);
            if (!simplified.toString().equals(second.toString())) {
                return ComparisonResult.different("second expression is not in simplified form",
                        Map.of("simplified_form", simplified.toString()));
            }
        }
        return result;
    }

    /**
     * Evaluates both sides at {@link CompareOptions#iterations()} random points. A third of the
     * points are drawn from each of the ranges 10, 100 and 1000; every other point uses integers
     * only.
     */
    ComparisonResult sample(final Expr first, final Expr second, final List<String> variables) {
        Random random = new Random(options.seed());
        int iterations = variables.isEmpty() ? 1 : options.iterations();
        int compared = 0;

        for (int i = 0; i < iterations; i++) {
            Map<String, BigDecimal> point = point(random, variables, i, iterations);

            BigDecimal value1;
            BigDecimal value2;
            boolean failed1 = false;
            boolean failed2 = false;
            try {
                value1 = first.eval(point);
            }
            catch (EvaluationException e) {
                value1 = null;
                failed1 = true;
            }
            try {
                value2 = second.eval(point);
            }
            catch (EvaluationException e) {
                value2 = null;
                failed2 = true;
            }

            if (failed1 && failed2) {
                continue;
            }
            if (failed1 || failed2) {
                return ComparisonResult.different("expressions differ in evaluation success",
                        Map.of("iteration", i, "variables", point.toString(),
                                "expr1_error", failed1, "expr2_error", failed2));
            }

            compared++;
            if (!withinTolerance(value1, value2)) {
                return ComparisonResult.different("expressions differ at test point " + i,
                        Map.of("iteration", i,
                                "variables", point.toString(),
                                "expr1_result", value1.toPlainString(),
                                "expr2_result", value2.toPlainString()));
            }
        }

        if (compared == 0) {
            return ComparisonResult.different("no test point could be evaluated");
        }
        return ComparisonResult.equivalent("expressions are numerically equivalent for all test points",
                Map.of("iterations_tested", compared));
    }

    /**
     * True when {@code left / right} is the same non-zero constant at every comparable point.
     */
    private boolean proportional(final Expr left, final Expr right) {
        List<String> variables = variables(left, right);
        Random random = new Random(options.seed());
        BigDecimal ratio = null;

        for (int i = 0; i < options.iterations(); i++) {
            Map<String, BigDecimal> point = point(random, variables, i, options.iterations());
            BigDecimal value1;
            BigDecimal value2;
            try {
                value1 = left.eval(point);
                value2 = right.eval(point);
            }
            catch (EvaluationException e) {
                continue;
            }
            if (value2.signum() == 0 || value1.signum() == 0) {
                if (value1.signum() != value2.signum()) {
                    return false;
                }
                continue;
            }

            BigDecimal current = value1.divide(value2, Numbers.CONTEXT);
            if (ratio == null) {
                ratio = current;
            }
            else if (!withinTolerance(ratio, current)) {
                return false;
            }
        }
        return ratio != null;
    }

    private Map<String, BigDecimal> point(final Random random, final List<String> variables, final int i, final int iterations) {
        int exponent = 1 + (int) Math.floor(3.0 * i / iterations);
        int range = (int) Math.pow(10, exponent);
        boolean integers = i % 2 == 1;

        Map<String, BigDecimal> point = new LinkedHashMap<>();
        for (String variable : variables) {
            if (integers) {
                point.put(variable, new BigDecimal(BigInteger.valueOf(random.nextInt(2 * range + 1) - range)));
            }
            else {
                point.put(variable, BigDecimal.valueOf((random.nextDouble() * 2 - 1) * range));
            }
        }
        return point;
    }

    private boolean withinTolerance(final BigDecimal value1, final BigDecimal value2) {
        BigDecimal difference = value1.subtract(value2).abs();
        BigDecimal tolerance = BigDecimal.valueOf(options.tolerance());
        if (value1.abs().compareTo(BigDecimal.ONE) >= 0 && value2.abs().compareTo(BigDecimal.ONE) >= 0) {
            tolerance = tolerance.multiply(value1.abs().max(value2.abs()));
        }
        return difference.compareTo(tolerance) <= 0;
    }

    private static List<String> variables(final Expr left, final Expr right) {
        Set<String> variables = new LinkedHashSet<>(left.freeVariables());
        variables.addAll(right.freeVariables());
        return List.copyOf(variables);
    }
}
