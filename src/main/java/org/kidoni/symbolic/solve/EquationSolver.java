package org.kidoni.symbolic.solve;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.kidoni.symbolic.expr.EvaluationException;
import org.kidoni.symbolic.expr.Expr;
import org.kidoni.symbolic.expr.Numbers;
import org.kidoni.symbolic.expr.Relation;
import org.kidoni.symbolic.simplify.Simplifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Solves polynomial equations of degree at most two in a single variable.
 * <p>
 * Exact coefficients give exact roots: rational roots when the discriminant is a perfect
 * square, {@code sqrt} forms otherwise. Decimal coefficients give decimal roots when
 * {@link SolveOptions#allowApproximate()} is set.
 */
public class EquationSolver {
    private static final Logger log = LoggerFactory.getLogger(EquationSolver.class);

    private static final BigDecimal TOLERANCE = new BigDecimal("1e-9");

    private final SolveOptions options;
    private final Simplifier simplifier;

    public EquationSolver() {
        this(SolveOptions.defaults());
    }

    public EquationSolver(final SolveOptions options) {
        this(options, new Simplifier());
    }

    public EquationSolver(final SolveOptions options, final Simplifier simplifier) {
        assert options != null && simplifier != null;
        this.options = options;
        this.simplifier = simplifier;
    }

    /**
     * Solves {@code expr = 0}, or {@code left = right} when {@code expr} is an equation.
     */
    public SolutionSet solve(final Expr expr) {
        if (expr instanceof Expr.Eq eq) {
            if (eq.relation() != Relation.EQUAL) {
                return SolutionSet.none("only equations can be solved, got relation " + eq.relation());
            }
            return solveZero(eq.difference());
        }
        return solveZero(expr);
    }

    public SolutionSet solve(final Expr left, final Expr right) {
        return solve(new Expr.Eq(left, right, Relation.EQUAL));
    }

    /**
     * True when substituting the solution makes {@code expr} vanish, within 1e-9.
     */
    public boolean verify(final Solution solution, final Expr expr) {
        Expr target = expr instanceof Expr.Eq eq ? eq.difference() : expr;
        try {
            BigDecimal value = solution.value().eval();
            BigDecimal residual = target.eval(Map.of(solution.variable(), value));
            return residual.abs().compareTo(TOLERANCE) <= 0;
        }
        catch (EvaluationException e) {
            log.debug("cannot verify {}: {}", solution, e.getMessage());
            return false;
        }
    }

    private SolutionSet solveZero(final Expr expr) {
        String variable = options.variable();
        Expr expanded = simplifier.collect(simplifier.expandFully(simplifier.simplify(expr)));
        log.debug("solving {} = 0 for {}", expanded, variable);

        Optional<Polynomial> polynomial = Polynomial.of(expanded, variable, simplifier);
        if (polynomial.isEmpty()) {
            return SolutionSet.none("not a polynomial in " + variable + ": " + expanded);
        }

        Polynomial p = polynomial.get();
        int degree = p.degree();
        if (degree > options.maxDegree()) {
            return SolutionSet.none("polynomial degree " + degree + " exceeds the maximum of " + options.maxDegree());
        }

        return switch (degree) {
            case 0 -> constant(p.coefficient(0));
            case 1 -> linear(p.coefficient(1), p.coefficient(0));
            case 2 -> quadratic(p.coefficient(2), p.coefficient(1), p.coefficient(0));
            default -> SolutionSet.none("degree " + degree + " equations have no closed-form solver");
        };
    }

    private SolutionSet constant(final Expr value) {
        if (Numbers.isZero(value)) {
            return SolutionSet.identity(options.variable());
        }
        try {
            BigDecimal v = value.eval();
            if (v.signum() == 0) {
                return SolutionSet.identity(options.variable());
            }
            return SolutionSet.none("no solution: " + v.toPlainString() + " <> 0");
        }
        catch (EvaluationException e) {
            return SolutionSet.none("cannot evaluate constant expression " + value + ": " + e.getMessage());
        }
    }

    // a*x + b = 0
    private SolutionSet linear(final Expr a, final Expr b) {
        Optional<Expr.Numeric> exactA = Numbers.exactRational(a);
        Optional<Expr.Numeric> exactB = Numbers.exactRational(b);
        if (exactA.isPresent() && exactB.isPresent()) {
            Expr.Numeric root = Numbers.multiply(Numbers.negate(exactB.get()), reciprocal(exactA.get()));
            return SolutionSet.of("linear equation solved", List.of(solution(root, true)));
        }

        Expr root = simplifier.simplify(new Expr.Mul(Numbers.MINUS_ONE, b, new Expr.Pow(a, Numbers.MINUS_ONE)));
        boolean exact = !containsFloat(a) && !containsFloat(b);
        if (!exact && !options.allowApproximate()) {
            return SolutionSet.none("approximate solutions are disabled");
        }
        return SolutionSet.of("linear equation solved", List.of(solution(root, exact)));
    }

    // a*x^2 + b*x + c = 0
    private SolutionSet quadratic(final Expr a, final Expr b, final Expr c) {
        Optional<Expr.Numeric> exactA = Numbers.exactRational(a);
        Optional<Expr.Numeric> exactB = Numbers.exactRational(b);
        Optional<Expr.Numeric> exactC = Numbers.exactRational(c);
        if (exactA.isPresent() && exactB.isPresent() && exactC.isPresent()) {
            return exactQuadratic(exactA.get(), exactB.get(), exactC.get());
        }
        return approximateQuadratic(a, b, c);
    }

    private SolutionSet exactQuadratic(final Expr.Numeric a, final Expr.Numeric b, final Expr.Numeric c) {
        // b^2 - 4ac
        Expr.Numeric discriminant = Numbers.add(Numbers.multiply(b, b),
                Numbers.multiply(new Expr.Int(-4), Numbers.multiply(a, c)));
        log.debug("discriminant {}", discriminant);

        if (discriminant.signum() < 0) {
            return noRealRoots();
        }

        Expr.Numeric twoA = Numbers.multiply(new Expr.Int(2), a);
        Expr.Numeric minusB = Numbers.negate(b);
        if (discriminant.signum() == 0) {
            Expr.Numeric root = Numbers.multiply(minusB, reciprocal(twoA));
            return SolutionSet.of("quadratic equation solved (repeated root)", List.of(solution(root, true)));
        }

        Optional<Expr.Numeric> squareRoot = exactSquareRoot(discriminant);
        List<Solution> solutions = new ArrayList<>(2);
        if (squareRoot.isPresent()) {
            Expr.Numeric s = squareRoot.get();
            solutions.add(solution(Numbers.multiply(Numbers.add(minusB, Numbers.negate(s)), reciprocal(twoA)), true));
            solutions.add(solution(Numbers.multiply(Numbers.add(minusB, s), reciprocal(twoA)), true));
        }
        else {
            Expr sqrt = new Expr.Func("sqrt", discriminant);
            Expr over = reciprocal(twoA);
            solutions.add(solution(simplifier.collect(new Expr.Mul(over,
                    new Expr.Add(minusB, new Expr.Mul(Numbers.MINUS_ONE, sqrt)))), true));
            solutions.add(solution(simplifier.collect(new Expr.Mul(over, new Expr.Add(minusB, sqrt))), true));
        }
        solutions.sort(Comparator.comparing(s -> s.value().eval()));
        return SolutionSet.of("quadratic equation solved", solutions);
    }

    private SolutionSet approximateQuadratic(final Expr a, final Expr b, final Expr c) {
        if (!options.allowApproximate()) {
            return SolutionSet.none("approximate solutions are disabled");
        }

        BigDecimal av;
        BigDecimal bv;
        BigDecimal cv;
        try {
            av = a.eval();
            bv = b.eval();
            cv = c.eval();
        }
        catch (EvaluationException e) {
            return SolutionSet.none("cannot evaluate coefficients: " + e.getMessage());
        }

        BigDecimal discriminant = bv.multiply(bv).subtract(BigDecimal.valueOf(4).multiply(av).multiply(cv));
        if (discriminant.signum() < 0) {
            return noRealRoots();
        }

        BigDecimal twoA = av.multiply(BigDecimal.valueOf(2));
        if (discriminant.signum() == 0) {
            Expr root = new Expr.Float(bv.negate().divide(twoA, Numbers.CONTEXT));
            return SolutionSet.of("quadratic equation solved (repeated root)", List.of(solution(root, false)));
        }

        BigDecimal s = discriminant.sqrt(Numbers.CONTEXT);
        List<Solution> solutions = new ArrayList<>(2);
        solutions.add(solution(new Expr.Float(bv.negate().subtract(s).divide(twoA, Numbers.CONTEXT)), false));
        solutions.add(solution(new Expr.Float(bv.negate().add(s).divide(twoA, Numbers.CONTEXT)), false));
        solutions.sort(Comparator.comparing(sol -> sol.value().eval()));
        return SolutionSet.of("quadratic equation solved", solutions);
    }

    private SolutionSet noRealRoots() {
        if (options.allowComplex()) {
            return SolutionSet.none("complex solutions are not supported");
        }
        return SolutionSet.none("no real solutions (discriminant < 0)");
    }

    private Solution solution(final Expr value, final boolean exact) {
        return new Solution(options.variable(), value, true, exact);
    }

    private static Expr.Numeric reciprocal(final Expr.Numeric value) {
        return Numbers.pow(value, BigInteger.ONE.negate())
                .orElseThrow(() -> new IllegalStateException("reciprocal of zero"));
    }

    private static Optional<Expr.Numeric> exactSquareRoot(final Expr.Numeric value) {
        if (!(value instanceof Expr.Int) && !(value instanceof Expr.Rational)) {
            return Optional.empty();
        }

        Expr.Numeric reduced = Numbers.exactRational(value).orElseThrow();
        BigInteger numerator = reduced instanceof Expr.Rational r ? r.numerator() : ((Expr.Int) reduced).value();
        BigInteger denominator = reduced instanceof Expr.Rational q ? q.denominator() : BigInteger.ONE;
        BigInteger n = numerator.sqrt();
        BigInteger d = denominator.sqrt();
        if (n.multiply(n).equals(numerator) && d.multiply(d).equals(denominator)) {
            return Optional.of(Numbers.of(n, d));
        }
        return Optional.empty();
    }

    private static boolean containsFloat(final Expr expr) {
        return switch (expr.kind()) {
            case FLOAT -> true;
            case ADD -> ((Expr.Add) expr).terms().stream().anyMatch(EquationSolver::containsFloat);
            case MUL -> ((Expr.Mul) expr).factors().stream().anyMatch(EquationSolver::containsFloat);
            case POW -> containsFloat(((Expr.Pow) expr).base()) || containsFloat(((Expr.Pow) expr).exponent());
            case FUNC -> ((Expr.Func) expr).args().stream().anyMatch(EquationSolver::containsFloat);
            default -> false;
        };
    }
}
