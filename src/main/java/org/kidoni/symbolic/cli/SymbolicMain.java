package org.kidoni.symbolic.cli;

import java.io.PrintStream;
import java.math.BigDecimal;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.kidoni.symbolic.SymbolicException;
import org.kidoni.symbolic.calculus.Differentiator;
import org.kidoni.symbolic.expr.Expr;
import org.kidoni.symbolic.parse.Parser;
import org.kidoni.symbolic.simplify.ExpandOptions;
import org.kidoni.symbolic.simplify.SimplifyOptions;
import org.kidoni.symbolic.simplify.Simplifier;
import org.kidoni.symbolic.solve.EquationSolver;
import org.kidoni.symbolic.solve.Solution;
import org.kidoni.symbolic.solve.SolutionSet;
import org.kidoni.symbolic.solve.SolveOptions;

/**
 * Command line front end.
 * <pre>
 *  symbolic simplify|expand|factor|latex EXPR
 *  symbolic eval EXPR [name=value ...]
 *  symbolic derive EXPR [variable] [order]
 *  symbolic solve EXPR [variable]
 * </pre>
 * {@code SYMBOLIC_MAX_ITERATIONS} and {@code SYMBOLIC_MAX_DEGREE} override the simplifier's
 * iteration cap and the expander's degree cap.
 */
public class SymbolicMain {
    static final String MAX_ITERATIONS_ENV = "SYMBOLIC_MAX_ITERATIONS";
    static final String MAX_DEGREE_ENV = "SYMBOLIC_MAX_DEGREE";

    private static final String USAGE = "usage: symbolic simplify|expand|factor|latex|eval|derive|solve EXPR [ARGS...]";

    public static void main(String[] args) {
        System.exit(run(args, System.getenv(), System.out, System.err));
    }

    static int run(final String[] args, final Map<String, String> env, final PrintStream out, final PrintStream err) {
        if (args.length < 2) {
            err.println(USAGE);
            return 2;
        }

        SimplifyOptions simplifyOptions = SimplifyOptions.defaults()
                .withMaxIterations(intSetting(env, MAX_ITERATIONS_ENV, SimplifyOptions.DEFAULT_MAX_ITERATIONS, err));
        ExpandOptions expandOptions = ExpandOptions.defaults()
                .withMaxDegree(intSetting(env, MAX_DEGREE_ENV, ExpandOptions.DEFAULT_MAX_DEGREE, err));
        Simplifier simplifier = new Simplifier(simplifyOptions, expandOptions);

        String command = args[0];
        List<String> rest = Arrays.asList(args).subList(2, args.length);
        try {
            Expr expr = Parser.parse(args[1]).orElseThrow();
            switch (command) {
                case "simplify" -> out.println(simplifier.simplify(expr));
                case "expand" -> out.println(simplifier.collect(simplifier.expandFully(expr)));
                case "factor" -> out.println(simplifier.factor(simplifier.collect(expr)));
                case "latex" -> out.println(expr.toLatex());
                case "eval" -> out.println(expr.eval(bindings(rest)).stripTrailingZeros().toPlainString());
                case "derive" -> {
                    String variable = rest.isEmpty() ? "x" : rest.get(0);
                    int order = rest.size() < 2 ? 1 : Integer.parseInt(rest.get(1));
                    Expr derivative = new Differentiator(simplifier).nthDerivative(expr, variable, order);
                    out.println(simplifier.simplify(derivative));
                }
                case "solve" -> {
                    SolveOptions options = SolveOptions.defaults();
                    if (!rest.isEmpty()) {
                        options = options.withVariable(rest.get(0));
                    }
                    SolutionSet solutions = new EquationSolver(options, simplifier).solve(expr);
                    out.println(solutions.message());
                    for (Solution solution : solutions.solutions()) {
                        out.println(solution);
                    }
                    if (!solutions.hasSolutions()) {
                        return 1;
                    }
                }
                default -> {
                    err.println("unknown command: " + command);
                    err.println(USAGE);
                    return 2;
                }
            }
        }
        catch (SymbolicException | IllegalArgumentException e) {
            err.println(command + ": " + e.getMessage());
            return 1;
        }

        return 0;
    }

    private static Map<String, BigDecimal> bindings(final List<String> assignments) {
        Map<String, BigDecimal> bindings = new HashMap<>();
        for (String assignment : assignments) {
            int equals = assignment.indexOf('=');
            if (equals <= 0) {
                throw new IllegalArgumentException("expected name=value, got " + assignment);
            }
            bindings.put(assignment.substring(0, equals).trim(), new BigDecimal(assignment.substring(equals + 1).trim()));
        }
        return bindings;
    }

    private static int intSetting(final Map<String, String> env, final String name, final int defaultValue, final PrintStream err) {
        String value = env.get(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed >= 0) {
                return parsed;
            }
            err.println("ignoring " + name + "=" + value + ": must not be negative");
        }
        catch (NumberFormatException e) {
            err.println("ignoring " + name + "=" + value + ": not an integer");
        }
        return defaultValue;
    }
}
