package org.kidoni.symbolic.solve;

import java.math.BigDecimal;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.kidoni.symbolic.expr.Expr;
import org.kidoni.symbolic.parse.Parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EquationSolverTest {
    private final EquationSolver solver = new EquationSolver();

    private static Expr parse(final String input) {
        return Parser.parse(input).orElseThrow();
    }

    private static List<String> values(final SolutionSet set) {
        return set.solutions().stream().map(s -> s.value().toString()).toList();
    }

    @Test
    void quadraticWithRationalRoots() {
        var result = solver.solve(parse("x^2-5*x+6"));
        assertTrue(result.hasSolutions());
        assertEquals("quadratic equation solved", result.message());
        assertEquals(List.of("2", "3"), values(result));
        assertTrue(result.solutions().get(0).exact());
        assertEquals("x = 2", result.solutions().get(0).toString());
    }

    @Test
    void quadraticWithIrrationalRoots() {
        Expr equation = parse("x^2-2");
        var result = solver.solve(equation);
        assertEquals(2, result.solutions().size());

        var smaller = result.solutions().get(0);
        assertEquals(-Math.sqrt(2), smaller.value().eval().doubleValue(), 1e-12);
        for (Solution solution : result.solutions()) {
            assertTrue(solver.verify(solution, equation));
            assertTrue(solution.exact());
        }
    }

    @Test
    void repeatedRoot() {
        var result = solver.solve(parse("x^2-2*x+1"));
        assertEquals("quadratic equation solved (repeated root)", result.message());
        assertEquals(List.of("1"), values(result));
    }

    @Test
    void noRealRoots() {
        var result = solver.solve(parse("x^2+1"));
        assertFalse(result.hasSolutions());
        assertEquals("no real solutions (discriminant < 0)", result.message());

        var complex = new EquationSolver(SolveOptions.defaults().withAllowComplex(true)).solve(parse("x^2+1"));
        assertEquals("complex solutions are not supported", complex.message());
    }

    @Test
    void linearEquations() {
        assertEquals(List.of("-2"), values(solver.solve(parse("2*x+4"))));
        assertEquals(List.of("3"), values(solver.solve(parse("2x + 1 = 7"))));
        assertEquals(List.of("4"), values(solver.solve(parse("2*x"), parse("8"))));
        assertEquals(List.of("-3/2"), values(solver.solve(parse("2*x+3"))));
        assertEquals("linear equation solved", solver.solve(parse("x+1")).message());
    }

    @Test
    void equationWithSidesSwapped() {
        assertEquals(List.of("-2", "2"), values(solver.solve(parse("4 = x^2"))));
    }

    @Test
    void otherVariable() {
        var ySolver = new EquationSolver(SolveOptions.defaults().withVariable("y"));
        var result = ySolver.solve(parse("y^2-4"));
        assertEquals(List.of("-2", "2"), values(result));
        assertEquals("y", result.solutions().get(0).variable());
    }

    @Test
    void constantEquations() {
        var identity = solver.solve(parse("x-x"));
        assertTrue(identity.hasSolutions());
        assertTrue(identity.isIdentity());
        assertEquals("identity: true for all values of x", identity.message());

        var none = solver.solve(parse("5"));
        assertFalse(none.hasSolutions());
        assertEquals("no solution: 5 <> 0", none.message());
    }

    @Test
    void unsupportedEquations() {
        assertEquals("degree 3 equations have no closed-form solver", solver.solve(parse("x^3-x")).message());

        var limited = new EquationSolver(SolveOptions.defaults().withMaxDegree(2));
        assertEquals("polynomial degree 3 exceeds the maximum of 2", limited.solve(parse("x^3-x")).message());

        var transcendental = solver.solve(parse("sin(x)"));
        assertFalse(transcendental.hasSolutions());
        assertTrue(transcendental.message().startsWith("not a polynomial in x"));

        var inequality = solver.solve(parse("x < 3"));
        assertFalse(inequality.hasSolutions());
        assertTrue(inequality.message().startsWith("only equations can be solved"));
    }

    @Test
    void decimalCoefficients() {
        var result = solver.solve(parse("0.5*x^2-2"));
        assertEquals(2, result.solutions().size());
        assertEquals(0, new BigDecimal("-2").compareTo(result.solutions().get(0).value().eval()));
        assertEquals(0, new BigDecimal("2").compareTo(result.solutions().get(1).value().eval()));
        assertFalse(result.solutions().get(0).exact());

        var exactOnly = new EquationSolver(SolveOptions.defaults().withAllowApproximate(false));
        assertFalse(exactOnly.solve(parse("0.5*x^2-2")).hasSolutions());
    }

    @Test
    void verifyRejectsWrongSolution() {
        var wrong = new Solution("x", new Expr.Int(5), true, true);
        assertFalse(solver.verify(wrong, parse("x^2-4")));
        assertTrue(solver.verify(new Solution("x", new Expr.Int(2), true, true), parse("x^2=4")));
    }

    @Test
    void invalidOptions() {
        assertThrows(IllegalArgumentException.class, () -> SolveOptions.defaults().withMaxDegree(-1));
        assertThrows(IllegalArgumentException.class, () -> SolveOptions.defaults().withVariable(""));
    }
}
