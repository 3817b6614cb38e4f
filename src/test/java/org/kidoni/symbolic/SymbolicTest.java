package org.kidoni.symbolic;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.kidoni.symbolic.expr.Expr;
import org.kidoni.symbolic.parse.ParseException;
import org.kidoni.symbolic.simplify.ExpandOptions;
import org.kidoni.symbolic.simplify.SimplifyOptions;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SymbolicTest {
    @Test
    void parseFailureIsAnException() {
        var error = assertThrows(ParseException.class, () -> Symbolic.parse("2+"));
        assertInstanceOf(SymbolicException.class, error);
    }

    @Test
    void simplifyAndDerive() {
        Expr expr = Symbolic.parse("x^3+x^3");
        assertEquals("2*x^3", Symbolic.simplify(expr).toString());
        assertEquals("6*x^2", Symbolic.derivative(expr, "x").toString());
        assertEquals("12*x", Symbolic.nthDerivative(expr, "x", 2).toString());
    }

    @Test
    void derivativeMatchesDifferenceQuotient() {
        Expr expr = Symbolic.parse("x^2*sin(x)+3*x");
        Expr derivative = Symbolic.derivative(expr, "x");

        double x = 0.7;
        double h = 1e-6;
        double quotient = (expr.eval(Map.of("x", BigDecimal.valueOf(x + h))).doubleValue()
                - expr.eval(Map.of("x", BigDecimal.valueOf(x - h))).doubleValue()) / (2 * h);
        assertEquals(quotient, derivative.eval(Map.of("x", BigDecimal.valueOf(x))).doubleValue(), 1e-6);
    }

    @Test
    void expandWithOptions() {
        Expr expr = Symbolic.parse("ln(x*y)");
        assertEquals("ln(x*y)", Symbolic.expand(expr).toString());
        assertEquals("ln(x)+ln(y)", Symbolic.expand(expr, ExpandOptions.defaults().withExpandLogs(true)).toString());
    }

    @Test
    void gradientSolveAndCompare() {
        assertEquals(List.of("x", "y"), List.copyOf(Symbolic.gradient(Symbolic.parse("x*y"), List.of("x", "y")).keySet()));
        assertTrue(Symbolic.solve(Symbolic.parse("x^2=9")).hasSolutions());
        assertTrue(Symbolic.compare(Symbolic.parse("x*(x+2)"), Symbolic.parse("x^2+2*x")).equal());
        assertEquals("x+y", Symbolic.normalize(Symbolic.parse("y+x")).toString());
        assertEquals("2*(x+2)", Symbolic.factor(Symbolic.parse("2*x+4")).toString());
        assertEquals("2*x+4", Symbolic.collect(Symbolic.parse("x+x+4")).toString());
    }

    @Test
    void collectAndFactorWithOptions() {
        Expr negative = Symbolic.parse("-2*x-4*y");
        assertEquals("-2*(x+2*y)", Symbolic.factor(negative).toString());
        assertEquals("2*(-1*x-2*y)",
                Symbolic.factor(negative, SimplifyOptions.defaults().withKeepNegativeFactoring(true)).toString());
        assertEquals("3*x", Symbolic.collect(Symbolic.parse("x+x+x"), SimplifyOptions.defaults()).toString());
    }

    @Test
    void divideThroughEquation() {
        assertEquals("x+2", Symbolic.divideThrough((Expr.Eq) Symbolic.parse("3*x+6=0")).toString());
    }
}
