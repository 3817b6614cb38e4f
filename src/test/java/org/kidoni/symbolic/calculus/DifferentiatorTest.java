package org.kidoni.symbolic.calculus;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.kidoni.symbolic.expr.Expr;
import org.kidoni.symbolic.parse.Parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeout;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DifferentiatorTest {
    private final Differentiator differentiator = new Differentiator();

    private static Expr parse(final String input) {
        return Parser.parse(input).orElseThrow();
    }

    private String derive(final String input) {
        return differentiator.derivative(parse(input), "x").toString();
    }

    private double deriveAt(final String input, final double x) {
        return differentiator.derivative(parse(input), "x").eval(Map.of("x", BigDecimal.valueOf(x))).doubleValue();
    }

    @ParameterizedTest
    @CsvSource(delimiter = ';', value = {
            "5; 0",
            "pi; 0",
            "x; 1",
            "y; 0",
            "x^3; 3*x^2",
            "3*x^2+2*x+1; 6*x+2",
            "sin(x^2); 2*cos(x^2)*x",
            "x*sin(x); sin(x)+x*cos(x)",
            "cos(x); -1*sin(x)",
            "exp(x); exp(x)",
            "ln(x); x^(-1)",
            "sqrt(x); 1/2*x^(-1/2)",
            "y*x^2; 2*y*x"
    })
    void derivative(final String input, final String expected) {
        assertEquals(expected, derive(input));
    }

    @Test
    void exponentialOfConstantBase() {
        assertEquals(1.0, deriveAt("e^x", 0), 1e-12);
        assertEquals(8 * Math.log(2), deriveAt("2^x", 3), 1e-9);
    }

    @Test
    void variableBaseAndExponent() {
        assertEquals(4 * (Math.log(2) + 1), deriveAt("x^x", 2), 1e-9);
    }

    @Test
    void chainRuleThroughNestedFunctions() {
        assertEquals(Math.cos(Math.sin(1.0)) * Math.cos(1.0), deriveAt("sin(sin(x))", 1.0), 1e-9);
        assertEquals(1.0 / (1 + 0.25), deriveAt("arctan(x)", 0.5), 1e-9);
        assertEquals(0.25, deriveAt("sqrt(x)", 4), 1e-12);
    }

    @Test
    void derivativeIsIndependentOfOtherVariables() {
        assertEquals("0", differentiator.derivative(parse("sin(y)*y^2"), "x").toString());
    }

    @Test
    void equationsCannotBeDifferentiated() {
        var error = assertThrows(UnsupportedDifferentiationException.class, () -> derive("x^2=4"));
        assertTrue(error.getMessage().startsWith("cannot differentiate an equation"));
    }

    @Test
    void unknownFunction() {
        var error = assertThrows(UnsupportedDifferentiationException.class,
                () -> differentiator.derivative(new Expr.Func("unsupported_fn", new Expr.Var("x")), "x"));
        assertEquals("unsupported function: unsupported_fn", error.getMessage());
    }

    @Test
    void multiArgumentFunction() {
        var error = assertThrows(UnsupportedDifferentiationException.class, () -> derive("log(x, 2)"));
        assertEquals("cannot differentiate log with 2 arguments", error.getMessage());
    }

    @Test
    void higherOrderDerivatives() {
        Expr cube = parse("x^3");
        assertEquals("6*x", differentiator.nthDerivative(cube, "x", 2).toString());
        assertEquals("6", differentiator.nthDerivative(cube, "x", 3).toString());
        assertEquals("0", differentiator.nthDerivative(cube, "x", 4).toString());
        assertSame(cube, differentiator.nthDerivative(cube, "x", 0));
    }

    @Test
    void nthDerivativeStopsOnceZero() {
        assertTimeout(Duration.ofSeconds(5),
                () -> assertEquals("0", differentiator.nthDerivative(parse("x^3+2*x"), "x", Integer.MAX_VALUE).toString()));
        assertEquals("0", differentiator.nthDerivative(parse("5"), "x", 1_000_000_000).toString());
    }

    @Test
    void negativeOrder() {
        var error = assertThrows(InvalidDerivativeOrderException.class,
                () -> differentiator.nthDerivative(parse("x"), "x", -1));
        assertEquals(-1, error.getOrder());
    }

    @Test
    void gradientInRequestedOrder() {
        Map<String, Expr> gradient = differentiator.gradient(parse("x^2*y"), List.of("x", "y"));
        assertEquals(List.of("x", "y"), List.copyOf(gradient.keySet()));
        assertEquals("2*x*y", gradient.get("x").toString());
        assertEquals("x^2", gradient.get("y").toString());
    }

    @Test
    void gradientFailsAsAWhole() {
        assertThrows(UnsupportedDifferentiationException.class,
                () -> differentiator.gradient(parse("x=y"), List.of("x", "y")));
        var error = assertThrows(UnsupportedDifferentiationException.class,
                () -> differentiator.gradient(new Expr.Func("unsupported_fn", parse("x")), List.of("x")));
        assertTrue(error.getMessage().contains("unsupported_fn"), error.getMessage());
    }
}
