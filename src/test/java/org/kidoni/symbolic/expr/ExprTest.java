package org.kidoni.symbolic.expr;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.kidoni.symbolic.expr.Expressions.add;
import static org.kidoni.symbolic.expr.Expressions.decimal;
import static org.kidoni.symbolic.expr.Expressions.eq;
import static org.kidoni.symbolic.expr.Expressions.func;
import static org.kidoni.symbolic.expr.Expressions.integer;
import static org.kidoni.symbolic.expr.Expressions.mul;
import static org.kidoni.symbolic.expr.Expressions.negate;
import static org.kidoni.symbolic.expr.Expressions.pow;
import static org.kidoni.symbolic.expr.Expressions.rational;
import static org.kidoni.symbolic.expr.Expressions.rationalPreserved;
import static org.kidoni.symbolic.expr.Expressions.var;

class ExprTest {
    private final Expr x = var("x");
    private final Expr y = var("y");

    @Test
    void emptySumAndProduct() {
        assertEquals("0", add().toString());
        assertEquals("1", mul().toString());
    }

    @Test
    void sumRendering() {
        assertEquals("x+y", add(x, y).toString());
        assertEquals("x-1*y", add(x, negate(y)).toString());
        assertEquals("x-3", add(x, integer(-3)).toString());
    }

    @Test
    void productRendering() {
        assertEquals("2*x", mul(integer(2), x).toString());
        assertEquals("2*(x+1)", mul(integer(2), add(x, integer(1))).toString());
    }

    @Test
    void powerRendering() {
        assertEquals("x^2", pow(x, 2).toString());
        assertEquals("x^(-1)", pow(x, -1).toString());
        assertEquals("x^(1/2)", pow(x, rational(1, 2)).toString());
        assertEquals("(x+1)^2", pow(add(x, integer(1)), 2).toString());
        assertEquals("(x^2)^3", pow(pow(x, 2), 3).toString());
        assertEquals("x^y^2", pow(x, pow(y, 2)).toString());
        assertEquals("(-2)^x", pow(integer(-2), x).toString());
        assertEquals("x^(a+1)", pow(x, add(var("a"), integer(1))).toString());
    }

    @Test
    void leafRendering() {
        assertEquals("2.5", decimal("2.500").toString());
        assertEquals("100", decimal(new BigDecimal("100")).toString());
        assertEquals("pi", Expr.Const.PI.toString());
        assertEquals("log(x, 2)", func("log", x, integer(2)).toString());
    }

    @Test
    void relationRendering() {
        assertEquals("x>=8", eq(x, integer(8), Relation.GREATER_EQUAL).toString());
        assertEquals("x<>1", eq(x, integer(1), Relation.NOT_EQUAL).toString());
        assertEquals("x=y", eq(x, y).toString());
    }

    @Test
    void rationalIsReducedWithPositiveDenominator() {
        Expr.Rational half = rational(2, 4);
        assertEquals(BigInteger.ONE, half.numerator());
        assertEquals(BigInteger.TWO, half.denominator());
        assertTrue(half.isReduced());

        Expr.Rational negative = rational(1, -2);
        assertEquals("-1/2", negative.toString());
        assertEquals("2/1", rational(4, 2).toString());
    }

    @Test
    void preservedRationalKeepsItsForm() {
        Expr.Rational preserved = rationalPreserved(2, 4);
        assertEquals("2/4", preserved.toString());
        assertFalse(preserved.isReduced());
        assertEquals(0, new BigDecimal("0.5").compareTo(preserved.eval()));
    }

    @Test
    void zeroDenominatorIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> rational(1, 0));
        assertThrows(IllegalArgumentException.class, () -> new Expr.Rational(BigInteger.ONE, BigInteger.ZERO));
    }

    @Test
    void freeVariablesInFirstSeenOrder() {
        Expr expr = add(mul(y, x), func("sin", x), Expr.Const.PI, pow(var("z"), y));
        assertEquals(List.of("y", "x", "z"), expr.freeVariables());
        assertTrue(expr.dependsOn("z"));
        assertFalse(expr.dependsOn("pi"));
    }

    @Test
    void structuralEqualityIsPositional() {
        assertTrue(add(x, y).structuralEquals(add(x, y)));
        assertFalse(add(x, y).structuralEquals(add(y, x)));
        assertTrue(decimal("2.50").structuralEquals(decimal("2.5")));
        assertFalse(integer(2).structuralEquals(decimal("2")));
        assertFalse(eq(x, y).structuralEquals(eq(x, y, Relation.LESS)));
    }

    @Test
    void deepCopyIsIndependentButEqual() {
        Expr expr = add(mul(integer(2), x), func("cos", pow(y, 2)), eq(x, y));
        Expr copy = expr.deepCopy();

        assertNotSame(expr, copy);
        assertTrue(expr.structuralEquals(copy));
        assertEquals(expr.toString(), copy.toString());
        assertNotSame(((Expr.Add) expr).terms().get(0), ((Expr.Add) copy).terms().get(0));
    }

    @Test
    void kindMatchesVariant() {
        assertEquals(Kind.INT, integer(1).kind());
        assertEquals(Kind.FLOAT, decimal("1.5").kind());
        assertEquals(Kind.RATIONAL, rational(1, 3).kind());
        assertEquals(Kind.CONST, Expr.Const.E.kind());
        assertEquals(Kind.EQ, eq(x, y).kind());
        assertTrue(Kind.RATIONAL.isNumeric());
        assertFalse(Kind.CONST.isNumeric());
    }
}
