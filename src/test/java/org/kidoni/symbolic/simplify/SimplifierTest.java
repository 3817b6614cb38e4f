package org.kidoni.symbolic.simplify;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.kidoni.symbolic.expr.Expr;
import org.kidoni.symbolic.parse.Parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeout;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.kidoni.symbolic.expr.Expressions.add;
import static org.kidoni.symbolic.expr.Expressions.integer;
import static org.kidoni.symbolic.expr.Expressions.mul;
import static org.kidoni.symbolic.expr.Expressions.negate;
import static org.kidoni.symbolic.expr.Expressions.pow;
import static org.kidoni.symbolic.expr.Expressions.rational;
import static org.kidoni.symbolic.expr.Expressions.var;

class SimplifierTest {
    private final Simplifier simplifier = new Simplifier();
    private final Expr x = var("x");
    private final Expr y = var("y");

    private static Expr parse(final String input) {
        return Parser.parse(input).orElseThrow();
    }

    @ParameterizedTest
    @CsvSource(delimiter = ';', value = {
            "x+x+x; 3*x",
            "2*x+3*x+1; 5*x+1",
            "x-x; 0",
            "3*x-3*x+5; 5",
            "x*x*x; x^3",
            "x*x^2; x^3",
            "x*x^-1; 1",
            "(x^2)^3; x^6",
            "1/2+1/2; 1",
            "6/4; 3/2",
            "2^3; 8",
            "2^-1; 1/2",
            "2*0*x; 0",
            "1^x; 1",
            "x^0; 1",
            "x^1; x",
            "2*x*3; 6*x"
    })
    void collect(final String input, final String expected) {
        assertEquals(expected, simplifier.collect(parse(input)).toString());
    }

    @ParameterizedTest
    @CsvSource({"2, 3", "-3, -4", "-6, -4", "5, -5", "0, 0", "123456789012, 987654321098"})
    void simplifyFoldsIntegerSums(final long a, final long b) {
        assertEquals(integer(a + b).toString(), simplifier.simplify(add(integer(a), integer(b))).toString());
    }

    @Test
    void collectKeepsWrittenNegativeZero() {
        assertEquals("-1*0", simplifier.collect(parse("-0")).toString());
    }

    @Test
    void collectRecursesIntoFunctionsAndRelations() {
        assertEquals("sin(2*x)", simplifier.collect(parse("sin(x+x)")).toString());
        assertEquals("2*x=4", simplifier.collect(parse("x+x=2+2")).toString());
    }

    @Test
    void collectPreservesValue() {
        Expr expr = parse("3*x^2+2*x*y-x^2+4*y*x+7");
        var bindings = Map.of("x", BigDecimal.valueOf(2), "y", BigDecimal.valueOf(5));
        assertEquals(0, expr.eval(bindings).compareTo(simplifier.collect(expr).eval(bindings)));
    }

    @Test
    void factorPullsOutIntegerGcd() {
        assertEquals("2*(x+2*y)", simplifier.factor(parse("2*x+4*y")).toString());
        assertEquals("3*(x+2)", simplifier.factor(parse("3*x+6")).toString());
        assertEquals("x+y", simplifier.factor(parse("x+y")).toString());
    }

    @Test
    void factorLeavesNonIntegerCoefficientsAlone() {
        Expr expr = add(mul(rational(1, 2), x), mul(integer(2), y));
        assertTrue(expr.structuralEquals(simplifier.factor(expr)));
    }

    @Test
    void factorPullsOutCommonSymbolicFactors() {
        assertEquals("x*(y+z)", simplifier.factor(parse("x*y+x*z")).toString());
        assertEquals("2*x^2*(3*y+2)", simplifier.factor(parse("6*x^2*y+4*x^2")).toString());
        assertEquals("sin(x)*(x+1)", simplifier.factor(parse("sin(x)*x+sin(x)")).toString());
        assertEquals("x^2+x", simplifier.factor(parse("x^2+x")).toString());
    }

    @Test
    void factorPullsOutSymbolicFactorsDespiteFractions() {
        Expr expr = add(mul(rational(1, 2), x, y), mul(integer(2), x));
        Expr factored = simplifier.factor(expr);

        var product = assertInstanceOf(Expr.Mul.class, factored);
        assertEquals("x", product.factors().get(0).toString());
        var bindings = Map.of("x", BigDecimal.valueOf(3), "y", BigDecimal.valueOf(4));
        assertEquals(0, expr.eval(bindings).compareTo(factored.eval(bindings)));
    }

    @Test
    void simplifyFactorsCommonVariable() {
        assertEquals("x*(y+z)", simplifier.simplify(parse("x*y+x*z")).toString());
    }

    @Test
    void factorAllNegativeSum() {
        Expr expr = add(mul(integer(-2), x), mul(integer(-4), y));
        assertEquals("-2*(x+2*y)", simplifier.factor(expr).toString());

        var keeping = new Simplifier(SimplifyOptions.defaults().withKeepNegativeFactoring(true));
        assertEquals("2*(-1*x-2*y)", keeping.factor(expr).toString());
    }

    @Test
    void factorBothSidesOfRelation() {
        assertEquals("2*(x+2)=4*(y+1)", simplifier.factor(parse("2*x+4=4*y+4")).toString());
    }

    @Test
    void simplifyKeepsFactoredForm() {
        Expr simplified = simplifier.simplify(parse("2*x+4*y"));
        assertEquals("2*(x+2*y)", simplified.toString());

        var bindings = Map.of("x", BigDecimal.valueOf(3), "y", BigDecimal.ONE);
        assertEquals(0, BigDecimal.TEN.compareTo(simplified.eval(bindings)));
    }

    @Test
    void simplifyEscapesPlateauWhenExpansionIsSmaller() {
        assertEquals("x^2-1", simplifier.simplify(parse("(x+1)*(x-1)")).toString());
    }

    @Test
    void simplifyDoesNotExpandWhenExpansionIsLarger() {
        assertEquals("(x+1)^2", simplifier.simplify(parse("(x+1)^2")).toString());
    }

    @Test
    void plateauEscapeSkipsLargeMultinomialPowers() {
        assertTimeout(Duration.ofSeconds(5),
                () -> assertEquals("(a+b+c+d+e)^9", simplifier.simplify(parse("(a+b+c+d+e)^9")).toString()));

        Expr product = parse("(a+b+c+d+f)^4*(g+h+k+m+n)^4");
        assertTrue(Simplifier.expandedTerms(product) > Simplifier.ESCAPE_MAX_TERMS);
        assertTimeout(Duration.ofSeconds(5),
                () -> assertEquals(product.toString(), simplifier.simplify(product).toString()));
    }

    @ParameterizedTest
    @CsvSource(delimiter = ';', value = {
            "3*x+6=0; x+2",
            "2*x=4; x-2",
            "2*x*(x+1)=0; x+1",
            "4*x>=2; 2*x-1",
            "-2*x<0; -1*x"
    })
    void divideThrough(final String input, final String expected) {
        assertEquals(expected, simplifier.divideThrough((Expr.Eq) parse(input)).toString());
    }

    @ParameterizedTest
    @ValueSource(strings = {"2*x+4*y", "x^2+2*x+1", "(x+1)*(x-1)", "x*x*x", "3*x-3*x+5", "sin(x)^2+cos(x)^2", "x*y+x*z"})
    void simplifyIsIdempotent(final String input) {
        Expr once = simplifier.simplify(parse(input));
        assertEquals(once.toString(), simplifier.simplify(once).toString());
    }

    @Test
    void zeroIterationsReturnsInput() {
        Expr expr = parse("x+x");
        var none = new Simplifier(SimplifyOptions.defaults().withMaxIterations(0));
        assertSame(expr, none.simplify(expr));
    }

    @Test
    void singlePassStopsAfterOneRound() {
        var single = new Simplifier(SimplifyOptions.defaults().withSinglePass(true));
        assertEquals("2*x", single.simplify(parse("x+x")).toString());
    }

    @Test
    void invalidOptions() {
        assertThrows(IllegalArgumentException.class, () -> SimplifyOptions.defaults().withMaxIterations(-1));
        assertThrows(IllegalArgumentException.class, () -> ExpandOptions.defaults().withMaxDegree(-1));
    }

    @Test
    void normalizeSortsOperands() {
        assertEquals("x+y", simplifier.normalize(add(y, x)).toString());
        assertEquals("2*x*y", simplifier.normalize(mul(y, integer(2), x)).toString());
        assertEquals("(a+b)^2", simplifier.normalize(pow(add(var("b"), var("a")), 2)).toString());
    }

    @Test
    void normalizeIsStable() {
        Expr normalized = simplifier.normalize(parse("z*y+c*b*a+sin(q+p)"));
        assertEquals(normalized.toString(), simplifier.normalize(normalized).toString());
    }

    @Test
    void semanticEquality() {
        assertTrue(simplifier.semanticallyEqual(add(x, y), add(y, x)));
        assertTrue(simplifier.semanticallyEqual(parse("x*2"), parse("x+x")));
        assertFalse(simplifier.semanticallyEqual(x, y));
    }

    @Test
    void collectOfNegatedNumberFolds() {
        Expr folded = simplifier.collect(negate(integer(3)));
        assertInstanceOf(Expr.Int.class, folded);
        assertEquals("-3", folded.toString());
    }
}
