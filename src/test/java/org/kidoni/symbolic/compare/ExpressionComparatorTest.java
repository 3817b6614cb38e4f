package org.kidoni.symbolic.compare;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.kidoni.symbolic.expr.Expr;
import org.kidoni.symbolic.parse.Parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExpressionComparatorTest {
    private final ExpressionComparator comparator = new ExpressionComparator();

    private static Expr parse(final String input) {
        return Parser.parse(input).orElseThrow();
    }

    private ComparisonResult compare(final String first, final String second) {
        return comparator.compare(parse(first), parse(second));
    }

    @Test
    void structurallyIdentical() {
        var result = compare("x+1", "x+1");
        assertTrue(result.equal());
        assertEquals("expressions are structurally identical", result.message());
    }

    @Test
    void semanticallyEquivalent() {
        var result = compare("x+y", "y+x");
        assertTrue(result.equal());
        assertEquals("expressions are semantically equivalent", result.message());
        assertTrue(result.details().containsKey("simplified1"));

        assertTrue(compare("2+3", "5").equal());
        assertTrue(compare("1/x", "x^-1").equal());
    }

    @Test
    void numericallyEquivalent() {
        var result = compare("(x+1)^2", "x^2+2*x+1");
        assertTrue(result.equal());
        assertEquals("expressions are numerically equivalent for all test points", result.message());
    }

    @Test
    void numericallyDifferent() {
        var result = compare("x^2", "x^3");
        assertFalse(result.equal());
        assertTrue(result.message().startsWith("expressions differ at test point"), result.message());
        assertTrue(result.details().containsKey("simplified2"));
    }

    @Test
    void differentVariables() {
        var result = compare("x+1", "y+1");
        assertFalse(result.equal());
        assertEquals("different variables: [x] vs [y]", result.message());
    }

    @Test
    void noEvaluablePoint() {
        var result = compare("sqrt(-1-x^2)", "ln(-1-x^2)");
        assertFalse(result.equal());
        assertEquals("no test point could be evaluated", result.message());
    }

    @Test
    void inequalitiesDividedThroughByPositiveContent() {
        var result = compare("x<2", "3*x<6");
        assertTrue(result.equal());
        assertEquals("inequalities are equivalent (divided through)", result.message());

        assertFalse(compare("x<2", "-3*x<-6").equal());
    }

    @Test
    void equations() {
        assertTrue(compare("x>=8", "8<=x").equal());
        assertEquals("equations are structurally identical", compare("y=2*x", "2*x=y").message());

        var divided = compare("x=2", "2*x=4");
        assertTrue(divided.equal());
        assertEquals("equations are equivalent (divided through)", divided.message());
        assertEquals("x-2", divided.details().get("divided2"));

        var scaled = compare("x=2", "0.5*x=1");
        assertTrue(scaled.equal());
        assertEquals("equations are equivalent (scaled)", scaled.message());

        assertTrue(compare("x+y=3", "y+x=3").equal());
        assertTrue(compare("x-2=0", "2-x=0").equal());
    }

    @Test
    void differentEquations() {
        var relations = compare("x=1", "x<1");
        assertFalse(relations.equal());
        assertTrue(relations.message().startsWith("different relations"));

        assertFalse(compare("x<8", "x>8").equal());
        assertFalse(compare("x=1", "x=2").equal());
        assertEquals("comparing an equation with a non-equation expression", compare("x=1", "x+1").message());
    }

    @Test
    void formCheck() {
        assertTrue(compare("2*(x+1)", "2*x+2").equal());

        var strict = new ExpressionComparator(CompareOptions.defaults().withCheckForm(true));
        var result = strict.compare(parse("2*(x+1)"), parse("2*x+2"));
        assertFalse(result.equal());
        assertEquals("expressions do not have the same form", result.message());

        assertTrue(strict.compare(parse("x*2+1"), parse("1+2*x")).equal());
    }

    @Test
    void simplifiedCheck() {
        var strict = new ExpressionComparator(CompareOptions.defaults().withCheckSimplified(true));
        var result = strict.compare(parse("2*x"), parse("x+x"));
        assertFalse(result.equal());
        assertEquals("second expression is not in simplified form", result.message());
        assertEquals("2*x", result.details().get("simplified_form"));

        assertTrue(strict.compare(parse("x+x"), parse("2*x")).equal());
    }

    @Test
    void requiredVariables() {
        var strict = new ExpressionComparator(CompareOptions.defaults().withRequireVariables(List.of("y")));
        var result = strict.compare(parse("x"), parse("x"));
        assertFalse(result.equal());
        assertEquals("missing required variable: y", result.message());
    }

    @Test
    void staticHelpers() {
        assertTrue(ExpressionComparator.structurallyEqual(parse("x+1"), parse("x + 1")));
        assertFalse(ExpressionComparator.structurallyEqual(parse("x+1"), parse("1+x")));
        assertTrue(ExpressionComparator.semanticallyEqual(parse("x+1"), parse("1+x")));
        assertTrue(ExpressionComparator.numericallyEqual(parse("x*(x+1)"), parse("x^2+x"), 1e-9));
        assertFalse(ExpressionComparator.numericallyEqual(parse("x"), parse("x+1"), 1e-9));
    }

    @Test
    void invalidOptions() {
        assertThrows(IllegalArgumentException.class, () -> CompareOptions.defaults().withIterations(0));
        assertThrows(IllegalArgumentException.class, () -> CompareOptions.defaults().withTolerance(-1));
    }
}
