package org.kidoni.symbolic.expr;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders expression trees as LaTeX math.
 */
public abstract class LatexRenderer {
    public static final Set<String> GREEK = Set.of(
            "alpha", "beta", "gamma", "delta", "epsilon", "zeta", "eta", "theta", "iota", "kappa",
            "lambda", "mu", "nu", "xi", "rho", "sigma", "tau", "upsilon", "phi", "chi", "psi", "omega",
            "Gamma", "Delta", "Theta", "Lambda", "Xi", "Pi", "Sigma", "Upsilon", "Phi", "Psi", "Omega");

    private static final Set<String> OPERATOR_NAMES = Set.of(
            "sin", "cos", "tan", "sec", "csc", "cot", "arcsin", "arccos", "arctan",
            "sinh", "cosh", "tanh", "ln", "log", "exp");

    public static String render(final Expr expr) {
        return switch (expr.kind()) {
            case INT -> expr.toString();
            case FLOAT -> expr.toString();
            case RATIONAL -> rational((Expr.Rational) expr);
            case VAR -> variable(((Expr.Var) expr).name());
            case CONST -> {
                String name = ((Expr.Const) expr).name();
                yield name.equals("pi") ? "\\pi" : variable(name);
            }
            case ADD -> sum((Expr.Add) expr);
            case MUL -> product((Expr.Mul) expr);
            case POW -> power((Expr.Pow) expr);
            case FUNC -> function((Expr.Func) expr);
            case EQ -> {
                Expr.Eq eq = (Expr.Eq) expr;
                yield render(eq.left()) + " " + eq.relation().latex() + " " + render(eq.right());
            }
        };
    }

    private static String rational(final Expr.Rational rational) {
        Expr.Rational r = Expr.Rational.of(rational.numerator(), rational.denominator());
        if (r.denominator().equals(BigInteger.ONE)) {
            return r.numerator().toString();
        }
        String sign = r.signum() < 0 ? "-" : "";
        return sign + "\\frac{" + r.numerator().abs() + "}{" + r.denominator() + "}";
    }

    private static String variable(final String name) {
        int underscore = name.indexOf('_');
        if (underscore > 0 && underscore < name.length() - 1) {
            String subscript = name.substring(underscore + 1);
            if (subscript.startsWith("{")) {
                return variable(name.substring(0, underscore)) + "_" + subscript;
            }
            return variable(name.substring(0, underscore)) + "_{" + subscript + "}";
        }
        return GREEK.contains(name) ? "\\" + name : name;
    }

    private static String sum(final Expr.Add add) {
        if (add.terms().isEmpty()) {
            return "0";
        }

        StringBuilder buffer = new StringBuilder(render(add.terms().get(0)));
        for (int i = 1; i < add.terms().size(); i++) {
            String term = render(add.terms().get(i));
            if (term.startsWith("-")) {
                buffer.append(" - ").append(term.substring(1));
            }
            else {
                buffer.append(" + ").append(term);
            }
        }
        return buffer.toString();
    }

    private static String product(final Expr.Mul mul) {
        if (mul.factors().isEmpty()) {
            return "1";
        }

        String sign = "";
        List<String> numerator = new ArrayList<>();
        List<String> denominator = new ArrayList<>();
        for (Expr factor : mul.factors()) {
            if (Numbers.isMinusOne(factor) && mul.factors().size() > 1) {
                sign = sign.isEmpty() ? "-" : "";
            }
            else if (factor instanceof Expr.Rational r && !r.isInteger()) {
                Expr.Rational reduced = Expr.Rational.of(r.numerator(), r.denominator());
                if (reduced.signum() < 0) {
                    sign = sign.isEmpty() ? "-" : "";
                }
                if (!reduced.numerator().abs().equals(BigInteger.ONE)) {
                    numerator.add(reduced.numerator().abs().toString());
                }
                denominator.add(reduced.denominator().toString());
            }
            else if (factor instanceof Expr.Pow pow && pow.exponent() instanceof Expr.Int e && e.signum() < 0) {
                Expr reciprocal = e.value().equals(BigInteger.ONE.negate())
                        ? pow.base()
                        : new Expr.Pow(pow.base(), new Expr.Int(e.value().negate()));
                denominator.add(factorText(reciprocal));
            }
            else {
                numerator.add(factorText(factor));
            }
        }

        String top = numerator.isEmpty() ? "1" : String.join(" \\cdot ", numerator);
        if (denominator.isEmpty()) {
            return sign + top;
        }
        return sign + "\\frac{" + top + "}{" + String.join(" \\cdot ", denominator) + "}";
    }

    private static String factorText(final Expr factor) {
        String text = render(factor);
        return factor.kind() == Kind.ADD ? "\\left(" + text + "\\right)" : text;
    }

    private static String power(final Expr.Pow pow) {
        if (pow.exponent() instanceof Expr.Rational r && r.numerator().equals(BigInteger.ONE) && r.denominator().signum() > 0) {
            String radicand = render(pow.base());
            if (r.denominator().equals(BigInteger.TWO)) {
                return "\\sqrt{" + radicand + "}";
            }
            return "\\sqrt[" + r.denominator() + "]{" + radicand + "}";
        }

        String base = render(pow.base());
        boolean wrap = switch (pow.base().kind()) {
            case ADD, MUL, POW, RATIONAL, EQ, FUNC -> true;
            case INT, FLOAT -> ((Expr.Numeric) pow.base()).signum() < 0;
            default -> false;
        };
        if (wrap) {
            base = "\\left(" + base + "\\right)";
        }
        return base + "^{" + render(pow.exponent()) + "}";
    }

    private static String function(final Expr.Func func) {
        String name = ElementaryFunction.lookup(func.name())
                .map(ElementaryFunction::primaryName)
                .orElse(func.name());
        String args = func.args().stream()
                .map(LatexRenderer::render)
                .collect(Collectors.joining(", "));

        if (name.equals("sqrt") && func.args().size() == 1) {
            return "\\sqrt{" + args + "}";
        }
        if (name.equals("abs") && func.args().size() == 1) {
            return "\\left|" + args + "\\right|";
        }
        if (name.equals("log") && func.args().size() == 2) {
            return "\\log_{" + render(func.args().get(1)) + "}(" + render(func.args().get(0)) + ")";
        }
        if (name.equals("ln") || name.equals("log")) {
            return "\\" + name + "{" + args + "}";
        }
        if (OPERATOR_NAMES.contains(name)) {
            return "\\" + name + "(" + args + ")";
        }
        return "\\mathrm{" + name + "}(" + args + ")";
    }
}
