package org.kidoni.symbolic.expr;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Numeric evaluation of expression trees under a set of variable bindings.
 */
public abstract class Evaluator {
    private static final Logger log = LoggerFactory.getLogger(Evaluator.class);

    private static final BigDecimal MAX_EXACT_POWER = BigDecimal.valueOf(100_000);

    public static BigDecimal evaluate(final Expr expr, final Map<String, BigDecimal> bindings) {
        return switch (expr.kind()) {
            case INT, FLOAT, RATIONAL -> ((Expr.Numeric) expr).decimalValue();
            case CONST -> ((Expr.Const) expr).value();
            case VAR -> {
                String name = ((Expr.Var) expr).name();
                BigDecimal value = bindings.get(name);
                if (value == null) {
                    throw new UndefinedVariableException(name);
                }
                yield value;
            }
            case ADD -> {
                BigDecimal sum = BigDecimal.ZERO;
                for (Expr term : ((Expr.Add) expr).terms()) {
                    sum = sum.add(evaluate(term, bindings), Numbers.CONTEXT);
                }
                yield sum;
            }
            case MUL -> {
                BigDecimal product = BigDecimal.ONE;
                for (Expr factor : ((Expr.Mul) expr).factors()) {
                    product = product.multiply(evaluate(factor, bindings), Numbers.CONTEXT);
                }
                yield product;
            }
            case POW -> power((Expr.Pow) expr, bindings);
            case FUNC -> {
                Expr.Func func = (Expr.Func) expr;
                ElementaryFunction function = ElementaryFunction.lookup(func.name())
                        .orElseThrow(() -> new UnknownFunctionException(func.name()));
                List<BigDecimal> args = new ArrayList<>(func.args().size());
                for (Expr arg : func.args()) {
                    args.add(evaluate(arg, bindings));
                }
                yield function.evaluate(func.name(), args);
            }
            case EQ -> {
                Expr.Eq eq = (Expr.Eq) expr;
                int comparison = evaluate(eq.left(), bindings).compareTo(evaluate(eq.right(), bindings));
                yield eq.relation().holds(comparison) ? BigDecimal.ONE : BigDecimal.ZERO;
            }
        };
    }

    private static BigDecimal power(final Expr.Pow pow, final Map<String, BigDecimal> bindings) {
        BigDecimal base = evaluate(pow.base(), bindings);
        BigDecimal exponent = evaluate(pow.exponent(), bindings);

        if (isIntegral(exponent)) {
            if (base.signum() == 0 && exponent.signum() < 0) {
                throw new DomainException("pow", base, "zero raised to a negative power");
            }
            if (exponent.abs().compareTo(MAX_EXACT_POWER) <= 0) {
                return base.pow(exponent.intValueExact(), Numbers.CONTEXT);
            }
            log.debug("exponent {} too large for exact evaluation, using double arithmetic", exponent);
            return finite(base, Math.pow(base.doubleValue(), exponent.doubleValue()));
        }

        if (base.signum() > 0) {
            return finite(base, Math.pow(base.doubleValue(), exponent.doubleValue()));
        }
        if (base.signum() == 0) {
            if (exponent.signum() > 0) {
                return BigDecimal.ZERO;
            }
            throw new DomainException("pow", base, "zero raised to a non-positive power");
        }

        // negative base: only real odd roots are defined, e.g. (-8)^(1/3) = -2
        Optional<Expr.Numeric> exact = Numbers.exactRational(pow.exponent());
        if (exact.isPresent() && exact.get() instanceof Expr.Rational rational) {
            BigInteger denominator = rational.denominator();
            if (denominator.testBit(0)) {
                double magnitude = Math.pow(base.abs().doubleValue(), rational.decimalValue().doubleValue());
                BigDecimal root = finite(base, magnitude);
                return rational.numerator().testBit(0) ? root.negate() : root;
            }
        }
        throw new DomainException("pow", base,
                "negative base " + base.toPlainString() + " with non-integer exponent " + exponent.toPlainString());
    }

    private static boolean isIntegral(final BigDecimal value) {
        return value.signum() == 0 || value.stripTrailingZeros().scale() <= 0;
    }

    private static BigDecimal finite(final BigDecimal argument, final double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new DomainException("pow", argument, "result is not a finite real number");
        }
        return BigDecimal.valueOf(value);
    }
}
