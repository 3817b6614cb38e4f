package org.kidoni.symbolic.expr;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The fixed table of functions the evaluator knows. Aliases such as {@code asin} and
 * {@code arcsin} map to the same entry.
 */
public enum ElementaryFunction {
    SQRT("sqrt") {
        @Override
        BigDecimal apply(final String name, final List<BigDecimal> args) {
            BigDecimal x = args.get(0);
            if (x.signum() < 0) {
                throw new DomainException(name, x, "square root of a negative number");
            }
            return x.sqrt(Numbers.CONTEXT);
        }
    },
    ABS("abs") {
        @Override
        BigDecimal apply(final String name, final List<BigDecimal> args) {
            return args.get(0).abs();
        }
    },
    EXP("exp") {
        @Override
        BigDecimal apply(final String name, final List<BigDecimal> args) {
            return real(name, args.get(0), Math.exp(args.get(0).doubleValue()));
        }
    },
    LN("ln") {
        @Override
        BigDecimal apply(final String name, final List<BigDecimal> args) {
            BigDecimal x = positive(name, args.get(0));
            if (x.compareTo(BigDecimal.ONE) == 0) {
                return BigDecimal.ZERO;
            }
            if (x.compareTo(Expr.Const.E.value()) == 0) {
                return BigDecimal.ONE;
            }
            return real(name, x, Math.log(x.doubleValue()));
        }
    },
    LOG("log") {
        @Override
        int minArity() {
            return 1;
        }

        @Override
        int maxArity() {
            return 2;
        }

        @Override
        BigDecimal apply(final String name, final List<BigDecimal> args) {
            BigDecimal x = positive(name, args.get(0));
            if (args.size() == 2) {
                BigDecimal base = positive(name, args.get(1));
                if (base.compareTo(BigDecimal.ONE) == 0) {
                    throw new DomainException(name, base, "logarithm base must not be 1");
                }
                if (x.compareTo(base) == 0) {
                    return BigDecimal.ONE;
                }
                return real(name, x, Math.log(x.doubleValue()) / Math.log(base.doubleValue()));
            }
            if (x.compareTo(BigDecimal.ONE) == 0) {
                return BigDecimal.ZERO;
            }
            if (x.compareTo(BigDecimal.TEN) == 0) {
                return BigDecimal.ONE;
            }
            return real(name, x, Math.log10(x.doubleValue()));
        }
    },
    SIN("sin") {
        @Override
        BigDecimal apply(final String name, final List<BigDecimal> args) {
            return real(name, args.get(0), Math.sin(args.get(0).doubleValue()));
        }
    },
    COS("cos") {
        @Override
        BigDecimal apply(final String name, final List<BigDecimal> args) {
            return real(name, args.get(0), Math.cos(args.get(0).doubleValue()));
        }
    },
    TAN("tan") {
        @Override
        BigDecimal apply(final String name, final List<BigDecimal> args) {
            double x = args.get(0).doubleValue();
            return reciprocal(name, args.get(0), Math.cos(x), Math.sin(x));
        }
    },
    SEC("sec") {
        @Override
        BigDecimal apply(final String name, final List<BigDecimal> args) {
            return reciprocal(name, args.get(0), Math.cos(args.get(0).doubleValue()), 1.0);
        }
    },
    CSC("csc") {
        @Override
        BigDecimal apply(final String name, final List<BigDecimal> args) {
            return reciprocal(name, args.get(0), Math.sin(args.get(0).doubleValue()), 1.0);
        }
    },
    COT("cot") {
        @Override
        BigDecimal apply(final String name, final List<BigDecimal> args) {
            double x = args.get(0).doubleValue();
            return reciprocal(name, args.get(0), Math.sin(x), Math.cos(x));
        }
    },
    ARCSIN("arcsin", "asin") {
        @Override
        BigDecimal apply(final String name, final List<BigDecimal> args) {
            return real(name, args.get(0), Math.asin(unitInterval(name, args.get(0))));
        }
    },
    ARCCOS("arccos", "acos") {
        @Override
        BigDecimal apply(final String name, final List<BigDecimal> args) {
            return real(name, args.get(0), Math.acos(unitInterval(name, args.get(0))));
        }
    },
    ARCTAN("arctan", "atan") {
        @Override
        BigDecimal apply(final String name, final List<BigDecimal> args) {
            return real(name, args.get(0), Math.atan(args.get(0).doubleValue()));
        }
    },
    SINH("sinh") {
        @Override
        BigDecimal apply(final String name, final List<BigDecimal> args) {
            return real(name, args.get(0), Math.sinh(args.get(0).doubleValue()));
        }
    },
    COSH("cosh") {
        @Override
        BigDecimal apply(final String name, final List<BigDecimal> args) {
            return real(name, args.get(0), Math.cosh(args.get(0).doubleValue()));
        }
    },
    TANH("tanh") {
        @Override
        BigDecimal apply(final String name, final List<BigDecimal> args) {
            return real(name, args.get(0), Math.tanh(args.get(0).doubleValue()));
        }
    };

    private static final double POLE_EPSILON = 1e-15;

    private static final Map<String, ElementaryFunction> BY_NAME = new HashMap<>();

    static {
        for (ElementaryFunction function : values()) {
            for (String name : function.names) {
                BY_NAME.put(name, function);
            }
        }
    }

    private final String[] names;

    ElementaryFunction(final String... names) {
        this.names = names;
    }

    public static Optional<ElementaryFunction> lookup(final String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }

    public static boolean isKnown(final String name) {
        return BY_NAME.containsKey(name);
    }

    public List<String> names() {
        return List.of(names);
    }

    /**
     * The primary name, e.g. {@code arcsin} for both {@code arcsin} and {@code asin}.
     */
    public String primaryName() {
        return names[0];
    }

    int minArity() {
        return 1;
    }

    int maxArity() {
        return 1;
    }

    /**
     * Applies the function to already evaluated arguments.
     *
     * @param name the name the function was called by, used in error messages
     */
    public BigDecimal evaluate(final String name, final List<BigDecimal> args) {
        if (args.size() < minArity() || args.size() > maxArity()) {
            String expected = minArity() == maxArity()
                    ? String.valueOf(minArity())
                    : minArity() + " or " + maxArity();
            throw new ArityException(name, expected, args.size());
        }
        return apply(name, args);
    }

    abstract BigDecimal apply(String name, List<BigDecimal> args);

    private static BigDecimal real(final String name, final BigDecimal argument, final double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new DomainException(name, argument, "result is not a finite real number");
        }
        return BigDecimal.valueOf(value);
    }

    private static BigDecimal positive(final String name, final BigDecimal x) {
        if (x.signum() <= 0) {
            throw new DomainException(name, x, "logarithm of a non-positive number");
        }
        return x;
    }

    private static double unitInterval(final String name, final BigDecimal x) {
        if (x.abs().compareTo(BigDecimal.ONE) > 0) {
            throw new DomainException(name, x, "argument must be within [-1, 1]");
        }
        return x.doubleValue();
    }

    private static BigDecimal reciprocal(final String name, final BigDecimal argument, final double denominator, final double numerator) {
        if (Math.abs(denominator) < POLE_EPSILON) {
            throw new DomainException(name, argument, "pole");
        }
        return real(name, argument, numerator / denominator);
    }
}
