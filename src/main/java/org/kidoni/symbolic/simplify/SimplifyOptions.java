package org.kidoni.symbolic.simplify;

/**
 * Controls the {@link Simplifier#simplify(org.kidoni.symbolic.expr.Expr) simplify} driver.
 *
 * @param singlePass            run a single collect/factor round only
 * @param keepNegativeFactoring leave a sum whose coefficients are all negative as is, instead
 *                              of factoring out the negative sign
 * @param maxIterations         upper bound on driver rounds
 */
public record SimplifyOptions(boolean singlePass, boolean keepNegativeFactoring, int maxIterations) {
    public static final int DEFAULT_MAX_ITERATIONS = 10;

    public SimplifyOptions {
        if (maxIterations < 0) {
            throw new IllegalArgumentException("maxIterations must be >= 0: " + maxIterations);
        }
    }

    public static SimplifyOptions defaults() {
        return new SimplifyOptions(false, false, DEFAULT_MAX_ITERATIONS);
    }

    public SimplifyOptions withSinglePass(final boolean singlePass) {
        return new SimplifyOptions(singlePass, keepNegativeFactoring, maxIterations);
    }

    public SimplifyOptions withKeepNegativeFactoring(final boolean keepNegativeFactoring) {
        return new SimplifyOptions(singlePass, keepNegativeFactoring, maxIterations);
    }

    public SimplifyOptions withMaxIterations(final int maxIterations) {
        return new SimplifyOptions(singlePass, keepNegativeFactoring, maxIterations);
    }
}
