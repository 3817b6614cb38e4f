package org.kidoni.symbolic.compare;

import java.util.List;

/**
 * @param checkForm        equivalent expressions must also normalize to the same tree
 * @param checkSimplified  the second expression must already be fully simplified
 * @param tolerance        numeric tolerance, relative for magnitudes of at least 1
 * @param requireVariables variables the first expression must mention
 * @param iterations       number of random sample points
 * @param seed             seed for the sample points; a fixed seed makes results repeatable
 */
public record CompareOptions(boolean checkForm, boolean checkSimplified, double tolerance,
                             List<String> requireVariables, int iterations, long seed) {
    public static final double DEFAULT_TOLERANCE = 1e-9;
    public static final int DEFAULT_ITERATIONS = 12;
    public static final long DEFAULT_SEED = 42L;

    public CompareOptions {
        requireVariables = requireVariables == null ? List.of() : List.copyOf(requireVariables);
        if (tolerance < 0) {
            throw new IllegalArgumentException("tolerance must be >= 0: " + tolerance);
        }
        if (iterations <= 0) {
            throw new IllegalArgumentException("iterations must be > 0: " + iterations);
        }
    }

    public static CompareOptions defaults() {
        return new CompareOptions(false, false, DEFAULT_TOLERANCE, List.of(), DEFAULT_ITERATIONS, DEFAULT_SEED);
    }

    public CompareOptions withCheckForm(final boolean checkForm) {
        return new CompareOptions(checkForm, checkSimplified, tolerance, requireVariables, iterations, seed);
    }

    public CompareOptions withCheckSimplified(final boolean checkSimplified) {
        return new CompareOptions(checkForm, checkSimplified, tolerance, requireVariables, iterations, seed);
    }

    public CompareOptions withTolerance(final double tolerance) {
        return new CompareOptions(checkForm, checkSimplified, tolerance, requireVariables, iterations, seed);
    }

    public CompareOptions withRequireVariables(final List<String> requireVariables) {
        return new CompareOptions(checkForm, checkSimplified, tolerance, requireVariables, iterations, seed);
    }

    public CompareOptions withIterations(final int iterations) {
        return new CompareOptions(checkForm, checkSimplified, tolerance, requireVariables, iterations, seed);
    }

    public CompareOptions withSeed(final long seed) {
        return new CompareOptions(checkForm, checkSimplified, tolerance, requireVariables, iterations, seed);
    }
}
