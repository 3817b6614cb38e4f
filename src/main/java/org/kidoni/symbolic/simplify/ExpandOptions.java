package org.kidoni.symbolic.simplify;

/**
 * Controls {@link Expander}.
 *
 * @param maxDegree  largest integer power of a sum that is multiplied out
 * @param expandLogs rewrite {@code ln(a*b)} and {@code ln(a^b)}, and the same for {@code log}
 * @param expandTrig rewrite {@code tan}, {@code sec}, {@code csc} and {@code cot} in terms of
 *                   {@code sin} and {@code cos}
 */
public record ExpandOptions(int maxDegree, boolean expandLogs, boolean expandTrig) {
    public static final int DEFAULT_MAX_DEGREE = 10;

    public ExpandOptions {
        if (maxDegree < 0) {
            throw new IllegalArgumentException("maxDegree must be >= 0: " + maxDegree);
        }
    }

    public static ExpandOptions defaults() {
        return new ExpandOptions(DEFAULT_MAX_DEGREE, false, false);
    }

    public ExpandOptions withMaxDegree(final int maxDegree) {
        return new ExpandOptions(maxDegree, expandLogs, expandTrig);
    }

    public ExpandOptions withExpandLogs(final boolean expandLogs) {
        return new ExpandOptions(maxDegree, expandLogs, expandTrig);
    }

    public ExpandOptions withExpandTrig(final boolean expandTrig) {
        return new ExpandOptions(maxDegree, expandLogs, expandTrig);
    }
}
