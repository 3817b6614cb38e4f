package org.kidoni.symbolic.solve;

/**
 * @param variable         the unknown to solve for
 * @param allowComplex     accepted for completeness; complex roots are never produced
 * @param allowApproximate allow decimal roots when the coefficients are not exact
 * @param maxDegree        polynomials of higher degree are rejected up front
 */
public record SolveOptions(String variable, boolean allowComplex, boolean allowApproximate, int maxDegree) {
    public SolveOptions {
        if (variable == null || variable.isBlank()) {
            throw new IllegalArgumentException("variable must not be blank");
        }
        if (maxDegree < 0) {
            throw new IllegalArgumentException("maxDegree must be >= 0: " + maxDegree);
        }
    }

    public static SolveOptions defaults() {
        return new SolveOptions("x", false, true, 4);
    }

    public SolveOptions withVariable(final String variable) {
        return new SolveOptions(variable, allowComplex, allowApproximate, maxDegree);
    }

    public SolveOptions withAllowComplex(final boolean allowComplex) {
        return new SolveOptions(variable, allowComplex, allowApproximate, maxDegree);
    }

    public SolveOptions withAllowApproximate(final boolean allowApproximate) {
        return new SolveOptions(variable, allowComplex, allowApproximate, maxDegree);
    }

    public SolveOptions withMaxDegree(final int maxDegree) {
        return new SolveOptions(variable, allowComplex, allowApproximate, maxDegree);
    }
}
