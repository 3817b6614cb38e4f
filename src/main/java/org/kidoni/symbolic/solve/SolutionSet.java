package org.kidoni.symbolic.solve;

import java.util.List;

/**
 * The roots found, with a human readable account of how they were found or why there are
 * none. An identity has solutions but lists none of them.
 */
public record SolutionSet(List<Solution> solutions, String message, boolean hasSolutions) {
    public SolutionSet {
        solutions = List.copyOf(solutions);
    }

    static SolutionSet of(final String message, final List<Solution> solutions) {
        return new SolutionSet(solutions, message, !solutions.isEmpty());
    }

    static SolutionSet none(final String message) {
        return new SolutionSet(List.of(), message, false);
    }

    static SolutionSet identity(final String variable) {
        return new SolutionSet(List.of(), "identity: true for all values of " + variable, true);
    }

    public boolean isIdentity() {
        return hasSolutions && solutions.isEmpty();
    }
}
