package org.kidoni.symbolic.compare;

import java.util.Map;

public record ComparisonResult(boolean equal, String message, Map<String, Object> details) {
    public ComparisonResult {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    static ComparisonResult equivalent(final String message) {
        return new ComparisonResult(true, message, Map.of());
    }

    static ComparisonResult equivalent(final String message, final Map<String, Object> details) {
        return new ComparisonResult(true, message, details);
    }

    static ComparisonResult different(final String message) {
        return new ComparisonResult(false, message, Map.of());
    }

    static ComparisonResult different(final String message, final Map<String, Object> details) {
        return new ComparisonResult(false, message, details);
    }
}
