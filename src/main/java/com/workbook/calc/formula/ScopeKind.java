package com.workbook.calc.formula;

import java.util.Locale;

/**
 * The three scoped-aggregation (level of detail) keywords.
 */
public enum ScopeKind {
    /** Fix the computation at the listed dimensions, or the whole table if none. */
    FIXED,
    /** Add dimensions to the view's grouping; computes at a finer granularity. */
    INCLUDE,
    /** Remove dimensions from the view's grouping; computes at a coarser granularity. */
    EXCLUDE;

    /** Case-insensitive keyword lookup; null when {@code word} is not a scope keyword. */
    public static ScopeKind fromKeyword(String word) {
        if (word == null)
            return null;
        return switch (word.toUpperCase(Locale.ROOT)) {
            case "FIXED" -> FIXED;
            case "INCLUDE" -> INCLUDE;
            case "EXCLUDE" -> EXCLUDE;
            default -> null;
        };
    }

    /** True for the keyword that ignores the view's grouping and scopes to its own dimensions. */
    public boolean isTableWide() {
        return this == FIXED;
    }
}
