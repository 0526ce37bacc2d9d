package com.workbook.calc.formula;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Extracts bracket-delimited references from formula text.
 *
 * <p>
 * Scans left to right for {@code [ ... ]} pairs. Nesting is not balanced: the
 * first {@code ]} after an opening {@code [} closes the token, so
 * {@code [a[b]} yields {@code a[b}. An unterminated {@code [} ends the scan.
 * The literal {@code Parameters} is only ever a qualifying prefix and is never
 * returned.
 */
public final class ReferenceTokenizer {
    public static final String PARAMETERS_PREFIX = "Parameters";

    private ReferenceTokenizer() {
        // Utility class
    }

    /**
     * Returns the distinct reference tokens of {@code formula} in first-seen
     * order. Never null; empty for null or bracket-free input.
     */
    public static List<String> extract(String formula) {
        if (formula == null || formula.isEmpty())
            return List.of();
        Set<String> refs = new LinkedHashSet<>();
        int pos = 0;
        int len = formula.length();
        while (pos < len) {
            int open = formula.indexOf('[', pos);
            if (open < 0)
                break;
            int close = formula.indexOf(']', open + 1);
            if (close < 0)
                break;
            String ref = formula.substring(open + 1, close);
            if (!ref.isEmpty() && !PARAMETERS_PREFIX.equals(ref))
                refs.add(ref);
            pos = close + 1;
        }
        return new ArrayList<>(refs);
    }
}
