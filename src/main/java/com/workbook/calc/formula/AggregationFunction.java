package com.workbook.calc.formula;

import java.util.Locale;

/**
 * Aggregation functions recognised at the start of a scoped-aggregation body.
 */
public enum AggregationFunction {
    SUM, AVG, COUNT, COUNTD, MIN, MAX, MEDIAN, ATTR, STDEV, STDEVP, VAR, VARP;

    /** Case-insensitive lookup; null for anything outside the vocabulary. */
    public static AggregationFunction lookup(String word) {
        if (word == null || word.isEmpty())
            return null;
        try {
            return valueOf(word.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public boolean isExtremum() {
        return this == MIN || this == MAX;
    }
}
