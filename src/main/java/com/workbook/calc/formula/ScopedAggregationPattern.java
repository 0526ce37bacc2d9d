package com.workbook.calc.formula;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Usage categories a scoped-aggregation expression is bucketed into.
 *
 * <p>
 * Classification is a heuristic over surface tokens: dimension names are
 * matched against small entity and temporal vocabularies, case-insensitively
 * and as substrings. False positives and negatives are expected.
 */
public enum ScopedAggregationPattern {
    /** Table-wide scope with no dimensions, typically a percent-of-total denominator. */
    TABLE_TOTAL("percentOfTotal"),
    /** Table-wide MIN/MAX per customer-like entity, typically first/last event per entity. */
    ENTITY_COHORT("customerCohort"),
    /** Table-wide SUM per time dimension. */
    CUMULATIVE_TOTAL("runningTotal"),
    OTHER("other");

    static final Pattern ENTITY_WORDS = Pattern.compile("customer|user|client|account|member",
            Pattern.CASE_INSENSITIVE);
    static final Pattern TEMPORAL_WORDS = Pattern.compile("date|month|year|quarter|week|day",
            Pattern.CASE_INSENSITIVE);

    private final String reportKey;

    ScopedAggregationPattern(String reportKey) {
        this.reportKey = reportKey;
    }

    /** Key under which this category is grouped in reports. */
    public String reportKey() {
        return reportKey;
    }

    public static ScopedAggregationPattern classify(ScopedAggregationExpression expr) {
        return classify(expr.kind(), expr.dimensions(), expr.aggregation());
    }

    public static ScopedAggregationPattern classify(ScopeKind kind, List<String> dimensions,
            AggregationFunction aggregation) {
        if (!kind.isTableWide())
            return OTHER;
        if (dimensions.isEmpty())
            return TABLE_TOTAL;
        if (aggregation != null && aggregation.isExtremum() && anyMatches(dimensions, ENTITY_WORDS))
            return ENTITY_COHORT;
        if (aggregation == AggregationFunction.SUM && anyMatches(dimensions, TEMPORAL_WORDS))
            return CUMULATIVE_TOTAL;
        return OTHER;
    }

    static boolean anyMatches(List<String> dimensions, Pattern words) {
        for (String d : dimensions)
            if (words.matcher(d).find())
                return true;
        return false;
    }
}
