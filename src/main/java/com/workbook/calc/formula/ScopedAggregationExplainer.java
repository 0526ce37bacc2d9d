package com.workbook.calc.formula;

/**
 * Builds plain-language explanations of scoped-aggregation expressions.
 */
public final class ScopedAggregationExplainer {
    private static final int EXPRESSION_PREVIEW = 50;

    private ScopedAggregationExplainer() {
        // Utility class
    }

    /** Short summary, longer description and typical use case of one expression. */
    public record Explanation(String brief, String detailed, String useCase) {
    }

    public static Explanation explain(ScopedAggregationExpression expr) {
        String dimList = expr.dimensions().isEmpty() ? "no dimensions" : String.join(", ", expr.dimensions());
        String aggExpr = expr.aggregation() != null
                ? expr.aggregation().name() + "(...)"
                : FormulaText.preview(expr.expression(), EXPRESSION_PREVIEW);

        return switch (expr.kind()) {
            case FIXED -> explainFixed(expr, dimList, aggExpr);
            case INCLUDE -> new Explanation(
                    "Include " + dimList + " in calculation",
                    "This calculates the expression INCLUDING " + dimList
                            + " in addition to whatever dimensions are in the view. It adds granularity,"
                            + " computing at a more detailed level than the visualization.",
                    "Getting detailed values before aggregating up (e.g., average of daily totals)");
            case EXCLUDE -> new Explanation(
                    "Exclude " + dimList + " from calculation",
                    "This calculates the expression EXCLUDING " + dimList
                            + " from the view's level of detail. It removes granularity,"
                            + " computing at a higher level than the visualization shows.",
                    "Subtotals, group-level averages, removing a dimension's effect");
        };
    }

    private static Explanation explainFixed(ScopedAggregationExpression expr, String dimList, String aggExpr) {
        if (expr.dimensions().isEmpty()) {
            return new Explanation(
                    "Table-level calculation: " + aggExpr,
                    "This calculates the expression at the entire table level, ignoring ALL dimensions in the view."
                            + " The result is the same for every row, making it useful for grand totals"
                            + " or percent-of-total calculations.",
                    "Percent of total, grand totals, table-level benchmarks");
        }
        if (ScopedAggregationPattern.anyMatches(expr.dimensions(), ScopedAggregationPattern.ENTITY_WORDS)) {
            String agg = expr.aggregation() != null ? expr.aggregation().name() : "calculation";
            return new Explanation(
                    "Customer-level " + agg + " by " + dimList,
                    "This calculates the expression at the " + dimList
                            + " level, regardless of what other dimensions are shown in the view."
                            + " Perfect for customer metrics that shouldn't change when drilling down.",
                    "Customer lifetime value, first purchase date, customer cohort analysis");
        }
        return new Explanation(
                "Fixed calculation at " + dimList + " level",
                "This calculates the expression fixed at the level of " + dimList
                        + ". The result stays constant for each unique combination of " + dimList
                        + ", ignoring other dimensions in the view.",
                "Calculations that need to stay at a specific granularity");
    }
}
