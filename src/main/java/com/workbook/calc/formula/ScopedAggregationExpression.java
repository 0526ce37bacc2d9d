package com.workbook.calc.formula;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One parsed scoped-aggregation block, e.g. {@code {FIXED [Customer] : MIN([Order Date])}}.
 *
 * @param owner             caption of the calculation whose formula holds the block
 * @param kind              scope keyword
 * @param dimensions        dimension field names in order; empty means the whole table
 * @param aggregation       leading aggregation function, or null when the body
 *                          does not start with one
 * @param expression        the aggregated body text, trimmed
 * @param hasNestedScope    whether the body contains another scope block
 * @param nestedExpressions blocks parsed out of the body
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ScopedAggregationExpression(
        String owner,
        ScopeKind kind,
        List<String> dimensions,
        AggregationFunction aggregation,
        String expression,
        boolean hasNestedScope,
        List<ScopedAggregationExpression> nestedExpressions) {

    public ScopedAggregationExpression {
        dimensions = List.copyOf(dimensions);
        nestedExpressions = nestedExpressions == null ? List.of() : List.copyOf(nestedExpressions);
    }

    /** Table-wide scope with no dimensions: one value for the whole result set. */
    @JsonIgnore
    public boolean isTableScoped() {
        return kind.isTableWide() && dimensions.isEmpty();
    }
}
