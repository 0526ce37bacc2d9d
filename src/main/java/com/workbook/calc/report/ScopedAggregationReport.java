package com.workbook.calc.report;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.workbook.calc.engine.AnalysisOptions;
import com.workbook.calc.engine.DependencyGraph;
import com.workbook.calc.formula.ScopeKind;
import com.workbook.calc.formula.ScopedAggregationExplainer;
import com.workbook.calc.formula.ScopedAggregationExplainer.Explanation;
import com.workbook.calc.formula.ScopedAggregationExpression;
import com.workbook.calc.formula.ScopedAggregationParser;
import com.workbook.calc.formula.ScopedAggregationPattern;
import com.workbook.calc.node.CalculationField;

/**
 * Every scoped-aggregation block of a workbook with explanations, usage context
 * and pattern groupings.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScopedAggregationReport(
        String workbook,
        String message,
        Summary summary,
        List<Entry> expressions,
        Map<String, List<String>> patterns,
        LearningGuide learningResources) {

    public static final String NO_EXPRESSIONS = "No LOD expressions found in this workbook";

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Summary(int totalExpressions, Map<String, Integer> byType, Integer nestedCount,
            Integer tableScopedCount, Integer hiddenCount, int totalCalculations) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Entry(String name, String caption, String fullFormula, String datasource, boolean hidden,
            ScopedAggregationExpression details, String pattern, Explanation explanation,
            UsageContext usageContext) {
    }

    public record UsageContext(List<String> usedInCalculations, boolean hidden) {
    }

    public record LearningGuide(String introduction, Map<String, String> typeSummary, List<String> tips) {
    }

    public static final LearningGuide GUIDE = new LearningGuide(
            "LOD (Level of Detail) expressions let you compute aggregations at a different granularity than the"
                    + " visualization. They're powerful for calculations that need to ignore, add, or remove"
                    + " dimensions from the view's level of detail.",
            Map.of(
                    "fixed", "FIXED computes at a specific level regardless of the view. Use FIXED when you need"
                            + " values that stay constant (e.g., customer's first purchase date). FIXED with no"
                            + " dimensions computes at the table level (grand total).",
                    "include", "INCLUDE adds dimensions to the view's level of detail, computing at a MORE"
                            + " detailed level. Use INCLUDE when you need to aggregate pre-computed detailed"
                            + " values (e.g., average of daily totals when viewing by month).",
                    "exclude", "EXCLUDE removes dimensions from the view's level of detail, computing at a LESS"
                            + " detailed level. Use EXCLUDE for subtotals or when you want to ignore certain"
                            + " dimensions (e.g., category total while viewing by sub-category)."),
            List.of(
                    "FIXED LODs are computed before dimension filters (except context filters)",
                    "INCLUDE and EXCLUDE LODs are computed after dimension filters",
                    "Table-scoped FIXED { : SUM([Sales]) } is great for percent-of-total calculations",
                    "Nested LODs are possible but can impact performance - use sparingly",
                    "Use FIXED [Customer] : MIN([Order Date]) to find each customer's first purchase"));

    public static ScopedAggregationReport from(String workbook, DependencyGraph graph, AnalysisOptions options) {
        List<Entry> entries = new ArrayList<>();
        Map<String, List<String>> patterns = new LinkedHashMap<>();
        for (ScopedAggregationPattern p : ScopedAggregationPattern.values())
            patterns.put(p.reportKey(), new ArrayList<>());

        for (CalculationField calc : graph.calculations()) {
            for (ScopedAggregationExpression expr : ScopedAggregationParser.parse(calc.displayName(),
                    calc.formula())) {
                ScopedAggregationPattern pattern = ScopedAggregationPattern.classify(expr);
                patterns.get(pattern.reportKey()).add(calc.displayName());
                UsageContext usage = options.isIncludeUsageContext()
                        ? new UsageContext(usersOf(graph, calc), calc.hidden())
                        : null;
                entries.add(new Entry(calc.name(), calc.displayName(), calc.formula(), calc.datasource(),
                        calc.hidden(), expr, pattern.reportKey(), ScopedAggregationExplainer.explain(expr), usage));
            }
        }

        if (entries.isEmpty()) {
            return new ScopedAggregationReport(workbook, NO_EXPRESSIONS,
                    new Summary(0, null, null, null, null, graph.calculationCount()), null, null, GUIDE);
        }

        Map<String, Integer> byType = new LinkedHashMap<>();
        for (ScopeKind kind : ScopeKind.values())
            byType.put(kind.name().toLowerCase(Locale.ROOT), 0);
        int nested = 0, tableScoped = 0, hidden = 0;
        for (Entry e : entries) {
            byType.merge(e.details().kind().name().toLowerCase(Locale.ROOT), 1, Integer::sum);
            if (e.details().hasNestedScope())
                nested++;
            if (e.details().isTableScoped())
                tableScoped++;
            if (e.hidden())
                hidden++;
        }
        patterns.values().removeIf(List::isEmpty);

        return new ScopedAggregationReport(workbook, null,
                new Summary(entries.size(), byType, nested, tableScoped, hidden, graph.calculationCount()),
                entries, patterns, GUIDE);
    }

    private static List<String> usersOf(DependencyGraph graph, CalculationField calc) {
        List<String> users = new ArrayList<>();
        for (int id : calc.usedBy())
            if (id != calc.id())
                users.add(graph.calculation(id).displayName());
        return users;
    }
}
