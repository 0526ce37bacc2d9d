package com.workbook.calc.report;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.workbook.calc.engine.AnalysisOptions;
import com.workbook.calc.engine.DependencyGraph;
import com.workbook.calc.engine.DuplicateCaption;
import com.workbook.calc.formula.FormulaText;
import com.workbook.calc.node.CalculationField;
import com.workbook.calc.util.DependencyTreeRenderer;

/**
 * Dependency analysis of one workbook: summary, depth levels, per-calculation
 * detail, cycles and the rendered tree.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DependencyReport(
        String workbook,
        String message,
        Summary summary,
        Map<String, List<LevelEntry>> depthLevels,
        List<CalculationEntry> calculations,
        List<CycleEntry> circularDependencies,
        List<DuplicateCaption> duplicateCaptions,
        String dependencyTree) {

    public static final String NO_CALCULATIONS = "No calculated fields found in this workbook";

    /** Counts; root, leaf and intermediate counts exclude circular calculations. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Summary(int totalCalculations, Integer maxDependencyDepth, Integer rootCalculations,
            Integer leafCalculations, Integer intermediateCalculations, Integer circularDependencies,
            int parameterCount, Integer sourceFieldCount) {
    }

    public record LevelEntry(String caption, String formula, List<String> usedBy) {
    }

    public record DependsOn(List<String> calculations, List<String> sourceFields, List<String> parameters) {
    }

    public record CalculationEntry(String name, String caption, String formula, String datasource, int depth,
            DependsOn dependsOn, List<String> usedBy, boolean root, boolean leaf, boolean circular) {
    }

    public record CycleEntry(List<String> cycle, String explanation) {
    }

    public static DependencyReport from(String workbook, DependencyGraph graph, AnalysisOptions options) {
        if (graph.isEmpty()) {
            return new DependencyReport(workbook, NO_CALCULATIONS,
                    new Summary(0, null, null, null, null, null, graph.parameters().size(),
                            graph.sourceFieldNames().size()),
                    null, null, null, null, null);
        }

        List<CalculationEntry> entries = new ArrayList<>(graph.calculationCount());
        for (CalculationField calc : graph.calculations())
            entries.add(entry(graph, calc, options));
        entries.sort(Comparator.comparingInt(CalculationEntry::depth));
        if (entries.size() > options.getMaxCalculationsInReport())
            entries = new ArrayList<>(entries.subList(0, options.getMaxCalculationsInReport()));

        Map<String, List<LevelEntry>> levels = new LinkedHashMap<>();
        graph.depthLevels().forEach((key, calcs) -> {
            List<LevelEntry> level = new ArrayList<>(calcs.size());
            for (CalculationField calc : calcs)
                level.add(new LevelEntry(calc.displayName(),
                        FormulaText.preview(calc.formula(), options.getFormulaPreviewLength()),
                        head(graph.usedByNames(calc), options.getUsedByPreview())));
            levels.put(key, level);
        });

        List<CycleEntry> cycles = new ArrayList<>();
        for (List<String> cycle : graph.cycles())
            cycles.add(new CycleEntry(cycle, "Circular dependency detected: " + String.join(" -> ", cycle)));

        Summary summary = new Summary(graph.calculationCount(), graph.maxDepth(), graph.roots().size(),
                graph.leaves().size(), graph.intermediates().size(), cycles.size(), graph.parameters().size(),
                null);

        return new DependencyReport(workbook, null, summary, levels, entries,
                cycles.isEmpty() ? null : cycles,
                graph.duplicateCaptions().isEmpty() ? null : graph.duplicateCaptions(),
                new DependencyTreeRenderer(graph, options).render());
    }

    private static CalculationEntry entry(DependencyGraph graph, CalculationField calc, AnalysisOptions options) {
        List<String> sources = new ArrayList<>(calc.dependsOnSource());
        if (!options.isIncludeSourceFields())
            sources = head(sources, options.getSourceFieldPreview());
        return new CalculationEntry(calc.name(), calc.displayName(), calc.formula(), calc.datasource(),
                calc.depth(),
                new DependsOn(graph.dependsOnCalcNames(calc), sources, new ArrayList<>(calc.dependsOnParams())),
                graph.usedByNames(calc), calc.isRoot(), calc.isLeaf(), calc.isCircular());
    }

    static List<String> head(List<String> list, int max) {
        return list.size() > max ? new ArrayList<>(list.subList(0, max)) : list;
    }
}
