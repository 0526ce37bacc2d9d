package com.workbook.calc;

import java.io.IOException;
import java.nio.file.Path;

import com.workbook.calc.engine.AnalysisOptions;
import com.workbook.calc.engine.DependencyGraph;
import com.workbook.calc.engine.FieldExtractor;
import com.workbook.calc.io.WorkbookDefinition;
import com.workbook.calc.io.WorkbookJsonLoader;
import com.workbook.calc.report.DependencyReport;
import com.workbook.calc.report.FieldCatalogReport;
import com.workbook.calc.report.ScopedAggregationReport;
import com.workbook.calc.util.DependencyTreeRenderer;
import com.workbook.calc.util.GraphExplain;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A high-level wrapper that analyzes one workbook's calculation graph.
 * <p>
 * This class handles:
 * <ul>
 * <li>Loading a decoded workbook tree from JSON</li>
 * <li>Extracting calculations, parameters and source fields</li>
 * <li>Resolving dependencies, depths and cycles via {@link DependencyGraph}</li>
 * <li>Producing the dependency, scoped-aggregation and field catalog
 * reports</li>
 * </ul>
 * Each instance owns a graph built for it alone; analyzing the same tree twice
 * yields structurally identical results, and separate instances can be used
 * from separate threads.
 */
public final class CalcGraph {
    private static final Logger log = LogManager.getLogger(CalcGraph.class);

    private final String workbookName;
    private final AnalysisOptions options;
    private final DependencyGraph graph;

    private CalcGraph(String workbookName, AnalysisOptions options, DependencyGraph graph) {
        this.workbookName = workbookName;
        this.options = options;
        this.graph = graph;
    }

    /** Analyzes a workbook tree with default options. */
    public static CalcGraph analyze(WorkbookDefinition def) {
        return analyze(def, AnalysisOptions.defaults());
    }

    public static CalcGraph analyze(WorkbookDefinition def, AnalysisOptions options) {
        if (def == null)
            throw new IllegalArgumentException("Workbook definition is null");
        String name = def.getWorkbook() != null && def.getWorkbook().getName() != null
                ? def.getWorkbook().getName()
                : "";
        DependencyGraph graph = new FieldExtractor(options).extract(def).build();
        log.info("Analyzed workbook '{}': {} calculations, max depth {}, {} cycle(s)",
                name, graph.calculationCount(), graph.maxDepth(), graph.cycleIds().size());
        return new CalcGraph(name, options, graph);
    }

    /**
     * Loads and analyzes a workbook JSON file.
     *
     * @throws IOException              if the file cannot be read
     * @throws IllegalArgumentException if the document is not a workbook tree
     */
    public static CalcGraph load(Path path, AnalysisOptions options) throws IOException {
        log.debug("Loading workbook from {}", path);
        return analyze(WorkbookJsonLoader.parseFile(path), options);
    }

    public String workbookName() {
        return workbookName;
    }

    public AnalysisOptions options() {
        return options;
    }

    public DependencyGraph graph() {
        return graph;
    }

    public DependencyReport dependencyReport() {
        return DependencyReport.from(workbookName, graph, options);
    }

    public ScopedAggregationReport scopedAggregationReport() {
        return ScopedAggregationReport.from(workbookName, graph, options);
    }

    public FieldCatalogReport fieldCatalog() {
        return FieldCatalogReport.from(workbookName, graph, options);
    }

    /** Indented dependency tree as one text block. */
    public String tree() {
        return new DependencyTreeRenderer(graph, options).render();
    }

    public String mermaid() {
        return new GraphExplain(graph).toMermaid();
    }
}
