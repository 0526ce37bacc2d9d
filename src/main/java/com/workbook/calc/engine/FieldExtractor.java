package com.workbook.calc.engine;

import java.util.List;

import com.workbook.calc.formula.FormulaText;
import com.workbook.calc.io.WorkbookDefinition;
import com.workbook.calc.io.WorkbookDefinition.ColumnDef;
import com.workbook.calc.io.WorkbookDefinition.DatasourceDef;
import com.workbook.calc.node.Parameter;
import com.workbook.calc.node.SourceField;

import lombok.extern.log4j.Log4j2;

/**
 * Walks the datasource tree and sorts columns into calculations, parameters
 * and source fields.
 *
 * <p>
 * Columns of the reserved parameters datasource become parameters. Elsewhere a
 * column with a non-blank formula is a calculation and anything else a source
 * field. Missing collections are treated as empty and columns with neither name
 * nor caption are skipped.
 */
@Log4j2
public final class FieldExtractor {
    private static final String UNKNOWN = "unknown";

    private final AnalysisOptions options;

    public FieldExtractor(AnalysisOptions options) {
        this.options = options;
    }

    public FieldExtractor() {
        this(AnalysisOptions.defaults());
    }

    /** Returns a builder populated from {@code def}; call {@code build()} to resolve it. */
    public DependencyGraph.Builder extract(WorkbookDefinition def) {
        if (def == null)
            throw new IllegalArgumentException("Workbook definition is null");
        DependencyGraph.Builder builder = DependencyGraph.builder(options);
        WorkbookDefinition.WorkbookInfo info = def.getWorkbook();
        if (info == null || info.getDatasources() == null)
            return builder;

        for (DatasourceDef ds : info.getDatasources()) {
            if (ds == null)
                continue;
            String dsName = firstNonBlank(ds.getName(), ds.getCaption(), "");
            List<ColumnDef> columns = ds.getColumns() == null ? List.of() : ds.getColumns();
            if (options.getParametersDatasourceName().equals(dsName))
                extractParameters(columns, builder);
            else
                extractColumns(dsName, columns, builder);
        }
        log.debug("Extracted {} calculations, {} parameters, {} source fields",
                builder.calculationCount(), builder.parameterCount(), builder.sourceFieldCount());
        return builder;
    }

    private void extractParameters(List<ColumnDef> columns, DependencyGraph.Builder builder) {
        for (ColumnDef col : columns) {
            if (col == null)
                continue;
            String name = stripBrackets(col.getName());
            String caption = firstNonBlank(col.getCaption(), name, "");
            if (caption.isEmpty())
                continue;
            builder.addParameter(new Parameter(name, caption, firstNonBlank(col.getDatatype(), UNKNOWN, UNKNOWN),
                    FormulaText.decodeEntities(firstNonBlank(col.getValue(), "", "")),
                    allowedValues(col.getMembers())));
        }
    }

    private void extractColumns(String dsName, List<ColumnDef> columns, DependencyGraph.Builder builder) {
        for (ColumnDef col : columns) {
            if (col == null)
                continue;
            String name = stripBrackets(col.getName());
            String caption = firstNonBlank(col.getCaption(), name, "");
            if (caption.isEmpty())
                continue;
            String datatype = firstNonBlank(col.getDatatype(), UNKNOWN, UNKNOWN);
            String role = firstNonBlank(col.getRole(), UNKNOWN, UNKNOWN);
            String formula = col.getFormula();
            if (formula != null && !formula.isBlank()) {
                builder.addCalculation(name.isEmpty() ? caption : name, caption,
                        FormulaText.decodeEntities(formula), dsName, col.isHidden(), datatype, role);
            } else {
                builder.addSourceField(new SourceField(name.isEmpty() ? caption : name, caption, dsName,
                        datatype, role));
            }
        }
    }

    private static List<String> allowedValues(List<String> members) {
        if (members == null)
            return List.of();
        return members.stream()
                .filter(m -> m != null && !m.isEmpty())
                .map(FormulaText::decodeEntities)
                .distinct()
                .toList();
    }

    static String stripBrackets(String name) {
        return name == null ? "" : name.replace("[", "").replace("]", "");
    }

    private static String firstNonBlank(String a, String b, String fallback) {
        if (a != null && !a.isBlank())
            return a;
        if (b != null && !b.isBlank())
            return b;
        return fallback;
    }
}
