package com.workbook.calc.report;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.workbook.calc.engine.AnalysisOptions;
import com.workbook.calc.engine.DependencyGraph;
import com.workbook.calc.node.CalculationField;
import com.workbook.calc.node.Parameter;
import com.workbook.calc.node.SourceField;

/**
 * Inventory of a workbook's calculated fields, parameters and source fields.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FieldCatalogReport(
        String workbook,
        Summary summary,
        List<ParameterEntry> parameters,
        List<CalculatedFieldEntry> calculatedFields,
        List<SourceFieldEntry> sourceFields) {

    public record Summary(int calculatedFieldCount, int parameterCount, int sourceFieldCount,
            int hiddenFieldCount) {
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record ParameterEntry(String caption, String datatype, String currentValue, List<String> allowedValues) {
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record CalculatedFieldEntry(String caption, String formula, String datatype, String role,
            Boolean hidden, String datasource, List<String> dependencies) {
    }

    public record SourceFieldEntry(String caption, String datatype, String role, String datasource) {
    }

    public static FieldCatalogReport from(String workbook, DependencyGraph graph, AnalysisOptions options) {
        List<ParameterEntry> params = new ArrayList<>();
        for (Parameter p : graph.parameters())
            params.add(new ParameterEntry(p.caption(), p.datatype(), p.currentValue(), p.allowedValues()));

        List<CalculatedFieldEntry> calcs = new ArrayList<>();
        int hiddenCount = 0;
        for (CalculationField c : graph.calculations()) {
            if (c.hidden()) {
                hiddenCount++;
                if (!options.isIncludeHidden())
                    continue;
            }
            calcs.add(new CalculatedFieldEntry(c.displayName(), c.formula(), c.datatype(), c.role(),
                    c.hidden() ? Boolean.TRUE : null, c.datasource(), c.references()));
        }

        List<SourceFieldEntry> sources = new ArrayList<>();
        for (SourceField s : graph.sourceFields()) {
            if (sources.size() >= options.getMaxSourceFieldsInCatalog())
                break;
            sources.add(new SourceFieldEntry(s.caption(), s.datatype(), s.role(), s.datasource()));
        }

        return new FieldCatalogReport(workbook,
                new Summary(calcs.size(), params.size(), graph.sourceFields().size(), hiddenCount),
                params, calcs, sources);
    }
}
