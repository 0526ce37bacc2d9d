package com.workbook.calc.io;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a decoded workbook document tree: datasources, each
 * holding an ordered column list.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class WorkbookDefinition {
    private WorkbookInfo workbook;

    /** Root element of the document. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class WorkbookInfo {
        private String name;
        private List<DatasourceDef> datasources = new ArrayList<>();
    }

    /** A datasource and its columns. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class DatasourceDef {
        private String name, caption;
        private List<ColumnDef> columns = new ArrayList<>();
    }

    /**
     * A single column. A column with a non-blank {@code formula} is a
     * calculation; otherwise it is a source field, or a parameter when it sits in
     * the parameters datasource ({@code value} and {@code members} apply there).
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class ColumnDef {
        private String name, caption, datatype, role, formula, value;
        private boolean hidden;
        private List<String> members = new ArrayList<>();
    }

    /** Convenience factory used when building trees in code. */
    public static WorkbookDefinition of(String name, List<DatasourceDef> datasources) {
        WorkbookInfo info = new WorkbookInfo();
        info.setName(name);
        info.setDatasources(datasources);
        WorkbookDefinition def = new WorkbookDefinition();
        def.setWorkbook(info);
        return def;
    }

    public static DatasourceDef datasource(String name, List<ColumnDef> columns) {
        DatasourceDef ds = new DatasourceDef();
        ds.setName(name);
        ds.setColumns(columns);
        return ds;
    }

    public static ColumnDef column(String name, String caption, String formula) {
        ColumnDef col = new ColumnDef();
        col.setName(name);
        col.setCaption(caption);
        col.setFormula(formula);
        return col;
    }
}
