package com.workbook.calc.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;

/**
 * Tunables for one analysis run. Defaults reproduce the stock report limits;
 * options can be read from JSON, where missing keys keep these defaults.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AnalysisOptions {

    /** How a bare caption or name reference resolves when several calculations share it. */
    public enum DuplicateCaptionPolicy {
        /** The first calculation declared wins. */
        KEEP_FIRST,
        /** The last calculation declared wins. */
        KEEP_LAST,
        /** First wins for resolution; colliding captions display as {@code Caption (datasource)}. */
        QUALIFY
    }

    /** Reserved name of the datasource that holds parameters. */
    private String parametersDatasourceName = "Parameters";
    private DuplicateCaptionPolicy duplicateCaptionPolicy = DuplicateCaptionPolicy.KEEP_FIRST;

    // Field catalog
    private boolean includeHidden = true;
    private int maxSourceFieldsInCatalog = 50;

    // Dependency report
    private boolean includeSourceFields = false;
    private int sourceFieldPreview = 5;
    private int maxCalculationsInReport = 50;
    private int formulaPreviewLength = 100;
    private int usedByPreview = 5;

    // Scoped-aggregation report
    private boolean includeUsageContext = true;

    // Tree rendering
    private int maxTreeRoots = 10;
    private int treeSourcePreview = 3;
    /** Levels below a leaf rendered before a branch is cut off. */
    private int maxTreeDepth = 100;
    private boolean collapseSharedSubtrees = false;

    public static AnalysisOptions defaults() {
        return new AnalysisOptions();
    }
}
