package com.workbook.calc.node;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.workbook.calc.api.ReferenceKind;
import com.workbook.calc.api.Symbol;

/**
 * A calculated field: a column whose value is produced by a formula.
 *
 * <p>
 * Each calculation owns a stable integer id, its position in the graph's
 * calculation arena. Dependencies on other calculations are stored as ids and
 * resolved back to captions through the graph, so two calculations sharing a
 * caption never alias each other.
 *
 * <p>
 * Depth semantics:
 * <ul>
 * <li>{@code -1}: not yet resolved</li>
 * <li>{@code 0}: depends on no other calculation, or the node is circular
 * (sentinel, not a true depth)</li>
 * <li>{@code N}: one more than the deepest calculation it depends on</li>
 * </ul>
 *
 * Instances are mutable only while the owning graph is being built.
 */
public final class CalculationField implements Symbol {
    public static final int UNRESOLVED = -1;

    private final int id;
    private final String name;
    private final String caption;
    private final String formula;
    private final String datasource;
    private final boolean hidden;
    private final String datatype;
    private final String role;
    private final List<String> references;

    private final Set<Integer> dependsOnCalcs = new LinkedHashSet<>();
    private final Set<String> dependsOnSource = new LinkedHashSet<>();
    private final Set<String> dependsOnParams = new LinkedHashSet<>();
    private final Set<Integer> usedBy = new LinkedHashSet<>();

    private String displayName;
    private int depth = UNRESOLVED;
    private boolean circular;

    public CalculationField(int id, String name, String caption, String formula, String datasource,
            boolean hidden, String datatype, String role, List<String> references) {
        this.id = id;
        this.name = name;
        this.caption = caption;
        this.formula = formula;
        this.datasource = datasource;
        this.hidden = hidden;
        this.datatype = datatype;
        this.role = role;
        this.references = List.copyOf(references);
        this.displayName = caption;
    }

    public int id() {
        return id;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String caption() {
        return caption;
    }

    @Override
    public ReferenceKind kind() {
        return ReferenceKind.CALCULATION;
    }

    /**
     * Caption as shown in reports. Equals {@link #caption()} unless the caption
     * collides with another calculation and collisions are qualified.
     */
    public String displayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public String formula() {
        return formula;
    }

    public String datasource() {
        return datasource;
    }

    public boolean hidden() {
        return hidden;
    }

    public String datatype() {
        return datatype;
    }

    public String role() {
        return role;
    }

    /** Raw reference tokens in first-seen order, de-duplicated. */
    public List<String> references() {
        return references;
    }

    public Set<Integer> dependsOnCalcs() {
        return Collections.unmodifiableSet(dependsOnCalcs);
    }

    public Set<String> dependsOnSource() {
        return Collections.unmodifiableSet(dependsOnSource);
    }

    public Set<String> dependsOnParams() {
        return Collections.unmodifiableSet(dependsOnParams);
    }

    public Set<Integer> usedBy() {
        return Collections.unmodifiableSet(usedBy);
    }

    public void addCalcDependency(int calcId) {
        dependsOnCalcs.add(calcId);
    }

    public void addSourceDependency(String field) {
        dependsOnSource.add(field);
    }

    public void addParamDependency(String param) {
        dependsOnParams.add(param);
    }

    public void addUsedBy(int calcId) {
        usedBy.add(calcId);
    }

    public int depth() {
        return depth;
    }

    public void setDepth(int depth) {
        this.depth = depth;
    }

    public boolean isCircular() {
        return circular;
    }

    public void markCircular() {
        this.circular = true;
    }

    public boolean isRoot() {
        return dependsOnCalcs.isEmpty();
    }

    public boolean isLeaf() {
        return usedBy.isEmpty();
    }

    @Override
    public String toString() {
        return "CalculationField[" + id + ":" + displayName + ", depth=" + depth
                + (circular ? ", circular" : "") + "]";
    }
}
