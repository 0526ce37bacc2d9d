package com.workbook.calc.util;

import com.workbook.calc.engine.DependencyGraph;
import com.workbook.calc.node.CalculationField;

/**
 * Diagnostic utility for inspecting the calculation graph.
 *
 * <p>
 * Generates human-readable string representations of single nodes, of the
 * whole graph, and a Mermaid diagram suitable for embedding in Markdown.
 */
public final class GraphExplain {
    private final DependencyGraph graph;

    public GraphExplain(DependencyGraph graph) {
        this.graph = graph;
    }

    /**
     * Dumps detailed state of a single calculation.
     */
    public String explainNode(String captionOrName) {
        CalculationField node = graph.calculation(captionOrName);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Calculation: ").append(node.displayName()).append('\n')
                .append("  Id: ").append(node.id()).append('\n')
                .append("  Internal name: ").append(node.name()).append('\n')
                .append("  Datasource: ").append(node.datasource()).append('\n')
                .append("  Formula: ").append(node.formula()).append('\n')
                .append("  Depth: ").append(node.depth()).append('\n')
                .append("  Root: ").append(node.isRoot())
                .append(", Leaf: ").append(node.isLeaf())
                .append(", Circular: ").append(node.isCircular()).append('\n');
        appendList(sb, "Depends on calculations", graph.dependsOnCalcNames(node));
        appendList(sb, "Depends on parameters", node.dependsOnParams());
        appendList(sb, "Depends on source fields", node.dependsOnSource());
        appendList(sb, "Used by", graph.usedByNames(node));
        return sb.toString();
    }

    /**
     * Dumps every calculation with its dependencies, one per line.
     */
    public String dumpGraph() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph (").append(graph.calculationCount()).append(" calculations):\n");
        for (CalculationField node : graph.calculations()) {
            sb.append("  [").append(node.id()).append("] ").append(node.displayName())
                    .append(" (depth ").append(node.depth()).append(')');
            if (node.isCircular())
                sb.append(" (CIRCULAR)");
            if (!node.dependsOnCalcs().isEmpty())
                sb.append(" -> ").append(String.join(", ", graph.dependsOnCalcNames(node)));
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS graph diagram.
     * <p>
     * Edges point from a dependency to the calculation that uses it. Circular
     * calculations get the {@code circular} class.
     * </p>
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");

        // 1. Declare nodes
        for (CalculationField node : graph.calculations()) {
            sb.append("  ").append(nodeId(node)).append("[\"").append(escape(node.displayName()))
                    .append("<br/>depth ").append(node.depth()).append("\"];\n");
        }

        // 2. Declare all edges afterwards
        for (CalculationField node : graph.calculations()) {
            for (int dep : node.dependsOnCalcs()) {
                sb.append("  ").append(nodeId(graph.calculation(dep))).append(" --> ").append(nodeId(node))
                        .append(";\n");
            }
        }

        // 3. Style cycles
        boolean anyCircular = false;
        for (CalculationField node : graph.calculations()) {
            if (node.isCircular()) {
                sb.append("  class ").append(nodeId(node)).append(" circular;\n");
                anyCircular = true;
            }
        }
        if (anyCircular)
            sb.append("  classDef circular fill:#fdd,stroke:#c00;\n");
        return sb.toString();
    }

    private static void appendList(StringBuilder sb, String label, Iterable<String> items) {
        sb.append("  ").append(label).append(": ").append(String.join(", ", items)).append('\n');
    }

    private static String nodeId(CalculationField node) {
        return "c" + node.id() + "_" + sanitize(node.caption());
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }

    private static String escape(String text) {
        return text.replace("\"", "#quot;");
    }
}
