package com.workbook.calc.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.workbook.calc.engine.AnalysisOptions;
import com.workbook.calc.engine.DependencyGraph;
import com.workbook.calc.node.CalculationField;

/**
 * Renders dependency chains as an indented text tree, one tree per leaf
 * calculation (nothing uses it), deepest leaves first.
 *
 * <pre>
 * Profit Ratio [depth: 2] (leaf calculation)
 * ├── Margin [depth: 1]
 * │   └── Net [depth: 0]
 * │       └── [source: Sales, Cost]
 * └── [source: Region]
 * </pre>
 *
 * <p>
 * A node already on the current branch prints as {@code (circular ref)} and is
 * not expanded again. Source-field dependencies print as one trailing line
 * listing the first few names and a remainder count. With
 * {@code collapseSharedSubtrees} a node expanded anywhere earlier in the render
 * prints as {@code (see above)}, bounding output on graphs with wide fan-in.
 * Nodes at {@code maxTreeDepth} levels below the leaf are printed without their
 * dependencies and marked {@code (dependencies not shown)}.
 *
 * <p>
 * Presentation only: the graph is never modified.
 */
public final class DependencyTreeRenderer {
    static final String BRANCH = "├── ";
    static final String LAST = "└── ";
    static final String PIPE = "│   ";
    static final String SPACE = "    ";

    private final DependencyGraph graph;
    private final int maxRoots;
    private final int sourcePreview;
    private final boolean collapseShared;
    private final int maxDepth;

    public DependencyTreeRenderer(DependencyGraph graph) {
        this(graph, AnalysisOptions.defaults());
    }

    public DependencyTreeRenderer(DependencyGraph graph, AnalysisOptions options) {
        this.graph = graph;
        this.maxRoots = options.getMaxTreeRoots();
        this.sourcePreview = options.getTreeSourcePreview();
        this.collapseShared = options.isCollapseSharedSubtrees();
        this.maxDepth = options.getMaxTreeDepth();
    }

    public String render() {
        if (graph.isEmpty())
            return "No calculated fields found";
        List<CalculationField> leaves = new ArrayList<>(graph.leaves());
        if (leaves.isEmpty())
            return "No leaf calculations found (possible circular dependencies)";
        leaves.sort(Comparator.comparingInt(CalculationField::depth).reversed());

        List<String> lines = new ArrayList<>();
        Set<Integer> expanded = new HashSet<>();
        Branch branch = new Branch(graph.calculationCount());
        int count = Math.min(leaves.size(), maxRoots);
        for (int i = 0; i < count; i++) {
            CalculationField leaf = leaves.get(i);
            if (i > 0)
                lines.add("");
            lines.add(leaf.displayName() + depthLabel(leaf) + " (leaf calculation)");
            expanded.add(leaf.id());
            branch.truncate(0);
            branch.push(leaf.id());
            renderTree(leaf, branch, expanded, lines);
        }
        if (leaves.size() > count)
            lines.add("\n(+" + (leaves.size() - count) + " more leaf calculations)");
        return String.join("\n", lines);
    }

    /** A pending output line: either a calculation to render or a literal source line. */
    private record Task(int id, String indent, boolean last, int level, String text) {
        static Task node(int id, String indent, boolean last, int level) {
            return new Task(id, indent, last, level, null);
        }

        static Task line(String text) {
            return new Task(-1, null, false, 0, text);
        }
    }

    /** Calculations on the path from the current leaf down to the node being rendered. */
    private static final class Branch {
        private final boolean[] member;
        private final List<Integer> path = new ArrayList<>();

        Branch(int size) {
            this.member = new boolean[size];
        }

        void truncate(int size) {
            while (path.size() > size)
                member[path.remove(path.size() - 1)] = false;
        }

        void push(int id) {
            path.add(id);
            member[id] = true;
        }

        boolean contains(int id) {
            return member[id];
        }
    }

    /** Pre-order walk below {@code leaf} on an explicit work stack. */
    private void renderTree(CalculationField leaf, Branch branch, Set<Integer> expanded, List<String> lines) {
        Deque<Task> work = new ArrayDeque<>();
        pushChildren(leaf, "", 1, work);
        while (!work.isEmpty()) {
            Task task = work.pop();
            if (task.text() != null) {
                lines.add(task.text());
                continue;
            }
            branch.truncate(task.level());
            CalculationField node = graph.calculation(task.id());
            String prefix = task.indent() + (task.last() ? LAST : BRANCH);
            if (branch.contains(node.id())) {
                lines.add(prefix + node.displayName() + " (circular ref)");
                continue;
            }
            boolean hasChildren = !node.dependsOnCalcs().isEmpty() || !node.dependsOnSource().isEmpty();
            if (collapseShared && hasChildren && expanded.contains(node.id())) {
                lines.add(prefix + node.displayName() + depthLabel(node) + " (see above)");
                continue;
            }
            if (hasChildren && task.level() >= maxDepth) {
                lines.add(prefix + node.displayName() + depthLabel(node) + " (dependencies not shown)");
                continue;
            }
            lines.add(prefix + node.displayName() + depthLabel(node));
            expanded.add(node.id());
            branch.push(node.id());
            pushChildren(node, task.indent() + (task.last() ? SPACE : PIPE), task.level() + 1, work);
        }
    }

    /** Pushes children so that calculations pop in order, followed by the source line. */
    private void pushChildren(CalculationField node, String indent, int level, Deque<Task> work) {
        List<Integer> deps = new ArrayList<>(node.dependsOnCalcs());
        boolean hasSources = !node.dependsOnSource().isEmpty();
        if (hasSources)
            work.push(Task.line(indent + LAST + "[source: " + sourceLabel(node) + "]"));
        for (int i = deps.size() - 1; i >= 0; i--)
            work.push(Task.node(deps.get(i), indent, i == deps.size() - 1 && !hasSources, level));
    }

    private String sourceLabel(CalculationField node) {
        List<String> sources = new ArrayList<>(node.dependsOnSource());
        String shown = String.join(", ", sources.subList(0, Math.min(sourcePreview, sources.size())));
        int rest = sources.size() - sourcePreview;
        return rest > 0 ? shown + " (+" + rest + " more)" : shown;
    }

    private static String depthLabel(CalculationField node) {
        return node.depth() >= 0 ? " [depth: " + node.depth() + "]" : "";
    }
}
