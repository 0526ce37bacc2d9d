package com.workbook.calc.util;

import org.junit.Test;

import com.workbook.calc.engine.AnalysisOptions;
import com.workbook.calc.engine.DependencyGraph;

import static org.junit.Assert.*;

public class DependencyTreeRendererTest {

    private static DependencyGraph sharedBase() {
        return DependencyGraph.builder()
                .addCalculation("Top", "[L] + [R]")
                .addCalculation("L", "[Base]")
                .addCalculation("R", "[Base]")
                .addCalculation("Base", "[x] + [y]")
                .build();
    }

    @Test
    public void testChain() {
        DependencyGraph g = DependencyGraph.builder()
                .addCalculation("Alpha", "[Beta] + 1")
                .addCalculation("Beta", "[Gamma] * 2")
                .addCalculation("Gamma", "SUM([Sales])")
                .build();
        String expected = String.join("\n",
                "Alpha [depth: 2] (leaf calculation)",
                "└── Beta [depth: 1]",
                "    └── Gamma [depth: 0]",
                "        └── [source: Sales]");
        assertEquals(expected, new DependencyTreeRenderer(g).render());
    }

    @Test
    public void testSiblingsAndSources() {
        DependencyGraph g = DependencyGraph.builder()
                .addCalculation("Ratio", "[Margin] / [Region]")
                .addCalculation("Margin", "[Sales] - [Cost]")
                .build();
        String expected = String.join("\n",
                "Ratio [depth: 1] (leaf calculation)",
                "├── Margin [depth: 0]",
                "│   └── [source: Sales, Cost]",
                "└── [source: Region]");
        assertEquals(expected, new DependencyTreeRenderer(g).render());
    }

    @Test
    public void testSourceTruncation() {
        DependencyGraph g = DependencyGraph.builder()
                .addCalculation("Wide", "[a] + [b] + [c] + [d] + [e]")
                .build();
        assertEquals("Wide [depth: 0] (leaf calculation)\n└── [source: a, b, c (+2 more)]",
                new DependencyTreeRenderer(g).render());
    }

    @Test
    public void testSharedSubtreeExpandedPerBranch() {
        String tree = new DependencyTreeRenderer(sharedBase()).render();
        assertEquals(2, tree.split("Base \\[depth: 0\\]", -1).length - 1);
        assertFalse(tree.contains("(see above)"));
    }

    @Test
    public void testCollapseSharedSubtrees() {
        AnalysisOptions options = new AnalysisOptions();
        options.setCollapseSharedSubtrees(true);
        String expected = String.join("\n",
                "Top [depth: 2] (leaf calculation)",
                "├── L [depth: 1]",
                "│   └── Base [depth: 0]",
                "│       └── [source: x, y]",
                "└── R [depth: 1]",
                "    └── Base [depth: 0] (see above)");
        assertEquals(expected, new DependencyTreeRenderer(sharedBase(), options).render());
    }

    @Test
    public void testCircularReference() {
        DependencyGraph g = DependencyGraph.builder()
                .addCalculation("X", "[A]")
                .addCalculation("A", "[B]")
                .addCalculation("B", "[A]")
                .build();
        String expected = String.join("\n",
                "X [depth: 1] (leaf calculation)",
                "└── A [depth: 0]",
                "    └── B [depth: 0]",
                "        └── A (circular ref)");
        assertEquals(expected, new DependencyTreeRenderer(g).render());
    }

    @Test
    public void testLeavesOrderedByDepthAndCapped() {
        AnalysisOptions options = new AnalysisOptions();
        options.setMaxTreeRoots(1);
        DependencyGraph g = DependencyGraph.builder()
                .addCalculation("Shallow", "[x]")
                .addCalculation("Deep", "[Mid]")
                .addCalculation("Mid", "[y]")
                .build();
        String tree = new DependencyTreeRenderer(g, options).render();
        assertTrue(tree.startsWith("Deep [depth: 1] (leaf calculation)"));
        assertFalse(tree.contains("Shallow"));
        assertTrue(tree.endsWith("\n\n(+1 more leaf calculations)"));

        String both = new DependencyTreeRenderer(g).render();
        assertTrue(both.contains("[source: y]\n\nShallow [depth: 0] (leaf calculation)"));
    }

    @Test
    public void testEmptyAndAllCircular() {
        assertEquals("No calculated fields found", new DependencyTreeRenderer(DependencyGraph.builder().build())
                .render());
        DependencyGraph loop = DependencyGraph.builder()
                .addCalculation("Alpha", "[Beta]")
                .addCalculation("Beta", "[Alpha]")
                .build();
        assertEquals("No leaf calculations found (possible circular dependencies)",
                new DependencyTreeRenderer(loop).render());
    }

    private static DependencyGraph chainOf(int length) {
        DependencyGraph.Builder builder = DependencyGraph.builder();
        for (int i = 0; i < length; i++)
            builder.addCalculation("C" + i, i + 1 < length ? "[C" + (i + 1) + "]" : "[Sales]");
        return builder.build();
    }

    @Test
    public void testLongChainIsCutAtMaxTreeDepth() {
        String[] lines = new DependencyTreeRenderer(chainOf(20_000)).render().split("\n");
        assertEquals(101, lines.length);
        assertEquals("C0 [depth: 19999] (leaf calculation)", lines[0]);
        assertTrue(lines[1].startsWith("└── C1 [depth: 19998]"));
        assertTrue(lines[100].endsWith("└── C100 [depth: 19899] (dependencies not shown)"));
    }

    @Test
    public void testLongChainFullyExpanded() {
        AnalysisOptions options = new AnalysisOptions();
        options.setMaxTreeDepth(Integer.MAX_VALUE);
        String[] lines = new DependencyTreeRenderer(chainOf(3_000), options).render().split("\n");
        // Header, 2999 calculations, one source line
        assertEquals(3_001, lines.length);
        assertTrue(lines[2_999].endsWith("└── C2999 [depth: 0]"));
        assertTrue(lines[3_000].endsWith("└── [source: Sales]"));
    }

    @Test
    public void testDepthCapOfOne() {
        AnalysisOptions options = new AnalysisOptions();
        options.setMaxTreeDepth(1);
        DependencyGraph g = DependencyGraph.builder()
                .addCalculation("Alpha", "[Beta] + 1")
                .addCalculation("Beta", "[Gamma] * 2")
                .addCalculation("Gamma", "SUM([Sales])")
                .build();
        assertEquals("Alpha [depth: 2] (leaf calculation)\n└── Beta [depth: 1] (dependencies not shown)",
                new DependencyTreeRenderer(g, options).render());
    }
}
