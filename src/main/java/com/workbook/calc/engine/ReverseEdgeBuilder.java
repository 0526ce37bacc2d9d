package com.workbook.calc.engine;

import java.util.List;

import com.workbook.calc.node.CalculationField;

/**
 * Derives "used by" edges: for every {@code A dependsOn B}, adds A to B's users.
 */
public final class ReverseEdgeBuilder {
    private ReverseEdgeBuilder() {
        // Utility class
    }

    public static void apply(List<CalculationField> arena) {
        for (CalculationField calc : arena)
            for (int dep : calc.dependsOnCalcs())
                arena.get(dep).addUsedBy(calc.id());
    }
}
