package com.workbook.calc.engine;

import java.util.List;

import com.workbook.calc.node.CalculationField;

/**
 * Classifies each raw reference of each calculation and records forward edges.
 *
 * Every reference lands in exactly one of the parameter, calculation or source
 * field sets of its node; unmatched references default to source fields.
 */
public final class DependencyResolver {
    private final SymbolTable symbols;

    public DependencyResolver(SymbolTable symbols) {
        this.symbols = symbols;
    }

    public void resolve(List<CalculationField> calculations) {
        for (CalculationField calc : calculations)
            resolve(calc);
    }

    void resolve(CalculationField calc) {
        for (String ref : calc.references()) {
            switch (symbols.classify(ref)) {
                case PARAMETER -> calc.addParamDependency(ref);
                case CALCULATION -> calc.addCalcDependency(symbols.calculationId(ref));
                case SOURCE_FIELD -> calc.addSourceDependency(ref);
            }
        }
    }
}
