package com.workbook.calc.api;

/**
 * A named field of a workbook that formulas can reference.
 *
 * Calculations, parameters and source fields all share this contract. The
 * internal name is what the workbook stores (brackets stripped); the caption is
 * what a user sees and defaults to the name.
 */
public interface Symbol {

    /** Internal symbol name, without surrounding brackets. */
    String name();

    /** Display caption. Never null; falls back to {@link #name()}. */
    String caption();

    /** The reference kind a formula token resolves to when it names this symbol. */
    ReferenceKind kind();
}
