package com.workbook.calc.api;

/**
 * Classification of a bracketed reference found in a formula.
 *
 * Every reference resolves to exactly one kind. A reference that matches neither
 * a parameter nor a calculation is a {@link #SOURCE_FIELD}.
 */
public enum ReferenceKind {
    PARAMETER,
    CALCULATION,
    SOURCE_FIELD
}
