package com.workbook.calc.node;

import java.util.List;

import com.workbook.calc.api.ReferenceKind;
import com.workbook.calc.api.Symbol;

/**
 * A named parameter declared in the workbook's reserved parameters datasource.
 *
 * @param name          internal name, brackets stripped
 * @param caption       display caption
 * @param datatype      declared datatype, {@code unknown} when absent
 * @param currentValue  current value, entity-decoded
 * @param allowedValues allowed values; empty means unconstrained
 */
public record Parameter(String name, String caption, String datatype, String currentValue,
        List<String> allowedValues) implements Symbol {

    public Parameter {
        allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
    }

    @Override
    public ReferenceKind kind() {
        return ReferenceKind.PARAMETER;
    }

    public boolean isConstrained() {
        return !allowedValues.isEmpty();
    }
}
