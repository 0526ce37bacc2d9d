package com.workbook.calc.node;

import com.workbook.calc.api.ReferenceKind;
import com.workbook.calc.api.Symbol;

/**
 * A column without a formula, backed directly by the underlying data.
 */
public record SourceField(String name, String caption, String datasource, String datatype, String role)
        implements Symbol {

    @Override
    public ReferenceKind kind() {
        return ReferenceKind.SOURCE_FIELD;
    }
}
