package com.workbook.calc.formula;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A decomposed qualified reference of shape
 * {@code [Datasource].[prefix:FieldName:suffix]}.
 *
 * <p>
 * Tokens that don't match the qualified shape parse as a bare field name with
 * null datasource, prefix and suffix. A qualified token whose field part isn't
 * three colon-separated parts keeps the whole field part as the name.
 */
public record FieldReference(String datasource, String prefix, String fieldName, String suffix) {
    private static final Pattern QUALIFIED = Pattern.compile("^\\[?([^\\]]+)\\]?\\.\\[?([^\\]]+)\\]?$");

    public static FieldReference parse(String reference) {
        String cleaned = strip(reference == null ? "" : reference);
        Matcher m = QUALIFIED.matcher(cleaned);
        if (m.matches()) {
            String datasource = m.group(1);
            String fieldPart = m.group(2);
            String[] parts = fieldPart.split(":", -1);
            if (parts.length == 3)
                return new FieldReference(datasource, emptyToNull(parts[0]), parts[1], emptyToNull(parts[2]));
            return new FieldReference(datasource, null, fieldPart, null);
        }
        return new FieldReference(null, null, cleaned, null);
    }

    public boolean isQualified() {
        return datasource != null;
    }

    private static String strip(String s) {
        int start = s.startsWith("[") ? 1 : 0;
        int end = s.endsWith("]") && s.length() > start ? s.length() - 1 : s.length();
        return s.substring(start, end);
    }

    private static String emptyToNull(String s) {
        return s.isEmpty() ? null : s;
    }
}
