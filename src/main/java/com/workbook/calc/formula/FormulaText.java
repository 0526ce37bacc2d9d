package com.workbook.calc.formula;

/**
 * Text helpers for formulas as stored in workbook documents.
 */
public final class FormulaText {
    private FormulaText() {
        // Utility class
    }

    /** Decodes the XML character entities workbook documents leave in formulas. */
    public static String decodeEntities(String text) {
        if (text == null || text.indexOf('&') < 0)
            return text;
        return text
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&apos;", "'")
                .replace("&quot;", "\"")
                .replace("&#10;", "\n")
                .replace("&#13;", "\r")
                .replace("&amp;", "&");
    }

    /** First {@code max} characters followed by {@code ...} when truncated. */
    public static String preview(String text, int max) {
        if (text == null)
            return "";
        return text.length() > max ? text.substring(0, max) + "..." : text;
    }
}
