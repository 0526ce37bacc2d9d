package com.workbook.calc.formula;

import java.util.ArrayList;
import java.util.List;

/**
 * Hand-written scanner for scoped-aggregation blocks of shape
 * {@code { KIND dimension-list : aggregated-expression }}.
 *
 * <p>
 * The scanner tracks brace depth so arbitrarily nested blocks are captured
 * whole; the captured body is then parsed again for nested blocks. Bracketed
 * field names, string literals and {@code //} line comments are skipped, so
 * braces or colons inside them never confuse the scan.
 *
 * <p>
 * Malformed input never fails: an unterminated block runs to the end of the
 * formula, a brace group that doesn't start with a scope keyword is scanned
 * for blocks inside it, and a block without a {@code :} is ignored.
 */
public final class ScopedAggregationParser {

    private ScopedAggregationParser() {
        // Utility class
    }

    /** Parses top-level blocks of a formula with no owning calculation. */
    public static List<ScopedAggregationExpression> parse(String formula) {
        return parse(null, formula);
    }

    /**
     * Parses every top-level block of {@code formula}, attaching blocks found in
     * each body as nested expressions.
     */
    public static List<ScopedAggregationExpression> parse(String owner, String formula) {
        if (formula == null || formula.indexOf('{') < 0)
            return List.of();
        return new Scanner(owner, formula).blocks();
    }

    /** True when {@code text} holds at least one brace followed by a scope keyword. */
    public static boolean containsScopeMarker(String text) {
        if (text == null)
            return false;
        int from = 0;
        while (true) {
            int brace = text.indexOf('{', from);
            if (brace < 0)
                return false;
            int p = skipWhitespace(text, brace + 1, text.length());
            int end = identifierEnd(text, p, text.length());
            if (ScopeKind.fromKeyword(text.substring(p, end)) != null)
                return true;
            from = brace + 1;
        }
    }

    private static final class Scanner {
        private final String owner;
        private final String input;
        private final int len;

        Scanner(String owner, String input) {
            this.owner = owner;
            this.input = input;
            this.len = input.length();
        }

        List<ScopedAggregationExpression> blocks() {
            List<ScopedAggregationExpression> out = new ArrayList<>();
            int pos = 0;
            while (pos < len) {
                char c = input.charAt(pos);
                if (c == '{') {
                    int close = matchingBrace(pos);
                    int bodyEnd = close < 0 ? len : close;
                    ScopedAggregationExpression block = parseBlock(pos + 1, bodyEnd);
                    if (block != null) {
                        out.add(block);
                        pos = close < 0 ? len : close + 1;
                    } else {
                        pos++;
                    }
                } else {
                    pos = skipOpaque(pos);
                }
            }
            return out;
        }

        /** Parses {@code KIND dims : body} between {@code start} and {@code end}. */
        private ScopedAggregationExpression parseBlock(int start, int end) {
            int p = skipWhitespace(input, start, end);
            int kwEnd = identifierEnd(input, p, end);
            ScopeKind kind = ScopeKind.fromKeyword(input.substring(p, kwEnd));
            if (kind == null)
                return null;
            int colon = topLevelColon(kwEnd, end);
            if (colon < 0)
                return null;

            List<String> dimensions = parseDimensions(input.substring(kwEnd, colon));
            String body = input.substring(colon + 1, end).trim();
            AggregationFunction aggregation = leadingAggregation(body);
            List<ScopedAggregationExpression> nestedBlocks = containsScopeMarker(body) ? parse(owner, body)
                    : List.of();
            return new ScopedAggregationExpression(owner, kind, dimensions, aggregation, body,
                    !nestedBlocks.isEmpty(), nestedBlocks);
        }

        private int matchingBrace(int open) {
            int depth = 0;
            int pos = open;
            while (pos < len) {
                char c = input.charAt(pos);
                if (c == '{') {
                    depth++;
                    pos++;
                } else if (c == '}') {
                    if (--depth == 0)
                        return pos;
                    pos++;
                } else {
                    pos = skipOpaque(pos);
                }
            }
            return -1;
        }

        private int topLevelColon(int from, int end) {
            int depth = 0;
            int pos = from;
            while (pos < end) {
                char c = input.charAt(pos);
                if (c == '{' || c == '(') {
                    depth++;
                    pos++;
                } else if (c == '}' || c == ')') {
                    depth--;
                    pos++;
                } else if (c == ':' && depth <= 0) {
                    return pos;
                } else {
                    pos = skipOpaque(pos);
                }
            }
            return -1;
        }

        /**
         * Advances past one character, or past a whole field name, string
         * literal or line comment starting at {@code pos}.
         */
        private int skipOpaque(int pos) {
            char c = input.charAt(pos);
            switch (c) {
                case '[': {
                    int close = input.indexOf(']', pos + 1);
                    return close < 0 ? len : close + 1;
                }
                case '"':
                case '\'': {
                    int close = input.indexOf(c, pos + 1);
                    return close < 0 ? len : close + 1;
                }
                case '/': {
                    if (pos + 1 < len && input.charAt(pos + 1) == '/') {
                        int eol = input.indexOf('\n', pos + 2);
                        return eol < 0 ? len : eol + 1;
                    }
                    return pos + 1;
                }
                default:
                    return pos + 1;
            }
        }
    }

    /**
     * Splits the dimension list on commas and takes the field names of each
     * entry. A qualified {@code [ds].[field]} pair yields its field name; any
     * other bracketed token is a dimension of its own, and an entry with no
     * bracketed token is not a dimension.
     */
    static List<String> parseDimensions(String text) {
        List<String> dims = new ArrayList<>();
        for (String entry : splitTopLevel(text)) {
            List<int[]> spans = bracketSpans(entry);
            for (int i = 0; i < spans.size(); i++) {
                int[] span = spans.get(i);
                if (i + 1 < spans.size() && qualifies(entry, span, spans.get(i + 1))) {
                    int[] field = spans.get(++i);
                    String qualified = entry.substring(span[0], span[1] + 1) + "."
                            + entry.substring(field[0], field[1] + 1);
                    dims.add(FieldReference.parse(qualified).fieldName());
                } else {
                    dims.add(entry.substring(span[0] + 1, span[1]));
                }
            }
        }
        return dims;
    }

    /** True when only a {@code .} (and whitespace) separates two bracketed tokens. */
    private static boolean qualifies(String entry, int[] datasource, int[] field) {
        return entry.substring(datasource[1] + 1, field[0]).trim().equals(".");
    }

    /** Open and close bracket positions of each non-empty bracketed token. */
    private static List<int[]> bracketSpans(String text) {
        List<int[]> spans = new ArrayList<>();
        int pos = 0;
        while (pos < text.length()) {
            int open = text.indexOf('[', pos);
            if (open < 0)
                break;
            int close = text.indexOf(']', open + 1);
            if (close < 0)
                break;
            if (close > open + 1)
                spans.add(new int[] { open, close });
            pos = close + 1;
        }
        return spans;
    }

    private static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        int pos = 0;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '[') {
                int close = text.indexOf(']', pos + 1);
                pos = close < 0 ? text.length() : close + 1;
                continue;
            }
            if (c == '(')
                depth++;
            else if (c == ')')
                depth--;
            else if (c == ',' && depth <= 0) {
                parts.add(text.substring(start, pos));
                start = pos + 1;
            }
            pos++;
        }
        parts.add(text.substring(start));
        return parts;
    }

    /** The aggregation named at the start of {@code body}, if immediately followed by '('. */
    static AggregationFunction leadingAggregation(String body) {
        int end = identifierEnd(body, 0, body.length());
        if (end == 0)
            return null;
        int p = skipWhitespace(body, end, body.length());
        if (p >= body.length() || body.charAt(p) != '(')
            return null;
        return AggregationFunction.lookup(body.substring(0, end));
    }

    private static int skipWhitespace(String s, int pos, int end) {
        while (pos < end && Character.isWhitespace(s.charAt(pos)))
            pos++;
        return pos;
    }

    private static int identifierEnd(String s, int pos, int end) {
        while (pos < end && (Character.isLetterOrDigit(s.charAt(pos)) || s.charAt(pos) == '_'))
            pos++;
        return pos;
    }
}
