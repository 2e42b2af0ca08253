package com.eql.edn;

import org.eclipse.collections.api.list.ImmutableList;

/**
 * Renders value trees in EDN-like notation for diagnostics and logging.
 */
public class EdnPrinter {
    private final boolean prettyPrint;

    private static final EdnPrinter COMPACT = new EdnPrinter(false);

    // one builder per thread, reused across print calls
    private static final ThreadLocal<StringBuilder> STRING_BUILDER_POOL =
        ThreadLocal.withInitial(() -> new StringBuilder(256));

    public EdnPrinter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
    }

    public static String compact(EdnValue value) {
        return COMPACT.print(value);
    }

    public String print(EdnValue value) {
        // toString() of nested values may re-enter this printer, so only the
        // outermost call borrows the pooled builder
        StringBuilder pooled = STRING_BUILDER_POOL.get();
        StringBuilder sb = pooled.length() == 0 ? pooled : new StringBuilder(64);
        try {
            if (prettyPrint) {
                printPretty(value, 0, sb);
            } else {
                printCompact(value, sb);
            }
            return sb.toString();
        } finally {
            sb.setLength(0);
        }
    }

    private void printPretty(EdnValue value, int indent, StringBuilder sb) {
        String indentStr = " ".repeat(indent);

        if (value instanceof EdnValue.EdnMap map) {
            if (map.isEmpty()) {
                sb.append("{}");
                return;
            }

            sb.append("{");
            boolean first = true;
            for (var entry : map.entries().keyValuesView()) {
                if (!first) {
                    sb.append("\n").append(indentStr).append(" ");
                }
                first = false;

                printCompact(entry.getOne(), sb);
                sb.append(" ");
                printPretty(entry.getTwo(), indent + 2, sb);
            }
            sb.append("}");
        } else if (value instanceof EdnValue.EdnVector vector) {
            printPrettySequence(vector.elements(), "[", "]", indent, sb);
        } else if (value instanceof EdnValue.EdnList list) {
            printPrettySequence(list.elements(), "(", ")", indent, sb);
        } else {
            printCompact(value, sb);
        }
    }

    private void printPrettySequence(ImmutableList<EdnValue> elements, String open, String close,
                                     int indent, StringBuilder sb) {
        if (elements.isEmpty()) {
            sb.append(open).append(close);
            return;
        }

        String indentStr = " ".repeat(indent + 1);
        sb.append(open);
        boolean first = true;
        for (EdnValue element : elements) {
            if (!first) {
                sb.append("\n").append(indentStr);
            }
            first = false;
            printPretty(element, indent + 1, sb);
        }
        sb.append(close);
    }

    private void printCompact(EdnValue value, StringBuilder sb) {
        if (value instanceof EdnValue.EdnMap map) {
            sb.append("{");
            boolean first = true;
            for (var entry : map.entries().keyValuesView()) {
                if (!first) {
                    sb.append(", ");
                }
                first = false;

                printCompact(entry.getOne(), sb);
                sb.append(" ");
                printCompact(entry.getTwo(), sb);
            }
            sb.append("}");
        } else if (value instanceof EdnValue.EdnVector vector) {
            printCompactSequence(vector.elements(), "[", "]", sb);
        } else if (value instanceof EdnValue.EdnList list) {
            printCompactSequence(list.elements(), "(", ")", sb);
        } else if (value instanceof EdnValue.EdnString s) {
            appendQuoted(s.value(), sb);
        } else if (value instanceof EdnValue.EdnNumber n) {
            sb.append(n.toEdnString());
        } else {
            // keywords, symbols, booleans and nil print themselves
            sb.append(value);
        }
    }

    private void printCompactSequence(ImmutableList<EdnValue> elements, String open, String close,
                                      StringBuilder sb) {
        sb.append(open);
        boolean first = true;
        for (EdnValue element : elements) {
            if (!first) {
                sb.append(" ");
            }
            first = false;
            printCompact(element, sb);
        }
        sb.append(close);
    }

    /** Appends {@code s} as an EDN string literal. */
    private static void appendQuoted(String s, StringBuilder sb) {
        sb.append('"');
        int start = 0;
        for (int i = 0; i < s.length(); i++) {
            String escape = escapeFor(s.charAt(i));
            if (escape != null) {
                sb.append(s, start, i).append(escape);
                start = i + 1;
            }
        }
        sb.append(s, start, s.length()).append('"');
    }

    private static String escapeFor(char c) {
        switch (c) {
            case '"':
                return "\\\"";
            case '\\':
                return "\\\\";
            case '\n':
                return "\\n";
            case '\r':
                return "\\r";
            case '\t':
                return "\\t";
            default:
                return null;
        }
    }
}
