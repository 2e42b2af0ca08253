package com.eql.ast;

import com.eql.edn.EdnPrinter;
import com.eql.edn.EdnValue;
import com.eql.edn.SourcePosition;

/**
 * Thrown when a transaction does not follow the query notation. Parsing stops
 * at the first such element, so no partial tree is ever produced.
 */
public class EqlParseException extends RuntimeException {

    private final ErrorKind kind;
    private final EdnValue offending;
    private final EqlPath path;
    private final SourcePosition position;

    public EqlParseException(ErrorKind kind, EdnValue offending, EqlPath path, SourcePosition position) {
        super(buildMessage(kind, offending, path, position));
        this.kind = kind;
        this.offending = offending;
        this.path = path;
        this.position = position;
    }

    private static String buildMessage(ErrorKind kind, EdnValue offending, EqlPath path, SourcePosition position) {
        StringBuilder sb = new StringBuilder()
            .append(kind).append(": ").append(kind.description())
            .append(", got ").append(EdnPrinter.compact(offending))
            .append(" at ").append(path);
        if (position != null) {
            sb.append(" (").append(position).append(")");
        }
        return sb.toString();
    }

    public ErrorKind kind() {
        return kind;
    }

    public EdnValue offending() {
        return offending;
    }

    public EqlPath path() {
        return path;
    }

    /** Nearest known source position, or {@code null} if the input had none. */
    public SourcePosition position() {
        return position;
    }
}
