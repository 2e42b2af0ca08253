package com.eql.edn;

/**
 * Metadata attached to a collection value: an optional source position and an
 * optional map of arbitrary attributes. Never part of value equality.
 */
public record Meta(SourcePosition position, EdnValue.EdnMap data) {

    public static Meta at(int line, int column) {
        return new Meta(new SourcePosition(line, column), null);
    }

    public static Meta of(EdnValue.EdnMap data) {
        return new Meta(null, data);
    }

    public boolean hasPosition() {
        return position != null;
    }
}
