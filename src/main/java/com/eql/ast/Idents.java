package com.eql.ast;

import com.eql.edn.EdnValue;

/**
 * Helpers for ident tuples, the {@code [keyword value]} keys that address a
 * single entity.
 */
public final class Idents {

    private Idents() {
    }

    public static boolean isIdent(EdnValue value) {
        return value instanceof EdnValue.EdnVector vector
            && vector.size() == 2
            && vector.get(0) instanceof EdnValue.Keyword;
    }

    public static EdnValue.Keyword identKey(EdnValue ident) {
        return (EdnValue.Keyword) requireIdent(ident).get(0);
    }

    public static EdnValue identValue(EdnValue ident) {
        return requireIdent(ident).get(1);
    }

    private static EdnValue.EdnVector requireIdent(EdnValue value) {
        if (!isIdent(value)) {
            throw new IllegalArgumentException("Not an ident: " + value);
        }
        return (EdnValue.EdnVector) value;
    }
}
