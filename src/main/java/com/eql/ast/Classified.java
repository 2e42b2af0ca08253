package com.eql.ast;

/**
 * Result of classifying one element: either a finished node, or a frame whose
 * children still have to be built.
 */
record Classified(EqlNode node, ParseFrame pending) {

    static Classified done(EqlNode node) {
        return new Classified(node, null);
    }

    static Classified pending(ParseFrame frame) {
        return new Classified(null, frame);
    }

    boolean isDone() {
        return pending == null;
    }
}
