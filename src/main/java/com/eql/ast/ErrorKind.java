package com.eql.ast;

public enum ErrorKind {
    INVALID_JOIN_SHAPE("join must be a mapping with exactly one entry"),
    INVALID_PARAMS("parameters must be a mapping"),
    INVALID_CALL_SHAPE("call must be (symbol) or (symbol params-map)"),
    INVALID_RECURSION_MARKER("join value must be ..., a non-negative integer, a vector or a union map"),
    UNCLASSIFIABLE_ELEMENT("not a query element");

    private final String description;

    ErrorKind(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
