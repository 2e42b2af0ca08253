package com.eql.ast;

public enum NodeType {
    ROOT,
    PROP,
    JOIN,
    UNION,
    UNION_ENTRY,
    CALL
}
