package com.eql.ast;

/**
 * Parser settings.
 *
 * @param keepMeta attach collection metadata to the nodes built from them
 * @param bareSymbolCalls read a bare symbol element as a call with empty params
 * @param logClassification trace-log every classified element
 */
public record EqlParserOptions(boolean keepMeta, boolean bareSymbolCalls, boolean logClassification) {

    public static EqlParserOptions defaults() {
        return new EqlParserOptions(true, true, false);
    }

    public EqlParserOptions withKeepMeta(boolean value) {
        return new EqlParserOptions(value, bareSymbolCalls, logClassification);
    }

    public EqlParserOptions withBareSymbolCalls(boolean value) {
        return new EqlParserOptions(keepMeta, value, logClassification);
    }

    public EqlParserOptions withLogClassification(boolean value) {
        return new EqlParserOptions(keepMeta, bareSymbolCalls, value);
    }
}
