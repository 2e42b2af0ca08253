package com.eql.ast;

import com.eql.edn.EdnValue;
import com.eql.edn.Meta;
import com.eql.edn.SourcePosition;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.MutableOrderedMap;
import org.eclipse.collections.api.tuple.Pair;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides, from shape alone, which node a single query element denotes.
 * <p>
 * Rules are tried in a fixed order: keyword, ident, parenthesized list (call or
 * params wrapper), single-entry map (join), bare symbol. Joins whose value still
 * has elements to classify come back as a pending frame instead of recursing.
 */
final class NodeClassifier {
    private static final Logger log = LoggerFactory.getLogger(NodeClassifier.class);

    private final EqlParserOptions options;

    NodeClassifier(EqlParserOptions options) {
        this.options = options;
    }

    Classified classify(EdnValue element, EqlPath path, SourcePosition enclosing) {
        if (options.logClassification() && log.isTraceEnabled()) {
            log.trace("Classifying {} at {}", element, path);
        }

        if (element instanceof EdnValue.Keyword keyword) {
            return Classified.done(EqlNode.Prop.of(keyword));
        }

        if (element instanceof EdnValue.EdnVector vector) {
            if (Idents.isIdent(vector)) {
                return Classified.done(new EqlNode.Prop((EdnValue.Keyword) vector.get(0), vector, null, meta(vector)));
            }
            throw error(ErrorKind.UNCLASSIFIABLE_ELEMENT, element, path, positionOf(vector, enclosing));
        }

        if (element instanceof EdnValue.EdnList list) {
            if (isCallList(list)) {
                return Classified.done(new EqlNode.Call((EdnValue.Symbol) list.get(0),
                    callParams(list, path, enclosing), null, Lists.immutable.empty(), meta(list)));
            }
            return classifyParameterized(list, path, enclosing);
        }

        if (element instanceof EdnValue.EdnMap map) {
            return classifyJoin(map, path, enclosing, null, meta(map));
        }

        if (element instanceof EdnValue.Symbol symbol && options.bareSymbolCalls() && !symbol.isRecursionMarker()) {
            return Classified.done(EqlNode.Call.of(symbol, EdnValue.EdnMap.empty()));
        }

        throw error(ErrorKind.UNCLASSIFIABLE_ELEMENT, element, path, enclosing);
    }

    /** {@code (target params)} around a keyword, an ident or a whole join map. */
    private Classified classifyParameterized(EdnValue.EdnList list, EqlPath path, SourcePosition enclosing) {
        SourcePosition position = positionOf(list, enclosing);
        if (list.size() == 0) {
            throw error(ErrorKind.UNCLASSIFIABLE_ELEMENT, list, path, position);
        }
        if (list.size() != 2 || !(list.get(1) instanceof EdnValue.EdnMap params)) {
            throw error(ErrorKind.INVALID_PARAMS, list, path, position);
        }

        EdnValue target = list.get(0);
        if (target instanceof EdnValue.Keyword keyword) {
            return Classified.done(new EqlNode.Prop(keyword, keyword, params, meta(list)));
        }
        if (Idents.isIdent(target)) {
            return Classified.done(new EqlNode.Prop(Idents.identKey(target), target, params, meta(list)));
        }
        if (target instanceof EdnValue.EdnMap joinMap) {
            return classifyJoin(joinMap, path, position, params, meta(list));
        }
        throw error(ErrorKind.UNCLASSIFIABLE_ELEMENT, target, path.index(0), position);
    }

    /**
     * {@code {key subquery}}, where key is a keyword, an ident, a params-wrapped
     * keyword or ident, or a call list (mutation join).
     */
    private Classified classifyJoin(EdnValue.EdnMap map, EqlPath path, SourcePosition enclosing,
                                    EdnValue.EdnMap outerParams, Meta nodeMeta) {
        SourcePosition position = positionOf(map, enclosing);
        if (map.size() != 1) {
            throw error(ErrorKind.INVALID_JOIN_SHAPE, map, path, position);
        }

        Pair<EdnValue, EdnValue> entry = map.entries().keyValuesView().getFirst();
        JoinKey joinKey = readJoinKey(entry.getOne(), path, position);
        EdnValue.EdnMap params = combineParams(joinKey.params(), outerParams);
        EqlPath subPath = path.key(joinKey.dispatchKey());
        EdnValue value = entry.getTwo();

        if (value instanceof EdnValue.Symbol symbol && symbol.isRecursionMarker()) {
            return Classified.done(build(joinKey, params, nodeMeta, new JoinQuery.UnboundedRecursion(),
                Lists.immutable.empty()));
        }

        if (value instanceof EdnValue.EdnNumber.EdnLong depth) {
            if (depth.value() < 0) {
                throw error(ErrorKind.INVALID_RECURSION_MARKER, value, subPath, position);
            }
            return Classified.done(build(joinKey, params, nodeMeta, new JoinQuery.BoundedRecursion(depth.value()),
                Lists.immutable.empty()));
        }

        // recorded queries are rebuilt from the parsed children in canonical spelling
        if (value instanceof EdnValue.EdnVector subQuery) {
            return Classified.pending(new ParseFrame.SequenceFrame(subPath, positionOf(subQuery, position), subQuery,
                children -> build(joinKey, params, nodeMeta,
                    new JoinQuery.SubQuery(EqlNodes.querySequence(children)), children)));
        }

        if (value instanceof EdnValue.EdnMap union && isUnionMap(union)) {
            return Classified.pending(new ParseFrame.UnionFrame(subPath, positionOf(union, position), union,
                unionNode -> build(joinKey, params, nodeMeta, new JoinQuery.UnionQuery(unionNode.query()),
                    Lists.immutable.of(unionNode))));
        }

        throw error(ErrorKind.INVALID_RECURSION_MARKER, value, subPath, position);
    }

    private JoinKey readJoinKey(EdnValue key, EqlPath path, SourcePosition position) {
        if (key instanceof EdnValue.Keyword keyword) {
            return new JoinKey(keyword, keyword, null);
        }
        if (Idents.isIdent(key)) {
            return new JoinKey(Idents.identKey(key), key, null);
        }
        if (key instanceof EdnValue.EdnList list) {
            if (isCallList(list)) {
                EdnValue.Symbol symbol = (EdnValue.Symbol) list.get(0);
                return new JoinKey(symbol, symbol, callParams(list, path, position));
            }
            if (list.size() != 2 || !(list.get(1) instanceof EdnValue.EdnMap params)) {
                throw error(ErrorKind.INVALID_PARAMS, list, path, position);
            }
            EdnValue target = list.get(0);
            if (target instanceof EdnValue.Keyword keyword) {
                return new JoinKey(keyword, keyword, params);
            }
            if (Idents.isIdent(target)) {
                return new JoinKey(Idents.identKey(target), target, params);
            }
            throw error(ErrorKind.UNCLASSIFIABLE_ELEMENT, target, path, position);
        }
        throw error(ErrorKind.UNCLASSIFIABLE_ELEMENT, key, path, position);
    }

    private EqlNode build(JoinKey joinKey, EdnValue.EdnMap params, Meta nodeMeta, JoinQuery query,
                          ImmutableList<EqlNode> children) {
        if (joinKey.dispatchKey() instanceof EdnValue.Symbol symbol) {
            return new EqlNode.Call(symbol, params, query, children, nodeMeta);
        }
        return new EqlNode.Join((EdnValue.Keyword) joinKey.dispatchKey(), joinKey.key(), query, children, params,
            nodeMeta);
    }

    private EdnValue.EdnMap callParams(EdnValue.EdnList list, EqlPath path, SourcePosition enclosing) {
        if (list.size() == 1) {
            return EdnValue.EdnMap.empty();
        }
        if (list.size() == 2 && list.get(1) instanceof EdnValue.EdnMap params) {
            return params;
        }
        throw error(ErrorKind.INVALID_CALL_SHAPE, list, path, positionOf(list, enclosing));
    }

    private static boolean isCallList(EdnValue.EdnList list) {
        return list.size() > 0 && list.get(0) instanceof EdnValue.Symbol symbol && !symbol.isRecursionMarker();
    }

    /** A union map's values are all sub-query vectors. */
    static boolean isUnionMap(EdnValue.EdnMap map) {
        return map.entries().valuesView().allSatisfy(v -> v instanceof EdnValue.EdnVector);
    }

    private static EdnValue.EdnMap combineParams(EdnValue.EdnMap inner, EdnValue.EdnMap outer) {
        if (inner == null) {
            return outer;
        }
        if (outer == null) {
            return inner;
        }
        MutableOrderedMap<EdnValue, EdnValue> merged = EdnValue.EdnMap.newEntries();
        merged.putAll(inner.entries());
        merged.putAll(outer.entries());
        return new EdnValue.EdnMap(merged, inner.meta());
    }

    private Meta meta(EdnValue value) {
        if (!options.keepMeta()) {
            return null;
        }
        return metaOf(value);
    }

    static Meta metaOf(EdnValue value) {
        if (value instanceof EdnValue.EdnVector vector) {
            return vector.meta();
        }
        if (value instanceof EdnValue.EdnList list) {
            return list.meta();
        }
        if (value instanceof EdnValue.EdnMap map) {
            return map.meta();
        }
        return null;
    }

    SourcePosition positionOf(EdnValue value, SourcePosition enclosing) {
        Meta meta = metaOf(value);
        return meta != null && meta.hasPosition() ? meta.position() : enclosing;
    }

    private static EqlParseException error(ErrorKind kind, EdnValue offending, EqlPath path, SourcePosition position) {
        return new EqlParseException(kind, offending, path, position);
    }

    private record JoinKey(EdnValue dispatchKey, EdnValue key, EdnValue.EdnMap params) {
    }
}
