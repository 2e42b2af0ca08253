package com.eql.query;

import com.eql.ast.EqlNode;
import com.eql.ast.EqlNodes;
import com.eql.ast.EqlParser;
import com.eql.edn.Edn;
import com.eql.edn.EdnValue;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.tuple.Pair;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Optional;

/**
 * Queries derived from the shape of other values.
 */
public class QueryShapes {

    private final EqlParser parser;
    private final QueryMerger merger;

    public QueryShapes() {
        this(new EqlParser(), new QueryMerger());
    }

    public QueryShapes(EqlParser parser, QueryMerger merger) {
        this.parser = parser;
        this.merger = merger;
    }

    /**
     * Dispatch keys of the top-level elements, in query order.
     */
    public ImmutableList<EdnValue> rootProperties(EdnValue.EdnVector query) {
        EqlNode.Root root = parser.parse(query);
        return root.children().collect(child -> EqlNodes.dispatchKey(child).orElseThrow());
    }

    /**
     * A query that would select everything present in {@code data}. Keyword keys of
     * a map become props, or joins when their value holds maps; the shapes of maps
     * inside a vector are merged. Values without maps yield nothing.
     */
    public Optional<EdnValue.EdnVector> dataToQuery(EdnValue data) {
        if (data instanceof EdnValue.EdnMap map) {
            MutableList<EdnValue> elements = Lists.mutable.empty();
            for (Pair<EdnValue, EdnValue> entry : map.entries().keyValuesView()) {
                if (!(entry.getOne() instanceof EdnValue.Keyword key)) {
                    continue;
                }
                Optional<EdnValue.EdnVector> subquery = dataToQuery(entry.getTwo());
                elements.add(subquery.<EdnValue>map(q -> Edn.map(key, q)).orElse(key));
            }
            return elements.isEmpty() ? Optional.empty() : Optional.of(Edn.vector(elements));
        }

        if (data instanceof EdnValue.EdnVector vector) {
            EdnValue.EdnVector merged = null;
            for (EdnValue element : vector.elements()) {
                Optional<EdnValue.EdnVector> shape = dataToQuery(element);
                if (shape.isEmpty()) {
                    continue;
                }
                merged = merged == null ? shape.get() : merger.merge(merged, shape.get()).orElse(merged);
            }
            return Optional.ofNullable(merged);
        }

        return Optional.empty();
    }
}
