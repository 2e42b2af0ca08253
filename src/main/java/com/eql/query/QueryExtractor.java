package com.eql.query;

import com.eql.ast.EqlNode;
import com.eql.ast.EqlNodes;
import com.eql.edn.Edn;
import com.eql.edn.EdnValue;

/**
 * Recovers the plain query a node declares. Joins contribute the query value
 * recorded at parse time, which the parser keeps in canonical spelling and
 * without meta.
 */
public class QueryExtractor {

    public EdnValue getQuery(EqlNode node) {
        if (node instanceof EqlNode.Root root) {
            return EqlNodes.querySequence(root.children());
        }
        if (node instanceof EqlNode.Join join) {
            return join.query().toValue();
        }
        if (node instanceof EqlNode.Call call && call.hasQuery()) {
            return call.query().toValue();
        }
        if (node instanceof EqlNode.Union || node instanceof EqlNode.UnionEntry) {
            return EqlNodes.expression(node);
        }
        return Edn.vector(expression(node));
    }

    /**
     * The element that stands for {@code node} inside its parent's query.
     */
    public EdnValue expression(EqlNode node) {
        return EqlNodes.expression(node);
    }
}
