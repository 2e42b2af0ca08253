package com.eql.ast;

import com.eql.edn.Edn;
import com.eql.edn.EdnValue;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.MutableOrderedMap;

/**
 * Turns an AST back into query notation.
 * <p>
 * Sub-queries and unions are rebuilt from {@code children}, so rewritten
 * children show up in the output. Params are always written around the key,
 * {@code (key params)}, whichever spelling was parsed. Node meta is not written.
 */
public class EqlUnparser {

    public EdnValue unparse(EqlNode node) {
        if (node instanceof EqlNode.Root root) {
            return sequence(root.children());
        }
        if (node instanceof EqlNode.Prop prop) {
            return EqlNodes.wrapKey(prop.key(), prop.params());
        }
        if (node instanceof EqlNode.Join join) {
            return Edn.map(EqlNodes.wrapKey(join.key(), join.params()), joinValue(join.query(), join.children()));
        }
        if (node instanceof EqlNode.Call call) {
            EdnValue expr = EqlNodes.wrapKey(call.dispatchKey(), call.params());
            return call.hasQuery() ? Edn.map(expr, joinValue(call.query(), call.children())) : expr;
        }
        if (node instanceof EqlNode.Union union) {
            MutableOrderedMap<EdnValue, EdnValue> branches = EdnValue.EdnMap.newEntries();
            for (EqlNode.UnionEntry entry : union.children()) {
                branches.put(Edn.withoutMeta(entry.unionKey()), sequence(entry.children()));
            }
            return new EdnValue.EdnMap(branches, null);
        }
        if (node instanceof EqlNode.UnionEntry entry) {
            return sequence(entry.children());
        }
        throw new IllegalStateException("Unknown node type: " + node);
    }

    private EdnValue joinValue(JoinQuery query, ImmutableList<EqlNode> children) {
        if (query instanceof JoinQuery.SubQuery) {
            return sequence(children);
        }
        if (query instanceof JoinQuery.UnionQuery) {
            if (children.size() != 1 || !(children.getFirst() instanceof EqlNode.Union union)) {
                throw new IllegalStateException("Union join must have exactly one union child, got " + children);
            }
            return unparse(union);
        }
        return query.toValue();
    }

    private EdnValue.EdnVector sequence(ImmutableList<? extends EqlNode> children) {
        return new EdnValue.EdnVector(children.collect(this::unparse), null);
    }
}
