package com.eql.ast;

import com.eql.edn.Edn;
import com.eql.edn.EdnValue;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableOrderedMap;
import org.eclipse.collections.impl.factory.Lists;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Utility methods for walking and comparing ASTs.
 */
public final class EqlNodes {

    private EqlNodes() {
        // Utility class - no instantiation
    }

    /**
     * Direct children of a node; empty for props.
     */
    public static ImmutableList<? extends EqlNode> children(EqlNode node) {
        if (node instanceof EqlNode.Root root) {
            return root.children();
        }
        if (node instanceof EqlNode.Join join) {
            return join.children();
        }
        if (node instanceof EqlNode.Call call) {
            return call.children();
        }
        if (node instanceof EqlNode.Union union) {
            return union.children();
        }
        if (node instanceof EqlNode.UnionEntry entry) {
            return entry.children();
        }
        return Lists.immutable.empty();
    }

    /**
     * Dispatch key of a prop, join or call. Roots, unions and union entries have none.
     */
    public static Optional<EdnValue> dispatchKey(EqlNode node) {
        if (node instanceof EqlNode.Prop prop) {
            return Optional.of(prop.dispatchKey());
        }
        if (node instanceof EqlNode.Join join) {
            return Optional.of(join.dispatchKey());
        }
        if (node instanceof EqlNode.Call call) {
            return Optional.of(call.dispatchKey());
        }
        return Optional.empty();
    }

    /**
     * Full key of a prop, join or call: the keyword, the ident tuple or the call symbol.
     */
    public static Optional<EdnValue> key(EqlNode node) {
        if (node instanceof EqlNode.Prop prop) {
            return Optional.of(prop.key());
        }
        if (node instanceof EqlNode.Join join) {
            return Optional.of(join.key());
        }
        if (node instanceof EqlNode.Call call) {
            return Optional.of(call.key());
        }
        return Optional.empty();
    }

    public static EdnValue.EdnMap params(EqlNode node) {
        if (node instanceof EqlNode.Prop prop) {
            return prop.params();
        }
        if (node instanceof EqlNode.Join join) {
            return join.params();
        }
        if (node instanceof EqlNode.Call call) {
            return call.params();
        }
        return null;
    }

    /**
     * The element that stands for {@code node} inside its parent's query, in
     * canonical spelling: params wrap the key, calls always carry a params map,
     * and no meta is written. Sub-queries come from the recorded {@code query}
     * of joins and calls, so only the node itself is visited.
     */
    public static EdnValue expression(EqlNode node) {
        if (node instanceof EqlNode.Prop prop) {
            return wrapKey(prop.key(), prop.params());
        }
        if (node instanceof EqlNode.Join join) {
            return Edn.map(wrapKey(join.key(), join.params()), join.query().toValue());
        }
        if (node instanceof EqlNode.Call call) {
            EdnValue expr = wrapKey(call.dispatchKey(), call.params());
            return call.hasQuery() ? Edn.map(expr, call.query().toValue()) : expr;
        }
        if (node instanceof EqlNode.Root root) {
            return querySequence(root.children());
        }
        if (node instanceof EqlNode.Union union) {
            return union.query();
        }
        if (node instanceof EqlNode.UnionEntry entry) {
            return entry.query();
        }
        throw new IllegalStateException("Unknown node type: " + node);
    }

    /** Query vector made of the nodes' expressions. */
    public static EdnValue.EdnVector querySequence(ImmutableList<? extends EqlNode> nodes) {
        return new EdnValue.EdnVector(nodes.collect(EqlNodes::expression), null);
    }

    /** Union map from each entry's key to its recorded branch query. */
    public static EdnValue.EdnMap unionQuery(ImmutableList<EqlNode.UnionEntry> entries) {
        MutableOrderedMap<EdnValue, EdnValue> branches = EdnValue.EdnMap.newEntries();
        for (EqlNode.UnionEntry entry : entries) {
            branches.put(Edn.withoutMeta(entry.unionKey()), entry.query());
        }
        return new EdnValue.EdnMap(branches, null);
    }

    /** {@code key} or {@code (key params)}, without meta. */
    public static EdnValue wrapKey(EdnValue key, EdnValue.EdnMap params) {
        EdnValue bare = Edn.withoutMeta(key);
        return params == null ? bare : Edn.list(bare, Edn.withoutMeta(params));
    }

    /**
     * All nodes of a tree in pre-order (a node before its children, children in order).
     */
    public static ImmutableList<EqlNode> preOrder(EqlNode node) {
        MutableList<EqlNode> visited = Lists.mutable.empty();
        Deque<EqlNode> pending = new ArrayDeque<>();
        pending.push(node);
        while (!pending.isEmpty()) {
            EqlNode current = pending.pop();
            visited.add(current);
            ImmutableList<? extends EqlNode> children = children(current);
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
        return visited.toImmutable();
    }

    /**
     * Copy of the tree with every node's meta removed.
     */
    @SuppressWarnings("unchecked")
    public static <N extends EqlNode> N stripMeta(N node) {
        return (N) strip(node);
    }

    private static EqlNode strip(EqlNode node) {
        if (node instanceof EqlNode.Root root) {
            return new EqlNode.Root(stripAll(root.children()), null);
        }
        if (node instanceof EqlNode.Prop prop) {
            return new EqlNode.Prop(prop.dispatchKey(), prop.key(), prop.params(), null);
        }
        if (node instanceof EqlNode.Join join) {
            return new EqlNode.Join(join.dispatchKey(), join.key(), join.query(), stripAll(join.children()),
                join.params(), null);
        }
        if (node instanceof EqlNode.Call call) {
            return new EqlNode.Call(call.dispatchKey(), call.params(), call.query(), stripAll(call.children()), null);
        }
        if (node instanceof EqlNode.Union union) {
            return new EqlNode.Union(union.query(),
                union.children().collect(entry -> (EqlNode.UnionEntry) strip(entry)));
        }
        if (node instanceof EqlNode.UnionEntry entry) {
            return new EqlNode.UnionEntry(entry.unionKey(), entry.query(), stripAll(entry.children()));
        }
        throw new IllegalStateException("Unknown node type: " + node);
    }

    private static ImmutableList<EqlNode> stripAll(ImmutableList<EqlNode> children) {
        return children.collect(EqlNodes::strip);
    }
}
