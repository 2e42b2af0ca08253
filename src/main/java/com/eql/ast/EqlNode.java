package com.eql.ast;

import com.eql.edn.EdnValue;
import com.eql.edn.Meta;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;

/**
 * Node of the abstract syntax tree built from a transaction. Nodes are
 * immutable; each node is owned by exactly one parent's children list.
 * <p>
 * Optional fields ({@code params}, {@code meta}, a call's {@code query}) are
 * {@code null} when absent.
 */
public sealed interface EqlNode {

    NodeType type();

    record Root(ImmutableList<EqlNode> children, Meta meta) implements EqlNode {
        public Root {
            Objects.requireNonNull(children, "children");
        }

        @Override
        public NodeType type() {
            return NodeType.ROOT;
        }

        public Root withChildren(ImmutableList<EqlNode> newChildren) {
            return new Root(newChildren, meta);
        }
    }

    /**
     * A property read. {@code key} is either the keyword itself or an ident
     * tuple whose first element is {@code dispatchKey}.
     */
    record Prop(EdnValue.Keyword dispatchKey, EdnValue key, EdnValue.EdnMap params, Meta meta) implements EqlNode {
        public Prop {
            Objects.requireNonNull(dispatchKey, "dispatchKey");
            Objects.requireNonNull(key, "key");
        }

        public static Prop of(EdnValue.Keyword key) {
            return new Prop(key, key, null, null);
        }

        @Override
        public NodeType type() {
            return NodeType.PROP;
        }

        public boolean hasParams() {
            return params != null;
        }
    }

    record Join(EdnValue.Keyword dispatchKey, EdnValue key, JoinQuery query, ImmutableList<EqlNode> children,
                EdnValue.EdnMap params, Meta meta) implements EqlNode {
        public Join {
            Objects.requireNonNull(dispatchKey, "dispatchKey");
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(query, "query");
            Objects.requireNonNull(children, "children");
        }

        @Override
        public NodeType type() {
            return NodeType.JOIN;
        }

        public boolean hasParams() {
            return params != null;
        }

        /** The union node of a union join, or {@code null} for any other join. */
        public Union union() {
            if (query instanceof JoinQuery.UnionQuery && children.size() == 1
                    && children.getFirst() instanceof Union union) {
                return union;
            }
            return null;
        }

        public Join withQuery(JoinQuery newQuery, ImmutableList<EqlNode> newChildren) {
            return new Join(dispatchKey, key, newQuery, newChildren, params, meta);
        }
    }

    record Union(EdnValue.EdnMap query, ImmutableList<UnionEntry> children) implements EqlNode {
        public Union {
            Objects.requireNonNull(query, "query");
            Objects.requireNonNull(children, "children");
        }

        @Override
        public NodeType type() {
            return NodeType.UNION;
        }

        public UnionEntry entry(EdnValue unionKey) {
            return children.detect(entry -> entry.unionKey().equals(unionKey));
        }
    }

    record UnionEntry(EdnValue unionKey, EdnValue.EdnVector query, ImmutableList<EqlNode> children)
            implements EqlNode {
        public UnionEntry {
            Objects.requireNonNull(unionKey, "unionKey");
            Objects.requireNonNull(query, "query");
            Objects.requireNonNull(children, "children");
        }

        @Override
        public NodeType type() {
            return NodeType.UNION_ENTRY;
        }
    }

    /**
     * A call (mutation). The key is always the dispatch symbol and params are
     * always present. A mutation join also carries the return-shape query.
     */
    record Call(EdnValue.Symbol dispatchKey, EdnValue.EdnMap params, JoinQuery query, ImmutableList<EqlNode> children,
                Meta meta) implements EqlNode {
        public Call {
            Objects.requireNonNull(dispatchKey, "dispatchKey");
            Objects.requireNonNull(params, "params");
            Objects.requireNonNull(children, "children");
        }

        public static Call of(EdnValue.Symbol symbol, EdnValue.EdnMap params) {
            return new Call(symbol, params, null, Lists.immutable.empty(), null);
        }

        @Override
        public NodeType type() {
            return NodeType.CALL;
        }

        public EdnValue.Symbol key() {
            return dispatchKey;
        }

        public boolean hasQuery() {
            return query != null;
        }

        public Call withQuery(JoinQuery newQuery, ImmutableList<EqlNode> newChildren) {
            return new Call(dispatchKey, params, newQuery, newChildren, meta);
        }
    }
}
