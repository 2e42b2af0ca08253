package com.eql.query;

import com.eql.ast.EqlNode;
import com.eql.ast.EqlNodes;
import com.eql.ast.EqlParser;
import com.eql.ast.EqlUnparser;
import com.eql.ast.JoinQuery;
import com.eql.edn.EdnValue;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableOrderedMap;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Combines two queries into one that asks for everything either asks for.
 * <p>
 * Elements are matched by key. Matching joins merge their children, union
 * branches merge per union key, and a prop next to a join of the same key
 * becomes the join. The same key with different params cannot be merged, and
 * the merge then yields nothing.
 */
public class QueryMerger {
    private static final Logger log = LoggerFactory.getLogger(QueryMerger.class);

    private final EqlParser parser;
    private final EqlUnparser unparser;

    public QueryMerger() {
        this(new EqlParser(), new EqlUnparser());
    }

    public QueryMerger(EqlParser parser, EqlUnparser unparser) {
        this.parser = parser;
        this.unparser = unparser;
    }

    public Optional<EdnValue.EdnVector> merge(EdnValue.EdnVector left, EdnValue.EdnVector right) {
        return mergeAsts(parser.parse(left), parser.parse(right))
            .map(root -> (EdnValue.EdnVector) unparser.unparse(root));
    }

    public Optional<EqlNode.Root> mergeAsts(EqlNode.Root left, EqlNode.Root right) {
        return mergeChildren(left.children(), right.children()).map(left::withChildren);
    }

    private Optional<ImmutableList<EqlNode>> mergeChildren(ImmutableList<EqlNode> left, ImmutableList<EqlNode> right) {
        MutableList<EqlNode> merged = Lists.mutable.withAll(left);
        for (EqlNode item : right) {
            EdnValue key = EqlNodes.key(item).orElse(null);
            int index = merged.detectIndex(existing -> Objects.equals(key, EqlNodes.key(existing).orElse(null)));
            if (index < 0) {
                merged.add(item);
                continue;
            }
            Optional<EqlNode> combined = mergeNodes(merged.get(index), item);
            if (combined.isEmpty()) {
                return Optional.empty();
            }
            merged.set(index, combined.get());
        }
        return Optional.of(merged.toImmutable());
    }

    private Optional<EqlNode> mergeNodes(EqlNode left, EqlNode right) {
        if (!Objects.equals(EqlNodes.params(left), EqlNodes.params(right))) {
            log.debug("Cannot merge {} and {}: params differ", EqlNodes.key(left).orElse(null),
                EqlNodes.key(right).orElse(null));
            return Optional.empty();
        }
        if (left instanceof EqlNode.Prop && right instanceof EqlNode.Prop) {
            return Optional.of(left);
        }
        if (left instanceof EqlNode.Prop && right instanceof EqlNode.Join) {
            return Optional.of(right);
        }
        if (left instanceof EqlNode.Join && right instanceof EqlNode.Prop) {
            return Optional.of(left);
        }
        if (left instanceof EqlNode.Join leftJoin && right instanceof EqlNode.Join rightJoin) {
            return mergeQueries(leftJoin.query(), leftJoin.children(), rightJoin.query(), rightJoin.children())
                .map(merged -> leftJoin.withQuery(merged.query(), merged.children()));
        }
        if (left instanceof EqlNode.Call leftCall && right instanceof EqlNode.Call rightCall) {
            if (!leftCall.hasQuery() || !rightCall.hasQuery()) {
                return Optional.of(leftCall.hasQuery() ? leftCall : rightCall);
            }
            return mergeQueries(leftCall.query(), leftCall.children(), rightCall.query(), rightCall.children())
                .map(merged -> leftCall.withQuery(merged.query(), merged.children()));
        }
        log.debug("Cannot merge {} with {}", left.type(), right.type());
        return Optional.empty();
    }

    private Optional<Merged> mergeQueries(JoinQuery leftQuery, ImmutableList<EqlNode> leftChildren,
                                          JoinQuery rightQuery, ImmutableList<EqlNode> rightChildren) {
        if (leftQuery instanceof JoinQuery.SubQuery && rightQuery instanceof JoinQuery.SubQuery) {
            return mergeChildren(leftChildren, rightChildren)
                .map(children -> new Merged(new JoinQuery.SubQuery(sequence(children)), children));
        }
        if (leftQuery instanceof JoinQuery.UnionQuery && rightQuery instanceof JoinQuery.UnionQuery) {
            return mergeUnions((EqlNode.Union) leftChildren.getFirst(), (EqlNode.Union) rightChildren.getFirst())
                .map(union -> new Merged(new JoinQuery.UnionQuery(union.query()), Lists.immutable.of(union)));
        }
        if (leftQuery.equals(rightQuery)) {
            return Optional.of(new Merged(leftQuery, leftChildren));
        }
        log.debug("Cannot merge join queries {} and {}", leftQuery.toValue(), rightQuery.toValue());
        return Optional.empty();
    }

    private Optional<EqlNode.Union> mergeUnions(EqlNode.Union left, EqlNode.Union right) {
        MutableList<EqlNode.UnionEntry> entries = Lists.mutable.withAll(left.children());
        for (EqlNode.UnionEntry entry : right.children()) {
            int index = entries.detectIndex(existing -> existing.unionKey().equals(entry.unionKey()));
            if (index < 0) {
                entries.add(entry);
                continue;
            }
            Optional<ImmutableList<EqlNode>> children = mergeChildren(entries.get(index).children(), entry.children());
            if (children.isEmpty()) {
                return Optional.empty();
            }
            entries.set(index, new EqlNode.UnionEntry(entry.unionKey(), sequence(children.get()), children.get()));
        }

        MutableOrderedMap<EdnValue, EdnValue> query = EdnValue.EdnMap.newEntries();
        for (EqlNode.UnionEntry entry : entries) {
            query.put(entry.unionKey(), entry.query());
        }
        return Optional.of(new EqlNode.Union(new EdnValue.EdnMap(query, null), entries.toImmutable()));
    }

    private EdnValue.EdnVector sequence(ImmutableList<EqlNode> children) {
        return new EdnValue.EdnVector(children.collect(unparser::unparse), null);
    }

    private record Merged(JoinQuery query, ImmutableList<EqlNode> children) {
    }
}
