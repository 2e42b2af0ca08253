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

import java.util.Objects;

/**
 * Restricts a query to what a second "mask" query selects.
 * <p>
 * An element of the source survives when the mask has an element with the same
 * key. Where both are joins the source's children are masked by the mask's
 * children; where the mask only names the key, the whole source element is
 * kept. Params and recursion markers come from the source.
 */
public class QueryMasker {

    private final EqlParser parser;
    private final EqlUnparser unparser;

    public QueryMasker() {
        this(new EqlParser(), new EqlUnparser());
    }

    public QueryMasker(EqlParser parser, EqlUnparser unparser) {
        this.parser = parser;
        this.unparser = unparser;
    }

    public EdnValue.EdnVector mask(EdnValue.EdnVector source, EdnValue.EdnVector mask) {
        EqlNode.Root sourceRoot = parser.parse(source);
        EqlNode.Root maskRoot = parser.parse(mask);
        return sequence(maskChildren(sourceRoot.children(), maskRoot.children()));
    }

    private ImmutableList<EqlNode> maskChildren(ImmutableList<EqlNode> source, ImmutableList<EqlNode> mask) {
        MutableList<EqlNode> kept = Lists.mutable.empty();
        for (EqlNode node : source) {
            EdnValue key = EqlNodes.key(node).orElse(null);
            EqlNode selector = mask.detect(candidate -> Objects.equals(key, EqlNodes.key(candidate).orElse(null)));
            if (selector == null) {
                continue;
            }
            kept.add(maskNode(node, selector));
        }
        return kept.toImmutable();
    }

    private EqlNode maskNode(EqlNode node, EqlNode selector) {
        if (node instanceof EqlNode.Join join && selector instanceof EqlNode.Join selectorJoin) {
            Masked masked = maskQuery(join.query(), join.children(), selectorJoin.query(), selectorJoin.children());
            return join.withQuery(masked.query(), masked.children());
        }
        if (node instanceof EqlNode.Call call && call.hasQuery()
                && selector instanceof EqlNode.Call selectorCall && selectorCall.hasQuery()) {
            Masked masked = maskQuery(call.query(), call.children(), selectorCall.query(), selectorCall.children());
            return call.withQuery(masked.query(), masked.children());
        }
        return node;
    }

    private Masked maskQuery(JoinQuery query, ImmutableList<EqlNode> children,
                             JoinQuery maskQuery, ImmutableList<EqlNode> selectorChildren) {
        if (query.isRecursive() || maskQuery.isRecursive()) {
            return new Masked(query, children);
        }
        if (query instanceof JoinQuery.SubQuery) {
            ImmutableList<EqlNode> masked = maskChildren(children, flatten(maskQuery, selectorChildren));
            return new Masked(new JoinQuery.SubQuery(sequence(masked)), masked);
        }

        EqlNode.Union union = (EqlNode.Union) children.getFirst();
        EqlNode.Union maskUnion = maskQuery instanceof JoinQuery.UnionQuery
            ? (EqlNode.Union) selectorChildren.getFirst()
            : null;
        MutableList<EqlNode.UnionEntry> entries = Lists.mutable.empty();
        MutableOrderedMap<EdnValue, EdnValue> branches = EdnValue.EdnMap.newEntries();
        for (EqlNode.UnionEntry entry : union.children()) {
            ImmutableList<EqlNode> selectors = selectorChildren;
            if (maskUnion != null) {
                EqlNode.UnionEntry maskEntry = maskUnion.entry(entry.unionKey());
                if (maskEntry == null) {
                    continue;
                }
                selectors = maskEntry.children();
            }
            ImmutableList<EqlNode> masked = maskChildren(entry.children(), selectors);
            EdnValue.EdnVector branch = sequence(masked);
            entries.add(new EqlNode.UnionEntry(entry.unionKey(), branch, masked));
            branches.put(entry.unionKey(), branch);
        }
        EdnValue.EdnMap unionQuery = new EdnValue.EdnMap(branches, null);
        return new Masked(new JoinQuery.UnionQuery(unionQuery),
            Lists.immutable.of(new EqlNode.Union(unionQuery, entries.toImmutable())));
    }

    /** A union mask applied to a plain sub-query selects with all its branches at once. */
    private static ImmutableList<EqlNode> flatten(JoinQuery maskQuery, ImmutableList<EqlNode> selectorChildren) {
        if (maskQuery instanceof JoinQuery.UnionQuery) {
            return ((EqlNode.Union) selectorChildren.getFirst()).children()
                .flatCollect(EqlNode.UnionEntry::children);
        }
        return selectorChildren;
    }

    private EdnValue.EdnVector sequence(ImmutableList<EqlNode> children) {
        return new EdnValue.EdnVector(children.collect(unparser::unparse), null);
    }

    private record Masked(JoinQuery query, ImmutableList<EqlNode> children) {
    }
}
