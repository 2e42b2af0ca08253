package com.eql.ast;

import com.eql.edn.EdnValue;
import com.eql.edn.SourcePosition;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.tuple.Pair;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Iterator;
import java.util.function.Function;

/**
 * Unit of work on the parser's explicit stack. A frame hands out its child
 * sources one at a time, collects the nodes built from them, and turns the
 * collected children into its own node once exhausted.
 */
abstract class ParseFrame {
    final EqlPath path;
    final SourcePosition position;
    final MutableList<EqlNode> built = Lists.mutable.empty();

    ParseFrame(EqlPath path, SourcePosition position) {
        this.path = path;
        this.position = position;
    }

    abstract boolean hasNext();

    abstract Classified next(NodeClassifier classifier);

    abstract EqlNode finish();

    /** The elements of a vector: a transaction, a join sub-query or a union branch. */
    static final class SequenceFrame extends ParseFrame {
        private final EdnValue.EdnVector source;
        private final Function<ImmutableList<EqlNode>, EqlNode> finisher;
        private int index;

        SequenceFrame(EqlPath path, SourcePosition position, EdnValue.EdnVector source,
                      Function<ImmutableList<EqlNode>, EqlNode> finisher) {
            super(path, position);
            this.source = source;
            this.finisher = finisher;
        }

        @Override
        boolean hasNext() {
            return index < source.size();
        }

        @Override
        Classified next(NodeClassifier classifier) {
            EdnValue element = source.get(index);
            EqlPath elementPath = path.index(index);
            index++;
            return classifier.classify(element, elementPath, position);
        }

        @Override
        EqlNode finish() {
            return finisher.apply(built.toImmutable());
        }
    }

    /** The branches of a union map; finishes into whatever node owns the union. */
    static final class UnionFrame extends ParseFrame {
        private final Iterator<Pair<EdnValue, EdnValue>> entries;
        private final Function<EqlNode.Union, EqlNode> finisher;

        UnionFrame(EqlPath path, SourcePosition position, EdnValue.EdnMap union,
                   Function<EqlNode.Union, EqlNode> finisher) {
            super(path, position);
            this.entries = union.entries().keyValuesView().iterator();
            this.finisher = finisher;
        }

        @Override
        boolean hasNext() {
            return entries.hasNext();
        }

        @Override
        Classified next(NodeClassifier classifier) {
            Pair<EdnValue, EdnValue> entry = entries.next();
            EdnValue unionKey = entry.getOne();
            EdnValue.EdnVector branch = (EdnValue.EdnVector) entry.getTwo();
            return Classified.pending(new SequenceFrame(path.key(unionKey), classifier.positionOf(branch, position),
                branch, children -> new EqlNode.UnionEntry(unionKey, EqlNodes.querySequence(children), children)));
        }

        @Override
        EqlNode finish() {
            ImmutableList<EqlNode.UnionEntry> branches = built.selectInstancesOf(EqlNode.UnionEntry.class).toImmutable();
            return finisher.apply(new EqlNode.Union(EqlNodes.unionQuery(branches), branches));
        }
    }
}
