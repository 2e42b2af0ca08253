package com.eql.ast;

import com.eql.edn.EdnValue;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;

/**
 * Location of an element inside a transaction, as the indices and keys taken
 * from the root to reach it. Paths share their prefix with the parent path, so
 * extending one is constant time.
 */
public final class EqlPath {

    private static final EqlPath ROOT = new EqlPath(null, null, 0);

    private final EqlPath parent;
    private final Object segment;
    private final int length;

    private EqlPath(EqlPath parent, Object segment, int length) {
        this.parent = parent;
        this.segment = segment;
        this.length = length;
    }

    public static EqlPath root() {
        return ROOT;
    }

    public EqlPath index(int index) {
        return new EqlPath(this, index, length + 1);
    }

    public EqlPath key(EdnValue key) {
        return new EqlPath(this, key, length + 1);
    }

    public boolean isRoot() {
        return length == 0;
    }

    public int length() {
        return length;
    }

    /**
     * Segments from the root: {@link Integer} positions and {@link EdnValue} keys.
     */
    public ImmutableList<Object> segments() {
        MutableList<Object> segments = Lists.mutable.empty();
        for (EqlPath p = this; p.length > 0; p = p.parent) {
            segments.add(p.segment);
        }
        return segments.reverseThis().toImmutable();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof EqlPath other && segments().equals(other.segments());
    }

    @Override
    public int hashCode() {
        return Objects.hash(segments());
    }

    @Override
    public String toString() {
        return segments().makeString("[", " ", "]");
    }
}
