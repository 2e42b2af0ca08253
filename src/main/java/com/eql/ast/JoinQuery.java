package com.eql.ast;

import com.eql.edn.Edn;
import com.eql.edn.EdnValue;

/**
 * What sits in a join's value position. The four cases share one syntactic slot
 * and are told apart by shape only.
 */
public sealed interface JoinQuery {

    /** The surface value this query was read from. */
    EdnValue toValue();

    default boolean isRecursive() {
        return false;
    }

    record SubQuery(EdnValue.EdnVector query) implements JoinQuery {
        @Override
        public EdnValue toValue() {
            return query;
        }
    }

    /** {@code ...}: re-apply the enclosing query with no depth limit. */
    record UnboundedRecursion() implements JoinQuery {
        @Override
        public EdnValue toValue() {
            return Edn.recursion();
        }

        @Override
        public boolean isRecursive() {
            return true;
        }
    }

    record BoundedRecursion(long depth) implements JoinQuery {
        public BoundedRecursion {
            if (depth < 0) {
                throw new IllegalArgumentException("Recursion depth must be non-negative: " + depth);
            }
        }

        @Override
        public EdnValue toValue() {
            return Edn.integer(depth);
        }

        @Override
        public boolean isRecursive() {
            return true;
        }
    }

    /** Union key to branch sub-query. */
    record UnionQuery(EdnValue.EdnMap query) implements JoinQuery {
        @Override
        public EdnValue toValue() {
            return query;
        }
    }
}
