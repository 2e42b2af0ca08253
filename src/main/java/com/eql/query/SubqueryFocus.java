package com.eql.query;

import com.eql.edn.EdnValue;
import org.eclipse.collections.api.list.MutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Finds the sub-query reachable from a query along a path of keys, working on
 * the plain query without building an AST.
 * <p>
 * Each path key selects the first join whose dispatch key (or full ident key)
 * equals it. A union join needs the following path element to name the branch.
 * A recursive join focuses back on the query that contains it: {@code ...}
 * unchanged, a depth {@code n} with that join's depth lowered to {@code n - 1},
 * and depth {@code 0} resolves to nothing.
 */
public class SubqueryFocus {
    private static final Logger log = LoggerFactory.getLogger(SubqueryFocus.class);

    public Optional<EdnValue.EdnVector> focus(EdnValue.EdnVector query, List<? extends EdnValue> path) {
        EdnValue.EdnVector current = query;
        int i = 0;
        while (i < path.size()) {
            EdnValue pathKey = path.get(i);
            int index = indexOfJoin(current, pathKey);
            if (index < 0) {
                return notFound(path, i);
            }

            JoinShape join = JoinShape.read(current.get(index)).orElseThrow();
            EdnValue subquery = join.subquery();

            if (subquery instanceof EdnValue.EdnVector vector) {
                current = vector;
                i++;
            } else if (subquery instanceof EdnValue.EdnMap union) {
                if (i + 1 >= path.size()) {
                    return notFound(path, i);
                }
                EdnValue branch = union.get(path.get(i + 1));
                if (!(branch instanceof EdnValue.EdnVector branchQuery)) {
                    return notFound(path, i + 1);
                }
                current = branchQuery;
                i += 2;
            } else if (subquery instanceof EdnValue.Symbol symbol && symbol.isRecursionMarker()) {
                i++;
            } else if (subquery instanceof EdnValue.EdnNumber.EdnLong depth && depth.value() > 0) {
                EdnValue lowered = join.withSubquery(EdnValue.EdnNumber.of(depth.value() - 1));
                MutableList<EdnValue> elements = current.elements().toList();
                elements.set(index, lowered);
                current = new EdnValue.EdnVector(elements.toImmutable(), current.meta());
                i++;
            } else {
                return notFound(path, i);
            }
        }
        return Optional.of(current);
    }

    private static int indexOfJoin(EdnValue.EdnVector query, EdnValue pathKey) {
        for (int i = 0; i < query.size(); i++) {
            Optional<JoinShape> join = JoinShape.read(query.get(i));
            if (join.isPresent() && join.get().matches(pathKey)) {
                return i;
            }
        }
        return -1;
    }

    private static Optional<EdnValue.EdnVector> notFound(List<? extends EdnValue> path, int position) {
        if (log.isDebugEnabled()) {
            log.debug("Focus path {} does not resolve at {}", path, path.get(position));
        }
        return Optional.empty();
    }
}
