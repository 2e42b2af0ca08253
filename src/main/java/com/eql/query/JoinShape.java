package com.eql.query;

import com.eql.ast.Idents;
import com.eql.edn.EdnValue;
import org.eclipse.collections.api.map.MutableOrderedMap;
import org.eclipse.collections.api.tuple.Pair;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Optional;

/**
 * Read-only view of a join element of a plain query, in any of its spellings:
 * {@code {k q}}, {@code {(k params) q}}, {@code ({k q} params)} or a mutation join
 * {@code {(sym params) q}}. Reading never fails; anything else is not a join.
 *
 * @param element the element as it appears in its query
 * @param joinMap the single-entry map inside {@code element}
 * @param dispatchKey keyword, or symbol for a mutation join
 * @param key dispatch key, ident tuple or symbol
 * @param subquery the join's value
 */
record JoinShape(EdnValue element, EdnValue.EdnMap joinMap, EdnValue dispatchKey, EdnValue key,
                 EdnValue subquery) {

    static Optional<JoinShape> read(EdnValue element) {
        EdnValue.EdnMap map = null;
        if (element instanceof EdnValue.EdnMap direct) {
            map = direct;
        } else if (element instanceof EdnValue.EdnList list && list.size() == 2
                && list.get(0) instanceof EdnValue.EdnMap wrapped && list.get(1) instanceof EdnValue.EdnMap) {
            map = wrapped;
        }
        if (map == null || map.size() != 1) {
            return Optional.empty();
        }

        Pair<EdnValue, EdnValue> entry = map.entries().keyValuesView().getFirst();
        EdnValue keyExpr = entry.getOne();
        if (keyExpr instanceof EdnValue.EdnList list && list.size() > 0) {
            keyExpr = list.get(0);
        }
        if (keyExpr instanceof EdnValue.Keyword || keyExpr instanceof EdnValue.Symbol) {
            return Optional.of(new JoinShape(element, map, keyExpr, keyExpr, entry.getTwo()));
        }
        if (Idents.isIdent(keyExpr)) {
            return Optional.of(new JoinShape(element, map, Idents.identKey(keyExpr), keyExpr, entry.getTwo()));
        }
        return Optional.empty();
    }

    boolean matches(EdnValue pathKey) {
        return dispatchKey.equals(pathKey) || key.equals(pathKey);
    }

    /**
     * The same element, spelled the same way, with a different join value.
     */
    EdnValue withSubquery(EdnValue newSubquery) {
        MutableOrderedMap<EdnValue, EdnValue> entries = EdnValue.EdnMap.newEntries();
        entries.put(joinMap.entries().keysView().getFirst(), newSubquery);
        EdnValue.EdnMap newMap = new EdnValue.EdnMap(entries, joinMap.meta());
        if (element instanceof EdnValue.EdnList list) {
            return new EdnValue.EdnList(Lists.immutable.of(newMap, list.get(1)), list.meta());
        }
        return newMap;
    }
}
