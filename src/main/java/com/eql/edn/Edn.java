package com.eql.edn;

import org.eclipse.collections.api.map.MutableOrderedMap;
import org.eclipse.collections.api.tuple.Pair;
import org.eclipse.collections.impl.factory.Lists;

import java.util.List;

/**
 * Static constructors for {@link EdnValue} trees.
 */
public final class Edn {

    private Edn() {
    }

    public static EdnValue.Keyword keyword(String text) {
        return EdnValue.Keyword.of(text);
    }

    public static EdnValue.Symbol symbol(String text) {
        return EdnValue.Symbol.of(text);
    }

    public static EdnValue.Symbol recursion() {
        return EdnValue.Symbol.RECURSION;
    }

    public static EdnValue.EdnVector vector(EdnValue... elements) {
        return new EdnValue.EdnVector(Lists.immutable.of(elements), null);
    }

    public static EdnValue.EdnVector vector(List<? extends EdnValue> elements) {
        return new EdnValue.EdnVector(Lists.immutable.withAll(elements), null);
    }

    public static EdnValue.EdnList list(EdnValue... elements) {
        return new EdnValue.EdnList(Lists.immutable.of(elements), null);
    }

    /**
     * Builds a map from alternating keys and values.
     */
    public static EdnValue.EdnMap map(EdnValue... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("map() needs an even number of arguments, got " + keysAndValues.length);
        }
        MutableOrderedMap<EdnValue, EdnValue> entries = EdnValue.EdnMap.newEntries();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            entries.put(keysAndValues[i], keysAndValues[i + 1]);
        }
        return new EdnValue.EdnMap(entries, null);
    }

    public static EdnValue.EdnNumber integer(long value) {
        return EdnValue.EdnNumber.of(value);
    }

    public static EdnValue.EdnNumber decimal(double value) {
        return EdnValue.EdnNumber.of(value);
    }

    public static EdnValue.EdnString string(String value) {
        return new EdnValue.EdnString(value);
    }

    public static EdnValue.EdnBoolean bool(boolean value) {
        return new EdnValue.EdnBoolean(value);
    }

    public static EdnValue.EdnNil nil() {
        return new EdnValue.EdnNil();
    }

    /** An ident tuple {@code [key value]}. */
    public static EdnValue.EdnVector ident(String key, EdnValue value) {
        return vector(keyword(key), value);
    }

    /**
     * Copy of {@code value} with meta removed from it and from every collection
     * nested inside it.
     */
    public static EdnValue withoutMeta(EdnValue value) {
        if (value instanceof EdnValue.EdnVector vector) {
            return new EdnValue.EdnVector(vector.elements().collect(Edn::withoutMeta), null);
        }
        if (value instanceof EdnValue.EdnList list) {
            return new EdnValue.EdnList(list.elements().collect(Edn::withoutMeta), null);
        }
        if (value instanceof EdnValue.EdnMap map) {
            MutableOrderedMap<EdnValue, EdnValue> entries = EdnValue.EdnMap.newEntries();
            for (Pair<EdnValue, EdnValue> entry : map.entries().keyValuesView()) {
                entries.put(withoutMeta(entry.getOne()), withoutMeta(entry.getTwo()));
            }
            return new EdnValue.EdnMap(entries, null);
        }
        return value;
    }
}
