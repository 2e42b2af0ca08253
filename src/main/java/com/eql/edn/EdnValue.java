package com.eql.edn;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.MutableOrderedMap;
import org.eclipse.collections.impl.map.ordered.mutable.OrderedMapAdapter;

import java.util.LinkedHashMap;
import java.util.Objects;

/**
 * Generic, already-read value tree that queries and transactions are made of.
 * Collections keep insertion order; their {@link Meta} is ignored by equality.
 */
public sealed interface EdnValue {

    record EdnVector(ImmutableList<EdnValue> elements, Meta meta) implements EdnValue {
        public EdnVector {
            Objects.requireNonNull(elements, "elements");
        }

        public int size() {
            return elements.size();
        }

        public boolean isEmpty() {
            return elements.isEmpty();
        }

        public EdnValue get(int index) {
            return elements.get(index);
        }

        public EdnVector with(EdnValue element) {
            return new EdnVector(elements.newWith(element), meta);
        }

        public EdnVector withMeta(Meta newMeta) {
            return new EdnVector(elements, newMeta);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof EdnVector other && elements.equals(other.elements);
        }

        @Override
        public int hashCode() {
            return elements.hashCode();
        }

        @Override
        public String toString() {
            return EdnPrinter.compact(this);
        }
    }

    record EdnList(ImmutableList<EdnValue> elements, Meta meta) implements EdnValue {
        public EdnList {
            Objects.requireNonNull(elements, "elements");
        }

        public int size() {
            return elements.size();
        }

        public EdnValue get(int index) {
            return elements.get(index);
        }

        public EdnList withMeta(Meta newMeta) {
            return new EdnList(elements, newMeta);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof EdnList other && elements.equals(other.elements);
        }

        @Override
        public int hashCode() {
            return 31 * elements.hashCode() + 1;
        }

        @Override
        public String toString() {
            return EdnPrinter.compact(this);
        }
    }

    /**
     * Insertion-ordered map. The entries are copied on construction and
     * {@link #entries()} is a read-only view.
     */
    record EdnMap(MutableOrderedMap<EdnValue, EdnValue> entries, Meta meta) implements EdnValue {
        public EdnMap {
            Objects.requireNonNull(entries, "entries");
            entries = OrderedMapAdapter.adapt(new LinkedHashMap<>(entries)).asUnmodifiable();
        }

        public static EdnMap empty() {
            return new EdnMap(newEntries(), null);
        }

        public static MutableOrderedMap<EdnValue, EdnValue> newEntries() {
            return OrderedMapAdapter.adapt(new LinkedHashMap<>());
        }

        public int size() {
            return entries.size();
        }

        public boolean isEmpty() {
            return entries.isEmpty();
        }

        public EdnValue get(EdnValue key) {
            return entries.get(key);
        }

        public boolean containsKey(EdnValue key) {
            return entries.containsKey(key);
        }

        public EdnMap with(EdnValue key, EdnValue value) {
            MutableOrderedMap<EdnValue, EdnValue> newEntries = newEntries();
            newEntries.putAll(entries);
            newEntries.put(key, value);
            return new EdnMap(newEntries, meta);
        }

        public EdnMap withMeta(Meta newMeta) {
            return new EdnMap(entries, newMeta);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof EdnMap other && entries.equals(other.entries);
        }

        @Override
        public int hashCode() {
            return entries.hashCode();
        }

        @Override
        public String toString() {
            return EdnPrinter.compact(this);
        }
    }

    record Keyword(String namespace, String name) implements EdnValue {
        public Keyword {
            Objects.requireNonNull(name, "name");
        }

        /**
         * Reads {@code "ns/name"}, {@code ":ns/name"} or {@code "name"}.
         */
        public static Keyword of(String text) {
            String body = text.startsWith(":") ? text.substring(1) : text;
            int slash = body.indexOf('/');
            if (slash > 0 && slash < body.length() - 1) {
                return new Keyword(body.substring(0, slash), body.substring(slash + 1));
            }
            return new Keyword(null, body);
        }

        @Override
        public String toString() {
            return ":" + (namespace == null ? name : namespace + "/" + name);
        }
    }

    record Symbol(String namespace, String name) implements EdnValue {
        /** The unbounded recursion marker {@code ...}. */
        public static final Symbol RECURSION = new Symbol(null, "...");

        public Symbol {
            Objects.requireNonNull(name, "name");
        }

        public static Symbol of(String text) {
            int slash = text.indexOf('/');
            if (slash > 0 && slash < text.length() - 1) {
                return new Symbol(text.substring(0, slash), text.substring(slash + 1));
            }
            return new Symbol(null, text);
        }

        public boolean isRecursionMarker() {
            return RECURSION.equals(this);
        }

        @Override
        public String toString() {
            return namespace == null ? name : namespace + "/" + name;
        }
    }

    record EdnString(String value) implements EdnValue {
        @Override
        public String toString() {
            return EdnPrinter.compact(this);
        }
    }

    sealed interface EdnNumber extends EdnValue {
        String toEdnString();

        record EdnLong(long value) implements EdnNumber {
            @Override
            public String toEdnString() {
                return Long.toString(value);
            }

            @Override
            public String toString() {
                return toEdnString();
            }
        }

        record EdnDouble(double value) implements EdnNumber {
            @Override
            public String toEdnString() {
                if (value == (long) value && !Double.isInfinite(value) && !Double.isNaN(value)) {
                    return (long) value + ".0";
                }
                return Double.toString(value);
            }

            @Override
            public String toString() {
                return toEdnString();
            }
        }

        static EdnNumber of(long value) {
            return new EdnLong(value);
        }

        static EdnNumber of(double value) {
            return new EdnDouble(value);
        }
    }

    record EdnBoolean(boolean value) implements EdnValue {
        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    record EdnNil() implements EdnValue {
        @Override
        public String toString() {
            return "nil";
        }
    }
}
