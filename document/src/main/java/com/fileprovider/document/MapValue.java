package com.fileprovider.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A mapping from string keys to values.
 *
 * <p>Keys are kept in ascending order so that two equal maps always serialize
 * to the same bytes.</p>
 *
 * @param entries the entries, copied into an immutable sorted map
 */
public record MapValue(SortedMap<String, Document> entries) implements Document {

    private static final MapValue EMPTY = new MapValue(new TreeMap<>());

    public MapValue {
        TreeMap<String, Document> copy = new TreeMap<>();
        copy.putAll(entries);
        entries = Collections.unmodifiableSortedMap(copy);
    }

    public static MapValue empty() {
        return EMPTY;
    }

    public static MapValue of(Map<String, ? extends Document> entries) {
        return new MapValue(new TreeMap<>(entries));
    }

    public static MapValue of(String key, Document value) {
        TreeMap<String, Document> entries = new TreeMap<>();
        entries.put(key, value);
        return new MapValue(entries);
    }

    public Optional<Document> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }

    @Override
    public Kind kind() {
        return Kind.MAP;
    }

    @Override
    public Map<String, Object> toPlain() {
        Map<String, Object> plain = new LinkedHashMap<>();
        for (Map.Entry<String, Document> entry : entries.entrySet()) {
            plain.put(entry.getKey(), entry.getValue().toPlain());
        }
        return plain;
    }
}
