package io.github.clickin.requestbuilder.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.BiConsumer;

/**
 * Name to value-list mapping shared by {@link Params} and {@link FileParams}.
 *
 * <p>Keys iterate in ascending order. Within a key, values added through {@link #add} come
 * most-recent first.
 */
abstract class ListValuedMap<V> {
    private final TreeMap<String, List<V>> entries;
    private final boolean readOnly;

    ListValuedMap() {
        this(new TreeMap<>(), false);
    }

    ListValuedMap(TreeMap<String, List<V>> entries, boolean readOnly) {
        this.entries = entries;
        this.readOnly = readOnly;
    }

    void prepend(String name, V value) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        checkWritable();
        entries.computeIfAbsent(name, k -> new ArrayList<>()).add(0, value);
    }

    void replaceWithSingletons(List<? extends Map.Entry<String, ? extends V>> pairs) {
        Objects.requireNonNull(pairs, "pairs");
        checkWritable();
        TreeMap<String, List<V>> replacement = new TreeMap<>();
        for (Map.Entry<String, ? extends V> pair : pairs) {
            String name = Objects.requireNonNull(pair.getKey(), "name");
            V value = Objects.requireNonNull(pair.getValue(), "value");
            List<V> single = new ArrayList<>(1);
            single.add(value);
            replacement.put(name, single);
        }
        entries.clear();
        entries.putAll(replacement);
    }

    TreeMap<String, List<V>> copyEntries() {
        TreeMap<String, List<V>> copy = new TreeMap<>();
        for (Map.Entry<String, List<V>> e : entries.entrySet()) {
            copy.put(e.getKey(), new ArrayList<>(e.getValue()));
        }
        return copy;
    }

    boolean readOnly() {
        return readOnly;
    }

    /**
     * Values stored under {@code name}.
     *
     * @param name parameter name
     * @return the values, most-recently added first; empty if absent
     */
    public List<V> get(String name) {
        if (name == null) return List.of();
        List<V> values = entries.get(name);
        return values == null ? List.of() : Collections.unmodifiableList(values);
    }

    public boolean contains(String name) {
        return name != null && entries.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    /**
     * Visits every name with its value list, in key order.
     *
     * @param action receives each name and its unmodifiable values
     */
    public void forEach(BiConsumer<String, List<V>> action) {
        Objects.requireNonNull(action, "action");
        for (Map.Entry<String, List<V>> e : entries.entrySet()) {
            action.accept(e.getKey(), Collections.unmodifiableList(e.getValue()));
        }
    }

    /**
     * Unmodifiable view in key order.
     *
     * @return map of names to values
     */
    public Map<String, List<V>> asMap() {
        Map<String, List<V>> out = new LinkedHashMap<>();
        for (Map.Entry<String, List<V>> e : entries.entrySet()) {
            out.put(e.getKey(), Collections.unmodifiableList(e.getValue()));
        }
        return Collections.unmodifiableMap(out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return entries.equals(((ListValuedMap<?>) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.toString();
    }

    private void checkWritable() {
        if (readOnly) throw new UnsupportedOperationException(getClass().getSimpleName() + " are read-only");
    }
}
