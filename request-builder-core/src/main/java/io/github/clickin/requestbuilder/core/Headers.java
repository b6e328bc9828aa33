package io.github.clickin.requestbuilder.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Case-insensitive, insertion-ordered header container.
 *
 * <p>Names are matched ignoring case; the spelling of the first insertion is kept for output.
 * A container returned by {@link #copyOf(Headers)} is read-only.
 */
public final class Headers {
    private final Map<String, Entry> entries;
    private final boolean readOnly;

    private Headers(Map<String, Entry> entries, boolean readOnly) {
        this.entries = entries;
        this.readOnly = readOnly;
    }

    /**
     * Creates an empty, mutable container.
     *
     * @return new headers
     */
    public static Headers create() {
        return new Headers(new LinkedHashMap<>(), false);
    }

    /**
     * Creates a read-only snapshot of the given headers.
     *
     * @param source headers to copy
     * @return read-only copy
     */
    public static Headers copyOf(Headers source) {
        Objects.requireNonNull(source, "source");
        if (source.readOnly) return source;
        return new Headers(copyEntries(source.entries), true);
    }

    /**
     * Creates a mutable copy of the given headers.
     *
     * @param source headers to copy
     * @return mutable copy
     */
    public static Headers mutableCopyOf(Headers source) {
        Objects.requireNonNull(source, "source");
        return new Headers(copyEntries(source.entries), false);
    }

    /**
     * Replaces every value of {@code name} with {@code value}.
     *
     * @param name header name (case-insensitive)
     * @param value header value
     * @return this container
     */
    public Headers set(String name, String value) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        checkWritable();
        String key = key(name);
        Entry existing = entries.get(key);
        String spelling = existing == null ? name : existing.name;
        List<String> values = new ArrayList<>(1);
        values.add(value);
        entries.put(key, new Entry(spelling, values));
        return this;
    }

    /**
     * Appends {@code value} to the values of {@code name}.
     *
     * @param name header name (case-insensitive)
     * @param value header value
     * @return this container
     */
    public Headers add(String name, String value) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        checkWritable();
        entries.computeIfAbsent(key(name), k -> new Entry(name, new ArrayList<>())).values.add(value);
        return this;
    }

    /**
     * Removes every value of {@code name}.
     *
     * @param name header name (case-insensitive)
     * @return this container
     */
    public Headers remove(String name) {
        Objects.requireNonNull(name, "name");
        checkWritable();
        entries.remove(key(name));
        return this;
    }

    public List<String> get(String name) {
        if (name == null) return List.of();
        Entry e = entries.get(key(name));
        return e == null ? List.of() : Collections.unmodifiableList(e.values);
    }

    public Optional<String> firstValue(String name) {
        List<String> values = get(name);
        return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    public boolean contains(String name) {
        return name != null && entries.containsKey(key(name));
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    /**
     * Header names, in insertion order, spelled as first inserted.
     *
     * @return header names
     */
    public List<String> names() {
        List<String> out = new ArrayList<>(entries.size());
        for (Entry e : entries.values()) {
            out.add(e.name);
        }
        return out;
    }

    /**
     * Map view keyed by header name as first inserted; suitable for adapters expecting
     * {@code Map<String, List<String>>}.
     *
     * @return unmodifiable map of names to values
     */
    public Map<String, List<String>> asMap() {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (Entry e : entries.values()) {
            out.put(e.name, List.copyOf(e.values));
        }
        return Collections.unmodifiableMap(out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Headers)) return false;
        Headers other = (Headers) o;
        if (entries.size() != other.entries.size()) return false;
        for (Map.Entry<String, Entry> e : entries.entrySet()) {
            Entry theirs = other.entries.get(e.getKey());
            if (theirs == null || !theirs.values.equals(e.getValue().values)) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 0;
        for (Map.Entry<String, Entry> e : entries.entrySet()) {
            h += e.getKey().hashCode() ^ e.getValue().values.hashCode();
        }
        return h;
    }

    @Override
    public String toString() {
        return asMap().toString();
    }

    private void checkWritable() {
        if (readOnly) throw new UnsupportedOperationException("headers are read-only");
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    private static Map<String, Entry> copyEntries(Map<String, Entry> source) {
        Map<String, Entry> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Entry> e : source.entrySet()) {
            copy.put(e.getKey(), new Entry(e.getValue().name, new ArrayList<>(e.getValue().values)));
        }
        return copy;
    }

    private static final class Entry {
        private final String name;
        private final List<String> values;

        Entry(String name, List<String> values) {
            this.name = name;
            this.values = values;
        }
    }
}
