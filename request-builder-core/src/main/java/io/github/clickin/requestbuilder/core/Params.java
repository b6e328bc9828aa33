package io.github.clickin.requestbuilder.core;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Request parameters: each name maps to one or more string values.
 */
public final class Params extends ListValuedMap<String> {

    private Params(TreeMap<String, List<String>> entries, boolean readOnly) {
        super(entries, readOnly);
    }

    public static Params create() {
        return new Params(new TreeMap<>(), false);
    }

    /**
     * Builds parameters holding one value per name; a later pair replaces an earlier one
     * with the same name.
     *
     * @param pairs name/value pairs
     * @return new mutable parameters
     */
    public static Params of(List<? extends Map.Entry<String, String>> pairs) {
        Params params = create();
        params.replaceWithSingletons(pairs);
        return params;
    }

    /**
     * Read-only copy of {@code source}.
     *
     * @param source parameters to copy
     * @return read-only parameters
     */
    public static Params copyOf(Params source) {
        Objects.requireNonNull(source, "source");
        if (source.readOnly()) return source;
        return new Params(source.copyEntries(), true);
    }

    /**
     * Adds {@code value} in front of any values already stored under {@code name}.
     *
     * @param name parameter name
     * @param value parameter value
     * @return this parameters
     */
    public Params add(String name, String value) {
        prepend(name, value);
        return this;
    }

    /**
     * Replaces every entry with one value per name.
     *
     * @param pairs name/value pairs
     * @return this parameters
     */
    public Params replaceAll(List<? extends Map.Entry<String, String>> pairs) {
        replaceWithSingletons(pairs);
        return this;
    }
}
