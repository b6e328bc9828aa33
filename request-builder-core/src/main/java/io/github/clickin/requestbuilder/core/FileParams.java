package io.github.clickin.requestbuilder.core;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * File parameters of a multipart request: each field name maps to one or more uploads.
 *
 * <p>A field with a single upload is encoded as a plain file part; a field with two or more
 * uploads is a compound field and is encoded as a nested {@code multipart/mixed} part.
 */
public final class FileParams extends ListValuedMap<FileUpload> {

    private FileParams(TreeMap<String, List<FileUpload>> entries, boolean readOnly) {
        super(entries, readOnly);
    }

    public static FileParams create() {
        return new FileParams(new TreeMap<>(), false);
    }

    /**
     * Builds file parameters holding one upload per field; a later pair replaces an earlier
     * one with the same field name.
     *
     * @param pairs field name/upload pairs
     * @return new mutable file parameters
     */
    public static FileParams of(List<? extends Map.Entry<String, FileUpload>> pairs) {
        FileParams files = create();
        files.replaceWithSingletons(pairs);
        return files;
    }

    public static FileParams copyOf(FileParams source) {
        Objects.requireNonNull(source, "source");
        if (source.readOnly()) return source;
        return new FileParams(source.copyEntries(), true);
    }

    /**
     * Adds {@code upload} in front of any uploads already stored under {@code name}.
     *
     * @param name field name
     * @param upload the file
     * @return this file parameters
     */
    public FileParams add(String name, FileUpload upload) {
        prepend(name, upload);
        return this;
    }

    public FileParams replaceAll(List<? extends Map.Entry<String, FileUpload>> pairs) {
        replaceWithSingletons(pairs);
        return this;
    }

    /**
     * Whether the field carries more than one upload.
     *
     * @param name field name
     * @return {@code true} for a compound field
     */
    public boolean isCompound(String name) {
        return get(name).size() > 1;
    }
}
