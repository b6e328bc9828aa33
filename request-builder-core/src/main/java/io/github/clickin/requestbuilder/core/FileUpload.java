package io.github.clickin.requestbuilder.core;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * A file attached to a multipart request: its filename and raw content.
 */
public final class FileUpload {
    private final String filename;
    private final byte[] content;

    public FileUpload(String filename, byte[] content) {
        this.filename = Objects.requireNonNull(filename, "filename");
        this.content = Objects.requireNonNull(content, "content").clone();
    }

    public static FileUpload of(String filename, String content) {
        return new FileUpload(filename, Objects.requireNonNull(content, "content").getBytes(StandardCharsets.UTF_8));
    }

    public String filename() {
        return filename;
    }

    public byte[] content() {
        return content.clone();
    }

    public int length() {
        return content.length;
    }

    /**
     * Writes the content to {@code out} without copying it first.
     *
     * @param out destination stream
     * @throws IOException if the stream rejects the write
     */
    public void writeTo(OutputStream out) throws IOException {
        out.write(content);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileUpload)) return false;
        FileUpload other = (FileUpload) o;
        return filename.equals(other.filename) && Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return 31 * filename.hashCode() + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "FileUpload[filename=" + filename + ", length=" + content.length + "]";
    }
}
