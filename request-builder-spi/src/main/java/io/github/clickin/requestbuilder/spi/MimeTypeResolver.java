package io.github.clickin.requestbuilder.spi;

/**
 * Strategy for deriving the {@code Content-Type} of an uploaded file from its name.
 */
@FunctionalInterface
public interface MimeTypeResolver {

    /**
     * Resolve a MIME type for {@code filename}.
     *
     * @param filename the upload's filename, possibly without an extension
     * @return a MIME type; never null
     */
    String mimeTypeFor(String filename);
}
