package io.github.clickin.requestbuilder;

import io.github.clickin.requestbuilder.core.FileParams;
import io.github.clickin.requestbuilder.core.FileUpload;
import io.github.clickin.requestbuilder.core.Params;
import io.github.clickin.requestbuilder.core.Protocol;
import io.github.clickin.requestbuilder.spi.MimeTypeResolver;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * Writes {@code multipart/form-data} bodies.
 *
 * <p>Layout: one part per parameter value, then one part per file field, then the closing
 * delimiter {@code --boundary--} with no trailing CRLF. A file field holding several uploads is
 * written as a single {@code multipart/mixed} part delimited by the file boundary. Inner parts of
 * such a field carry {@code Content-Disposition: name; filename="..."} without the
 * {@code form-data;} prefix; existing consumers depend on that exact form.
 */
public final class MultipartEncoder {
    private static final String CRLF = "\r\n";
    private static final String DASHES = "--";

    private final MimeTypeResolver mimeTypes;

    public MultipartEncoder(MimeTypeResolver mimeTypes) {
        this.mimeTypes = Objects.requireNonNull(mimeTypes, "mimeTypes");
    }

    /**
     * Encodes a complete multipart body.
     *
     * @param boundary delimiter for top-level parts
     * @param fileBoundary delimiter for parts nested inside compound file fields
     * @param params simple parameters
     * @param fileParams file parameters
     * @return the body bytes
     */
    public byte[] encode(String boundary, String fileBoundary, Params params, FileParams fileParams) {
        Objects.requireNonNull(boundary, "boundary");
        Objects.requireNonNull(fileBoundary, "fileBoundary");
        Objects.requireNonNull(params, "params");
        Objects.requireNonNull(fileParams, "fileParams");

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        params.forEach((name, values) -> {
            for (String value : values) {
                writeParamPart(out, boundary, name, value);
            }
        });
        fileParams.forEach((name, uploads) -> {
            if (uploads.size() == 1) {
                writeFilePart(out, boundary, name, uploads.get(0));
            } else {
                writeCompoundFilePart(out, boundary, fileBoundary, name, uploads);
            }
        });
        write(out, DASHES + boundary + DASHES);
        return out.toByteArray();
    }

    private void writeParamPart(ByteArrayOutputStream out, String boundary, String name, String value) {
        write(out, DASHES + boundary + CRLF
                + "Content-Disposition: form-data; name=\"" + name + "\"" + CRLF
                + CRLF
                + value + CRLF);
    }

    private void writeFilePart(ByteArrayOutputStream out, String boundary, String name, FileUpload upload) {
        write(out, DASHES + boundary + CRLF
                + "Content-Disposition: form-data; name=\"" + name + "\"; filename=\"" + upload.filename() + "\"" + CRLF
                + Protocol.H_CONTENT_TYPE + ": " + mimeTypes.mimeTypeFor(upload.filename()) + CRLF
                + CRLF);
        writeContent(out, upload);
        write(out, CRLF);
    }

    private void writeCompoundFilePart(ByteArrayOutputStream out, String boundary, String fileBoundary,
                                       String name, List<FileUpload> uploads) {
        write(out, DASHES + boundary + CRLF
                + "Content-Disposition: form-data; name=\"" + name + "\"" + CRLF
                + Protocol.H_CONTENT_TYPE + ": " + Protocol.CT_MULTIPART_MIXED + "; "
                + Protocol.P_BOUNDARY + "=" + fileBoundary + CRLF
                + CRLF);
        for (FileUpload upload : uploads) {
            write(out, DASHES + fileBoundary + CRLF
                    + "Content-Disposition: " + name + "; filename=\"" + upload.filename() + "\"" + CRLF
                    + Protocol.H_CONTENT_TYPE + ": " + mimeTypes.mimeTypeFor(upload.filename()) + CRLF
                    + CRLF);
            writeContent(out, upload);
            write(out, CRLF);
        }
        write(out, DASHES + fileBoundary + DASHES + CRLF);
    }

    private static void write(ByteArrayOutputStream out, String text) {
        out.writeBytes(text.getBytes(StandardCharsets.UTF_8));
    }

    private static void writeContent(ByteArrayOutputStream out, FileUpload upload) {
        try {
            upload.writeTo(out);
        } catch (IOException e) {
            // ByteArrayOutputStream does not throw
            throw new UncheckedIOException(e);
        }
    }
}
