package io.github.clickin.requestbuilder.core;

/**
 * Header names and well-known content-type tags used when building requests.
 *
 * <p>The form and multipart tags are the literal values written to the {@code Content-Type}
 * header by the builder. The urlencoded tag deliberately has no {@code application/} prefix.
 */
public final class Protocol {
    private Protocol() {}

    // HTTP headers
    public static final String H_CONTENT_TYPE = "Content-Type";
    public static final String H_CONTENT_LENGTH = "Content-Length";
    public static final String H_ACCEPT = "Accept";

    // Content-type tags
    public static final String CT_FORM_URLENCODED = "x-www-form-urlencoded";
    public static final String CT_MULTIPART_FORM_DATA = "multipart/form-data";
    public static final String CT_MULTIPART_MIXED = "multipart/mixed";

    /** Content-Type parameter carrying the multipart delimiter. */
    public static final String P_BOUNDARY = "boundary";

    /** Prefix of every generated multipart boundary token. */
    public static final String BOUNDARY_PREFIX = "snap-boundary-";

    /** Type assumed for uploads whose filename has no known extension. */
    public static final String CT_OCTET_STREAM = "application/octet-stream";
}
