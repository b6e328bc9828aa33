package io.github.clickin.requestbuilder.core;

/**
 * Protocol version of a built request.
 *
 * @param major major version number
 * @param minor minor version number
 */
public record HttpVersion(int major, int minor) {

    public static final HttpVersion HTTP_1_0 = new HttpVersion(1, 0);
    public static final HttpVersion HTTP_1_1 = new HttpVersion(1, 1);

    public HttpVersion {
        if (major < 0) throw new IllegalArgumentException("major must be >= 0");
        if (minor < 0) throw new IllegalArgumentException("minor must be >= 0");
    }

    @Override
    public String toString() {
        return "HTTP/" + major + "." + minor;
    }
}
