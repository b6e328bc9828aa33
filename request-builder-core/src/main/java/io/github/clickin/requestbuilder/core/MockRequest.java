package io.github.clickin.requestbuilder.core;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Immutable in-memory HTTP request, ready to be handed to a handler under test.
 *
 * <p>{@link #contentLength()} is empty when no body was configured, which is distinct from a
 * configured body of zero bytes.
 */
public final class MockRequest {
    private final HttpMethod method;
    private final String uri;
    private final String queryString;
    private final Headers headers;
    private final byte[] body;
    private final OptionalLong contentLength;
    private final Params params;
    private final boolean secure;
    private final ServerDefaults server;

    private MockRequest(Builder b) {
        this.method = Objects.requireNonNull(b.method, "method");
        this.uri = Objects.requireNonNull(b.uri, "uri");
        this.queryString = b.queryString == null ? "" : b.queryString;
        this.headers = Headers.copyOf(b.headers == null ? Headers.create() : b.headers);
        this.body = b.body == null ? new byte[0] : b.body.clone();
        this.contentLength = b.contentLength == null ? OptionalLong.empty() : b.contentLength;
        this.params = Params.copyOf(b.params == null ? Params.create() : b.params);
        this.secure = b.secure;
        this.server = b.server == null ? ServerDefaults.defaults() : b.server;
    }

    public static Builder builder(HttpMethod method, String uri) {
        return new Builder(method, uri);
    }

    public HttpMethod method() {
        return method;
    }

    /**
     * Request URI; for GET requests with parameters this includes the encoded query string.
     *
     * @return the URI as configured, never null
     */
    public String uri() {
        return uri;
    }

    /**
     * Encoded query string derived from the parameters; empty for anything but GET.
     *
     * @return the query string without a leading {@code ?}
     */
    public String queryString() {
        return queryString;
    }

    public Headers headers() {
        return headers;
    }

    public Optional<String> header(String name) {
        return headers.firstValue(name);
    }

    /**
     * Body bytes. Empty when the request carries no body.
     *
     * @return a copy of the body
     */
    public byte[] body() {
        return body.clone();
    }

    public InputStream bodyStream() {
        return new ByteArrayInputStream(body);
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public OptionalLong contentLength() {
        return contentLength;
    }

    /**
     * Parameters exactly as configured, regardless of where they were encoded.
     *
     * @return read-only parameters
     */
    public Params params() {
        return params;
    }

    public boolean isSecure() {
        return secure;
    }

    public String serverName() { return server.serverName(); }
    public int serverPort() { return server.serverPort(); }
    public String remoteAddress() { return server.remoteAddress(); }
    public int remotePort() { return server.remotePort(); }
    public String localAddress() { return server.localAddress(); }
    public int localPort() { return server.localPort(); }
    public String localHostname() { return server.localHostname(); }
    public HttpVersion version() { return server.version(); }
    public String contextPath() { return server.contextPath(); }
    public String pathInfo() { return server.pathInfo(); }

    @Override
    public String toString() {
        return "MockRequest[" + method + " " + uri + " " + server.version()
                + ", headers=" + headers
                + ", contentLength=" + (contentLength.isPresent() ? contentLength.getAsLong() : "unset")
                + "]";
    }

    public static final class Builder {
        private final HttpMethod method;
        private final String uri;
        private String queryString;
        private Headers headers;
        private byte[] body;
        private OptionalLong contentLength;
        private Params params;
        private boolean secure;
        private ServerDefaults server;

        private Builder(HttpMethod method, String uri) {
            this.method = method;
            this.uri = uri;
        }

        public Builder queryString(String queryString) {
            this.queryString = queryString;
            return this;
        }

        public Builder headers(Headers headers) {
            this.headers = headers;
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        public Builder contentLength(OptionalLong contentLength) {
            this.contentLength = contentLength;
            return this;
        }

        public Builder params(Params params) {
            this.params = params;
            return this;
        }

        public Builder secure(boolean secure) {
            this.secure = secure;
            return this;
        }

        public Builder server(ServerDefaults server) {
            this.server = server;
            return this;
        }

        public MockRequest build() {
            return new MockRequest(this);
        }
    }
}
