package io.github.clickin.requestbuilder.core;

import java.util.Objects;

/**
 * Connection-level fields stamped onto every built request.
 *
 * <p>None of these influence body encoding; they exist so handlers that inspect the server
 * or peer address see plausible values. Defaults describe a plain HTTP/1.1 request from
 * {@code 127.0.0.1} to {@code localhost:80}.
 */
public final class ServerDefaults {
    private static final ServerDefaults DEFAULTS = builder().build();

    private final String serverName;
    private final int serverPort;
    private final String remoteAddress;
    private final int remotePort;
    private final String localAddress;
    private final int localPort;
    private final String localHostname;
    private final HttpVersion version;
    private final String contextPath;
    private final String pathInfo;

    private ServerDefaults(Builder b) {
        this.serverName = b.serverName;
        this.serverPort = b.serverPort;
        this.remoteAddress = b.remoteAddress;
        this.remotePort = b.remotePort;
        this.localAddress = b.localAddress;
        this.localPort = b.localPort;
        this.localHostname = b.localHostname;
        this.version = b.version;
        this.contextPath = b.contextPath;
        this.pathInfo = b.pathInfo;
    }

    public static ServerDefaults defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String serverName() { return serverName; }
    public int serverPort() { return serverPort; }
    public String remoteAddress() { return remoteAddress; }
    public int remotePort() { return remotePort; }
    public String localAddress() { return localAddress; }
    public int localPort() { return localPort; }
    public String localHostname() { return localHostname; }
    public HttpVersion version() { return version; }
    public String contextPath() { return contextPath; }
    public String pathInfo() { return pathInfo; }

    public Builder toBuilder() {
        return new Builder()
                .serverName(serverName)
                .serverPort(serverPort)
                .remoteAddress(remoteAddress)
                .remotePort(remotePort)
                .localAddress(localAddress)
                .localPort(localPort)
                .localHostname(localHostname)
                .version(version)
                .contextPath(contextPath)
                .pathInfo(pathInfo);
    }

    public static final class Builder {
        private String serverName = "localhost";
        private int serverPort = 80;
        private String remoteAddress = "127.0.0.1";
        private int remotePort = 80;
        private String localAddress = "127.0.0.1";
        private int localPort = 80;
        private String localHostname = "localhost";
        private HttpVersion version = HttpVersion.HTTP_1_1;
        private String contextPath = "";
        private String pathInfo = "";

        private Builder() {}

        public Builder serverName(String serverName) {
            this.serverName = Objects.requireNonNull(serverName, "serverName");
            return this;
        }

        public Builder serverPort(int serverPort) {
            this.serverPort = port(serverPort, "serverPort");
            return this;
        }

        public Builder remoteAddress(String remoteAddress) {
            this.remoteAddress = Objects.requireNonNull(remoteAddress, "remoteAddress");
            return this;
        }

        public Builder remotePort(int remotePort) {
            this.remotePort = port(remotePort, "remotePort");
            return this;
        }

        public Builder localAddress(String localAddress) {
            this.localAddress = Objects.requireNonNull(localAddress, "localAddress");
            return this;
        }

        public Builder localPort(int localPort) {
            this.localPort = port(localPort, "localPort");
            return this;
        }

        public Builder localHostname(String localHostname) {
            this.localHostname = Objects.requireNonNull(localHostname, "localHostname");
            return this;
        }

        public Builder version(HttpVersion version) {
            this.version = Objects.requireNonNull(version, "version");
            return this;
        }

        public Builder contextPath(String contextPath) {
            this.contextPath = Objects.requireNonNull(contextPath, "contextPath");
            return this;
        }

        public Builder pathInfo(String pathInfo) {
            this.pathInfo = Objects.requireNonNull(pathInfo, "pathInfo");
            return this;
        }

        public ServerDefaults build() {
            return new ServerDefaults(this);
        }

        private static int port(int port, String name) {
            if (port < 0 || port > 65535) throw new IllegalArgumentException(name + " must be within 0..65535");
            return port;
        }
    }
}
