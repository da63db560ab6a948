package io.quarkiverse.stickyheader.server;

/**
 * The origin service requests are forwarded to once stickiness has been resolved.
 */
public class ServiceConfig {
    private final String name;
    private final String host;
    private final int port;
    private final boolean ssl;

    public ServiceConfig(String name, String host, int port, boolean ssl) {
        this.name = name;
        this.host = host;
        this.port = port;
        this.ssl = ssl;
    }

    public String getName() {
        return name;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public boolean isSsl() {
        return ssl;
    }

    @Override
    public String toString() {
        return name + " (" + (ssl ? "https" : "http") + "://" + host + ":" + port + ")";
    }
}
