package com.omnifuzz.model;

import java.util.Objects;

/**
 * Where a materialized request is sent.
 */
public class HttpTarget {

    private final String host;
    private final int port;
    private final boolean secure;

    public HttpTarget(String host, int port, boolean secure) {
        this.host = Objects.requireNonNull(host, "host is required");
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Invalid port: " + port);
        }
        this.port = port;
        this.secure = secure;
    }

    /**
     * Parses a Host header value ("example.com" or "example.com:8443").
     * An explicit port of 443 implies TLS; otherwise {@code secure} decides.
     */
    public static HttpTarget fromHostHeader(String hostHeader, boolean secure) {
        String value = hostHeader.trim();
        int colon = value.lastIndexOf(':');
        if (colon > 0 && value.indexOf(']') < colon) {
            int port = Integer.parseInt(value.substring(colon + 1).trim());
            return new HttpTarget(value.substring(0, colon), port, secure || port == 443);
        }
        return new HttpTarget(value, secure ? 443 : 80, secure);
    }

    public String getHost() { return host; }
    public int getPort() { return port; }
    public boolean isSecure() { return secure; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HttpTarget that = (HttpTarget) o;
        return port == that.port && secure == that.secure && host.equals(that.host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port, secure);
    }

    @Override
    public String toString() {
        return (secure ? "https://" : "http://") + host + ":" + port;
    }
}
