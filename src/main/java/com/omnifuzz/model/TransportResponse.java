package com.omnifuzz.model;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;

/**
 * What the transport returns for one request.
 */
public class TransportResponse {

    private final int statusCode;
    private final List<HeaderField> headers;
    private final String body;
    private final long elapsedMs;
    private final String raw;

    public TransportResponse(int statusCode, List<HeaderField> headers, String body, long elapsedMs, String raw) {
        this.statusCode = statusCode;
        this.headers = headers != null ? Collections.unmodifiableList(List.copyOf(headers)) : Collections.emptyList();
        this.body = body != null ? body : "";
        this.elapsedMs = elapsedMs;
        this.raw = raw != null ? raw : render(statusCode, this.headers, this.body);
    }

    /** A response without a captured raw form; the raw text is rebuilt from its parts. */
    public static TransportResponse of(int statusCode, List<HeaderField> headers, String body, long elapsedMs) {
        return new TransportResponse(statusCode, headers, body, elapsedMs, null);
    }

    public int getStatusCode() { return statusCode; }
    public List<HeaderField> getHeaders() { return headers; }
    public String getBody() { return body; }

    /** Negative when the transport did not measure it. */
    public long getElapsedMs() { return elapsedMs; }

    /** Status line, headers, blank line and body. */
    public String getRaw() { return raw; }

    public int rawLength() {
        return raw.getBytes(StandardCharsets.UTF_8).length;
    }

    private static String render(int statusCode, List<HeaderField> headers, String body) {
        StringBuilder sb = new StringBuilder(64 + body.length());
        sb.append("HTTP/1.1 ").append(statusCode).append("\r\n");
        for (HeaderField h : headers) {
            sb.append(h.getName()).append(": ").append(h.getValue()).append("\r\n");
        }
        sb.append("\r\n").append(body);
        return sb.toString();
    }
}
