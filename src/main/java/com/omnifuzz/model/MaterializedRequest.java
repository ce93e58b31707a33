package com.omnifuzz.model;

import java.util.Collections;
import java.util.List;

/**
 * A concrete request produced from the template. Shares no mutable state with it.
 */
public class MaterializedRequest {

    private final String method;
    private final String url;
    private final String httpVersion;
    private final List<HeaderField> headers;
    private final String body;
    private final String raw;
    private final HttpTarget target;

    public MaterializedRequest(String method, String url, String httpVersion, List<HeaderField> headers,
                               String body, String raw, HttpTarget target) {
        this.method = method;
        this.url = url;
        this.httpVersion = httpVersion;
        this.headers = headers != null ? Collections.unmodifiableList(List.copyOf(headers)) : Collections.emptyList();
        this.body = body != null ? body : "";
        this.raw = raw;
        this.target = target;
    }

    public String getMethod() { return method; }
    public String getUrl() { return url; }
    public String getHttpVersion() { return httpVersion; }
    public List<HeaderField> getHeaders() { return headers; }
    public String getBody() { return body; }
    public String getRaw() { return raw; }
    public HttpTarget getTarget() { return target; }

    /** First header with this name (case-insensitive), or null. */
    public String header(String name) {
        for (HeaderField h : headers) {
            if (h.getName().equalsIgnoreCase(name)) return h.getValue();
        }
        return null;
    }

    @Override
    public String toString() {
        return method + " " + url;
    }
}
