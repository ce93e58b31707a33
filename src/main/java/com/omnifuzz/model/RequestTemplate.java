package com.omnifuzz.model;

import java.util.Objects;

/**
 * The immutable base request an attack substitutes payloads into: request line,
 * header block, blank line and body as one string, plus an optional target.
 */
public class RequestTemplate {

    private final String text;
    private final HttpTarget target;

    public RequestTemplate(String text, HttpTarget target) {
        this.text = Objects.requireNonNull(text, "text is required");
        this.target = target;
    }

    public static RequestTemplate of(String text) {
        return new RequestTemplate(text, null);
    }

    public String getText() { return text; }

    /** May be null, in which case the transport resolves the Host header. */
    public HttpTarget getTarget() { return target; }

    public int length() { return text.length(); }
}
