package com.omnifuzz.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one request plan. Built once when the response (or error) is
 * known and never mutated afterwards; ordered by request number, not arrival.
 */
public class AttackResult {

    public enum ErrorKind {
        ENCODING,
        TRANSPORT
    }

    private final long requestNumber;
    private final Map<String, String> payloads;
    private final Integer statusCode;
    private final Integer length;
    private final Long elapsedMs;
    private final String error;
    private final ErrorKind errorKind;
    private final Map<String, Boolean> matches;
    private final Map<String, String> extractions;
    private final String rawRequest;
    private final String rawResponse;

    private AttackResult(Builder builder) {
        this.requestNumber = builder.requestNumber;
        this.payloads = Collections.unmodifiableMap(new LinkedHashMap<>(builder.payloads));
        this.statusCode = builder.statusCode;
        this.length = builder.length;
        this.elapsedMs = builder.elapsedMs;
        this.error = builder.error;
        this.errorKind = builder.errorKind;
        this.matches = Collections.unmodifiableMap(new LinkedHashMap<>(builder.matches));
        this.extractions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.extractions));
        this.rawRequest = builder.rawRequest;
        this.rawResponse = builder.rawResponse;
    }

    public long getRequestNumber() { return requestNumber; }

    /** Raw payloads keyed by position id, before processing; the processed form is in the raw request. */
    public Map<String, String> getPayloads() { return payloads; }
    public Integer getStatusCode() { return statusCode; }
    public Integer getLength() { return length; }
    public Long getElapsedMs() { return elapsedMs; }
    public String getError() { return error; }
    public ErrorKind getErrorKind() { return errorKind; }
    public Map<String, Boolean> getMatches() { return matches; }
    public Map<String, String> getExtractions() { return extractions; }
    public String getRawRequest() { return rawRequest; }
    public String getRawResponse() { return rawResponse; }

    public boolean hasError() { return error != null; }
    public boolean hasResponse() { return rawResponse != null; }

    public boolean matched(String ruleId) {
        return Boolean.TRUE.equals(matches.get(ruleId));
    }

    public static Builder builder(long requestNumber) {
        return new Builder(requestNumber);
    }

    @Override
    public String toString() {
        return "#" + requestNumber + " " + payloads
                + (error != null ? " error=" + error : " status=" + statusCode + " length=" + length);
    }

    public static class Builder {
        private final long requestNumber;
        private Map<String, String> payloads = Map.of();
        private Integer statusCode;
        private Integer length;
        private Long elapsedMs;
        private String error;
        private ErrorKind errorKind;
        private Map<String, Boolean> matches = Map.of();
        private Map<String, String> extractions = Map.of();
        private String rawRequest = "";
        private String rawResponse;

        private Builder(long requestNumber) {
            this.requestNumber = requestNumber;
        }

        public Builder payloads(Map<String, String> p) { this.payloads = p != null ? p : Map.of(); return this; }
        public Builder statusCode(Integer s) { this.statusCode = s; return this; }
        public Builder length(Integer l) { this.length = l; return this; }
        public Builder elapsedMs(Long e) { this.elapsedMs = e; return this; }
        public Builder matches(Map<String, Boolean> m) { this.matches = m != null ? m : Map.of(); return this; }
        public Builder extractions(Map<String, String> e) { this.extractions = e != null ? e : Map.of(); return this; }
        public Builder rawRequest(String r) { this.rawRequest = r != null ? r : ""; return this; }
        public Builder rawResponse(String r) { this.rawResponse = r; return this; }

        public Builder error(ErrorKind kind, String message) {
            this.errorKind = kind;
            this.error = message;
            return this;
        }

        public AttackResult build() {
            return new AttackResult(this);
        }
    }
}
