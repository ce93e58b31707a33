package com.omnifuzz.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One request to be sent: which processed payload goes into which position.
 * Positions absent from {@link #getPayloadsByPosition()} keep their template text.
 */
public class RequestPlan {

    private final long requestNumber;
    private final Map<String, String> payloadsByPosition;
    private final Map<String, String> rawPayloads;
    private final String encodingError;

    private RequestPlan(long requestNumber, Map<String, String> payloadsByPosition,
                        Map<String, String> rawPayloads, String encodingError) {
        this.requestNumber = requestNumber;
        this.payloadsByPosition = Collections.unmodifiableMap(new LinkedHashMap<>(payloadsByPosition));
        this.rawPayloads = Collections.unmodifiableMap(new LinkedHashMap<>(rawPayloads));
        this.encodingError = encodingError;
    }

    public static RequestPlan of(long requestNumber, Map<String, String> processed, Map<String, String> raw) {
        return new RequestPlan(requestNumber, processed, raw, null);
    }

    /** A plan whose payload could not be processed; it is recorded but never sent. */
    public static RequestPlan failed(long requestNumber, Map<String, String> raw, String encodingError) {
        return new RequestPlan(requestNumber, Map.of(), raw, encodingError);
    }

    public long getRequestNumber() { return requestNumber; }
    public Map<String, String> getPayloadsByPosition() { return payloadsByPosition; }
    public Map<String, String> getRawPayloads() { return rawPayloads; }
    public String getEncodingError() { return encodingError; }

    public boolean hasEncodingError() { return encodingError != null; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RequestPlan that = (RequestPlan) o;
        return requestNumber == that.requestNumber
                && payloadsByPosition.equals(that.payloadsByPosition)
                && rawPayloads.equals(that.rawPayloads)
                && Objects.equals(encodingError, that.encodingError);
    }

    @Override
    public int hashCode() {
        return Objects.hash(requestNumber, payloadsByPosition, rawPayloads, encodingError);
    }

    @Override
    public String toString() {
        return "#" + requestNumber + " " + (encodingError != null ? "ENCODING ERROR " + encodingError : payloadsByPosition);
    }
}
