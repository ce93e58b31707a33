package com.omnifuzz.modules.payloads;

import java.util.Objects;

/**
 * Feedback source: the first payload is fixed, every later payload is the
 * value the {@code ruleId} extract rule pulled from the previous response.
 * Only the first payload is index-addressable; the rest are produced by the
 * sequential plan sequence as responses arrive.
 */
public class RecursiveGrepSource extends AbstractPayloadSource {

    private final String initialPayload;
    private final String ruleId;
    private final long maxPayloads;

    public RecursiveGrepSource(String id, String initialPayload, String ruleId, long maxPayloads) {
        super(id, PayloadSourceKind.RECURSIVE_GREP);
        this.initialPayload = initialPayload != null ? initialPayload : "";
        this.ruleId = Objects.requireNonNull(ruleId, "ruleId is required");
        if (maxPayloads < 0) {
            throw new IllegalArgumentException("maxPayloads must be >= 0, got " + maxPayloads);
        }
        this.maxPayloads = maxPayloads;
    }

    public String getInitialPayload() { return initialPayload; }

    /** Id of the extract grep rule whose value feeds the next payload. */
    public String getRuleId() { return ruleId; }

    @Override
    public long size() {
        return maxPayloads;
    }

    @Override
    public boolean isRecursive() {
        return true;
    }

    @Override
    protected String compute(long index) {
        if (index == 0) return initialPayload;
        throw new UnsupportedOperationException("Payload " + index + " of recursive source " + getId()
                + " depends on the previous response");
    }
}
