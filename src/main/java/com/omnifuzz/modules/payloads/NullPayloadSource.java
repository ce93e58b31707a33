package com.omnifuzz.modules.payloads;

/**
 * {@code count} empty payloads. Useful for replaying the same request
 * (with the position text removed) a fixed number of times.
 */
public class NullPayloadSource extends AbstractPayloadSource {

    private final long count;

    public NullPayloadSource(String id, long count) {
        super(id, PayloadSourceKind.NULL);
        if (count < 0) {
            throw new IllegalArgumentException("Null payload count must be >= 0, got " + count);
        }
        this.count = count;
    }

    @Override
    public long size() {
        return count;
    }

    @Override
    protected String compute(long index) {
        return "";
    }
}
