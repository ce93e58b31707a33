package com.omnifuzz.modules.payloads;

import java.util.Objects;

abstract class AbstractPayloadSource implements PayloadSource {

    private final String id;
    private final PayloadSourceKind kind;

    protected AbstractPayloadSource(String id, PayloadSourceKind kind) {
        this.id = Objects.requireNonNull(id, "id is required");
        this.kind = kind;
    }

    @Override
    public String getId() { return id; }

    @Override
    public PayloadSourceKind getKind() { return kind; }

    @Override
    public final String payloadAt(long index) {
        if (index < 0 || index >= size()) {
            throw new IndexOutOfBoundsException("Payload index " + index + " out of range for "
                    + kind.getId() + " source " + id + " of size " + size());
        }
        return compute(index);
    }

    /** Called with an index already known to be in range. */
    protected abstract String compute(long index);

    @Override
    public String toString() {
        return kind.getId() + ":" + id + " (" + size() + ")";
    }
}
