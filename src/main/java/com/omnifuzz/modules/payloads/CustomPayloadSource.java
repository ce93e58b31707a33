package com.omnifuzz.modules.payloads;

import java.util.Objects;
import java.util.function.LongFunction;

/**
 * Caller-supplied generator. The function must be pure: the same index
 * always yields the same payload.
 */
public class CustomPayloadSource extends AbstractPayloadSource {

    private final long size;
    private final LongFunction<String> generator;

    public CustomPayloadSource(String id, long size, LongFunction<String> generator) {
        super(id, PayloadSourceKind.CUSTOM);
        if (size < 0) {
            throw new IllegalArgumentException("Custom source size must be >= 0, got " + size);
        }
        this.size = size;
        this.generator = Objects.requireNonNull(generator, "generator is required");
    }

    @Override
    public long size() {
        return size;
    }

    @Override
    protected String compute(long index) {
        String payload = generator.apply(index);
        return payload != null ? payload : "";
    }
}
