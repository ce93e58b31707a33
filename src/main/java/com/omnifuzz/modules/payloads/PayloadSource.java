package com.omnifuzz.modules.payloads;

/**
 * A deterministic, finite sequence of raw payload strings.
 *
 * <p>Index-addressable sources compute {@link #payloadAt(long)} as a pure
 * function of the index, so large generators (numbers, brute force) never
 * materialize their full sequence. Recursive sources are the exception: only
 * their first payload is known up front, the rest come from prior responses.
 */
public interface PayloadSource {

    String getId();

    PayloadSourceKind getKind();

    /** Number of payloads (an upper bound for recursive sources). */
    long size();

    /**
     * Payload at {@code index}, 0-based.
     *
     * @throws IndexOutOfBoundsException if index is outside [0, size())
     */
    String payloadAt(long index);

    /** True when later payloads depend on earlier responses. */
    default boolean isRecursive() {
        return false;
    }
}
