package com.omnifuzz.modules.payloads;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Every string over {@code charset} with length in [minLength, maxLength].
 * Shorter strings come first; within one length the last character varies
 * fastest. Payloads are computed from the index, never enumerated.
 */
public class BruteForceSource extends AbstractPayloadSource {

    private final char[] charset;
    private final int minLength;
    private final int maxLength;
    // countsByLength[i] = charset.length ^ (minLength + i)
    private final long[] countsByLength;
    private final long total;

    public BruteForceSource(String id, String charset, int minLength, int maxLength) {
        super(id, PayloadSourceKind.BRUTE_FORCE);
        this.charset = distinct(charset);
        if (this.charset.length == 0) {
            throw new IllegalArgumentException("Brute force charset must not be empty");
        }
        if (minLength < 0 || maxLength < minLength) {
            throw new IllegalArgumentException("Invalid brute force length range " + minLength + ".." + maxLength);
        }
        this.minLength = minLength;
        this.maxLength = maxLength;
        this.countsByLength = new long[maxLength - minLength + 1];
        long sum = 0;
        try {
            for (int len = minLength; len <= maxLength; len++) {
                long n = 1;
                for (int i = 0; i < len; i++) {
                    n = Math.multiplyExact(n, this.charset.length);
                }
                countsByLength[len - minLength] = n;
                sum = Math.addExact(sum, n);
            }
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Brute force space over " + this.charset.length
                    + " characters up to length " + maxLength + " is too large", e);
        }
        this.total = sum;
    }

    private static char[] distinct(String charset) {
        Set<Character> seen = new LinkedHashSet<>();
        for (char c : charset.toCharArray()) {
            seen.add(c);
        }
        char[] out = new char[seen.size()];
        int i = 0;
        for (char c : seen) {
            out[i++] = c;
        }
        return out;
    }

    public int getMinLength() { return minLength; }
    public int getMaxLength() { return maxLength; }

    @Override
    public long size() {
        return total;
    }

    @Override
    protected String compute(long index) {
        long remaining = index;
        int length = minLength;
        for (long count : countsByLength) {
            if (remaining < count) break;
            remaining -= count;
            length++;
        }
        char[] out = new char[length];
        int radix = charset.length;
        for (int i = length - 1; i >= 0; i--) {
            out[i] = charset[(int) (remaining % radix)];
            remaining /= radix;
        }
        return new String(out);
    }
}
