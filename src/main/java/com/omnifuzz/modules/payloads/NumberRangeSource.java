package com.omnifuzz.modules.payloads;

import java.util.Objects;

/**
 * Sequential numbers from {@code from} towards {@code to} (inclusive) in
 * increments of {@code step}. A step pointing away from {@code to} gives an
 * empty sequence.
 */
public class NumberRangeSource extends AbstractPayloadSource {

    public enum Format {
        DECIMAL(10),
        HEX(16),
        OCTAL(8);

        private final int radix;

        Format(int radix) {
            this.radix = radix;
        }

        public int getRadix() { return radix; }
    }

    private final long from;
    private final long to;
    private final long step;
    private final Format format;
    private final int minDigits;
    private final long count;

    public NumberRangeSource(String id, long from, long to, long step, Format format, int minDigits) {
        super(id, PayloadSourceKind.NUMBERS);
        if (step == 0) {
            throw new IllegalArgumentException("Number step must not be 0");
        }
        if (minDigits < 0) {
            throw new IllegalArgumentException("minDigits must be >= 0, got " + minDigits);
        }
        this.from = from;
        this.to = to;
        this.step = step;
        this.format = Objects.requireNonNull(format, "format is required");
        this.minDigits = minDigits;
        this.count = computeCount(from, to, step);
    }

    public NumberRangeSource(String id, long from, long to, long step) {
        this(id, from, to, step, Format.DECIMAL, 0);
    }

    private static long computeCount(long from, long to, long step) {
        if ((step > 0 && from > to) || (step < 0 && from < to)) return 0;
        try {
            long span = Math.abs(Math.subtractExact(to, from));
            return Math.addExact(span / Math.abs(step), 1);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Number range " + from + ".." + to + " is too large", e);
        }
    }

    public long getFrom() { return from; }
    public long getTo() { return to; }
    public long getStep() { return step; }
    public Format getFormat() { return format; }

    @Override
    public long size() {
        return count;
    }

    @Override
    protected String compute(long index) {
        long value = from + index * step;
        // unsigned form of the negation keeps Long.MIN_VALUE's magnitude
        String digits = value < 0
                ? Long.toUnsignedString(-value, format.getRadix())
                : Long.toString(value, format.getRadix());
        StringBuilder sb = new StringBuilder(Math.max(digits.length(), minDigits) + 1);
        if (value < 0) sb.append('-');
        for (int i = digits.length(); i < minDigits; i++) {
            sb.append('0');
        }
        return sb.append(digits).toString();
    }
}
