package com.omnifuzz.model;

/**
 * Dispatch policy for a run: how many sends may be in flight, and the pause
 * between successive admissions when throttling is enabled.
 */
public class Throttle {

    private final boolean enabled;
    private final long delayMs;
    private final int maxConcurrent;

    public Throttle(boolean enabled, long delayMs, int maxConcurrent) {
        this.enabled = enabled;
        this.delayMs = delayMs;
        this.maxConcurrent = maxConcurrent;
    }

    /** Fully sequential, no delay. */
    public static Throttle sequential() {
        return new Throttle(false, 0, 1);
    }

    public static Throttle concurrent(int maxConcurrent) {
        return new Throttle(false, 0, maxConcurrent);
    }

    public static Throttle delayed(long delayMs, int maxConcurrent) {
        return new Throttle(true, delayMs, maxConcurrent);
    }

    public boolean isEnabled() { return enabled; }
    public long getDelayMs() { return delayMs; }
    public int getMaxConcurrent() { return maxConcurrent; }

    /** Same policy with maxConcurrent forced to 1. */
    public Throttle singleInFlight() {
        return maxConcurrent == 1 ? this : new Throttle(enabled, delayMs, 1);
    }

    @Override
    public String toString() {
        return "Throttle{maxConcurrent=" + maxConcurrent
                + (enabled ? ", delayMs=" + delayMs : "") + "}";
    }
}
