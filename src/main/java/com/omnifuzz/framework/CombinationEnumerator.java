package com.omnifuzz.framework;

import com.omnifuzz.model.AttackStrategy;
import com.omnifuzz.modules.payloads.PayloadSource;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Maps a plan ordinal to a payload assignment: one payload index per
 * position, or {@link #KEEP_ORIGINAL} where the template text stays.
 *
 * <p>Assignments are a pure function of the ordinal, so every
 * {@link #iterator()} is a fresh, restartable pass in the same order:
 * <ul>
 *   <li>rotate: position-major, then payload index</li>
 *   <li>broadcast: payload index, same in every position</li>
 *   <li>lockstep: index {@code j} in every position, up to the shortest source</li>
 *   <li>cartesian: odometer order, last position varying fastest</li>
 * </ul>
 */
public class CombinationEnumerator implements Iterable<long[]> {

    public static final long KEEP_ORIGINAL = -1;

    private final AttackStrategy strategy;
    private final int positionCount;
    private final long[] sizes;
    private final long total;

    public CombinationEnumerator(AttackStrategy strategy, int positionCount, List<PayloadSource> sources) {
        if (positionCount < 1) {
            throw new IllegalArgumentException("At least one position is required");
        }
        int expectedSources = strategy.isSingleSource() ? 1 : positionCount;
        if (sources.size() != expectedSources) {
            throw new IllegalArgumentException(strategy.getId() + " needs " + expectedSources
                    + " payload source(s), got " + sources.size());
        }
        this.strategy = strategy;
        this.positionCount = positionCount;
        this.sizes = new long[sources.size()];
        for (int i = 0; i < sizes.length; i++) {
            sizes[i] = sources.get(i).size();
        }
        this.total = countPlans(strategy, positionCount, sizes);
    }

    /**
     * Number of plans the strategy produces.
     *
     * @throws ArithmeticException if the count overflows a long
     */
    public static long countPlans(AttackStrategy strategy, int positionCount, long[] sourceSizes) {
        switch (strategy) {
            case SINGLE_SET_ROTATE:
                return Math.multiplyExact(positionCount, sourceSizes[0]);
            case SINGLE_SET_BROADCAST:
                return sourceSizes[0];
            case LOCKSTEP: {
                long min = Long.MAX_VALUE;
                for (long s : sourceSizes) min = Math.min(min, s);
                return sourceSizes.length == 0 ? 0 : min;
            }
            case CARTESIAN: {
                long product = 1;
                for (long s : sourceSizes) {
                    if (s == 0) return 0;
                    product = Math.multiplyExact(product, s);
                }
                return product;
            }
            default:
                throw new IllegalStateException("Unhandled strategy " + strategy);
        }
    }

    public AttackStrategy getStrategy() { return strategy; }

    public long totalPlans() {
        return total;
    }

    /**
     * Assignment for plan {@code ordinal} (0-based). Element {@code i} is the
     * payload index for position {@code i}; for rotate and broadcast it indexes
     * the single source, otherwise source {@code i}.
     */
    public long[] assignmentAt(long ordinal) {
        if (ordinal < 0 || ordinal >= total) {
            throw new IndexOutOfBoundsException("Plan ordinal " + ordinal + " out of range, total " + total);
        }
        long[] assignment = new long[positionCount];
        switch (strategy) {
            case SINGLE_SET_ROTATE: {
                Arrays.fill(assignment, KEEP_ORIGINAL);
                assignment[(int) (ordinal / sizes[0])] = ordinal % sizes[0];
                break;
            }
            case SINGLE_SET_BROADCAST:
            case LOCKSTEP:
                Arrays.fill(assignment, ordinal);
                break;
            case CARTESIAN: {
                long rest = ordinal;
                for (int i = positionCount - 1; i >= 0; i--) {
                    assignment[i] = rest % sizes[i];
                    rest /= sizes[i];
                }
                break;
            }
            default:
                throw new IllegalStateException("Unhandled strategy " + strategy);
        }
        return assignment;
    }

    @Override
    public Iterator<long[]> iterator() {
        return new Iterator<>() {
            private long next = 0;

            @Override
            public boolean hasNext() {
                return next < total;
            }

            @Override
            public long[] next() {
                if (!hasNext()) throw new NoSuchElementException();
                return assignmentAt(next++);
            }
        };
    }
}
