package com.omnifuzz.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Aggregate view over a run's results.
 */
public class AttackSummary {

    private final long totalResults;
    private final long errorCount;
    private final Map<Integer, Long> statusCounts;
    private final Map<String, Long> matchCounts;
    private final Map<String, Set<String>> distinctExtractions;

    public AttackSummary(long totalResults, long errorCount, Map<Integer, Long> statusCounts,
                         Map<String, Long> matchCounts, Map<String, Set<String>> distinctExtractions) {
        this.totalResults = totalResults;
        this.errorCount = errorCount;
        this.statusCounts = Collections.unmodifiableMap(new TreeMap<>(statusCounts));
        this.matchCounts = Collections.unmodifiableMap(new LinkedHashMap<>(matchCounts));
        this.distinctExtractions = Collections.unmodifiableMap(new LinkedHashMap<>(distinctExtractions));
    }

    public long getTotalResults() { return totalResults; }
    public long getErrorCount() { return errorCount; }

    /** Status code to number of responses, in ascending status order. */
    public Map<Integer, Long> getStatusCounts() { return statusCounts; }

    /** Rule id to number of results where the match rule fired. */
    public Map<String, Long> getMatchCounts() { return matchCounts; }

    /** Rule id to the distinct values extracted, in first-seen request order. */
    public Map<String, Set<String>> getDistinctExtractions() { return distinctExtractions; }

    @Override
    public String toString() {
        return totalResults + " results, " + errorCount + " errors, status " + statusCounts;
    }
}
