package com.omnifuzz.framework;

import com.omnifuzz.model.AttackResult;
import com.omnifuzz.model.AttackSummary;
import com.omnifuzz.model.RunStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Results of one run, keyed by request number. Each slot is written exactly
 * once by the worker that owns that request; readers get sorted snapshots.
 * Listener notifications fire outside the critical section.
 */
public class ResultStore {

    private final ConcurrentHashMap<Long, AttackResult> slots = new ConcurrentHashMap<>();
    private final AtomicLong completed = new AtomicLong();
    private final CopyOnWriteArrayList<Registration> listeners = new CopyOnWriteArrayList<>();
    private volatile RunStatus finishedWith;
    private volatile Consumer<String> errorLogger;

    public void setErrorLogger(Consumer<String> logger) {
        this.errorLogger = logger;
    }

    /**
     * Writes a result into its slot.
     *
     * @throws IllegalStateException if the slot already holds a result
     */
    public void record(AttackResult result) {
        synchronized (this) {
            if (slots.putIfAbsent(result.getRequestNumber(), result) != null) {
                throw new IllegalStateException("Result slot " + result.getRequestNumber() + " already written");
            }
            completed.incrementAndGet();
        }
        for (Registration r : listeners) {
            r.deliver(result);
        }
    }

    /**
     * Registers a listener and replays everything already stored (in request
     * number order), then the terminal status if the run is over. Each result
     * reaches a listener at most once.
     */
    public void addListener(ResultListener listener) {
        if (listener == null) return;
        Registration registration = new Registration(listener);
        List<AttackResult> snapshot;
        synchronized (this) {
            listeners.add(registration);
            snapshot = getResults();
        }
        for (AttackResult result : snapshot) {
            registration.deliver(result);
        }
        // finish() skips registrations still replaying; the terminal status is delivered here instead
        registration.replayed = true;
        RunStatus finished = finishedWith;
        if (finished != null) {
            registration.finish(finished);
        }
    }

    public void removeListener(ResultListener listener) {
        listeners.removeIf(r -> r.listener == listener);
    }

    /** Marks the run finished and tells every listener. Later calls are ignored. */
    public void finish(RunStatus status) {
        synchronized (this) {
            if (finishedWith != null) return;
            finishedWith = status;
        }
        for (Registration r : listeners) {
            if (r.replayed) {
                r.finish(status);
            }
        }
    }

    public boolean isFinished() {
        return finishedWith != null;
    }

    public long getCompletedCount() {
        return completed.get();
    }

    public AttackResult get(long requestNumber) {
        return slots.get(requestNumber);
    }

    /** Read-only snapshot ordered by request number. */
    public List<AttackResult> getResults() {
        List<AttackResult> results = new ArrayList<>(slots.values());
        results.sort(Comparator.comparingLong(AttackResult::getRequestNumber));
        return Collections.unmodifiableList(results);
    }

    public AttackSummary summarize() {
        long errors = 0;
        Map<Integer, Long> statusCounts = new TreeMap<>();
        Map<String, Long> matchCounts = new LinkedHashMap<>();
        Map<String, Set<String>> extractions = new LinkedHashMap<>();
        List<AttackResult> results = getResults();
        for (AttackResult r : results) {
            if (r.hasError()) errors++;
            if (r.getStatusCode() != null) {
                statusCounts.merge(r.getStatusCode(), 1L, Long::sum);
            }
            for (Map.Entry<String, Boolean> m : r.getMatches().entrySet()) {
                matchCounts.merge(m.getKey(), m.getValue() ? 1L : 0L, Long::sum);
            }
            for (Map.Entry<String, String> e : r.getExtractions().entrySet()) {
                extractions.computeIfAbsent(e.getKey(), k -> new LinkedHashSet<>()).add(e.getValue());
            }
        }
        return new AttackSummary(results.size(), errors, statusCounts, matchCounts, extractions);
    }

    private void reportListenerError(Throwable t) {
        Consumer<String> logger = errorLogger;
        if (logger != null) {
            logger.accept("[ResultStore] Listener error: " + t.getClass().getName() + ": " + t.getMessage());
        }
    }

    private final class Registration {
        private final ResultListener listener;
        private final Set<Long> delivered = ConcurrentHashMap.newKeySet();
        private final AtomicBoolean finished = new AtomicBoolean();
        private volatile boolean replayed;

        Registration(ResultListener listener) {
            this.listener = listener;
        }

        void deliver(AttackResult result) {
            if (!delivered.add(result.getRequestNumber())) return;
            try {
                listener.onResult(result);
            } catch (Throwable t) {
                reportListenerError(t);
            }
        }

        void finish(RunStatus status) {
            if (!finished.compareAndSet(false, true)) return;
            try {
                listener.onRunFinished(status);
            } catch (Throwable t) {
                reportListenerError(t);
            }
        }
    }
}
