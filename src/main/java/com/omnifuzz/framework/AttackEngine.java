package com.omnifuzz.framework;

import com.omnifuzz.model.AttackConfiguration;
import com.omnifuzz.model.AttackResult;
import com.omnifuzz.model.AttackSummary;
import com.omnifuzz.model.ConfigurationException;
import com.omnifuzz.model.ModuleConfig;
import com.omnifuzz.model.RunProgress;
import com.omnifuzz.model.Throttle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Entry point for attacks. Starts runs on a shared {@link Transport}, keeps
 * track of them by id and forwards control calls to each run's scheduler.
 * Safe to call from any thread.
 */
public class AttackEngine {

    private final Transport transport;
    private final ModuleConfig settings;
    private final Map<String, RunHandle> runs = new ConcurrentHashMap<>();
    private final AtomicLong runCounter = new AtomicLong();
    private volatile boolean shutdown = false;

    private volatile Consumer<String> logger;
    private volatile Consumer<String> errorLogger;

    public AttackEngine(Transport transport, ModuleConfig settings) {
        this.transport = transport;
        this.settings = settings != null ? settings : ModuleConfig.defaults();
    }

    public void setLogger(Consumer<String> logger) {
        this.logger = logger;
    }

    public void setErrorLogger(Consumer<String> errorLogger) {
        this.errorLogger = errorLogger;
    }

    public ModuleConfig getSettings() {
        return settings;
    }

    /** Throttle with the configured default delay, one request in flight. Applied to builders without a throttle. */
    public Throttle defaultThrottle() {
        return Throttle.delayed(Math.max(0, settings.getInt(ModuleConfig.DEFAULT_DELAY_MS, 0)), 1);
    }

    /**
     * Builds the configuration and starts it. A builder without an explicit
     * throttle gets {@link #defaultThrottle()}.
     *
     * @throws ConfigurationException if the configuration is invalid; nothing is sent
     */
    public RunHandle start(AttackConfiguration.Builder builder) throws ConfigurationException {
        if (!builder.hasThrottle()) {
            builder.throttle(defaultThrottle());
        }
        return start(builder.build());
    }

    /**
     * Starts a run for a validated configuration and returns immediately.
     *
     * @throws IllegalStateException if the engine has been shut down
     */
    public RunHandle start(AttackConfiguration config) {
        if (shutdown) {
            throw new IllegalStateException("Attack engine has been shut down");
        }
        String id = Long.toString(runCounter.incrementAndGet());
        ResultStore store = new ResultStore();
        store.setErrorLogger(errorLogger);
        AttackScheduler scheduler = new AttackScheduler(id, config, transport, store, settings);
        scheduler.setLogger(logger);
        scheduler.setErrorLogger(errorLogger);
        RunHandle handle = new RunHandle(id, config, scheduler, store);
        runs.put(id, handle);
        if (config.getThrottle().getMaxConcurrent() > scheduler.getMaxConcurrent()
                && !config.hasRecursiveSource()) {
            log("Run " + id + ": maxConcurrent " + config.getThrottle().getMaxConcurrent()
                    + " capped to " + scheduler.getMaxConcurrent());
        }
        scheduler.start();
        return handle;
    }

    public boolean pause(RunHandle handle) {
        return handle.scheduler().pause();
    }

    public boolean resume(RunHandle handle) {
        return handle.scheduler().resume();
    }

    public boolean stop(RunHandle handle) {
        return handle.scheduler().stop();
    }

    /**
     * Registers a listener for the run's results. Results already stored are
     * replayed first; each result reaches the listener once.
     */
    public void subscribeResults(RunHandle handle, ResultListener listener) {
        handle.store().addListener(listener);
    }

    public void unsubscribeResults(RunHandle handle, ResultListener listener) {
        handle.store().removeListener(listener);
    }

    public RunProgress progress(RunHandle handle) {
        return handle.progress();
    }

    /** Snapshot ordered by request number. */
    public List<AttackResult> results(RunHandle handle) {
        return handle.store().getResults();
    }

    public AttackSummary summarize(RunHandle handle) {
        return handle.store().summarize();
    }

    public RunHandle getRun(String id) {
        return runs.get(id);
    }

    public List<RunHandle> getRuns() {
        List<RunHandle> list = new ArrayList<>(runs.values());
        list.sort((a, b) -> Long.compare(Long.parseLong(a.getId()), Long.parseLong(b.getId())));
        return Collections.unmodifiableList(list);
    }

    /**
     * Forgets a terminated run and its results.
     *
     * @return false if the run is still active or unknown
     */
    public boolean remove(RunHandle handle) {
        if (!handle.isTerminated()) return false;
        return runs.remove(handle.getId(), handle);
    }

    /**
     * Stops every run and waits briefly for in-flight sends; workers still
     * blocked after that are interrupted. Called when the extension unloads.
     */
    public void shutdown() {
        shutdown = true;
        for (RunHandle handle : runs.values()) {
            handle.scheduler().stop();
        }
        for (RunHandle handle : runs.values()) {
            try {
                if (!handle.awaitTermination(5, TimeUnit.SECONDS)) {
                    logError("Run " + handle.getId() + " did not drain in time; interrupting workers");
                    handle.scheduler().shutdownNow();
                }
            } catch (InterruptedException e) {
                handle.scheduler().shutdownNow();
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private void log(String message) {
        Consumer<String> log = logger;
        if (log != null) {
            log.accept("[AttackEngine] " + message);
        }
    }

    private void logError(String message) {
        Consumer<String> log = errorLogger;
        if (log != null) {
            log.accept("[AttackEngine] " + message);
        }
    }
}
