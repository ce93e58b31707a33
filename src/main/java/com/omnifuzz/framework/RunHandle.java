package com.omnifuzz.framework;

import com.omnifuzz.model.AttackConfiguration;
import com.omnifuzz.model.RunProgress;
import com.omnifuzz.model.RunStatus;

import java.util.concurrent.TimeUnit;

/**
 * Reference to a started run. Obtained from {@link AttackEngine#start}; all
 * control goes through the engine.
 */
public class RunHandle {

    private final String id;
    private final AttackConfiguration configuration;
    private final AttackScheduler scheduler;
    private final ResultStore store;
    private final long startedAt;

    RunHandle(String id, AttackConfiguration configuration, AttackScheduler scheduler, ResultStore store) {
        this.id = id;
        this.configuration = configuration;
        this.scheduler = scheduler;
        this.store = store;
        this.startedAt = System.currentTimeMillis();
    }

    public String getId() { return id; }
    public AttackConfiguration getConfiguration() { return configuration; }
    public long getStartedAt() { return startedAt; }

    public RunStatus getStatus() {
        return scheduler.getStatus();
    }

    public RunProgress progress() {
        return scheduler.progress();
    }

    /**
     * Waits until the run is terminal and every in-flight send has been recorded.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return scheduler.awaitTermination(timeout, unit);
    }

    public boolean isTerminated() {
        return scheduler.isTerminated();
    }

    AttackScheduler scheduler() {
        return scheduler;
    }

    ResultStore store() {
        return store;
    }

    @Override
    public String toString() {
        return "Run " + id + " [" + scheduler.getStatus() + "] " + configuration;
    }
}
