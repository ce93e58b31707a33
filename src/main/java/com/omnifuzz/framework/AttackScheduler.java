package com.omnifuzz.framework;

import com.omnifuzz.model.AttackConfiguration;
import com.omnifuzz.model.AttackResult;
import com.omnifuzz.model.MaterializedRequest;
import com.omnifuzz.model.ModuleConfig;
import com.omnifuzz.model.RequestPlan;
import com.omnifuzz.model.RunProgress;
import com.omnifuzz.model.RunStatus;
import com.omnifuzz.model.Throttle;
import com.omnifuzz.model.TransportException;
import com.omnifuzz.model.TransportResponse;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Runs one attack. A single admission thread pulls plans and hands them to a
 * fixed pool of worker threads; a semaphore caps the sends in flight at
 * {@code maxConcurrent}. Workers block on the transport and write their result
 * into the store before giving the permit back, so the run is complete once
 * every permit has been returned.
 *
 * <p>Pause stops admissions and lets in-flight sends finish. Stop does the same
 * and discards the remaining plans. Workers are never interrupted by either.
 */
public class AttackScheduler {

    private final String runId;
    private final Transport transport;
    private final RequestTemplater templater;
    private final GrepEvaluator grepEvaluator;
    private final PlanSequence plans;
    private final ResultStore store;
    private final int maxConcurrent;
    private final long delayMs;

    private final Semaphore permits;
    private final ThreadPoolExecutor workers;
    private final AtomicReference<RunStatus> status = new AtomicReference<>(RunStatus.CONFIGURING);
    private final ReentrantLock pauseLock = new ReentrantLock();
    private final Condition resumed = pauseLock.newCondition();
    private final CountDownLatch terminated = new CountDownLatch(1);
    private volatile Thread admissionThread;

    private volatile Consumer<String> logger;
    private volatile Consumer<String> errorLogger;

    public AttackScheduler(String runId, AttackConfiguration config, Transport transport,
                           ResultStore store, ModuleConfig settings) {
        this.runId = runId;
        this.transport = transport;
        this.store = store;
        this.templater = new RequestTemplater(config.getTemplate(), config.getPositions(),
                settings.getBool(ModuleConfig.UPDATE_CONTENT_LENGTH, true));
        this.grepEvaluator = config.getGrepEvaluator();
        this.plans = PlanSequence.forConfiguration(config);

        Throttle throttle = config.effectiveThrottle();
        int cap = Math.max(1, settings.getInt(ModuleConfig.MAX_CONCURRENT_CAP, Integer.MAX_VALUE));
        this.maxConcurrent = Math.min(throttle.getMaxConcurrent(), cap);
        this.delayMs = throttle.isEnabled() ? throttle.getDelayMs() : 0;

        this.permits = new Semaphore(maxConcurrent);
        this.workers = new ThreadPoolExecutor(
                maxConcurrent, maxConcurrent, 60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                r -> {
                    Thread t = new Thread(r, "OmniFuzz-Attack-" + runId);
                    t.setDaemon(true);
                    return t;
                });
    }

    /** Sets the logger for run lifecycle messages (routes to api.logging().logToOutput()). */
    public void setLogger(Consumer<String> logger) {
        this.logger = logger;
    }

    public void setErrorLogger(Consumer<String> errorLogger) {
        this.errorLogger = errorLogger;
    }

    public String getRunId() {
        return runId;
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public RunStatus getStatus() {
        return status.get();
    }

    public RunProgress progress() {
        return new RunProgress(store.getCompletedCount(), plans.expectedTotal(), status.get());
    }

    /**
     * Moves the run to RUNNING and starts admitting plans.
     *
     * @throws IllegalStateException if the run was already started
     */
    public void start() {
        Thread t;
        pauseLock.lock();
        try {
            if (!status.compareAndSet(RunStatus.CONFIGURING, RunStatus.RUNNING)) {
                throw new IllegalStateException("Run " + runId + " already started");
            }
            t = new Thread(this::admitAll, "OmniFuzz-Admission-" + runId);
            t.setDaemon(true);
            admissionThread = t;
        } finally {
            pauseLock.unlock();
        }
        log("Run " + runId + " started: " + plans.expectedTotal() + " request(s), maxConcurrent="
                + maxConcurrent + (delayMs > 0 ? ", delayMs=" + delayMs : ""));
        t.start();
    }

    /** Returns false when the run is not RUNNING. */
    public boolean pause() {
        return transition(RunStatus.RUNNING, RunStatus.PAUSED);
    }

    /** Returns false when the run is not PAUSED. */
    public boolean resume() {
        return transition(RunStatus.PAUSED, RunStatus.RUNNING);
    }

    /**
     * Stops admitting plans. In-flight sends complete and are recorded; the run
     * reaches STOPPED at once and terminates when they have drained.
     * Returns false when the run is already terminal.
     */
    public boolean stop() {
        Thread t;
        pauseLock.lock();
        try {
            boolean stopped = transition(RunStatus.RUNNING, RunStatus.STOPPED)
                    || transition(RunStatus.PAUSED, RunStatus.STOPPED)
                    || transition(RunStatus.CONFIGURING, RunStatus.STOPPED);
            if (!stopped) return false;
            t = admissionThread;
        } finally {
            pauseLock.unlock();
        }
        if (t != null) {
            t.interrupt();
        } else {
            finishRun();
        }
        return true;
    }

    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return terminated.await(timeout, unit);
    }

    public boolean isTerminated() {
        return terminated.getCount() == 0;
    }

    /** Interrupts any worker still blocked in the transport. Used on extension unload only. */
    public void shutdownNow() {
        stop();
        List<Runnable> notRun = workers.shutdownNow();
        permits.release(notRun.size());
    }

    private boolean transition(RunStatus from, RunStatus to) {
        pauseLock.lock();
        try {
            if (!status.compareAndSet(from, to)) {
                return false;
            }
            resumed.signalAll();
            return true;
        } finally {
            pauseLock.unlock();
        }
    }

    /** Blocks while paused. True when admission may continue. */
    private boolean awaitRunnable() throws InterruptedException {
        pauseLock.lock();
        try {
            while (status.get() == RunStatus.PAUSED) {
                resumed.await();
            }
            return status.get() == RunStatus.RUNNING;
        } finally {
            pauseLock.unlock();
        }
    }

    private void admitAll() {
        AttackResult previous = null;
        boolean first = true;
        try {
            while (awaitRunnable()) {
                RequestPlan plan = plans.next(previous);
                if (plan == null) break;

                if (plan.hasEncodingError()) {
                    AttackResult failed = AttackResult.builder(plan.getRequestNumber())
                            .payloads(plan.getRawPayloads())
                            .error(AttackResult.ErrorKind.ENCODING, plan.getEncodingError())
                            .build();
                    store.record(failed);
                    previous = failed;
                    continue;
                }

                if (!first && delayMs > 0) {
                    Thread.sleep(delayMs);
                    if (!awaitRunnable()) break;
                }
                first = false;

                permits.acquire();
                boolean admit;
                try {
                    // a pause may have arrived while waiting for the permit
                    admit = awaitRunnable();
                } catch (InterruptedException e) {
                    permits.release();
                    throw e;
                }
                if (!admit) {
                    permits.release();
                    break;
                }
                Future<AttackResult> future;
                try {
                    future = workers.submit(() -> dispatch(plan));
                } catch (RejectedExecutionException e) {
                    permits.release();
                    logError("Worker pool rejected request " + plan.getRequestNumber() + "; run ends early");
                    break;
                }
                if (plans.requiresFeedback()) {
                    previous = future.get();
                }
            }
        } catch (InterruptedException e) {
            // stop() wakes the admission thread this way; the drain below still waits for workers
            if (status.get() != RunStatus.STOPPED) {
                logError("Admission thread for run " + runId + " interrupted unexpectedly");
                transition(RunStatus.RUNNING, RunStatus.STOPPED);
                transition(RunStatus.PAUSED, RunStatus.STOPPED);
            }
        } catch (ExecutionException | RuntimeException e) {
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            logError("Run " + runId + " aborted: " + cause.getClass().getName() + ": " + cause.getMessage());
            transition(RunStatus.RUNNING, RunStatus.STOPPED);
            transition(RunStatus.PAUSED, RunStatus.STOPPED);
        } finally {
            finishRun();
        }
    }

    private AttackResult dispatch(RequestPlan plan) {
        try {
            AttackResult result = execute(plan);
            store.record(result);
            return result;
        } finally {
            permits.release();
        }
    }

    private AttackResult execute(RequestPlan plan) {
        AttackResult.Builder builder = AttackResult.builder(plan.getRequestNumber())
                .payloads(plan.getRawPayloads());
        try {
            MaterializedRequest request = templater.materialize(plan);
            builder.rawRequest(request.getRaw());
            TransportResponse response = transport.send(request);
            String raw = response.getRaw();
            GrepEvaluator.Outcome outcome = grepEvaluator.evaluate(raw);
            builder.statusCode(response.getStatusCode())
                    .length(response.rawLength())
                    .elapsedMs(response.getElapsedMs() >= 0 ? response.getElapsedMs() : null)
                    .rawResponse(raw)
                    .matches(outcome.getMatches())
                    .extractions(outcome.getExtractions());
        } catch (TransportException e) {
            builder.error(AttackResult.ErrorKind.TRANSPORT, e.getErrorType() + ": " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            builder.error(AttackResult.ErrorKind.TRANSPORT, "Interrupted while waiting for response");
        } catch (Throwable t) {
            logError("Request " + plan.getRequestNumber() + " failed: " + t.getClass().getName()
                    + ": " + t.getMessage());
            builder.error(AttackResult.ErrorKind.TRANSPORT, t.getClass().getSimpleName() + ": " + t.getMessage());
        }
        return builder.build();
    }

    private void finishRun() {
        permits.acquireUninterruptibly(maxConcurrent);
        permits.release(maxConcurrent);
        if (!transition(RunStatus.RUNNING, RunStatus.COMPLETED)) {
            transition(RunStatus.PAUSED, RunStatus.COMPLETED);
        }
        workers.shutdown();
        RunStatus finalStatus = status.get();
        store.finish(finalStatus);
        terminated.countDown();
        log("Run " + runId + " " + finalStatus + ": " + store.getCompletedCount() + " result(s)");
    }

    private void log(String message) {
        Consumer<String> log = logger;
        if (log != null) {
            log.accept("[AttackScheduler] " + message);
        }
    }

    private void logError(String message) {
        Consumer<String> log = errorLogger;
        if (log != null) {
            log.accept("[AttackScheduler] " + message);
        }
    }
}
