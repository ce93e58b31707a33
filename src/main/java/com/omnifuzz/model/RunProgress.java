package com.omnifuzz.model;

/**
 * Snapshot of a run's progress. {@code total} can shrink during a
 * recursive-grep run when the extraction chain ends early.
 */
public class RunProgress {

    private final long completed;
    private final long total;
    private final RunStatus status;

    public RunProgress(long completed, long total, RunStatus status) {
        this.completed = completed;
        this.total = total;
        this.status = status;
    }

    public long getCompleted() { return completed; }
    public long getTotal() { return total; }
    public RunStatus getStatus() { return status; }

    public int percent() {
        if (total <= 0) return status.isTerminal() ? 100 : 0;
        return (int) Math.min(100, completed * 100 / total);
    }

    @Override
    public String toString() {
        return completed + "/" + total + " (" + status + ")";
    }
}
