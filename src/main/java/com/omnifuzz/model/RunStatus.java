package com.omnifuzz.model;

public enum RunStatus {
    CONFIGURING,
    RUNNING,
    PAUSED,
    COMPLETED,
    STOPPED;

    public boolean isTerminal() {
        return this == COMPLETED || this == STOPPED;
    }
}
