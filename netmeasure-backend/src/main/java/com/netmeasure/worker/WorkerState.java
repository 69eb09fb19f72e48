package com.netmeasure.worker;

/**
 * Lifecycle of a worker. FINISHED, STOPPED and KILLED are terminal.
 */
public enum WorkerState {
    CREATED,
    SPAWNED,
    BLOCKED,
    RUNNING,
    FINISHED,
    STOPPED,
    KILLED;

    public boolean isTerminal() {
        return this == FINISHED || this == STOPPED || this == KILLED;
    }
}
