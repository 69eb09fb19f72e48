package com.netmeasure.service;

import com.netmeasure.model.RunSettings;
import com.netmeasure.supervisor.Supervisor;

import java.time.Instant;
import java.util.Objects;

/**
 * Bookkeeping for one run started through {@link TestRunService}.
 */
public class TestRun {

    public enum Status {
        RUNNING, FINISHED, FAILED, ABORTED
    }

    private final String runId;
    private final String testName;
    private final RunSettings settings;
    private final Supervisor supervisor;
    private final Instant startedAt = Instant.now();

    private volatile Status status = Status.RUNNING;
    private volatile String reason;
    private volatile String dataFile;
    private volatile int failedWorkers;
    private volatile Instant finishedAt;

    TestRun(String runId, String testName, RunSettings settings, Supervisor supervisor) {
        this.runId = Objects.requireNonNull(runId, "runId");
        this.testName = Objects.requireNonNull(testName, "testName");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
    }

    void finish(Status status, String reason) {
        this.status = status;
        this.reason = reason;
        this.finishedAt = Instant.now();
    }

    void setDataFile(String dataFile) {
        this.dataFile = dataFile;
    }

    void setFailedWorkers(int failedWorkers) {
        this.failedWorkers = failedWorkers;
    }

    public String getRunId() {
        return runId;
    }

    public String getTestName() {
        return testName;
    }

    public RunSettings getSettings() {
        return settings;
    }

    public Supervisor getSupervisor() {
        return supervisor;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isRunning() {
        return status == Status.RUNNING;
    }

    public String getReason() {
        return reason;
    }

    public String getDataFile() {
        return dataFile;
    }

    public int getFailedWorkers() {
        return failedWorkers;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }
}
