package com.netmeasure.worker;

/**
 * Waits for a fixed time, or until stopped, and produces nothing. Other workers use it as a
 * {@code runAfter} or {@code killAfter} anchor.
 */
public class TimerWorker extends Worker {

    private final double length;

    public TimerWorker(WorkerContext context) {
        super(context);
        Double specLength = context.getSpec() != null ? context.getSpec().getLength() : null;
        this.length = specLength != null ? specLength
                : context.getSettings() != null ? context.getSettings().getLength() : 0.0;
        this.command = "timer(" + length + "s)";
    }

    @Override
    protected WorkerResult execute() throws InterruptedException {
        awaitStop(length);
        exitCode = 0;
        return WorkerResult.empty();
    }

    @Override
    public boolean isSilent() {
        return true;
    }
}
