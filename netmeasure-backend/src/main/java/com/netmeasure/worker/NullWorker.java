package com.netmeasure.worker;

/**
 * Placeholder worker that produces nothing.
 */
public class NullWorker extends Worker {

    public NullWorker(WorkerContext context) {
        super(context);
        this.command = "null";
        this.exitCode = 0;
    }

    @Override
    protected WorkerResult execute() {
        return WorkerResult.empty();
    }

    @Override
    public boolean isSilent() {
        return true;
    }
}
