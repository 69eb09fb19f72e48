package com.netmeasure.worker;

import com.netmeasure.model.RunSettings;
import com.netmeasure.model.WorkerSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Base class of every worker kind.
 *
 * <p>A worker runs on its own thread. Waiting for the start signal happens on that thread, so
 * starting a worker never blocks the caller. The finish signal is set in every terminal state.
 * Results, raw values and metadata are only read by others once the worker has terminated.
 */
public abstract class Worker {
    private static final Logger log = LoggerFactory.getLogger(Worker.class);

    private final WorkerContext context;
    private final AtomicReference<WorkerState> state = new AtomicReference<>(WorkerState.CREATED);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicBoolean hardKilled = new AtomicBoolean(false);
    private final Signal wake;
    private final Signal stopSignal;

    private volatile Future<?> future;
    private volatile WorkerResult result = WorkerResult.empty();
    private volatile long startedAtNanos;
    private volatile long finishedAtNanos;

    protected final Map<String, Object> metadata = new LinkedHashMap<>();
    protected final Map<String, Object> testParameters = new LinkedHashMap<>();
    private volatile List<Map<String, Object>> rawValues = List.of();

    protected volatile String command;
    protected volatile Integer exitCode;
    protected volatile String stdout = "";
    protected volatile String stderr = "";

    protected Worker(WorkerContext context) {
        this.context = Objects.requireNonNull(context, "context");
        Objects.requireNonNull(context.getFinishSignal(), "finishSignal");
        this.wake = new Signal(context.getName() + ":wake");
        this.stopSignal = new Signal(context.getName() + ":stop");
        metadata.put("WORKER", getClass().getSimpleName());
        if (context.getSpec() != null && context.getSpec().getUnits() != null) {
            metadata.put("UNITS", context.getSpec().getUnits());
        }
    }

    /**
     * Produces this worker's result. Called on the worker thread once the start signal is set.
     *
     * @return the result; null is treated as {@link WorkerResult#empty()}
     * @throws Exception on failure; the worker then yields an empty result
     */
    protected abstract WorkerResult execute() throws Exception;

    /**
     * Called once per stop mode when a stop is requested. Implementations terminate whatever
     * external work they own.
     *
     * @param graceful true to let partial output be kept
     */
    protected void onStop(boolean graceful) {
    }

    /**
     * Releases temporary resources. Safe to call more than once and on every path.
     */
    public void close() {
    }

    /**
     * Whether an empty result is expected and should not be reported as a failure.
     */
    public boolean isSilent() {
        return false;
    }

    /**
     * Spawns the worker on the given executor. Does not wait for dependencies.
     *
     * @param executor executor with a thread available for every worker
     */
    public void start(ExecutorService executor) {
        if (!state.compareAndSet(WorkerState.CREATED, WorkerState.SPAWNED)) {
            throw new IllegalStateException("Worker already started: " + getName());
        }
        Signal startSignal = context.getStartSignal();
        if (startSignal != null) {
            startSignal.onSet(wake::set);
        } else {
            wake.set();
        }
        Signal killSignal = context.getKillSignal();
        if (killSignal != null) {
            killSignal.onSet(() -> {
                log.debug("Kill signal observed: worker={}, signal={}", getName(), killSignal.getName());
                kill(true);
            });
        }
        future = executor.submit(this::run);
    }

    /**
     * @return true while the worker thread has not terminated
     */
    public boolean isAlive() {
        Future<?> f = future;
        return f != null && !f.isDone();
    }

    /**
     * Waits at most the given time for the worker thread to terminate.
     *
     * @return true if the worker has terminated
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        Future<?> f = future;
        if (f == null) {
            return false;
        }
        try {
            f.get(timeout, unit);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            // run() handles its own failures, so this only happens on errors.
            log.error("Worker thread failed: worker={}", getName(), e.getCause());
            return true;
        }
    }

    /**
     * Stops the worker. Each mode takes effect once; a hard kill after a graceful stop still
     * escalates.
     *
     * @param graceful true keeps partial output, false discards it
     */
    public void kill(boolean graceful) {
        if (graceful) {
            if (!stopRequested.compareAndSet(false, true)) {
                return;
            }
        } else {
            if (!hardKilled.compareAndSet(false, true)) {
                return;
            }
            stopRequested.set(true);
        }
        wake.set();
        stopSignal.set();
        try {
            onStop(graceful);
        } catch (Exception e) {
            log.warn("Failed to stop worker: worker={}, graceful={}", getName(), graceful, e);
        }
    }

    private void run() {
        try {
            if (context.getStartSignal() != null && !context.getStartSignal().isSet()) {
                state.set(WorkerState.BLOCKED);
                log.debug("Waiting for start signal: worker={}, signal={}", getName(),
                        context.getStartSignal().getName());
            }
            wake.await();
            if (stopRequested.get()) {
                result = WorkerResult.empty();
                state.set(hardKilled.get() ? WorkerState.KILLED : WorkerState.STOPPED);
                return;
            }

            double delay = context.getSpec() != null ? context.getSpec().getDelay() : 0.0;
            if (delay > 0 && awaitStop(delay)) {
                result = WorkerResult.empty();
                state.set(hardKilled.get() ? WorkerState.KILLED : WorkerState.STOPPED);
                return;
            }

            startedAtNanos = System.nanoTime();
            state.set(WorkerState.RUNNING);
            WorkerResult produced = execute();
            if (hardKilled.get()) {
                result = WorkerResult.empty();
                state.set(WorkerState.KILLED);
            } else {
                result = produced == null ? WorkerResult.empty() : produced;
                state.set(stopRequested.get() ? WorkerState.STOPPED : WorkerState.FINISHED);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = WorkerResult.empty();
            state.set(WorkerState.KILLED);
        } catch (Exception e) {
            log.warn("Worker failed: worker={}, command={}", getName(), command, e);
            result = WorkerResult.empty();
            state.set(hardKilled.get() ? WorkerState.KILLED : WorkerState.FINISHED);
        } finally {
            finishedAtNanos = System.nanoTime();
            context.getFinishSignal().set();
            log.debug("Worker terminated: worker={}, state={}, result={}", getName(), state.get(), result);
        }
    }

    /**
     * Sleeps for the given number of seconds unless a stop is requested first.
     *
     * @return true if a stop was requested
     */
    protected boolean awaitStop(double seconds) throws InterruptedException {
        return stopSignal.await((long) (seconds * 1000.0), TimeUnit.MILLISECONDS);
    }

    protected boolean isStopRequested() {
        return stopRequested.get();
    }

    protected boolean isHardKilled() {
        return hardKilled.get();
    }

    protected void setRawValues(List<Map<String, Object>> rawValues) {
        this.rawValues = rawValues == null ? List.of() : new ArrayList<>(rawValues);
    }

    public String getName() {
        return context.getName();
    }

    public WorkerContext getContext() {
        return context;
    }

    public WorkerSpec getSpec() {
        return context.getSpec();
    }

    public RunSettings getSettings() {
        return context.getSettings();
    }

    public WorkerState getState() {
        return state.get();
    }

    public WorkerResult getResult() {
        return result;
    }

    public List<Map<String, Object>> getRawValues() {
        return rawValues;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Map<String, Object> getTestParameters() {
        return testParameters;
    }

    /**
     * Metadata keys that hold values in the same unit as the result and should go through the
     * transform chain.
     */
    public List<String> getTransformedMetadata() {
        return List.of();
    }

    public String getCommand() {
        return command;
    }

    public Integer getExitCode() {
        return exitCode;
    }

    public String getStdout() {
        return stdout;
    }

    public String getStderr() {
        return stderr;
    }

    public long getStartedAtNanos() {
        return startedAtNanos;
    }

    public long getFinishedAtNanos() {
        return finishedAtNanos;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + getName() + ")";
    }
}
