package com.netmeasure.supervisor;

import com.netmeasure.model.ConfigurationException;
import com.netmeasure.model.RunSettings;
import com.netmeasure.model.WorkerSpec;
import com.netmeasure.transform.Transformers;
import com.netmeasure.transform.ValueTransformer;
import com.netmeasure.worker.Signal;
import com.netmeasure.worker.Worker;
import com.netmeasure.worker.WorkerContext;
import com.netmeasure.worker.WorkerRegistry;
import com.netmeasure.worker.WorkerResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Starts, waits on and merges the results of every worker of one round.
 *
 * <p>{@link #collect(Map)} runs on a single orchestrating thread. {@link #requestShutdown()} and
 * {@link #abort()} may be called from any thread at any time. Only one graceful stop is ever
 * broadcast per supervisor, however many shutdown requests arrive.
 */
public class Supervisor {
    private static final Logger log = LoggerFactory.getLogger(Supervisor.class);

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);
    static final long KILL_WAIT_MILLIS = 5000;

    private final WorkerRegistry workerRegistry;
    private final RunSettings settings;
    private final ExecutorService executor;
    private final long pollIntervalMillis;

    private final AtomicInteger shutdownRequests = new AtomicInteger();
    private final AtomicBoolean gracefulStopSent = new AtomicBoolean(false);
    private final AtomicBoolean abortRequested = new AtomicBoolean(false);
    private volatile List<Worker> activeWorkers = List.of();

    /**
     * Creates a supervisor.
     *
     * @param workerRegistry factories for worker kinds
     * @param settings run settings handed to every worker
     * @param executor executor with a thread for every concurrently running worker
     * @param pollInterval bounded wait per worker between shutdown checks
     */
    public Supervisor(WorkerRegistry workerRegistry, RunSettings settings, ExecutorService executor, Duration pollInterval) {
        this.workerRegistry = Objects.requireNonNull(workerRegistry, "workerRegistry");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.pollIntervalMillis = Math.max(1, Objects.requireNonNull(pollInterval, "pollInterval").toMillis());
    }

    /**
     * Runs every worker once, concurrently, and merges their output.
     *
     * @param specs worker specs by name
     * @return merged results of the round
     * @throws ConfigurationException if the specs cannot be wired; no worker is started then
     * @throws RunAbortedException if the round was aborted
     */
    public CollectedResults collect(Map<String, WorkerSpec> specs) {
        Map<String, List<ValueTransformer>> chains = validate(specs);
        if (abortRequested.get()) {
            throw new RunAbortedException("Run was aborted before workers were started");
        }

        Map<String, Signal> finishSignals = new LinkedHashMap<>();
        specs.keySet().forEach(name -> finishSignals.put(name, new Signal(name + ":finish")));

        Map<String, Worker> workers = new LinkedHashMap<>();
        for (Map.Entry<String, WorkerSpec> e : specs.entrySet()) {
            String name = e.getKey();
            WorkerSpec spec = e.getValue();
            WorkerContext context = WorkerContext.builder()
                    .name(name)
                    .settings(settings)
                    .spec(spec)
                    .startSignal(spec.hasRunAfter() ? finishSignals.get(spec.getRunAfter()) : null)
                    .killSignal(spec.hasKillAfter() ? finishSignals.get(spec.getKillAfter()) : null)
                    .finishSignal(finishSignals.get(name))
                    .build();
            workers.put(name, workerRegistry.create(context));
        }

        activeWorkers = List.copyOf(workers.values());
        try {
            for (Worker worker : workers.values()) {
                worker.start(executor);
            }
            log.debug("Started {} workers: {}", workers.size(), workers.keySet());

            for (Worker worker : workers.values()) {
                while (!worker.awaitTermination(pollIntervalMillis, TimeUnit.MILLISECONDS)) {
                    checkShutdown();
                }
                checkShutdown();
            }

            CollectedResults collected = new CollectedResults();
            if (gracefulStopSent.get()) {
                collected.markStoppedEarly();
            }
            for (Map.Entry<String, Worker> e : workers.entrySet()) {
                merge(e.getKey(), e.getValue(), chains.get(e.getKey()), collected);
            }
            log.debug("Worker aggregation finished: results={}", collected.getResults().keySet());
            return collected;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            killWorkers(false);
            throw new RunAbortedException("Interrupted while waiting for workers; all workers killed", e);
        } catch (RunAbortedException e) {
            killWorkers(false);
            awaitKilled(workers.values());
            throw e;
        } finally {
            for (Worker worker : workers.values()) {
                worker.close();
            }
            activeWorkers = List.of();
        }
    }

    /**
     * Requests a graceful shutdown. The first request stops every running worker without
     * discarding output; later requests only log a notice.
     */
    public void requestShutdown() {
        int count = shutdownRequests.incrementAndGet();
        if (count == 1) {
            log.info("Shutdown requested; initiating graceful shutdown. This may take a while...");
        } else {
            log.info("Already initiated graceful shutdown. Patience, please... (request #{})", count);
        }
    }

    /**
     * Kills every worker immediately and makes the running {@link #collect(Map)} throw
     * {@link RunAbortedException}.
     */
    public void abort() {
        if (abortRequested.compareAndSet(false, true)) {
            log.warn("Abort requested; killing all workers");
        }
        killWorkers(false);
    }

    /**
     * Checks worker wiring, kinds and transform names without starting anything.
     *
     * @throws ConfigurationException if the specs cannot be run
     */
    public void validateSpecs(Map<String, WorkerSpec> specs) {
        validate(specs);
    }

    public boolean isShutdownRequested() {
        return shutdownRequests.get() > 0;
    }

    public boolean isAborted() {
        return abortRequested.get();
    }

    private void checkShutdown() {
        if (abortRequested.get()) {
            throw new RunAbortedException("Run aborted by operator");
        }
        if (shutdownRequests.get() > 0 && gracefulStopSent.compareAndSet(false, true)) {
            killWorkers(true);
        }
    }

    private void awaitKilled(Collection<Worker> workers) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(KILL_WAIT_MILLIS);
        for (Worker worker : workers) {
            if (!worker.isAlive()) {
                continue;
            }
            try {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0 || !worker.awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
                    log.warn("Worker still running after hard kill: worker={}", worker.getName());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private void killWorkers(boolean graceful) {
        for (Worker worker : activeWorkers) {
            worker.kill(graceful);
        }
    }

    private Map<String, List<ValueTransformer>> validate(Map<String, WorkerSpec> specs) {
        if (specs == null || specs.isEmpty()) {
            throw new ConfigurationException("No workers configured");
        }
        Map<String, List<ValueTransformer>> chains = new LinkedHashMap<>();
        for (Map.Entry<String, WorkerSpec> e : specs.entrySet()) {
            String name = e.getKey();
            WorkerSpec spec = e.getValue();
            if (spec == null) {
                throw new ConfigurationException("Missing spec for worker '" + name + "'");
            }
            if (spec.hasRunAfter() && !specs.containsKey(spec.getRunAfter())) {
                throw new ConfigurationException("Worker '" + name + "' has runAfter='" + spec.getRunAfter()
                        + "', which is not a configured worker");
            }
            if (spec.hasKillAfter() && !specs.containsKey(spec.getKillAfter())) {
                throw new ConfigurationException("Worker '" + name + "' has killAfter='" + spec.getKillAfter()
                        + "', which is not a configured worker");
            }
            workerRegistry.validate(spec);
            chains.put(name, Transformers.resolve(spec.getTransforms()));
        }
        return chains;
    }

    private void merge(String name, Worker worker, List<ValueTransformer> chain, CollectedResults collected) {
        log.debug("Worker {} finished: state={}, command={}, exit_code={}\nstdout:\n{}\nstderr:\n{}",
                name, worker.getState(), worker.getCommand(), worker.getExitCode(),
                worker.getStdout(), worker.getStderr());

        Map<String, Object> meta = new LinkedHashMap<>(worker.getMetadata());
        if (!chain.isEmpty()) {
            for (String key : worker.getTransformedMetadata()) {
                if (meta.containsKey(key)) {
                    meta.put(key, Transformers.applyToMetadata(chain, meta.get(key)));
                }
            }
            meta.put("TRANSFORMS", new ArrayList<>(worker.getSpec().getTransforms()));
        }
        collected.getSeriesMetadata().put(name, meta);
        collected.getTestParameters().putAll(worker.getTestParameters());
        if (!worker.getRawValues().isEmpty()) {
            collected.getRawValues().put(name, Transformers.applyToRecords(chain, worker.getRawValues()));
        }

        WorkerResult result = worker.getResult();
        switch (result.getKind()) {
            case EMPTY:
                if (!worker.isSilent()) {
                    collected.incrementFailedWorkers();
                    log.warn("Dropping worker without usable data: worker={}, state={}, exit_code={}",
                            name, worker.getState(), worker.getExitCode());
                }
                break;
            case DEFERRED:
                collected.getPostprocessors().add(((WorkerResult.Deferred) result).getPostprocessor());
                break;
            case NAMED:
                Map<String, WorkerResult> parts = ((WorkerResult.Named) result).getParts();
                if (parts.isEmpty()) {
                    collected.incrementFailedWorkers();
                }
                for (Map.Entry<String, WorkerResult> part : parts.entrySet()) {
                    collected.getResults().put(name + "::" + part.getKey(), Transformers.applyChain(chain, part.getValue()));
                }
                break;
            case SCALAR:
            case SERIES:
                collected.getResults().put(name, Transformers.applyChain(chain, result));
                break;
            default:
                throw new IllegalStateException("Unhandled result kind: " + result.getKind());
        }
    }
}
