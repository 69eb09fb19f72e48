package com.netmeasure.service;

import com.netmeasure.aggregation.Aggregator;
import com.netmeasure.aggregation.AggregatorRegistry;
import com.netmeasure.api.RunRequest;
import com.netmeasure.model.ConfigurationException;
import com.netmeasure.model.RunSettings;
import com.netmeasure.model.TestDefinition;
import com.netmeasure.model.WorkerSpec;
import com.netmeasure.result.ResultFormatException;
import com.netmeasure.result.ResultSet;
import com.netmeasure.result.ResultStore;
import com.netmeasure.supervisor.RunAbortedException;
import com.netmeasure.supervisor.Supervisor;
import com.netmeasure.worker.WorkerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Starts test runs in the background and tracks them by run id.
 */
@Service
public class TestRunService {
    private static final Logger log = LoggerFactory.getLogger(TestRunService.class);

    private static final String TRACE_ID = "trace_id";

    private final TestDefinitionRegistry testDefinitionRegistry;
    private final WorkerRegistry workerRegistry;
    private final AggregatorRegistry aggregatorRegistry;
    private final ResultStore resultStore;
    private final Path dataDir;
    private final Duration pollInterval;
    private final String resultSuffix;
    private final String toolVersion;

    private final ExecutorService workerExecutor = Executors.newCachedThreadPool();
    private final ExecutorService runExecutor = Executors.newCachedThreadPool();
    private final Map<String, TestRun> runs = new ConcurrentHashMap<>();

    public TestRunService(
            TestDefinitionRegistry testDefinitionRegistry,
            WorkerRegistry workerRegistry,
            AggregatorRegistry aggregatorRegistry,
            ResultStore resultStore,
            @Value("${netmeasure.data.dir:data}") String dataDir,
            @Value("${netmeasure.supervisor.poll-interval-ms:1000}") long pollIntervalMs,
            @Value("${netmeasure.result.suffix:.netmeasure.gz}") String resultSuffix,
            @Value("${netmeasure.version:0.1.0}") String toolVersion
    ) {
        this.testDefinitionRegistry = testDefinitionRegistry;
        this.workerRegistry = workerRegistry;
        this.aggregatorRegistry = aggregatorRegistry;
        this.resultStore = resultStore;
        this.dataDir = Paths.get(dataDir);
        this.pollInterval = Duration.ofMillis(pollIntervalMs);
        this.resultSuffix = resultSuffix;
        this.toolVersion = toolVersion;
    }

    public Collection<TestDefinition> listTests() {
        return testDefinitionRegistry.getDefinitions();
    }

    /**
     * Validates a run request and starts the run in the background.
     *
     * @param request run request
     * @return the started run
     * @throws TestNotFoundException if the test is unknown
     * @throws ConfigurationException if the test cannot be run with these settings
     */
    public TestRun startRun(RunRequest request) {
        TestDefinition definition = testDefinitionRegistry.getDefinition(request.getTest());
        RunSettings settings = buildSettings(definition, request);
        Map<String, WorkerSpec> specs = testDefinitionRegistry.buildSpecs(definition, settings);

        Supervisor supervisor = new Supervisor(workerRegistry, settings, workerExecutor, pollInterval);
        supervisor.validateSpecs(specs);
        if (!aggregatorRegistry.supports(settings.getAggregator())) {
            throw new ConfigurationException("Unknown aggregator '" + settings.getAggregator() + "' for test "
                    + definition.getName() + ". Available: " + aggregatorRegistry.getKinds());
        }

        String runId = UUID.randomUUID().toString();
        TestRun run = new TestRun(runId, definition.getName(), settings, supervisor);
        runs.put(runId, run);

        String traceId = MDC.get(TRACE_ID);
        runExecutor.submit(() -> {
            if (traceId != null) {
                MDC.put(TRACE_ID, traceId);
            }
            try {
                execute(run, specs);
            } finally {
                MDC.remove(TRACE_ID);
            }
        });
        log.info("Started run: run_id={}, test={}, host={}, length={}, step_size={}",
                runId, definition.getName(), settings.getHost(), settings.getLength(), settings.getStepSize());
        return run;
    }

    void execute(TestRun run, Map<String, WorkerSpec> specs) {
        RunSettings settings = run.getSettings();
        try {
            Aggregator aggregator = aggregatorRegistry.create(settings.getAggregator(), run.getSupervisor(), settings, specs);
            ResultSet results = aggregator.run(ResultSet.fromSettings(settings));
            Object failed = results.getMetadata().get(ResultSet.FAILED_WORKERS);
            if (failed instanceof Number) {
                run.setFailedWorkers(((Number) failed).intValue());
            }
            Path file = resultStore.dumpDir(results, dataDir, resultSuffix);
            run.setDataFile(file.getFileName().toString());
            run.finish(TestRun.Status.FINISHED, run.getSupervisor().isShutdownRequested() ? "stopped early by shutdown request" : null);
            log.info("Run finished: run_id={}, test={}, points={}, data_file={}",
                    run.getRunId(), run.getTestName(), results.size(), file);
        } catch (RunAbortedException e) {
            run.finish(TestRun.Status.ABORTED, e.getMessage());
            log.warn("Run aborted: run_id={}, reason={}", run.getRunId(), e.getMessage());
        } catch (Exception e) {
            run.finish(TestRun.Status.FAILED, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            log.error("Run failed: run_id={}, test={}", run.getRunId(), run.getTestName(), e);
        }
    }

    RunSettings buildSettings(TestDefinition definition, RunRequest request) {
        RunSettings.RunSettingsBuilder b = RunSettings.builder()
                .name(definition.getName())
                .title(request.getTitle())
                .note(request.getNote())
                .toolVersion(toolVersion);
        if (request.getHosts() != null && !request.getHosts().isEmpty()) {
            b.hosts(request.getHosts());
        } else if (request.getHost() != null && !request.getHost().isBlank()) {
            b.host(request.getHost());
        }
        if (request.getLength() != null) {
            b.length(request.getLength());
        }
        Double stepSize = request.getStepSize() != null ? request.getStepSize() : definition.getStepSize();
        if (stepSize != null) {
            b.stepSize(stepSize);
        }
        Integer iterations = request.getIterations() != null ? request.getIterations() : definition.getIterations();
        if (iterations != null) {
            b.iterations(iterations);
        }
        if (definition.getAggregator() != null && !definition.getAggregator().isBlank()) {
            b.aggregator(definition.getAggregator());
        }
        if (definition.getTotalLength() != null) {
            b.totalLength(definition.getTotalLength());
        }
        return b.build();
    }

    /**
     * @throws RunNotFoundException if no run has this id
     */
    public TestRun getRun(String runId) {
        TestRun run = runId == null ? null : runs.get(runId);
        if (run == null) {
            throw new RunNotFoundException("Run not found: " + runId);
        }
        return run;
    }

    public List<TestRun> listRuns() {
        return List.copyOf(runs.values());
    }

    /**
     * Asks a run to stop gracefully. Repeated requests are only logged.
     */
    public TestRun requestShutdown(String runId) {
        TestRun run = getRun(runId);
        if (run.isRunning()) {
            run.getSupervisor().requestShutdown();
        } else {
            log.info("Shutdown requested for run that is no longer running: run_id={}, status={}", runId, run.getStatus());
        }
        return run;
    }

    /**
     * Kills every worker of a run and discards its data.
     */
    public TestRun abort(String runId) {
        TestRun run = getRun(runId);
        if (run.isRunning()) {
            run.getSupervisor().abort();
        }
        return run;
    }

    /**
     * Loads a result file from the data directory.
     *
     * @param fileName file name relative to the data directory
     * @return the loaded result set
     * @throws IllegalArgumentException if the name points outside the data directory
     * @throws ResultFormatException if the file cannot be loaded
     */
    public ResultSet loadResult(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("file is required");
        }
        Path base = dataDir.toAbsolutePath().normalize();
        Path file = base.resolve(fileName).normalize();
        if (!file.startsWith(base)) {
            throw new IllegalArgumentException("file must be inside the data directory: " + fileName);
        }
        return resultStore.load(file);
    }

    public ResultStore getResultStore() {
        return resultStore;
    }

    @PreDestroy
    public void cleanup() {
        runs.values().stream().filter(TestRun::isRunning).forEach(run -> run.getSupervisor().abort());
        runExecutor.shutdown();
        workerExecutor.shutdown();
        try {
            if (!runExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                runExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            runExecutor.shutdownNow();
        }
        workerExecutor.shutdownNow();
    }
}
