package com.netmeasure.controller;

import com.netmeasure.api.RunRequest;
import com.netmeasure.api.RunResponse;
import com.netmeasure.api.RunStatusResponse;
import com.netmeasure.api.TestsListResponse;
import com.netmeasure.model.TestDefinition;
import com.netmeasure.result.ResultSet;
import com.netmeasure.service.TestRun;
import com.netmeasure.service.TestRunService;
import com.netmeasure.util.TimeFormats;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1")
public class NetMeasureController {

    private static final Logger log = LoggerFactory.getLogger(NetMeasureController.class);

    private final TestRunService testRunService;

    public NetMeasureController(TestRunService testRunService) {
        this.testRunService = testRunService;
    }

    @GetMapping("/tests")
    public ResponseEntity<TestsListResponse> listTests() {
        List<TestsListResponse.TestSummary> tests = new ArrayList<>();
        for (TestDefinition d : testRunService.listTests()) {
            tests.add(TestsListResponse.TestSummary.builder()
                    .name(d.getName())
                    .description(d.getDescription())
                    .aggregator(d.getAggregator() == null ? "timeseries" : d.getAggregator())
                    .workers(d.getWorkers() == null ? List.of() : List.copyOf(d.getWorkers().keySet()))
                    .sourceFile(d.getSourceFile())
                    .build());
        }
        return ResponseEntity.ok(TestsListResponse.builder().tests(tests).build());
    }

    @PostMapping("/runs")
    public ResponseEntity<RunResponse> startRun(@Valid @RequestBody RunRequest request) {
        TestRun run = testRunService.startRun(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(RunResponse.builder()
                .runId(run.getRunId())
                .test(run.getTestName())
                .status(run.getStatus().name())
                .build());
    }

    @GetMapping("/runs/{runId}")
    public ResponseEntity<RunStatusResponse> getRun(@PathVariable("runId") String runId) {
        return ResponseEntity.ok(toStatus(testRunService.getRun(runId)));
    }

    @PostMapping("/runs/{runId}/shutdown")
    public ResponseEntity<RunStatusResponse> shutdownRun(@PathVariable("runId") String runId) {
        log.info("Shutdown requested: run_id={}", runId);
        return ResponseEntity.ok(toStatus(testRunService.requestShutdown(runId)));
    }

    @PostMapping("/runs/{runId}/abort")
    public ResponseEntity<RunStatusResponse> abortRun(@PathVariable("runId") String runId) {
        log.warn("Abort requested: run_id={}", runId);
        return ResponseEntity.ok(toStatus(testRunService.abort(runId)));
    }

    @GetMapping("/results")
    public ResponseEntity<Map<String, Object>> getResult(@RequestParam("file") String file) {
        ResultSet results = testRunService.loadResult(file);
        return ResponseEntity.ok(testRunService.getResultStore().serialize(results));
    }

    private static RunStatusResponse toStatus(TestRun run) {
        return RunStatusResponse.builder()
                .runId(run.getRunId())
                .test(run.getTestName())
                .status(run.getStatus().name())
                .reason(run.getReason())
                .dataFile(run.getDataFile())
                .failedWorkers(run.getFailedWorkers())
                .shutdownRequested(run.getSupervisor().isShutdownRequested())
                .startedAt(TimeFormats.format(run.getStartedAt()))
                .finishedAt(run.getFinishedAt() == null ? null : TimeFormats.format(run.getFinishedAt()))
                .build();
    }
}
