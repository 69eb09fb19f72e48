package com.netmeasure.worker;

import com.netmeasure.model.ConfigurationException;
import com.netmeasure.model.RunSettings;
import com.netmeasure.model.WorkerSpec;
import com.netmeasure.result.ResultSet;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ComputingWorkerTest {

    private final WorkerRegistry registry = new WorkerRegistry();

    @Test
    void averageSkipsMissingValuesPerRow() {
        ResultSet results = results(
                "Upload::1", Arrays.asList(2.0, 4.0, null),
                "Upload::2", Arrays.asList(4.0, null, null),
                "Ping", Arrays.asList(100.0, 100.0, 100.0));

        ComputingWorker worker = (ComputingWorker) create("average", "Upload avg", "Upload::*");
        worker.postprocess(results);

        assertThat(results.series("Upload avg")).containsExactly(3.0, 4.0, null);
        assertThat(results.getSeriesMeta()).containsKey("Upload avg");
    }

    @Test
    void sumAndFairness() {
        ResultSet results = results(
                "a", Arrays.asList(1.0, 3.0),
                "b", Arrays.asList(1.0, 1.0));

        ((ComputingWorker) create("sum", "total", "a", "b")).postprocess(results);
        ((ComputingWorker) create("fairness", "fair", "a", "b")).postprocess(results);

        assertThat(results.series("total")).containsExactly(2.0, 4.0);
        assertThat(results.series("fair").get(0)).isEqualTo(1.0);
        // (3 + 1)^2 / (2 * (9 + 1))
        assertThat(results.series("fair").get(1)).isCloseTo(0.8, within(1e-9));
    }

    @Test
    void meanValueIsComputedFromInputMetadata() {
        ResultSet results = results(
                "a", Arrays.asList(1.0, 1.0),
                "b", Arrays.asList(3.0, 3.0));
        results.getSeriesMeta().put("a", new LinkedHashMap<>(Map.of("MEAN_VALUE", 10.0)));
        results.getSeriesMeta().put("b", new LinkedHashMap<>(Map.of("MEAN_VALUE", 20.0)));

        ((ComputingWorker) create("average", "avg", "*")).postprocess(results);

        assertThat(results.meta("SERIES_META:avg:MEAN_VALUE")).isEqualTo(15.0);
        assertThat(results.meta("SERIES_META:avg:WORKER")).isEqualTo("ComputingWorker");
        assertThat(results.series("avg")).containsExactly(2.0, 2.0);
    }

    @Test
    void unitsAreCopiedFromInputSeries() {
        ResultSet results = results(
                "up", Arrays.asList(1.0),
                "down", Arrays.asList(2.0),
                "ping", Arrays.asList(30.0));
        results.getSeriesMeta().put("up", new LinkedHashMap<>(Map.of("UNITS", "Mbits/s")));
        results.getSeriesMeta().put("down", new LinkedHashMap<>(Map.of("UNITS", "Mbits/s")));
        results.getSeriesMeta().put("ping", new LinkedHashMap<>(Map.of("UNITS", "ms")));

        ((ComputingWorker) create("sum", "bandwidth", "up", "down")).postprocess(results);
        ((ComputingWorker) create("average", "mixed", "up", "ping")).postprocess(results);

        assertThat(results.meta("SERIES_META:bandwidth:UNITS")).isEqualTo("Mbits/s");
        assertThat(results.meta("SERIES_META:mixed:UNITS")).isEqualTo(List.of("Mbits/s", "ms"));
    }

    @Test
    void smoothAverageUsesRunningWindow() {
        ResultSet results = results("a", Arrays.asList(1.0, 3.0, 5.0, 7.0));
        WorkerSpec spec = WorkerSpec.builder().name("smooth").kind("smooth_average").applyTo(List.of("a")).smoothSteps(2).build();

        ((ComputingWorker) create(spec)).postprocess(results);

        assertThat(results.series("smooth")).containsExactly(1.0, 2.0, 4.0, 6.0);
    }

    @Test
    void diffMinSubtractsMinimumOfFirstSeries() {
        ResultSet results = results("Ping", Arrays.asList(12.0, null, 10.0, 15.0));

        ((ComputingWorker) create("diff_min", "Ping delta", "Ping")).postprocess(results);

        assertThat(results.series("Ping delta")).containsExactly(2.0, null, 0.0, 5.0);
    }

    @Test
    void producesDeferredResultAndIsSilent() throws Exception {
        ComputingWorker worker = (ComputingWorker) create("average", "avg", "*");

        assertThat(worker.execute().getKind()).isEqualTo(WorkerResult.Kind.DEFERRED);
        assertThat(worker.isSilent()).isTrue();
    }

    @Test
    void noMatchingSeriesLeavesResultsUntouched() {
        ResultSet results = results("a", List.of(1.0));

        ((ComputingWorker) create("average", "avg", "missing*")).postprocess(results);

        assertThat(results.getSeriesNames()).containsExactly("a");
    }

    @Test
    void registryRejectsUnknownKindAndMissingCommand() {
        assertThatThrownBy(() -> registry.validate(WorkerSpec.builder().name("x").kind("nope").build()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Unknown worker kind 'nope'");
        assertThatThrownBy(() -> registry.validate(WorkerSpec.builder().name("x").build()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("No command set for worker 'x'");
    }

    private Worker create(String kind, String name, String... applyTo) {
        return create(WorkerSpec.builder().name(name).kind(kind).applyTo(Arrays.asList(applyTo)).build());
    }

    private Worker create(WorkerSpec spec) {
        return registry.create(WorkerContext.builder()
                .name(spec.getName())
                .settings(RunSettings.builder().name("test").build())
                .spec(spec)
                .finishSignal(new Signal(spec.getName() + ":finish"))
                .build());
    }

    private static ResultSet results(Object... nameAndValues) {
        Map<String, List<Double>> series = new LinkedHashMap<>();
        for (int i = 0; i < nameAndValues.length; i += 2) {
            @SuppressWarnings("unchecked")
            List<Double> values = (List<Double>) nameAndValues[i + 1];
            series.put((String) nameAndValues[i], values);
        }
        ResultSet rs = new ResultSet(Map.of(ResultSet.NAME, "test"));
        rs.createSeries(series.keySet());
        int n = series.values().iterator().next().size();
        for (int x = 0; x < n; x++) {
            Map<String, Double> point = new LinkedHashMap<>();
            for (Map.Entry<String, List<Double>> e : series.entrySet()) {
                point.put(e.getKey(), e.getValue().get(x));
            }
            rs.appendDatapoint(x, point);
        }
        return rs;
    }
}
