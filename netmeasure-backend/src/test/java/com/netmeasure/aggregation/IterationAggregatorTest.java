package com.netmeasure.aggregation;

import com.netmeasure.model.RunSettings;
import com.netmeasure.model.WorkerSpec;
import com.netmeasure.result.ResultSet;
import com.netmeasure.supervisor.CollectedResults;
import com.netmeasure.supervisor.Supervisor;
import com.netmeasure.worker.WorkerResult;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IterationAggregatorTest {

    private final Supervisor supervisor = mock(Supervisor.class);
    private final Map<String, WorkerSpec> specs = Map.of("rtt", WorkerSpec.builder().name("rtt").command("true").build());

    @Test
    void collectsOneDatapointPerIteration() {
        when(supervisor.collect(anyMap())).thenReturn(
                round(1.0, "first"), round(2.0, "second"), round(3.0, "third"));

        ResultSet results = aggregator(3).run(new ResultSet(Map.of(ResultSet.NAME, "test")));

        verify(supervisor, times(3)).collect(specs);
        assertThat(results.getXValues()).containsExactly(0.0, 1.0, 2.0);
        assertThat(results.series("rtt")).containsExactly(1.0, 2.0, 3.0);
        assertThat(results.meta("SERIES_META:rtt:NOTE")).isEqualTo("third");
    }

    @Test
    void missingValueInALaterRoundIsNull() {
        CollectedResults empty = new CollectedResults();
        when(supervisor.collect(anyMap())).thenReturn(round(1.0, "first"), empty);

        ResultSet results = aggregator(2).run(new ResultSet(Map.of(ResultSet.NAME, "test")));

        assertThat(results.series("rtt")).containsExactly(1.0, null);
    }

    @Test
    void seriesAppearingAfterTheFirstRoundArePaddedWithNulls() {
        CollectedResults second = round(2.0, "second");
        second.getResults().put("late", WorkerResult.scalar(9.0));
        when(supervisor.collect(anyMap())).thenReturn(new CollectedResults(), second, round(3.0, "third"));

        ResultSet results = aggregator(3).run(new ResultSet(Map.of(ResultSet.NAME, "test")));

        assertThat(results.getXValues()).containsExactly(0.0, 1.0, 2.0);
        assertThat(results.series("rtt")).containsExactly(null, 2.0, 3.0);
        assertThat(results.series("late")).containsExactly(null, 9.0, null);
    }

    @Test
    void shutdownRequestStopsFurtherIterations() {
        when(supervisor.collect(anyMap())).thenReturn(round(1.0, "first"), round(2.0, "second"));
        when(supervisor.isShutdownRequested()).thenReturn(true);

        ResultSet results = aggregator(5).run(new ResultSet(Map.of(ResultSet.NAME, "test")));

        verify(supervisor, times(1)).collect(specs);
        assertThat(results.series("rtt")).containsExactly(1.0);
    }

    private IterationAggregator aggregator(int iterations) {
        RunSettings settings = RunSettings.builder().name("test").iterations(iterations).build();
        return new IterationAggregator(supervisor, settings, specs);
    }

    private static CollectedResults round(double value, String note) {
        CollectedResults collected = new CollectedResults();
        collected.getResults().put("rtt", WorkerResult.scalar(value));
        collected.getSeriesMetadata().put("rtt", Map.of("NOTE", note));
        return collected;
    }
}
