package com.netmeasure.aggregation;

import com.netmeasure.model.RunSettings;
import com.netmeasure.model.WorkerSpec;
import com.netmeasure.result.ResultSet;
import com.netmeasure.supervisor.CollectedResults;
import com.netmeasure.supervisor.Supervisor;
import com.netmeasure.util.TimeFormats;
import com.netmeasure.worker.Sample;
import com.netmeasure.worker.WorkerResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs every worker once and resamples their irregular series onto one evenly spaced grid.
 *
 * <p>The grid starts at the earliest first sample and has {@code ceil((tMax - t0) / step)}
 * points. Each series is interpolated linearly between the samples around a grid point. A grid
 * point further than {@link #MAX_DISTANCE_STEPS} steps from the next sample gets null; before a
 * series' first sample the allowed distance shrinks to half a step. Once a series has run out of
 * samples, its last value is not repeated.
 */
public class TimeSeriesAggregator extends Aggregator {
    private static final Logger log = LoggerFactory.getLogger(TimeSeriesAggregator.class);

    static final double MAX_DISTANCE_STEPS = 5.0;
    static final double LEADING_DISTANCE_STEPS = 0.5;

    private final double step;
    private final double maxDistance;

    public TimeSeriesAggregator(Supervisor supervisor, RunSettings settings, Map<String, WorkerSpec> specs) {
        super(supervisor, settings, specs);
        if (!(settings.getStepSize() > 0)) {
            throw new IllegalArgumentException("step size must be positive, got " + settings.getStepSize());
        }
        this.step = settings.getStepSize();
        this.maxDistance = step * MAX_DISTANCE_STEPS;
    }

    @Override
    protected void aggregate(ResultSet results) {
        CollectedResults collected = collect();
        if (collected.isEmpty()) {
            throw new AggregationException(NO_DATA_MESSAGE);
        }

        Map<String, List<Sample>> measurements = new LinkedHashMap<>();
        collected.getResults().forEach((name, result) -> {
            if (result.getKind() == WorkerResult.Kind.SERIES) {
                measurements.put(name, ((WorkerResult.Series) result).getSamples());
            } else {
                log.warn("Ignoring non-series result in time series aggregation: series={}, kind={}",
                        name, result.getKind());
            }
        });

        recordMetadata(results, collected);
        results.createSeries(measurements.keySet());

        align(results, measurements);
    }

    /**
     * Appends one datapoint per grid step to {@code results}, whose series must already be
     * declared.
     *
     * @param results result set to append to
     * @param measurements samples by series name, each sorted by time
     * @throws AggregationException if no series has any sample
     */
    void align(ResultSet results, Map<String, List<Sample>> measurements) {
        double t0 = Double.POSITIVE_INFINITY;
        double tMax = Double.NEGATIVE_INFINITY;
        for (List<Sample> samples : measurements.values()) {
            if (samples.isEmpty()) {
                continue;
            }
            t0 = Math.min(t0, samples.get(0).getTime());
            tMax = Math.max(tMax, samples.get(samples.size() - 1).getTime());
        }
        if (Double.isInfinite(t0) || Double.isInfinite(tMax)) {
            throw new AggregationException(NO_DATA_MESSAGE);
        }

        int steps = (int) Math.ceil((tMax - t0) / step);
        results.meta(ResultSet.T0, TimeFormats.fromEpochSeconds(t0));

        for (int s = 0; s < steps; s++) {
            double t = t0 + step * s;
            Map<String, Double> datapoint = new LinkedHashMap<>();
            for (Map.Entry<String, List<Sample>> e : measurements.entrySet()) {
                List<Sample> r = e.getValue();
                if (r.isEmpty()) {
                    continue;
                }
                datapoint.put(e.getKey(), valueAt(t, r, results.lastDatapoint(e.getKey())));
            }
            results.appendDatapoint(step * s, datapoint);
        }
        log.debug("Aligned {} series onto {} steps of {}s", measurements.size(), steps, step);
    }

    private Double valueAt(double t, List<Sample> r, Double lastEmitted) {
        double allowed = maxDistance;
        boolean last = false;
        Sample prev = null;
        Sample next = null;

        for (int i = 0; i < r.size(); i++) {
            if (r.get(i).getTime() > t) {
                if (i > 0) {
                    prev = r.get(i - 1);
                } else {
                    allowed = step * LEADING_DISTANCE_STEPS;
                }
                next = r.get(i);
                break;
            }
        }
        if (next == null) {
            next = r.get(r.size() - 1);
            last = true;
        }

        if (Math.abs(t - next.getTime()) > allowed) {
            return null;
        }
        if (prev == null) {
            if (last && (lastEmitted == null || Objects.equals(lastEmitted, next.getValue()))) {
                return null;
            }
            return next.getValue();
        }
        if (prev.getValue() == null || next.getValue() == null) {
            return null;
        }
        double slope = (next.getValue() - prev.getValue()) / (next.getTime() - prev.getTime());
        return prev.getValue() + slope * (t - prev.getTime());
    }
}
