package com.netmeasure.worker;

import com.netmeasure.result.ResultSet;
import com.netmeasure.util.Globs;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Worker whose result is a computation over other series of the final data set, such as the
 * average of all upload streams. It produces a {@link WorkerResult.Deferred} immediately; the
 * computation itself runs once every direct result is in the data set.
 */
public class ComputingWorker extends Worker {

    /**
     * Reduces the non-null values of one row to a single value.
     */
    @FunctionalInterface
    public interface Computation {
        Double compute(List<Double> values);
    }

    static final String MEAN_VALUE = "MEAN_VALUE";
    static final String UNITS = "UNITS";

    private final Supplier<Computation> computation;

    protected ComputingWorker(WorkerContext context, String description, Supplier<Computation> computation) {
        super(context);
        this.computation = computation;
        this.command = description + " (computed)";
        this.exitCode = 0;
    }

    public static ComputingWorker average(WorkerContext context) {
        return new ComputingWorker(context, "Average", () -> ComputingWorker::mean);
    }

    public static ComputingWorker sum(WorkerContext context) {
        return new ComputingWorker(context, "Sum", () -> ComputingWorker::total);
    }

    public static ComputingWorker fairness(WorkerContext context) {
        return new ComputingWorker(context, "Fairness", () -> values -> {
            double squares = 0.0;
            for (Double v : values) {
                squares += v * v;
            }
            if (squares == 0.0) {
                return null;
            }
            double s = total(values);
            return s * s / (values.size() * squares);
        });
    }

    /**
     * Running mean of the per-row averages over the last {@code smoothSteps} rows.
     */
    public static ComputingWorker smoothAverage(WorkerContext context) {
        Integer configured = context.getSpec() != null ? context.getSpec().getSmoothSteps() : null;
        int steps = configured != null && configured > 0 ? configured : 5;
        return new ComputingWorker(context, "Smooth average", () -> {
            List<Double> window = new ArrayList<>();
            return values -> {
                window.add(mean(values));
                while (window.size() > steps) {
                    window.remove(0);
                }
                return mean(window);
            };
        });
    }

    @Override
    protected WorkerResult execute() {
        return WorkerResult.deferred(this::postprocess);
    }

    @Override
    public boolean isSilent() {
        return true;
    }

    protected List<String> resolveKeys(ResultSet results) {
        List<String> patterns = getSpec() != null && getSpec().getApplyTo() != null ? getSpec().getApplyTo() : List.of();
        return Globs.expand(patterns, results.getSeriesNames(), List.of(getName()));
    }

    /**
     * Adds this worker's series to the data set.
     *
     * @param results aligned data set
     * @return the same data set
     */
    protected ResultSet postprocess(ResultSet results) {
        List<String> keys = resolveKeys(results);
        if (keys.isEmpty()) {
            return results;
        }

        Computation rows = computation.get();
        List<Double> out = new ArrayList<>(results.size());
        for (int i = 0; i < results.size(); i++) {
            List<Double> values = new ArrayList<>();
            for (String key : keys) {
                Double v = results.series(key).get(i);
                if (v != null) {
                    values.add(v);
                }
            }
            out.add(values.isEmpty() ? null : rows.compute(values));
        }
        results.addSeries(getName(), out);

        Map<String, Object> seriesMeta = results.getSeriesMeta();
        Map<String, Object> own = new LinkedHashMap<>(metadata);
        List<Double> means = new ArrayList<>();
        List<Object> units = new ArrayList<>();
        for (String key : keys) {
            if (!(seriesMeta.get(key) instanceof Map<?, ?> meta)) {
                continue;
            }
            if (meta.get(MEAN_VALUE) instanceof Number mean) {
                means.add(mean.doubleValue());
            }
            if (meta.containsKey(UNITS)) {
                units.add(meta.get(UNITS));
            }
        }
        if (!means.isEmpty()) {
            own.put(MEAN_VALUE, computation.get().compute(means));
        }
        // Inputs that agree on their units pass the value on; otherwise all of them are listed.
        if (!units.isEmpty()) {
            own.put(UNITS, new HashSet<>(units).size() == 1 ? units.get(0) : units);
        }
        seriesMeta.put(getName(), own);
        return results;
    }

    static double total(List<Double> values) {
        double s = 0.0;
        for (Double v : values) {
            s += v;
        }
        return s;
    }

    static Double mean(List<Double> values) {
        return values.isEmpty() ? null : total(values) / values.size();
    }
}
