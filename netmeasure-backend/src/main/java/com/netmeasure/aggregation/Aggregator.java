package com.netmeasure.aggregation;

import com.netmeasure.model.RunSettings;
import com.netmeasure.model.WorkerSpec;
import com.netmeasure.result.ResultSet;
import com.netmeasure.supervisor.CollectedResults;
import com.netmeasure.supervisor.Supervisor;
import com.netmeasure.worker.Postprocessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Drives a {@link Supervisor} and turns its rounds into an aligned {@link ResultSet}.
 */
public abstract class Aggregator {
    private static final Logger log = LoggerFactory.getLogger(Aggregator.class);

    static final String NO_DATA_MESSAGE =
            "No data to aggregate. Enable debug logging for com.netmeasure.supervisor and check the log to investigate.";

    protected final Supervisor supervisor;
    protected final RunSettings settings;
    protected final Map<String, WorkerSpec> specs;
    private final List<Postprocessor> postprocessors = new ArrayList<>();

    protected Aggregator(Supervisor supervisor, RunSettings settings, Map<String, WorkerSpec> specs) {
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.specs = new LinkedHashMap<>(Objects.requireNonNull(specs, "specs"));
    }

    /**
     * Fills the result set from one or more collect rounds.
     *
     * @param results result set seeded with the run metadata
     */
    protected abstract void aggregate(ResultSet results);

    /**
     * Aggregates and then applies every deferred postprocessor, in registration order.
     *
     * @param results result set seeded with the run metadata
     * @return the final result set
     */
    public ResultSet run(ResultSet results) {
        aggregate(results);
        return postprocess(results);
    }

    /**
     * Runs one round and keeps its deferred postprocessors.
     */
    protected CollectedResults collect() {
        CollectedResults collected = supervisor.collect(specs);
        postprocessors.clear();
        postprocessors.addAll(collected.getPostprocessors());
        return collected;
    }

    protected ResultSet postprocess(ResultSet results) {
        ResultSet current = results;
        for (Postprocessor p : postprocessors) {
            current = p.apply(current);
        }
        if (!postprocessors.isEmpty()) {
            log.debug("Applied {} postprocessors to {}", postprocessors.size(), current.getName());
        }
        return current;
    }

    protected void recordMetadata(ResultSet results, CollectedResults collected) {
        results.meta(ResultSet.SERIES_META, new LinkedHashMap<>(collected.getSeriesMetadata()));
        results.meta(ResultSet.TEST_PARAMETERS, new LinkedHashMap<>(collected.getTestParameters()));
        results.meta(ResultSet.FAILED_WORKERS, collected.getFailedWorkers());
        results.setRawValues(collected.getRawValues());
    }
}
