package com.netmeasure.aggregation;

import com.netmeasure.model.RunSettings;
import com.netmeasure.model.WorkerSpec;
import com.netmeasure.result.ResultSet;
import com.netmeasure.supervisor.CollectedResults;
import com.netmeasure.supervisor.Supervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Runs every worker {@code iterations} times; each round becomes one datapoint at x = round
 * index, starting at 0. Every worker is expected to yield one number per round; a round
 * without a number for a worker records null.
 *
 * <p>Series metadata and raw values are replaced by each round, not merged, so the stored
 * values are those of the last round.
 */
public class IterationAggregator extends Aggregator {
    private static final Logger log = LoggerFactory.getLogger(IterationAggregator.class);

    private final int iterations;

    public IterationAggregator(Supervisor supervisor, RunSettings settings, Map<String, WorkerSpec> specs) {
        super(supervisor, settings, specs);
        this.iterations = settings.getIterations();
    }

    @Override
    protected void aggregate(ResultSet results) {
        for (int i = 0; i < iterations; i++) {
            if (i > 0 && supervisor.isShutdownRequested()) {
                log.info("Shutdown requested; stopping after {} of {} iterations", i, iterations);
                break;
            }
            CollectedResults collected = collect();
            if (collected.getResults().size() > collected.scalars().size()) {
                log.warn("Ignoring non-scalar results in iteration {}: {}", i, collected.getResults().keySet());
            }
            Map<String, Double> data = collected.scalars();
            recordMetadata(results, collected);
            // A worker first heard from in a later round gets nulls for the earlier ones.
            results.createSeries(data.keySet());
            results.appendDatapoint(i, data);
            log.debug("Iteration {} of {} collected: {}", i + 1, iterations, data);
        }
    }
}
