package com.netmeasure.aggregation;

import com.netmeasure.model.ConfigurationException;
import com.netmeasure.model.RunSettings;
import com.netmeasure.model.WorkerSpec;
import com.netmeasure.supervisor.Supervisor;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps aggregator kind ids ({@code timeseries}, {@code iteration}) to constructors.
 */
@Component
public class AggregatorRegistry {

    /**
     * Creates an aggregator of one kind.
     */
    @FunctionalInterface
    public interface AggregatorFactory {
        Aggregator create(Supervisor supervisor, RunSettings settings, Map<String, WorkerSpec> specs);
    }

    private final Map<String, AggregatorFactory> factories = new ConcurrentHashMap<>();

    public AggregatorRegistry() {
        register("timeseries", TimeSeriesAggregator::new);
        register("iteration", IterationAggregator::new);
    }

    public void register(String kind, AggregatorFactory factory) {
        factories.put(kind, factory);
    }

    public Set<String> getKinds() {
        return Set.copyOf(factories.keySet());
    }

    public boolean supports(String kind) {
        return kind != null && factories.containsKey(kind);
    }

    public Aggregator create(String kind, Supervisor supervisor, RunSettings settings, Map<String, WorkerSpec> specs) {
        AggregatorFactory factory = kind == null ? null : factories.get(kind);
        if (factory == null) {
            throw new ConfigurationException("Aggregator not found: '" + kind + "'. Available: " + factories.keySet());
        }
        return factory.create(supervisor, settings, specs);
    }
}
