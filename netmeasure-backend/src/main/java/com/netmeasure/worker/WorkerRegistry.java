package com.netmeasure.worker;

import com.netmeasure.model.ConfigurationException;
import com.netmeasure.model.WorkerSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps worker kind ids to factories. The built-in kinds are registered on construction; more can
 * be added at startup with {@link #register(String, WorkerFactory)}.
 */
@Component
public class WorkerRegistry {
    private static final Logger log = LoggerFactory.getLogger(WorkerRegistry.class);

    public static final String DEFAULT_KIND = "process";

    private final Map<String, WorkerFactory> factories = new ConcurrentHashMap<>();
    private final Set<String> commandKinds = ConcurrentHashMap.newKeySet();

    public WorkerRegistry() {
        registerCommand("process", ScalarProcessWorker::new);
        registerCommand("series", SeriesProcessWorker::new);
        register("null", NullWorker::new);
        register("timer", TimerWorker::new);
        register("average", ComputingWorker::average);
        register("sum", ComputingWorker::sum);
        register("smooth_average", ComputingWorker::smoothAverage);
        register("fairness", ComputingWorker::fairness);
        register("diff_min", DiffMinWorker::new);
    }

    /**
     * Registers a worker kind, replacing any existing registration.
     *
     * @param kind kind id used in test definitions
     * @param factory factory for the kind
     */
    public void register(String kind, WorkerFactory factory) {
        factories.put(kind, factory);
        commandKinds.remove(kind);
        log.debug("Registered worker kind: {}", kind);
    }

    /**
     * Registers a worker kind that needs a {@code command}.
     */
    public void registerCommand(String kind, WorkerFactory factory) {
        register(kind, factory);
        commandKinds.add(kind);
    }

    public Set<String> getKinds() {
        return Set.copyOf(factories.keySet());
    }

    /**
     * Checks a spec before any worker is started.
     *
     * @throws ConfigurationException if the kind is unknown or a required command is missing
     */
    public void validate(WorkerSpec spec) {
        String kind = kindOf(spec);
        if (!factories.containsKey(kind)) {
            throw new ConfigurationException("Unknown worker kind '" + kind + "' for worker '" + spec.getName()
                    + "'. Available: " + factories.keySet());
        }
        if (commandKinds.contains(kind) && (spec.getCommand() == null || spec.getCommand().isBlank())) {
            throw new ConfigurationException("No command set for worker '" + spec.getName() + "' of kind " + kind);
        }
    }

    public Worker create(WorkerContext context) {
        validate(context.getSpec());
        return factories.get(kindOf(context.getSpec())).create(context);
    }

    private static String kindOf(WorkerSpec spec) {
        String kind = spec.getKind();
        return kind == null || kind.isBlank() ? DEFAULT_KIND : kind.trim();
    }
}
