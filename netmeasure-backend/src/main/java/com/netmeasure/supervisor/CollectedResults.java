package com.netmeasure.supervisor;

import com.netmeasure.worker.Postprocessor;
import com.netmeasure.worker.WorkerResult;
import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merged output of one collect round.
 *
 * <p>{@code results} holds only scalar and series values, keyed by worker name or by
 * {@code worker::subKey} for named results. Deferred postprocessors are kept in registration order.
 */
@Getter
public class CollectedResults {
    private final Map<String, WorkerResult> results = new LinkedHashMap<>();
    private final Map<String, Object> seriesMetadata = new LinkedHashMap<>();
    private final Map<String, List<Map<String, Object>>> rawValues = new LinkedHashMap<>();
    private final Map<String, Object> testParameters = new LinkedHashMap<>();
    private final List<Postprocessor> postprocessors = new ArrayList<>();
    private int failedWorkers;
    private boolean stoppedEarly;

    void incrementFailedWorkers() {
        failedWorkers++;
    }

    void markStoppedEarly() {
        stoppedEarly = true;
    }

    /**
     * Scalar values by name; series results are skipped.
     */
    public Map<String, Double> scalars() {
        Map<String, Double> out = new LinkedHashMap<>();
        results.forEach((name, result) -> {
            if (result.getKind() == WorkerResult.Kind.SCALAR) {
                out.put(name, ((WorkerResult.Scalar) result).getValue());
            }
        });
        return out;
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }
}
