package com.netmeasure.worker;

import com.netmeasure.result.ResultSet;

import java.util.ArrayList;
import java.util.List;

/**
 * Computed series holding the first input series minus its own minimum.
 */
public class DiffMinWorker extends ComputingWorker {

    public DiffMinWorker(WorkerContext context) {
        super(context, "Diff from min", () -> values -> null);
    }

    @Override
    protected ResultSet postprocess(ResultSet results) {
        List<String> keys = resolveKeys(results);
        if (keys.isEmpty()) {
            return results;
        }
        List<Double> data = results.series(keys.get(0));
        Double min = null;
        for (Double v : data) {
            if (v != null && (min == null || v < min)) {
                min = v;
            }
        }
        List<Double> out = new ArrayList<>(data.size());
        for (Double v : data) {
            out.add(v == null || min == null ? null : v - min);
        }
        results.addSeries(getName(), out);
        return results;
    }
}
