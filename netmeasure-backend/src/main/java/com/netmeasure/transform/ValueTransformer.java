package com.netmeasure.transform;

import com.netmeasure.worker.Sample;

import java.util.ArrayList;
import java.util.List;

/**
 * A pure numeric conversion applied to worker output after it has been classified.
 */
public interface ValueTransformer {

    String getName();

    /**
     * Converts a single value. Null stays null.
     */
    Double apply(Double value);

    /**
     * Converts every value of a series. Times are left untouched.
     */
    default List<Sample> applySeries(List<Sample> samples) {
        List<Sample> out = new ArrayList<>(samples.size());
        for (Sample s : samples) {
            out.add(Sample.of(s.getTime(), apply(s.getValue())));
        }
        return out;
    }
}
