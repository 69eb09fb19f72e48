package com.netmeasure.worker;

import com.netmeasure.result.ResultSet;

/**
 * A computation over an already aligned data set, applied after every direct worker result has
 * been merged.
 */
@FunctionalInterface
public interface Postprocessor {
    ResultSet apply(ResultSet results);
}
