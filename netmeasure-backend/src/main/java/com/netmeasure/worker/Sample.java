package com.netmeasure.worker;

import lombok.Value;

/**
 * One timestamped measurement. Time is absolute, in seconds since the epoch.
 */
@Value
public class Sample {
    double time;
    Double value;

    public static Sample of(double time, Double value) {
        return new Sample(time, value);
    }
}
