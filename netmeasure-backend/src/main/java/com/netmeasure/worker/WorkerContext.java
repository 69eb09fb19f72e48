package com.netmeasure.worker;

import com.netmeasure.model.RunSettings;
import com.netmeasure.model.WorkerSpec;
import lombok.Builder;
import lombok.Value;

/**
 * Everything a worker is constructed from: its spec, the shared run settings and the signals that
 * bind it to other workers. Start and kill signals are null when the spec has no dependency.
 */
@Value
@Builder
public class WorkerContext {
    String name;
    RunSettings settings;
    WorkerSpec spec;
    Signal startSignal;
    Signal killSignal;
    Signal finishSignal;
}
