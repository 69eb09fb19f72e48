package com.netmeasure.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Declarative description of one unit of concurrent work. Immutable once a run starts.
 */
@Value
@Builder(toBuilder = true)
public class WorkerSpec {
    String name;
    String kind;
    String command;
    String pattern;
    String runAfter;
    String killAfter;
    @Singular
    List<String> transforms;
    @Builder.Default
    List<String> applyTo = List.of();
    String units;
    @Builder.Default
    double delay = 0.0;
    Double killTimeout;
    Double length;
    Integer smoothSteps;

    public boolean hasRunAfter() {
        return runAfter != null && !runAfter.isBlank();
    }

    public boolean hasKillAfter() {
        return killAfter != null && !killAfter.isBlank();
    }
}
