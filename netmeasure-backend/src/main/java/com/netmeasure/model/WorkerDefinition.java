package com.netmeasure.model;

import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * One worker entry of a YAML test definition.
 */
@Data
public class WorkerDefinition {
    private String kind;
    private String command;
    private String pattern;
    private String runAfter;
    private String killAfter;
    private List<String> transforms;
    private List<String> applyTo;
    private String units;
    private Double delay;
    private Double killTimeout;
    private Double length;
    private Integer smoothSteps;
    private Integer duplicates;
    private Map<String, Object> params;
}
