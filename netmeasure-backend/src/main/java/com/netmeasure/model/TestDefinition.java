package com.netmeasure.model;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A named measurement test loaded from YAML: which aggregation to use and which workers to run.
 */
@Data
public class TestDefinition {
    private String name;
    private String description;
    private String aggregator;
    private Double stepSize;
    private Integer iterations;
    private Double totalLength;
    private Map<String, WorkerDefinition> workers = new LinkedHashMap<>();
    private String sourceFile;
}
