package com.netmeasure.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

/**
 * Response payload that describes the current state of a run.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RunStatusResponse {
    private String runId;
    private String test;
    private String status;
    private String reason;
    private String dataFile;
    private Integer failedWorkers;
    private Boolean shutdownRequested;
    private String startedAt;
    private String finishedAt;
}
