package com.netmeasure.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.util.List;

/**
 * Request payload for starting a test run.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RunRequest {
    @NotBlank
    private String test;
    private String host;
    private List<String> hosts;
    @Positive
    private Double length;
    @Positive
    private Double stepSize;
    @Min(1)
    private Integer iterations;
    private String title;
    private String note;
}
