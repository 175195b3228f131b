package com.mk.fx.qa.load.engine.dto.controllerresponse;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/** Body of a load test submission. */
@Data
public class LoadTestRequest {

  @NotNull
  @JsonProperty("concurrency")
  private Integer concurrency;

  @NotNull
  @JsonProperty("duration")
  private Integer duration;

  @JsonProperty("rampUpSeconds")
  private Integer rampUpSeconds;

  @JsonProperty("workloadType")
  private String workloadType;

  @JsonProperty("overrides")
  private Overrides overrides;

  @Data
  public static class Overrides {
    private Long minLatencyMs;
    private Long maxLatencyMs;
    private Double failureProbability;
  }
}
