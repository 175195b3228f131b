package com.mk.fx.qa.load.engine.metrics;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Heap usage in megabytes at the start of a run, its peak, and at the end. */
public record MemoryUsage(
    @JsonProperty("initial") double initialMb,
    @JsonProperty("peak") double peakMb,
    @JsonProperty("final") double finalMb) {

  public static MemoryUsage empty() {
    return new MemoryUsage(0.0, 0.0, 0.0);
  }

  @JsonIgnore
  public double growthMb() {
    return finalMb - initialMb;
  }
}
