package com.mk.fx.qa.load.engine.model;

/** Optional replacements for a workload type's latency range and failure rate. */
public record SimulationOverrides(
    Long minLatencyMs, Long maxLatencyMs, Double failureProbability) {

  public static SimulationOverrides none() {
    return new SimulationOverrides(null, null, null);
  }

  public boolean isEmpty() {
    return minLatencyMs == null && maxLatencyMs == null && failureProbability == null;
  }
}
