package com.mk.fx.qa.load.engine.model;

import java.time.Duration;

/**
 * Describes one load test run.
 *
 * @param concurrency number of virtual users
 * @param duration seconds each virtual user keeps issuing operations
 * @param rampUpSeconds window over which user start times are spread
 * @param workloadType id of the simulated operation; unknown ids fall back to generic
 * @param overrides optional latency and failure overrides, may be null
 */
public record WorkloadProfile(
    int concurrency,
    int duration,
    int rampUpSeconds,
    String workloadType,
    SimulationOverrides overrides) {

  public static WorkloadProfile of(
      int concurrency, int duration, int rampUpSeconds, String workloadType) {
    return new WorkloadProfile(concurrency, duration, rampUpSeconds, workloadType, null);
  }

  public Duration runDuration() {
    return Duration.ofSeconds(duration);
  }

  public Duration rampUp() {
    return Duration.ofSeconds(rampUpSeconds);
  }
}
