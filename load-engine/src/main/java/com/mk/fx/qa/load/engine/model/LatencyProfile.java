package com.mk.fx.qa.load.engine.model;

/**
 * Latency range and failure rate applied to every simulated operation of a run.
 *
 * @param minLatencyMs inclusive lower bound of the drawn latency
 * @param maxLatencyMs inclusive upper bound of the drawn latency
 * @param failureProbability chance in [0, 1] that an operation reports failure
 */
public record LatencyProfile(long minLatencyMs, long maxLatencyMs, double failureProbability) {

  /** Returns a copy where every non-null field of {@code overrides} replaces the current value. */
  public LatencyProfile withOverrides(SimulationOverrides overrides) {
    if (overrides == null) {
      return this;
    }
    return new LatencyProfile(
        overrides.minLatencyMs() != null ? overrides.minLatencyMs() : minLatencyMs,
        overrides.maxLatencyMs() != null ? overrides.maxLatencyMs() : maxLatencyMs,
        overrides.failureProbability() != null
            ? overrides.failureProbability()
            : failureProbability);
  }
}
