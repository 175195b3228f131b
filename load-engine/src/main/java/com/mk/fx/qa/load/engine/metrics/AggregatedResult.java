package com.mk.fx.qa.load.engine.metrics;

import java.util.List;
import java.util.Map;

/** Summary statistics computed from a run's samples and snapshots. */
public record AggregatedResult(
    long totalRequests,
    long successfulRequests,
    long failedRequests,
    double averageLatencyMs,
    double minLatencyMs,
    double maxLatencyMs,
    double p95LatencyMs,
    double p99LatencyMs,
    double throughputReqPerSec,
    double errorRatePercent,
    MemoryUsage memory,
    List<Double> cpuUtilization,
    long durationMs,
    Map<String, Long> errorBreakdown) {

  public AggregatedResult {
    cpuUtilization = cpuUtilization == null ? List.of() : List.copyOf(cpuUtilization);
  }

  public static AggregatedResult empty(long durationMs) {
    return new AggregatedResult(
        0,
        0,
        0,
        0.0,
        0.0,
        0.0,
        0.0,
        0.0,
        0.0,
        0.0,
        MemoryUsage.empty(),
        List.of(),
        durationMs,
        Map.of());
  }

  public double memoryGrowthMb() {
    return memory.growthMb();
  }
}
