package com.mk.fx.qa.load.engine.metrics;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Reduces samples and resource snapshots to summary statistics. Stateless; the result depends only
 * on the multiset of samples, the snapshot sequence and the observed duration.
 */
@Component
public class ResultAggregator {

  public AggregatedResult aggregate(
      Collection<ExecutionSample> samples, List<ResourceSnapshot> snapshots, long durationMs) {
    Objects.requireNonNull(samples, "samples");
    Objects.requireNonNull(snapshots, "snapshots");

    var total = samples.size();
    var memory = memoryUsage(snapshots);
    var cpu = snapshots.stream().map(ResourceSnapshot::cpuUtilizationPercent).toList();
    if (total == 0) {
      return new AggregatedResult(
          0, 0, 0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, memory, cpu, durationMs, Map.of());
    }

    var latencies = samples.stream().mapToDouble(ExecutionSample::latencyMs).sorted().toArray();
    var failed = samples.stream().filter(sample -> !sample.success()).count();
    var successful = total - failed;

    var sum = Arrays.stream(latencies).sum();
    var throughput = durationMs > 0 ? total / (durationMs / 1000.0) : 0.0;

    return new AggregatedResult(
        total,
        successful,
        failed,
        sum / total,
        latencies[0],
        latencies[latencies.length - 1],
        percentile(latencies, 95),
        percentile(latencies, 99),
        throughput,
        failed * 100.0 / total,
        memory,
        cpu,
        durationMs,
        errorBreakdown(samples));
  }

  /** Nearest-rank percentile over an ascending array. */
  static double percentile(double[] sorted, double percentile) {
    if (sorted.length == 0) {
      return 0.0;
    }
    int index = (int) Math.ceil(percentile * sorted.length / 100.0) - 1;
    index = Math.max(0, Math.min(index, sorted.length - 1));
    return sorted[index];
  }

  private static MemoryUsage memoryUsage(List<ResourceSnapshot> snapshots) {
    if (snapshots.isEmpty()) {
      return MemoryUsage.empty();
    }
    var peak = snapshots.stream().mapToDouble(ResourceSnapshot::heapUsedMb).max().orElse(0.0);
    return new MemoryUsage(
        snapshots.get(0).heapUsedMb(), peak, snapshots.get(snapshots.size() - 1).heapUsedMb());
  }

  private static Map<String, Long> errorBreakdown(Collection<ExecutionSample> samples) {
    Map<String, Long> breakdown = new LinkedHashMap<>();
    samples.stream()
        .filter(sample -> !sample.success())
        .map(sample -> sample.error() != null ? sample.error() : "Unknown error")
        .sorted()
        .forEach(error -> breakdown.merge(error, 1L, Long::sum));
    return breakdown;
  }
}
