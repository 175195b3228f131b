package com.mk.fx.qa.load.engine.dto.report;

import com.mk.fx.qa.load.engine.metrics.MemoryUsage;
import com.mk.fx.qa.load.engine.model.RunStatus;
import com.mk.fx.qa.load.engine.model.WorkloadProfile;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.Builder;

/** Immutable outcome of one load test run. */
@Builder(toBuilder = true)
public record LoadTestReport(
    UUID runId,
    WorkloadProfile config,
    String workloadType,
    Instant startTime,
    Instant endTime,
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
    boolean cancelled,
    RunStatus status,
    List<String> recommendations,
    Map<String, Long> errorBreakdown,
    String error) {

  public LoadTestReport {
    cpuUtilization = cpuUtilization == null ? List.of() : List.copyOf(cpuUtilization);
    recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    errorBreakdown =
        errorBreakdown == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(errorBreakdown));
  }
}
