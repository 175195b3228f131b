package com.mk.fx.qa.load.engine.metrics;

import com.mk.fx.qa.load.engine.cfg.EngineCfg;
import com.mk.fx.qa.load.engine.dto.report.LoadTestReport;
import com.mk.fx.qa.load.engine.model.RunStatus;
import com.mk.fx.qa.load.engine.model.WorkloadProfile;
import com.mk.fx.qa.load.engine.model.WorkloadType;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Classifies aggregated results as PASS, WARNING or FAIL and attaches one recommendation per
 * breached threshold.
 */
@Component
public class ReportGenerator {

  static final String ENGINE_FAILURE_RECOMMENDATION =
      "Investigate the engine failure before trusting these results";
  static final String CANCELLED_NOTE =
      "Run was cancelled before its configured duration; metrics cover a partial run";

  private final EngineCfg.Thresholds thresholds;

  public ReportGenerator(EngineCfg cfg) {
    this.thresholds = Objects.requireNonNull(cfg, "cfg").getThresholds();
  }

  public record Classification(RunStatus status, List<String> recommendations) {}

  public Classification classify(AggregatedResult result) {
    Objects.requireNonNull(result, "result");
    var errorRate = result.errorRatePercent();
    var averageLatency = result.averageLatencyMs();
    var memoryGrowth = result.memoryGrowthMb();

    var status = RunStatus.PASS;
    if (errorRate > thresholds.getFailErrorRatePercent()
        || memoryGrowth > thresholds.getFailMemoryGrowthMb()) {
      status = RunStatus.FAIL;
    } else if (errorRate > thresholds.getWarnErrorRatePercent()
        || averageLatency > thresholds.getWarnAverageLatencyMs()
        || memoryGrowth > thresholds.getWarnMemoryGrowthMb()) {
      status = RunStatus.WARNING;
    }

    List<String> recommendations = new ArrayList<>();
    if (errorRate > thresholds.getWarnErrorRatePercent()) {
      recommendations.add(
          String.format(
              "Error rate of %.1f%% is high: add retries with exponential backoff and a circuit"
                  + " breaker around the failing operation",
              errorRate));
    }
    if (averageLatency > thresholds.getWarnAverageLatencyMs()) {
      recommendations.add(
          String.format(
              "Average latency of %.0f ms is high: introduce caching or batch requests to cut"
                  + " per-operation cost",
              averageLatency));
    }
    if (memoryGrowth > thresholds.getWarnMemoryGrowthMb()) {
      var severity = memoryGrowth > thresholds.getFailMemoryGrowthMb() ? "severe" : "notable";
      recommendations.add(
          String.format(
              "Heap grew by %.1f MB (%s): audit listener and subscription cleanup for leaked"
                  + " references",
              memoryGrowth, severity));
    }
    return new Classification(status, recommendations);
  }

  public LoadTestReport generate(
      UUID runId,
      WorkloadProfile profile,
      WorkloadType type,
      Instant startTime,
      Instant endTime,
      AggregatedResult result,
      boolean cancelled) {
    var classification = classify(result);
    List<String> recommendations = new ArrayList<>(classification.recommendations());
    if (cancelled) {
      recommendations.add(CANCELLED_NOTE);
    }
    return baseReport(runId, profile, type, startTime, endTime, result, cancelled)
        .status(classification.status())
        .recommendations(recommendations)
        .build();
  }

  /**
   * Report for a run that hit an unexpected engine error. Metrics that were collected are kept;
   * the status is always FAIL.
   */
  public LoadTestReport engineFailure(
      UUID runId,
      WorkloadProfile profile,
      WorkloadType type,
      Instant startTime,
      Instant endTime,
      AggregatedResult result,
      boolean cancelled,
      Throwable failure) {
    var summary = result != null ? result : AggregatedResult.empty(0);
    List<String> recommendations = new ArrayList<>(classify(summary).recommendations());
    recommendations.add(ENGINE_FAILURE_RECOMMENDATION);
    return baseReport(runId, profile, type, startTime, endTime, summary, cancelled)
        .status(RunStatus.FAIL)
        .recommendations(recommendations)
        .error(describe(failure))
        .build();
  }

  private static LoadTestReport.LoadTestReportBuilder baseReport(
      UUID runId,
      WorkloadProfile profile,
      WorkloadType type,
      Instant startTime,
      Instant endTime,
      AggregatedResult result,
      boolean cancelled) {
    return LoadTestReport.builder()
        .runId(runId)
        .config(profile)
        .workloadType(type != null ? type.getId() : null)
        .startTime(startTime)
        .endTime(endTime)
        .totalRequests(result.totalRequests())
        .successfulRequests(result.successfulRequests())
        .failedRequests(result.failedRequests())
        .averageLatencyMs(result.averageLatencyMs())
        .minLatencyMs(result.minLatencyMs())
        .maxLatencyMs(result.maxLatencyMs())
        .p95LatencyMs(result.p95LatencyMs())
        .p99LatencyMs(result.p99LatencyMs())
        .throughputReqPerSec(result.throughputReqPerSec())
        .errorRatePercent(result.errorRatePercent())
        .memory(result.memory())
        .cpuUtilization(result.cpuUtilization())
        .durationMs(result.durationMs())
        .cancelled(cancelled)
        .errorBreakdown(result.errorBreakdown());
  }

  private static String describe(Throwable failure) {
    if (failure == null) {
      return "Unknown engine failure";
    }
    var message = failure.getMessage();
    return failure.getClass().getSimpleName() + (message != null ? ": " + message : "");
  }
}
