package com.mk.fx.qa.load.engine.cfg;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "load.engine")
public class EngineCfg {

  /** Number of finished reports kept; the oldest is evicted first. */
  @Min(1)
  @Max(10_000)
  private int historySize = 50;

  /** Upper bound on virtual users per run. */
  @Min(1)
  @Max(10_000)
  private int maxConcurrency = 500;

  /** Runs started asynchronously that may execute at the same time; the rest queue. */
  @Min(1)
  @Max(64)
  private int maxConcurrentRuns = 4;

  /** Chance that a recorded sample also triggers a heap snapshot. */
  @DecimalMin("0.0")
  @DecimalMax("1.0")
  private double snapshotProbability = 0.10;

  @Min(0)
  private long jitterMinMs = 50;

  @Min(0)
  private long jitterMaxMs = 150;

  /** Interval of the progress log line for active runs; zero disables it. */
  @NotNull private Duration progressLogInterval = Duration.ofSeconds(5);

  /** Per workload type latency and failure defaults, keyed by type id. */
  @Valid private Map<String, SimulatorDefaults> simulators = new LinkedHashMap<>();

  @Valid @NotNull private Thresholds thresholds = new Thresholds();

  @Data
  public static class SimulatorDefaults {
    @Min(0)
    private Long minLatencyMs;

    @Min(0)
    private Long maxLatencyMs;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double failureProbability;
  }

  @Data
  public static class Thresholds {
    private double failErrorRatePercent = 15.0;
    private double warnErrorRatePercent = 5.0;
    private double warnAverageLatencyMs = 1000.0;
    private double failMemoryGrowthMb = 100.0;
    private double warnMemoryGrowthMb = 50.0;
  }
}
