package com.mk.fx.qa.load.engine.model;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Named kinds of simulated operation. Each type carries the latency range and failure rate used
 * when no override is supplied, plus the fixed message recorded when an operation of that type
 * fails.
 */
@Getter
public enum WorkloadType {
  COMPONENT("component", 20, 120, 0.03, "Component render cycle failed"),
  DATA_PROCESSING("data-processing", 100, 400, 0.05, "Data processing batch failed"),
  UI_INTERACTION("ui-interaction", 50, 150, 0.02, "UI interaction handler failed"),
  API_CALL("api-call", 200, 700, 0.08, "API call returned an error response"),
  ANALYTICS("analytics", 300, 900, 0.05, "Analytics computation failed"),
  ANALYTICS_CONCURRENT("analytics-concurrent", 400, 1200, 0.07, "Concurrent analytics job failed"),
  RESEARCH_QUESTION("research-question", 500, 1500, 0.06, "Research question evaluation failed"),
  CONTEXT_PROCESSING("context-processing", 150, 500, 0.04, "Context processing step failed"),
  GENERIC("generic", 100, 300, 0.05, "Generic operation failed");

  private static final Map<String, WorkloadType> ALIASES =
      Map.of("api", API_CALL, "analytics-processing", ANALYTICS);

  private final String id;
  private final long minLatencyMs;
  private final long maxLatencyMs;
  private final double failureProbability;
  private final String failureMessage;

  WorkloadType(
      String id,
      long minLatencyMs,
      long maxLatencyMs,
      double failureProbability,
      String failureMessage) {
    this.id = id;
    this.minLatencyMs = minLatencyMs;
    this.maxLatencyMs = maxLatencyMs;
    this.failureProbability = failureProbability;
    this.failureMessage = failureMessage;
  }

  public LatencyProfile defaultProfile() {
    return new LatencyProfile(minLatencyMs, maxLatencyMs, failureProbability);
  }

  /**
   * Looks up a type by its id, an accepted alias, or the enum constant name. Matching ignores case
   * and surrounding whitespace.
   *
   * @return the matching type, or empty when the value is null, blank or unrecognised
   */
  public static Optional<WorkloadType> fromValue(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    var normalized = value.trim().toLowerCase(Locale.ROOT);
    var alias = ALIASES.get(normalized);
    if (alias != null) {
      return Optional.of(alias);
    }
    return Arrays.stream(values())
        .filter(
            type ->
                type.id.equals(normalized)
                    || type.name().toLowerCase(Locale.ROOT).equals(normalized))
        .findFirst();
  }

  public static Set<String> ids() {
    return Arrays.stream(values())
        .map(WorkloadType::getId)
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }
}
