package com.mk.fx.qa.load.engine.service;

import com.mk.fx.qa.load.engine.cfg.EngineCfg;
import com.mk.fx.qa.load.engine.model.SimulationOverrides;
import com.mk.fx.qa.load.engine.model.WorkloadProfile;
import java.util.Objects;

public class ProfileValidator {

  private final EngineCfg cfg;

  public ProfileValidator(EngineCfg cfg) {
    this.cfg = Objects.requireNonNull(cfg, "cfg");
  }

  public void validate(WorkloadProfile profile) {
    if (profile == null) {
      throw new InvalidWorkloadProfileException("Workload profile must not be null");
    }
    if (profile.concurrency() < 1) {
      throw new InvalidWorkloadProfileException(
          "concurrency must be at least 1 but was " + profile.concurrency());
    }
    if (profile.concurrency() > cfg.getMaxConcurrency()) {
      throw new InvalidWorkloadProfileException(
          "concurrency "
              + profile.concurrency()
              + " exceeds the configured maximum of "
              + cfg.getMaxConcurrency());
    }
    if (profile.duration() < 0) {
      throw new InvalidWorkloadProfileException(
          "duration must not be negative but was " + profile.duration());
    }
    if (profile.rampUpSeconds() < 0) {
      throw new InvalidWorkloadProfileException(
          "rampUpSeconds must not be negative but was " + profile.rampUpSeconds());
    }
    validateOverrides(profile.overrides());
  }

  private static void validateOverrides(SimulationOverrides overrides) {
    if (overrides == null) {
      return;
    }
    var min = overrides.minLatencyMs();
    var max = overrides.maxLatencyMs();
    if (min != null && min < 0) {
      throw new InvalidWorkloadProfileException("minLatencyMs must not be negative");
    }
    if (max != null && max < 0) {
      throw new InvalidWorkloadProfileException("maxLatencyMs must not be negative");
    }
    if (min != null && max != null && min > max) {
      throw new InvalidWorkloadProfileException(
          "minLatencyMs " + min + " must not exceed maxLatencyMs " + max);
    }
    var probability = overrides.failureProbability();
    if (probability != null && (probability.isNaN() || probability < 0 || probability > 1)) {
      throw new InvalidWorkloadProfileException(
          "failureProbability must be within [0, 1] but was " + probability);
    }
  }
}
