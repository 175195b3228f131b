package com.mk.fx.qa.load.engine.simulators;

import com.mk.fx.qa.load.engine.cfg.EngineCfg;
import com.mk.fx.qa.load.engine.model.LatencyProfile;
import com.mk.fx.qa.load.engine.model.SimulationOverrides;
import com.mk.fx.qa.load.engine.model.WorkloadType;
import com.mk.fx.qa.load.engine.utils.RandomSource;
import com.mk.fx.qa.load.engine.utils.Sleeper;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Maps workload types to simulators and resolves the latency profile a run uses.
 *
 * <p>Unknown or missing type ids resolve to {@link WorkloadType#GENERIC}, which must always be
 * registered.
 */
@Slf4j
@Component
public class SimulatorRegistry {

  private final Map<WorkloadType, WorkloadSimulator> simulators;
  private final EngineCfg cfg;

  public SimulatorRegistry(List<WorkloadSimulator> available, EngineCfg cfg) {
    Objects.requireNonNull(available, "available");
    this.cfg = Objects.requireNonNull(cfg, "cfg");
    Map<WorkloadType, WorkloadSimulator> byType = new EnumMap<>(WorkloadType.class);
    for (WorkloadSimulator simulator : available) {
      var previous = byType.putIfAbsent(simulator.supportedType(), simulator);
      if (previous != null) {
        throw new IllegalStateException(
            "Duplicate simulator for workload type " + simulator.supportedType().getId());
      }
    }
    if (!byType.containsKey(WorkloadType.GENERIC)) {
      throw new IllegalStateException("No simulator registered for the generic workload type");
    }
    this.simulators = Collections.unmodifiableMap(byType);
    log.info("Registered simulators for workload types {}", byType.keySet());
  }

  /** Registry holding every built-in simulator. */
  public static SimulatorRegistry withDefaults(
      RandomSource random, Sleeper sleeper, EngineCfg cfg) {
    return new SimulatorRegistry(
        List.of(
            new ComponentRenderSimulator(random, sleeper),
            new DataProcessingSimulator(random, sleeper),
            new UiInteractionSimulator(random, sleeper),
            new ApiCallSimulator(random, sleeper),
            new AnalyticsSimulator(random, sleeper),
            new ConcurrentAnalyticsSimulator(random, sleeper),
            new ResearchQuestionSimulator(random, sleeper),
            new ContextProcessingSimulator(random, sleeper),
            new GenericSimulator(random, sleeper)),
        cfg);
  }

  public WorkloadType resolveType(String requested) {
    return WorkloadType.fromValue(requested)
        .orElseGet(
            () -> {
              log.warn(
                  "Unknown workload type '{}', falling back to {}",
                  requested,
                  WorkloadType.GENERIC.getId());
              return WorkloadType.GENERIC;
            });
  }

  public WorkloadSimulator simulatorFor(WorkloadType type) {
    var simulator = simulators.get(type);
    if (simulator == null) {
      log.warn("No simulator registered for {}, using generic", type);
      return simulators.get(WorkloadType.GENERIC);
    }
    return simulator;
  }

  /**
   * Resolves the effective latency profile. Per-run overrides win over configured defaults, which
   * win over the type's built-in values.
   */
  public LatencyProfile latencyProfileFor(WorkloadType type, SimulationOverrides overrides) {
    var configured = cfg.getSimulators().get(type.getId());
    var profile = type.defaultProfile();
    if (configured != null) {
      profile =
          profile.withOverrides(
              new SimulationOverrides(
                  configured.getMinLatencyMs(),
                  configured.getMaxLatencyMs(),
                  configured.getFailureProbability()));
    }
    return profile.withOverrides(overrides);
  }

  public List<WorkloadType> supportedTypes() {
    return List.copyOf(simulators.keySet());
  }
}
