package com.mk.fx.qa.load.engine.simulators;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.load.engine.cfg.EngineCfg;
import com.mk.fx.qa.load.engine.model.LatencyProfile;
import com.mk.fx.qa.load.engine.model.SimulationOverrides;
import com.mk.fx.qa.load.engine.model.WorkloadType;
import com.mk.fx.qa.load.engine.utils.RecordingSleeper;
import com.mk.fx.qa.load.engine.utils.ScriptedRandomSource;
import java.util.List;
import org.junit.jupiter.api.Test;

class SimulatorRegistryTest {

  private final ScriptedRandomSource random = new ScriptedRandomSource(0.5);
  private final RecordingSleeper sleeper = new RecordingSleeper();

  @Test
  void withDefaults_registersEveryWorkloadType() {
    var registry = SimulatorRegistry.withDefaults(random, sleeper, new EngineCfg());

    assertEquals(List.of(WorkloadType.values()), registry.supportedTypes());
  }

  @Test
  void resolveType_fallsBackToGeneric_forUnknownOrMissingIds() {
    var registry = SimulatorRegistry.withDefaults(random, sleeper, new EngineCfg());

    assertEquals(WorkloadType.GENERIC, registry.resolveType("teleportation"));
    assertEquals(WorkloadType.GENERIC, registry.resolveType(null));
    assertEquals(WorkloadType.API_CALL, registry.resolveType("api"));
  }

  @Test
  void simulatorFor_usesGeneric_whenTypeIsNotRegistered() {
    var generic = new GenericSimulator(random, sleeper);
    var registry = new SimulatorRegistry(List.of(generic), new EngineCfg());

    assertSame(generic, registry.simulatorFor(WorkloadType.ANALYTICS));
  }

  @Test
  void constructor_rejectsDuplicateRegistrations() {
    var ex =
        assertThrows(
            IllegalStateException.class,
            () ->
                new SimulatorRegistry(
                    List.of(
                        new GenericSimulator(random, sleeper),
                        new GenericSimulator(random, sleeper)),
                    new EngineCfg()));
    assertTrue(ex.getMessage().contains("generic"));
  }

  @Test
  void constructor_requiresGenericFallback() {
    assertThrows(
        IllegalStateException.class,
        () ->
            new SimulatorRegistry(
                List.of(new ApiCallSimulator(random, sleeper)), new EngineCfg()));
  }

  @Test
  void latencyProfileFor_prefersRunOverrides_thenConfiguredDefaults_thenBuiltIns() {
    var cfg = new EngineCfg();
    var configured = new EngineCfg.SimulatorDefaults();
    configured.setMinLatencyMs(10L);
    configured.setMaxLatencyMs(20L);
    cfg.getSimulators().put("api-call", configured);
    var registry = SimulatorRegistry.withDefaults(random, sleeper, cfg);

    assertEquals(
        new LatencyProfile(10, 20, 0.08), registry.latencyProfileFor(WorkloadType.API_CALL, null));
    assertEquals(
        new LatencyProfile(10, 20, 1.0),
        registry.latencyProfileFor(
            WorkloadType.API_CALL, new SimulationOverrides(null, null, 1.0)));
    assertEquals(
        new LatencyProfile(1, 2, 0.08),
        registry.latencyProfileFor(WorkloadType.API_CALL, new SimulationOverrides(1L, 2L, null)));
    assertEquals(
        WorkloadType.COMPONENT.defaultProfile(),
        registry.latencyProfileFor(WorkloadType.COMPONENT, SimulationOverrides.none()));
  }
}
