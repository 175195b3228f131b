package com.mk.fx.qa.load.engine.service;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.mk.fx.qa.load.engine.cfg.EngineCfg;
import com.mk.fx.qa.load.engine.dto.report.LoadTestReport;
import com.mk.fx.qa.load.engine.metrics.ReportGenerator;
import com.mk.fx.qa.load.engine.metrics.ResourceProbe;
import com.mk.fx.qa.load.engine.metrics.ResultAggregator;
import com.mk.fx.qa.load.engine.metrics.RuntimeResourceProbe;
import com.mk.fx.qa.load.engine.model.RunStatus;
import com.mk.fx.qa.load.engine.model.SimulationOverrides;
import com.mk.fx.qa.load.engine.model.WorkloadProfile;
import com.mk.fx.qa.load.engine.simulators.SimulatorRegistry;
import com.mk.fx.qa.load.engine.utils.RandomSource;
import com.mk.fx.qa.load.engine.utils.Sleeper;
import com.mk.fx.qa.load.engine.utils.ThreadLocalRandomSource;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class LoadTestEngineTest {

  private static final SimulationOverrides FAST = new SimulationOverrides(5L, 15L, 0.0);

  private final List<LoadTestEngine> engines = new ArrayList<>();

  @AfterEach
  void tearDown() {
    engines.forEach(LoadTestEngine::shutdown);
  }

  private LoadTestEngine newEngine(
      EngineCfg cfg, ResultAggregator aggregator, ResourceProbe resourceProbe) {
    RandomSource random = new ThreadLocalRandomSource();
    var engine =
        new LoadTestEngine(
            cfg,
            SimulatorRegistry.withDefaults(random, Sleeper.SYSTEM, cfg),
            aggregator,
            new ReportGenerator(cfg),
            random,
            Sleeper.SYSTEM,
            resourceProbe);
    engines.add(engine);
    return engine;
  }

  private LoadTestEngine newEngine(EngineCfg cfg) {
    return newEngine(cfg, new ResultAggregator(), new RuntimeResourceProbe());
  }

  private LoadTestEngine newEngine() {
    return newEngine(new EngineCfg());
  }

  private static void assertReportInvariants(LoadTestReport report) {
    assertNotNull(report.runId());
    assertNotNull(report.status());
    assertNotNull(report.startTime());
    assertNotNull(report.endTime());
    assertFalse(report.endTime().isBefore(report.startTime()));
    assertEquals(
        report.totalRequests(), report.successfulRequests() + report.failedRequests());
    assertTrue(report.errorRatePercent() >= 0 && report.errorRatePercent() <= 100);
    if (report.failedRequests() == 0) {
      assertEquals(0.0, report.errorRatePercent());
    }
    assertTrue(report.throughputReqPerSec() >= 0);
    if (report.totalRequests() == 0) {
      assertEquals(0.0, report.throughputReqPerSec());
    }
    assertTrue(report.minLatencyMs() <= report.maxLatencyMs());
  }

  // -----------------------------------------------------
  // Reference scenarios
  // -----------------------------------------------------
  @Test
  void singleApiUser_recordsAtLeastOneRequest() {
    var engine = newEngine();

    var report = engine.runLoadTest(WorkloadProfile.of(1, 1, 0, "api"));

    assertReportInvariants(report);
    assertTrue(report.totalRequests() >= 1);
    assertEquals("api-call", report.workloadType());
    assertFalse(report.cancelled());
    assertTrue(report.cpuUtilization().size() >= 2);
    assertTrue(report.cpuUtilization().stream().allMatch(cpu -> cpu >= 0 && cpu <= 100));
    assertEquals(List.of(report), engine.getTestResults());
  }

  @Test
  void zeroConcurrency_isRejectedBeforeScheduling() {
    var engine = newEngine();

    assertThrows(
        InvalidWorkloadProfileException.class,
        () -> engine.runLoadTest(WorkloadProfile.of(0, 1, 0, "api")));
    assertTrue(engine.getTestResults().isEmpty());
    assertTrue(engine.getActiveRunIds().isEmpty());
  }

  @Test
  void rampedUiInteractionRuns_backToBack_bothSatisfyInvariants() {
    var engine = newEngine();
    var profile = WorkloadProfile.of(10, 5, 2, "ui-interaction");

    var first = engine.runLoadTest(profile);
    var second = engine.runLoadTest(profile);

    assertReportInvariants(first);
    assertReportInvariants(second);
    assertTrue(first.totalRequests() >= 10);
    assertTrue(second.totalRequests() >= 10);
    assertNotEquals(first.runId(), second.runId());
    assertEquals(2, engine.getTestResults().size());
  }

  @Test
  void certainFailure_yieldsFullErrorRateAndFail() {
    var engine = newEngine();
    var profile = new WorkloadProfile(2, 1, 0, "api", new SimulationOverrides(1L, 5L, 1.0));

    var report = engine.runLoadTest(profile);

    assertReportInvariants(report);
    assertTrue(report.totalRequests() >= 2);
    assertEquals(0, report.successfulRequests());
    assertEquals(100.0, report.errorRatePercent());
    assertEquals(RunStatus.FAIL, report.status());
    assertEquals(
        Long.valueOf(report.totalRequests()),
        report.errorBreakdown().get("API call returned an error response"));
    assertFalse(report.recommendations().isEmpty());
  }

  @Test
  void simulatedFailures_doNotStopTheUser() {
    var engine = newEngine();
    var profile = new WorkloadProfile(1, 1, 0, "generic", new SimulationOverrides(5L, 10L, 1.0));

    var report = engine.runLoadTest(profile);

    assertTrue(report.totalRequests() > 1);
    assertEquals(report.totalRequests(), report.failedRequests());
    assertEquals(RunStatus.FAIL, report.status());
    assertNull(report.error());
  }

  // -----------------------------------------------------
  // Facade behaviour
  // -----------------------------------------------------
  @Test
  void unknownWorkloadType_fallsBackToGeneric() {
    var engine = newEngine();

    var report = engine.runLoadTest(new WorkloadProfile(1, 0, 0, "mystery", FAST));

    assertEquals("generic", report.workloadType());
    assertEquals(0, report.totalRequests());
    assertEquals(0.0, report.throughputReqPerSec());
  }

  @Test
  void stopTest_endsRunLongBeforeItsDuration() throws Exception {
    var engine = newEngine();

    var started = System.nanoTime();
    var runId = engine.startLoadTest(WorkloadProfile.of(4, 30, 0, "api-call"));
    assertTrue(engine.getActiveRunIds().contains(runId));
    TimeUnit.MILLISECONDS.sleep(300);

    assertTrue(engine.stopTest(runId));

    await().atMost(Duration.ofSeconds(5)).until(() -> engine.getTestResults().size() == 1);
    var elapsed = Duration.ofNanos(System.nanoTime() - started);
    var report = engine.getTestResults().get(0);

    assertReportInvariants(report);
    assertEquals(runId, report.runId());
    assertTrue(report.cancelled());
    assertTrue(report.durationMs() < 5_000);
    assertTrue(elapsed.toSeconds() < 10);
    assertTrue(engine.getActiveRunIds().isEmpty());
    assertFalse(engine.stopTest(runId));
  }

  @Test
  void stopTest_isNoOpForUnknownRuns() {
    var engine = newEngine();

    assertFalse(engine.stopTest(UUID.randomUUID()));
    assertFalse(engine.stopTest(null));
    assertTrue(engine.getTestResults().isEmpty());
  }

  @Test
  void liveSnapshot_tracksAnActiveRun() {
    var engine = newEngine();
    var runId = engine.startLoadTest(new WorkloadProfile(2, 30, 0, "component", FAST));

    await()
        .atMost(Duration.ofSeconds(5))
        .until(
            () -> engine.getLiveSnapshot(runId).map(s -> s.totalRequests() > 0).orElse(false));
    var snapshot = engine.getLiveSnapshot(runId).orElseThrow();
    assertEquals("component", snapshot.workloadType());
    assertEquals(2, snapshot.configuredUsers());
    assertFalse(snapshot.cancellationRequested());

    engine.stopTest(runId);
    await().atMost(Duration.ofSeconds(5)).until(() -> engine.getTestResults().size() == 1);
    assertTrue(engine.getLiveSnapshot(runId).isEmpty());
  }

  @Test
  void clearResults_emptiesHistory_andIsIdempotent() {
    var engine = newEngine();
    engine.runLoadTest(new WorkloadProfile(1, 0, 0, "generic", FAST));
    assertEquals(1, engine.getTestResults().size());

    engine.clearResults();
    assertTrue(engine.getTestResults().isEmpty());
    engine.clearResults();
    assertTrue(engine.getTestResults().isEmpty());
  }

  @Test
  void history_isBounded_andEvictsOldestFirst() {
    var cfg = new EngineCfg();
    cfg.setHistorySize(2);
    var engine = newEngine(cfg);

    engine.runLoadTest(new WorkloadProfile(1, 0, 0, "generic", FAST));
    var second = engine.runLoadTest(new WorkloadProfile(1, 0, 0, "generic", FAST));
    var third = engine.runLoadTest(new WorkloadProfile(1, 0, 0, "generic", FAST));

    var history = engine.getTestResults();
    assertEquals(List.of(second, third), history);
    assertThrows(UnsupportedOperationException.class, () -> history.add(third));
  }

  @Test
  void engineFailure_isReportedAsFail_andRecorded() {
    var aggregator = mock(ResultAggregator.class);
    when(aggregator.aggregate(any(), anyList(), anyLong()))
        .thenThrow(new IllegalStateException("aggregation exploded"));
    var engine = newEngine(new EngineCfg(), aggregator, new RuntimeResourceProbe());

    var report = engine.runLoadTest(new WorkloadProfile(1, 0, 0, "generic", FAST));

    assertEquals(RunStatus.FAIL, report.status());
    assertEquals("IllegalStateException: aggregation exploded", report.error());
    assertEquals(0, report.totalRequests());
    assertEquals(List.of(report), engine.getTestResults());
  }

  @Test
  void heapGrowth_failsTheRun() {
    var readings = new AtomicInteger();
    ResourceProbe growingHeap = () -> readings.getAndIncrement() == 0 ? 100.0 : 250.0;
    var engine = newEngine(new EngineCfg(), new ResultAggregator(), growingHeap);

    var report = engine.runLoadTest(new WorkloadProfile(1, 0, 0, "generic", FAST));

    assertEquals(RunStatus.FAIL, report.status());
    assertEquals(100.0, report.memory().initialMb());
    assertEquals(250.0, report.memory().finalMb());
    assertEquals(250.0, report.memory().peakMb());
    assertTrue(report.recommendations().stream().anyMatch(line -> line.contains("listener")));
  }

  @Test
  void duplicateActiveRunId_isRejected() throws Exception {
    var engine = newEngine();
    var runId = UUID.randomUUID();
    var running =
        CompletableFuture.supplyAsync(
            () -> engine.runLoadTest(runId, new WorkloadProfile(1, 30, 0, "generic", FAST)));
    await().atMost(Duration.ofSeconds(2)).until(() -> engine.getActiveRunIds().contains(runId));

    assertThrows(
        IllegalStateException.class,
        () -> engine.runLoadTest(runId, new WorkloadProfile(1, 0, 0, "generic", FAST)));

    engine.stopTest(runId);
    var report = running.get(5, TimeUnit.SECONDS);
    assertTrue(report.cancelled());
  }

  @Test
  void shutdown_rejectsFurtherRuns() {
    var engine = newEngine();
    engine.shutdown();

    var ex =
        assertThrows(
            IllegalStateException.class,
            () -> engine.runLoadTest(WorkloadProfile.of(1, 0, 0, "generic")));
    assertEquals("Load engine is shut down", ex.getMessage());
    assertThrows(
        IllegalStateException.class,
        () -> engine.startLoadTest(WorkloadProfile.of(1, 0, 0, "generic")));
  }

  @Test
  void shutdownEngine_stillReportsInvalidProfilesAsConfigurationErrors() {
    var engine = newEngine();
    engine.shutdown();

    assertThrows(
        InvalidWorkloadProfileException.class,
        () -> engine.runLoadTest(WorkloadProfile.of(0, 1, 0, "generic")));
    assertThrows(
        InvalidWorkloadProfileException.class,
        () -> engine.startLoadTest(WorkloadProfile.of(1, -1, 0, "generic")));
  }

  @Test
  void engines_doNotShareState() {
    var first = newEngine();
    var second = newEngine();

    first.runLoadTest(new WorkloadProfile(1, 0, 0, "generic", FAST));

    assertEquals(1, first.getTestResults().size());
    assertTrue(second.getTestResults().isEmpty());
  }
}
