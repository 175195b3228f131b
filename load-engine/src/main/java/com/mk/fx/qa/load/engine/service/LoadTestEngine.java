package com.mk.fx.qa.load.engine.service;

import static java.util.concurrent.Executors.newFixedThreadPool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.load.engine.cfg.EngineCfg;
import com.mk.fx.qa.load.engine.cfg.ObjectMapperConfig;
import com.mk.fx.qa.load.engine.dto.report.LoadTestReport;
import com.mk.fx.qa.load.engine.executors.CancellationToken;
import com.mk.fx.qa.load.engine.executors.JitterStrategy;
import com.mk.fx.qa.load.engine.executors.SchedulerResult;
import com.mk.fx.qa.load.engine.executors.VirtualUserParameters;
import com.mk.fx.qa.load.engine.executors.VirtualUserScheduler;
import com.mk.fx.qa.load.engine.metrics.AggregatedResult;
import com.mk.fx.qa.load.engine.metrics.LiveRunSnapshot;
import com.mk.fx.qa.load.engine.metrics.ReportGenerator;
import com.mk.fx.qa.load.engine.metrics.ResourceProbe;
import com.mk.fx.qa.load.engine.metrics.ResultAggregator;
import com.mk.fx.qa.load.engine.metrics.SampleCollector;
import com.mk.fx.qa.load.engine.model.WorkloadProfile;
import com.mk.fx.qa.load.engine.model.WorkloadType;
import com.mk.fx.qa.load.engine.simulators.SimulatorRegistry;
import com.mk.fx.qa.load.engine.utils.LoadUtils;
import com.mk.fx.qa.load.engine.utils.RandomSource;
import com.mk.fx.qa.load.engine.utils.Sleeper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for running load tests against the simulated workloads.
 *
 * <p>Responsibilities:
 * - Validates profiles before anything is scheduled.
 * - Runs tests synchronously ({@link #runLoadTest}) or on a bounded run pool ({@link
 *   #startLoadTest}), tracking a cancellation token and live counters per active run.
 * - Aggregates and classifies every finished run and keeps the reports in a bounded history.
 *
 * <p>Thread-safety: all public methods may be called concurrently. Several engines may coexist;
 * nothing is shared between instances.
 */
@Slf4j
@Service
public class LoadTestEngine {

  private final EngineCfg cfg;
  private final SimulatorRegistry simulators;
  private final ResultAggregator aggregator;
  private final ReportGenerator reportGenerator;
  private final RandomSource random;
  private final Sleeper sleeper;
  private final ResourceProbe resourceProbe;
  private final ProfileValidator validator;
  private final ObjectMapper reportWriter;

  private final Map<UUID, ActiveRun> activeRuns = new ConcurrentHashMap<>();
  private final Deque<LoadTestReport> history = new ConcurrentLinkedDeque<>();
  private final AtomicBoolean acceptingRuns = new AtomicBoolean(true);
  private final ExecutorService runExecutor;
  private final ScheduledExecutorService progressLogger;

  public LoadTestEngine(
      EngineCfg cfg,
      SimulatorRegistry simulators,
      ResultAggregator aggregator,
      ReportGenerator reportGenerator,
      RandomSource random,
      Sleeper sleeper,
      ResourceProbe resourceProbe) {
    this.cfg = cfg;
    this.simulators = simulators;
    this.aggregator = aggregator;
    this.reportGenerator = reportGenerator;
    this.random = random;
    this.sleeper = sleeper;
    this.resourceProbe = resourceProbe;
    this.validator = new ProfileValidator(cfg);
    this.reportWriter = ObjectMapperConfig.createObjectMapper();
    this.runExecutor =
        newFixedThreadPool(cfg.getMaxConcurrentRuns(), daemonThreads("load-engine-run-"));
    this.progressLogger = startProgressLogger();
  }

  @PostConstruct
  void logConfiguration() {
    log.info(
        "LoadTestEngine initialised with maxConcurrency={} maxConcurrentRuns={} historySize={}",
        cfg.getMaxConcurrency(),
        cfg.getMaxConcurrentRuns(),
        cfg.getHistorySize());
  }

  /** Runs a load test on the calling thread under a freshly generated run id. */
  public LoadTestReport runLoadTest(WorkloadProfile profile) {
    return runLoadTest(UUID.randomUUID(), profile);
  }

  /**
   * Runs a load test on the calling thread and returns its report once every virtual user has
   * exited. The report is also appended to the history.
   *
   * @throws InvalidWorkloadProfileException if the profile is rejected; nothing is recorded
   * @throws IllegalStateException if the engine is shut down or the run id is already active
   */
  public LoadTestReport runLoadTest(UUID runId, WorkloadProfile profile) {
    var run = register(runId, profile);
    return execute(run);
  }

  /**
   * Validates the profile and starts the run on the engine's run pool.
   *
   * @return the id of the started run, usable with {@link #stopTest} and {@link #getLiveSnapshot}
   */
  public UUID startLoadTest(WorkloadProfile profile) {
    var run = register(UUID.randomUUID(), profile);
    try {
      runExecutor.execute(() -> execute(run));
    } catch (RejectedExecutionException ex) {
      activeRuns.remove(run.runId());
      log.warn("Load test {} rejected: {}", run.runId(), ex.getMessage());
      throw new IllegalStateException("Load engine is shut down", ex);
    }
    return run.runId();
  }

  /**
   * Requests cooperative cancellation of an active run. Users stop at their next loop head, so
   * the run ends after at most one in-flight operation plus jitter.
   *
   * @return true if the run was active, false for unknown or finished ids
   */
  public boolean stopTest(UUID runId) {
    var run = runId != null ? activeRuns.get(runId) : null;
    if (run == null) {
      log.info("Stop requested for unknown or finished load test {}", runId);
      return false;
    }
    if (run.cancellation().cancel()) {
      log.info("Load test {} cancellation requested", runId);
    }
    return true;
  }

  /** Returns a copy of the finished reports, oldest first. */
  public List<LoadTestReport> getTestResults() {
    return List.copyOf(new ArrayList<>(history));
  }

  public void clearResults() {
    history.clear();
    log.info("Load test history cleared");
  }

  public Set<UUID> getActiveRunIds() {
    return Set.copyOf(activeRuns.keySet());
  }

  public Optional<LiveRunSnapshot> getLiveSnapshot(UUID runId) {
    var run = runId != null ? activeRuns.get(runId) : null;
    return Optional.ofNullable(run).map(ActiveRun::snapshot);
  }

  public List<String> getSupportedWorkloadTypes() {
    return simulators.supportedTypes().stream().map(WorkloadType::getId).toList();
  }

  /**
   * Stops accepting runs, cancels the active ones and shuts the run pool down. Runs already in
   * progress finish their current iteration and still produce a report.
   */
  public void shutdown() {
    if (acceptingRuns.compareAndSet(true, false)) {
      log.info("Shutting down load engine with {} active runs", activeRuns.size());
      activeRuns.values().forEach(run -> run.cancellation().cancel());
      runExecutor.shutdown();
      if (progressLogger != null) {
        progressLogger.shutdownNow();
      }
    }
  }

  @PreDestroy
  void onShutdown() {
    shutdown();
  }

  private ActiveRun register(UUID runId, WorkloadProfile profile) {
    validator.validate(profile);
    if (!acceptingRuns.get()) {
      throw new IllegalStateException("Load engine is shut down");
    }
    var id = runId != null ? runId : UUID.randomUUID();
    var type = simulators.resolveType(profile.workloadType());
    var collector = new SampleCollector(resourceProbe, random, cfg.getSnapshotProbability());
    var run =
        new ActiveRun(id, profile, type, new CancellationToken(), collector, System.nanoTime());
    if (activeRuns.putIfAbsent(id, run) != null) {
      throw new IllegalStateException("Load test " + id + " is already running");
    }
    return run;
  }

  private LoadTestReport execute(ActiveRun run) {
    var runId = run.runId();
    var profile = run.profile();
    var startTime = Instant.now();
    SchedulerResult result = null;
    AggregatedResult summary = null;
    LoadTestReport report;
    try {
      log.info(
          "Load test {} started: type={} users={} duration={}s rampUp={}s",
          runId,
          run.type().getId(),
          profile.concurrency(),
          profile.duration(),
          profile.rampUpSeconds());

      var collector = run.collector();
      collector.recordBaseline();
      var latencyProfile = simulators.latencyProfileFor(run.type(), profile.overrides());
      var iterationRunner =
          new SimulatedIterationRunner(
              simulators.simulatorFor(run.type()), latencyProfile, collector);
      var jitter =
          JitterStrategy.uniform(cfg.getJitterMinMs(), cfg.getJitterMaxMs(), random, sleeper);

      result =
          VirtualUserScheduler.execute(
              runId,
              new VirtualUserParameters(
                  profile.concurrency(), profile.runDuration(), profile.rampUp()),
              run.cancellation(),
              iterationRunner,
              jitter);
      collector.recordFinal();

      summary =
          aggregator.aggregate(
              collector.samples(), collector.snapshots(), result.observedDuration().toMillis());
      report =
          result.failure() == null
              ? reportGenerator.generate(
                  runId, profile, run.type(), startTime, Instant.now(), summary, result.cancelled())
              : reportGenerator.engineFailure(
                  runId,
                  profile,
                  run.type(),
                  startTime,
                  Instant.now(),
                  summary,
                  result.cancelled(),
                  result.failure());
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      run.cancellation().cancel();
      log.info("Load test {} interrupted, reporting partial results", runId);
      report = partialReport(run, startTime);
    } catch (Exception ex) {
      log.error("Load test {} failed: {}", runId, ex.getMessage(), ex);
      report =
          reportGenerator.engineFailure(
              runId,
              profile,
              run.type(),
              startTime,
              Instant.now(),
              summary != null ? summary : AggregatedResult.empty(elapsedMillis(run)),
              run.cancellation().isCancellationRequested(),
              ex);
    } finally {
      activeRuns.remove(runId);
    }

    addToHistory(report);
    logReport(report, result);
    return report;
  }

  /** Report built from whatever samples were collected before the coordinator was interrupted. */
  private LoadTestReport partialReport(ActiveRun run, Instant startTime) {
    var collector = run.collector();
    try {
      collector.recordFinal();
      var summary =
          aggregator.aggregate(collector.samples(), collector.snapshots(), elapsedMillis(run));
      return reportGenerator.generate(
          run.runId(), run.profile(), run.type(), startTime, Instant.now(), summary, true);
    } catch (RuntimeException ex) {
      log.error("Load test {} partial report failed: {}", run.runId(), ex.getMessage(), ex);
      return reportGenerator.engineFailure(
          run.runId(),
          run.profile(),
          run.type(),
          startTime,
          Instant.now(),
          AggregatedResult.empty(elapsedMillis(run)),
          true,
          ex);
    }
  }

  private void addToHistory(LoadTestReport report) {
    history.addLast(report);
    while (history.size() > cfg.getHistorySize()) {
      history.pollFirst();
    }
  }

  private void logReport(LoadTestReport report, SchedulerResult result) {
    log.info(
        "Load test {} finished: status={} requests={} errorRate={}% avgLatency={}ms throughput={}/s"
            + " cancelled={}{}",
        report.runId(),
        report.status(),
        report.totalRequests(),
        LoadUtils.round(report.errorRatePercent(), 2),
        LoadUtils.round(report.averageLatencyMs(), 1),
        LoadUtils.round(report.throughputReqPerSec(), 2),
        report.cancelled(),
        result != null
            ? " users=" + result.completedUsers() + "/" + result.startedUsers() + " completed"
            : "");
    if (log.isDebugEnabled()) {
      try {
        log.debug(
            "Load test {} report:\n{}", report.runId(), reportWriter.writeValueAsString(report));
      } catch (JsonProcessingException ex) {
        log.warn("Unable to serialise report {}: {}", report.runId(), ex.getMessage());
      }
    }
  }

  private ScheduledExecutorService startProgressLogger() {
    var interval = cfg.getProgressLogInterval();
    if (interval == null || interval.isZero() || interval.isNegative()) {
      return null;
    }
    var scheduler =
        Executors.newSingleThreadScheduledExecutor(daemonThreads("load-engine-progress-"));
    scheduler.scheduleAtFixedRate(
        this::logProgress, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    return scheduler;
  }

  private void logProgress() {
    for (ActiveRun run : activeRuns.values()) {
      var snapshot = run.snapshot();
      var sb = new StringBuilder();
      sb.append("Load test ")
          .append(snapshot.runId())
          .append(" progress: type=")
          .append(snapshot.workloadType())
          .append(", users=")
          .append(snapshot.usersStarted())
          .append('/')
          .append(snapshot.configuredUsers())
          .append(", requests=")
          .append(snapshot.totalRequests())
          .append(", errors=")
          .append(snapshot.failedRequests())
          .append(", rps=")
          .append(String.format("%.2f", snapshot.requestsPerSecond()))
          .append(", elapsed=")
          .append(snapshot.elapsedMs())
          .append("ms");
      if (snapshot.cancellationRequested()) {
        sb.append(", stopping");
      }
      log.info(sb.toString());
    }
  }

  private static long elapsedMillis(ActiveRun run) {
    return (long) LoadUtils.elapsedMillis(run.startNanos());
  }

  private static ThreadFactory daemonThreads(String prefix) {
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(prefix + thread.getId());
      thread.setDaemon(true);
      return thread;
    };
  }

  private record ActiveRun(
      UUID runId,
      WorkloadProfile profile,
      WorkloadType type,
      CancellationToken cancellation,
      SampleCollector collector,
      long startNanos) {

    LiveRunSnapshot snapshot() {
      var elapsedMs = elapsedMillis(this);
      var total = collector.totalRecorded();
      var rps = elapsedMs > 0 ? total / (elapsedMs / 1000.0) : 0.0;
      return new LiveRunSnapshot(
          runId,
          type.getId(),
          profile.concurrency(),
          collector.usersStarted(),
          total,
          collector.failedRecorded(),
          elapsedMs,
          rps,
          cancellation.isCancellationRequested());
    }
  }
}
