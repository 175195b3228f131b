package com.mk.fx.qa.load.engine.metrics;

import com.mk.fx.qa.load.engine.utils.RandomSource;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe sink for the samples and resource snapshots of one run.
 *
 * <p>A baseline snapshot is taken before any user starts and a final one after all users exit.
 * Between the two, each recorded sample triggers a snapshot with the configured probability.
 */
public class SampleCollector {

  private final Queue<ExecutionSample> samples = new ConcurrentLinkedQueue<>();
  private final List<ResourceSnapshot> snapshots = new CopyOnWriteArrayList<>();
  private final AtomicLong recorded = new AtomicLong();
  private final AtomicLong failed = new AtomicLong();
  private final AtomicInteger usersStarted = new AtomicInteger();

  private final ResourceProbe resourceProbe;
  private final RandomSource random;
  private final double snapshotProbability;

  public SampleCollector(
      ResourceProbe resourceProbe, RandomSource random, double snapshotProbability) {
    this.resourceProbe = Objects.requireNonNull(resourceProbe, "resourceProbe");
    this.random = Objects.requireNonNull(random, "random");
    this.snapshotProbability = snapshotProbability;
  }

  public void recordBaseline() {
    takeSnapshot();
  }

  public void recordFinal() {
    takeSnapshot();
  }

  public void recordUserStarted() {
    usersStarted.incrementAndGet();
  }

  public void record(ExecutionSample sample) {
    Objects.requireNonNull(sample, "sample");
    samples.add(sample);
    recorded.incrementAndGet();
    if (!sample.success()) {
      failed.incrementAndGet();
    }
    if (random.chance(snapshotProbability)) {
      takeSnapshot();
    }
  }

  public List<ExecutionSample> samples() {
    return List.copyOf(samples);
  }

  public List<ResourceSnapshot> snapshots() {
    return List.copyOf(snapshots);
  }

  public long totalRecorded() {
    return recorded.get();
  }

  public long failedRecorded() {
    return failed.get();
  }

  public int usersStarted() {
    return usersStarted.get();
  }

  private void takeSnapshot() {
    snapshots.add(
        new ResourceSnapshot(
            System.currentTimeMillis(),
            resourceProbe.heapUsedMb(),
            resourceProbe.cpuUtilizationPercent()));
  }
}
