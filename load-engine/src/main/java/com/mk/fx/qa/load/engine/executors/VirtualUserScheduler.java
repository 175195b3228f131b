package com.mk.fx.qa.load.engine.executors;

import static com.mk.fx.qa.load.engine.utils.LoadUtils.toDuration;
import static java.util.concurrent.Executors.newFixedThreadPool;

import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a fixed number of virtual users, each repeating its operation until its own duration has
 * elapsed or the run is cancelled.
 *
 * <p>Threading: one daemon thread per user. Ramp-up is achieved by delaying the submission of user
 * {@code i} until {@code rampUp * i / users} after scheduling started. Users are never interrupted;
 * cancellation is observed at the head of each iteration, so the in-flight operation finishes. A
 * run only counts as cancelled when a user or the ramp-up loop actually observed the request.
 */
@Slf4j
public final class VirtualUserScheduler {

  private static final long WAIT_CHUNK_MILLIS = 100L;

  private VirtualUserScheduler() {
    throw new UnsupportedOperationException("VirtualUserScheduler cannot be instantiated");
  }

  /**
   * Runs the users and blocks until every started user has exited.
   *
   * @param runId run identifier used for thread names and logs
   * @param parameters user count, per-user duration and ramp-up window
   * @param cancellation token checked at every loop head and during ramp-up waits
   * @param iterationRunner callback invoked for each user iteration
   * @param jitter pause taken after every iteration
   * @return counts, cancellation flag, observed duration and the first user failure if any
   * @throws InterruptedException if the coordinating thread is interrupted
   */
  public static SchedulerResult execute(
      UUID runId,
      VirtualUserParameters parameters,
      CancellationToken cancellation,
      VirtualUserIterationRunner iterationRunner,
      JitterStrategy jitter)
      throws InterruptedException {
    Objects.requireNonNull(runId, "runId");
    Objects.requireNonNull(parameters, "parameters");
    Objects.requireNonNull(cancellation, "cancellation");
    Objects.requireNonNull(iterationRunner, "iterationRunner");
    Objects.requireNonNull(jitter, "jitter");

    var users = Math.max(1, parameters.users());
    var durationNanos = toDuration(parameters.duration()).toNanos();
    var rampUp = toDuration(parameters.rampUp());

    var cancellationObserved = new AtomicBoolean(false);
    var completedUsers = new AtomicInteger();
    var failure = new AtomicReference<Throwable>();
    var userNumber = new AtomicInteger();

    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("load-engine-user-" + runId + "-" + userNumber.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };

    var executor = newFixedThreadPool(users, threadFactory);
    List<Future<?>> futures = new ArrayList<>();
    var startNanos = System.nanoTime();

    try {
      log.debug("Run {} starting {} users over {}", runId, users, rampUp);
      for (int userIndex = 0; userIndex < users; userIndex++) {
        var offsetMillis = computeStartOffsetMillis(userIndex, users, rampUp);
        if (!waitUntil(startNanos + TimeUnit.MILLISECONDS.toNanos(offsetMillis), cancellation)) {
          cancellationObserved.set(true);
          log.info("Run {} stopping ramp-up at user {} due to cancellation", runId, userIndex + 1);
          break;
        }

        final var currentUser = userIndex;
        futures.add(
            executor.submit(
                () ->
                    runVirtualUser(
                        runId,
                        users,
                        currentUser,
                        durationNanos,
                        cancellation,
                        cancellationObserved,
                        completedUsers,
                        failure,
                        iterationRunner,
                        jitter)));
      }

      log.debug("Run {} ramp-up complete, awaiting {} users", runId, futures.size());
      waitForUsers(runId, futures, failure);
      executor.shutdown();
      if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
        log.warn("Run {} user threads did not terminate in time", runId);
      }
    } catch (InterruptedException interrupted) {
      cancellation.cancel();
      executor.shutdownNow();
      Thread.currentThread().interrupt();
      throw interrupted;
    }

    return new SchedulerResult(
        users,
        futures.size(),
        completedUsers.get(),
        cancellationObserved.get(),
        Duration.ofNanos(System.nanoTime() - startNanos),
        failure.get());
  }

  /**
   * Executes iterations for a single virtual user. An elapsed duration takes precedence over a
   * pending cancellation, so a user that has already finished is not counted as cancelled.
   */
  private static void runVirtualUser(
      UUID runId,
      int totalUsers,
      int userIndex,
      long durationNanos,
      CancellationToken cancellation,
      AtomicBoolean cancellationObserved,
      AtomicInteger completedUsers,
      AtomicReference<Throwable> failure,
      VirtualUserIterationRunner iterationRunner,
      JitterStrategy jitter) {
    log.debug("Run {} virtual user {} started", runId, userIndex + 1);
    var userStart = System.nanoTime();
    int iteration = 0;

    while (true) {
      if (System.nanoTime() - userStart >= durationNanos) {
        break;
      }
      if (cancellation.isCancellationRequested()) {
        cancellationObserved.set(true);
        log.debug(
            "Run {} virtual user {} stopping due to cancellation after {} iterations",
            runId,
            userIndex + 1,
            iteration);
        return;
      }

      try {
        iterationRunner.run(userIndex, iteration);
        iteration++;
        jitter.pause();
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        log.info(
            "Run {} virtual user {} interrupted after {} iterations",
            runId,
            userIndex + 1,
            iteration);
        return;
      } catch (Exception ex) {
        log.error(
            "Run {} virtual user {} iteration {} failed: {} - stopping this user",
            runId,
            userIndex + 1,
            iteration,
            ex.getMessage(),
            ex);
        failure.compareAndSet(null, ex);
        return;
      }
    }

    var done = completedUsers.incrementAndGet();
    log.debug(
        "Run {} virtual user {} finished after {} iterations (users completed {}/{})",
        runId,
        userIndex + 1,
        iteration,
        done,
        totalUsers);
  }

  /** Waits for every submitted user. Futures are never cancelled. */
  private static void waitForUsers(
      UUID runId, List<Future<?>> futures, AtomicReference<Throwable> failure)
      throws InterruptedException {
    for (Future<?> future : futures) {
      try {
        future.get();
      } catch (ExecutionException ex) {
        log.error("Run {} virtual user terminated abnormally", runId, ex.getCause());
        failure.compareAndSet(null, ex.getCause());
      }
    }
  }

  /**
   * Waits until {@code deadlineNanos} in chunks, checking for cancellation between chunks.
   *
   * @return false if cancellation was requested before the deadline
   */
  private static boolean waitUntil(long deadlineNanos, CancellationToken cancellation)
      throws InterruptedException {
    while (true) {
      if (cancellation.isCancellationRequested()) {
        return false;
      }
      var remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime());
      if (remainingMillis <= 0) {
        return true;
      }
      TimeUnit.MILLISECONDS.sleep(Math.min(WAIT_CHUNK_MILLIS, remainingMillis));
    }
  }

  /** Start offset of user {@code userIndex}: users are spread linearly across the ramp window. */
  @VisibleForTesting
  static long computeStartOffsetMillis(int userIndex, int users, Duration rampUp) {
    if (users <= 0 || rampUp == null || rampUp.isZero() || rampUp.isNegative()) {
      return 0;
    }
    return rampUp.toMillis() * userIndex / users;
  }
}
