package com.mk.fx.qa.load.engine.simulators;

import com.mk.fx.qa.load.engine.model.LatencyProfile;
import com.mk.fx.qa.load.engine.utils.RandomSource;
import com.mk.fx.qa.load.engine.utils.Sleeper;
import java.util.Objects;

/**
 * Base for the built-in simulators. Draws the latency budget, lets the subclass do a small amount
 * of representative work, waits out whatever budget is left and then rolls for failure.
 */
public abstract class AbstractWorkloadSimulator implements WorkloadSimulator {

  private final RandomSource random;
  private final Sleeper sleeper;

  protected AbstractWorkloadSimulator(RandomSource random, Sleeper sleeper) {
    this.random = Objects.requireNonNull(random, "random");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  @Override
  public final void simulate(LatencyProfile profile)
      throws SimulatedOperationException, InterruptedException {
    Objects.requireNonNull(profile, "profile");
    var budgetMs = random.nextLong(profile.minLatencyMs(), profile.maxLatencyMs());
    var context = new WorkContext(budgetMs, sleeper);

    performWork(context);

    var remaining = context.remainingMs();
    if (remaining > 0) {
      sleeper.sleep(remaining);
    }
    if (random.chance(profile.failureProbability())) {
      throw new SimulatedOperationException(supportedType(), supportedType().getFailureMessage());
    }
  }

  /** Work representative of the operation; may pause through {@code context}. */
  protected abstract void performWork(WorkContext context) throws InterruptedException;
}
