package com.mk.fx.qa.load.engine.simulators;

import com.mk.fx.qa.load.engine.utils.LoadUtils;
import com.mk.fx.qa.load.engine.utils.Sleeper;

/** Per-operation state handed to a simulator: the latency budget and the time spent so far. */
public final class WorkContext {

  private final long budgetMs;
  private final Sleeper sleeper;
  private final long startNanos;
  private long pausedMs;

  WorkContext(long budgetMs, Sleeper sleeper) {
    this.budgetMs = budgetMs;
    this.sleeper = sleeper;
    this.startNanos = System.nanoTime();
  }

  public long budgetMs() {
    return budgetMs;
  }

  public void pause(long millis) throws InterruptedException {
    if (millis <= 0) {
      return;
    }
    sleeper.sleep(millis);
    pausedMs += millis;
  }

  long remainingMs() {
    var spent = Math.max(pausedMs, (long) LoadUtils.elapsedMillis(startNanos));
    return budgetMs - spent;
  }
}
