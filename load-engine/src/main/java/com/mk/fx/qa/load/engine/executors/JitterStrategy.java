package com.mk.fx.qa.load.engine.executors;

import com.mk.fx.qa.load.engine.utils.RandomSource;
import com.mk.fx.qa.load.engine.utils.Sleeper;
import java.util.Objects;

/** Random pause a virtual user takes between consecutive operations. */
public class JitterStrategy {

  private final long min;
  private final long max;
  private final RandomSource random;
  private final Sleeper sleeper;

  private JitterStrategy(long min, long max, RandomSource random, Sleeper sleeper) {
    this.min = Math.max(0, min);
    this.max = Math.max(this.min, max);
    this.random = random;
    this.sleeper = sleeper;
  }

  public static JitterStrategy none() {
    return new JitterStrategy(0, 0, null, null);
  }

  public static JitterStrategy uniform(
      long minMs, long maxMs, RandomSource random, Sleeper sleeper) {
    Objects.requireNonNull(random, "random");
    Objects.requireNonNull(sleeper, "sleeper");
    return new JitterStrategy(minMs, maxMs, random, sleeper);
  }

  public boolean isEnabled() {
    return max > 0 && sleeper != null;
  }

  public void pause() throws InterruptedException {
    if (!isEnabled()) {
      return;
    }
    var delay = random.nextLong(min, max);
    if (delay > 0) {
      sleeper.sleep(delay);
    }
  }
}
