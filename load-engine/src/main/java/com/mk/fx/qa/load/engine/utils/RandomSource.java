package com.mk.fx.qa.load.engine.utils;

/** Source of randomness for latency draws, failure rolls, jitter and snapshot sampling. */
public interface RandomSource {

  /** Returns a value in {@code [0, 1)}. */
  double nextDouble();

  /** Returns a value in {@code [minInclusive, maxInclusive]}; collapses to the lower bound. */
  default long nextLong(long minInclusive, long maxInclusive) {
    var lower = Math.max(0, minInclusive);
    var upper = Math.max(lower, maxInclusive);
    if (upper == lower) {
      return lower;
    }
    var drawn = lower + (long) Math.floor(nextDouble() * (upper - lower + 1));
    return Math.min(drawn, upper);
  }

  /** Returns true with the given probability. */
  default boolean chance(double probability) {
    if (probability <= 0) {
      return false;
    }
    return nextDouble() < probability;
  }
}
