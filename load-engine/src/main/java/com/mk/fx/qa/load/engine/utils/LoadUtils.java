package com.mk.fx.qa.load.engine.utils;

import java.time.Duration;

public final class LoadUtils {

  private LoadUtils() {
    // Utility class, no instantiation
  }

  public static Duration toDuration(Duration duration) {
    return duration != null ? duration : Duration.ZERO;
  }

  public static double elapsedMillis(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000.0;
  }

  public static double round(double value, int decimals) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return 0.0;
    }
    var factor = Math.pow(10, decimals);
    return Math.round(value * factor) / factor;
  }
}
