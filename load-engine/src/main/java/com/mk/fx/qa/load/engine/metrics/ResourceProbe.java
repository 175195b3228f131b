package com.mk.fx.qa.load.engine.metrics;

/** Reads the process resources recorded with every snapshot. */
@FunctionalInterface
public interface ResourceProbe {
  /** Currently used heap in megabytes. */
  double heapUsedMb();

  /** CPU utilisation in percent, 0 when the platform cannot report it. */
  default double cpuUtilizationPercent() {
    return 0.0;
  }
}
