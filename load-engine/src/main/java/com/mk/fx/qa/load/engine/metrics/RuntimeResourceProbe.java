package com.mk.fx.qa.load.engine.metrics;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

public class RuntimeResourceProbe implements ResourceProbe {

  private static final double BYTES_PER_MB = 1024.0 * 1024.0;

  private final OperatingSystemMXBean osMx = ManagementFactory.getOperatingSystemMXBean();

  @Override
  public double heapUsedMb() {
    var runtime = Runtime.getRuntime();
    return (runtime.totalMemory() - runtime.freeMemory()) / BYTES_PER_MB;
  }

  /** System load average spread over the available processors, capped at 100. */
  @Override
  public double cpuUtilizationPercent() {
    var loadAverage = osMx.getSystemLoadAverage();
    if (loadAverage < 0) {
      return 0.0; // not available on this platform
    }
    var processors = Math.max(1, osMx.getAvailableProcessors());
    return Math.min(100.0, loadAverage / processors * 100.0);
  }
}
