package com.mk.fx.qa.load.engine.service;

import com.mk.fx.qa.load.engine.executors.VirtualUserIterationRunner;
import com.mk.fx.qa.load.engine.metrics.ExecutionSample;
import com.mk.fx.qa.load.engine.metrics.SampleCollector;
import com.mk.fx.qa.load.engine.model.LatencyProfile;
import com.mk.fx.qa.load.engine.simulators.SimulatedOperationException;
import com.mk.fx.qa.load.engine.simulators.WorkloadSimulator;
import com.mk.fx.qa.load.engine.utils.LoadUtils;
import lombok.RequiredArgsConstructor;

/** Times one simulated operation per iteration and records it as a sample. */
@RequiredArgsConstructor
class SimulatedIterationRunner implements VirtualUserIterationRunner {

  private final WorkloadSimulator simulator;
  private final LatencyProfile latencyProfile;
  private final SampleCollector collector;

  @Override
  public void run(int userIndex, int iteration) throws InterruptedException {
    if (iteration == 0) {
      collector.recordUserStarted();
    }
    var startNanos = System.nanoTime();
    try {
      simulator.simulate(latencyProfile);
      collector.record(ExecutionSample.success(LoadUtils.elapsedMillis(startNanos), userIndex));
    } catch (SimulatedOperationException ex) {
      collector.record(
          ExecutionSample.failure(LoadUtils.elapsedMillis(startNanos), ex.getMessage(), userIndex));
    }
  }
}
