package com.mk.fx.qa.load.engine.simulators;

import com.mk.fx.qa.load.engine.model.LatencyProfile;
import com.mk.fx.qa.load.engine.model.WorkloadType;

/**
 * Performs one simulated operation of a given workload type.
 *
 * <p>Implementations are shared by every virtual user of a run and must be safe to call from many
 * threads at once.
 */
public interface WorkloadSimulator {

  WorkloadType supportedType();

  /**
   * Runs one operation, taking a latency drawn from {@code profile}.
   *
   * @throws SimulatedOperationException when the operation reports failure
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  void simulate(LatencyProfile profile) throws SimulatedOperationException, InterruptedException;
}
