package com.mk.fx.qa.load.engine.simulators;

import com.mk.fx.qa.load.engine.model.WorkloadType;
import lombok.Getter;

/** Raised when a simulated operation reports failure. The message is recorded on the sample. */
@Getter
public class SimulatedOperationException extends Exception {

  private final WorkloadType workloadType;

  public SimulatedOperationException(WorkloadType workloadType, String message) {
    super(message);
    this.workloadType = workloadType;
  }
}
