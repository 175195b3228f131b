package com.mk.fx.qa.load.engine.metrics;

/**
 * One simulated operation.
 *
 * @param success whether the operation succeeded
 * @param latencyMs measured wall-clock time of the operation
 * @param error failure message, null on success
 * @param userIndex zero-based index of the virtual user that ran it
 */
public record ExecutionSample(boolean success, double latencyMs, String error, int userIndex) {

  public static ExecutionSample success(double latencyMs, int userIndex) {
    return new ExecutionSample(true, latencyMs, null, userIndex);
  }

  public static ExecutionSample failure(double latencyMs, String error, int userIndex) {
    return new ExecutionSample(false, latencyMs, error, userIndex);
  }
}
