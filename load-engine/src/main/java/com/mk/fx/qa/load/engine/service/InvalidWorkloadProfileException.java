package com.mk.fx.qa.load.engine.service;

/** Raised before any scheduling when a workload profile is rejected. */
public class InvalidWorkloadProfileException extends IllegalArgumentException {

  public InvalidWorkloadProfileException(String message) {
    super(message);
  }
}
