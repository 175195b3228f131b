package com.mk.fx.qa.load.engine.model;

/** Health verdict attached to every finished run. */
public enum RunStatus {
  PASS,
  WARNING,
  FAIL
}
