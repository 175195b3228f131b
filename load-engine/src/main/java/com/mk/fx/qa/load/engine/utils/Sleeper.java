package com.mk.fx.qa.load.engine.utils;

import java.util.concurrent.TimeUnit;

/** Blocking pause used by simulators and jitter so tests can run without wall-clock waits. */
@FunctionalInterface
public interface Sleeper {

  Sleeper SYSTEM = TimeUnit.MILLISECONDS::sleep;

  void sleep(long millis) throws InterruptedException;
}
