package com.mk.fx.qa.load.engine.executors;

import java.util.concurrent.atomic.AtomicBoolean;

/** One-way cancellation flag shared by a run's coordinator and its virtual users. */
public final class CancellationToken {

  private final AtomicBoolean cancelled = new AtomicBoolean(false);

  /** Requests cancellation. Returns false if it had already been requested. */
  public boolean cancel() {
    return cancelled.compareAndSet(false, true);
  }

  public boolean isCancellationRequested() {
    return cancelled.get();
  }
}
