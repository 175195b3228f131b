package com.mk.fx.qa.load.engine.utils;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Records requested pauses without blocking. */
public class RecordingSleeper implements Sleeper {

  private final List<Long> sleeps = new CopyOnWriteArrayList<>();

  @Override
  public void sleep(long millis) {
    sleeps.add(millis);
  }

  public List<Long> sleeps() {
    return List.copyOf(sleeps);
  }

  public long totalSleptMs() {
    return sleeps.stream().mapToLong(Long::longValue).sum();
  }
}
