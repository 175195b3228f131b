package com.mk.fx.qa.load.engine.utils;

import java.util.concurrent.ThreadLocalRandom;

public class ThreadLocalRandomSource implements RandomSource {

  @Override
  public double nextDouble() {
    return ThreadLocalRandom.current().nextDouble();
  }
}
