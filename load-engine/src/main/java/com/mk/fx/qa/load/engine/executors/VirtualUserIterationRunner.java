package com.mk.fx.qa.load.engine.executors;

@FunctionalInterface
public interface VirtualUserIterationRunner {
  void run(int userIndex, int iteration) throws Exception;
}
