package com.mk.fx.qa.load.engine.metrics;

/** Heap usage and CPU utilisation observed at one point of a run. */
public record ResourceSnapshot(long timestampMs, double heapUsedMb, double cpuUtilizationPercent) {}
