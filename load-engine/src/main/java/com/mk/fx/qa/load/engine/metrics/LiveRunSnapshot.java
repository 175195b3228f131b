package com.mk.fx.qa.load.engine.metrics;

import java.util.UUID;

/** Point-in-time view of an active run. */
public record LiveRunSnapshot(
    UUID runId,
    String workloadType,
    int configuredUsers,
    int usersStarted,
    long totalRequests,
    long failedRequests,
    long elapsedMs,
    double requestsPerSecond,
    boolean cancellationRequested) {}
