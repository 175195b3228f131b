package com.mk.fx.qa.load.engine.executors;

import java.time.Duration;

/**
 * Outcome of a scheduled run.
 *
 * @param totalUsers users requested
 * @param startedUsers users actually started; lower than requested when cancelled during ramp-up
 * @param completedUsers users that ran for their whole duration
 * @param cancelled whether cancellation was observed
 * @param observedDuration time from scheduling start until the last user exited
 * @param failure first unexpected error raised by a user, or null
 */
public record SchedulerResult(
    int totalUsers,
    int startedUsers,
    int completedUsers,
    boolean cancelled,
    Duration observedDuration,
    Throwable failure) {}
