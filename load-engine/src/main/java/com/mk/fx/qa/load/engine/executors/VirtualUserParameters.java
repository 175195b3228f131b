package com.mk.fx.qa.load.engine.executors;

import java.time.Duration;

/**
 * @param users number of virtual users
 * @param duration how long each user keeps iterating, measured from its own start
 * @param rampUp window over which user start times are spread
 */
public record VirtualUserParameters(int users, Duration duration, Duration rampUp) {}
