package com.mk.fx.qa.load.engine.simulators;

import com.mk.fx.qa.load.engine.model.WorkloadType;
import com.mk.fx.qa.load.engine.utils.RandomSource;
import com.mk.fx.qa.load.engine.utils.Sleeper;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Aggregates a window of user events into per-action counts and a conversion rate. */
@Slf4j
@Component
public class AnalyticsSimulator extends AbstractWorkloadSimulator {

  static final String[] ACTIONS = {"view", "click", "add-to-cart", "purchase"};
  static final int EVENT_COUNT = 1000;

  public AnalyticsSimulator(RandomSource random, Sleeper sleeper) {
    super(random, sleeper);
  }

  @Override
  public WorkloadType supportedType() {
    return WorkloadType.ANALYTICS;
  }

  @Override
  protected void performWork(WorkContext context) {
    var counts = countActions(0, EVENT_COUNT);
    var views = counts.getOrDefault("view", 0L);
    var purchases = counts.getOrDefault("purchase", 0L);
    var conversion = views == 0 ? 0.0 : purchases / (double) views;
    log.trace("Aggregated {} events, conversion {}", EVENT_COUNT, conversion);
  }

  static Map<String, Long> countActions(int fromEvent, int toEvent) {
    return IntStream.range(fromEvent, toEvent)
        .mapToObj(event -> ACTIONS[(event * 31 + event / 7) % ACTIONS.length])
        .collect(Collectors.groupingBy(action -> action, Collectors.counting()));
  }
}
