package com.mk.fx.qa.load.engine.simulators;

import com.mk.fx.qa.load.engine.model.WorkloadType;
import com.mk.fx.qa.load.engine.utils.RandomSource;
import com.mk.fx.qa.load.engine.utils.Sleeper;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Splits the analytics window into partitions, aggregates them in parallel and merges. */
@Slf4j
@Component
public class ConcurrentAnalyticsSimulator extends AbstractWorkloadSimulator {

  private static final int PARTITIONS = 4;

  public ConcurrentAnalyticsSimulator(RandomSource random, Sleeper sleeper) {
    super(random, sleeper);
  }

  @Override
  public WorkloadType supportedType() {
    return WorkloadType.ANALYTICS_CONCURRENT;
  }

  @Override
  protected void performWork(WorkContext context) {
    var partitionSize = AnalyticsSimulator.EVENT_COUNT / PARTITIONS;
    List<CompletableFuture<Map<String, Long>>> partials =
        IntStream.range(0, PARTITIONS)
            .mapToObj(
                partition ->
                    CompletableFuture.supplyAsync(
                        () ->
                            AnalyticsSimulator.countActions(
                                partition * partitionSize, (partition + 1) * partitionSize)))
            .collect(Collectors.toList());

    Map<String, Long> merged = new HashMap<>();
    for (CompletableFuture<Map<String, Long>> partial : partials) {
      partial.join().forEach((action, count) -> merged.merge(action, count, Long::sum));
    }
    log.trace("Merged {} partitions into {} actions", PARTITIONS, merged.size());
  }
}
