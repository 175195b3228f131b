package com.mk.fx.qa.load.engine.simulators;

import com.mk.fx.qa.load.engine.model.WorkloadType;
import com.mk.fx.qa.load.engine.utils.RandomSource;
import com.mk.fx.qa.load.engine.utils.Sleeper;
import java.util.Comparator;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Filters, sorts and projects a batch of records. */
@Slf4j
@Component
public class DataProcessingSimulator extends AbstractWorkloadSimulator {

  private static final int BATCH_SIZE = 1000;

  public DataProcessingSimulator(RandomSource random, Sleeper sleeper) {
    super(random, sleeper);
  }

  @Override
  public WorkloadType supportedType() {
    return WorkloadType.DATA_PROCESSING;
  }

  @Override
  protected void performWork(WorkContext context) {
    var processed =
        IntStream.range(0, BATCH_SIZE)
            .mapToObj(i -> new DataRecord(i, (i * 7919 % BATCH_SIZE) / (double) BATCH_SIZE))
            .filter(record -> record.value() > 0.5)
            .sorted(Comparator.comparingDouble(DataRecord::value).reversed())
            .map(record -> new DataRecord(record.id(), record.value() * 2))
            .collect(Collectors.toList());
    log.trace("Processed {} of {} records", processed.size(), BATCH_SIZE);
  }

  private record DataRecord(int id, double value) {}
}
