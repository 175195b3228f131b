package com.mk.fx.qa.load.engine.simulators;

import com.mk.fx.qa.load.engine.model.WorkloadType;
import com.mk.fx.qa.load.engine.utils.RandomSource;
import com.mk.fx.qa.load.engine.utils.Sleeper;
import org.springframework.stereotype.Component;

/** Pure latency with no payload work. Also serves unknown workload types. */
@Component
public class GenericSimulator extends AbstractWorkloadSimulator {

  public GenericSimulator(RandomSource random, Sleeper sleeper) {
    super(random, sleeper);
  }

  @Override
  public WorkloadType supportedType() {
    return WorkloadType.GENERIC;
  }

  @Override
  protected void performWork(WorkContext context) {
    // latency only
  }
}
