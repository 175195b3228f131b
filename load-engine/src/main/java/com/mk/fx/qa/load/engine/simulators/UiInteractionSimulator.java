package com.mk.fx.qa.load.engine.simulators;

import com.mk.fx.qa.load.engine.model.WorkloadType;
import com.mk.fx.qa.load.engine.utils.RandomSource;
import com.mk.fx.qa.load.engine.utils.Sleeper;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

/** A short burst of clicks, each dispatched to a handler with a pause between them. */
@Component
public class UiInteractionSimulator extends AbstractWorkloadSimulator {

  private static final int CLICKS = 10;

  public UiInteractionSimulator(RandomSource random, Sleeper sleeper) {
    super(random, sleeper);
  }

  @Override
  public WorkloadType supportedType() {
    return WorkloadType.UI_INTERACTION;
  }

  @Override
  protected void performWork(WorkContext context) throws InterruptedException {
    var handled = new AtomicInteger();
    var pauseMs = context.budgetMs() / CLICKS;
    for (int click = 0; click < CLICKS; click++) {
      handled.incrementAndGet();
      context.pause(pauseMs);
    }
  }
}
