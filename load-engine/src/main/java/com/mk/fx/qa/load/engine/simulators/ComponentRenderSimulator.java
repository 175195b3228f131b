package com.mk.fx.qa.load.engine.simulators;

import com.mk.fx.qa.load.engine.model.WorkloadType;
import com.mk.fx.qa.load.engine.utils.RandomSource;
import com.mk.fx.qa.load.engine.utils.Sleeper;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Builds a small element tree and lays it out, as a component render would. */
@Slf4j
@Component
public class ComponentRenderSimulator extends AbstractWorkloadSimulator {

  private static final int ELEMENT_COUNT = 100;

  public ComponentRenderSimulator(RandomSource random, Sleeper sleeper) {
    super(random, sleeper);
  }

  @Override
  public WorkloadType supportedType() {
    return WorkloadType.COMPONENT;
  }

  @Override
  protected void performWork(WorkContext context) {
    List<Element> elements = new ArrayList<>(ELEMENT_COUNT);
    for (int i = 0; i < ELEMENT_COUNT; i++) {
      elements.add(new Element("div", "Element " + i, i % 10));
    }
    var height = elements.stream().mapToInt(element -> 16 + element.depth() * 2).sum();
    log.trace("Rendered {} elements, layout height {}", elements.size(), height);
  }

  private record Element(String tag, String text, int depth) {}
}
