package com.mk.fx.qa.load.engine.simulators;

import com.mk.fx.qa.load.engine.model.WorkloadType;
import com.mk.fx.qa.load.engine.utils.RandomSource;
import com.mk.fx.qa.load.engine.utils.Sleeper;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Assembles a bounded context window from overlapping chunks, dropping duplicates. */
@Slf4j
@Component
public class ContextProcessingSimulator extends AbstractWorkloadSimulator {

  private static final int CHUNKS = 40;
  private static final int WINDOW_TOKENS = 256;

  public ContextProcessingSimulator(RandomSource random, Sleeper sleeper) {
    super(random, sleeper);
  }

  @Override
  public WorkloadType supportedType() {
    return WorkloadType.CONTEXT_PROCESSING;
  }

  @Override
  protected void performWork(WorkContext context) {
    Set<String> unique = new LinkedHashSet<>();
    for (int chunk = 0; chunk < CHUNKS; chunk++) {
      unique.add("chunk-" + (chunk % 25) + " section " + (chunk / 5));
    }
    List<String> window = new ArrayList<>();
    var tokens = 0;
    for (String chunk : unique) {
      var chunkTokens = chunk.split(" ").length;
      if (tokens + chunkTokens > WINDOW_TOKENS) {
        break;
      }
      window.add(chunk);
      tokens += chunkTokens;
    }
    log.trace("Context window holds {} chunks, {} tokens", window.size(), tokens);
  }
}
