package com.mk.fx.qa.load.engine.simulators;

import com.mk.fx.qa.load.engine.model.WorkloadType;
import com.mk.fx.qa.load.engine.utils.RandomSource;
import com.mk.fx.qa.load.engine.utils.Sleeper;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Ranks a small corpus of findings against a question by term overlap. */
@Slf4j
@Component
public class ResearchQuestionSimulator extends AbstractWorkloadSimulator {

  private static final String QUESTION = "How does caching affect latency under concurrent load?";

  private static final List<String> FINDINGS =
      List.of(
          "Caching reduces repeated computation and lowers median latency",
          "Concurrent load increases contention on shared locks",
          "Tail latency grows when queues build up under load",
          "Connection pooling limits the cost of new sessions",
          "Batching requests amortises per-call overhead");

  public ResearchQuestionSimulator(RandomSource random, Sleeper sleeper) {
    super(random, sleeper);
  }

  @Override
  public WorkloadType supportedType() {
    return WorkloadType.RESEARCH_QUESTION;
  }

  @Override
  protected void performWork(WorkContext context) {
    var questionTerms = terms(QUESTION);
    var best =
        FINDINGS.stream()
            .max(Comparator.comparingLong(finding -> overlap(questionTerms, terms(finding))))
            .orElse("");
    log.trace("Best finding for question: {}", best);
  }

  private static Set<String> terms(String text) {
    return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^a-z]+"))
        .filter(term -> term.length() > 3)
        .collect(Collectors.toSet());
  }

  private static long overlap(Set<String> left, Set<String> right) {
    return left.stream().filter(right::contains).count();
  }
}
