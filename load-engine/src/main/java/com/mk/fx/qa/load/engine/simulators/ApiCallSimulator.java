package com.mk.fx.qa.load.engine.simulators;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.load.engine.cfg.ObjectMapperConfig;
import com.mk.fx.qa.load.engine.model.WorkloadType;
import com.mk.fx.qa.load.engine.utils.RandomSource;
import com.mk.fx.qa.load.engine.utils.Sleeper;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Encodes a request body and waits for the simulated network round trip. */
@Slf4j
@Component
public class ApiCallSimulator extends AbstractWorkloadSimulator {

  private static final ObjectMapper BODY_WRITER = ObjectMapperConfig.createObjectMapper();

  public ApiCallSimulator(RandomSource random, Sleeper sleeper) {
    super(random, sleeper);
  }

  @Override
  public WorkloadType supportedType() {
    return WorkloadType.API_CALL;
  }

  @Override
  protected void performWork(WorkContext context) throws InterruptedException {
    var encoded = encodeRequestBody();
    log.trace("Sending {}", encoded);
    context.pause(context.budgetMs());
  }

  @VisibleForTesting
  static String encodeRequestBody() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("method", "GET");
    body.put("path", "/api/test");
    body.put("timeoutMs", 5000);
    try {
      return BODY_WRITER.writeValueAsString(body);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Unable to encode simulated request body", ex);
    }
  }
}
