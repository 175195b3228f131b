package com.mk.fx.qa.load.engine.cfg;

import com.mk.fx.qa.load.engine.metrics.ResourceProbe;
import com.mk.fx.qa.load.engine.metrics.RuntimeResourceProbe;
import com.mk.fx.qa.load.engine.utils.RandomSource;
import com.mk.fx.qa.load.engine.utils.Sleeper;
import com.mk.fx.qa.load.engine.utils.ThreadLocalRandomSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Production implementations of the engine's randomness, sleeping and resource reading seams. */
@Configuration
public class EngineWiringCfg {

  @Bean
  public RandomSource randomSource() {
    return new ThreadLocalRandomSource();
  }

  @Bean
  public Sleeper sleeper() {
    return Sleeper.SYSTEM;
  }

  @Bean
  public ResourceProbe resourceProbe() {
    return new RuntimeResourceProbe();
  }
}
