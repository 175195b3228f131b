package com.mk.fx.qa.load.engine.executors;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.load.engine.utils.RecordingSleeper;
import com.mk.fx.qa.load.engine.utils.ScriptedRandomSource;
import java.util.List;
import org.junit.jupiter.api.Test;

class JitterStrategyTest {

  @Test
  void none_isDisabledAndNeverPauses() throws Exception {
    var jitter = JitterStrategy.none();
    assertFalse(jitter.isEnabled());
    jitter.pause();
  }

  @Test
  void uniform_pausesWithinConfiguredBounds() throws Exception {
    var sleeper = new RecordingSleeper();
    var jitter =
        JitterStrategy.uniform(50, 150, new ScriptedRandomSource(0.0, 0.5, 0.9999), sleeper);

    jitter.pause();
    jitter.pause();
    jitter.pause();

    assertTrue(jitter.isEnabled());
    assertEquals(List.of(50L, 100L, 150L), sleeper.sleeps());
  }

  @Test
  void uniform_withZeroBounds_isDisabled() throws Exception {
    var sleeper = new RecordingSleeper();
    var jitter = JitterStrategy.uniform(0, 0, new ScriptedRandomSource(0.5), sleeper);

    jitter.pause();

    assertFalse(jitter.isEnabled());
    assertTrue(sleeper.sleeps().isEmpty());
  }
}
