package com.sayou.fabric.pipeline.progress;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.Logger;

@ExtendWith(MockitoExtension.class)
class LoggingProgressSinkTest {

  @Mock private Logger logger;

  @Test
  void stepsAreThrottledButStageEdgesAreAlwaysLogged() {
    when(logger.isInfoEnabled()).thenReturn(true);
    LoggingProgressSink sink = new LoggingProgressSink(logger, 60_000, 1_000);

    sink.beginStage("fetch", "fetch (http)", 0);
    for (int i = 1; i <= 20; i++) sink.step("fetch", i, "item " + i, Map.of());
    sink.endStageOk("fetch", Map.of("dispatched", 20));

    // begin, first step, end
    verify(logger, times(3)).info(anyString(), anyString());
    verify(logger).info(anyString(), contains("\"status\":\"ok\""));
    verify(logger, never()).info(anyString(), contains("item 2\""));
  }

  @Test
  void errorsCarryTheSummary() {
    when(logger.isInfoEnabled()).thenReturn(true);
    LoggingProgressSink sink = new LoggingProgressSink(logger, 0, 0);

    sink.beginStage("seed", "seed (single)", 0);
    sink.endStageError("seed", "boom", Map.of());

    verify(logger).info(anyString(), contains("\"error\":\"boom\""));
    verify(logger).info(anyString(), contains("\"status\":\"error\""));
  }

  @Test
  void nothingIsRenderedWhenInfoIsDisabled() {
    LoggingProgressSink sink = new LoggingProgressSink(logger, 0, 0);
    sink.beginStage("store", "store (jsonl)", 3);
    verify(logger, never()).info(anyString(), anyString());
  }
}
