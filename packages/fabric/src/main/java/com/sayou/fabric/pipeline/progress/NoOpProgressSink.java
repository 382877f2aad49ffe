package com.sayou.fabric.pipeline.progress;

import java.util.Map;

public class NoOpProgressSink implements ProgressSink {
  public static final NoOpProgressSink INSTANCE = new NoOpProgressSink();

  @Override
  public void beginStage(String id, String label, long totalWork) {}

  @Override
  public void step(String id, long completed, String message, Map<String, Object> attrs) {}

  @Override
  public void endStageOk(String id, Map<String, Object> attrs) {}

  @Override
  public void endStageError(String id, String errorSummary, Map<String, Object> attrs) {}
}
