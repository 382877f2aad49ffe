package com.sayou.fabric.pipeline.progress;

import java.util.Map;

/**
 * Receives stage events from a pipeline run.
 *
 * <p>Stage ids are the stage names of the roles ({@code seed}, {@code fetch}, {@code parse},
 * ..., {@code store}). Calls come from the orchestrator thread only. Implementations must be
 * cheap and must not throw.
 */
public interface ProgressSink {

  /**
   * @param totalWork expected work units, 0 when unknown (the fetch frontier grows while running)
   */
  void beginStage(String id, String label, long totalWork);

  /**
   * @param completed work units done so far, monotonic within a stage
   */
  void step(String id, long completed, String message, Map<String, Object> attrs);

  void endStageOk(String id, Map<String, Object> attrs);

  void endStageError(String id, String errorSummary, Map<String, Object> attrs);

  /** The run stopped early; the stage will not complete. */
  default void endStageCancelled(String id, Map<String, Object> attrs) {
    endStageError(id, "cancelled", attrs);
  }
}
