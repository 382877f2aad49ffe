package com.sayou.fabric.pipeline;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop signal for a pipeline run. Once cancelled, the orchestrator dispatches no new
 * frontier items, lets in-flight items finish and runs no further stage.
 */
public final class CancellationToken {
  private final AtomicBoolean cancelled = new AtomicBoolean();

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }
}
