package com.sayou.fabric.resilience;

import java.time.Duration;

/** Receives the outcome of every {@link Resilience#timed} call. */
@FunctionalInterface
public interface TimingListener {
  void onTiming(String label, Duration elapsed, boolean success);

  /** Listener writing a debug line per call. */
  static TimingListener logging() {
    org.slf4j.Logger log = com.sayou.fabric.logging.LoggingService.getLogger(TimingListener.class);
    return (label, elapsed, success) ->
        log.debug(
            "[Timer] {} took {} ms ({})", label, elapsed.toMillis(), success ? "ok" : "error");
  }
}
