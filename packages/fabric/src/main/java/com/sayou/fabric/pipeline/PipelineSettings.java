package com.sayou.fabric.pipeline;

import com.sayou.fabric.component.ComponentOptions;
import com.sayou.fabric.exception.ConfigException;
import com.sayou.fabric.registry.Role;
import com.sayou.fabric.resilience.RetryPolicy;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;

/**
 * Orchestrator settings read from the {@code pipeline.*} configuration subtree.
 *
 * <ul>
 *   <li>{@code pipeline.workers} (int, default 4): size of the fetch worker pool
 *   <li>{@code pipeline.max-items} (int, default 0): cap on dispatched identifiers, 0 = no cap
 *   <li>{@code pipeline.retry.max-attempts} (int, default 3)
 *   <li>{@code pipeline.retry.delay-ms} (long, default 1000)
 *   <li>{@code pipeline.retry.backoff} (double, default 1.0)
 *   <li>{@code pipeline.retry.call-timeout-ms} (long, default 30000, 0 = none)
 *   <li>{@code pipeline.progress.min-interval-ms} / {@code pipeline.progress.min-delta}
 *   <li>{@code pipeline.defaults.<role>}: strategy used when a run does not name one
 *   <li>{@code pipeline.options.*}: run options applied under the per-run ones
 * </ul>
 */
public record PipelineSettings(
    int workers,
    int maxItems,
    RetryPolicy retryPolicy,
    long progressMinIntervalMs,
    long progressMinDelta,
    Map<Role, String> defaultStrategies,
    ComponentOptions defaultOptions) {

  public PipelineSettings {
    if (workers < 1) throw new ConfigException("pipeline.workers must be >= 1 but was " + workers);
    if (maxItems < 0) {
      throw new ConfigException("pipeline.max-items must be >= 0 but was " + maxItems);
    }
    EnumMap<Role, String> strategies = new EnumMap<>(Role.class);
    for (Role role : Role.values()) strategies.put(role, role.defaultStrategy());
    if (defaultStrategies != null) {
      defaultStrategies.forEach(
          (role, name) -> {
            if (name != null && !name.isBlank()) strategies.put(role, name.trim());
          });
    }
    defaultStrategies = Collections.unmodifiableMap(strategies);
    defaultOptions = defaultOptions == null ? ComponentOptions.empty() : defaultOptions;
  }

  public static PipelineSettings defaults() {
    return new PipelineSettings(
        4,
        0,
        RetryPolicy.transientOnly(3, Duration.ofSeconds(1), 1.0, Duration.ofSeconds(30)),
        500,
        10,
        null,
        null);
  }

  /**
   * @throws ConfigException when a value is out of range or not a number
   * @throws com.sayou.fabric.exception.UnknownRoleException for a default naming an unknown role
   */
  public static PipelineSettings from(Configuration cfg) {
    if (cfg == null) return defaults();
    try {
      int maxAttempts = cfg.getInt("pipeline.retry.max-attempts", 3);
      long delayMs = cfg.getLong("pipeline.retry.delay-ms", 1000L);
      double backoff = cfg.getDouble("pipeline.retry.backoff", 1.0);
      long callTimeoutMs = cfg.getLong("pipeline.retry.call-timeout-ms", 30000L);
      if (maxAttempts < 1) {
        throw new ConfigException("pipeline.retry.max-attempts must be >= 1");
      }
      if (delayMs < 0 || callTimeoutMs < 0) {
        throw new ConfigException("pipeline.retry delays and timeouts must not be negative");
      }
      if (backoff < 1.0) throw new ConfigException("pipeline.retry.backoff must be >= 1.0");

      Map<Role, String> strategies = new EnumMap<>(Role.class);
      Configuration defaults = cfg.subset("pipeline.defaults");
      Iterator<String> keys = defaults.getKeys();
      while (keys.hasNext()) {
        String key = keys.next();
        strategies.put(Role.fromId(key), defaults.getString(key));
      }

      return new PipelineSettings(
          cfg.getInt("pipeline.workers", 4),
          cfg.getInt("pipeline.max-items", 0),
          RetryPolicy.transientOnly(
              maxAttempts,
              Duration.ofMillis(delayMs),
              backoff,
              callTimeoutMs == 0 ? null : Duration.ofMillis(callTimeoutMs)),
          cfg.getLong("pipeline.progress.min-interval-ms", 500L),
          cfg.getLong("pipeline.progress.min-delta", 10L),
          strategies,
          ComponentOptions.fromConfiguration(cfg.subset("pipeline.options")));
    } catch (org.apache.commons.configuration2.ex.ConversionException e) {
      throw new ConfigException("Invalid pipeline configuration: " + e.getMessage(), e);
    }
  }

  public String defaultStrategy(Role role) {
    return defaultStrategies.get(role);
  }

  public PipelineSettings withWorkers(int n) {
    return new PipelineSettings(
        n,
        maxItems,
        retryPolicy,
        progressMinIntervalMs,
        progressMinDelta,
        defaultStrategies,
        defaultOptions);
  }

  public PipelineSettings withMaxItems(int n) {
    return new PipelineSettings(
        workers,
        n,
        retryPolicy,
        progressMinIntervalMs,
        progressMinDelta,
        defaultStrategies,
        defaultOptions);
  }

  public PipelineSettings withRetryPolicy(RetryPolicy policy) {
    return new PipelineSettings(
        workers,
        maxItems,
        policy,
        progressMinIntervalMs,
        progressMinDelta,
        defaultStrategies,
        defaultOptions);
  }
}
