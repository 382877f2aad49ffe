package com.sayou.fabric;

import com.sayou.fabric.exception.StateException;
import com.sayou.fabric.logging.LoggingService;
import com.sayou.fabric.pipeline.CancellationToken;
import com.sayou.fabric.pipeline.PipelineOrchestrator;
import com.sayou.fabric.pipeline.PipelineSettings;
import com.sayou.fabric.pipeline.RunStats;
import com.sayou.fabric.pipeline.progress.LoggingProgressSink;
import com.sayou.fabric.pipeline.progress.ProgressSink;
import com.sayou.fabric.registry.ComponentRegistry;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;

/**
 * Composition root: loads the configuration, applies logging levels, builds the registry from
 * every {@link com.sayou.fabric.registry.ComponentProvider} on the classpath and wires the
 * orchestrator.
 *
 * <pre>{@code
 * Fabric fabric = new Fabric();
 * fabric.initialize();
 * RunStats stats = fabric.process("docs/", "out/graph.jsonl", Map.of("seeder", "directory"));
 * }</pre>
 */
public class Fabric {
  private static final org.slf4j.Logger log =
      com.sayou.fabric.logging.LoggingService.getLogger(Fabric.class);

  private final String configLocation;
  private ConfigurationProvider configurationProvider;
  private ComponentRegistry registry;
  private PipelineOrchestrator orchestrator;

  public Fabric(String configLocation) {
    this.configLocation = configLocation;
  }

  public Fabric() {
    this(ConfigurationProvider.DEFAULT_LOCATION);
  }

  public synchronized Fabric initialize() {
    if (orchestrator != null) return this;
    this.configurationProvider = new ConfigurationProvider(configLocation);
    LoggingService.applyConfiguration(configuration());

    this.registry = ComponentRegistry.withProviders();
    PipelineSettings settings = PipelineSettings.from(configuration());
    ProgressSink progress =
        new LoggingProgressSink(
            LoggingService.getLogger(PipelineOrchestrator.class),
            settings.progressMinIntervalMs(),
            settings.progressMinDelta());
    this.orchestrator = new PipelineOrchestrator(registry, settings, progress);
    log.info(
        "Fabric initialized: workers={}, max-items={}, retry={}x",
        settings.workers(),
        settings.maxItems(),
        settings.retryPolicy().maxAttempts());
    return this;
  }

  public RunStats process(String source, String destination, Map<String, String> strategies) {
    return orchestrator().process(source, destination, strategies, Map.of());
  }

  public RunStats process(
      String source,
      String destination,
      Map<String, String> strategies,
      Map<String, ?> options,
      CancellationToken token) {
    return orchestrator().process(source, destination, strategies, options, token);
  }

  public Configuration configuration() {
    if (configurationProvider == null) throw new StateException("Fabric is not initialized");
    return configurationProvider.config();
  }

  public ComponentRegistry registry() {
    if (registry == null) throw new StateException("Fabric is not initialized");
    return registry;
  }

  public PipelineOrchestrator orchestrator() {
    if (orchestrator == null) throw new StateException("Fabric is not initialized");
    return orchestrator;
  }
}
