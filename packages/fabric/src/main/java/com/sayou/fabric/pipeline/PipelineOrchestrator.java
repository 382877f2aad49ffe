package com.sayou.fabric.pipeline;

import com.sayou.fabric.atom.Atom;
import com.sayou.fabric.component.Builder;
import com.sayou.fabric.component.Component;
import com.sayou.fabric.component.ComponentOptions;
import com.sayou.fabric.component.Fetcher;
import com.sayou.fabric.component.Generator;
import com.sayou.fabric.component.RawPayload;
import com.sayou.fabric.component.Seeder;
import com.sayou.fabric.component.Transformer;
import com.sayou.fabric.component.Writer;
import com.sayou.fabric.exception.ExceptionUtil;
import com.sayou.fabric.model.KnowledgeGraph;
import com.sayou.fabric.pipeline.progress.NoOpProgressSink;
import com.sayou.fabric.pipeline.progress.ProgressSink;
import com.sayou.fabric.registry.ComponentFactory;
import com.sayou.fabric.registry.ComponentRegistry;
import com.sayou.fabric.registry.Role;
import com.sayou.fabric.resilience.Operation;
import com.sayou.fabric.resilience.Resilience;
import com.sayou.fabric.resilience.RetryPolicy;
import com.sayou.fabric.resilience.TimingListener;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one source through the chain {@code seed → fetch → generate → parse → refine → chunk →
 * wrap → assemble → store}.
 *
 * <p>Every role is resolved in the registry before any component is created, and every component
 * is created and initialized before any I/O happens, so a misconfigured run fails without side
 * effects. Fetching and generation run on a bounded worker pool fed from a {@link Frontier};
 * every other stage runs on the calling thread.
 *
 * <p>Failure handling per stage:
 *
 * <ul>
 *   <li>seed: retried, a final failure aborts the run;
 *   <li>fetch, generate: retried, a final failure is logged and counted as {@code failed} and the
 *       run goes on with the next identifier;
 *   <li>parse to assemble: not retried, a failure aborts the run;
 *   <li>store: retried per unit, a final failure is counted and the next unit is stored.
 * </ul>
 *
 * <p>Run options are handed to every component together with {@code source} and {@code
 * destination}; options under a role prefix (e.g. {@code fetcher.user_agent}) override the global
 * ones for that role only.
 *
 * <p>An orchestrator holds no per-run state and may serve several runs concurrently.
 */
public class PipelineOrchestrator {
  private static final org.slf4j.Logger log =
      com.sayou.fabric.logging.LoggingService.getLogger(PipelineOrchestrator.class);

  public static final String OPTION_SOURCE = "source";
  public static final String OPTION_DESTINATION = "destination";
  public static final String RAW_ATOM_TYPE = "raw";

  private final ComponentRegistry registry;
  private final PipelineSettings settings;
  private final ProgressSink progress;

  public PipelineOrchestrator(
      ComponentRegistry registry, PipelineSettings settings, ProgressSink progress) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.progress = progress == null ? NoOpProgressSink.INSTANCE : progress;
  }

  public PipelineOrchestrator(ComponentRegistry registry) {
    this(registry, PipelineSettings.defaults(), NoOpProgressSink.INSTANCE);
  }

  public PipelineSettings settings() {
    return settings;
  }

  public RunStats process(
      String source, String destination, Map<String, String> strategies, Map<String, ?> options) {
    return process(source, destination, strategies, options, new CancellationToken());
  }

  /**
   * Run the pipeline once.
   *
   * @param source what the seeder starts from (a URL, a path, a manifest)
   * @param destination where the writer persists, may be {@code null} for writers that need none
   * @param strategies role id to strategy name; roles left out use the configured default
   * @param options run options for the components
   * @param token stops the run early when cancelled; the returned stats are then partial
   * @throws com.sayou.fabric.exception.UnknownRoleException for an undeclared role key
   * @throws com.sayou.fabric.exception.UnresolvedComponentException for an unknown strategy
   * @throws com.sayou.fabric.exception.InitializationException when a component rejects its
   *     options
   * @throws com.sayou.fabric.exception.ComponentException when seeding or a transformation stage
   *     fails
   */
  public RunStats process(
      String source,
      String destination,
      Map<String, String> strategies,
      Map<String, ?> options,
      CancellationToken token) {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(token, "token");

    Map<Role, String> names = resolveNames(strategies);
    Map<Role, ComponentFactory<?>> factories = new EnumMap<>(Role.class);
    for (Role role : Role.values()) {
      factories.put(role, registry.resolve(role, names.get(role)));
    }

    ComponentOptions runOptions =
        settings
            .defaultOptions()
            .merge(ComponentOptions.of(options))
            .with(OPTION_SOURCE, source)
            .with(OPTION_DESTINATION, destination);

    List<ComponentSlot<?>> opened = new ArrayList<>();
    try {
      Run run = new Run(source, token);
      run.seeder = open(Role.SEEDER, Seeder.class, names, factories, runOptions, opened);
      run.fetcher = open(Role.FETCHER, Fetcher.class, names, factories, runOptions, opened);
      run.generator = open(Role.GENERATOR, Generator.class, names, factories, runOptions, opened);
      for (Role role : List.of(Role.PARSER, Role.REFINER, Role.SPLITTER, Role.MAPPER)) {
        run.transformers.add(open(role, Transformer.class, names, factories, runOptions, opened));
      }
      run.builder = open(Role.BUILDER, Builder.class, names, factories, runOptions, opened);
      run.writer = open(Role.WRITER, Writer.class, names, factories, runOptions, opened);

      log.info("Pipeline run started for '{}' with strategies {}", source, describe(names));
      execute(run);
      log.info("Pipeline run finished for '{}': {}", source, run.stats.toJson());
      return run.stats;
    } finally {
      Collections.reverse(opened);
      for (ComponentSlot<?> slot : opened) slot.close();
    }
  }

  private void execute(Run run) {
    if (stopRequested(run)) return;
    runSeed(run);
    if (stopRequested(run)) return;

    List<Atom> atoms = timed(() -> runFetch(run), Role.FETCHER.stage(), run);
    if (stopRequested(run)) return;

    for (ComponentSlot<Transformer> slot : run.transformers) {
      final List<Atom> input = atoms;
      atoms = runStage(slot, input.size(), () -> slot.apply(t -> t.transform(input)), run);
      if (stopRequested(run)) return;
    }

    final List<Atom> assembled = atoms;
    Object built =
        runStage(
            run.builder, assembled.size(), () -> run.builder.apply(b -> b.build(assembled)), run);
    if (built instanceof KnowledgeGraph graph) {
      graph.freeze();
      log.debug("Assembled {}", graph);
    }
    if (stopRequested(run)) return;

    timed(() -> runStore(run, built), Role.WRITER.stage(), run);
  }

  private void runSeed(Run run) {
    String stage = Role.SEEDER.stage();
    progress.beginStage(stage, label(run.seeder), 0);
    List<String> seeds;
    try {
      Operation<List<String>> seed =
          Resilience.retry(() -> run.seeder.apply(s -> s.seed(run.source)), retryPolicy(), stage);
      seeds = Resilience.timed(seed, stage, run.timing).callUnchecked();
    } catch (RuntimeException e) {
      progress.endStageError(
          stage, ExceptionUtil.describe(e), ExceptionUtil.toErrorDetails(e).toAttributes());
      throw e;
    }
    int admitted = run.frontier.offerAll(seeds);
    run.stats.addSeeded(admitted);
    log.debug("Seeded {} identifiers ({} offered)", admitted, seeds == null ? 0 : seeds.size());
    progress.endStageOk(stage, Map.of("seeded", admitted));
  }

  /**
   * Dispatch loop. Items are handed to the pool while fewer than {@code workers} are in flight
   * and the item cap is not reached; completed items may feed the frontier with new identifiers.
   */
  private List<Atom> runFetch(Run run) {
    String stage = Role.FETCHER.stage();
    int workers = settings.workers();
    int maxItems = settings.maxItems();
    progress.beginStage(stage, label(run.fetcher), 0);

    Map<Integer, Atom> results = new ConcurrentHashMap<>();
    ExecutorService pool = Executors.newFixedThreadPool(workers, workerThreads());
    CompletionService<String> completion = new ExecutorCompletionService<>(pool);
    int inFlight = 0;
    int dispatched = 0;
    long completed = 0;
    boolean interrupted = false;
    try {
      while (true) {
        while (inFlight < workers
            && !run.token.isCancelled()
            && (maxItems == 0 || dispatched < maxItems)) {
          String identifier = run.frontier.poll();
          if (identifier == null) break;
          final int index = dispatched++;
          completion.submit(() -> processItem(run, identifier, index, results));
          inFlight++;
        }
        if (inFlight == 0) break;

        try {
          Future<String> done = completion.take();
          inFlight--;
          completed++;
          String identifier = done.get();
          progress.step(stage, completed, identifier, Map.of("pending", run.frontier.remaining()));
        } catch (InterruptedException e) {
          // stop dispatching, then wait for the items already running
          interrupted = true;
          run.token.cancel();
          log.warn("Pipeline interrupted; waiting for {} in-flight items", inFlight);
        } catch (ExecutionException e) {
          run.stats.addFailed(1);
          log.error("Fetch worker failed unexpectedly", e.getCause());
        }
      }
    } finally {
      pool.shutdownNow();
      if (interrupted) Thread.currentThread().interrupt();
    }

    int left = run.frontier.remaining();
    if (left > 0) {
      run.stats.addSkipped(left);
      log.info("{} identifiers left undispatched", left);
    }
    Map<String, Object> attrs = Map.of("dispatched", dispatched, "undispatched", left);
    if (run.token.isCancelled()) {
      progress.endStageCancelled(stage, attrs);
    } else {
      progress.endStageOk(stage, attrs);
    }
    return new ArrayList<>(new TreeMap<>(results).values());
  }

  /** Fetch one identifier and expand the frontier with what the generator finds. Never throws. */
  private String processItem(Run run, String identifier, int index, Map<Integer, Atom> results) {
    Operation<RawPayload> fetch =
        Resilience.retry(
            () -> {
              RawPayload payload = run.fetcher.apply(f -> f.fetch(identifier));
              return payload == null ? RawPayload.empty(identifier) : payload;
            },
            retryPolicy(),
            "fetch " + identifier);
    RawPayload payload =
        Resilience.<RawPayload>safeDefault(fetch, null, "fetch " + identifier).callUnchecked();
    if (payload == null) {
      run.stats.addFailed(1);
      return identifier;
    }
    if (payload.isEmpty()) {
      run.stats.addSkipped(1);
      return identifier;
    }
    run.stats.addFetched(1);
    results.put(index, toRawAtom(payload));

    Operation<List<String>> generate =
        Resilience.retry(
            () -> run.generator.apply(g -> g.generate(payload)),
            retryPolicy(),
            "generate " + identifier);
    List<String> discovered =
        Resilience.<List<String>>safeDefault(generate, null, "generate " + identifier)
            .callUnchecked();
    if (discovered == null) {
      run.stats.addFailed(1);
    } else if (!discovered.isEmpty()) {
      int admitted = run.frontier.offerAll(discovered);
      run.stats.addGenerated(admitted);
      log.trace("{} yielded {} new identifiers", identifier, admitted);
    }
    return identifier;
  }

  private Void runStore(Run run, Object built) {
    String stage = Role.WRITER.stage();
    List<Object> units = StorageUnits.split(built);
    progress.beginStage(stage, label(run.writer), units.size());
    long done = 0;
    for (Object unit : units) {
      if (stopRequested(run)) {
        progress.endStageCancelled(stage, Map.of("stored", done, "total", units.size()));
        return null;
      }
      Operation<Integer> store =
          Resilience.retry(() -> run.writer.apply(w -> w.store(unit)), retryPolicy(), stage);
      Integer written = Resilience.<Integer>safeDefault(store, null, stage).callUnchecked();
      if (written == null) {
        run.stats.addFailed(1);
      } else {
        run.stats.addWritten(written);
      }
      progress.step(stage, ++done, "unit stored", Map.of());
    }
    progress.endStageOk(stage, Map.of("written", run.stats.written()));
    return null;
  }

  /** A sequential stage: timed, not retried, failure aborts the run. */
  private <T> T runStage(ComponentSlot<?> slot, int inputSize, Operation<T> operation, Run run) {
    String stage = slot.role().stage();
    progress.beginStage(stage, label(slot), inputSize);
    try {
      T result = Resilience.timed(operation, stage, run.timing).callUnchecked();
      progress.endStageOk(stage, Map.of("in", inputSize));
      return result;
    } catch (RuntimeException e) {
      Map<String, Object> attrs = ExceptionUtil.toErrorDetails(e).toAttributes();
      attrs.put("in", inputSize);
      progress.endStageError(stage, ExceptionUtil.describe(e), attrs);
      throw e;
    }
  }

  private <T> T timed(Operation<T> operation, String stage, Run run) {
    return Resilience.timed(operation, stage, run.timing).callUnchecked();
  }

  private boolean stopRequested(Run run) {
    if (Thread.currentThread().isInterrupted()) run.token.cancel();
    if (!run.token.isCancelled()) return false;
    if (!run.stats.cancelled()) {
      run.stats.markCancelled();
      log.info("Pipeline run for '{}' cancelled", run.source);
    }
    return true;
  }

  private RetryPolicy retryPolicy() {
    return settings.retryPolicy();
  }

  private Map<Role, String> resolveNames(Map<String, String> strategies) {
    Map<Role, String> names = new EnumMap<>(Role.class);
    if (strategies != null) {
      strategies.forEach((role, name) -> names.put(Role.fromId(role), name));
    }
    for (Role role : Role.values()) {
      String name = names.get(role);
      if (name == null || name.isBlank()) names.put(role, settings.defaultStrategy(role));
    }
    return names;
  }

  private static <C extends Component<?, ?>> ComponentSlot<C> open(
      Role role,
      Class<C> type,
      Map<Role, String> names,
      Map<Role, ComponentFactory<?>> factories,
      ComponentOptions runOptions,
      List<ComponentSlot<?>> opened) {
    ComponentOptions options = runOptions.merge(runOptions.subset(role.id()));
    ComponentSlot<C> slot =
        ComponentSlot.open(role, names.get(role), factories.get(role), type, options);
    opened.add(slot);
    return slot;
  }

  private static Atom toRawAtom(RawPayload payload) {
    Map<String, Object> content = new LinkedHashMap<>();
    content.put("identifier", payload.identifier());
    content.put("media_type", payload.mediaType());
    content.put("content", payload.content());
    content.put("metadata", payload.metadata());
    return Atom.create(payload.identifier(), RAW_ATOM_TYPE, content);
  }

  private static String label(ComponentSlot<?> slot) {
    return "%s (%s)".formatted(slot.role().stage(), slot.name());
  }

  private static Map<String, String> describe(Map<Role, String> names) {
    Map<String, String> m = new LinkedHashMap<>();
    names.forEach((role, name) -> m.put(role.id(), name));
    return m;
  }

  private static ThreadFactory workerThreads() {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread t = new Thread(runnable, "fabric-fetch-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }

  /** Mutable state of one {@code process} call. */
  private static final class Run {
    final String source;
    final CancellationToken token;
    final RunStats stats = new RunStats();
    final Frontier frontier = new Frontier();
    final TimingListener timing;
    final List<ComponentSlot<Transformer>> transformers = new ArrayList<>();
    ComponentSlot<Seeder> seeder;
    ComponentSlot<Fetcher> fetcher;
    ComponentSlot<Generator> generator;
    ComponentSlot<Builder> builder;
    ComponentSlot<Writer> writer;

    Run(String source, CancellationToken token) {
      this.source = source;
      this.token = token;
      TimingListener logging = TimingListener.logging();
      this.timing =
          (label, elapsed, success) -> {
            stats.recordTiming(label, elapsed);
            logging.onTiming(label, elapsed, success);
          };
    }
  }
}
