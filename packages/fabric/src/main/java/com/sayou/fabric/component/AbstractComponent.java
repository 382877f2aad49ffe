package com.sayou.fabric.component;

import com.sayou.fabric.exception.ComponentException;
import com.sayou.fabric.exception.ExceptionUtil;
import com.sayou.fabric.exception.FabricException;
import com.sayou.fabric.exception.InitializationException;
import com.sayou.fabric.exception.NotInitializedException;
import com.sayou.fabric.exception.StateException;
import com.sayou.fabric.logging.ComponentLogContext;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Base {@link Component} implementing the lifecycle and the execution template once.
 *
 * <p>Subclasses implement {@link #onInitialize(ComponentOptions)} to parse their options and
 * acquire resources, and {@link #doExecute(Object)} to do the actual work. This class wraps them
 * with:
 *
 * <ul>
 *   <li>a state guard: {@code execute} runs only in {@link ComponentState#READY};
 *   <li>request validation through {@link #validate(Object)}, whose failures are reported as the
 *       role error, flagged non-retryable, without touching the state;
 *   <li>error translation: anything thrown by {@code doExecute} becomes the role error and moves
 *       the instance to {@link ComponentState#FAILED};
 *   <li>an MDC scope carrying role and component name, plus debug/trace timing lines.
 * </ul>
 *
 * <p>Role bases such as {@link AbstractFetcher} fix the role and the request/response types, so
 * adapters normally extend those rather than this class.
 */
public abstract class AbstractComponent<Q, R> implements Component<Q, R> {
  private static final org.slf4j.Logger log =
      com.sayou.fabric.logging.LoggingService.getLogger(AbstractComponent.class);

  private final String name;
  private final AtomicReference<ComponentState> state =
      new AtomicReference<>(ComponentState.UNINITIALIZED);

  protected AbstractComponent(String name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public ComponentState state() {
    return state.get();
  }

  @Override
  public final synchronized void initialize(ComponentOptions options) {
    ComponentState current = state.get();
    if (current == ComponentState.READY) {
      log.trace("{} '{}' already initialized", role().id(), name);
      return;
    }
    if (current == ComponentState.FAILED) {
      throw new StateException(
          "%s '%s' has failed and cannot be initialized again".formatted(role().id(), name));
    }
    try (ComponentLogContext ignored = new ComponentLogContext(role(), name)) {
      onInitialize(options == null ? ComponentOptions.empty() : options);
      state.set(ComponentState.READY);
      log.debug("{} '{}' initialized", role().id(), name);
    } catch (Exception e) {
      state.set(ComponentState.FAILED);
      log.warn("{} '{}' failed to initialize: {}", role().id(), name, ExceptionUtil.describe(e));
      if (e instanceof InitializationException ie) throw ie;
      throw new InitializationException(
          "Failed to initialize %s '%s'".formatted(role().id(), name),
          Map.of("role", role().id(), "component", name),
          e);
    }
  }

  @Override
  public final R execute(Q request) {
    ComponentState current = state.get();
    if (current != ComponentState.READY) {
      throw new NotInitializedException(name, current.name());
    }
    try (ComponentLogContext ignored = new ComponentLogContext(role(), name)) {
      try {
        validate(request);
      } catch (Exception e) {
        log.debug("{} '{}' rejected request: {}", role().id(), name, ExceptionUtil.describe(e));
        throw role()
            .error(
                "Invalid request for %s '%s': %s"
                    .formatted(role().id(), name, ExceptionUtil.describe(e)),
                e,
                false);
      }

      long start = System.currentTimeMillis();
      log.trace("{} '{}' executing with request [{}]", role().id(), name, request);
      try {
        R result = doExecute(request);
        log.debug(
            "{} '{}' completed in {} ms", role().id(), name, System.currentTimeMillis() - start);
        return result;
      } catch (Exception e) {
        state.set(ComponentState.FAILED);
        log.debug(
            "{} '{}' failed after {} ms: {}",
            role().id(),
            name,
            System.currentTimeMillis() - start,
            ExceptionUtil.formatCompactStackTrace(e, 5));
        throw translate(e);
      }
    }
  }

  /**
   * Role error for a hook failure. An error of this role is passed through as is; any other
   * error is wrapped, keeping its retryable flag when it carries one.
   */
  private ComponentException translate(Exception e) {
    if (e instanceof ComponentException ce && ce.getRole() == role()) {
      return ce;
    }
    boolean retryable = !(e instanceof FabricException fe) || fe.isRetryable();
    return role()
        .error(
            "%s '%s' failed: %s".formatted(role().id(), name, ExceptionUtil.describe(e)),
            e,
            retryable);
  }

  @Override
  public final void close() {
    try (ComponentLogContext ignored = new ComponentLogContext(role(), name)) {
      onClose();
    } catch (Exception e) {
      log.warn("{} '{}' failed to release resources", role().id(), name, e);
    }
  }

  /** Parse options and acquire resources. Throwing moves the component to {@code FAILED}. */
  protected void onInitialize(ComponentOptions options) throws Exception {}

  /**
   * Reject malformed requests. Throwing here does not change the component state.
   *
   * @throws IllegalArgumentException by default for a {@code null} request
   */
  protected void validate(Q request) {
    if (request == null) {
      throw new IllegalArgumentException("request must not be null");
    }
  }

  protected abstract R doExecute(Q request) throws Exception;

  protected void onClose() throws Exception {}

  @Override
  public String toString() {
    return "%s{role=%s, name=%s, state=%s}"
        .formatted(getClass().getSimpleName(), role().id(), name, state.get());
  }
}
