package com.sayou.fabric.pipeline;

import com.sayou.fabric.component.Component;
import com.sayou.fabric.component.ComponentOptions;
import com.sayou.fabric.component.ComponentState;
import com.sayou.fabric.exception.NotInitializedException;
import com.sayou.fabric.registry.ComponentFactory;
import com.sayou.fabric.registry.ComponentRegistry;
import com.sayou.fabric.registry.Role;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Holds the live instance of one role for the duration of a run.
 *
 * <p>A component that failed is never called again: the next {@link #apply} retires it and
 * builds a fresh instance through the factory resolved at the start of the run. The slot counts
 * the callers inside each instance; a retired instance is closed as soon as its last caller
 * leaves, so at most one retired instance per concurrent caller is open at any time.
 */
final class ComponentSlot<C extends Component<?, ?>> implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.sayou.fabric.logging.LoggingService.getLogger(ComponentSlot.class);

  private static final int MAX_STALE_CALLS = 3;

  private final Role role;
  private final String name;
  private final ComponentFactory<?> factory;
  private final Class<C> type;
  private final ComponentOptions options;
  /** Callers currently inside an instance, live or retired. Guarded by {@code this}. */
  private final Map<C, Integer> callers = new IdentityHashMap<>();
  /** Retired instances still waiting for their callers to leave. Guarded by {@code this}. */
  private final Map<C, Boolean> retired = new IdentityHashMap<>();
  private C current;

  private ComponentSlot(
      Role role,
      String name,
      ComponentFactory<?> factory,
      Class<C> type,
      ComponentOptions options) {
    this.role = role;
    this.name = name;
    this.factory = factory;
    this.type = type;
    this.options = options;
  }

  /** Create and initialize the first instance. */
  static <C extends Component<?, ?>> ComponentSlot<C> open(
      Role role,
      String name,
      ComponentFactory<?> factory,
      Class<C> type,
      ComponentOptions options) {
    ComponentSlot<C> slot = new ComponentSlot<>(role, name, factory, type, options);
    slot.current = slot.newInstance();
    return slot;
  }

  private synchronized C acquire() {
    if (current.state() == ComponentState.FAILED) {
      C replacement = newInstance();
      log.info("Replaced failed {} '{}' with a fresh instance", role.id(), name);
      retire(current);
      current = replacement;
    }
    callers.merge(current, 1, Integer::sum);
    return current;
  }

  private synchronized void release(C instance) {
    Integer left = callers.merge(instance, -1, Integer::sum);
    if (left != null && left > 0) return;
    callers.remove(instance);
    if (retired.remove(instance) != null) {
      log.debug("Closing retired {} '{}' after its last caller left", role.id(), name);
      instance.close();
    }
  }

  private void retire(C instance) {
    if (callers.containsKey(instance)) {
      retired.put(instance, Boolean.TRUE);
    } else {
      instance.close();
    }
  }

  /**
   * Apply {@code call} to the live instance. A call that lost the race against another worker
   * failing the same instance is repeated on the replacement.
   */
  <R> R apply(Function<C, R> call) {
    for (int i = 1; ; i++) {
      C instance = acquire();
      try {
        return call.apply(instance);
      } catch (NotInitializedException e) {
        if (instance.state() != ComponentState.FAILED || i >= MAX_STALE_CALLS) throw e;
        log.trace("{} '{}' failed under a concurrent call; using replacement", role.id(), name);
      } finally {
        release(instance);
      }
    }
  }

  /** Instances built by this slot and not closed yet: the live one plus retired ones in use. */
  synchronized int openInstances() {
    return retired.size() + (current == null ? 0 : 1);
  }

  Role role() {
    return role;
  }

  String name() {
    return name;
  }

  private C newInstance() {
    C instance = ComponentRegistry.instantiate(role, name, factory, type);
    try {
      instance.initialize(options);
    } catch (RuntimeException e) {
      instance.close();
      throw e;
    }
    return instance;
  }

  @Override
  public synchronized void close() {
    for (C c : retired.keySet()) c.close();
    retired.clear();
    callers.clear();
    if (current != null) current.close();
  }
}
