package com.sayou.fabric.component;

import com.sayou.fabric.registry.Role;

/**
 * Contract shared by every pipeline component.
 *
 * <p>Instances are created by a registry factory, configured once through {@link #initialize}
 * and then invoked through {@link #execute}. Capability interfaces ({@link Fetcher}, {@link
 * Writer}, ...) bind the request and response types and add a role specific alias for {@code
 * execute}.
 *
 * @param <Q> request type
 * @param <R> response type
 */
public interface Component<Q, R> extends AutoCloseable {

  /** Strategy name the instance was registered under. */
  String name();

  Role role();

  ComponentState state();

  /**
   * Configure the component. Succeeds at most once; repeated calls on a ready instance are
   * no-ops.
   *
   * @throws com.sayou.fabric.exception.InitializationException when the options are invalid or
   *     a resource cannot be acquired
   * @throws com.sayou.fabric.exception.StateException when the instance has already failed
   */
  void initialize(ComponentOptions options);

  /**
   * Run the component on a single request.
   *
   * @throws com.sayou.fabric.exception.NotInitializedException unless the instance is ready
   * @throws com.sayou.fabric.exception.ComponentException on validation or execution failure
   */
  R execute(Q request);

  /** Release resources. Never throws. */
  @Override
  default void close() {}
}
