package com.sayou.fabric.exception;

import com.sayou.fabric.registry.Role;
import java.util.Map;
import java.util.Objects;

/**
 * Failure of a component operation, tagged with the role the component plays.
 *
 * <p>Each role has its own subtype ({@link FetcherException}, {@link WriterException}, ...);
 * use {@link Role#error(String, Throwable, boolean)} to build the right one. Errors raised
 * by request validation are not retryable; errors raised by an adapter hook are.
 */
public abstract class ComponentException extends FabricException {
  private final Role role;

  protected ComponentException(
      Role role, FabricErrorCode code, String message, Throwable cause, boolean retryable) {
    super(code, message, Map.of("role", role.id()), cause, retryable);
    this.role = Objects.requireNonNull(role, "role");
  }

  public Role getRole() {
    return role;
  }
}
