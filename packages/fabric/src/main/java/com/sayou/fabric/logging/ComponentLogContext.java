package com.sayou.fabric.logging;

import com.sayou.fabric.registry.Role;
import org.slf4j.MDC;

/**
 * MDC scope that tags every log line emitted while a component runs with its role and name.
 * Restores the enclosing values on close, so scopes nest.
 */
public final class ComponentLogContext implements AutoCloseable {
  public static final String MDC_ROLE = "fabric.role";
  public static final String MDC_COMPONENT = "fabric.component";

  private final String previousRole;
  private final String previousComponent;

  public ComponentLogContext(Role role, String component) {
    this.previousRole = MDC.get(MDC_ROLE);
    this.previousComponent = MDC.get(MDC_COMPONENT);
    if (role != null) MDC.put(MDC_ROLE, role.id());
    if (component != null) MDC.put(MDC_COMPONENT, component);
  }

  @Override
  public void close() {
    restore(MDC_ROLE, previousRole);
    restore(MDC_COMPONENT, previousComponent);
  }

  private static void restore(String key, String value) {
    if (value == null) {
      MDC.remove(key);
    } else {
      MDC.put(key, value);
    }
  }
}
