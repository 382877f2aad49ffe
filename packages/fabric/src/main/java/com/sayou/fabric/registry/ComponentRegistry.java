package com.sayou.fabric.registry;

import com.sayou.fabric.component.Component;
import com.sayou.fabric.exception.ConfigException;
import com.sayou.fabric.exception.UnresolvedComponentException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Mapping from (role, name) to a {@link ComponentFactory}.
 *
 * <p>Concurrency contract: the per-role tables are created once in the constructor and never
 * replaced; each table is a {@link ConcurrentHashMap}, so {@link #register} may run concurrently
 * with {@link #resolve} and a lookup observes either the previous or the new factory, never a
 * partially written entry. Registration is last-writer-wins.
 *
 * <p>One registry is built per process (see {@code Fabric}) and passed by reference to the
 * orchestrator; tests construct isolated instances.
 */
public final class ComponentRegistry {
  private static final org.slf4j.Logger log =
      com.sayou.fabric.logging.LoggingService.getLogger(ComponentRegistry.class);

  private final Map<Role, ConcurrentMap<String, ComponentFactory<?>>> factories =
      new EnumMap<>(Role.class);

  public ComponentRegistry() {
    for (Role role : Role.values()) {
      factories.put(role, new ConcurrentHashMap<>());
    }
  }

  /** Registry populated by every {@link ComponentProvider} visible to {@link ServiceLoader}. */
  public static ComponentRegistry withProviders() {
    ComponentRegistry registry = new ComponentRegistry();
    for (ComponentProvider provider : ServiceLoader.load(ComponentProvider.class)) {
      registry.registerAll(provider);
    }
    return registry;
  }

  public ComponentRegistry registerAll(ComponentProvider provider) {
    Objects.requireNonNull(provider, "provider");
    log.debug("Registering components from provider '{}'", provider.id());
    provider.register(this);
    return this;
  }

  public ComponentRegistry register(Role role, String name, ComponentFactory<?> factory) {
    Objects.requireNonNull(role, "role");
    Objects.requireNonNull(factory, "factory");
    String key = normalize(name);
    ComponentFactory<?> previous = factories.get(role).put(key, factory);
    if (previous != null && previous != factory) {
      log.debug("Component '{}' for role '{}' was overridden", key, role.id());
    } else {
      log.trace("Registered component '{}' for role '{}'", key, role.id());
    }
    return this;
  }

  /**
   * String keyed registration.
   *
   * @throws com.sayou.fabric.exception.UnknownRoleException when {@code role} is not declared
   */
  public ComponentRegistry register(String role, String name, ComponentFactory<?> factory) {
    return register(Role.fromId(role), name, factory);
  }

  /**
   * @throws UnresolvedComponentException when nothing is registered under (role, name)
   */
  public ComponentFactory<?> resolve(Role role, String name) {
    Objects.requireNonNull(role, "role");
    ComponentFactory<?> factory =
        name == null || name.isBlank() ? null : factories.get(role).get(normalize(name));
    if (factory == null) {
      throw new UnresolvedComponentException(role.id(), name, names(role));
    }
    return factory;
  }

  public ComponentFactory<?> resolve(String role, String name) {
    return resolve(Role.fromId(role), name);
  }

  /**
   * Resolve and instantiate a component, checking that it implements the capability of the role.
   */
  public <C> C create(Role role, String name, Class<C> type) {
    return instantiate(role, name, resolve(role, name), type);
  }

  /**
   * Instantiate through an already resolved factory.
   *
   * @throws ConfigException when the factory returns nothing or an instance of the wrong
   *     capability
   */
  public static <C> C instantiate(
      Role role, String name, ComponentFactory<?> factory, Class<C> type) {
    Component<?, ?> component = factory.create();
    if (component == null) {
      throw new ConfigException(
          "Factory for %s '%s' returned no instance".formatted(role.id(), name));
    }
    if (!role.capability().isInstance(component) || !type.isInstance(component)) {
      throw new ConfigException(
          "Factory for %s '%s' produced %s, which is not a %s"
              .formatted(
                  role.id(),
                  name,
                  component.getClass().getName(),
                  role.capability().getSimpleName()));
    }
    return type.cast(component);
  }

  public boolean isRegistered(Role role, String name) {
    return name != null && !name.isBlank() && factories.get(role).containsKey(normalize(name));
  }

  /** Sorted snapshot of the names registered for a role. */
  public Set<String> names(Role role) {
    return Collections.unmodifiableSet(new TreeSet<>(factories.get(role).keySet()));
  }

  private static String normalize(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Component name must not be blank");
    }
    return name.trim().toLowerCase(Locale.ROOT);
  }
}
