package com.sayou.fabric.registry;

/**
 * Service Provider Interface (SPI) for plugging component packs into a {@link ComponentRegistry}.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} by {@link
 * ComponentRegistry#withProviders()}. To register a provider, add its fully qualified class name
 * to the service resource {@code META-INF/services/com.sayou.fabric.registry.ComponentProvider}.
 * Providers are applied in discovery order and registration is last-writer-wins, so a plugin jar
 * can override a built-in adapter by registering the same (role, name).
 */
public interface ComponentProvider {

  /** A stable, lowercase identifier for this provider (e.g. "builtin"). */
  String id();

  /** Register this provider's factories. Must not perform I/O. */
  void register(ComponentRegistry registry);
}
