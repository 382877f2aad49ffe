package com.sayou.fabric.component;

import com.sayou.fabric.exception.InitializationException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.commons.configuration2.Configuration;

/**
 * Immutable option bag handed to {@link Component#initialize}.
 *
 * <p>Values come either from per-run maps or from the {@code pipeline.options} configuration
 * subtree. Typed getters convert leniently (a number stored as text is accepted); a value that
 * cannot be converted raises {@link InitializationException}.
 */
public final class ComponentOptions {
  private static final ComponentOptions EMPTY = new ComponentOptions(Map.of());

  private final Map<String, Object> values;

  private ComponentOptions(Map<String, ?> values) {
    Map<String, Object> m = new LinkedHashMap<>();
    values.forEach(
        (k, v) -> {
          if (k != null && v != null) m.put(k, v);
        });
    this.values = Collections.unmodifiableMap(m);
  }

  public static ComponentOptions empty() {
    return EMPTY;
  }

  public static ComponentOptions of(Map<String, ?> values) {
    return values == null || values.isEmpty() ? EMPTY : new ComponentOptions(values);
  }

  /** Flattened view of a configuration subtree; keys keep their dotted form. */
  public static ComponentOptions fromConfiguration(Configuration configuration) {
    if (configuration == null || configuration.isEmpty()) return EMPTY;
    Map<String, Object> m = new LinkedHashMap<>();
    Iterator<String> keys = configuration.getKeys();
    while (keys.hasNext()) {
      String key = keys.next();
      Object value = configuration.getProperty(key);
      // strings go through the interpolator so ${env:...} references resolve
      m.put(key, value instanceof String ? configuration.getString(key) : value);
    }
    return new ComponentOptions(m);
  }

  /** Copy with the entries of {@code overrides} replacing those of this instance. */
  public ComponentOptions merge(ComponentOptions overrides) {
    if (overrides == null || overrides.values.isEmpty()) return this;
    if (values.isEmpty()) return overrides;
    Map<String, Object> m = new LinkedHashMap<>(values);
    m.putAll(overrides.values);
    return new ComponentOptions(m);
  }

  public ComponentOptions with(String key, Object value) {
    Map<String, Object> m = new LinkedHashMap<>(values);
    if (value == null) {
      m.remove(key);
    } else {
      m.put(key, value);
    }
    return new ComponentOptions(m);
  }

  public boolean contains(String key) {
    return values.containsKey(key);
  }

  public Optional<Object> get(String key) {
    return Optional.ofNullable(values.get(key));
  }

  public String getString(String key, String defaultValue) {
    Object v = values.get(key);
    if (v == null) return defaultValue;
    if (v instanceof Collection<?> c) {
      return c.isEmpty() ? defaultValue : String.valueOf(c.iterator().next());
    }
    return v.toString();
  }

  public String getString(String key) {
    return getString(key, null);
  }

  /**
   * @throws InitializationException when the key is absent or blank
   */
  public String requireString(String component, String key) {
    String v = getString(key);
    if (v == null || v.isBlank()) throw InitializationException.missingOption(component, key);
    return v;
  }

  public int getInt(String key, int defaultValue) {
    Object v = values.get(key);
    if (v == null) return defaultValue;
    if (v instanceof Number n) {
      try {
        return n instanceof BigInteger big ? big.intValueExact() : Math.toIntExact(n.longValue());
      } catch (ArithmeticException e) {
        throw invalid(key, v, "an integer", e);
      }
    }
    try {
      return Integer.parseInt(v.toString().trim());
    } catch (NumberFormatException e) {
      throw invalid(key, v, "an integer", e);
    }
  }

  public long getLong(String key, long defaultValue) {
    Object v = values.get(key);
    if (v == null) return defaultValue;
    if (v instanceof Number n) return n.longValue();
    try {
      return Long.parseLong(v.toString().trim());
    } catch (NumberFormatException e) {
      throw invalid(key, v, "a long", e);
    }
  }

  public double getDouble(String key, double defaultValue) {
    Object v = values.get(key);
    if (v == null) return defaultValue;
    if (v instanceof Number n) return n.doubleValue();
    try {
      return Double.parseDouble(v.toString().trim());
    } catch (NumberFormatException e) {
      throw invalid(key, v, "a number", e);
    }
  }

  public boolean getBoolean(String key, boolean defaultValue) {
    Object v = values.get(key);
    if (v == null) return defaultValue;
    if (v instanceof Boolean b) return b;
    String s = v.toString().trim().toLowerCase(java.util.Locale.ROOT);
    return switch (s) {
      case "true", "yes", "on", "1" -> true;
      case "false", "no", "off", "0" -> false;
      default -> throw invalid(key, v, "a boolean", null);
    };
  }

  /** A list value, or a comma separated string split into trimmed, non-blank items. */
  public List<String> getStringList(String key) {
    Object v = values.get(key);
    if (v == null) return List.of();
    List<String> out = new ArrayList<>();
    if (v instanceof Collection<?> c) {
      for (Object item : c) {
        if (item != null && !item.toString().isBlank()) out.add(item.toString().trim());
      }
    } else {
      Arrays.stream(v.toString().split(","))
          .map(String::trim)
          .filter(s -> !s.isEmpty())
          .forEach(out::add);
    }
    return Collections.unmodifiableList(out);
  }

  /**
   * A map value, either stored as a map under {@code key} or spread over dotted keys {@code
   * key.*} (the shape a YAML configuration produces).
   */
  public Map<String, String> getStringMap(String key) {
    Map<String, String> out = new LinkedHashMap<>();
    Object v = values.get(key);
    if (v instanceof Map<?, ?> m) {
      m.forEach(
          (k, val) -> {
            if (k != null && val != null) out.put(k.toString(), val.toString());
          });
    }
    subset(key).values.forEach((k, val) -> out.put(k, val.toString()));
    return Collections.unmodifiableMap(out);
  }

  /** Entries under {@code prefix.}, with the prefix removed. */
  public ComponentOptions subset(String prefix) {
    String p = prefix.endsWith(".") ? prefix : prefix + ".";
    Map<String, Object> m = new LinkedHashMap<>();
    values.forEach(
        (k, v) -> {
          if (k.startsWith(p) && k.length() > p.length()) m.put(k.substring(p.length()), v);
        });
    return of(m);
  }

  public Map<String, Object> asMap() {
    return values;
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  private static InitializationException invalid(
      String key, Object value, String expected, Throwable cause) {
    return new InitializationException(
        "Option '%s' must be %s but was '%s'".formatted(key, expected, value),
        Map.of("option", key),
        cause);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ComponentOptions other && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "ComponentOptions" + values;
  }
}
