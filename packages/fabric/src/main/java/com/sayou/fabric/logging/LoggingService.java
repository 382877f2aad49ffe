package com.sayou.fabric.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logger factory for the fabric and the bridge from the {@code logging.level} block of the
 * fabric configuration to Logback.
 *
 * <pre>
 * logging:
 *   level:
 *     root: INFO
 *     com.sayou.fabric.pipeline: DEBUG
 *     okhttp3: WARN
 * </pre>
 *
 * Levels not named here keep what {@code logback.xml} configured.
 */
public final class LoggingService {
  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);

  public static final String LEVEL_PREFIX = "logging.level";
  public static final String ROOT = "root";

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  /**
   * Apply the configured levels.
   *
   * @return logger name to level for every entry that was applied, in configuration order; unknown
   *     level names are skipped with a warning
   */
  public static Map<String, Level> applyConfiguration(Configuration cfg) {
    Map<String, Level> applied = new LinkedHashMap<>();
    if (cfg == null) return applied;
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext ctx)) {
      log.warn("SLF4J is not bound to Logback; '{}' settings are ignored", LEVEL_PREFIX);
      return applied;
    }
    Configuration levels = cfg.subset(LEVEL_PREFIX);
    Iterator<String> keys = levels.getKeys();
    while (keys.hasNext()) {
      String key = keys.next();
      String value = levels.getString(key, null);
      if (value == null || value.isBlank()) continue;
      Level level = Level.toLevel(value.trim(), null);
      String name = loggerName(key);
      if (level == null) {
        log.warn("Unknown log level '{}' for logger '{}'; ignoring", value, name);
        continue;
      }
      ctx.getLogger(name).setLevel(level);
      applied.put(name, level);
    }
    if (!applied.isEmpty()) log.debug("Applied log levels {}", applied);
    return applied;
  }

  /** Hierarchical YAML keys escape the dots of a package name by doubling them. */
  static String loggerName(String key) {
    String name = key.replace("..", ".");
    return ROOT.equalsIgnoreCase(name) ? Logger.ROOT_LOGGER_NAME : name;
  }
}
