package com.sayou.fabric.logging;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Map;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingServiceTest {
  private static final String PIPELINE = "com.sayou.fabric.pipeline";

  private LoggerContext ctx;
  private Level rootBefore;
  private Level pipelineBefore;

  @BeforeEach
  void remember() {
    ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
    rootBefore = ctx.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).getLevel();
    pipelineBefore = ctx.getLogger(PIPELINE).getLevel();
  }

  @AfterEach
  void restore() {
    ctx.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(rootBefore);
    ctx.getLogger(PIPELINE).setLevel(pipelineBefore);
  }

  @Test
  @DisplayName("levels under logging.level reach the Logback loggers")
  void appliesConfiguredLevels() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty("logging.level.root", "ERROR");
    cfg.addProperty("logging.level." + PIPELINE, "trace");
    cfg.addProperty("pipeline.workers", 4);

    Map<String, Level> applied = LoggingService.applyConfiguration(cfg);

    assertEquals(
        Map.of(org.slf4j.Logger.ROOT_LOGGER_NAME, Level.ERROR, PIPELINE, Level.TRACE), applied);
    assertEquals(Level.ERROR, ctx.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).getLevel());
    assertEquals(Level.TRACE, ctx.getLogger(PIPELINE).getLevel());
  }

  @Test
  void unknownLevelsAreSkipped() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty("logging.level." + PIPELINE, "LOUD");

    assertTrue(LoggingService.applyConfiguration(cfg).isEmpty());
    assertEquals(pipelineBefore, ctx.getLogger(PIPELINE).getLevel());
    assertTrue(LoggingService.applyConfiguration(null).isEmpty());
  }

  @Test
  void escapedYamlKeysBecomeLoggerNames() {
    assertEquals("com.sayou.fabric", LoggingService.loggerName("com..sayou..fabric"));
    assertEquals("okhttp3", LoggingService.loggerName("okhttp3"));
    assertEquals(org.slf4j.Logger.ROOT_LOGGER_NAME, LoggingService.loggerName("ROOT"));
  }
}
