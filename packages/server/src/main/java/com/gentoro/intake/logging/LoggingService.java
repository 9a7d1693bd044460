package com.gentoro.intake.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.TimeBasedRollingPolicy;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.logging.LogManager;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Central access point for loggers and runtime logging configuration.
 *
 * <p>Recognized configuration keys:
 *
 * <ul>
 *   <li>{@code logging.level.<logger>}: Logback level for a logger, e.g. {@code
 *       logging.level.root: INFO} or {@code logging.level.com.gentoro.intake.archive: DEBUG}
 *   <li>{@code logging.file.dir}: when set, a daily rolling file appender is added writing to
 *       {@code <dir>/archive-intake.log}
 * </ul>
 */
public final class LoggingService {
  static final String LEVEL_PREFIX = "logging.level";
  static final String FILE_DIR_KEY = "logging.file.dir";
  static final String PATTERN =
      "%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /** Apply logging levels and the optional file appender from configuration. */
  public static void applyConfiguration(Configuration configuration) {
    // Third-party libraries that log through JUL are not routed anywhere.
    LogManager.getLogManager().reset();
    java.util.logging.Logger.getLogger("").setLevel(java.util.logging.Level.OFF);

    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      return;
    }

    Iterator<String> keys = configuration.getKeys(LEVEL_PREFIX);
    while (keys.hasNext()) {
      String key = keys.next();
      // Dots inside a YAML key are escaped as ".." by the default expression engine.
      String loggerName = key.substring(LEVEL_PREFIX.length()).replace("..", ".");
      if (loggerName.startsWith(".")) loggerName = loggerName.substring(1);
      if (loggerName.isEmpty() || "root".equalsIgnoreCase(loggerName)) {
        loggerName = Logger.ROOT_LOGGER_NAME;
      }
      String value = configuration.getString(key);
      context.getLogger(loggerName).setLevel(Level.toLevel(value, Level.INFO));
    }

    String fileDir = configuration.getString(FILE_DIR_KEY, null);
    if (fileDir != null && !fileDir.isBlank()) {
      enableFileLogging(context, Path.of(fileDir));
    }
  }

  private static void enableFileLogging(LoggerContext context, Path logsDir) {
    Logger log = getLogger(LoggingService.class);
    try {
      Files.createDirectories(logsDir);
    } catch (Exception e) {
      log.warn("Could not create log directory {}, file logging disabled: {}", logsDir, e.toString());
      return;
    }

    ch.qos.logback.classic.Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
    if (root.getAppender("FILE") != null) {
      return;
    }

    File dir = logsDir.toFile();
    RollingFileAppender<ILoggingEvent> fileAppender = new RollingFileAppender<>();
    fileAppender.setContext(context);
    fileAppender.setName("FILE");
    fileAppender.setFile(new File(dir, "archive-intake.log").getPath());

    TimeBasedRollingPolicy<ILoggingEvent> rollingPolicy = new TimeBasedRollingPolicy<>();
    rollingPolicy.setContext(context);
    rollingPolicy.setParent(fileAppender);
    rollingPolicy.setFileNamePattern(new File(dir, "archive-intake.%d{yyyy-MM-dd}.log.gz").getPath());
    rollingPolicy.setMaxHistory(7);
    rollingPolicy.start();

    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern(PATTERN);
    encoder.start();

    fileAppender.setEncoder(encoder);
    fileAppender.setRollingPolicy(rollingPolicy);
    fileAppender.start();

    root.addAppender(fileAppender);
    log.info("File logging enabled at {}", new File(dir, "archive-intake.log").getPath());
  }
}
