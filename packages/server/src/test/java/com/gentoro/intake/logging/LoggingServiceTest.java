package com.gentoro.intake.logging;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.core.Appender;
import ch.qos.logback.classic.spi.ILoggingEvent;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class LoggingServiceTest {

  @TempDir Path temp;

  private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

  @AfterEach
  void tearDown() {
    ch.qos.logback.classic.Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
    Appender<ILoggingEvent> file = root.getAppender("FILE");
    if (file != null) {
      root.detachAppender(file);
      file.stop();
    }
    root.setLevel(Level.WARN);
  }

  @Test
  void appliesLevelsFromFlatKeys() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty("logging.level.org.example.flat", "DEBUG");

    LoggingService.applyConfiguration(config);

    assertEquals(Level.DEBUG, context.getLogger("org.example.flat").getLevel());
  }

  @Test
  void appliesLevelsFromYamlWithDottedLoggerNames() throws Exception {
    YAMLConfiguration yaml = new YAMLConfiguration();
    yaml.read(
        new StringReader("logging:\n  level:\n    root: ERROR\n    org.example.yaml: TRACE\n"));

    LoggingService.applyConfiguration(yaml);

    assertEquals(Level.TRACE, context.getLogger("org.example.yaml").getLevel());
    assertEquals(Level.ERROR, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
  }

  @Test
  void enablesRollingFileAppender() {
    Path logs = temp.resolve("logs");
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty("logging.file.dir", logs.toString());

    LoggingService.applyConfiguration(config);
    LoggingService.getLogger(LoggingServiceTest.class).warn("written to file");

    assertNotNull(context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender("FILE"));
    assertTrue(Files.exists(logs.resolve("archive-intake.log")));
  }
}
