package com.gentoro.intake;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.intake.exception.ConfigurationException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @TempDir Path temp;

  @Test
  void loadsBundledDefaults() {
    Configuration config = new ConfigurationProvider(null, Map.of()).config();

    assertEquals("file_queue", config.getString("broker.queue"));
    assertEquals("rabbitmq", config.getString("broker.host"));
    assertEquals(10, config.getInt("queue.capacity"));
    assertEquals("extracted", config.getString("intake.output-dir"));
  }

  @Test
  void environmentOverridesLoadedKeys() {
    Configuration config =
        new ConfigurationProvider(
                null,
                Map.of(
                    "INTAKE_BROKER_HOST", "mq.local",
                    "INTAKE_QUEUE_CAPACITY", "3",
                    "INTAKE_WORKERS_DRAIN_TIMEOUT_SECONDS", "5"))
            .config();

    assertEquals("mq.local", config.getString("broker.host"));
    assertEquals(3, config.getInt("queue.capacity"));
    assertEquals(5, config.getInt("workers.drain-timeout-seconds"));
  }

  @Test
  void rabbitmqHostAliasAppliesUnlessExplicitOverrideExists() {
    Configuration aliased =
        new ConfigurationProvider(null, Map.of("RABBITMQ_HOST", "broker-a")).config();
    assertEquals("broker-a", aliased.getString("broker.host"));

    Configuration explicit =
        new ConfigurationProvider(
                null, Map.of("RABBITMQ_HOST", "broker-a", "INTAKE_BROKER_HOST", "broker-b"))
            .config();
    assertEquals("broker-b", explicit.getString("broker.host"));
  }

  @Test
  void readsExplicitFile() throws Exception {
    Path file = temp.resolve("intake.yaml");
    Files.writeString(file, "queue:\n  capacity: 42\nintake:\n  output-dir: /srv/out\n");

    Configuration config = new ConfigurationProvider(file, Map.of()).config();

    assertEquals(42, config.getInt("queue.capacity"));
    assertEquals("/srv/out", config.getString("intake.output-dir"));
  }

  @Test
  void missingFileIsAConfigurationError() {
    assertThrows(
        ConfigurationException.class,
        () -> new ConfigurationProvider(temp.resolve("absent.yaml"), Map.of()));
  }

  @Test
  void malformedYamlIsAConfigurationError() throws Exception {
    Path file = temp.resolve("bad.yaml");
    Files.writeString(file, "broker: [unclosed\n");
    assertThrows(ConfigurationException.class, () -> new ConfigurationProvider(file, Map.of()));
  }

  @Test
  void derivesEnvironmentNames() {
    assertEquals("INTAKE_BROKER_AUTO_DELETE", ConfigurationProvider.environmentName("broker.auto-delete"));
    assertEquals(
        "INTAKE_LOGGING_LEVEL_COM_RABBITMQ",
        ConfigurationProvider.environmentName("logging.level.com..rabbitmq"));
  }
}
