package com.gentoro.intake;

import com.gentoro.intake.exception.ConfigurationException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;

/**
 * Loads the service configuration from YAML and applies environment overrides.
 *
 * <p>The configuration is read from the given file, or from the bundled classpath resource {@code
 * application.yaml} when no file is given. Every loaded key can then be overridden by an
 * environment variable named {@code INTAKE_} followed by the key upper-cased with {@code .} and
 * {@code -} replaced by {@code _} (for example {@code INTAKE_BROKER_HOST} for {@code
 * broker.host}). {@code RABBITMQ_HOST}, shared by every service of the pipeline, is honoured as
 * an alias of {@code broker.host}.
 */
public final class ConfigurationProvider {
  static final String DEFAULT_RESOURCE = "application.yaml";
  static final String ENV_PREFIX = "INTAKE_";
  static final Map<String, String> ENV_ALIASES = Map.of("RABBITMQ_HOST", "broker.host");

  private final YAMLConfiguration config;

  public ConfigurationProvider(Path configFile) {
    this(configFile, System.getenv());
  }

  ConfigurationProvider(Path configFile, Map<String, String> environment) {
    this.config = configFile == null ? loadResource(DEFAULT_RESOURCE) : loadFile(configFile);
    applyEnvironment(config, environment);
  }

  public Configuration config() {
    return config;
  }

  static String environmentName(String key) {
    return ENV_PREFIX + key.replace("..", ".").replaceAll("[.\\-]", "_").toUpperCase(Locale.ROOT);
  }

  private static void applyEnvironment(Configuration config, Map<String, String> environment) {
    ENV_ALIASES.forEach(
        (env, key) -> {
          String value = environment.get(env);
          if (value != null && !value.isBlank()) config.setProperty(key, value);
        });

    List<String> keys = new ArrayList<>();
    config.getKeys().forEachRemaining(keys::add);
    for (String key : keys) {
      String value = environment.get(environmentName(key));
      if (value != null) {
        config.setProperty(key, value);
      }
    }
  }

  private static YAMLConfiguration loadFile(Path file) {
    if (!Files.isRegularFile(file)) {
      throw new ConfigurationException("Configuration file not found: " + file);
    }
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      return read(reader);
    } catch (ConfigurationException e) {
      throw e;
    } catch (Exception e) {
      throw new ConfigurationException("Failed to read configuration file " + file, e);
    }
  }

  private static YAMLConfiguration loadResource(String resource) {
    InputStream in = ConfigurationProvider.class.getClassLoader().getResourceAsStream(resource);
    if (in == null) {
      throw new ConfigurationException("Configuration resource not found on classpath: " + resource);
    }
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      return read(reader);
    } catch (ConfigurationException e) {
      throw e;
    } catch (Exception e) {
      throw new ConfigurationException("Failed to read configuration resource " + resource, e);
    }
  }

  private static YAMLConfiguration read(Reader reader) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try {
      yaml.read(reader);
    } catch (org.apache.commons.configuration2.ex.ConfigurationException e) {
      throw new ConfigurationException("Malformed YAML configuration", e);
    }
    return yaml;
  }
}
