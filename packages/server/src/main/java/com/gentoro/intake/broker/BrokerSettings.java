package com.gentoro.intake.broker;

import com.gentoro.intake.exception.ConfigurationException;
import org.apache.commons.configuration2.Configuration;

/** Connection and queue settings for the RabbitMQ consumer, read from the {@code broker.*} keys. */
public record BrokerSettings(
    String host,
    int port,
    String virtualHost,
    String username,
    String password,
    String queue,
    boolean durable,
    boolean autoDelete,
    int prefetch,
    boolean requeueOnFull,
    int connectionTimeoutMs,
    int heartbeatSeconds) {

  public static BrokerSettings from(Configuration c) {
    BrokerSettings settings =
        new BrokerSettings(
            c.getString("broker.host", "rabbitmq"),
            c.getInt("broker.port", 5672),
            c.getString("broker.virtual-host", "/"),
            c.getString("broker.username", "guest"),
            c.getString("broker.password", "guest"),
            c.getString("broker.queue", "file_queue"),
            c.getBoolean("broker.durable", false),
            c.getBoolean("broker.auto-delete", true),
            c.getInt("broker.prefetch", 10),
            c.getBoolean("broker.requeue-on-full", false),
            c.getInt("broker.connection-timeout-ms", 30_000),
            c.getInt("broker.heartbeat-seconds", 60));
    if (settings.host() == null || settings.host().isBlank()) {
      throw new ConfigurationException("broker.host must not be blank");
    }
    if (settings.queue() == null || settings.queue().isBlank()) {
      throw new ConfigurationException("broker.queue must not be blank");
    }
    if (settings.prefetch() < 0) {
      throw new ConfigurationException("broker.prefetch must be >= 0");
    }
    return settings;
  }

  @Override
  public String toString() {
    return "BrokerSettings[" + username + "@" + host + ":" + port + virtualHost + " queue=" + queue
        + "]";
  }
}
