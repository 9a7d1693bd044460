package com.gentoro.intake.broker;

import com.gentoro.intake.exception.BrokerException;
import com.gentoro.intake.exception.QueueFullException;
import com.gentoro.intake.exception.StateException;
import com.gentoro.intake.queue.Job;
import com.gentoro.intake.queue.TaskQueue;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.ShutdownSignalException;
import java.io.IOException;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;

/**
 * Feeds the {@link TaskQueue} from a RabbitMQ queue.
 *
 * <p>Holds one connection and one channel for its whole lifetime. The queue is declared on start
 * (idempotent) and consumed with manual acknowledgement. A delivery is acknowledged as soon as
 * its job has been enqueued, not when processing completes: a crash between the two loses the
 * job. When the task queue is full the delivery is rejected, with {@code requeue} taken from
 * {@link BrokerSettings#requeueOnFull()}; by default the broker drops or dead-letters it.
 *
 * <p>{@link #run()} blocks the calling thread. Connection, channel and consumer-cancel failures end
 * it with a {@link BrokerException}; nothing is retried here, the process supervisor restarts the
 * service.
 */
public final class BrokerConsumer {
  private static final Logger log =
      com.gentoro.intake.logging.LoggingService.getLogger(BrokerConsumer.class);

  private final BrokerSettings settings;
  private final TaskQueue queue;
  private final ConnectionFactory connectionFactory;

  private final CountDownLatch terminated = new CountDownLatch(1);
  private final AtomicBoolean stopRequested = new AtomicBoolean(false);
  private final AtomicLong accepted = new AtomicLong();
  private final AtomicLong rejected = new AtomicLong();

  private volatile Connection connection;
  private volatile Channel channel;
  private volatile String consumerTag;
  private volatile String failure;
  private volatile Throwable failureCause;

  public BrokerConsumer(BrokerSettings settings, TaskQueue queue) {
    this(settings, queue, newConnectionFactory(settings));
  }

  public BrokerConsumer(
      BrokerSettings settings, TaskQueue queue, ConnectionFactory connectionFactory) {
    this.settings = settings;
    this.queue = queue;
    this.connectionFactory = connectionFactory;
  }

  static ConnectionFactory newConnectionFactory(BrokerSettings settings) {
    ConnectionFactory factory = new ConnectionFactory();
    factory.setHost(settings.host());
    factory.setPort(settings.port());
    factory.setVirtualHost(settings.virtualHost());
    factory.setUsername(settings.username());
    factory.setPassword(settings.password());
    factory.setConnectionTimeout(settings.connectionTimeoutMs());
    factory.setRequestedHeartbeat(settings.heartbeatSeconds());
    // Failures must surface to the supervisor instead of being retried in-process.
    factory.setAutomaticRecoveryEnabled(false);
    factory.setTopologyRecoveryEnabled(false);
    return factory;
  }

  /**
   * Connect, declare the queue and consume until {@link #stop()} is called.
   *
   * @throws BrokerException on any connection, authentication or channel failure
   */
  public void run() {
    if (stopRequested.get()) {
      return;
    }
    try {
      connection = connectionFactory.newConnection("archive-intake");
    } catch (IOException | TimeoutException e) {
      throw new BrokerException(
          "Failed to connect to broker at " + settings.host() + ":" + settings.port(), e);
    }

    try {
      connection.addShutdownListener(this::onShutdown);
      channel = connection.createChannel();
      if (channel == null) {
        throw new BrokerException("Broker refused to open a channel");
      }
      channel.addShutdownListener(this::onShutdown);
      channel.basicQos(settings.prefetch());
      channel.queueDeclare(
          settings.queue(), settings.durable(), false, settings.autoDelete(), null);
      consumerTag =
          channel.basicConsume(settings.queue(), false, this::handleDelivery, this::handleCancel);
      log.info("Consuming file paths from queue '{}' on {}", settings.queue(), settings.host());

      terminated.await();
    } catch (IOException e) {
      throw new BrokerException("Broker channel setup failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.info("Broker consumer interrupted");
    } finally {
      closeQuietly();
    }

    if (failure != null && !stopRequested.get()) {
      throw new BrokerException(failure, failureCause);
    }
    log.info(
        "Broker consumer stopped ({} accepted, {} rejected)", accepted.get(), rejected.get());
  }

  /** Stop consuming and release {@link #run()}. Idempotent. */
  public void stop() {
    if (!stopRequested.compareAndSet(false, true)) {
      return;
    }
    Channel current = channel;
    String tag = consumerTag;
    if (current != null && tag != null && current.isOpen()) {
      try {
        current.basicCancel(tag);
      } catch (IOException | RuntimeException e) {
        log.debug("Could not cancel consumer {}: {}", tag, e.toString());
      }
    }
    terminated.countDown();
  }

  void handleDelivery(String tag, Delivery delivery) throws IOException {
    long deliveryTag = delivery.getEnvelope().getDeliveryTag();
    Optional<String> path = MessagePayloads.filePath(delivery.getBody());
    if (path.isEmpty()) {
      log.warn("Discarding delivery {} without a usable file path", deliveryTag);
      rejected.incrementAndGet();
      channel.basicReject(deliveryTag, false);
      return;
    }

    try {
      queue.enqueue(new Job(path.get(), deliveryTag, Instant.now()));
    } catch (QueueFullException e) {
      log.error("Queue full, cannot enqueue {}", path.get());
      rejected.incrementAndGet();
      channel.basicReject(deliveryTag, settings.requeueOnFull());
      return;
    } catch (StateException e) {
      log.warn("Shutting down, returning {} to the broker", path.get());
      rejected.incrementAndGet();
      channel.basicReject(deliveryTag, true);
      return;
    }

    channel.basicAck(deliveryTag, false);
    accepted.incrementAndGet();
    log.debug("Enqueued {} (delivery {})", path.get(), deliveryTag);
  }

  void handleCancel(String tag) {
    if (stopRequested.get()) {
      return;
    }
    fail("Consumer " + tag + " was cancelled by the broker", null);
  }

  private void onShutdown(ShutdownSignalException cause) {
    if (cause.isInitiatedByApplication() && stopRequested.get()) {
      return;
    }
    fail("Broker connection lost: " + cause.getMessage(), cause);
  }

  private void fail(String message, Throwable cause) {
    if (failure == null) {
      failureCause = cause;
      failure = message;
      log.error(message);
    }
    terminated.countDown();
  }

  private void closeQuietly() {
    Channel ch = channel;
    if (ch != null && ch.isOpen()) {
      try {
        ch.close();
      } catch (IOException | TimeoutException | RuntimeException e) {
        log.debug("Error closing broker channel: {}", e.toString());
      }
    }
    Connection conn = connection;
    if (conn != null && conn.isOpen()) {
      try {
        conn.close();
      } catch (IOException | RuntimeException e) {
        log.debug("Error closing broker connection: {}", e.toString());
      }
    }
  }

  public long acceptedCount() {
    return accepted.get();
  }

  public long rejectedCount() {
    return rejected.get();
  }
}
